package com.gentoro.flowbridge.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * A node (n8n) or module (Make) in platform-neutral form.
 *
 * <p>{@code parameters} holds n8n {@code parameters} or the Make {@code mapper} merged with the
 * non-connection entries of the Make {@code parameters}. Credentials are kept apart as a
 * name-to-value object. {@code routeConditions} is only used by routers and switches: entry
 * {@code i} is the condition guarding output port {@code i}, as {@code {operator, left, right}}.
 */
public class WorkflowNode {
  private final String id;
  private final String name;
  private final String type;
  private final JsonNode typeVersion;
  private final Position position;
  private final ObjectNode parameters;
  private final ObjectNode credentials;
  private final boolean disabled;
  private final List<JsonNode> routeConditions;

  private WorkflowNode(Builder b) {
    this.id = b.id;
    this.name = b.name;
    this.type = b.type;
    this.typeVersion = b.typeVersion;
    this.position = b.position;
    this.parameters = b.parameters != null ? b.parameters : JsonNodeFactory.instance.objectNode();
    this.credentials =
        b.credentials != null ? b.credentials : JsonNodeFactory.instance.objectNode();
    this.disabled = b.disabled;
    this.routeConditions = List.copyOf(b.routeConditions);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .name(name)
        .type(type)
        .typeVersion(typeVersion)
        .position(position)
        .parameters(parameters)
        .credentials(credentials)
        .disabled(disabled)
        .routeConditions(routeConditions);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getType() {
    return type;
  }

  public JsonNode getTypeVersion() {
    return typeVersion;
  }

  public Position getPosition() {
    return position;
  }

  public ObjectNode getParameters() {
    return parameters;
  }

  public ObjectNode getCredentials() {
    return credentials;
  }

  public boolean isDisabled() {
    return disabled;
  }

  public List<JsonNode> getRouteConditions() {
    return routeConditions;
  }

  @Override
  public String toString() {
    return "WorkflowNode{id='" + id + "', name='" + name + "', type='" + type + "'}";
  }

  public static final class Builder {
    private String id;
    private String name;
    private String type;
    private JsonNode typeVersion;
    private Position position;
    private ObjectNode parameters;
    private ObjectNode credentials;
    private boolean disabled;
    private List<JsonNode> routeConditions = new ArrayList<>();

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder typeVersion(JsonNode typeVersion) {
      this.typeVersion = typeVersion;
      return this;
    }

    public Builder position(Position position) {
      this.position = position;
      return this;
    }

    public Builder parameters(ObjectNode parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder credentials(ObjectNode credentials) {
      this.credentials = credentials;
      return this;
    }

    public Builder disabled(boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Builder routeConditions(List<JsonNode> routeConditions) {
      this.routeConditions = routeConditions == null ? new ArrayList<>() : routeConditions;
      return this;
    }

    public WorkflowNode build() {
      return new WorkflowNode(this);
    }
  }
}
