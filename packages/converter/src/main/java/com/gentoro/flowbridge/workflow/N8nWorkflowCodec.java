package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.model.Connection;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.model.Position;
import com.gentoro.flowbridge.model.WorkflowGraph;
import com.gentoro.flowbridge.model.WorkflowNode;
import com.gentoro.flowbridge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * n8n documents: {@code {name, nodes[], connections{}}}.
 *
 * <p>Connections are keyed by node name: {@code connections[from][type][outputIndex]} is a list of
 * {@code {node, type, index}} targets. Every connection type is read; only {@code main} is
 * written.
 */
public class N8nWorkflowCodec implements WorkflowCodec {

  static final String MAIN = "main";

  @Override
  public Platform platform() {
    return Platform.N8N;
  }

  @Override
  public WorkflowGraph read(JsonNode document, ConversionLogCollector logs) {
    String name = document.path("name").asText(null);
    List<WorkflowNode> nodes = new ArrayList<>();
    Map<String, String> idByName = new HashMap<>();
    Set<String> ids = new HashSet<>();

    JsonNode nodeArray = document.path("nodes");
    for (int i = 0; i < nodeArray.size(); i++) {
      JsonNode n = nodeArray.get(i);
      String id = n.hasNonNull("id") ? n.get("id").asText() : "";
      if (id.isBlank() || ids.contains(id)) {
        String generated = generateId(i, ids);
        logs.info("Node at index " + i + " has no unique id; assigned '" + generated + "'");
        id = generated;
      }
      ids.add(id);
      String nodeName = n.path("name").asText(id);
      idByName.putIfAbsent(nodeName, id);
      nodes.add(
          WorkflowNode.builder()
              .id(id)
              .name(nodeName)
              .type(n.path("type").asText(""))
              .typeVersion(n.get("typeVersion"))
              .position(readPosition(n.get("position")))
              .parameters(objectOrNull(n.get("parameters")))
              .credentials(objectOrNull(n.get("credentials")))
              .disabled(n.path("disabled").asBoolean(false))
              .build());
    }

    List<Connection> connections = new ArrayList<>();
    for (Iterator<Map.Entry<String, JsonNode>> it = document.path("connections").fields();
        it.hasNext(); ) {
      Map.Entry<String, JsonNode> byFrom = it.next();
      String fromId = idByName.getOrDefault(byFrom.getKey(), byFrom.getKey());
      for (Iterator<Map.Entry<String, JsonNode>> types = byFrom.getValue().fields();
          types.hasNext(); ) {
        JsonNode outputs = types.next().getValue();
        for (int port = 0; port < outputs.size(); port++) {
          JsonNode targets = outputs.get(port);
          if (targets == null || !targets.isArray()) continue;
          for (JsonNode target : targets) {
            String toName = target.path("node").asText(null);
            if (toName == null) {
              logs.warning("Ignoring connection from '" + byFrom.getKey() + "' without a target node");
              continue;
            }
            connections.add(
                new Connection(
                    fromId,
                    port,
                    idByName.getOrDefault(toName, toName),
                    target.path("index").asInt(0)));
          }
        }
      }
    }
    return new WorkflowGraph(name, nodes, connections);
  }

  @Override
  public ObjectNode write(
      String name,
      List<WorkflowNode> nodes,
      List<Connection> connections,
      ConversionLogCollector logs) {
    ObjectNode doc = emptySkeleton(name);
    ArrayNode nodeArray = (ArrayNode) doc.get("nodes");
    Map<String, String> nameById = new HashMap<>();
    for (int i = 0; i < nodes.size(); i++) {
      WorkflowNode node = nodes.get(i);
      nameById.put(node.getId(), node.getName());
      ObjectNode n = nodeArray.addObject();
      n.put("id", node.getId());
      n.put("name", node.getName());
      n.put("type", node.getType());
      n.set("typeVersion", node.getTypeVersion() != null ? node.getTypeVersion() : IntNode.valueOf(1));
      Position p = node.getPosition() != null ? node.getPosition() : new Position(i * 200d, 0d);
      n.putArray("position")
          .add(WorkflowCodec.coordinate(p.x()))
          .add(WorkflowCodec.coordinate(p.y()));
      n.set("parameters", node.getParameters());
      if (!node.getCredentials().isEmpty()) {
        n.set("credentials", node.getCredentials());
      }
      if (node.isDisabled()) {
        n.put("disabled", true);
      }
    }

    ObjectNode conns = (ObjectNode) doc.get("connections");
    for (Connection c : connections) {
      if (c.fromPort() < 0) {
        logs.warning(
            "Dropping connection " + c.fromNodeId() + " -> " + c.toNodeId()
                + " from a negative output");
        continue;
      }
      String fromName = nameById.getOrDefault(c.fromNodeId(), c.fromNodeId());
      String toName = nameById.getOrDefault(c.toNodeId(), c.toNodeId());
      ObjectNode byType = conns.has(fromName) ? (ObjectNode) conns.get(fromName) : conns.putObject(fromName);
      ArrayNode outputs = byType.has(MAIN) ? (ArrayNode) byType.get(MAIN) : byType.putArray(MAIN);
      while (outputs.size() <= c.fromPort()) {
        outputs.addArray();
      }
      ObjectNode target = ((ArrayNode) outputs.get(c.fromPort())).addObject();
      target.put("node", toName);
      target.put("type", MAIN);
      target.put("index", c.toPort());
    }
    return doc;
  }

  @Override
  public ObjectNode emptySkeleton(String name) {
    ObjectNode doc = JacksonUtility.getJsonMapper().createObjectNode();
    doc.put("name", name);
    doc.putArray("nodes");
    doc.putObject("connections");
    doc.put("active", false);
    doc.putObject("settings").put("executionOrder", "v1");
    return doc;
  }

  private static String generateId(int index, Set<String> taken) {
    String candidate = "node-" + (index + 1);
    int suffix = 1;
    while (taken.contains(candidate)) {
      candidate = "node-" + (index + 1) + "-" + suffix++;
    }
    return candidate;
  }

  private static Position readPosition(JsonNode position) {
    if (position == null || !position.isArray() || position.size() < 2) return null;
    return new Position(position.get(0).asDouble(), position.get(1).asDouble());
  }

  private static ObjectNode objectOrNull(JsonNode node) {
    return node != null && node.isObject() ? ((ObjectNode) node).deepCopy() : null;
  }
}
