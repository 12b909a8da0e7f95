package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Make scenario blueprints: {@code {name, flow[], metadata{}}}.
 *
 * <p>Edges are implied by structure: a module feeds the module after it in the same flow array,
 * and route {@code i} of a router feeds the first module of {@code routes[i].flow}. Chains that
 * hang off nothing are kept in {@code metadata.designer.orphans}; edges the structure cannot
 * express are kept in {@code metadata.designer.links}. Credentials live in {@code parameters} as
 * {@code __IMTCONN__<name>} entries; all other values are written to {@code mapper}.
 */
public class MakeWorkflowCodec implements WorkflowCodec {

  public static final String ROUTER_TYPE = "builtin:BasicRouter";
  static final String CONNECTION_PREFIX = "__IMTCONN__";
  /** Highest output or input index accepted from a designer link. */
  static final int MAX_PORT = 255;

  @Override
  public Platform platform() {
    return Platform.MAKE;
  }

  /**
   * Rewrites the legacy {@code {blueprint:{name}, modules[]}} shape into {@code {name, flow}}.
   * Other documents are returned unchanged.
   */
  public static JsonNode normalizeLegacy(JsonNode document) {
    if (document == null
        || !document.isObject()
        || document.has("flow")
        || !document.path("modules").isArray()) {
      return document;
    }
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    out.put("name", document.path("blueprint").path("name").asText(document.path("name").asText(null)));
    out.set("flow", document.get("modules").deepCopy());
    if (document.has("metadata")) {
      out.set("metadata", document.get("metadata").deepCopy());
    }
    return out;
  }

  public static boolean isLegacy(JsonNode document) {
    return document != null
        && document.isObject()
        && !document.has("flow")
        && document.path("modules").isArray();
  }

  // ---- reading -----------------------------------------------------------------------------

  @Override
  public WorkflowGraph read(JsonNode document, ConversionLogCollector logs) {
    Reader reader = new Reader(logs);
    reader.readFlow(document.path("flow"));
    JsonNode designer = document.path("metadata").path("designer");
    for (JsonNode orphan : designer.path("orphans")) {
      reader.readFlow(orphan.isArray() ? orphan : JsonNodeFactory.instance.arrayNode().add(orphan));
    }
    for (JsonNode link : designer.path("links")) {
      String from = link.path("from").asText(null);
      String to = link.path("to").asText(null);
      if (from == null || to == null) {
        logs.warning("Ignoring designer link without endpoints: " + link);
        continue;
      }
      int fromPort = link.path("fromPort").asInt(0);
      int toPort = link.path("toPort").asInt(0);
      if (fromPort < 0 || fromPort > MAX_PORT || toPort < 0 || toPort > MAX_PORT) {
        logs.warning(
            "Ignoring designer link " + from + " -> " + to
                + ": port out of range 0.." + MAX_PORT);
        continue;
      }
      reader.connections.add(
          new Connection(reader.resolve(from), fromPort, reader.resolve(to), toPort));
    }
    return new WorkflowGraph(document.path("name").asText(null), reader.nodes, reader.connections);
  }

  private static final class Reader {
    final ConversionLogCollector logs;
    final List<WorkflowNode> nodes = new ArrayList<>();
    final List<Connection> connections = new ArrayList<>();
    final Set<String> ids = new HashSet<>();
    final Map<String, String> renamed = new HashMap<>();

    Reader(ConversionLogCollector logs) {
      this.logs = logs;
    }

    /** Reads a flow array; returns the id of its first module, or null when empty. */
    String readFlow(JsonNode flow) {
      if (!flow.isArray()) {
        if (!flow.isMissingNode()) {
          logs.warning("Ignoring flow that is not an array: " + flow);
        }
        return null;
      }
      String first = null;
      String previous = null;
      for (JsonNode module : flow) {
        if (!module.isObject()) {
          logs.warning("Ignoring flow entry that is not a module: " + module);
          continue;
        }
        String id = readModule(module);
        if (first == null) first = id;
        if (previous != null) {
          connections.add(new Connection(previous, 0, id, 0));
        }
        previous = id;
        JsonNode routes = routesOf(module);
        for (int i = 0; i < routes.size(); i++) {
          String head = readFlow(routes.get(i).path("flow"));
          if (head != null) {
            connections.add(new Connection(id, i, head, 0));
          }
        }
      }
      return first;
    }

    private String readModule(JsonNode m) {
      String original = m.hasNonNull("id") ? m.get("id").asText() : "";
      String id = original;
      if (id.isBlank() || ids.contains(id)) {
        id = "module-" + (nodes.size() + 1);
        while (ids.contains(id)) id = id + "_";
        logs.info("Module at position " + (nodes.size() + 1) + " has no unique id; assigned '" + id + "'");
        if (!original.isBlank()) renamed.putIfAbsent(original, id);
      }
      ids.add(id);

      ObjectNode parameters = JsonNodeFactory.instance.objectNode();
      ObjectNode credentials = JsonNodeFactory.instance.objectNode();
      for (Iterator<Map.Entry<String, JsonNode>> it = m.path("parameters").fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        if (e.getKey().startsWith(CONNECTION_PREFIX)) {
          credentials.set(e.getKey().substring(CONNECTION_PREFIX.length()), e.getValue().deepCopy());
        } else {
          parameters.set(e.getKey(), e.getValue().deepCopy());
        }
      }
      for (Iterator<Map.Entry<String, JsonNode>> it = m.path("mapper").fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        parameters.set(e.getKey(), e.getValue().deepCopy());
      }

      List<JsonNode> conditions = new ArrayList<>();
      if (m.hasNonNull("routes") && routesOf(m) != m.get("routes")) {
        logs.warning(
            "Ignoring routes of module '" + m.path("id").asText("?")
                + "': expected an array of route objects");
      }
      for (JsonNode route : routesOf(m)) {
        conditions.add(route.has("condition") ? route.get("condition").deepCopy() : JsonNodeFactory.instance.objectNode());
      }

      JsonNode designer = m.path("metadata").path("designer");
      Position position =
          designer.has("x") || designer.has("y")
              ? new Position(designer.path("x").asDouble(0), designer.path("y").asDouble(0))
              : null;
      String type = m.path("module").asText("");
      String name = designer.path("name").asText(m.path("label").asText(type + " " + id));

      nodes.add(
          WorkflowNode.builder()
              .id(id)
              .name(name)
              .type(type)
              .typeVersion(m.get("version"))
              .position(position)
              .parameters(parameters)
              .credentials(credentials)
              .disabled(m.path("disabled").asBoolean(false))
              .routeConditions(conditions)
              .build());
      return id;
    }

    String resolve(String reference) {
      return renamed.getOrDefault(reference, reference);
    }
  }

  /** The module's routes when they are an array of objects, otherwise an empty array. */
  static JsonNode routesOf(JsonNode module) {
    JsonNode routes = module.path("routes");
    if (!routes.isArray()) {
      return JsonNodeFactory.instance.arrayNode();
    }
    for (JsonNode route : routes) {
      if (!route.isObject()) return JsonNodeFactory.instance.arrayNode();
    }
    return routes;
  }

  // ---- writing -----------------------------------------------------------------------------

  @Override
  public ObjectNode write(
      String name,
      List<WorkflowNode> nodes,
      List<Connection> connections,
      ConversionLogCollector logs) {
    ObjectNode doc = emptySkeleton(name);
    new Writer(nodes, connections, logs).write((ArrayNode) doc.get("flow"), (ObjectNode) doc.path("metadata").path("designer"));
    return doc;
  }

  private static final class Writer {
    final List<WorkflowNode> nodes;
    final List<Connection> connections;
    final ConversionLogCollector logs;
    final Map<String, WorkflowNode> byId = new LinkedHashMap<>();
    final Map<String, Integer> incoming = new HashMap<>();
    final Set<String> placed = new HashSet<>();
    final Set<Connection> structural = new HashSet<>();

    Writer(List<WorkflowNode> nodes, List<Connection> connections, ConversionLogCollector logs) {
      this.nodes = nodes;
      this.connections = connections;
      this.logs = logs;
      for (WorkflowNode node : nodes) byId.put(node.getId(), node);
      for (Connection c : connections) incoming.merge(c.toNodeId(), 1, Integer::sum);
    }

    void write(ArrayNode flow, ObjectNode designer) {
      ArrayNode orphans = (ArrayNode) designer.get("orphans");
      // the main flow starts at the first node nothing feeds into
      for (WorkflowNode node : nodes) {
        if (!incoming.containsKey(node.getId())) {
          emitChain(node, flow);
          break;
        }
      }
      for (WorkflowNode node : nodes) {
        if (placed.contains(node.getId())) continue;
        ArrayNode chain = JsonNodeFactory.instance.arrayNode();
        if (flow.isEmpty()) {
          emitChain(node, flow);
        } else {
          emitChain(node, chain);
          orphans.add(chain);
        }
      }

      ArrayNode links = JsonNodeFactory.instance.arrayNode();
      for (Connection c : connections) {
        if (structural.contains(c)) continue;
        logs.warning(
            "Connection " + c.fromNodeId() + " -> " + c.toNodeId()
                + " cannot be expressed in the flow; kept in metadata.designer.links");
        ObjectNode link = links.addObject();
        link.set("from", idValue(c.fromNodeId()));
        link.put("fromPort", c.fromPort());
        link.set("to", idValue(c.toNodeId()));
        link.put("toPort", c.toPort());
      }
      if (!links.isEmpty()) {
        designer.set("links", links);
      }
    }

    private void emitChain(WorkflowNode start, ArrayNode flow) {
      WorkflowNode current = start;
      while (current != null) {
        placed.add(current.getId());
        ObjectNode module = flow.addObject();
        writeModule(current, module);
        if (isRouter(current)) {
          ArrayNode routes = module.putArray("routes");
          int count = Math.max(current.getRouteConditions().size(), maxPort(current.getId()) + 1);
          for (int i = 0; i < count; i++) {
            ObjectNode route = routes.addObject();
            if (i < current.getRouteConditions().size() && !current.getRouteConditions().get(i).isEmpty()) {
              route.set("condition", current.getRouteConditions().get(i));
            }
            ArrayNode routeFlow = route.putArray("flow");
            WorkflowNode head = follow(current.getId(), i);
            if (head != null) emitChain(head, routeFlow);
          }
          return;
        }
        current = follow(current.getId(), 0);
      }
    }

    /** Next module to place after {@code fromId} on {@code port}, marking the edge structural. */
    private WorkflowNode follow(String fromId, int port) {
      for (Connection c : connections) {
        if (!c.fromNodeId().equals(fromId) || c.fromPort() != port || c.toPort() != 0) continue;
        WorkflowNode target = byId.get(c.toNodeId());
        if (target == null || placed.contains(target.getId())) continue;
        if (incoming.getOrDefault(target.getId(), 0) != 1) continue;
        structural.add(c);
        return target;
      }
      return null;
    }

    private int maxPort(String fromId) {
      int max = -1;
      for (Connection c : connections) {
        if (c.fromNodeId().equals(fromId)) max = Math.max(max, c.fromPort());
      }
      return max;
    }

    private static boolean isRouter(WorkflowNode node) {
      return ROUTER_TYPE.equals(node.getType()) || !node.getRouteConditions().isEmpty();
    }

    private static void writeModule(WorkflowNode node, ObjectNode module) {
      module.set("id", idValue(node.getId()));
      module.put("module", node.getType());
      module.set("version", node.getTypeVersion() != null ? node.getTypeVersion() : IntNode.valueOf(1));
      ObjectNode parameters = module.putObject("parameters");
      for (Iterator<Map.Entry<String, JsonNode>> it = node.getCredentials().fields(); it.hasNext(); ) {
        Map.Entry<String, JsonNode> e = it.next();
        parameters.set(CONNECTION_PREFIX + e.getKey(), e.getValue());
      }
      module.set("mapper", node.getParameters());
      ObjectNode designer = module.putObject("metadata").putObject("designer");
      Position p = node.getPosition() != null ? node.getPosition() : new Position(0, 0);
      designer.set("x", WorkflowCodec.coordinate(p.x()));
      designer.set("y", WorkflowCodec.coordinate(p.y()));
      if (node.getName() != null) {
        designer.put("name", node.getName());
      }
      if (node.isDisabled()) {
        module.put("disabled", true);
      }
    }
  }

  /** Numeric ids are written as numbers, anything else as text. */
  static JsonNode idValue(String id) {
    try {
      return IntNode.valueOf(Integer.parseInt(id));
    } catch (NumberFormatException e) {
      return JsonNodeFactory.instance.textNode(id);
    }
  }

  @Override
  public ObjectNode emptySkeleton(String name) {
    ObjectNode doc = JacksonUtility.getJsonMapper().createObjectNode();
    doc.put("name", name);
    doc.putArray("flow");
    ObjectNode metadata = doc.putObject("metadata");
    metadata.put("instant", false);
    metadata.put("version", 1);
    ObjectNode scenario = metadata.putObject("scenario");
    scenario.put("roundtrips", 1);
    scenario.put("maxErrors", 3);
    scenario.put("autoCommit", true);
    scenario.put("autoCommitTriggerLast", true);
    scenario.put("sequential", false);
    scenario.put("confidential", false);
    scenario.put("dataloss", false);
    scenario.put("dlq", false);
    ObjectNode designer = metadata.putObject("designer");
    designer.putArray("orphans");
    return doc;
  }
}
