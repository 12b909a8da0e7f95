package com.gentoro.flowbridge.workflow;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.model.Connection;
import com.gentoro.flowbridge.model.Position;
import com.gentoro.flowbridge.model.WorkflowGraph;
import com.gentoro.flowbridge.model.WorkflowNode;
import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MakeWorkflowCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final MakeWorkflowCodec codec = new MakeWorkflowCodec();
  private final ConversionLogCollector logs = new ConversionLogCollector(Clock.systemUTC());

  private static WorkflowNode module(String id, String type) {
    return WorkflowNode.builder().id(id).name("M" + id).type(type).build();
  }

  @Test
  @DisplayName("reading splits credentials from values and derives edges from structure")
  void readsStructure() throws Exception {
    JsonNode doc =
        mapper.readTree(
            """
            {"name": "S", "flow": [
              {"id": 1, "module": "gateway:CustomWebHook",
               "parameters": {"hook": 5, "__IMTCONN__conn": 11},
               "mapper": {"x": "{{1.a}}"},
               "metadata": {"designer": {"x": 10, "y": 20}}},
              {"id": 2, "module": "builtin:BasicRouter", "routes": [
                {"condition": {"operator": "eq", "left": "a", "right": "b"},
                 "flow": [{"id": 3, "module": "util:SetVariables", "label": "Set it"}]},
                {"flow": []}
              ]}
            ], "metadata": {"designer": {
              "orphans": [[{"id": 4, "module": "helper:Note"}]],
              "links": [{"from": 4, "to": 3}]
            }}}
            """);

    WorkflowGraph graph = codec.read(doc, logs);

    assertEquals(4, graph.getNodes().size());
    WorkflowNode hook = graph.getNodes().get(0);
    assertEquals("1", hook.getId());
    assertEquals(mapper.readTree("{\"hook\": 5, \"x\": \"{{1.a}}\"}"), hook.getParameters());
    assertEquals(mapper.readTree("{\"conn\": 11}"), hook.getCredentials());
    assertEquals(new Position(10, 20), hook.getPosition());
    assertEquals("gateway:CustomWebHook 1", hook.getName());

    WorkflowNode router = graph.getNodes().get(1);
    assertEquals(2, router.getRouteConditions().size());
    assertEquals("eq", router.getRouteConditions().get(0).get("operator").asText());
    assertTrue(router.getRouteConditions().get(1).isEmpty());
    assertEquals("Set it", graph.getNodes().get(2).getName());

    assertEquals(
        List.of(
            new Connection("1", 0, "2", 0),
            new Connection("2", 0, "3", 0),
            new Connection("4", 0, "3", 0)),
        graph.getConnections());
  }

  @Test
  @DisplayName("missing and duplicate ids are replaced")
  void generatedIds() throws Exception {
    JsonNode doc =
        mapper.readTree(
            """
            {"flow": [{"module": "a:A"}, {"id": 7, "module": "b:B"}, {"id": 7, "module": "c:C"}]}
            """);

    WorkflowGraph graph = codec.read(doc, logs);

    assertEquals("module-1", graph.getNodes().get(0).getId());
    assertEquals("7", graph.getNodes().get(1).getId());
    assertEquals("module-3", graph.getNodes().get(2).getId());
    assertEquals(2, logs.count(LogLevel.INFO));
  }

  @Test
  @DisplayName("writing nests route chains and keeps unreachable chains as orphans")
  void writesRoutesAndOrphans() {
    WorkflowNode router =
        WorkflowNode.builder()
            .id("2")
            .name("Router")
            .type(MakeWorkflowCodec.ROUTER_TYPE)
            .position(new Position(1.5, 2))
            .build();
    List<WorkflowNode> nodes =
        List.of(
            module("1", "gateway:CustomWebHook"),
            router,
            module("3", "util:SetVariables"),
            module("4", "util:SetVariables"),
            module("5", "helper:Note"));
    List<Connection> connections =
        List.of(
            new Connection("1", 0, "2", 0),
            new Connection("2", 0, "3", 0),
            new Connection("2", 1, "4", 0));

    ObjectNode doc = codec.write("W", nodes, connections, logs);

    JsonNode flow = doc.get("flow");
    assertEquals(2, flow.size());
    assertEquals(1, flow.at("/0/id").intValue());
    assertEquals(1, flow.at("/0/version").intValue());
    assertEquals(1.5, flow.at("/1/metadata/designer/x").doubleValue());
    assertTrue(flow.at("/1/metadata/designer/y").isInt());
    assertEquals(3, flow.at("/1/routes/0/flow/0/id").intValue());
    assertEquals(4, flow.at("/1/routes/1/flow/0/id").intValue());
    assertEquals(5, doc.at("/metadata/designer/orphans/0/0/id").intValue());
    assertFalse(doc.at("/metadata/designer").has("links"));
  }

  @Test
  @DisplayName("edges the flow cannot hold go to designer links")
  void writesLinks() {
    List<WorkflowNode> nodes =
        List.of(module("1", "a:A"), module("2", "b:B"), module("3", "c:C"));
    // node 3 has two inputs, so it can only sit behind one of them
    List<Connection> connections =
        List.of(
            new Connection("1", 0, "2", 0),
            new Connection("2", 0, "3", 0),
            new Connection("1", 0, "3", 0));

    ObjectNode doc = codec.write("W", nodes, connections, logs);

    assertEquals(2, doc.get("flow").size());
    assertEquals(3, doc.at("/metadata/designer/orphans/0/0/id").intValue());
    assertEquals(2, doc.at("/metadata/designer/links").size());
    assertEquals(2, logs.count(LogLevel.WARNING));
  }

  @Test
  @DisplayName("credentials are written as connection parameters")
  void writesCredentials() throws Exception {
    WorkflowNode node =
        WorkflowNode.builder()
            .id("1")
            .type("http:ActionSendData")
            .credentials((ObjectNode) mapper.readTree("{\"basic\": 3}"))
            .parameters((ObjectNode) mapper.readTree("{\"url\": \"u\"}"))
            .disabled(true)
            .build();

    JsonNode module = codec.write("W", List.of(node), List.of(), logs).at("/flow/0");

    assertEquals(3, module.at("/parameters/__IMTCONN__basic").intValue());
    assertEquals("u", module.at("/mapper/url").asText());
    assertTrue(module.get("disabled").booleanValue());
    assertFalse(module.at("/metadata/designer").has("name"));
  }

  @Test
  @DisplayName("legacy blueprints are recognized and normalized")
  void legacy() throws Exception {
    JsonNode legacy =
        mapper.readTree(
            "{\"blueprint\": {\"name\": \"Old\"}, \"modules\": [{\"id\": 1, \"module\": \"a:A\"}]}");
    assertTrue(MakeWorkflowCodec.isLegacy(legacy));
    JsonNode normalized = MakeWorkflowCodec.normalizeLegacy(legacy);
    assertEquals("Old", normalized.get("name").asText());
    assertEquals(1, normalized.get("flow").size());

    JsonNode modern = mapper.readTree("{\"flow\": []}");
    assertFalse(MakeWorkflowCodec.isLegacy(modern));
    assertSame(modern, MakeWorkflowCodec.normalizeLegacy(modern));
  }

  @Test
  @DisplayName("ids are numbers when numeric")
  void idValue() {
    assertTrue(MakeWorkflowCodec.idValue("12").isInt());
    assertEquals("module-1", MakeWorkflowCodec.idValue("module-1").asText());
    assertNull(MakeWorkflowCodec.idValue("x").numberValue());
  }
}
