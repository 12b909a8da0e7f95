package com.gentoro.flowbridge.walker;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.flowbridge.evaluate.ExpressionEvaluator;
import com.gentoro.flowbridge.evaluate.FunctionRegistry;
import com.gentoro.flowbridge.expression.Dialect;
import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.translate.DialectTranslator;
import com.gentoro.flowbridge.translate.TranslationContext;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParameterTreeWalkerTest {

  private final ObjectMapper mapper = new ObjectMapper();

  private final TranslationContext ctx =
      new TranslationContext("b", List.of("a"), Map.of("Start", "a"), Map.of("a", "1"));

  private final ParameterTreeWalker toMake =
      new ParameterTreeWalker(new DialectTranslator(Dialect.N8N, Dialect.MAKE));

  @Test
  @DisplayName("string leaves are translated; everything else is copied in order")
  void translatesLeaves() throws Exception {
    JsonNode params =
        mapper.readTree(
            """
            {
              "url": "={{ $json.url }}",
              "retries": 3,
              "enabled": true,
              "missing": null,
              "headers": [{"name": "X-Id", "value": "=id-{{ $json.id }}"}],
              "note": "plain text"
            }
            """);

    WalkResult result = toMake.walk(params, WalkMode.TRANSLATE, ctx);

    JsonNode out = result.value();
    assertEquals("{{1.url}}", out.get("url").textValue());
    assertEquals("id-{{1.id}}", out.at("/headers/0/value").textValue());
    assertEquals(3, out.get("retries").intValue());
    assertTrue(out.get("enabled").booleanValue());
    assertTrue(out.get("missing").isNull());
    assertEquals("plain text", out.get("note").textValue());
    assertEquals(
        List.of("url", "retries", "enabled", "missing", "headers", "note"),
        iterableToList(out.fieldNames()));

    assertEquals(2, result.findings().size());
    assertEquals("url", result.findings().get(0).path());
    assertEquals("headers[0].value", result.findings().get(1).path());
    assertTrue(result.warnings().isEmpty());
  }

  @Test
  @DisplayName("walking an already translated tree changes nothing")
  void idempotent() throws Exception {
    JsonNode params = mapper.readTree("{\"a\": \"={{ $json.a }}\", \"b\": [\"x{{ $json.b }}\"]}");
    JsonNode once = toMake.walk(params, WalkMode.TRANSLATE, ctx).value();
    JsonNode twice = toMake.walk(once, WalkMode.TRANSLATE, ctx).value();
    assertEquals(once, twice);

    ParameterTreeWalker toN8n =
        new ParameterTreeWalker(new DialectTranslator(Dialect.MAKE, Dialect.N8N));
    TranslationContext back =
        new TranslationContext("2", List.of("1"), Map.of(), Map.of("1", "Start"));
    JsonNode n8n = toN8n.walk(mapper.readTree("{\"v\": \"{{1.a}}\"}"), WalkMode.TRANSLATE, back).value();
    assertEquals("={{ $json.a }}", n8n.get("v").textValue());
    assertEquals(n8n, toN8n.walk(n8n, WalkMode.TRANSLATE, back).value());
  }

  @Test
  @DisplayName("verbatim subtrees are copied without inspection")
  void verbatimPaths() throws Exception {
    JsonNode params =
        mapper.readTree("{\"jsCode\": \"return {{ $json.x }}\", \"label\": \"={{ $json.x }}\"}");
    WalkResult result =
        toMake.walk(params, WalkMode.TRANSLATE, ctx, null, Set.of("jsCode"));
    assertEquals("return {{ $json.x }}", result.value().get("jsCode").textValue());
    assertEquals("{{1.x}}", result.value().get("label").textValue());
    assertEquals(1, result.findings().size());
  }

  @Test
  @DisplayName("trees nested past the limit are rejected")
  void depthLimit() throws Exception {
    ParameterTreeWalker shallow =
        new ParameterTreeWalker(new DialectTranslator(Dialect.N8N, Dialect.MAKE), null, 2);
    JsonNode params = mapper.readTree("{\"a\": {\"b\": {\"c\": {\"d\": 1}}}}");
    ParameterDepthExceededException e =
        assertThrows(
            ParameterDepthExceededException.class,
            () -> shallow.walk(params, WalkMode.TRANSLATE, ctx));
    assertEquals(2, e.getLimit());
    assertEquals("a.b.c", e.getPath());
  }

  @Test
  @DisplayName("evaluation yields values and falls back to translation when it fails")
  void evaluateMode() throws Exception {
    ParameterTreeWalker evaluating =
        new ParameterTreeWalker(
            new DialectTranslator(Dialect.N8N, Dialect.MAKE),
            new ExpressionEvaluator(new FunctionRegistry(), Dialect.N8N),
            ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    JsonNode params =
        mapper.readTree(
            """
            {"url": "={{ \\"https://example.com/api/\\" + $json.id }}",
             "custom": "={{ $customFn($json.id) }}"}
            """);
    JsonNode bindings = mapper.readTree("{\"$json\": {\"id\": \"12345\"}}");

    WalkResult result =
        evaluating.walk(params, WalkMode.EVALUATE, ctx, bindings, Set.of());

    assertEquals("https://example.com/api/12345", result.value().get("url").textValue());
    assertEquals("{{$customFn(1.id)}}", result.value().get("custom").textValue());
    assertEquals(1, result.warnings().size());
    assertTrue(result.warnings().get(0).contains("UNKNOWN_FUNCTION"));
    assertEquals(
        ExpressionIssue.Kind.UNRECOGNIZED_FUNCTION,
        result.findings().get(1).issues().get(0).kind());
  }

  @Test
  @DisplayName("a failing block keeps its translation while the other blocks are evaluated")
  void evaluatePerBlock() throws Exception {
    ParameterTreeWalker evaluating =
        new ParameterTreeWalker(
            new DialectTranslator(Dialect.N8N, Dialect.MAKE),
            new ExpressionEvaluator(new FunctionRegistry(), Dialect.N8N),
            ParameterTreeWalker.DEFAULT_MAX_DEPTH);
    JsonNode params =
        mapper.readTree("{\"url\": \"=https://x/{{ $json.id }}/{{ $customFn($json.a) }}\"}");
    JsonNode bindings = mapper.readTree("{\"$json\": {\"id\": \"42\", \"a\": 1}}");

    WalkResult result = evaluating.walk(params, WalkMode.EVALUATE, ctx, bindings, Set.of());

    assertEquals("https://x/42/{{$customFn(1.a)}}", result.value().get("url").textValue());
    assertEquals(1, result.warnings().size());
    assertTrue(result.warnings().get(0).contains("UNKNOWN_FUNCTION"));
    assertEquals(1, result.findings().size());
    assertEquals(
        List.of(ExpressionIssue.Kind.UNRECOGNIZED_FUNCTION),
        result.findings().get(0).issues().stream().map(ExpressionIssue::kind).toList());
  }

  @Test
  @DisplayName("evaluate mode without an evaluator is a programming error")
  void evaluateNeedsEvaluator() {
    assertThrows(
        IllegalStateException.class,
        () -> toMake.walk(mapper.createObjectNode(), WalkMode.EVALUATE, ctx, null, Set.of()));
  }

  private static List<String> iterableToList(java.util.Iterator<String> it) {
    List<String> names = new java.util.ArrayList<>();
    it.forEachRemaining(names::add);
    return names;
  }
}
