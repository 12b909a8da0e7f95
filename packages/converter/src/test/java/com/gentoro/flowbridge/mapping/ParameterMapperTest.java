package com.gentoro.flowbridge.mapping;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParameterMapperTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final ParameterMapper parameterMapper = new ParameterMapper(new TransformationRegistry());

  private ObjectNode params(String json) throws Exception {
    return (ObjectNode) mapper.readTree(json);
  }

  @Test
  @DisplayName("mapped paths move, substitutions and transforms apply, the rest is copied")
  void movesAndConverts() throws Exception {
    Map<String, String> paths = new LinkedHashMap<>();
    paths.put("url", "url");
    paths.put("method", "method");
    paths.put("body", "data");
    paths.put("responseFormat", "parseResponse");
    Map<String, Map<String, JsonNode>> substitutions =
        Map.of("responseFormat", Map.of("json", BooleanNode.TRUE, "string", BooleanNode.FALSE));
    MappingEntry entry =
        new MappingEntry(
            "n8n-nodes-base.httpRequest",
            "http:ActionSendData",
            "HTTP Request",
            paths,
            substitutions,
            Map.of("method", "toUpperCase"),
            null);

    ParameterMapper.MappedParameters result =
        parameterMapper.apply(
            entry,
            params(
                """
                {"url": "https://x.test", "method": "post", "body": {"a": 1},
                 "responseFormat": "json", "timeout": 5}
                """),
            true);

    assertEquals(
        params(
            """
            {"url": "https://x.test", "method": "POST", "data": {"a": 1},
             "parseResponse": true, "timeout": 5}
            """),
        result.parameters());
    assertEquals("data.a", result.targetPath("body.a"));
    assertEquals("timeout", result.targetPath("timeout"));
  }

  @Test
  @DisplayName("nested source paths leave their siblings in place")
  void nestedPaths() throws Exception {
    Map<String, String> paths = Map.of("otherOptions.unfurlLinks", "unfurlLinks");
    ParameterMapper.MappedParameters result =
        parameterMapper.apply(
            params("{\"otherOptions\": {\"unfurlLinks\": true, \"mrkdwn\": false}}"),
            paths,
            Map.of(),
            Map.of("otherOptions.unfurlLinks", "booleanToString"),
            true);

    assertEquals(TextNode.valueOf("true"), result.parameters().get("unfurlLinks"));
    assertEquals(params("{\"mrkdwn\": false}"), result.parameters().get("otherOptions"));
  }

  @Test
  @DisplayName("without copyUnmapped only mapped paths survive")
  void dropsUnmapped() throws Exception {
    ParameterMapper.MappedParameters result =
        parameterMapper.apply(
            params("{\"to\": \"a@b.c\", \"cc\": \"d@e.f\"}"),
            Map.of("to", "toEmail"),
            Map.of(),
            Map.of(),
            false);
    assertEquals(params("{\"toEmail\": \"a@b.c\"}"), result.parameters());
  }

  @Test
  @DisplayName("absent source paths are skipped")
  void absentPaths() throws Exception {
    ParameterMapper.MappedParameters result =
        parameterMapper.apply(params("{}"), Map.of("url", "url"), Map.of(), Map.of(), true);
    assertTrue(result.parameters().isEmpty());
    assertFalse(result.pathMap().containsKey("url"));
  }

  @Test
  @DisplayName("invert swaps directions and keeps the first source per target")
  void invert() {
    Map<String, String> forward = new LinkedHashMap<>();
    forward.put("toEmail", "to");
    forward.put("recipient", "to");
    forward.put("text", "content");
    assertEquals(Map.of("to", "toEmail", "content", "text"), ParameterMapper.invert(forward));
  }
}
