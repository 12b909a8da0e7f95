package com.gentoro.flowbridge.mapping;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TransformationRegistryTest {

  private final TransformationRegistry registry = new TransformationRegistry();

  @Test
  @DisplayName("built-in transforms are registered")
  void builtIns() {
    for (String name :
        new String[] {
          "booleanToString", "stringToBoolean", "numberToString", "stringToNumber",
          "toUpperCase", "toLowerCase", "trim"
        }) {
      assertTrue(registry.hasTransformation(name), name);
    }
  }

  @Test
  @DisplayName("boolean and string conversions")
  void booleans() {
    assertEquals("true", registry.apply("booleanToString", BooleanNode.TRUE).textValue());
    assertTrue(registry.apply("stringToBoolean", TextNode.valueOf(" Yes ")).booleanValue());
    assertFalse(registry.apply("stringToBoolean", TextNode.valueOf("off")).booleanValue());
  }

  @Test
  @DisplayName("number and string conversions")
  void numbers() {
    assertEquals("42", registry.apply("numberToString", IntNode.valueOf(42)).textValue());
    assertEquals(42L, registry.apply("stringToNumber", TextNode.valueOf("42")).longValue());
    assertEquals(
        "2.5", registry.apply("stringToNumber", TextNode.valueOf("2.50")).decimalValue()
            .stripTrailingZeros().toPlainString());
  }

  @Test
  @DisplayName("failures, unknown names and expressions return the original value")
  void leavesValueAlone() {
    JsonNode notANumber = TextNode.valueOf("abc");
    assertSame(notANumber, registry.apply("stringToNumber", notANumber));
    JsonNode value = TextNode.valueOf("get");
    assertSame(value, registry.apply("noSuchTransform", value));
    JsonNode expression = TextNode.valueOf("={{ $json.method }}");
    assertSame(expression, registry.apply("toUpperCase", expression));
  }

  @Test
  @DisplayName("custom transforms can be registered")
  void register() {
    registry.register("reverse", v -> TextNode.valueOf(new StringBuilder(v.asText()).reverse().toString()));
    assertEquals("cba", registry.apply("reverse", TextNode.valueOf("abc")).textValue());
  }
}
