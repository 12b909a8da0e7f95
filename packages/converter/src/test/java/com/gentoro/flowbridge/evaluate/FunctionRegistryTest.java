package com.gentoro.flowbridge.evaluate;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FunctionRegistryTest {

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private final FunctionRegistry registry = new FunctionRegistry();

  private EvaluationException.Kind failure(String name, JsonNode... args) {
    return assertThrows(EvaluationException.class, () -> registry.invoke(name, List.of(args)))
        .getKind();
  }

  @Test
  @DisplayName("round rejects digit counts it cannot represent")
  void roundDigitsBounded() {
    assertEquals(
        1.5,
        registry.invoke("round", List.of(NODES.numberNode(1.46), NODES.numberNode(1))).doubleValue());
    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("round", NODES.numberNode(1.5), NODES.numberNode(2_000_000_000)));
    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("round", NODES.numberNode(1.5), NODES.numberNode(-1)));
    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("round", NODES.numberNode(1.5), NODES.numberNode(1_000_000_000_000L)));
  }

  @Test
  @DisplayName("runtime failures inside a builtin surface as evaluation errors")
  void builtinFailuresWrapped() {
    registry.register(
        "explode",
        args -> {
          throw new ArithmeticException("overflow");
        });

    EvaluationException e =
        assertThrows(EvaluationException.class, () -> registry.invoke("explode", List.of()));
    assertEquals(EvaluationException.Kind.TYPE_MISMATCH, e.getKind());
    assertTrue(e.getMessage().contains("explode: overflow"));
    assertInstanceOf(ArithmeticException.class, e.getCause());
  }

  @Test
  @DisplayName("random takes an optional range")
  void randomRange() {
    double unit = registry.invoke("random", List.of()).doubleValue();
    assertTrue(unit >= 0 && unit < 1);

    for (int i = 0; i < 50; i++) {
      double value =
          registry.invoke("random", List.of(NODES.numberNode(1), NODES.numberNode(10))).doubleValue();
      assertTrue(value >= 1 && value < 10, "out of range: " + value);
    }
    double upTo = registry.invoke("random", List.of(NODES.numberNode(5))).doubleValue();
    assertTrue(upTo >= 0 && upTo < 5);

    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("random", NODES.numberNode(3), NODES.numberNode(3)));
    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("random", NODES.numberNode(1), NODES.numberNode(2), NODES.numberNode(3)));
  }

  @Test
  @DisplayName("substr counts a length, substring an end index")
  void substrVersusSubstring() {
    JsonNode hello = NODES.textNode("hello");
    assertEquals(
        "ell",
        registry.invoke("substr", List.of(hello, NODES.numberNode(1), NODES.numberNode(3))).textValue());
    assertEquals(
        "el",
        registry
            .invoke("substring", List.of(hello, NODES.numberNode(1), NODES.numberNode(3)))
            .textValue());
    assertEquals(
        "lo", registry.invoke("substr", List.of(hello, NODES.numberNode(-2))).textValue());
    assertEquals(
        "llo",
        registry.invoke("substr", List.of(hello, NODES.numberNode(2), NODES.numberNode(99))).textValue());
    assertEquals(
        EvaluationException.Kind.TYPE_MISMATCH,
        failure("substr", hello, NODES.numberNode(1), NODES.numberNode(-1)));
  }
}
