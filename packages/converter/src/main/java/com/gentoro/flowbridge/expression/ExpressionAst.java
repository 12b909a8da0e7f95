package com.gentoro.flowbridge.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;

/**
 * Parsed form of a single template expression.
 *
 * <p>Both dialects share the same tree shape; only variable-root names, function names and
 * rendering differ. Instances are immutable.
 */
public sealed interface ExpressionAst {

  /** String, number, boolean or null constant. */
  record Literal(JsonNode value) implements ExpressionAst {
    public Literal {
      value = value == null ? JsonNodeFactory.instance.nullNode() : value;
    }

    public static Literal of(String text) {
      return new Literal(JsonNodeFactory.instance.textNode(text));
    }
  }

  /**
   * Named entry point into the evaluation context: {@code $json}, {@code $env}, {@code env}, or a
   * numeric module reference such as {@code 1} in Make.
   */
  record VariableRoot(String name) implements ExpressionAst {
    public boolean isPositional() {
      if (name == null || name.isEmpty()) return false;
      for (int i = 0; i < name.length(); i++) {
        if (!Character.isDigit(name.charAt(i))) return false;
      }
      return true;
    }
  }

  /** {@code base.field[index]...} */
  record PropertyAccess(ExpressionAst base, List<PathStep> steps) implements ExpressionAst {
    public PropertyAccess {
      steps = List.copyOf(steps);
    }
  }

  /** Call of a named function; the name is the dotted callee ({@code $str.upper}, {@code upper}). */
  record FunctionCall(String name, List<ExpressionAst> arguments) implements ExpressionAst {
    public FunctionCall {
      arguments = List.copyOf(arguments);
    }
  }

  /** Operands joined with {@code +}; evaluation string-coerces every operand. */
  record Concatenation(List<ExpressionAst> operands) implements ExpressionAst {
    public Concatenation {
      operands = List.copyOf(operands);
    }
  }

  /** One step of a {@link PropertyAccess} chain. */
  sealed interface PathStep {
    record Field(String name) implements PathStep {}

    record Index(ExpressionAst key) implements PathStep {}
  }
}
