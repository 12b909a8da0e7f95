package com.gentoro.flowbridge.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.flowbridge.expression.ExpressionAst.Concatenation;
import com.gentoro.flowbridge.expression.ExpressionAst.FunctionCall;
import com.gentoro.flowbridge.expression.ExpressionAst.Literal;
import com.gentoro.flowbridge.expression.ExpressionAst.PathStep;
import com.gentoro.flowbridge.expression.ExpressionAst.PropertyAccess;
import com.gentoro.flowbridge.expression.ExpressionAst.VariableRoot;
import java.util.List;

/** Renders expression trees and segment lists back into dialect syntax. */
public final class ExpressionSerializer {

  private ExpressionSerializer() {}

  /** Expression body text, without delimiters. */
  public static String render(ExpressionAst ast) {
    StringBuilder sb = new StringBuilder();
    write(ast, sb);
    return sb.toString();
  }

  /**
   * Renders segments as a parameter string of {@code dialect}. Parsed expressions are wrapped in
   * the dialect's delimiters, unparsed blocks keep their original text and literal text is copied
   * unchanged. For n8n the sentinel is prepended when at least one expression is present.
   */
  public static String render(List<Segment> segments, Dialect dialect) {
    StringBuilder sb = new StringBuilder();
    boolean anyExpression = false;
    for (Segment segment : segments) {
      if (segment instanceof Segment.LiteralSegment literal) {
        sb.append(literal.text());
      } else if (segment instanceof Segment.ExpressionSegment expression) {
        anyExpression = true;
        if (expression.outcome() instanceof ParseOutcome.Parsed parsed) {
          sb.append(dialect.open()).append(render(parsed.ast())).append(dialect.close());
        } else {
          sb.append(expression.original());
        }
      }
    }
    return anyExpression ? dialect.sentinel() + sb : sb.toString();
  }

  private static void write(ExpressionAst ast, StringBuilder sb) {
    if (ast instanceof Literal literal) {
      writeLiteral(literal.value(), sb);
    } else if (ast instanceof VariableRoot root) {
      sb.append(root.name());
    } else if (ast instanceof PropertyAccess access) {
      writeOperand(access.base(), sb);
      for (PathStep step : access.steps()) {
        if (step instanceof PathStep.Field field) {
          sb.append('.').append(field.name());
        } else if (step instanceof PathStep.Index index) {
          sb.append('[');
          write(index.key(), sb);
          sb.append(']');
        }
      }
    } else if (ast instanceof FunctionCall call) {
      sb.append(call.name()).append('(');
      for (int i = 0; i < call.arguments().size(); i++) {
        if (i > 0) sb.append(", ");
        write(call.arguments().get(i), sb);
      }
      sb.append(')');
    } else if (ast instanceof Concatenation concat) {
      for (int i = 0; i < concat.operands().size(); i++) {
        if (i > 0) sb.append(" + ");
        writeOperand(concat.operands().get(i), sb);
      }
    }
  }

  private static void writeOperand(ExpressionAst ast, StringBuilder sb) {
    if (ast instanceof Concatenation) {
      sb.append('(');
      write(ast, sb);
      sb.append(')');
    } else {
      write(ast, sb);
    }
  }

  private static void writeLiteral(JsonNode value, StringBuilder sb) {
    if (value.isTextual()) {
      sb.append('"');
      String text = value.textValue();
      for (int i = 0; i < text.length(); i++) {
        char c = text.charAt(i);
        switch (c) {
          case '"' -> sb.append("\\\"");
          case '\\' -> sb.append("\\\\");
          case '\n' -> sb.append("\\n");
          case '\t' -> sb.append("\\t");
          case '\r' -> sb.append("\\r");
          default -> sb.append(c);
        }
      }
      sb.append('"');
    } else if (value.isBigDecimal()) {
      sb.append(value.decimalValue().toPlainString());
    } else {
      sb.append(value.asText());
    }
  }
}
