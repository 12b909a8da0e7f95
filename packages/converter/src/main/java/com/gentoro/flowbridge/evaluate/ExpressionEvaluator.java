package com.gentoro.flowbridge.evaluate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.gentoro.flowbridge.expression.Dialect;
import com.gentoro.flowbridge.expression.ExpressionAst;
import com.gentoro.flowbridge.expression.ExpressionAst.Concatenation;
import com.gentoro.flowbridge.expression.ExpressionAst.FunctionCall;
import com.gentoro.flowbridge.expression.ExpressionAst.Literal;
import com.gentoro.flowbridge.expression.ExpressionAst.PathStep;
import com.gentoro.flowbridge.expression.ExpressionAst.PropertyAccess;
import com.gentoro.flowbridge.expression.ExpressionAst.VariableRoot;
import com.gentoro.flowbridge.expression.ParseOutcome;
import com.gentoro.flowbridge.expression.Segment;
import com.gentoro.flowbridge.expression.Template;
import com.gentoro.flowbridge.translate.FunctionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reduces expressions to concrete JSON values.
 *
 * <p>The context is a JSON object keyed by variable-root names of the dialect the expression is
 * written in ({@code $json}, {@code $env} for n8n; {@code 1}, {@code env} for Make). Property
 * access never fails: a missing path yields {@code null}. Function calls resolve through {@link
 * FunctionTable} to the canonical builtin in the {@link FunctionRegistry}.
 *
 * <p>Every evaluation is bounded by a step budget and a nesting bound; hitting either raises
 * {@link EvaluationException} of kind {@code BUDGET_EXCEEDED}.
 */
public class ExpressionEvaluator {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(ExpressionEvaluator.class);

  public static final int DEFAULT_STEP_BUDGET = 10_000;
  public static final int MAX_RECURSION = 128;

  /** Canonical builtins whose n8n spelling takes different arguments. */
  private static final Map<String, String> N8N_VARIANTS = Map.of("substring", "substr");

  private final FunctionRegistry functions;
  private final Dialect dialect;
  private final int stepBudget;

  public ExpressionEvaluator(FunctionRegistry functions, Dialect dialect) {
    this(functions, dialect, DEFAULT_STEP_BUDGET);
  }

  public ExpressionEvaluator(FunctionRegistry functions, Dialect dialect, int stepBudget) {
    this.functions = Objects.requireNonNull(functions, "functions");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.stepBudget = stepBudget;
  }

  /** Evaluates one expression tree. */
  public JsonNode evaluate(ExpressionAst ast, JsonNode context) {
    return new Run(context).eval(ast, 0);
  }

  /**
   * Evaluates a tokenized parameter string. A string that is exactly one expression yields the
   * native value; otherwise every expression is string-coerced and spliced into the literal text.
   *
   * @throws EvaluationException if any expression fails, including an unparsed block
   */
  public JsonNode evaluate(Template template, JsonNode context) {
    Run run = new Run(context);
    if (template.isSingleExpression()) {
      return run.eval(parsed((Segment.ExpressionSegment) template.segments().get(0)), 0);
    }
    StringBuilder sb = new StringBuilder();
    for (Segment segment : template.segments()) {
      if (segment instanceof Segment.LiteralSegment literal) {
        sb.append(literal.text());
      } else if (segment instanceof Segment.ExpressionSegment expression) {
        sb.append(FunctionRegistry.text(run.eval(parsed(expression), 0)));
      }
    }
    return JsonNodeFactory.instance.textNode(sb.toString());
  }

  /**
   * Evaluates a single expression block of a tokenized string.
   *
   * @throws EvaluationException if the block fails, including when it could not be parsed
   */
  public JsonNode evaluate(Segment.ExpressionSegment segment, JsonNode context) {
    return new Run(context).eval(parsed(segment), 0);
  }

  private static ExpressionAst parsed(Segment.ExpressionSegment segment) {
    if (segment.outcome() instanceof ParseOutcome.Parsed parsed) {
      return parsed.ast();
    }
    ParseOutcome.Unparsed unparsed = (ParseOutcome.Unparsed) segment.outcome();
    throw new EvaluationException(
        EvaluationException.Kind.TYPE_MISMATCH,
        "Cannot evaluate unparsed expression: " + unparsed.reason());
  }

  /** State of one evaluation call. */
  private final class Run {
    private final JsonNode context;
    private int steps = 0;

    Run(JsonNode context) {
      this.context = context == null ? NullNode.getInstance() : context;
    }

    JsonNode eval(ExpressionAst ast, int depth) {
      if (++steps > stepBudget) {
        throw new EvaluationException(
            EvaluationException.Kind.BUDGET_EXCEEDED,
            "Evaluation exceeded " + stepBudget + " steps");
      }
      if (depth > MAX_RECURSION) {
        throw new EvaluationException(
            EvaluationException.Kind.BUDGET_EXCEEDED,
            "Expression nested deeper than " + MAX_RECURSION);
      }
      if (ast instanceof Literal literal) {
        return literal.value();
      }
      if (ast instanceof VariableRoot root) {
        return orNull(context.get(root.name()));
      }
      if (ast instanceof PropertyAccess access) {
        JsonNode current = eval(access.base(), depth + 1);
        for (PathStep step : access.steps()) {
          if (current.isNull()) break;
          if (step instanceof PathStep.Field field) {
            current = field(current, field.name());
          } else if (step instanceof PathStep.Index index) {
            current = index(current, eval(index.key(), depth + 1));
          }
        }
        return current;
      }
      if (ast instanceof FunctionCall call) {
        String canonical =
            FunctionTable.canonicalName(call.name(), dialect)
                .orElseThrow(
                    () ->
                        new EvaluationException(
                            EvaluationException.Kind.UNKNOWN_FUNCTION,
                            "Unknown function '" + call.name() + "'"));
        if (dialect == Dialect.N8N) {
          canonical = N8N_VARIANTS.getOrDefault(canonical, canonical);
        }
        List<JsonNode> args = new ArrayList<>(call.arguments().size());
        for (ExpressionAst arg : call.arguments()) {
          args.add(eval(arg, depth + 1));
        }
        return functions.invoke(canonical, args);
      }
      if (ast instanceof Concatenation concat) {
        StringBuilder sb = new StringBuilder();
        for (ExpressionAst operand : concat.operands()) {
          sb.append(FunctionRegistry.text(eval(operand, depth + 1)));
        }
        return JsonNodeFactory.instance.textNode(sb.toString());
      }
      log.debug("Unsupported expression node {}", ast);
      return NullNode.getInstance();
    }

    private JsonNode field(JsonNode current, String name) {
      if (current.isObject()) return orNull(current.get(name));
      if (current.isArray() && isIndex(name)) return orNull(current.get(Integer.parseInt(name)));
      return NullNode.getInstance();
    }

    private JsonNode index(JsonNode current, JsonNode key) {
      if (current.isArray() && key.canConvertToInt()) {
        return orNull(current.get(key.intValue()));
      }
      if (current.isObject()) {
        return orNull(current.get(FunctionRegistry.text(key)));
      }
      return NullNode.getInstance();
    }
  }

  private static boolean isIndex(String name) {
    if (name.isEmpty() || name.length() > 9) return false;
    for (int i = 0; i < name.length(); i++) {
      if (!Character.isDigit(name.charAt(i))) return false;
    }
    return true;
  }

  private static JsonNode orNull(JsonNode node) {
    return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
  }
}
