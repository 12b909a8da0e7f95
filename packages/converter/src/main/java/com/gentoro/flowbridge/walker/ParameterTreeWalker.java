package com.gentoro.flowbridge.walker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.gentoro.flowbridge.evaluate.EvaluationException;
import com.gentoro.flowbridge.evaluate.ExpressionEvaluator;
import com.gentoro.flowbridge.evaluate.FunctionRegistry;
import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.expression.ExpressionSerializer;
import com.gentoro.flowbridge.expression.ExpressionTokenizer;
import com.gentoro.flowbridge.expression.Segment;
import com.gentoro.flowbridge.expression.Template;
import com.gentoro.flowbridge.translate.DialectTranslator;
import com.gentoro.flowbridge.translate.TemplateTranslation;
import com.gentoro.flowbridge.translate.TranslationContext;
import com.gentoro.flowbridge.utility.ParameterPaths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies the translator or the evaluator to every string leaf of a parameter tree.
 *
 * <p>Only strings are inspected; numbers, booleans, nulls and container shapes are copied as they
 * are, with object key order and array order preserved. Strings already in the target dialect's
 * rendered form are left alone so that walking an already translated tree is a no-op. Subtrees
 * listed as verbatim are copied without looking inside.
 *
 * <p>Instances are immutable; the evaluator is optional and only needed for {@link
 * WalkMode#EVALUATE}.
 */
public class ParameterTreeWalker {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(ParameterTreeWalker.class);

  public static final int DEFAULT_MAX_DEPTH = 32;

  private final DialectTranslator translator;
  private final ExpressionEvaluator evaluator;
  private final int maxDepth;

  public ParameterTreeWalker(DialectTranslator translator) {
    this(translator, null, DEFAULT_MAX_DEPTH);
  }

  public ParameterTreeWalker(
      DialectTranslator translator, ExpressionEvaluator evaluator, int maxDepth) {
    this.translator = Objects.requireNonNull(translator, "translator");
    this.evaluator = evaluator;
    this.maxDepth = maxDepth;
  }

  public WalkResult walk(JsonNode value, WalkMode mode, TranslationContext ctx) {
    return walk(value, mode, ctx, null, Set.of());
  }

  /**
   * Walks {@code value}.
   *
   * @param evaluationContext variable bindings for {@link WalkMode#EVALUATE}
   * @param verbatimPaths paths whose subtrees are copied untouched
   * @throws ParameterDepthExceededException if the tree nests deeper than the configured limit
   */
  public WalkResult walk(
      JsonNode value,
      WalkMode mode,
      TranslationContext ctx,
      JsonNode evaluationContext,
      Set<String> verbatimPaths) {
    if (mode == WalkMode.EVALUATE && evaluator == null) {
      throw new IllegalStateException("EVALUATE mode requires an evaluator");
    }
    Walk walk = new Walk(mode, ctx, evaluationContext, verbatimPaths);
    JsonNode out = walk.visit(value, "", 0);
    return new WalkResult(out, walk.findings, walk.warnings);
  }

  private final class Walk {
    final WalkMode mode;
    final TranslationContext ctx;
    final JsonNode evaluationContext;
    final Set<String> verbatimPaths;
    final List<ExpressionFinding> findings = new ArrayList<>();
    final List<String> warnings = new ArrayList<>();

    Walk(
        WalkMode mode,
        TranslationContext ctx,
        JsonNode evaluationContext,
        Set<String> verbatimPaths) {
      this.mode = mode;
      this.ctx = ctx == null ? TranslationContext.detached() : ctx;
      this.evaluationContext = evaluationContext;
      this.verbatimPaths = verbatimPaths == null ? Set.of() : verbatimPaths;
    }

    JsonNode visit(JsonNode node, String path, int depth) {
      if (node == null || node.isNull()) {
        return JsonNodeFactory.instance.nullNode();
      }
      if (depth > maxDepth) {
        throw new ParameterDepthExceededException(path, maxDepth);
      }
      if (!path.isEmpty() && verbatimPaths.contains(path)) {
        return node.deepCopy();
      }
      if (node.isTextual()) {
        return visitString(node.textValue(), path);
      }
      if (node.isArray()) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        for (int i = 0; i < node.size(); i++) {
          out.add(visit(node.get(i), ParameterPaths.index(path, i), depth + 1));
        }
        return out;
      }
      if (node.isObject()) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
          Map.Entry<String, JsonNode> e = it.next();
          out.set(e.getKey(), visit(e.getValue(), ParameterPaths.child(path, e.getKey()), depth + 1));
        }
        return out;
      }
      // numbers, booleans, binary
      return node.deepCopy();
    }

    private JsonNode visitString(String text, String path) {
      if (translator.isAlreadyTranslated(text)) {
        return TextNode.valueOf(text);
      }
      Template template = ExpressionTokenizer.tokenize(text, translator.source());
      if (!template.hasExpressions()) {
        return TextNode.valueOf(text);
      }
      TemplateTranslation translation = translator.translate(template, ctx);
      if (mode == WalkMode.TRANSLATE) {
        findings.add(new ExpressionFinding(path, text, translation.issues()));
        return TextNode.valueOf(translation.text());
      }
      if (template.isSingleExpression()) {
        Segment.ExpressionSegment only = (Segment.ExpressionSegment) template.segments().get(0);
        try {
          JsonNode value = evaluator.evaluate(only, evaluationContext);
          findings.add(new ExpressionFinding(path, text, List.of()));
          return value.deepCopy();
        } catch (EvaluationException e) {
          abandoned(path, only, e);
          findings.add(new ExpressionFinding(path, text, translation.issues()));
          return TextNode.valueOf(translation.text());
        }
      }
      // each block on its own: a failing block keeps its translation, the rest are spliced in
      List<Segment> out = new ArrayList<>();
      List<ExpressionIssue> issues = new ArrayList<>();
      for (int i = 0; i < template.segments().size(); i++) {
        Segment segment = template.segments().get(i);
        if (!(segment instanceof Segment.ExpressionSegment expression)) {
          out.add(segment);
          continue;
        }
        try {
          JsonNode value = evaluator.evaluate(expression, evaluationContext);
          out.add(new Segment.LiteralSegment(FunctionRegistry.text(value)));
        } catch (EvaluationException e) {
          abandoned(path, expression, e);
          out.add(translation.segments().get(i));
          issues.addAll(
              translator
                  .translate(
                      new Template(
                          template.dialect(), expression.original(), true, List.of(expression)),
                      ctx)
                  .issues());
        }
      }
      findings.add(new ExpressionFinding(path, text, issues));
      return TextNode.valueOf(ExpressionSerializer.render(out, translator.target()));
    }

    private void abandoned(String path, Segment.ExpressionSegment expression, EvaluationException e) {
      String warning =
          "Evaluation of '" + path + "' block " + expression.original() + " abandoned ("
              + e.getKind() + "): " + e.getMessage();
      log.debug(warning);
      warnings.add(warning);
    }
  }
}
