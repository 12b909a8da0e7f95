package com.gentoro.flowbridge.translate;

import com.gentoro.flowbridge.expression.Dialect;
import com.gentoro.flowbridge.expression.ExpressionAst;
import com.gentoro.flowbridge.expression.ExpressionAst.Concatenation;
import com.gentoro.flowbridge.expression.ExpressionAst.FunctionCall;
import com.gentoro.flowbridge.expression.ExpressionAst.Literal;
import com.gentoro.flowbridge.expression.ExpressionAst.PathStep;
import com.gentoro.flowbridge.expression.ExpressionAst.PropertyAccess;
import com.gentoro.flowbridge.expression.ExpressionAst.VariableRoot;
import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.expression.ExpressionSerializer;
import com.gentoro.flowbridge.expression.ExpressionTokenizer;
import com.gentoro.flowbridge.expression.ParseOutcome;
import com.gentoro.flowbridge.expression.Segment;
import com.gentoro.flowbridge.expression.Template;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rewrites expressions between two dialects.
 *
 * <p>Both directions are total: whatever cannot be mapped is carried over unchanged and reported
 * as an {@link ExpressionIssue}. Variable roots go through {@link RootTable}, function names
 * through {@link FunctionTable}, and graph references through the {@link TranslationContext}:
 *
 * <ul>
 *   <li>n8n {@code $json} becomes the first predecessor's Make id; more than one predecessor is
 *       reported.
 *   <li>n8n {@code $node["Name"].json} becomes the Make id of {@code Name}.
 *   <li>a Make module id becomes {@code $json} when it is the only predecessor, otherwise {@code
 *       $node["Name"].json}.
 * </ul>
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class DialectTranslator {

  private final Dialect source;
  private final Dialect target;

  public DialectTranslator(Dialect source, Dialect target) {
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
  }

  public Dialect source() {
    return source;
  }

  public Dialect target() {
    return target;
  }

  /** Rewrites an expression written in the source dialect into the target dialect. */
  public Translation toTarget(ExpressionAst ast, TranslationContext ctx) {
    return rewrite(ast, ctx, source, target, false);
  }

  /** Rewrites an expression written in the target dialect back into the source dialect. */
  public Translation toSource(ExpressionAst ast, TranslationContext ctx) {
    return rewrite(ast, ctx, target, source, true);
  }

  /**
   * Translates every expression block of a tokenized source string and renders the result in the
   * target dialect. Unparsed blocks are kept as written and reported.
   */
  public TemplateTranslation translate(Template template, TranslationContext ctx) {
    List<Segment> out = new ArrayList<>();
    List<ExpressionIssue> issues = new ArrayList<>();
    boolean anyParsed = false;
    for (Segment segment : template.segments()) {
      if (segment instanceof Segment.ExpressionSegment expression) {
        if (expression.outcome() instanceof ParseOutcome.Parsed parsed) {
          anyParsed = true;
          Translation translation = toTarget(parsed.ast(), ctx);
          issues.addAll(translation.issues());
          out.add(
              new Segment.ExpressionSegment(
                  expression.original(),
                  ExpressionSerializer.render(translation.ast()),
                  new ParseOutcome.Parsed(translation.ast())));
        } else {
          issues.add(ExpressionIssue.parseFailure(expression.original()));
          out.add(expression);
        }
      } else {
        out.add(segment);
      }
    }
    // nothing translatable: keep the string byte for byte
    String text = anyParsed ? ExpressionSerializer.render(out, target) : template.source();
    return new TemplateTranslation(out, text, issues);
  }

  /**
   * Whether {@code text} is already in the target dialect's rendered form, so walking it again
   * must leave it alone. Carrying the n8n marker is not enough: a block that fails to parse as n8n
   * or that uses a Make module id, root or function means the string is still Make text.
   */
  public boolean isAlreadyTranslated(String text) {
    if (!target.isRenderedForm(text)) {
      return false;
    }
    Template rendered = ExpressionTokenizer.tokenize(text, target);
    for (Segment segment : rendered.segments()) {
      if (!(segment instanceof Segment.ExpressionSegment expression)) continue;
      if (!(expression.outcome() instanceof ParseOutcome.Parsed parsed)
          || usesMakeNames(parsed.ast())) {
        return false;
      }
    }
    return rendered.hasExpressions();
  }

  private static boolean usesMakeNames(ExpressionAst ast) {
    if (ast instanceof VariableRoot root) {
      return root.isPositional()
          || RootTable.translate(root.name(), Dialect.MAKE, Dialect.N8N).isPresent();
    }
    if (ast instanceof PropertyAccess access) {
      if (access.base() instanceof Literal literal && literal.value().isNumber()) {
        return true;
      }
      for (PathStep step : access.steps()) {
        if (step instanceof PathStep.Index index && usesMakeNames(index.key())) {
          return true;
        }
      }
      return usesMakeNames(access.base());
    }
    if (ast instanceof FunctionCall call) {
      return FunctionTable.isKnown(call.name(), Dialect.MAKE)
          || call.arguments().stream().anyMatch(DialectTranslator::usesMakeNames);
    }
    if (ast instanceof Concatenation concat) {
      return concat.operands().stream().anyMatch(DialectTranslator::usesMakeNames);
    }
    return false;
  }

  private static Translation rewrite(
      ExpressionAst ast, TranslationContext ctx, Dialect from, Dialect to, boolean backwards) {
    List<ExpressionIssue> issues = new ArrayList<>();
    ExpressionAst result =
        from == to ? ast : new Rewriter(ctx, from, to, backwards, issues).visit(ast);
    return new Translation(result, issues);
  }

  private static final class Rewriter {
    private final TranslationContext ctx;
    private final Dialect from;
    private final Dialect to;
    // true when rewriting target-dialect text back: node references are target-side names
    private final boolean backwards;
    private final List<ExpressionIssue> issues;

    Rewriter(
        TranslationContext ctx,
        Dialect from,
        Dialect to,
        boolean backwards,
        List<ExpressionIssue> issues) {
      this.ctx = ctx;
      this.from = from;
      this.to = to;
      this.backwards = backwards;
      this.issues = issues;
    }

    /** How the output dialect refers to the source node {@code sourceId}. */
    private Optional<String> referenceTo(String sourceId) {
      if (!backwards) {
        return ctx.targetReference(sourceId);
      }
      return to == Dialect.MAKE ? Optional.ofNullable(sourceId) : ctx.nameOf(sourceId);
    }

    /** Source id of the node an n8n {@code $node["name"]} reference names. */
    private Optional<String> sourceIdOfName(String name) {
      return backwards ? ctx.sourceIdOfReference(name) : ctx.sourceIdOf(name);
    }

    /** Source id of the node a Make positional root names. */
    private Optional<String> sourceIdOfModule(String id) {
      return backwards ? ctx.sourceIdOfReference(id) : Optional.of(id);
    }

    ExpressionAst visit(ExpressionAst ast) {
      if (ast instanceof Literal) {
        return ast;
      }
      if (ast instanceof VariableRoot root) {
        return access(root, List.of());
      }
      if (ast instanceof PropertyAccess access) {
        List<PathStep> steps = visitSteps(access.steps());
        if (access.base() instanceof VariableRoot root) {
          return access(root, steps);
        }
        return new PropertyAccess(visit(access.base()), steps);
      }
      if (ast instanceof FunctionCall call) {
        List<ExpressionAst> args = new ArrayList<>();
        for (ExpressionAst arg : call.arguments()) {
          args.add(visit(arg));
        }
        Optional<String> name = FunctionTable.translate(call.name(), from, to);
        if (name.isEmpty()) {
          issues.add(ExpressionIssue.unrecognizedFunction(call.name()));
        }
        return new FunctionCall(name.orElse(call.name()), args);
      }
      if (ast instanceof Concatenation concat) {
        List<ExpressionAst> operands = new ArrayList<>();
        for (ExpressionAst operand : concat.operands()) {
          operands.add(visit(operand));
        }
        return new Concatenation(operands);
      }
      return ast;
    }

    private List<PathStep> visitSteps(List<PathStep> steps) {
      List<PathStep> out = new ArrayList<>(steps.size());
      for (PathStep step : steps) {
        if (step instanceof PathStep.Index index) {
          out.add(new PathStep.Index(visit(index.key())));
        } else {
          out.add(step);
        }
      }
      return out;
    }

    /** Root plus already-translated steps. */
    private ExpressionAst access(VariableRoot root, List<PathStep> steps) {
      if (from == Dialect.N8N) {
        return fromN8n(root, steps);
      }
      return fromMake(root, steps);
    }

    private ExpressionAst fromN8n(VariableRoot root, List<PathStep> steps) {
      if (RootTable.N8N_JSON.equals(root.name())) {
        Optional<String> predecessor = ctx.firstPredecessor();
        Optional<String> reference = predecessor.flatMap(this::referenceTo);
        if (reference.isEmpty()) {
          issues.add(ExpressionIssue.unresolvedReference(root.name()));
          return build(root, steps);
        }
        if (ctx.hasMultiplePredecessors()) {
          issues.add(ExpressionIssue.multiplePredecessors(ctx.nodeId()));
        }
        return build(new VariableRoot(reference.get()), steps);
      }
      if (RootTable.N8N_NODE.equals(root.name())) {
        Optional<String> name = nodeReferenceName(steps);
        Optional<String> reference =
            name.flatMap(this::sourceIdOfName).flatMap(this::referenceTo);
        if (reference.isEmpty()) {
          issues.add(
              ExpressionIssue.unresolvedReference(
                  name.map(n -> "$node[\"" + n + "\"]").orElse(root.name())));
          return build(root, steps);
        }
        return build(new VariableRoot(reference.get()), steps.subList(2, steps.size()));
      }
      return named(root, steps);
    }

    private ExpressionAst fromMake(VariableRoot root, List<PathStep> steps) {
      if (!root.isPositional()) {
        return named(root, steps);
      }
      String id = root.name();
      Optional<String> sourceId = sourceIdOfModule(id);
      boolean onlyPredecessor =
          !ctx.hasMultiplePredecessors()
              && sourceId.isPresent()
              && ctx.firstPredecessor().filter(sourceId.get()::equals).isPresent();
      if (onlyPredecessor) {
        return build(new VariableRoot(RootTable.N8N_JSON), steps);
      }
      Optional<String> name = sourceId.flatMap(this::referenceTo);
      if (name.isEmpty()) {
        issues.add(ExpressionIssue.unresolvedReference(id));
      }
      List<PathStep> nodeSteps = new ArrayList<>();
      nodeSteps.add(new PathStep.Index(Literal.of(name.orElse(id))));
      nodeSteps.add(new PathStep.Field("json"));
      nodeSteps.addAll(steps);
      return new PropertyAccess(new VariableRoot(RootTable.N8N_NODE), nodeSteps);
    }

    private ExpressionAst named(VariableRoot root, List<PathStep> steps) {
      Optional<String> mapped = RootTable.translate(root.name(), from, to);
      if (mapped.isEmpty()) {
        issues.add(ExpressionIssue.unresolvedReference(root.name()));
        return build(root, steps);
      }
      return build(new VariableRoot(mapped.get()), steps);
    }

    /** Node name of a {@code $node["Name"].json} chain, when the steps have that shape. */
    private static Optional<String> nodeReferenceName(List<PathStep> steps) {
      if (steps.size() < 2
          || !(steps.get(0) instanceof PathStep.Index index)
          || !(index.key() instanceof Literal literal)
          || !literal.value().isTextual()
          || !(steps.get(1) instanceof PathStep.Field field)
          || !"json".equals(field.name())) {
        return Optional.empty();
      }
      return Optional.of(literal.value().textValue());
    }

    private static ExpressionAst build(VariableRoot root, List<PathStep> steps) {
      return steps.isEmpty() ? root : new PropertyAccess(root, steps);
    }
  }
}
