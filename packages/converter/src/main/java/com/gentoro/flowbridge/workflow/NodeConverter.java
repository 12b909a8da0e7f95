package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.exception.ExceptionUtil;
import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.mapping.FallbackTemplate;
import com.gentoro.flowbridge.mapping.MappingEntry;
import com.gentoro.flowbridge.mapping.MappingResolver;
import com.gentoro.flowbridge.mapping.ParameterMapper;
import com.gentoro.flowbridge.mapping.ParameterMapper.MappedParameters;
import com.gentoro.flowbridge.mapping.Provenance;
import com.gentoro.flowbridge.mapping.Resolution;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.model.WorkflowNode;
import com.gentoro.flowbridge.review.ReviewFlagger;
import com.gentoro.flowbridge.review.ReviewReason;
import com.gentoro.flowbridge.translate.TranslationContext;
import com.gentoro.flowbridge.utility.ParameterPaths;
import com.gentoro.flowbridge.walker.ExpressionFinding;
import com.gentoro.flowbridge.walker.ParameterDepthExceededException;
import com.gentoro.flowbridge.walker.ParameterTreeWalker;
import com.gentoro.flowbridge.walker.WalkResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Converts one node at a time for a single conversion call: resolves its target type, rewrites
 * its parameters, records review flags and conversion logs. Holds per-call state; not
 * thread-safe.
 */
class NodeConverter {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(NodeConverter.class);

  private static final String RULES = "rules";
  private static final String CONDITIONS = "conditions";

  /** What became of one source node. */
  record Converted(WorkflowNode node, Resolution.Strategy strategy) {}

  private final Platform source;
  private final Platform target;
  private final MappingResolver resolver;
  private final ParameterMapper mapper;
  private final ParameterTreeWalker walker;
  private final ReviewFlagger flagger;
  private final ConversionLogCollector logs;
  private final ConversionOptions options;
  private final List<String> unmapped = new ArrayList<>();

  NodeConverter(
      Platform source,
      Platform target,
      MappingResolver resolver,
      ParameterMapper mapper,
      ParameterTreeWalker walker,
      ReviewFlagger flagger,
      ConversionLogCollector logs,
      ConversionOptions options) {
    this.source = source;
    this.target = target;
    this.resolver = resolver;
    this.mapper = mapper;
    this.walker = walker;
    this.flagger = flagger;
    this.logs = logs;
    this.options = options;
  }

  /** Source ids of nodes emitted as stubs, in the order they were converted. */
  List<String> unmappedNodes() {
    return List.copyOf(unmapped);
  }

  /**
   * Converts {@code node}. Never throws for node content: anything unexpected becomes an error log
   * and a stub, so every source node yields exactly one target node.
   */
  Converted convert(WorkflowNode node, String targetId, String targetName, TranslationContext ctx) {
    try {
      Resolution resolution = resolver.resolve(node, source, target);
      return switch (resolution.strategy()) {
        case MAPPED -> mapped(node, resolution.entry(), targetId, targetName, ctx);
        case FALLBACK -> fallback(node, resolution.fallback(), targetId, targetName, ctx);
        case RECOVERED -> recovered(node, resolution, targetId, targetName, ctx);
        case PASSTHROUGH -> stub(node, targetId, targetName);
      };
    } catch (RuntimeException e) {
      log.error("Unexpected failure converting node '{}'", node.getId(), e);
      logs.error(
          "Node '" + node.getId() + "' could not be converted ("
              + ExceptionUtil.extractErrorMessage(e) + "); emitted as a stub");
      return stub(node, targetId, targetName);
    }
  }

  private Converted mapped(
      WorkflowNode node,
      MappingEntry entry,
      String targetId,
      String targetName,
      TranslationContext ctx) {
    ObjectNode params = withoutRouterRules(node, entry.targetType());
    Set<String> verbatim = new HashSet<>(entry.verbatimPaths());
    WalkResult walked;
    try {
      walked = walk(node, params, ctx, verbatim);
    } catch (ParameterDepthExceededException e) {
      return tooDeep(
          node, entry.targetType(), targetId, targetName, Resolution.Strategy.MAPPED, e);
    }
    MappedParameters mapped =
        mapper.apply(entry, (ObjectNode) walked.value(), options.isCopyUnmappedParameters());
    report(node, walked, mapped::targetPath);
    for (String path : entry.verbatimPaths()) {
      if (ParameterPaths.get(params, path) != null) {
        flagger.flag(node.getId(), mapped.targetPath(path), ReviewReason.EMBEDDED_CODE);
        logs.warning(
            "Node '" + node.getId() + "' carries embedded code at '" + path
                + "'; copied verbatim, review required");
      }
    }
    WorkflowNode.Builder out = base(node, entry.targetType(), targetId, targetName)
        .parameters(mapped.parameters());
    convertRouter(node, entry.targetType(), out, mapped.parameters(), ctx);
    return new Converted(out.build(), Resolution.Strategy.MAPPED);
  }

  private Converted fallback(
      WorkflowNode node,
      FallbackTemplate template,
      String targetId,
      String targetName,
      TranslationContext ctx) {
    ObjectNode params = withoutRouterRules(node, template.targetType());
    WalkResult walked;
    try {
      walked = walk(node, params, ctx, Set.of());
    } catch (ParameterDepthExceededException e) {
      return tooDeep(
          node, template.targetType(), targetId, targetName, Resolution.Strategy.FALLBACK, e);
    }
    MappedParameters mapped =
        mapper.apply(
            (ObjectNode) walked.value(),
            template.parameterPathMap(),
            Map.of(),
            Map.of(),
            options.isCopyUnmappedParameters());
    report(node, walked, mapped::targetPath);
    ObjectNode parameters = mapped.parameters();
    parameters.set(
        Provenance.KEY,
        provenance(node, Provenance.FALLBACK_PREFIX + template.category()).toJson());
    logs.warning(
        "No mapping for type '" + node.getType() + "' (node '" + node.getId()
            + "'); converted with the generic '" + template.category() + "' template");
    WorkflowNode.Builder out =
        base(node, template.targetType(), targetId, targetName).parameters(parameters);
    convertRouter(node, template.targetType(), out, parameters, ctx);
    return new Converted(out.build(), Resolution.Strategy.FALLBACK);
  }

  private Converted recovered(
      WorkflowNode node,
      Resolution resolution,
      String targetId,
      String targetName,
      TranslationContext ctx) {
    Provenance provenance = resolution.provenance();
    ObjectNode params = node.getParameters().deepCopy();
    params.remove(Provenance.KEY);
    ObjectNode parameters = params;
    if (provenance.isFallback()) {
      WalkResult walked;
      try {
        walked = walk(node, params, ctx, Set.of());
      } catch (ParameterDepthExceededException e) {
        return tooDeep(
            node,
            provenance.originalType(),
            targetId,
            targetName,
            Resolution.Strategy.RECOVERED,
            e);
      }
      if (resolution.fallback() != null) {
        Map<String, String> inverse =
            ParameterMapper.invert(resolution.fallback().parameterPathMap());
        MappedParameters mapped =
            mapper.apply((ObjectNode) walked.value(), inverse, Map.of(), Map.of(), true);
        report(node, walked, mapped::targetPath);
        parameters = mapped.parameters();
      } else {
        report(node, walked, UnaryOperator.identity());
        parameters = (ObjectNode) walked.value();
        logs.warning(
            "Fallback template '" + provenance.fallbackCategory() + "' is unknown; node '"
                + node.getId() + "' restored with its parameters as they are");
      }
    }
    logs.info(
        "Node '" + node.getId() + "' restored to its original type '"
            + provenance.originalType() + "'");
    WorkflowNode restored =
        base(node, provenance.originalType(), targetId, targetName).parameters(parameters).build();
    return new Converted(restored, Resolution.Strategy.RECOVERED);
  }

  /** Stub of the target's unknown-marker type carrying the original parameters untouched. */
  private Converted stub(WorkflowNode node, String targetId, String targetName) {
    ObjectNode parameters = node.getParameters().deepCopy();
    parameters.set(Provenance.KEY, provenance(node, Provenance.PASSTHROUGH).toJson());
    if (!unmapped.contains(node.getId())) {
      unmapped.add(node.getId());
      logs.warning(
          "No mapping for type '" + node.getType() + "' (node '" + node.getId()
              + "'); emitted as " + target.unknownMarkerType() + " stub");
    }
    WorkflowNode stub =
        base(node, target.unknownMarkerType(), targetId, targetName).parameters(parameters).build();
    return new Converted(stub, Resolution.Strategy.PASSTHROUGH);
  }

  private Converted tooDeep(
      WorkflowNode node,
      String targetType,
      String targetId,
      String targetName,
      Resolution.Strategy strategy,
      ParameterDepthExceededException e) {
    flagger.flag(node.getId(), e.getPath(), ReviewReason.TREE_TOO_DEEP);
    logs.warning(
        "Parameters of node '" + node.getId() + "' nest deeper than " + e.getLimit()
            + " levels; copied verbatim");
    WorkflowNode out =
        base(node, targetType, targetId, targetName)
            .parameters(node.getParameters().deepCopy())
            .build();
    return new Converted(out, strategy);
  }

  private WalkResult walk(
      WorkflowNode node, JsonNode params, TranslationContext ctx, Set<String> verbatim) {
    WalkResult walked =
        walker.walk(params, options.getMode(), ctx, options.getEvaluationContext(), verbatim);
    for (String warning : walked.warnings()) {
      logs.warning("Node '" + node.getId() + "': " + warning);
    }
    return walked;
  }

  /** Flags unsafe findings and logs the ones that failed to parse. */
  private void report(
      WorkflowNode node, WalkResult walked, UnaryOperator<String> pathMapper) {
    flagger.flagFindings(node.getId(), walked.findings(), pathMapper);
    for (ExpressionFinding finding : walked.findings()) {
      for (ExpressionIssue issue : finding.issues()) {
        if (issue.kind() == ExpressionIssue.Kind.PARSE_FAILURE) {
          logs.warning(
              "Expression at '" + finding.path() + "' of node '" + node.getId()
                  + "' could not be parsed; kept verbatim");
          break;
        }
      }
    }
  }

  private WorkflowNode.Builder base(
      WorkflowNode node, String type, String targetId, String targetName) {
    return WorkflowNode.builder()
        .id(targetId)
        .name(targetName)
        .type(type)
        .position(node.getPosition())
        .credentials(node.getCredentials().deepCopy())
        .disabled(node.isDisabled());
  }

  private Provenance provenance(WorkflowNode node, String strategy) {
    return new Provenance(node.getType(), node.getId(), node.getName(), source.id(), strategy);
  }

  // ---- router <-> switch -------------------------------------------------------------------

  private boolean isMakeRouterTarget(String targetType) {
    return target == Platform.MAKE && MakeWorkflowCodec.ROUTER_TYPE.equals(targetType);
  }

  /** Switch rules become route conditions on Make, so they are walked apart from the rest. */
  private ObjectNode withoutRouterRules(WorkflowNode node, String targetType) {
    ObjectNode params = node.getParameters().deepCopy();
    if (isMakeRouterTarget(targetType)) {
      params.remove(RULES);
    }
    return params;
  }

  private void convertRouter(
      WorkflowNode node,
      String targetType,
      WorkflowNode.Builder out,
      ObjectNode parameters,
      TranslationContext ctx) {
    if (isMakeRouterTarget(targetType)) {
      ArrayNode routes = JsonNodeFactory.instance.arrayNode();
      for (JsonNode rule : node.getParameters().path(RULES).path(CONDITIONS)) {
        ObjectNode condition = routes.addObject().putObject("condition");
        // a rule without an operation is the catch-all route
        if (!rule.has("operation")) continue;
        condition.put("operator", "equal".equals(rule.path("operation").asText()) ? "eq" : "neq");
        condition.set("left", rule.path("value1").deepCopy());
        condition.set("right", rule.path("value2").deepCopy());
      }
      List<JsonNode> conditions = new ArrayList<>();
      for (JsonNode route : walkConditions(node, routes, "routes", ctx)) {
        conditions.add(route.get("condition"));
      }
      out.routeConditions(conditions);
    } else if (target == Platform.N8N && !node.getRouteConditions().isEmpty()) {
      ArrayNode rules = JsonNodeFactory.instance.arrayNode();
      for (JsonNode condition : node.getRouteConditions()) {
        ObjectNode rule = rules.addObject();
        if (!condition.has("operator")) continue;
        rule.put("operation", "eq".equals(condition.path("operator").asText()) ? "equal" : "notEqual");
        rule.set("value1", condition.path("left").deepCopy());
        rule.set("value2", condition.path("right").deepCopy());
      }
      ObjectNode ruleHolder =
          parameters.path(RULES).isObject()
              ? (ObjectNode) parameters.get(RULES)
              : parameters.putObject(RULES);
      ruleHolder.set(CONDITIONS, walkConditions(node, rules, "rules.conditions", ctx));
    }
  }

  private JsonNode walkConditions(
      WorkflowNode node,
      ArrayNode conditions,
      String prefix,
      TranslationContext ctx) {
    try {
      WalkResult walked = walk(node, conditions, ctx, Set.of());
      report(node, walked, path -> prefix + path);
      return walked.value();
    } catch (ParameterDepthExceededException e) {
      flagger.flag(node.getId(), prefix + e.getPath(), ReviewReason.TREE_TOO_DEEP);
      logs.warning("Route conditions of node '" + node.getId() + "' are too deep; copied verbatim");
      return conditions;
    }
  }
}
