package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.evaluate.ExpressionEvaluator;
import com.gentoro.flowbridge.evaluate.FunctionRegistry;
import com.gentoro.flowbridge.exception.ExceptionUtil;
import com.gentoro.flowbridge.mapping.MappingResolver;
import com.gentoro.flowbridge.mapping.MappingTable;
import com.gentoro.flowbridge.mapping.ParameterMapper;
import com.gentoro.flowbridge.mapping.Provenance;
import com.gentoro.flowbridge.mapping.Resolution;
import com.gentoro.flowbridge.mapping.TransformationRegistry;
import com.gentoro.flowbridge.model.Connection;
import com.gentoro.flowbridge.model.Platform;
import com.gentoro.flowbridge.model.WorkflowGraph;
import com.gentoro.flowbridge.model.WorkflowNode;
import com.gentoro.flowbridge.review.ReviewFlagger;
import com.gentoro.flowbridge.translate.DialectTranslator;
import com.gentoro.flowbridge.translate.TranslationContext;
import com.gentoro.flowbridge.walker.ParameterTreeWalker;
import com.gentoro.flowbridge.walker.WalkMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Converts a workflow document from one platform to the other.
 *
 * <p>A conversion runs the stages {@code VALIDATE -> MAP_NODES -> CONVERT_CONNECTIONS -> ASSEMBLE
 * -> FINALIZE} once, in that order. Malformed content never makes {@link #convert} throw: a
 * document that fails validation yields the target platform's empty skeleton and an error log,
 * and per-node problems end up in the logs, the review list or the unmapped list of the {@link
 * ConversionResult}.
 *
 * <p>Instances are immutable and may be shared between threads; all per-call state lives inside
 * a single {@code convert} invocation.
 */
public class WorkflowConverter {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(WorkflowConverter.class);

  private final MappingResolver resolver;
  private final ParameterMapper mapper;
  private final Clock clock;

  public WorkflowConverter(MappingTable table) {
    this(table, Clock.systemUTC());
  }

  public WorkflowConverter(MappingTable table, Clock clock) {
    this.resolver = new MappingResolver(Objects.requireNonNull(table, "mapping table"));
    this.mapper = new ParameterMapper(new TransformationRegistry());
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ConversionResult convert(JsonNode document, Platform source, Platform target) {
    return convert(document, source, target, ConversionOptions.defaults());
  }

  /**
   * Converts {@code document}.
   *
   * @param source platform of the document, or {@code null} to detect it
   * @param target platform to convert to
   * @param options per-call settings, {@code null} for defaults
   */
  public ConversionResult convert(
      JsonNode document, Platform source, Platform target, ConversionOptions options) {
    Objects.requireNonNull(target, "target platform");
    return new Conversion(target, options == null ? ConversionOptions.defaults() : options)
        .run(document, source);
  }

  /** State of one call. */
  private final class Conversion {
    final Platform target;
    final ConversionOptions options;
    final ConversionLogCollector logs = new ConversionLogCollector(clock);
    final ReviewFlagger flagger = new ReviewFlagger();
    final List<ConversionStage> stages = new ArrayList<>();
    final List<DebugInfo.MappedNode> mappedNodes = new ArrayList<>();
    final List<DebugInfo.UnmappedNode> unmappedNodes = new ArrayList<>();
    final Map<String, Integer> strategyCounts = new LinkedHashMap<>();
    final List<String> unmapped = new ArrayList<>();
    Platform source;
    int danglingConnections;

    Conversion(Platform target, ConversionOptions options) {
      this.target = target;
      this.options = options;
    }

    ConversionResult run(JsonNode document, Platform requestedSource) {
      // VALIDATE
      stages.add(ConversionStage.VALIDATE);
      JsonNode input = validate(document, requestedSource);
      WorkflowCodec targetCodec = WorkflowCodec.forPlatform(target);
      if (input == null) {
        ObjectNode skeleton = targetCodec.emptySkeleton(nameOf(document));
        return finish(skeleton, List.of(), 0, 0);
      }
      WorkflowGraph graph;
      try {
        graph = WorkflowCodec.forPlatform(source).read(input, logs);
      } catch (RuntimeException e) {
        log.warn("Reading {} workflow failed", source.id(), e);
        logs.error(
            "Could not read " + source.id() + " workflow: " + ExceptionUtil.extractErrorMessage(e));
        return finish(targetCodec.emptySkeleton(nameOf(document)), List.of(), 0, 0);
      }

      // MAP_NODES
      stages.add(ConversionStage.MAP_NODES);
      Map<String, String> idMap = assignIds(graph);
      Map<String, String> names = assignNames(graph);
      List<WorkflowNode> converted = mapNodes(graph, idMap, names);

      // CONVERT_CONNECTIONS
      stages.add(ConversionStage.CONVERT_CONNECTIONS);
      List<Connection> connections = convertConnections(graph, idMap);

      // ASSEMBLE
      stages.add(ConversionStage.ASSEMBLE);
      ObjectNode assembled;
      try {
        assembled = targetCodec.write(graph.getName(), converted, connections, logs);
      } catch (RuntimeException e) {
        log.warn("Assembling {} workflow failed", target.id(), e);
        logs.error(
            "Could not assemble " + target.id() + " workflow: "
                + ExceptionUtil.extractErrorMessage(e));
        assembled = targetCodec.emptySkeleton(graph.getName());
      }

      return finish(assembled, converted, graph.getNodes().size(), connections.size());
    }

    /** Returns the normalized document, or null after logging why it cannot be converted. */
    private JsonNode validate(JsonNode document, Platform requestedSource) {
      if (document == null || !document.isObject()) {
        logs.error("Workflow document must be a JSON object");
        return null;
      }
      source = requestedSource;
      if (source == null) {
        Optional<Platform> detected = PlatformDetector.detect(document);
        if (detected.isEmpty()) {
          logs.error("Could not detect the platform of the workflow document");
          return null;
        }
        source = detected.get();
        logs.info("Detected source platform '" + source.id() + "'");
      }
      if (source == target) {
        logs.error("Source and target platform are both '" + target.id() + "'");
        return null;
      }
      JsonNode input = document;
      if (source == Platform.MAKE && MakeWorkflowCodec.isLegacy(document)) {
        input = MakeWorkflowCodec.normalizeLegacy(document);
        logs.info("Legacy Make blueprint normalized to the flow layout");
      }
      try {
        WorkflowValidator.validate(input, source);
      } catch (WorkflowValidationException e) {
        logs.error("Invalid " + source.id() + " workflow: " + e.getMessage());
        return null;
      }
      return input;
    }

    private List<WorkflowNode> mapNodes(
        WorkflowGraph graph, Map<String, String> idMap, Map<String, String> names) {
      DialectTranslator translator = new DialectTranslator(source.dialect(), target.dialect());
      ExpressionEvaluator evaluator =
          options.getMode() == WalkMode.EVALUATE
              ? new ExpressionEvaluator(
                  new FunctionRegistry(clock), source.dialect(), options.getEvaluationBudget())
              : null;
      ParameterTreeWalker walker =
          new ParameterTreeWalker(translator, evaluator, options.getMaxDepth());
      NodeConverter nodes =
          new NodeConverter(source, target, resolver, mapper, walker, flagger, logs, options);

      Map<String, String> sourceIdsByName = new HashMap<>();
      for (WorkflowNode node : graph.getNodes()) {
        if (node.getName() != null) sourceIdsByName.putIfAbsent(node.getName(), node.getId());
      }
      // how the target dialect refers to each converted node
      Map<String, String> references = target == Platform.MAKE ? idMap : names;
      Map<String, List<String>> predecessors = graph.predecessors();

      List<WorkflowNode> out = new ArrayList<>(graph.getNodes().size());
      for (WorkflowNode node : graph.getNodes()) {
        TranslationContext ctx =
            new TranslationContext(
                node.getId(),
                predecessors.getOrDefault(node.getId(), List.of()),
                sourceIdsByName,
                references);
        NodeConverter.Converted result =
            nodes.convert(node, idMap.get(node.getId()), names.get(node.getId()), ctx);
        WorkflowNode emitted = result.node();
        out.add(emitted);
        strategyCounts.merge(result.strategy().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
        mappedNodes.add(
            new DebugInfo.MappedNode(
                node.getId(), node.getType(), emitted.getType(), result.strategy().name()));
        if (result.strategy() == Resolution.Strategy.PASSTHROUGH) {
          unmappedNodes.add(new DebugInfo.UnmappedNode(node.getId(), node.getType()));
        }
      }
      unmapped.addAll(nodes.unmappedNodes());
      return out;
    }

    private List<Connection> convertConnections(WorkflowGraph graph, Map<String, String> idMap) {
      List<Connection> out = new ArrayList<>(graph.getConnections().size());
      for (Connection c : graph.getConnections()) {
        String from = idMap.get(c.fromNodeId());
        String to = idMap.get(c.toNodeId());
        if (from == null || to == null) {
          danglingConnections++;
          logs.warning(
              "Connection " + c.fromNodeId() + " -> " + c.toNodeId()
                  + " references a node that is not in the workflow; kept with its original reference");
        }
        out.add(
            c.withEndpoints(
                from != null ? from : c.fromNodeId(), to != null ? to : c.toNodeId()));
      }
      return out;
    }

    // FINALIZE
    private ConversionResult finish(
        ObjectNode workflow, List<WorkflowNode> converted, int sourceNodes, int connections) {
      stages.add(ConversionStage.FINALIZE);
      Map<String, Integer> summary = new LinkedHashMap<>();
      summary.put("totalNodes", sourceNodes);
      summary.put("convertedNodes", converted.size());
      summary.put("mappedNodes", strategyCounts.getOrDefault("mapped", 0));
      summary.put("fallbackNodes", strategyCounts.getOrDefault("fallback", 0));
      summary.put("recoveredNodes", strategyCounts.getOrDefault("recovered", 0));
      summary.put("stubNodes", strategyCounts.getOrDefault("passthrough", 0));
      summary.put("totalConnections", connections);
      summary.put("danglingConnections", danglingConnections);
      summary.put("nodesNeedingReview", flagger.reviews().size());
      summary.put("warnings", (int) logs.count(LogLevel.WARNING));
      summary.put("errors", (int) logs.count(LogLevel.ERROR));

      DebugInfo debug =
          new DebugInfo(source, target, stages, mappedNodes, unmappedNodes, summary);
      log.info(
          "Converted workflow '{}' {} -> {}: {} nodes ({} stubs), {} connections, {} nodes to review, {} errors",
          workflow.path("name").asText(""),
          source == null ? "?" : source.id(),
          target.id(),
          converted.size(),
          summary.get("stubNodes"),
          connections,
          summary.get("nodesNeedingReview"),
          summary.get("errors"));
      return new ConversionResult(workflow, logs.logs(), flagger.reviews(), unmapped, debug);
    }

    // ---- identity ----------------------------------------------------------------------------

    /** Source id to target id. */
    private Map<String, String> assignIds(WorkflowGraph graph) {
      Map<String, String> ids = new LinkedHashMap<>();
      if (target == Platform.MAKE) {
        Set<Integer> taken = new HashSet<>();
        // preserved and recovered ids are claimed first so sequential ids fill the gaps
        for (WorkflowNode node : graph.getNodes()) {
          Integer wanted = asModuleId(preferredId(node));
          if (wanted != null && taken.add(wanted)) {
            ids.put(node.getId(), String.valueOf(wanted));
          }
        }
        int next = 1;
        for (WorkflowNode node : graph.getNodes()) {
          if (ids.containsKey(node.getId())) continue;
          while (taken.contains(next)) next++;
          taken.add(next);
          ids.put(node.getId(), String.valueOf(next));
        }
      } else {
        Set<String> taken = new HashSet<>();
        for (WorkflowNode node : graph.getNodes()) {
          String id = preferredId(node);
          if (id == null || taken.contains(id)) {
            String seed = nameOrEmpty(graph.getName()) + "/" + node.getId();
            id = UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
          }
          taken.add(id);
          ids.put(node.getId(), id);
        }
      }
      return ids;
    }

    /** The id to keep on the target when one should be kept, else null. */
    private String preferredId(WorkflowNode node) {
      Optional<Provenance> provenance = recoverable(node);
      if (provenance.isPresent() && provenance.get().originalId() != null) {
        return provenance.get().originalId();
      }
      return options.isPreserveIds() ? node.getId() : null;
    }

    private Integer asModuleId(String id) {
      if (id == null) return null;
      try {
        int value = Integer.parseInt(id);
        return value > 0 ? value : null;
      } catch (NumberFormatException e) {
        return null;
      }
    }

    /** Source id to target name; names are made unique on n8n where connections key on them. */
    private Map<String, String> assignNames(WorkflowGraph graph) {
      Map<String, String> names = new LinkedHashMap<>();
      Set<String> taken = new HashSet<>();
      for (WorkflowNode node : graph.getNodes()) {
        String name =
            recoverable(node)
                .map(Provenance::originalName)
                .orElse(node.getName() != null ? node.getName() : node.getType());
        if (target == Platform.N8N) {
          String base = name;
          int suffix = 1;
          while (taken.contains(name)) {
            name = base + " " + suffix++;
          }
          taken.add(name);
        }
        names.put(node.getId(), name);
      }
      return names;
    }

    private Optional<Provenance> recoverable(WorkflowNode node) {
      return Provenance.read(node.getParameters())
          .filter(p -> target.id().equals(p.originalPlatform()));
    }
  }

  private static String nameOf(JsonNode document) {
    return document != null ? document.path("name").asText(null) : null;
  }

  private static String nameOrEmpty(String name) {
    return name == null ? "" : name;
  }
}
