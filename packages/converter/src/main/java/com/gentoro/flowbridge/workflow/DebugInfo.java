package com.gentoro.flowbridge.workflow;

import com.gentoro.flowbridge.model.Platform;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diagnostic view of one conversion.
 *
 * @param stages stages that ran, in order
 * @param mappedNodes every emitted node with the strategy that produced it
 * @param unmappedNodes source nodes that became passthrough stubs
 * @param summary counters ({@code totalNodes}, {@code mappedNodes}, {@code stubNodes}, ...)
 */
public record DebugInfo(
    Platform sourcePlatform,
    Platform targetPlatform,
    List<ConversionStage> stages,
    List<MappedNode> mappedNodes,
    List<UnmappedNode> unmappedNodes,
    Map<String, Integer> summary) {

  public DebugInfo {
    stages = List.copyOf(stages);
    mappedNodes = List.copyOf(mappedNodes);
    unmappedNodes = List.copyOf(unmappedNodes);
    summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
  }

  public record MappedNode(String id, String type, String mappedType, String strategy) {}

  public record UnmappedNode(String id, String type) {}
}
