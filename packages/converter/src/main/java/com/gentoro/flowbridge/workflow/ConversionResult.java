package com.gentoro.flowbridge.workflow;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.flowbridge.review.ParameterReview;
import java.util.List;

/**
 * Everything one conversion produced.
 *
 * @param convertedWorkflow the document in the target platform's shape
 * @param logs caller-visible logs, in the order they were recorded
 * @param parametersNeedingReview one entry per node with flagged parameters
 * @param unmappedNodes source ids of nodes emitted as passthrough stubs
 * @param debug diagnostic summary
 */
public record ConversionResult(
    ObjectNode convertedWorkflow,
    List<ConversionLog> logs,
    List<ParameterReview> parametersNeedingReview,
    List<String> unmappedNodes,
    DebugInfo debug) {

  public ConversionResult {
    logs = List.copyOf(logs);
    parametersNeedingReview = List.copyOf(parametersNeedingReview);
    unmappedNodes = List.copyOf(unmappedNodes);
  }

  public boolean hasErrors() {
    return logs.stream().anyMatch(l -> l.level() == LogLevel.ERROR);
  }
}
