package com.gentoro.flowbridge.review;

import java.util.List;

/**
 * Parameters of one node whose conversion could not be guaranteed mechanically.
 *
 * @param nodeId id of the node in the source workflow, as in {@code unmappedNodes}; paths refer to
 *     the converted parameters
 * @param parameterPaths flagged parameter paths, in first-seen order
 * @param reason distinct reasons joined with {@code "; "}
 */
public record ParameterReview(String nodeId, List<String> parameterPaths, String reason) {

  public ParameterReview {
    parameterPaths = List.copyOf(parameterPaths);
  }
}
