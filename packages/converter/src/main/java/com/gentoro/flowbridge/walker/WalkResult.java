package com.gentoro.flowbridge.walker;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Output of one walk.
 *
 * @param value the rewritten tree; same shape and key order as the input
 * @param findings every expression-carrying string, in document order
 * @param warnings non-fatal problems such as abandoned evaluations
 */
public record WalkResult(JsonNode value, List<ExpressionFinding> findings, List<String> warnings) {

  public WalkResult {
    findings = List.copyOf(findings);
    warnings = List.copyOf(warnings);
  }
}
