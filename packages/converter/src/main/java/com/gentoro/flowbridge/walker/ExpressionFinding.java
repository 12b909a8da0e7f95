package com.gentoro.flowbridge.walker;

import com.gentoro.flowbridge.expression.ExpressionIssue;
import java.util.List;

/**
 * One string leaf that carried at least one expression.
 *
 * @param path location in the parameter tree, e.g. {@code options.headers[0].value}
 * @param raw the original string
 * @param issues everything that keeps the rewrite from being mechanically safe
 */
public record ExpressionFinding(String path, String raw, List<ExpressionIssue> issues) {

  public ExpressionFinding {
    issues = List.copyOf(issues);
  }

  public boolean needsReview() {
    return !issues.isEmpty();
  }
}
