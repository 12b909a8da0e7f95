package com.gentoro.flowbridge.review;

import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.walker.ExpressionFinding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Collects review flags for one conversion and aggregates them into one {@link ParameterReview}
 * per node.
 *
 * <p>An expression is safe when it parsed, every function name was found in the function table
 * and every variable root resolved. Anything else is flagged. Not thread-safe; use one instance
 * per conversion.
 */
public class ReviewFlagger {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(ReviewFlagger.class);

  private final Map<String, Flags> byNode = new LinkedHashMap<>();

  public static boolean isSafe(ExpressionFinding finding) {
    return !finding.needsReview();
  }

  /**
   * Flags every finding that needs review.
   *
   * @param pathMapper maps a source parameter path to the path reported for the converted node
   * @return number of findings flagged
   */
  public int flagFindings(
      String nodeId, List<ExpressionFinding> findings, UnaryOperator<String> pathMapper) {
    int flagged = 0;
    for (ExpressionFinding finding : findings) {
      if (isSafe(finding)) continue;
      String path = pathMapper == null ? finding.path() : pathMapper.apply(finding.path());
      for (ExpressionIssue issue : finding.issues()) {
        flag(nodeId, path, ReviewReason.describe(issue));
      }
      flagged++;
    }
    return flagged;
  }

  public void flag(String nodeId, String path, ReviewReason reason) {
    flag(nodeId, path, reason.describe());
  }

  public void flag(String nodeId, String path, String reason) {
    log.debug("Review flag on node '{}' at '{}': {}", nodeId, path, reason);
    Flags flags = byNode.computeIfAbsent(nodeId, k -> new Flags());
    if (path != null) flags.paths.add(path);
    flags.reasons.add(reason);
  }

  public boolean isFlagged(String nodeId) {
    return byNode.containsKey(nodeId);
  }

  /** One review per flagged node, in the order nodes were first flagged. */
  public List<ParameterReview> reviews() {
    List<ParameterReview> out = new ArrayList<>(byNode.size());
    for (Map.Entry<String, Flags> e : byNode.entrySet()) {
      out.add(
          new ParameterReview(
              e.getKey(),
              new ArrayList<>(e.getValue().paths),
              String.join("; ", e.getValue().reasons)));
    }
    return out;
  }

  private static final class Flags {
    final Set<String> paths = new LinkedHashSet<>();
    final Set<String> reasons = new LinkedHashSet<>();
  }
}
