package com.gentoro.flowbridge.review;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.walker.ExpressionFinding;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReviewFlaggerTest {

  @Test
  @DisplayName("safe findings are not flagged")
  void safeFindingsIgnored() {
    ReviewFlagger flagger = new ReviewFlagger();
    int flagged =
        flagger.flagFindings("1", List.of(new ExpressionFinding("url", "{{1.url}}", List.of())), null);
    assertEquals(0, flagged);
    assertFalse(flagger.isFlagged("1"));
    assertTrue(flagger.reviews().isEmpty());
  }

  @Test
  @DisplayName("flags aggregate per node with distinct paths and reasons")
  void aggregatesPerNode() {
    ReviewFlagger flagger = new ReviewFlagger();
    List<ExpressionFinding> findings =
        List.of(
            new ExpressionFinding(
                "text",
                "={{ $customFn($json.a) }}",
                List.of(ExpressionIssue.unrecognizedFunction("$customFn"))),
            new ExpressionFinding(
                "subject",
                "={{ $customFn($json.b) }}",
                List.of(ExpressionIssue.unrecognizedFunction("$customFn"))),
            new ExpressionFinding("plain", "={{ $json.c }}", List.of()));

    int flagged = flagger.flagFindings("7", findings, path -> "mapped." + path);
    flagger.flag("7", "code", ReviewReason.EMBEDDED_CODE);

    assertEquals(2, flagged);
    List<ParameterReview> reviews = flagger.reviews();
    assertEquals(1, reviews.size());
    ParameterReview review = reviews.get(0);
    assertEquals("7", review.nodeId());
    assertEquals(List.of("mapped.text", "mapped.subject", "code"), review.parameterPaths());
    assertEquals(
        "unrecognized function '$customFn'; embedded code passed through verbatim",
        review.reason());
  }

  @Test
  @DisplayName("reviews keep the order nodes were first flagged")
  void ordering() {
    ReviewFlagger flagger = new ReviewFlagger();
    flagger.flag("b", "x", ReviewReason.TREE_TOO_DEEP);
    flagger.flag("a", "y", "custom reason");
    flagger.flag("b", "z", ReviewReason.TREE_TOO_DEEP);

    List<ParameterReview> reviews = flagger.reviews();
    assertEquals("b", reviews.get(0).nodeId());
    assertEquals(List.of("x", "z"), reviews.get(0).parameterPaths());
    assertEquals("parameter tree too deep", reviews.get(0).reason());
    assertEquals("a", reviews.get(1).nodeId());
  }

  @Test
  @DisplayName("issue kinds map to readable reasons")
  void describesIssues() {
    assertEquals(
        "unresolved reference '$json'",
        ReviewReason.describe(ExpressionIssue.unresolvedReference("$json")));
    assertEquals(
        "expression could not be parsed",
        ReviewReason.describe(ExpressionIssue.parseFailure("{{ 1. }}")));
    assertEquals(
        "multiple predecessors; resolved to first declared connection",
        ReviewReason.describe(ExpressionIssue.multiplePredecessors("n1")));
  }
}
