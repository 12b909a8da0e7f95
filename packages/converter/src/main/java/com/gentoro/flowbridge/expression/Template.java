package com.gentoro.flowbridge.expression;

import java.util.List;

/**
 * A parameter string split into literal and expression segments.
 *
 * @param dialect dialect the string was tokenized with
 * @param source the original string
 * @param expressionMode whether the string carried the dialect's whole-string sentinel
 * @param segments ordered segments; concatenating their original text yields {@code source}
 */
public record Template(
    Dialect dialect, String source, boolean expressionMode, List<Segment> segments) {

  public Template {
    segments = List.copyOf(segments);
  }

  public boolean hasExpressions() {
    for (Segment segment : segments) {
      if (segment instanceof Segment.ExpressionSegment) return true;
    }
    return false;
  }

  /** Exactly one expression segment and no surrounding literal text. */
  public boolean isSingleExpression() {
    return segments.size() == 1 && segments.get(0) instanceof Segment.ExpressionSegment;
  }
}
