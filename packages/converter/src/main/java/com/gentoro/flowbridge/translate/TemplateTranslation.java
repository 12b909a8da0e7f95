package com.gentoro.flowbridge.translate;

import com.gentoro.flowbridge.expression.ExpressionIssue;
import com.gentoro.flowbridge.expression.Segment;
import java.util.List;

/**
 * Result of translating a whole parameter string.
 *
 * @param segments translated segments, in the target dialect
 * @param text the rendered target string
 * @param issues issues of every expression in the string, in order of appearance
 */
public record TemplateTranslation(List<Segment> segments, String text, List<ExpressionIssue> issues) {

  public TemplateTranslation {
    segments = List.copyOf(segments);
    issues = List.copyOf(issues);
  }
}
