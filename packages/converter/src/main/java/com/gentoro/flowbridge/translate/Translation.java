package com.gentoro.flowbridge.translate;

import com.gentoro.flowbridge.expression.ExpressionAst;
import com.gentoro.flowbridge.expression.ExpressionIssue;
import java.util.List;

/** A rewritten expression together with everything that could not be mapped mechanically. */
public record Translation(ExpressionAst ast, List<ExpressionIssue> issues) {

  public Translation {
    issues = List.copyOf(issues);
  }

  public boolean isSafe() {
    return issues.isEmpty();
  }
}
