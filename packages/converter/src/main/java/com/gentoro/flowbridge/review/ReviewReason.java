package com.gentoro.flowbridge.review;

import com.gentoro.flowbridge.expression.ExpressionIssue;

/** Human-readable reasons attached to review flags. */
public enum ReviewReason {
  PARSE_FAILURE("expression could not be parsed"),
  UNRECOGNIZED_FUNCTION("unrecognized function '%s'"),
  UNRESOLVED_REFERENCE("unresolved reference '%s'"),
  MULTIPLE_PREDECESSORS("multiple predecessors; resolved to first declared connection"),
  EMBEDDED_CODE("embedded code passed through verbatim"),
  TREE_TOO_DEEP("parameter tree too deep");

  private final String template;

  ReviewReason(String template) {
    this.template = template;
  }

  public String describe(String subject) {
    return template.contains("%s") ? String.format(template, subject) : template;
  }

  public String describe() {
    return describe("");
  }

  public static String describe(ExpressionIssue issue) {
    return switch (issue.kind()) {
      case PARSE_FAILURE -> PARSE_FAILURE.describe();
      case UNRECOGNIZED_FUNCTION -> UNRECOGNIZED_FUNCTION.describe(issue.subject());
      case UNRESOLVED_REFERENCE -> UNRESOLVED_REFERENCE.describe(issue.subject());
      case MULTIPLE_PREDECESSORS -> MULTIPLE_PREDECESSORS.describe();
    };
  }
}
