package com.gentoro.flowbridge.expression;

/**
 * Something about one expression that prevents a mechanical guarantee of correctness.
 *
 * @param kind what went wrong
 * @param subject the offending function name, root or raw text
 */
public record ExpressionIssue(Kind kind, String subject) {

  public enum Kind {
    PARSE_FAILURE,
    UNRECOGNIZED_FUNCTION,
    UNRESOLVED_REFERENCE,
    MULTIPLE_PREDECESSORS
  }

  public static ExpressionIssue parseFailure(String raw) {
    return new ExpressionIssue(Kind.PARSE_FAILURE, raw);
  }

  public static ExpressionIssue unrecognizedFunction(String name) {
    return new ExpressionIssue(Kind.UNRECOGNIZED_FUNCTION, name);
  }

  public static ExpressionIssue unresolvedReference(String root) {
    return new ExpressionIssue(Kind.UNRESOLVED_REFERENCE, root);
  }

  public static ExpressionIssue multiplePredecessors(String nodeId) {
    return new ExpressionIssue(Kind.MULTIPLE_PREDECESSORS, nodeId);
  }
}
