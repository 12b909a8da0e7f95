package com.gentoro.flowbridge.expression;

/** Result of parsing one expression body. Parsing never throws; failures become {@link Unparsed}. */
public sealed interface ParseOutcome {

  record Parsed(ExpressionAst ast) implements ParseOutcome {}

  record Unparsed(String raw, String reason) implements ParseOutcome {}

  default boolean isParsed() {
    return this instanceof Parsed;
  }
}
