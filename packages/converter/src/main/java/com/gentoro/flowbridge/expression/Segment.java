package com.gentoro.flowbridge.expression;

/** A piece of a tokenized parameter string. */
public sealed interface Segment {

  /** Text outside any expression block, preserved byte-for-byte. */
  record LiteralSegment(String text) implements Segment {}

  /**
   * One expression block.
   *
   * @param original the block exactly as it appeared, delimiters and sentinel included
   * @param body the text between the delimiters
   * @param outcome the parse result for {@code body}
   */
  record ExpressionSegment(String original, String body, ParseOutcome outcome) implements Segment {}
}
