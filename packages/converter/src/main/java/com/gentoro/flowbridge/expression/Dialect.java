package com.gentoro.flowbridge.expression;

/**
 * The two templating dialects FlowBridge understands.
 *
 * <ul>
 *   <li>{@link #N8N}: a string starting with the {@code =} sentinel is in expression mode and every
 *       {@code {{ ... }}} block inside it is an expression; outside expression mode only an
 *       embedded {@code ={{ ... }}} is one.
 *   <li>{@link #MAKE}: every bare {@code {{...}}} block is an expression.
 * </ul>
 */
public enum Dialect {
  N8N("=", "{{ ", " }}"),
  MAKE("", "{{", "}}");

  private final String sentinel;
  private final String open;
  private final String close;

  Dialect(String sentinel, String open, String close) {
    this.sentinel = sentinel;
    this.open = open;
    this.close = close;
  }

  /** Prefix that puts a whole string into expression mode (empty for Make). */
  public String sentinel() {
    return sentinel;
  }

  /** Opening delimiter used when rendering a block, including the dialect's padding. */
  public String open() {
    return open;
  }

  /** Closing delimiter used when rendering a block, including the dialect's padding. */
  public String close() {
    return close;
  }

  /**
   * Whether {@code text} already carries this dialect's rendered marker. A repeated translation
   * uses this to leave strings it produced itself untouched.
   */
  public boolean isRenderedForm(String text) {
    if (text == null) return false;
    if (this == N8N) {
      return text.startsWith(sentinel) && text.contains("{{");
    }
    return false;
  }
}
