package com.gentoro.flowbridge.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a parameter string into literal and expression {@link Segment}s.
 *
 * <p>Scanning is character based. Inside a block, quotes, backslash escapes and nested braces are
 * tracked so that a {@code }}} inside a string literal does not close the block. An unterminated
 * block swallows the rest of the string and is reported as {@link ParseOutcome.Unparsed}.
 */
public final class ExpressionTokenizer {

  private static final String OPEN = "{{";
  private static final String CLOSE = "}}";

  private ExpressionTokenizer() {}

  public static Template tokenize(String text, Dialect dialect) {
    if (text == null || text.isEmpty()) {
      return new Template(dialect, text == null ? "" : text, false, List.of());
    }
    if (dialect == Dialect.N8N && text.startsWith(dialect.sentinel())) {
      String body = text.substring(dialect.sentinel().length());
      List<Segment> segments = scan(body, dialect, OPEN);
      if (containsExpression(segments)) {
        return new Template(dialect, text, true, segments);
      }
      // "=" with no block is plain text
      return new Template(dialect, text, false, List.of(new Segment.LiteralSegment(text)));
    }
    String marker = dialect == Dialect.N8N ? dialect.sentinel() + OPEN : OPEN;
    return new Template(dialect, text, false, scan(text, dialect, marker));
  }

  private static List<Segment> scan(String text, Dialect dialect, String marker) {
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < text.length()) {
      if (!text.startsWith(marker, i)) {
        literal.append(text.charAt(i++));
        continue;
      }
      int bodyStart = i + marker.length();
      int end = findClose(text, bodyStart);
      if (literal.length() > 0) {
        segments.add(new Segment.LiteralSegment(literal.toString()));
        literal.setLength(0);
      }
      if (end < 0) {
        String rest = text.substring(i);
        segments.add(
            new Segment.ExpressionSegment(
                rest,
                text.substring(bodyStart),
                new ParseOutcome.Unparsed(rest, "unterminated expression block")));
        return segments;
      }
      String body = text.substring(bodyStart, end);
      String original = text.substring(i, end + CLOSE.length());
      segments.add(
          new Segment.ExpressionSegment(original, body, ExpressionParser.parse(body, dialect)));
      i = end + CLOSE.length();
    }
    if (literal.length() > 0) {
      segments.add(new Segment.LiteralSegment(literal.toString()));
    }
    return segments;
  }

  /** Index of the closing {@code }}} matching a block whose body starts at {@code from}. */
  private static int findClose(String text, int from) {
    int depth = 0;
    char quote = 0;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      switch (c) {
        case '"', '\'', '`' -> quote = c;
        case '{' -> depth++;
        case '}' -> {
          if (depth > 0) {
            depth--;
          } else if (text.startsWith(CLOSE, i)) {
            return i;
          }
        }
        default -> {
          // plain body character
        }
      }
    }
    return -1;
  }

  private static boolean containsExpression(List<Segment> segments) {
    for (Segment segment : segments) {
      if (segment instanceof Segment.ExpressionSegment) return true;
    }
    return false;
  }
}
