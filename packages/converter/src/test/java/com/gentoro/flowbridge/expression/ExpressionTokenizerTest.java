package com.gentoro.flowbridge.expression;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpressionTokenizerTest {

  @Test
  @DisplayName("n8n sentinel string with literal text around two blocks")
  void n8nMultipleBlocks() {
    Template template =
        ExpressionTokenizer.tokenize("=Hi {{ $json.first }} {{ $json.last }}!", Dialect.N8N);
    assertTrue(template.expressionMode());
    List<Segment> segments = template.segments();
    assertEquals(5, segments.size());
    assertEquals(new Segment.LiteralSegment("Hi "), segments.get(0));
    Segment.ExpressionSegment first =
        assertInstanceOf(Segment.ExpressionSegment.class, segments.get(1));
    assertEquals("{{ $json.first }}", first.original());
    assertEquals(new Segment.LiteralSegment("!"), segments.get(4));
  }

  @Test
  @DisplayName("n8n string without the sentinel only treats ={{ }} as an expression")
  void n8nEmbeddedOnly() {
    Template plain = ExpressionTokenizer.tokenize("price {{ not an expression }}", Dialect.N8N);
    assertFalse(plain.hasExpressions());

    Template embedded = ExpressionTokenizer.tokenize("id: ={{ $json.id }}", Dialect.N8N);
    assertTrue(embedded.hasExpressions());
    assertEquals(new Segment.LiteralSegment("id: "), embedded.segments().get(0));
  }

  @Test
  @DisplayName("a lone = without blocks is plain text")
  void sentinelWithoutBlocks() {
    Template template = ExpressionTokenizer.tokenize("=total", Dialect.N8N);
    assertFalse(template.hasExpressions());
    assertEquals(List.of(new Segment.LiteralSegment("=total")), template.segments());
  }

  @Test
  @DisplayName("closing braces inside a string literal do not end the block")
  void bracesInsideQuotes() {
    Template template = ExpressionTokenizer.tokenize("{{upper(\"}}\")}} done", Dialect.MAKE);
    assertFalse(template.isSingleExpression());
    Segment.ExpressionSegment block =
        assertInstanceOf(Segment.ExpressionSegment.class, template.segments().get(0));
    assertEquals("upper(\"}}\")", block.body());
    assertInstanceOf(ParseOutcome.Parsed.class, block.outcome());
  }

  @Test
  @DisplayName("an unterminated block swallows the rest and is unparsed")
  void unterminatedBlock() {
    Template template = ExpressionTokenizer.tokenize("a {{1.text", Dialect.MAKE);
    assertEquals(2, template.segments().size());
    Segment.ExpressionSegment block =
        assertInstanceOf(Segment.ExpressionSegment.class, template.segments().get(1));
    assertEquals("{{1.text", block.original());
    assertInstanceOf(ParseOutcome.Unparsed.class, block.outcome());
  }

  @Test
  @DisplayName("literal text is preserved byte for byte")
  void literalPreserved() {
    String text = "  spaced\ttext  {{1.a}}\n";
    Template template = ExpressionTokenizer.tokenize(text, Dialect.MAKE);
    StringBuilder rebuilt = new StringBuilder();
    for (Segment segment : template.segments()) {
      if (segment instanceof Segment.LiteralSegment literal) {
        rebuilt.append(literal.text());
      } else {
        rebuilt.append(((Segment.ExpressionSegment) segment).original());
      }
    }
    assertEquals(text, rebuilt.toString());
  }
}
