package com.gentoro.flowbridge.expression;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.flowbridge.expression.ExpressionAst.Concatenation;
import com.gentoro.flowbridge.expression.ExpressionAst.FunctionCall;
import com.gentoro.flowbridge.expression.ExpressionAst.Literal;
import com.gentoro.flowbridge.expression.ExpressionAst.PathStep;
import com.gentoro.flowbridge.expression.ExpressionAst.PropertyAccess;
import com.gentoro.flowbridge.expression.ExpressionAst.VariableRoot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

  private static ExpressionAst parsed(String body, Dialect dialect) {
    ParseOutcome outcome = ExpressionParser.parse(body, dialect);
    return assertInstanceOf(ParseOutcome.Parsed.class, outcome).ast();
  }

  @Test
  @DisplayName("property chain with fields and a bracket index")
  void propertyChain() {
    ExpressionAst ast = parsed("$json.items[0].name", Dialect.N8N);
    PropertyAccess access = assertInstanceOf(PropertyAccess.class, ast);
    assertEquals(new VariableRoot("$json"), access.base());
    assertEquals(3, access.steps().size());
    assertEquals(new PathStep.Field("items"), access.steps().get(0));
    PathStep.Index index = assertInstanceOf(PathStep.Index.class, access.steps().get(1));
    assertEquals(0L, ((Literal) index.key()).value().longValue());
    assertEquals(new PathStep.Field("name"), access.steps().get(2));
  }

  @Test
  @DisplayName("dotted function name with nested arguments")
  void dottedFunctionCall() {
    FunctionCall call =
        assertInstanceOf(
            FunctionCall.class, parsed("$str.upper($str.trim($json.text))", Dialect.N8N));
    assertEquals("$str.upper", call.name());
    FunctionCall inner = assertInstanceOf(FunctionCall.class, call.arguments().get(0));
    assertEquals("$str.trim", inner.name());
  }

  @Test
  @DisplayName("plus joins operands into one concatenation")
  void concatenation() {
    Concatenation concat =
        assertInstanceOf(
            Concatenation.class, parsed("\"https://example.com/api/\" + $json.id", Dialect.N8N));
    assertEquals(2, concat.operands().size());
    assertEquals("https://example.com/api/", ((Literal) concat.operands().get(0)).value().asText());
  }

  @Test
  @DisplayName("string literals honour escapes and either quote")
  void stringEscapes() {
    Literal literal = assertInstanceOf(Literal.class, parsed("'it\\'s \"ok\"'", Dialect.N8N));
    assertEquals("it's \"ok\"", literal.value().textValue());
  }

  @Test
  @DisplayName("Make integer followed by a dot is a module reference")
  void makePositionalRoot() {
    PropertyAccess access =
        assertInstanceOf(PropertyAccess.class, parsed("1.text", Dialect.MAKE));
    VariableRoot root = assertInstanceOf(VariableRoot.class, access.base());
    assertTrue(root.isPositional());
    assertEquals("1", root.name());
  }

  @Test
  @DisplayName("decimal numbers stay numbers in both dialects")
  void decimals() {
    Literal literal = assertInstanceOf(Literal.class, parsed("1.5", Dialect.MAKE));
    assertEquals("1.5", literal.value().decimalValue().toPlainString());
  }

  @Test
  @DisplayName("malformed bodies become unparsed instead of throwing")
  void parsingIsTotal() {
    String[] broken = {"", "   ", "$json.", "upper(", "\"open", "a b", "1.text(", ")", "#"};
    for (String body : broken) {
      assertInstanceOf(
          ParseOutcome.Unparsed.class, ExpressionParser.parse(body, Dialect.MAKE), body);
    }
  }

  @Test
  @DisplayName("excessive nesting is reported rather than overflowing the stack")
  void nestingLimit() {
    String body = "(".repeat(500) + "1" + ")".repeat(500);
    ParseOutcome outcome = ExpressionParser.parse(body, Dialect.N8N);
    ParseOutcome.Unparsed unparsed = assertInstanceOf(ParseOutcome.Unparsed.class, outcome);
    assertTrue(unparsed.reason().contains("nested"));
  }
}
