package com.gentoro.flowbridge.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.flowbridge.expression.ExpressionAst.Concatenation;
import com.gentoro.flowbridge.expression.ExpressionAst.FunctionCall;
import com.gentoro.flowbridge.expression.ExpressionAst.Literal;
import com.gentoro.flowbridge.expression.ExpressionAst.PathStep;
import com.gentoro.flowbridge.expression.ExpressionAst.PropertyAccess;
import com.gentoro.flowbridge.expression.ExpressionAst.VariableRoot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for expression bodies (the text between the block delimiters).
 *
 * <p>Grammar shared by both dialects:
 *
 * <pre>
 *   expr    := concat
 *   concat  := postfix ('+' postfix)*
 *   postfix := primary ('.' ident | '[' expr ']' | '(' args ')')*
 *   primary := string | number | true | false | null | ident | '(' expr ')'
 * </pre>
 *
 * <p>In the Make dialect an integer directly followed by {@code .} or {@code [} is a positional
 * module root ({@code 1.text}). A call is only allowed on a dotted identifier chain, whose text
 * becomes the function name.
 *
 * <p>{@link #parse(String, Dialect)} is total: any failure, including excessive nesting, yields
 * {@link ParseOutcome.Unparsed}.
 */
public final class ExpressionParser {

  /** Maximum nesting of parentheses, brackets and calls accepted in one body. */
  public static final int MAX_NESTING = 64;

  private ExpressionParser() {}

  public static ParseOutcome parse(String body, Dialect dialect) {
    if (body == null || body.isBlank()) {
      return new ParseOutcome.Unparsed(body == null ? "" : body, "empty expression");
    }
    try {
      Parser parser = new Parser(body, dialect);
      ExpressionAst ast = parser.parseExpression();
      parser.expect(TokType.EOF);
      return new ParseOutcome.Parsed(ast);
    } catch (ExpressionParseException e) {
      return new ParseOutcome.Unparsed(body, e.getMessage());
    } catch (RuntimeException e) {
      return new ParseOutcome.Unparsed(body, "unexpected parser failure: " + e.getMessage());
    }
  }

  // ---- Lexer -------------------------------------------------------------------------------

  private enum TokType {
    STRING,
    NUMBER,
    IDENT,
    DOT,
    COMMA,
    PLUS,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    EOF
  }

  private static final class Tok {
    TokType type;
    String text;
    int pos;
  }

  private static final class Lexer {
    final String s;
    int i = 0;
    TokType previous = null;

    Lexer(String s) {
      this.s = s;
    }

    Tok next() {
      skipWs();
      if (i >= s.length()) return t(TokType.EOF, null, i);
      char c = s.charAt(i);
      int start = i;
      switch (c) {
        case '.' -> {
          i++;
          return t(TokType.DOT, ".", start);
        }
        case ',' -> {
          i++;
          return t(TokType.COMMA, ",", start);
        }
        case '+' -> {
          i++;
          return t(TokType.PLUS, "+", start);
        }
        case '(' -> {
          i++;
          return t(TokType.LPAREN, "(", start);
        }
        case ')' -> {
          i++;
          return t(TokType.RPAREN, ")", start);
        }
        case '[' -> {
          i++;
          return t(TokType.LBRACKET, "[", start);
        }
        case ']' -> {
          i++;
          return t(TokType.RBRACKET, "]", start);
        }
        default -> {
          // fall through to the multi-character tokens below
        }
      }

      if (c == '"' || c == '\'') {
        return string(c);
      }
      if (Character.isDigit(c) || (c == '-' && startsOperand() && nextIsDigit())) {
        return number();
      }
      if (isIdentStart(c)) {
        while (i < s.length() && isIdentPart(s.charAt(i))) i++;
        return t(TokType.IDENT, s.substring(start, i), start);
      }
      throw new ExpressionParseException("Unexpected character '" + c + "'", start);
    }

    private Tok string(char quote) {
      int start = i;
      i++;
      StringBuilder sb = new StringBuilder();
      while (i < s.length()) {
        char ch = s.charAt(i++);
        if (ch == quote) {
          return t(TokType.STRING, sb.toString(), start);
        }
        if (ch == '\\' && i < s.length()) {
          char esc = s.charAt(i++);
          switch (esc) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            default -> sb.append(esc);
          }
        } else {
          sb.append(ch);
        }
      }
      throw new ExpressionParseException("Unterminated string literal", start);
    }

    private Tok number() {
      int start = i;
      if (s.charAt(i) == '-') i++;
      while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
      // "1.5" is a decimal, "1.text" is a module root followed by a field.
      if (i + 1 < s.length() && s.charAt(i) == '.' && Character.isDigit(s.charAt(i + 1))) {
        i++;
        while (i < s.length() && Character.isDigit(s.charAt(i))) i++;
      }
      return t(TokType.NUMBER, s.substring(start, i), start);
    }

    private boolean startsOperand() {
      return previous == null
          || previous == TokType.PLUS
          || previous == TokType.COMMA
          || previous == TokType.LPAREN
          || previous == TokType.LBRACKET;
    }

    private boolean nextIsDigit() {
      return i + 1 < s.length() && Character.isDigit(s.charAt(i + 1));
    }

    private void skipWs() {
      while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
    }

    private Tok t(TokType type, String text, int pos) {
      Tok tok = new Tok();
      tok.type = type;
      tok.text = text;
      tok.pos = pos;
      previous = type;
      return tok;
    }

    private static boolean isIdentStart(char c) {
      return Character.isLetter(c) || c == '$' || c == '_';
    }

    private static boolean isIdentPart(char c) {
      return Character.isLetterOrDigit(c) || c == '$' || c == '_';
    }
  }

  // ---- Parser ------------------------------------------------------------------------------

  private static final class Parser {
    final Lexer lx;
    final Dialect dialect;
    Tok lookahead;
    int depth = 0;

    Parser(String s, Dialect dialect) {
      this.lx = new Lexer(s);
      this.dialect = dialect;
      this.lookahead = lx.next();
    }

    private Tok consume(TokType type) {
      Tok current = expect(type);
      advance();
      return current;
    }

    Tok expect(TokType type) {
      if (lookahead.type != type) {
        throw new ExpressionParseException(
            "Expected " + type + " but found " + describe(lookahead), lookahead.pos);
      }
      return lookahead;
    }

    private void advance() {
      if (lookahead.type != TokType.EOF) {
        lookahead = lx.next();
      }
    }

    private void enter(int pos) {
      if (++depth > MAX_NESTING) {
        throw new ExpressionParseException("Expression nested deeper than " + MAX_NESTING, pos);
      }
    }

    private void leave() {
      depth--;
    }

    ExpressionAst parseExpression() {
      enter(lookahead.pos);
      try {
        List<ExpressionAst> operands = new ArrayList<>();
        operands.add(parsePostfix());
        while (lookahead.type == TokType.PLUS) {
          advance();
          operands.add(parsePostfix());
        }
        return operands.size() == 1 ? operands.get(0) : new Concatenation(operands);
      } finally {
        leave();
      }
    }

    private ExpressionAst parsePostfix() {
      ExpressionAst base = parsePrimary();
      List<PathStep> steps = new ArrayList<>();
      while (true) {
        switch (lookahead.type) {
          case DOT -> {
            advance();
            Tok name = lookahead;
            if (name.type != TokType.IDENT && name.type != TokType.NUMBER) {
              throw new ExpressionParseException(
                  "Expected property name but found " + describe(name), name.pos);
            }
            advance();
            steps.add(new PathStep.Field(name.text));
          }
          case LBRACKET -> {
            int pos = lookahead.pos;
            advance();
            enter(pos);
            try {
              ExpressionAst key = parseExpression();
              consume(TokType.RBRACKET);
              steps.add(new PathStep.Index(key));
            } finally {
              leave();
            }
          }
          case LPAREN -> {
            int pos = lookahead.pos;
            String name = calleeName(base, steps, pos);
            advance();
            enter(pos);
            try {
              List<ExpressionAst> args = parseArguments();
              base = new FunctionCall(name, args);
              steps = new ArrayList<>();
            } finally {
              leave();
            }
          }
          default -> {
            return steps.isEmpty() ? base : new PropertyAccess(base, steps);
          }
        }
      }
    }

    private List<ExpressionAst> parseArguments() {
      List<ExpressionAst> args = new ArrayList<>();
      if (lookahead.type == TokType.RPAREN) {
        advance();
        return args;
      }
      args.add(parseExpression());
      while (lookahead.type == TokType.COMMA) {
        advance();
        args.add(parseExpression());
      }
      consume(TokType.RPAREN);
      return args;
    }

    private String calleeName(ExpressionAst base, List<PathStep> steps, int pos) {
      if (!(base instanceof VariableRoot root) || root.isPositional()) {
        throw new ExpressionParseException("Only named functions can be called", pos);
      }
      StringBuilder sb = new StringBuilder(root.name());
      for (PathStep step : steps) {
        if (!(step instanceof PathStep.Field field)) {
          throw new ExpressionParseException("Only named functions can be called", pos);
        }
        sb.append('.').append(field.name());
      }
      return sb.toString();
    }

    private ExpressionAst parsePrimary() {
      Tok tok = lookahead;
      switch (tok.type) {
        case STRING -> {
          advance();
          return Literal.of(tok.text);
        }
        case NUMBER -> {
          advance();
          if (dialect == Dialect.MAKE
              && isInteger(tok.text)
              && !tok.text.startsWith("-")
              && (lookahead.type == TokType.DOT || lookahead.type == TokType.LBRACKET)) {
            return new VariableRoot(tok.text);
          }
          return new Literal(number(tok.text));
        }
        case IDENT -> {
          advance();
          return switch (tok.text) {
            case "true" -> new Literal(JsonNodeFactory.instance.booleanNode(true));
            case "false" -> new Literal(JsonNodeFactory.instance.booleanNode(false));
            case "null" -> new Literal(JsonNodeFactory.instance.nullNode());
            default -> new VariableRoot(tok.text);
          };
        }
        case LPAREN -> {
          advance();
          enter(tok.pos);
          try {
            ExpressionAst inner = parseExpression();
            consume(TokType.RPAREN);
            return inner;
          } finally {
            leave();
          }
        }
        default -> throw new ExpressionParseException(
            "Unexpected " + describe(tok), tok.pos);
      }
    }

    private static boolean isInteger(String text) {
      return text.indexOf('.') < 0;
    }

    private static JsonNode number(String text) {
      if (isInteger(text)) {
        try {
          return JsonNodeFactory.instance.numberNode(Long.parseLong(text));
        } catch (NumberFormatException ignored) {
          // too large for a long: keep full precision below
        }
      }
      return JsonNodeFactory.instance.numberNode(new BigDecimal(text));
    }

    private static String describe(Tok tok) {
      return tok.type == TokType.EOF ? "end of expression" : "'" + tok.text + "'";
    }
  }
}
