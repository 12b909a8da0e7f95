package com.gentoro.flowbridge.evaluate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Builtin functions available to {@link ExpressionEvaluator}, keyed by canonical name.
 *
 * <p>Builtins receive already-evaluated arguments. Wrong argument types or counts raise {@link
 * EvaluationException} with kind {@code TYPE_MISMATCH}; calling an unregistered name raises kind
 * {@code UNKNOWN_FUNCTION}.
 */
public class FunctionRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.flowbridge.logging.LoggingService.getLogger(FunctionRegistry.class);

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
  /** Largest number of decimal places {@code round} accepts. */
  static final int MAX_ROUND_DIGITS = 15;
  private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
  private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

  /** A builtin over evaluated arguments. */
  @FunctionalInterface
  public interface Builtin {
    JsonNode apply(List<JsonNode> args);
  }

  private final Map<String, Builtin> functions = new HashMap<>();
  private final Clock clock;

  public FunctionRegistry() {
    this(Clock.systemUTC());
  }

  public FunctionRegistry(Clock clock) {
    this.clock = clock;
    registerBuiltIns();
  }

  public FunctionRegistry register(String name, Builtin builtin) {
    functions.put(name, builtin);
    return this;
  }

  public boolean hasFunction(String name) {
    return functions.containsKey(name);
  }

  public Set<String> getAvailableFunctions() {
    return Set.copyOf(functions.keySet());
  }

  public JsonNode invoke(String name, List<JsonNode> args) {
    Builtin builtin = functions.get(name);
    if (builtin == null) {
      throw new EvaluationException(
          EvaluationException.Kind.UNKNOWN_FUNCTION, "No builtin registered with name '" + name + "'");
    }
    log.trace("Invoking builtin '{}' with {} argument(s)", name, args.size());
    JsonNode result;
    try {
      result = builtin.apply(args);
    } catch (EvaluationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EvaluationException(
          EvaluationException.Kind.TYPE_MISMATCH, name + ": " + e.getMessage(), e);
    }
    return result == null ? NullNode.getInstance() : result;
  }

  private void registerBuiltIns() {
    // String operations (using Apache Commons Lang)
    register("upper", args -> NODES.textNode(StringUtils.upperCase(text(arg("upper", args, 0, 1)))));
    register("lower", args -> NODES.textNode(StringUtils.lowerCase(text(arg("lower", args, 0, 1)))));
    register("trim", args -> NODES.textNode(StringUtils.trim(text(arg("trim", args, 0, 1)))));

    register(
        "replace",
        args -> {
          arity("replace", args, 3, 3);
          return NODES.textNode(
              StringUtils.replace(text(args.get(0)), text(args.get(1)), text(args.get(2))));
        });

    register(
        "substring",
        args -> {
          arity("substring", args, 2, 3);
          String s = text(args.get(0));
          int start = integer("substring", args.get(1));
          int end = args.size() > 2 ? integer("substring", args.get(2)) : s.length();
          return NODES.textNode(StringUtils.substring(s, start, end));
        });

    // n8n's $str.substr takes a length instead of an end index
    register(
        "substr",
        args -> {
          arity("substr", args, 2, 3);
          String s = text(args.get(0));
          int start = integer("substr", args.get(1));
          if (args.size() < 3) {
            return NODES.textNode(StringUtils.substring(s, start));
          }
          int length = integer("substr", args.get(2));
          if (length < 0) {
            throw EvaluationException.typeMismatch("substr", "length must not be negative");
          }
          int from = start < 0 ? Math.max(0, s.length() + start) : Math.min(start, s.length());
          return NODES.textNode(s.substring(from, (int) Math.min((long) from + length, s.length())));
        });

    register(
        "length",
        args -> {
          JsonNode value = arg("length", args, 0, 1);
          if (value.isNull() || value.isMissingNode()) return NODES.numberNode(0);
          if (value.isArray() || value.isObject()) return NODES.numberNode(value.size());
          return NODES.numberNode(text(value).length());
        });

    // Array helpers
    register(
        "first",
        args -> {
          JsonNode array = array("first", arg("first", args, 0, 1));
          return array.isEmpty() ? NullNode.getInstance() : array.get(0);
        });

    register(
        "last",
        args -> {
          JsonNode array = array("last", arg("last", args, 0, 1));
          return array.isEmpty() ? NullNode.getInstance() : array.get(array.size() - 1);
        });

    register(
        "join",
        args -> {
          arity("join", args, 1, 2);
          JsonNode array = array("join", args.get(0));
          String separator = args.size() > 1 ? text(args.get(1)) : ",";
          StringBuilder sb = new StringBuilder();
          for (int i = 0; i < array.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(text(array.get(i)));
          }
          return NODES.textNode(sb.toString());
        });

    register(
        "count",
        args -> {
          JsonNode value = arg("count", args, 0, 1);
          if (value.isNull() || value.isMissingNode()) return NODES.numberNode(0);
          return NODES.numberNode(array("count", value).size());
        });

    // Dates
    register(
        "now",
        args -> {
          arity("now", args, 0, 0);
          return NODES.textNode(Instant.now(clock).toString());
        });

    register(
        "formatDate",
        args -> {
          arity("formatDate", args, 2, 2);
          Instant instant = parseDate(text(args.get(0)));
          try {
            DateTimeFormatter formatter = DateTimeFormatter.ofPattern(javaPattern(text(args.get(1))));
            return NODES.textNode(formatter.format(instant.atZone(ZoneOffset.UTC)));
          } catch (IllegalArgumentException e) {
            throw new EvaluationException(
                EvaluationException.Kind.TYPE_MISMATCH,
                "formatDate: invalid pattern '" + text(args.get(1)) + "'",
                e);
          }
        });

    // Numbers
    register(
        "round",
        args -> {
          arity("round", args, 1, 2);
          BigDecimal value = number("round", args.get(0));
          int digits = args.size() > 1 ? integer("round", args.get(1)) : 0;
          if (digits < 0 || digits > MAX_ROUND_DIGITS) {
            throw EvaluationException.typeMismatch(
                "round", "digits must be between 0 and " + MAX_ROUND_DIGITS + " but got " + digits);
          }
          if (value.precision() - value.scale() > 400) {
            throw EvaluationException.typeMismatch("round", "value out of range");
          }
          BigDecimal rounded = value.setScale(digits, RoundingMode.HALF_UP);
          return digits == 0 ? NODES.numberNode(rounded.longValue()) : NODES.numberNode(rounded);
        });

    register(
        "random",
        args -> {
          arity("random", args, 0, 2);
          // random() is [0, 1), random(max) is [0, max), random(min, max) is [min, max)
          double min = args.size() > 1 ? number("random", args.get(0)).doubleValue() : 0d;
          double max =
              args.isEmpty() ? 1d : number("random", args.get(args.size() - 1)).doubleValue();
          if (!(max > min)) {
            throw EvaluationException.typeMismatch(
                "random", "expects min below max but got " + min + " and " + max);
          }
          return NODES.numberNode(ThreadLocalRandom.current().nextDouble(min, max));
        });

    // Conditional
    register(
        "ifThenElse",
        args -> {
          arity("ifThenElse", args, 3, 3);
          return truthy(args.get(0)) ? args.get(1) : args.get(2);
        });
  }

  /** String form used by concatenation and string builtins; null and missing become empty. */
  public static String text(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return "";
    if (value.isTextual()) return value.textValue();
    if (value.isBigDecimal()) return value.decimalValue().toPlainString();
    if (value.isValueNode()) return value.asText();
    return value.toString();
  }

  public static boolean truthy(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return false;
    if (value.isBoolean()) return value.booleanValue();
    if (value.isNumber()) return value.doubleValue() != 0d;
    if (value.isTextual()) return !value.textValue().isEmpty();
    return true;
  }

  private static JsonNode arg(String function, List<JsonNode> args, int index, int expected) {
    arity(function, args, expected, expected);
    return args.get(index);
  }

  private static void arity(String function, List<JsonNode> args, int min, int max) {
    if (args.size() < min || args.size() > max) {
      String expected = min == max ? String.valueOf(min) : min + ".." + max;
      throw EvaluationException.typeMismatch(
          function, "expects " + expected + " argument(s) but got " + args.size());
    }
  }

  private static JsonNode array(String function, JsonNode value) {
    if (!value.isArray()) {
      throw EvaluationException.typeMismatch(function, "expects an array but got " + describe(value));
    }
    return value;
  }

  private static BigDecimal number(String function, JsonNode value) {
    if (value.isNumber()) return value.decimalValue();
    if (value.isTextual()) {
      String str = StringUtils.trimToEmpty(value.textValue());
      if (NumberUtils.isCreatable(str)) {
        return NumberUtils.createBigDecimal(str);
      }
    }
    throw EvaluationException.typeMismatch(function, "expects a number but got " + describe(value));
  }

  private static int integer(String function, JsonNode value) {
    BigDecimal number = number(function, value);
    if (number.compareTo(INT_MIN) < 0 || number.compareTo(INT_MAX) > 0) {
      throw EvaluationException.typeMismatch(function, "integer out of range: " + number);
    }
    return number.intValue();
  }

  private static String describe(JsonNode value) {
    return value.isTextual() ? "'" + value.textValue() + "'" : value.getNodeType().name();
  }

  private static Instant parseDate(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE)
            .atStartOfDay(ZoneOffset.UTC)
            .toInstant();
      } catch (DateTimeParseException inner) {
        throw new EvaluationException(
            EvaluationException.Kind.TYPE_MISMATCH, "formatDate: not a date '" + value + "'", inner);
      }
    }
  }

  /** Translates the moment-style tokens both platforms use into a java.time pattern. */
  static String javaPattern(String pattern) {
    return StringUtils.replaceEach(
        pattern,
        new String[] {"YYYY", "YY", "DD", "Do", "dddd", "ddd"},
        new String[] {"yyyy", "yy", "dd", "d", "EEEE", "EEE"});
  }
}
