package com.gentoro.flowbridge.translate;

import com.gentoro.flowbridge.expression.Dialect;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bidirectional table of builtin function names. The Make name doubles as the canonical name the
 * evaluator registers its builtins under.
 */
public final class FunctionTable {

  private static final Map<String, String> N8N_TO_MAKE = new LinkedHashMap<>();
  private static final Map<String, String> MAKE_TO_N8N = new LinkedHashMap<>();

  static {
    pair("$str.upper", "upper");
    pair("$str.lower", "lower");
    pair("$str.trim", "trim");
    pair("$str.replace", "replace");
    pair("$str.substr", "substring");
    pair("$str.length", "length");
    pair("$array.first", "first");
    pair("$array.last", "last");
    pair("$array.join", "join");
    pair("$array.length", "count");
    pair("$date.now", "now");
    pair("$date.format", "formatDate");
    pair("$math.round", "round");
    pair("$math.random", "random");
    pair("$if", "ifThenElse");
  }

  private FunctionTable() {}

  private static void pair(String n8n, String make) {
    N8N_TO_MAKE.put(n8n, make);
    MAKE_TO_N8N.put(make, n8n);
  }

  /** Name of {@code name} (written in {@code from}) in dialect {@code to}, if it is a builtin. */
  public static Optional<String> translate(String name, Dialect from, Dialect to) {
    if (from == to) {
      return isKnown(name, from) ? Optional.of(name) : Optional.empty();
    }
    Map<String, String> table = from == Dialect.N8N ? N8N_TO_MAKE : MAKE_TO_N8N;
    return Optional.ofNullable(table.get(name));
  }

  /** Canonical (Make) name of a builtin written in {@code dialect}. */
  public static Optional<String> canonicalName(String name, Dialect dialect) {
    if (dialect == Dialect.MAKE) {
      return MAKE_TO_N8N.containsKey(name) ? Optional.of(name) : Optional.empty();
    }
    return Optional.ofNullable(N8N_TO_MAKE.get(name));
  }

  public static boolean isKnown(String name, Dialect dialect) {
    return dialect == Dialect.N8N ? N8N_TO_MAKE.containsKey(name) : MAKE_TO_N8N.containsKey(name);
  }

  public static Map<String, String> n8nToMake() {
    return Collections.unmodifiableMap(N8N_TO_MAKE);
  }
}
