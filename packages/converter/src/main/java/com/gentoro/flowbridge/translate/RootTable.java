package com.gentoro.flowbridge.translate;

import com.gentoro.flowbridge.expression.Dialect;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named variable roots that translate one to one. The JSON-context root and node references
 * depend on the graph and are handled by {@link DialectTranslator} itself.
 */
public final class RootTable {

  /** n8n root holding the current input item. */
  public static final String N8N_JSON = "$json";

  /** n8n root for explicit node references, used as {@code $node["Name"].json}. */
  public static final String N8N_NODE = "$node";

  private static final Map<String, String> N8N_TO_MAKE = new LinkedHashMap<>();
  private static final Map<String, String> MAKE_TO_N8N = new LinkedHashMap<>();

  static {
    pair("$env", "env");
    pair("$workflow", "scenario");
    pair("$binary", "binary");
    pair("$parameter", "parameters");
    pair("$now", "now");
  }

  private RootTable() {}

  private static void pair(String n8n, String make) {
    N8N_TO_MAKE.put(n8n, make);
    MAKE_TO_N8N.put(make, n8n);
  }

  public static Optional<String> translate(String root, Dialect from, Dialect to) {
    if (from == to) {
      return Optional.of(root);
    }
    Map<String, String> table = from == Dialect.N8N ? N8N_TO_MAKE : MAKE_TO_N8N;
    return Optional.ofNullable(table.get(root));
  }
}
