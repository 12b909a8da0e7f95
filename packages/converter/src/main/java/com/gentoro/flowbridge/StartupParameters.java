package com.gentoro.flowbridge;

import com.gentoro.flowbridge.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Command line arguments, given as {@code --name value} or {@code --name=value}.
 *
 * <p>Recognized names: {@code input}, {@code output}, {@code from}, {@code to}, {@code mode},
 * {@code config}, {@code mappings}.
 */
public class StartupParameters {

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unexpected argument '" + arg + "'");
      }
      String name = arg.substring(2);
      int eq = name.indexOf('=');
      if (eq >= 0) {
        parameters.put(name.substring(0, eq), name.substring(eq + 1));
      } else if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
        parameters.put(name, args[++i]);
      } else {
        // bare flag
        parameters.put(name, "true");
      }
    }
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** Value of {@code name} converted to {@code type}, or null when absent. */
  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) return null;
    if (type == String.class) {
      return type.cast(value);
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.parseBoolean(value));
    }
    if (type == Integer.class) {
      if (!NumberUtils.isParsable(value)) {
        throw new ConfigurationException("Parameter --" + name + " expects a number: " + value);
      }
      return type.cast(Integer.valueOf(value));
    }
    throw new IllegalArgumentException("Unsupported parameter type " + type.getName());
  }

  public String getParameter(String name, String defaultValue) {
    return StringUtils.defaultIfBlank(parameters.get(name), defaultValue);
  }

  public String configFile() {
    return getParameter("config", String.class);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
