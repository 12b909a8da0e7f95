package com.gentoro.flowbridge.utility;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for parameter paths in {@code a.b[0].c} notation: building them while walking a tree,
 * and reading or writing the value a path points to.
 */
public final class ParameterPaths {

  private ParameterPaths() {}

  public static String child(String parent, String key) {
    return parent == null || parent.isEmpty() ? key : parent + "." + key;
  }

  public static String index(String parent, int i) {
    return (parent == null ? "" : parent) + "[" + i + "]";
  }

  /** Whether {@code path} equals {@code prefix} or lies underneath it. */
  public static boolean isWithin(String path, String prefix) {
    if (path.equals(prefix)) return true;
    return path.startsWith(prefix)
        && (path.charAt(prefix.length()) == '.' || path.charAt(prefix.length()) == '[');
  }

  /** Path tokens: {@link String} for object keys, {@link Integer} for array indexes. */
  public static List<Object> parse(String path) {
    List<Object> tokens = new ArrayList<>();
    if (path == null || path.isEmpty()) return tokens;
    StringBuilder key = new StringBuilder();
    int i = 0;
    while (i < path.length()) {
      char c = path.charAt(i);
      if (c == '.') {
        flush(key, tokens);
        i++;
      } else if (c == '[') {
        flush(key, tokens);
        int close = path.indexOf(']', i);
        if (close < 0) {
          throw new IllegalArgumentException("Unclosed index in path '" + path + "'");
        }
        String inner = path.substring(i + 1, close).trim();
        try {
          tokens.add(Integer.parseInt(inner));
        } catch (NumberFormatException e) {
          // quoted key: ["some key"]
          tokens.add(inner.replaceAll("^[\"']|[\"']$", ""));
        }
        i = close + 1;
      } else {
        key.append(c);
        i++;
      }
    }
    flush(key, tokens);
    return tokens;
  }

  /** Value at {@code path}, or {@code null} when any step is missing. */
  public static JsonNode get(JsonNode root, String path) {
    JsonNode current = root;
    for (Object token : parse(path)) {
      if (current == null) return null;
      if (token instanceof Integer idx) {
        current = current.isArray() ? current.get(idx) : null;
      } else {
        current = current.isObject() ? current.get((String) token) : null;
      }
    }
    return current;
  }

  /** Writes {@code value} at {@code path}, creating intermediate objects and arrays. */
  public static void set(ObjectNode root, String path, JsonNode value) {
    List<Object> tokens = parse(path);
    if (tokens.isEmpty()) {
      throw new IllegalArgumentException("Empty parameter path");
    }
    JsonNode current = root;
    for (int i = 0; i < tokens.size() - 1; i++) {
      current = descend(current, tokens.get(i), tokens.get(i + 1));
    }
    Object last = tokens.get(tokens.size() - 1);
    if (last instanceof Integer idx) {
      ArrayNode array = (ArrayNode) current;
      pad(array, idx);
      array.set(idx, value);
    } else {
      ((ObjectNode) current).set((String) last, value);
    }
  }

  /** Removes the value at {@code path}; returns it, or {@code null} when absent. */
  public static JsonNode remove(ObjectNode root, String path) {
    List<Object> tokens = parse(path);
    if (tokens.isEmpty()) return null;
    JsonNode parent = get(root, join(tokens.subList(0, tokens.size() - 1)));
    Object last = tokens.get(tokens.size() - 1);
    if (parent instanceof ObjectNode obj && last instanceof String key) {
      return obj.remove(key);
    }
    if (parent instanceof ArrayNode array && last instanceof Integer idx && idx < array.size()) {
      return array.remove(idx.intValue());
    }
    return null;
  }

  private static JsonNode descend(JsonNode current, Object token, Object next) {
    JsonNode child;
    if (token instanceof Integer idx) {
      ArrayNode array = (ArrayNode) current;
      pad(array, idx);
      child = array.get(idx);
      if (!isContainerFor(child, next)) {
        child = containerFor(next);
        array.set(idx, child);
      }
    } else {
      ObjectNode obj = (ObjectNode) current;
      child = obj.get((String) token);
      if (!isContainerFor(child, next)) {
        child = containerFor(next);
        obj.set((String) token, child);
      }
    }
    return child;
  }

  private static boolean isContainerFor(JsonNode node, Object next) {
    if (node == null) return false;
    return next instanceof Integer ? node.isArray() : node.isObject();
  }

  private static JsonNode containerFor(Object next) {
    return next instanceof Integer
        ? JsonNodeFactory.instance.arrayNode()
        : JsonNodeFactory.instance.objectNode();
  }

  private static void pad(ArrayNode array, int idx) {
    while (array.size() <= idx) {
      array.add(NullNode.getInstance());
    }
  }

  private static String join(List<Object> tokens) {
    StringBuilder sb = new StringBuilder();
    for (Object token : tokens) {
      if (token instanceof Integer idx) {
        sb.append('[').append(idx).append(']');
      } else {
        if (sb.length() > 0) sb.append('.');
        sb.append(token);
      }
    }
    return sb.toString();
  }

  private static void flush(StringBuilder key, List<Object> tokens) {
    if (key.length() > 0) {
      tokens.add(key.toString());
      key.setLength(0);
    }
  }
}
