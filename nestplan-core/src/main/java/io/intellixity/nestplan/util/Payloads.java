package io.intellixity.nestplan.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural helpers for request payload trees (maps, lists, scalars), the shape a JSON/YAML
 * deserializer produces.
 */
public final class Payloads {
  private Payloads() {}

  /**
   * Deep copy: maps become insertion-ordered maps with string keys, collections become lists,
   * scalars are shared.
   */
  public static Object deepCopy(Object value) {
    if (value instanceof Map<?, ?> m) return deepCopyMap(m);
    if (value instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(deepCopy(x));
      return out;
    }
    return value;
  }

  public static Map<String, Object> deepCopyMap(Map<?, ?> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      out.put(String.valueOf(e.getKey()), deepCopy(e.getValue()));
    }
    return out;
  }

  /**
   * Nesting depth of a payload tree: scalars are 0, each map or collection level adds one.
   */
  public static int depth(Object value) {
    int max = 0;
    if (value instanceof Map<?, ?> m) {
      for (Object v : m.values()) max = Math.max(max, depth(v));
      return max + 1;
    }
    if (value instanceof Collection<?> c) {
      for (Object v : c) max = Math.max(max, depth(v));
      return max + 1;
    }
    return 0;
  }

  /** True when {@link #depth(Object)} would exceed {@code limit}; stops descending once it does. */
  public static boolean depthExceeds(Object value, int limit) {
    if (limit < 0) return true;
    if (value instanceof Map<?, ?> m) {
      for (Object v : m.values()) if (depthExceeds(v, limit - 1)) return true;
      return limit < 1;
    }
    if (value instanceof Collection<?> c) {
      for (Object v : c) if (depthExceeds(v, limit - 1)) return true;
      return limit < 1;
    }
    return false;
  }

  /** Casts a payload node known to be a map with string keys. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> asObject(Object value) {
    return (Map<String, Object>) value;
  }
}
