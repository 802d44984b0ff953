package io.intellixity.nestplan.mutation;

import java.util.List;
import java.util.Map;
import java.util.Set;

/** Top-level keys of a store-native relation mutation object. */
public final class StoreVerbs {
  public static final List<String> ALL = List.of(
      "create",
      "connect",
      "update",
      "delete",
      "disconnect",
      "deleteMany",
      "connectOrCreate",
      "upsert",
      "set"
  );

  private static final Set<String> LOOKUP = Set.copyOf(ALL);

  private StoreVerbs() {}

  /** True for a non-empty object whose keys are all store verbs; such values are never re-interpreted. */
  public static boolean isShaped(Object value) {
    if (!(value instanceof Map<?, ?> m) || m.isEmpty()) return false;
    for (Object k : m.keySet()) {
      if (!LOOKUP.contains(String.valueOf(k))) return false;
    }
    return true;
  }
}
