package io.intellixity.nestplan.mutation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Per-field accumulator for a list relation; each item lands in exactly one bucket. */
final class FieldMutations {
  private final List<Map<String, Object>> create = new ArrayList<>();
  private final List<Map<String, Object>> connect = new ArrayList<>();
  private final List<Map<String, Object>> update = new ArrayList<>();
  private final List<Map<String, Object>> disconnect = new ArrayList<>();
  private final List<Object> deleteIds = new ArrayList<>();

  @SuppressWarnings("unchecked")
  void add(ApiAction verb, Object entry) {
    switch (verb) {
      case CREATE -> create.add((Map<String, Object>) entry);
      case CONNECT -> connect.add((Map<String, Object>) entry);
      case UPDATE -> update.add((Map<String, Object>) entry);
      case DISCONNECT -> disconnect.add((Map<String, Object>) entry);
      case DELETE -> deleteIds.add(entry);
    }
  }

  boolean isEmpty() {
    return create.isEmpty() && connect.isEmpty() && update.isEmpty() && disconnect.isEmpty() && deleteIds.isEmpty();
  }

  /** Store-native mutation object; empty buckets are omitted. */
  Map<String, Object> toPlan() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (!create.isEmpty()) out.put("create", create);
    if (!connect.isEmpty()) out.put("connect", connect);
    if (!update.isEmpty()) out.put("update", update);
    if (!disconnect.isEmpty()) out.put("disconnect", disconnect);
    if (!deleteIds.isEmpty()) {
      Map<String, Object> in = new LinkedHashMap<>();
      in.put("in", deleteIds);
      Map<String, Object> byId = new LinkedHashMap<>();
      byId.put(ConnectabilityClassifier.ID_FIELD, in);
      out.put("deleteMany", byId);
    }
    return out;
  }
}
