package io.intellixity.nestplan.mutation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Deep copy that drops the marker key from every object, at any depth. */
public final class MarkerScrubber {
  private final String markerKey;

  public MarkerScrubber() {
    this(ActionMarkers.DEFAULT_MARKER_KEY);
  }

  public MarkerScrubber(String markerKey) {
    this.markerKey = Objects.requireNonNull(markerKey, "markerKey");
  }

  public Object scrub(Object value) {
    if (value instanceof Map<?, ?> m) {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : m.entrySet()) {
        String k = String.valueOf(e.getKey());
        if (markerKey.equals(k)) continue;
        out.put(k, scrub(e.getValue()));
      }
      return out;
    }
    if (value instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      for (Object x : c) out.add(scrub(x));
      return out;
    }
    return value;
  }

  boolean containsMarker(Object value) {
    if (value instanceof Map<?, ?> m) {
      if (m.containsKey(markerKey)) return true;
      for (Object v : m.values()) if (containsMarker(v)) return true;
      return false;
    }
    if (value instanceof Collection<?> c) {
      for (Object x : c) if (containsMarker(x)) return true;
    }
    return false;
  }
}
