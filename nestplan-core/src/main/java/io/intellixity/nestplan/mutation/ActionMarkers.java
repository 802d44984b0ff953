package io.intellixity.nestplan.mutation;

import java.util.Map;

/** Validation of the optional verb marker carried by relation values. */
public final class ActionMarkers {
  public static final String DEFAULT_MARKER_KEY = "apiAction";

  private ActionMarkers() {}

  /**
   * Validates a raw marker value.
   *
   * @return the action, or null when the marker is absent (implicit default)
   * @throws InvalidActionValueException when present and not one of {@link ApiAction#wireValues()}
   */
  public static ApiAction validate(Object raw) {
    return validate(DEFAULT_MARKER_KEY, raw);
  }

  public static ApiAction validate(String markerKey, Object raw) {
    if (raw == null) return null;
    ApiAction a = (raw instanceof String s) ? ApiAction.fromWire(s) : null;
    if (a == null) throw new InvalidActionValueException(markerKey, raw);
    return a;
  }

  /** Reads and validates the marker of a relation value; null for non-object values. */
  public static ApiAction markerOf(Object value, String markerKey) {
    if (!(value instanceof Map<?, ?> m)) return null;
    return validate(markerKey, m.get(markerKey));
  }
}
