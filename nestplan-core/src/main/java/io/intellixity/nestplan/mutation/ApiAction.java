package io.intellixity.nestplan.mutation;

import java.util.ArrayList;
import java.util.List;

/** Closed set of verbs a relation value may request, and the verb the resolver settles on per item. */
public enum ApiAction {
  CREATE("create"),
  CONNECT("connect"),
  UPDATE("update"),
  DELETE("delete"),
  DISCONNECT("disconnect");

  private static final List<String> WIRE_VALUES;

  static {
    List<String> values = new ArrayList<>();
    for (ApiAction a : values()) values.add(a.wire);
    WIRE_VALUES = List.copyOf(values);
  }

  private final String wire;

  ApiAction(String wire) {
    this.wire = wire;
  }

  public String wire() {
    return wire;
  }

  /** Returns the action for a wire value, or null when it is not one of the closed set. */
  public static ApiAction fromWire(String s) {
    if (s == null) return null;
    for (ApiAction a : values()) {
      if (a.wire.equals(s)) return a;
    }
    return null;
  }

  public static List<String> wireValues() {
    return WIRE_VALUES;
  }
}
