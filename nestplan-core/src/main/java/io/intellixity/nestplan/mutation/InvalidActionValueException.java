package io.intellixity.nestplan.mutation;

/** A marker field carries a value outside the closed verb set. */
public final class InvalidActionValueException extends RelationMutationException {
  public static final String CODE = "InvalidActionValue";

  private final Object value;

  public InvalidActionValueException(String markerKey, Object value) {
    super(CODE, "Unknown value \"" + value + "\" for " + markerKey + " field, available values are "
        + String.join(", ", ApiAction.wireValues()) + ".");
    this.value = value;
  }

  public Object value() {
    return value;
  }
}
