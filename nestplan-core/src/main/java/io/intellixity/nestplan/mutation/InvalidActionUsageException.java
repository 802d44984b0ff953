package io.intellixity.nestplan.mutation;

/** A marker field was found on a body that is not a relation value. */
public final class InvalidActionUsageException extends RelationMutationException {
  public static final String CODE = "InvalidActionUsage";

  public InvalidActionUsageException(String markerKey) {
    super(CODE, "Invalid usage of " + markerKey
        + " field, it must only be used on relation fields whether single or multiple.");
  }
}
