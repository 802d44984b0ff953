package io.intellixity.nestplan.mutation;

/**
 * Base type for failures raised while compiling a nested write payload into a mutation plan.
 * <p>
 * The resolver never applies a partial plan: when one of these escapes, the whole call failed.
 */
public abstract class RelationMutationException extends RuntimeException {
  private final String code;

  protected RelationMutationException(String code, String message) {
    super(message);
    this.code = code;
  }

  /** Stable, machine-readable error code. */
  public String code() {
    return code;
  }
}
