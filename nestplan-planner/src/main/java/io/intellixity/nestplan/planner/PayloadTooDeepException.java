package io.intellixity.nestplan.planner;

import io.intellixity.nestplan.mutation.RelationMutationException;

/** The payload nests deeper than {@link PlannerSettings#maxDepth()} allows. */
public final class PayloadTooDeepException extends RelationMutationException {
  public static final String CODE = "PayloadTooDeep";

  private final int maxDepth;

  public PayloadTooDeepException(String entity, int maxDepth) {
    super(CODE, "Payload for " + entity + " nests deeper than " + maxDepth + " levels");
    this.maxDepth = maxDepth;
  }

  public int maxDepth() {
    return maxDepth;
  }
}
