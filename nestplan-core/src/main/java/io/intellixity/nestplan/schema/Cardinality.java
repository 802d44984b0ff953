package io.intellixity.nestplan.schema;

/** How many related records a relation field holds. */
public enum Cardinality {
  SINGULAR,
  LIST
}
