package io.intellixity.nestplan.mutation;

import java.util.Map;

/** An item addressing an existing record has neither an id nor a declared unique field. */
public final class NoUniqueIdentifierException extends RelationMutationException {
  public static final String CODE = "NoUniqueIdentifier";

  private final String relatedEntity;
  private final Map<String, Object> item;

  public NoUniqueIdentifierException(String relatedEntity, String relation, Map<String, Object> item) {
    super(CODE, "No unique fields to be used in the where clause of relation '" + relation
        + "' (entity " + relatedEntity + ")");
    this.relatedEntity = relatedEntity;
    this.item = item == null ? Map.of() : item;
  }

  public String relatedEntity() {
    return relatedEntity;
  }

  /** The offending item, marker included. */
  public Map<String, Object> item() {
    return item;
  }
}
