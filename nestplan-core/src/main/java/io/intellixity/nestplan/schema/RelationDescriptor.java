package io.intellixity.nestplan.schema;

/**
 * A declared relation field on an owning entity.
 *
 * @param name field name on the owning entity
 * @param relatedEntity referenced entity name
 * @param cardinality singular or list
 * @param foreignKeyField optional local join key; null when the store default applies
 * @param foreignReferenceField optional join target on the related entity; null means {@code id}
 */
public record RelationDescriptor(
    String name,
    String relatedEntity,
    Cardinality cardinality,
    String foreignKeyField,
    String foreignReferenceField
) {
  public static final String DEFAULT_REFERENCE_FIELD = "id";

  public RelationDescriptor {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("relation name is required");
    if (relatedEntity == null || relatedEntity.isBlank()) {
      throw new IllegalArgumentException("relatedEntity is required for relation: " + name);
    }
    cardinality = cardinality == null ? Cardinality.SINGULAR : cardinality;
    foreignKeyField = blankToNull(foreignKeyField);
    foreignReferenceField = blankToNull(foreignReferenceField);
  }

  public static RelationDescriptor singular(String name, String relatedEntity) {
    return new RelationDescriptor(name, relatedEntity, Cardinality.SINGULAR, null, null);
  }

  public static RelationDescriptor list(String name, String relatedEntity) {
    return new RelationDescriptor(name, relatedEntity, Cardinality.LIST, null, null);
  }

  public boolean isList() {
    return cardinality == Cardinality.LIST;
  }

  public String referenceFieldOrDefault() {
    return foreignReferenceField == null ? DEFAULT_REFERENCE_FIELD : foreignReferenceField;
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }
}
