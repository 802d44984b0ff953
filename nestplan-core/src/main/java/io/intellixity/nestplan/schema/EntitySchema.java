package io.intellixity.nestplan.schema;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Declared relation and uniqueness information for one entity. */
public record EntitySchema(
    String entity,
    List<RelationDescriptor> relations,
    Set<String> uniqueFields
) {
  public EntitySchema {
    if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity name is required");
    relations = relations == null ? List.of() : List.copyOf(relations);
    Set<String> seen = new HashSet<>();
    for (RelationDescriptor r : relations) {
      if (!seen.add(r.name())) {
        throw new IllegalArgumentException("Duplicate relation '" + r.name() + "' on entity: " + entity);
      }
    }
    // keep declaration order for unique fields
    uniqueFields = uniqueFields == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(uniqueFields));
  }

  public RelationSchema relationSchema() {
    return RelationSchema.of(relations);
  }
}
