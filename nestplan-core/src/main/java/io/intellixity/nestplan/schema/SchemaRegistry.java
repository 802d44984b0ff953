package io.intellixity.nestplan.schema;

import java.util.Set;

/**
 * Read-only view of the declared entity/relation schema.
 * <p>
 * Implementations must be fully built before the first lookup and never change afterwards.
 * Unknown entities answer with an empty schema and no unique fields.
 */
public interface SchemaRegistry {
  RelationSchema relationsOf(String entity);

  Set<String> uniqueFieldsOf(String entity);
}
