package io.intellixity.nestplan.schema;

import java.util.Collection;

public interface ListableSchemaRegistry extends SchemaRegistry {
  Collection<EntitySchema> allEntities();

  boolean contains(String entity);
}
