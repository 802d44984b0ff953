package io.intellixity.nestplan.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simple in-memory {@link ListableSchemaRegistry}.
 * <p>
 * Built once from declarations; lookups never mutate, so concurrent readers need no locking.
 */
public final class InMemorySchemaRegistry implements ListableSchemaRegistry {
  private final Map<String, EntitySchema> entities = new LinkedHashMap<>();
  private final Map<String, RelationSchema> relations = new LinkedHashMap<>();

  public InMemorySchemaRegistry(List<EntitySchema> schemas) {
    if (schemas != null) {
      for (EntitySchema es : schemas) {
        if (entities.putIfAbsent(es.entity(), es) != null) {
          throw new IllegalArgumentException("Duplicate entity declaration: " + es.entity());
        }
        relations.put(es.entity(), es.relationSchema());
      }
    }
  }

  public static InMemorySchemaRegistry of(EntitySchema... schemas) {
    return new InMemorySchemaRegistry(List.of(schemas));
  }

  @Override
  public RelationSchema relationsOf(String entity) {
    RelationSchema rs = relations.get(entity);
    return rs == null ? RelationSchema.empty() : rs;
  }

  @Override
  public Set<String> uniqueFieldsOf(String entity) {
    EntitySchema es = entities.get(entity);
    return es == null ? Set.of() : es.uniqueFields();
  }

  @Override
  public Collection<EntitySchema> allEntities() {
    return Collections.unmodifiableCollection(entities.values());
  }

  @Override
  public boolean contains(String entity) {
    return entities.containsKey(entity);
  }
}
