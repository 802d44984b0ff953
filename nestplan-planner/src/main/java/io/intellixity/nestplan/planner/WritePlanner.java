package io.intellixity.nestplan.planner;

import io.intellixity.nestplan.mutation.ApiAction;
import io.intellixity.nestplan.mutation.RelationMutationResolver;
import io.intellixity.nestplan.schema.ListableSchemaRegistry;
import io.intellixity.nestplan.schema.SchemaRegistry;
import io.intellixity.nestplan.util.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry points used by the CRUD service layer before handing a body to the store.
 * <p>
 * Creating a root entity may only create or connect related records; updating one may use every verb.
 */
public final class WritePlanner {
  private static final Logger log = LoggerFactory.getLogger(WritePlanner.class);

  /** Verbs dropped when the root record does not exist yet. */
  public static final Set<ApiAction> CREATE_IGNORED = Set.of(ApiAction.UPDATE, ApiAction.DELETE, ApiAction.DISCONNECT);

  private final SchemaRegistry schema;
  private final PlannerSettings settings;
  private final RelationMutationResolver resolver;

  public WritePlanner(SchemaRegistry schema) {
    this(schema, PlannerSettings.defaults());
  }

  public WritePlanner(SchemaRegistry schema, PlannerSettings settings) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.resolver = new RelationMutationResolver(schema, settings.markerKey());
  }

  public PlannerSettings settings() {
    return settings;
  }

  public Map<String, Object> planCreate(String entity, Map<String, ?> body) {
    return plan(entity, body, CREATE_IGNORED, "create");
  }

  /** Applies {@link #planCreate} to each body; one failure fails the batch. */
  public List<Map<String, Object>> planCreateMany(String entity, List<? extends Map<String, ?>> bodies) {
    Objects.requireNonNull(bodies, "bodies");
    List<Map<String, Object>> out = new ArrayList<>(bodies.size());
    for (Map<String, ?> body : bodies) {
      out.add(plan(entity, body, CREATE_IGNORED, "createMany"));
    }
    return out;
  }

  public Map<String, Object> planUpdate(String entity, Map<String, ?> body) {
    return plan(entity, body, Set.of(), "update");
  }

  private Map<String, Object> plan(String entity, Map<String, ?> body, Set<ApiAction> ignore, String op) {
    requireEntity(entity);
    Objects.requireNonNull(body, "body");

    int maxDepth = settings.maxDepth();
    if (maxDepth > 0 && Payloads.depthExceeds(body, maxDepth)) {
      throw new PayloadTooDeepException(entity, maxDepth);
    }

    Map<String, Object> planned = resolver.resolve(entity, body, ignore);
    if (log.isDebugEnabled()) {
      log.debug("nestplan.plan op={} entity={} fields={}", op, entity, planned.keySet());
    }
    return planned;
  }

  private void requireEntity(String entity) {
    if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity is required");
    if (schema instanceof ListableSchemaRegistry l && !l.contains(entity)) {
      throw new IllegalArgumentException("Unknown entity: " + entity);
    }
  }
}
