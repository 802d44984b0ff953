package io.intellixity.nestplan.mutation;

import io.intellixity.nestplan.schema.RelationDescriptor;
import io.intellixity.nestplan.schema.RelationSchema;
import io.intellixity.nestplan.schema.SchemaRegistry;
import io.intellixity.nestplan.util.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a nested write payload into store-native relation mutations.
 * <p>
 * For every declared relation present in the body the value is classified into exactly one {@link ApiAction}
 * per item:
 * <ul>
 *   <li>an explicit marker ({@code apiAction} by default) wins, except that {@code create} on an item
 *   with an {@code id} updates;</li>
 *   <li>a value that only identifies a record ({@code id} or a single unique field) connects;</li>
 *   <li>a value without {@code id} creates;</li>
 *   <li>anything else updates, addressed by {@code id} or the first declared unique field.</li>
 * </ul>
 * Values already shaped as mutation objects (see {@link StoreVerbs}) pass through. Created and updated data
 * is resolved recursively against the related entity's own relations. Markers never reach the output.
 * <p>
 * Stateless apart from the read-only registry: instances are safe to share between threads.
 */
public final class RelationMutationResolver {
  private static final Logger log = LoggerFactory.getLogger(RelationMutationResolver.class);

  private final SchemaRegistry schema;
  private final String markerKey;
  private final ConnectabilityClassifier classifier;
  private final MarkerScrubber scrubber;

  public RelationMutationResolver(SchemaRegistry schema) {
    this(schema, ActionMarkers.DEFAULT_MARKER_KEY);
  }

  public RelationMutationResolver(SchemaRegistry schema, String markerKey) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.markerKey = Objects.requireNonNull(markerKey, "markerKey");
    if (markerKey.isBlank()) throw new IllegalArgumentException("markerKey is blank");
    this.classifier = new ConnectabilityClassifier(schema, markerKey);
    this.scrubber = new MarkerScrubber(markerKey);
  }

  public String markerKey() {
    return markerKey;
  }

  public Map<String, Object> resolve(Map<String, ?> body, RelationSchema relations) {
    return resolve(body, relations, Set.of());
  }

  /** Resolves against the relations the registry declares for {@code entity}. */
  public Map<String, Object> resolve(String entity, Map<String, ?> body, Set<ApiAction> ignoreActions) {
    return resolve(body, schema.relationsOf(entity), ignoreActions);
  }

  /**
   * @param body write payload; never mutated
   * @param relations relation fields of the body's entity
   * @param ignoreActions verbs to drop silently wherever they are requested
   * @return a new, marker-free body with every present relation field rewritten to a mutation object
   * @throws InvalidActionValueException on a marker outside the closed verb set
   * @throws InvalidActionUsageException on a marker left on a body that is not a relation value
   * @throws NoUniqueIdentifierException when an item to update, disconnect or delete cannot be addressed
   */
  public Map<String, Object> resolve(Map<String, ?> body, RelationSchema relations, Set<ApiAction> ignoreActions) {
    Objects.requireNonNull(body, "body");
    Set<ApiAction> ignore = (ignoreActions == null || ignoreActions.isEmpty())
        ? EnumSet.noneOf(ApiAction.class)
        : EnumSet.copyOf(ignoreActions);

    Map<String, Object> copy = Payloads.deepCopyMap(body);
    Map<String, Object> resolved = resolveBody(copy, relations == null ? RelationSchema.empty() : relations, ignore);
    return Payloads.asObject(scrubber.scrub(resolved));
  }

  private Map<String, Object> resolveBody(Map<String, Object> body, RelationSchema relations, Set<ApiAction> ignore) {
    Map<String, Object> out = new LinkedHashMap<>(body);
    for (RelationDescriptor f : relations.list()) resolveList(f, out, ignore);
    for (RelationDescriptor f : relations.singular()) resolveSingular(f, out, ignore);

    if (out.containsKey(markerKey)) throw new InvalidActionUsageException(markerKey);
    return out;
  }

  private void resolveList(RelationDescriptor f, Map<String, Object> out, Set<ApiAction> ignore) {
    Object value = out.get(f.name());
    if (value == null) return;

    ApiAction fieldMarker = ActionMarkers.markerOf(value, markerKey);
    if (fieldMarker != null && ignore.contains(fieldMarker)) {
      out.remove(f.name());
      return;
    }
    if (StoreVerbs.isShaped(value)) return;
    // non-array values are taken as hand-built, but their markers must still be valid
    if (!(value instanceof List<?> items) || !allObjects(items)) {
      validateMarkers(value);
      return;
    }

    FieldMutations mutations = new FieldMutations();
    boolean skipped = false;
    for (Object raw : items) {
      Map<String, Object> item = Payloads.asObject(raw);
      ApiAction marker = ActionMarkers.validate(markerKey, item.get(markerKey));
      if (marker != null && ignore.contains(marker)) {
        skipped = true;
        continue;
      }

      ApiAction verb = classify(f.relatedEntity(), item, marker);
      Object entry = switch (verb) {
        case DELETE -> requireId(f, item);
        case DISCONNECT -> requireIdentifier(f, item).asWhere();
        case CONNECT -> withoutMarker(item);
        case CREATE -> resolveNested(f, withoutMarker(item), ignore);
        case UPDATE -> updateOf(f, item, ignore);
      };
      mutations.add(verb, entry);
    }

    if (skipped && mutations.isEmpty()) {
      out.remove(f.name());
      return;
    }
    Map<String, Object> plan = mutations.toPlan();
    out.put(f.name(), plan);
    if (log.isDebugEnabled()) {
      log.debug("nestplan.resolve relation={} entity={} cardinality=list verbs={}",
          f.name(), f.relatedEntity(), plan.keySet());
    }
  }

  private void resolveSingular(RelationDescriptor f, Map<String, Object> out, Set<ApiAction> ignore) {
    Object value = out.get(f.name());
    if (!(value instanceof Map<?, ?>)) {
      validateMarkers(value);
      return;
    }
    Map<String, Object> item = Payloads.asObject(value);

    ApiAction marker = ActionMarkers.validate(markerKey, item.get(markerKey));
    if (marker != null && ignore.contains(marker)) {
      out.remove(f.name());
      return;
    }
    if (StoreVerbs.isShaped(item)) return;

    ApiAction verb = classify(f.relatedEntity(), item, marker);
    Object entry = switch (verb) {
      case DELETE, DISCONNECT -> Boolean.TRUE;
      case CONNECT -> withoutMarker(item);
      case CREATE -> resolveNested(f, withoutMarker(item), ignore);
      case UPDATE -> updateOf(f, item, ignore);
    };
    Map<String, Object> plan = new LinkedHashMap<>();
    plan.put(verb.wire(), entry);
    out.put(f.name(), plan);
    if (log.isDebugEnabled()) {
      log.debug("nestplan.resolve relation={} entity={} cardinality=singular verb={}",
          f.name(), f.relatedEntity(), verb.wire());
    }
  }

  private ApiAction classify(String relatedEntity, Map<String, Object> item, ApiAction marker) {
    // create is the implicit default, so an item carrying an id still updates
    if (marker != null && marker != ApiAction.CREATE) return marker;
    if (marker == null && classifier.canConnect(relatedEntity, item)) return ApiAction.CONNECT;
    if (item.get(ConnectabilityClassifier.ID_FIELD) == null) return ApiAction.CREATE;
    return ApiAction.UPDATE;
  }

  private Map<String, Object> updateOf(RelationDescriptor f, Map<String, Object> item, Set<ApiAction> ignore) {
    Map<String, Object> data = withoutMarker(item);
    ConnectabilityClassifier.Identifier id = requireIdentifier(f, item);
    data.remove(id.field());

    Map<String, Object> update = new LinkedHashMap<>();
    update.put("where", id.asWhere());
    update.put("data", resolveNested(f, data, ignore));
    return update;
  }

  private Map<String, Object> resolveNested(RelationDescriptor f, Map<String, Object> data, Set<ApiAction> ignore) {
    return resolveBody(data, schema.relationsOf(f.relatedEntity()), ignore);
  }

  private ConnectabilityClassifier.Identifier requireIdentifier(RelationDescriptor f, Map<String, Object> item) {
    ConnectabilityClassifier.Identifier id = classifier.identifierOf(f.relatedEntity(), item);
    if (id == null) throw new NoUniqueIdentifierException(f.relatedEntity(), f.name(), item);
    return id;
  }

  private Object requireId(RelationDescriptor f, Map<String, Object> item) {
    Object id = item.get(ConnectabilityClassifier.ID_FIELD);
    if (id == null) throw new NoUniqueIdentifierException(f.relatedEntity(), f.name(), item);
    return id;
  }

  private Map<String, Object> withoutMarker(Map<String, Object> item) {
    Map<String, Object> out = new LinkedHashMap<>(item);
    out.remove(markerKey);
    return out;
  }

  private void validateMarkers(Object value) {
    if (value instanceof Map<?, ?>) {
      ActionMarkers.markerOf(value, markerKey);
    } else if (value instanceof List<?> items) {
      for (Object x : items) ActionMarkers.markerOf(x, markerKey);
    }
  }

  private static boolean allObjects(List<?> items) {
    for (Object x : items) {
      if (!(x instanceof Map<?, ?>)) return false;
    }
    return true;
  }
}
