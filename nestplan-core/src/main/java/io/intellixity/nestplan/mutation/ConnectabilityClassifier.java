package io.intellixity.nestplan.mutation;

import io.intellixity.nestplan.schema.SchemaRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a relation value only identifies an existing record, and which field identifies it.
 * <p>
 * A value can connect when it is explicitly marked {@code connect}, or when its single significant field is
 * {@code id} or one of the related entity's declared unique fields, with a non-null value.
 */
public final class ConnectabilityClassifier {
  public static final String ID_FIELD = "id";

  private final SchemaRegistry schema;
  private final String markerKey;

  public ConnectabilityClassifier(SchemaRegistry schema) {
    this(schema, ActionMarkers.DEFAULT_MARKER_KEY);
  }

  public ConnectabilityClassifier(SchemaRegistry schema, String markerKey) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.markerKey = Objects.requireNonNull(markerKey, "markerKey");
  }

  public boolean canConnect(String relatedEntity, Map<String, ?> candidate) {
    if (candidate == null) return false;

    Object marker = candidate.get(markerKey);
    if (marker != null) return ApiAction.CONNECT.wire().equals(marker);

    String only = null;
    int significant = 0;
    for (String k : candidate.keySet()) {
      if (markerKey.equals(k)) continue;
      significant++;
      only = k;
    }
    if (significant != 1) return false;

    if (candidate.get(only) == null) return false;
    return ID_FIELD.equals(only) || schema.uniqueFieldsOf(relatedEntity).contains(only);
  }

  /**
   * Picks the field used to address an existing record: {@code id} when set, otherwise the first non-null
   * unique field (in payload order).
   *
   * @return the identifier, or null when the fields carry none
   */
  public Identifier identifierOf(String relatedEntity, Map<String, ?> fields) {
    if (fields == null) return null;
    Object id = fields.get(ID_FIELD);
    if (id != null) return new Identifier(ID_FIELD, id);

    Set<String> unique = schema.uniqueFieldsOf(relatedEntity);
    for (var e : fields.entrySet()) {
      String k = e.getKey();
      if (markerKey.equals(k) || ID_FIELD.equals(k)) continue;
      if (e.getValue() != null && unique.contains(k)) return new Identifier(k, e.getValue());
    }
    return null;
  }

  /** A {@code field = value} pair addressing one existing record. */
  public record Identifier(String field, Object value) {
    public Identifier {
      Objects.requireNonNull(field, "field");
    }

    public Map<String, Object> asWhere() {
      Map<String, Object> where = new LinkedHashMap<>();
      where.put(field, value);
      return where;
    }
  }
}
