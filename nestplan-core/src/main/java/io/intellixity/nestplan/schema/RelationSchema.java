package io.intellixity.nestplan.schema;

import java.util.ArrayList;
import java.util.List;

/** Relation fields of one entity, split by cardinality. Declaration order is kept. */
public record RelationSchema(
    List<RelationDescriptor> singular,
    List<RelationDescriptor> list
) {
  private static final RelationSchema EMPTY = new RelationSchema(List.of(), List.of());

  public RelationSchema {
    singular = singular == null ? List.of() : List.copyOf(singular);
    list = list == null ? List.of() : List.copyOf(list);
  }

  public static RelationSchema empty() {
    return EMPTY;
  }

  public static RelationSchema of(List<RelationDescriptor> relations) {
    if (relations == null || relations.isEmpty()) return EMPTY;
    List<RelationDescriptor> one = new ArrayList<>();
    List<RelationDescriptor> many = new ArrayList<>();
    for (RelationDescriptor r : relations) {
      if (r.isList()) many.add(r);
      else one.add(r);
    }
    return new RelationSchema(one, many);
  }

  public boolean isEmpty() {
    return singular.isEmpty() && list.isEmpty();
  }
}
