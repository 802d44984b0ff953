package io.intellixity.nestplan.schema.yaml;

import io.intellixity.nestplan.schema.Cardinality;

/**
 * Tiny relation type DSL.
 * <pre>
 *   ref(Category)      singular
 *   Category           singular
 *   list&lt;ref(Tag)&gt;     list (also set&lt;..&gt; and array&lt;..&gt;)
 *   Tag[]              list
 * </pre>
 */
final class RelationTypeParser {
  private RelationTypeParser() {}

  record RelationType(String relatedEntity, Cardinality cardinality) {}

  static RelationType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("relation type is blank");
    String t = s.trim();

    String inner = collectionElement(t);
    if (inner != null) {
      RelationType element = parse(inner);
      if (element.cardinality() == Cardinality.LIST) {
        throw new IllegalArgumentException("nested collections are not relations: " + s);
      }
      return new RelationType(element.relatedEntity(), Cardinality.LIST);
    }

    if (t.startsWith("ref(") && t.endsWith(")")) {
      return new RelationType(entityName(t.substring("ref(".length(), t.length() - 1), s), Cardinality.SINGULAR);
    }
    return new RelationType(entityName(t, s), Cardinality.SINGULAR);
  }

  private static String collectionElement(String t) {
    for (String prefix : new String[] {"list<", "set<", "array<"}) {
      if (t.startsWith(prefix) && t.endsWith(">")) return t.substring(prefix.length(), t.length() - 1);
    }
    if (t.endsWith("[]")) return t.substring(0, t.length() - 2);
    return null;
  }

  private static String entityName(String raw, String original) {
    String id = raw.trim();
    if (id.isEmpty() || !Character.isJavaIdentifierStart(id.charAt(0))) {
      throw new IllegalArgumentException("invalid relation type: " + original);
    }
    for (int i = 1; i < id.length(); i++) {
      if (!Character.isJavaIdentifierPart(id.charAt(i))) {
        throw new IllegalArgumentException("invalid relation type: " + original);
      }
    }
    return id;
  }
}
