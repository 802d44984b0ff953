package io.intellixity.nestplan.mutation;

import io.intellixity.nestplan.schema.EntitySchema;
import io.intellixity.nestplan.schema.InMemorySchemaRegistry;
import io.intellixity.nestplan.schema.RelationDescriptor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class Fixtures {
  private Fixtures() {}

  /** Post / User / Comment graph with unique fields on Category, Tag and User. */
  static InMemorySchemaRegistry blog() {
    return InMemorySchemaRegistry.of(
        new EntitySchema("Post", List.of(
            RelationDescriptor.singular("category", "Category"),
            RelationDescriptor.list("tags", "Tag"),
            RelationDescriptor.list("comments", "Comment")
        ), Set.of("slug")),
        new EntitySchema("User", List.of(
            RelationDescriptor.singular("profile", "Profile"),
            RelationDescriptor.list("posts", "Post")
        ), Set.of("email", "username")),
        new EntitySchema("Comment", List.of(
            RelationDescriptor.singular("author", "User")
        ), Set.of()),
        new EntitySchema("Category", List.of(), Set.of("name")),
        new EntitySchema("Tag", List.of(), Set.of("name")),
        new EntitySchema("Profile", List.of(), Set.of())
    );
  }

  /** Product with relations to entities that declare nothing unique besides id. */
  static InMemorySchemaRegistry catalog() {
    return InMemorySchemaRegistry.of(
        new EntitySchema("Product", List.of(
            RelationDescriptor.singular("category", "Category"),
            RelationDescriptor.list("tags", "Tag")
        ), Set.of()),
        new EntitySchema("Category", List.of(), Set.of()),
        new EntitySchema("Tag", List.of(), Set.of())
    );
  }

  /** Insertion-ordered map that tolerates null values. */
  static Map<String, Object> map(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }
}
