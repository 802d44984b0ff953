package io.intellixity.nestplan.schema.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.intellixity.nestplan.schema.EntitySchema;
import io.intellixity.nestplan.schema.RelationDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Loads entity declarations from YAML.
 * <p>
 * One entity per YAML document; a file may hold several documents separated by {@code ---}:
 * <pre>
 * entity: Post
 * unique: [slug]
 * relations:
 *   category: ref(Category)
 *   tags: list&lt;ref(Tag)&gt;
 *   author: { type: ref(User), foreignKey: authorId, references: id }
 * </pre>
 */
public final class YamlSchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlSchemaLoader.class);

  private final ObjectMapper yaml = new YAMLMapper();

  public List<EntitySchema> loadDir(Path dir) {
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(p -> isYaml(p.getFileName().toString())).sorted().toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list schema directory " + dir, e);
    }
    List<EntitySchema> out = new ArrayList<>();
    for (Path p : files) out.addAll(loadFile(p));
    return out;
  }

  public List<EntitySchema> loadFile(Path file) {
    try (InputStream in = Files.newInputStream(file)) {
      return load(in, file.toString());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema file " + file, e);
    }
  }

  public List<EntitySchema> loadResource(String resource) {
    return loadResource(resource, Thread.currentThread().getContextClassLoader());
  }

  public List<EntitySchema> loadResource(String resource, ClassLoader cl) {
    ClassLoader loader = (cl != null) ? cl : YamlSchemaLoader.class.getClassLoader();
    InputStream in = loader.getResourceAsStream(resource);
    if (in == null) throw new IllegalArgumentException("Schema resource not found: " + resource);
    try (in) {
      return load(in, resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read schema resource " + resource, e);
    }
  }

  public List<EntitySchema> load(InputStream in, String sourceName) throws IOException {
    List<EntitySchema> out = new ArrayList<>();
    try (MappingIterator<JsonNode> docs = yaml.readerFor(JsonNode.class).readValues(in)) {
      while (docs.hasNext()) {
        JsonNode doc = docs.next();
        if (doc == null || doc.isNull() || doc.isMissingNode()) continue;
        out.add(parseEntity(doc, sourceName));
      }
    }
    log.debug("nestplan.schema source={} entities={}", sourceName, out.size());
    return out;
  }

  private static EntitySchema parseEntity(JsonNode doc, String sourceName) {
    if (!doc.isObject()) throw new IllegalArgumentException("Schema document must be a mapping: " + sourceName);
    String entity = text(doc.get("entity"));
    if (entity == null) throw new IllegalArgumentException("'entity' is required in " + sourceName);

    Set<String> unique = new LinkedHashSet<>();
    JsonNode u = doc.get("unique");
    if (u != null && !u.isNull()) {
      if (!u.isArray()) throw new IllegalArgumentException("'unique' must be a list for entity: " + entity);
      for (JsonNode x : u) {
        String f = text(x);
        if (f != null) unique.add(f);
      }
    }

    List<RelationDescriptor> relations = new ArrayList<>();
    JsonNode r = doc.get("relations");
    if (r != null && !r.isNull()) {
      if (!r.isObject()) throw new IllegalArgumentException("'relations' must be a mapping for entity: " + entity);
      Iterator<Map.Entry<String, JsonNode>> it = r.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        relations.add(parseRelation(entity, e.getKey(), e.getValue()));
      }
    }
    return new EntitySchema(entity, relations, unique);
  }

  private static RelationDescriptor parseRelation(String entity, String name, JsonNode spec) {
    String type;
    String foreignKey = null;
    String references = null;
    if (spec != null && spec.isTextual()) {
      type = spec.asText();
    } else if (spec != null && spec.isObject()) {
      type = text(spec.get("type"));
      foreignKey = text(spec.get("foreignKey"));
      references = text(spec.get("references"));
    } else {
      throw new IllegalArgumentException("Relation '" + name + "' of entity " + entity + " needs a type");
    }

    RelationTypeParser.RelationType rt;
    try {
      rt = RelationTypeParser.parse(type);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Relation '" + name + "' of entity " + entity + ": " + e.getMessage(), e);
    }
    return new RelationDescriptor(name, rt.relatedEntity(), rt.cardinality(), foreignKey, references);
  }

  private static String text(JsonNode n) {
    if (n == null || n.isNull() || !n.isValueNode()) return null;
    String s = n.asText().trim();
    return s.isEmpty() ? null : s;
  }

  private static boolean isYaml(String name) {
    return name.endsWith(".yml") || name.endsWith(".yaml");
  }
}
