package io.intellixity.sift.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads entity descriptors from JSON.
 *
 * <pre>
 * { "entities": [
 *   { "name": "Movie", "source": "movies", "key": "id",
 *     "fields": [ { "name": "id", "type": "int", "nullable": false }, { "name": "title", "type": "string", "column": "title" } ],
 *     "relations": [ { "name": "actors", "cardinality": "to_many", "target": "Actor", "foreignKey": "movieId" } ] }
 * ] }
 * </pre>
 */
public final class EntityRegistryJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private EntityRegistryJson() {}

  public static EntityRegistry load(InputStream in) {
    try {
      return fromTree(JSON.readTree(in));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read entity registry JSON", e);
    }
  }

  /** Loads a classpath resource (context class loader). */
  public static EntityRegistry loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = EntityRegistryJson.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Entity registry resource not found: " + resource);
      return load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  public static EntityRegistry fromTree(JsonNode root) {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Entity registry JSON must be an object");
    JsonNode arr = root.get("entities");
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException("Entity registry JSON requires an 'entities' array");

    EntityRegistry.Builder b = EntityRegistry.builder();
    for (JsonNode e : arr) b.register(parseEntity(e));
    return b.build();
  }

  private static EntityDescriptor parseEntity(JsonNode n) {
    String name = requiredText(n, "name", "entity");
    List<FieldDef> fields = new ArrayList<>();
    JsonNode fs = n.get("fields");
    if (fs != null && fs.isArray()) {
      for (JsonNode f : fs) {
        fields.add(new FieldDef(
            requiredText(f, "name", name + ".fields[]"),
            SemanticType.fromId(requiredText(f, "type", name + ".fields[]")),
            f.path("nullable").asBoolean(true),
            textOrNull(f.get("column"))));
      }
    }
    List<RelationDef> relations = new ArrayList<>();
    JsonNode rs = n.get("relations");
    if (rs != null && rs.isArray()) {
      for (JsonNode r : rs) {
        relations.add(new RelationDef(
            requiredText(r, "name", name + ".relations[]"),
            Cardinality.valueOf(requiredText(r, "cardinality", name + ".relations[]").toUpperCase(Locale.ROOT)),
            requiredText(r, "target", name + ".relations[]"),
            requiredText(r, "foreignKey", name + ".relations[]")));
      }
    }
    return new EntityDescriptor(name, textOrNull(n.get("source")), textOrNull(n.get("key")), fields, relations);
  }

  private static String requiredText(JsonNode n, String field, String where) {
    String v = textOrNull(n == null ? null : n.get(field));
    if (v == null || v.isBlank()) throw new IllegalArgumentException(where + " requires '" + field + "'");
    return v;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
