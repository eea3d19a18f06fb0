package io.intellixity.sift.model;

import java.util.*;

/**
 * Typed description of an entity: its storage source, key, ordered fields and relations.\n
 *
 * Immutable once built; shared freely between threads.
 */
public final class EntityDescriptor {
  private final String name;
  private final String source;
  private final String keyField;
  private final List<FieldDef> fields;
  private final List<RelationDef> relations;
  private final Map<String, FieldDef> fieldsByName;
  private final Map<String, RelationDef> relationsByName;

  public EntityDescriptor(String name, String source, String keyField, List<FieldDef> fields, List<RelationDef> relations) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("entity name is required");
    this.name = name;
    this.source = (source == null || source.isBlank()) ? name : source;
    this.fields = List.copyOf(fields == null ? List.of() : fields);
    this.relations = List.copyOf(relations == null ? List.of() : relations);
    if (this.fields.isEmpty()) throw new IllegalArgumentException("entity '" + name + "' has no fields");

    Map<String, FieldDef> fm = new LinkedHashMap<>();
    for (FieldDef f : this.fields) {
      if (fm.put(f.name(), f) != null) throw new IllegalArgumentException("duplicate field '" + f.name() + "' in entity: " + name);
    }
    Map<String, RelationDef> rm = new LinkedHashMap<>();
    for (RelationDef r : this.relations) {
      if (fm.containsKey(r.name())) throw new IllegalArgumentException("relation '" + r.name() + "' clashes with a field in entity: " + name);
      if (rm.put(r.name(), r) != null) throw new IllegalArgumentException("duplicate relation '" + r.name() + "' in entity: " + name);
    }
    this.fieldsByName = Collections.unmodifiableMap(fm);
    this.relationsByName = Collections.unmodifiableMap(rm);

    if (keyField != null && !fm.containsKey(keyField)) {
      throw new IllegalArgumentException("key field '" + keyField + "' is not a field of entity: " + name);
    }
    this.keyField = keyField;
  }

  public String name() { return name; }
  /** Table / collection name. */
  public String source() { return source; }
  /** Key field name, or null when the entity has no declared key. */
  public String keyField() { return keyField; }
  public List<FieldDef> fields() { return fields; }
  public List<RelationDef> relations() { return relations; }

  /** Returns the field, or null if unknown. */
  public FieldDef field(String fieldName) { return fieldsByName.get(fieldName); }

  /** Returns the relation, or null if unknown. */
  public RelationDef relation(String relationName) { return relationsByName.get(relationName); }

  public static Builder builder(String name) { return new Builder(name); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EntityDescriptor e)) return false;
    return name.equals(e.name) && source.equals(e.source) && Objects.equals(keyField, e.keyField)
        && fields.equals(e.fields) && relations.equals(e.relations);
  }

  @Override
  public int hashCode() { return Objects.hash(name, source, keyField, fields, relations); }

  @Override
  public String toString() { return "EntityDescriptor[" + name + "]"; }

  public static final class Builder {
    private final String name;
    private String source;
    private String key;
    private final List<FieldDef> fields = new ArrayList<>();
    private final List<RelationDef> relations = new ArrayList<>();

    private Builder(String name) { this.name = name; }

    public Builder source(String source) { this.source = source; return this; }
    public Builder key(String key) { this.key = key; return this; }
    public Builder field(String name, SemanticType type) { return field(new FieldDef(name, type, true)); }
    public Builder field(String name, SemanticType type, boolean nullable) { return field(new FieldDef(name, type, nullable)); }
    public Builder field(String name, SemanticType type, boolean nullable, String column) { return field(new FieldDef(name, type, nullable, column)); }
    public Builder field(FieldDef field) { fields.add(Objects.requireNonNull(field, "field")); return this; }
    public Builder toOne(String name, String target, String foreignKey) { return relation(new RelationDef(name, Cardinality.TO_ONE, target, foreignKey)); }
    public Builder toMany(String name, String target, String foreignKey) { return relation(new RelationDef(name, Cardinality.TO_MANY, target, foreignKey)); }
    public Builder relation(RelationDef relation) { relations.add(Objects.requireNonNull(relation, "relation")); return this; }

    public EntityDescriptor build() { return new EntityDescriptor(name, source, key, fields, relations); }
  }
}
