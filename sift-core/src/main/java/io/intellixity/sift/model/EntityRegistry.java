package io.intellixity.sift.model;

import io.intellixity.sift.error.DuplicateEntityException;
import io.intellixity.sift.error.TypeMismatchException;
import io.intellixity.sift.error.UnknownEntityException;
import io.intellixity.sift.error.UnknownFieldException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link EntityDescriptor}s.
 * <p>
 * Populated once through {@link Builder} during process initialization, read-only afterwards and
 * shared by builders, planners and adapters without locking.
 */
public final class EntityRegistry {
  private final Map<String, EntityDescriptor> entities;
  private final Map<CacheKey, ResolvedField> cache = new ConcurrentHashMap<>();

  private EntityRegistry(Map<String, EntityDescriptor> entities) {
    this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public static Builder builder() { return new Builder(); }

  /** Returns the descriptor, failing with {@link UnknownEntityException} when it is not registered. */
  public EntityDescriptor entity(String name) {
    EntityDescriptor e = (name == null) ? null : entities.get(name);
    if (e == null) throw new UnknownEntityException(name);
    return e;
  }

  public boolean contains(String name) { return name != null && entities.containsKey(name); }

  /** Descriptors in registration order. */
  public Collection<EntityDescriptor> entities() { return entities.values(); }

  /**
   * Resolve a field path (e.g. {@code title} or {@code director.name}) against an entity.
   * Dot segments navigate TO_ONE relations.
   */
  public ResolvedField resolveField(String entity, String fieldPath) {
    EntityDescriptor root = entity(entity);
    return cache.computeIfAbsent(new CacheKey(root.name(), fieldPath), k -> resolveNoCache(root, fieldPath));
  }

  /** As {@link #resolveField(String, String)} and additionally checks the leaf is comparable with {@code expected}. */
  public ResolvedField resolveField(String entity, String fieldPath, SemanticType expected) {
    ResolvedField rf = resolveField(entity, fieldPath);
    if (expected != null && !rf.type().comparableWith(expected)) {
      throw new TypeMismatchException("Field '" + entity + "." + fieldPath + "' has type " + rf.type().id()
          + " which is incompatible with " + expected.id());
    }
    return rf;
  }

  private ResolvedField resolveNoCache(EntityDescriptor root, String fieldPath) {
    if (fieldPath == null || fieldPath.isBlank()) throw new UnknownFieldException(root.name(), String.valueOf(fieldPath));
    String[] parts = fieldPath.split("\\.", -1);
    EntityDescriptor current = root;
    List<RelationDef> via = new ArrayList<>();

    for (int i = 0; i < parts.length; i++) {
      String part = parts[i];
      boolean last = (i == parts.length - 1);
      FieldDef fd = current.field(part);
      if (fd != null) {
        if (!last) {
          throw new TypeMismatchException("Cannot navigate through scalar field '" + current.name() + "." + part
              + "' in path '" + fieldPath + "'");
        }
        return new ResolvedField(root, current, fd, fieldPath, via);
      }

      RelationDef rel = current.relation(part);
      if (rel == null) throw new UnknownFieldException(root.name(), fieldPath);
      if (last) {
        throw new TypeMismatchException("Path '" + fieldPath + "' ends on relation '" + rel.name()
            + "', a scalar field is required");
      }
      if (rel.cardinality() != Cardinality.TO_ONE) {
        throw new TypeMismatchException("Path '" + fieldPath + "' navigates to-many relation '" + rel.name()
            + "'; join it explicitly");
      }
      via.add(rel);
      current = entity(rel.targetEntity());
    }
    throw new UnknownFieldException(root.name(), fieldPath);
  }

  private record CacheKey(String rootType, String propertyPath) {}

  public static final class Builder {
    private final Map<String, EntityDescriptor> entities = new LinkedHashMap<>();

    private Builder() {}

    /** Registers a descriptor; fails with {@link DuplicateEntityException} if the name is taken. */
    public Builder register(EntityDescriptor descriptor) {
      Objects.requireNonNull(descriptor, "descriptor");
      if (entities.containsKey(descriptor.name())) throw new DuplicateEntityException(descriptor.name());
      entities.put(descriptor.name(), descriptor);
      return this;
    }

    public Builder registerAll(Collection<EntityDescriptor> descriptors) {
      for (EntityDescriptor d : descriptors) register(d);
      return this;
    }

    /**
     * Freezes the registry. Relation targets and foreign keys are checked here so that a half-wired
     * model never becomes visible.
     */
    public EntityRegistry build() {
      for (EntityDescriptor e : entities.values()) {
        for (RelationDef r : e.relations()) {
          EntityDescriptor target = entities.get(r.targetEntity());
          if (target == null) {
            throw new UnknownEntityException(r.targetEntity());
          }
          EntityDescriptor fkOwner = (r.cardinality() == Cardinality.TO_MANY) ? target : e;
          EntityDescriptor keyOwner = (r.cardinality() == Cardinality.TO_MANY) ? e : target;
          FieldDef fk = fkOwner.field(r.foreignKey());
          if (fk == null) throw new UnknownFieldException(fkOwner.name(), r.foreignKey());
          if (keyOwner.keyField() == null) {
            throw new IllegalArgumentException("Relation '" + e.name() + "." + r.name() + "' requires entity '"
                + keyOwner.name() + "' to declare a key field");
          }
          FieldDef key = keyOwner.field(keyOwner.keyField());
          if (!fk.type().comparableWith(key.type())) {
            throw new TypeMismatchException("Relation '" + e.name() + "." + r.name() + "' joins " + fk.type().id()
                + " foreign key to " + key.type().id() + " key");
          }
        }
      }
      return new EntityRegistry(entities);
    }
  }
}
