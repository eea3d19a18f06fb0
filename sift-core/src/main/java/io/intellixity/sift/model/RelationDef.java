package io.intellixity.sift.model;

import java.util.Objects;

/**
 * Navigable relation from one entity to another.
 * <p>
 * {@link Cardinality#TO_MANY}: {@code foreignKey} is a field of the target referencing the owner's key.<br>
 * {@link Cardinality#TO_ONE}: {@code foreignKey} is a field of the owner referencing the target's key.
 */
public record RelationDef(String name, Cardinality cardinality, String targetEntity, String foreignKey) {
  public RelationDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("relation name is required");
    Objects.requireNonNull(cardinality, "cardinality");
    if (targetEntity == null || targetEntity.isBlank()) throw new IllegalArgumentException("targetEntity is required for relation: " + name);
    if (foreignKey == null || foreignKey.isBlank()) throw new IllegalArgumentException("foreignKey is required for relation: " + name);
  }
}
