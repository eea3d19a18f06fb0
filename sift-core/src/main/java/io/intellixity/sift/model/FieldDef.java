package io.intellixity.sift.model;

import java.util.Objects;

/**
 * One scalar field of an entity.
 *
 * @param name     logical field name used in queries
 * @param type     semantic type
 * @param nullable whether stored values may be null
 * @param column   storage column / document key (defaults to {@code name})
 */
public record FieldDef(String name, SemanticType type, boolean nullable, String column) {
  public FieldDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is required");
    if (name.contains(".")) throw new IllegalArgumentException("field name must not contain '.': " + name);
    Objects.requireNonNull(type, "type");
    if (!type.isScalar()) throw new IllegalArgumentException("field '" + name + "' must have a scalar type");
    column = (column == null || column.isBlank()) ? name : column;
  }

  public FieldDef(String name, SemanticType type, boolean nullable) {
    this(name, type, nullable, null);
  }
}
