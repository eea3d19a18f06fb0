package io.intellixity.sift.plan;

import io.intellixity.sift.model.SemanticType;

import java.util.Objects;

/**
 * One column of a {@link RowShape}.
 *
 * @param qualifier source alias, or null for derived columns (projections, aggregates, lets, group keys)
 * @param name      column name within its qualifier
 * @param type      semantic type
 * @param nullable  whether values may be null
 */
public record Column(String qualifier, String name, SemanticType type, boolean nullable) {
  public Column {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("column name is required");
    Objects.requireNonNull(type, "type");
  }

  public static Column derived(String name, SemanticType type, boolean nullable) {
    return new Column(null, name, type, nullable);
  }

  @Override
  public String toString() {
    return (qualifier == null ? "" : qualifier + ".") + name + ":" + type.id() + (nullable ? "?" : "");
  }
}
