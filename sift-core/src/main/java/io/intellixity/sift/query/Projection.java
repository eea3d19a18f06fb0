package io.intellixity.sift.query;

import java.util.Objects;

/**
 * Named output expression.
 *
 * @param name output column name
 * @param expr value
 */
public record Projection(String name, Expr expr) {
  public Projection {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("projection name is required");
    if (name.contains(".")) throw new IllegalArgumentException("projection name must not contain '.': " + name);
    Objects.requireNonNull(expr, "expr");
  }

  /** Projects a field under its own (unqualified) name. */
  public static Projection of(String fieldPath) {
    FieldRef f = FieldRef.parse(fieldPath);
    return new Projection(f.name(), f);
  }

  public static Projection as(String name, Expr expr) {
    return new Projection(name, expr);
  }
}
