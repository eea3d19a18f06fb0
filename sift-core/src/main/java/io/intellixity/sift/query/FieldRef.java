package io.intellixity.sift.query;

/**
 * Reference to a column of the current row.
 *
 * @param qualifier source alias ({@code m} in {@code m.title}); null resolves by name alone
 * @param name      column name
 */
public record FieldRef(String qualifier, String name) implements Expr {
  public FieldRef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is required");
    qualifier = (qualifier == null || qualifier.isBlank()) ? null : qualifier;
  }

  /** Parses {@code alias.name} or {@code name}. */
  public static FieldRef parse(String path) {
    if (path == null || path.isBlank()) throw new IllegalArgumentException("field path is required");
    int dot = path.indexOf('.');
    if (dot < 0) return new FieldRef(null, path);
    return new FieldRef(path.substring(0, dot), path.substring(dot + 1));
  }

  public String path() { return qualifier == null ? name : qualifier + "." + name; }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return path(); }
}
