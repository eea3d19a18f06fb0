package io.intellixity.sift.query;

/** Reference to a column of the enclosing row, valid only inside a {@code let} sub-query. */
public record OuterRef(String qualifier, String name) implements Expr {
  public OuterRef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("field name is required");
    qualifier = (qualifier == null || qualifier.isBlank()) ? null : qualifier;
  }

  public static OuterRef parse(String path) {
    FieldRef f = FieldRef.parse(path);
    return new OuterRef(f.qualifier(), f.name());
  }

  public FieldRef asField() { return new FieldRef(qualifier, name); }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return "outer." + asField().path(); }
}
