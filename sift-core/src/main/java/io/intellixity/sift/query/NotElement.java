package io.intellixity.sift.query;

import java.util.Objects;

/** Unary NOT for a predicate subtree (can wrap a {@link Comparison} or a {@link LogicalGroup}). */
public record NotElement(Expr element) implements Expr {
  public NotElement {
    Objects.requireNonNull(element, "element");
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return "NOT " + element; }
}
