package io.intellixity.sift.query;

import io.intellixity.sift.exec.ResultRow;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Predicate implemented in Java and evaluated in-process against the row (seen through its output names).
 * Remote backends cannot express it.
 */
public record ClientPredicate(String name, Predicate<ResultRow> test) implements Expr {
  public ClientPredicate {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(test, "test");
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return name + "(row)"; }
}
