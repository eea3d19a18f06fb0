package io.intellixity.sift.query;

import java.util.Objects;

/** Binary comparison. EQ / NE against a null literal mean IS NULL / IS NOT NULL. */
public record Comparison(Expr left, Operator operator, Expr right) implements Expr {
  public Comparison {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return left + " " + operator.symbol() + " " + right; }
}
