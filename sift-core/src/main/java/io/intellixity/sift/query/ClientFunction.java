package io.intellixity.sift.query;

import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.model.SemanticType;

import java.util.Objects;
import java.util.function.Function;

/** Derived value computed in-process; the declared type is trusted by the type checker. */
public record ClientFunction(String name, SemanticType type, Function<ResultRow, Object> fn) implements Expr {
  public ClientFunction {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(fn, "fn");
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() { return name + "(row)"; }
}
