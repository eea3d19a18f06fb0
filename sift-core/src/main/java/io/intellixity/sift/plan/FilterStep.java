package io.intellixity.sift.plan;

import io.intellixity.sift.query.Expr;

import java.util.List;

public record FilterStep(int id, int input, Expr predicate, RowShape shape) implements PlanStep {
  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "filter"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
