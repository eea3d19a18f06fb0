package io.intellixity.sift.plan;

import io.intellixity.sift.query.SortField;

import java.util.List;

public record OrderStep(int id, int input, List<SortField> keys, RowShape shape) implements PlanStep {
  public OrderStep {
    keys = List.copyOf(keys);
  }

  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "order"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
