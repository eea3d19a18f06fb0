package io.intellixity.sift.plan;

import java.util.List;

public record PageStep(int id, int input, int offset, int limit, RowShape shape) implements PlanStep {
  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "page"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
