package io.intellixity.sift.plan;

import java.util.List;
import java.util.Objects;

/**
 * Appends column {@code name} holding the scalar result of {@code subPlan}, evaluated once per input row.
 * {@code OuterRef}s in the sub-plan resolve against this step's input shape.
 */
public record LetStep(int id, int input, String name, LogicalPlan subPlan, RowShape shape) implements PlanStep {
  public LetStep {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(subPlan, "subPlan");
  }

  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "let"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
