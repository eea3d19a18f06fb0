package io.intellixity.sift.plan;

import io.intellixity.sift.query.Projection;

import java.util.List;

/** Key columns followed by the {@code group} column carrying the group's input rows. */
public record GroupStep(int id, int input, List<Projection> keys, RowShape shape) implements PlanStep {
  public GroupStep {
    keys = List.copyOf(keys);
  }

  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "group"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
