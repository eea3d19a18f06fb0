package io.intellixity.sift.plan;

import java.util.List;

/** Inner equi-join; output columns are the left columns followed by the right columns. */
public record JoinStep(int id, int left, int right, List<JoinKey> keys, RowShape shape) implements PlanStep {
  public JoinStep {
    keys = List.copyOf(keys);
  }

  @Override public List<Integer> inputs() { return List.of(left, right); }
  @Override public String kind() { return "join"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
