package io.intellixity.sift.plan;

import io.intellixity.sift.query.Projection;

import java.util.List;

public record ProjectStep(int id, int input, List<Projection> projections, RowShape shape) implements PlanStep {
  public ProjectStep {
    projections = List.copyOf(projections);
  }

  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "project"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
