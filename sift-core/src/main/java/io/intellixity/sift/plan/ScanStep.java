package io.intellixity.sift.plan;

import io.intellixity.sift.model.EntityDescriptor;

import java.util.List;
import java.util.Objects;

/** Reads every row of an entity; columns follow the descriptor's field order. */
public record ScanStep(int id, EntityDescriptor entity, String alias, RowShape shape) implements PlanStep {
  public ScanStep {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(shape, "shape");
  }

  @Override public List<Integer> inputs() { return List.of(); }
  @Override public String kind() { return "scan"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
