package io.intellixity.sift.plan;

import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.AggregateCall;

import java.util.List;

/**
 * Aggregates its input.
 * <p>
 * When {@code grouped}, {@code input} is a {@link GroupStep}: call fields are evaluated against the
 * group step's own input rows and the output is one row per group (keys, then aggregates).
 * Otherwise the output is exactly one row.
 *
 * @param callTypes result type of each call, in call order
 */
public record AggregateStep(int id, int input, boolean grouped, List<AggregateCall> calls,
                            List<SemanticType> callTypes, RowShape shape) implements PlanStep {
  public AggregateStep {
    calls = List.copyOf(calls);
    callTypes = List.copyOf(callTypes);
  }

  @Override public List<Integer> inputs() { return List.of(input); }
  @Override public String kind() { return "aggregate"; }
  @Override public <R> R accept(PlanStepVisitor<R> visitor) { return visitor.visit(this); }
}
