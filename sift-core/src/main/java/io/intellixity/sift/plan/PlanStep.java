package io.intellixity.sift.plan;

import java.util.List;

/**
 * One operation of a {@link LogicalPlan}. Steps are numbered in post-order, so every input id is
 * smaller than the id of the step consuming it.
 */
public interface PlanStep {
  int id();

  List<Integer> inputs();

  /** Shape of the rows this step yields. */
  RowShape shape();

  String kind();

  <R> R accept(PlanStepVisitor<R> visitor);
}
