package io.intellixity.sift.plan;

public interface PlanStepVisitor<R> {
  R visit(ScanStep step);
  R visit(FilterStep step);
  R visit(ProjectStep step);
  R visit(JoinStep step);
  R visit(GroupStep step);
  R visit(OrderStep step);
  R visit(AggregateStep step);
  R visit(LetStep step);
  R visit(PageStep step);
}
