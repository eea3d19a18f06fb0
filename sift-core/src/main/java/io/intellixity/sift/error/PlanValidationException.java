package io.intellixity.sift.error;

import java.util.List;

/** Carries every defect found in a single planning pass, not only the first one. */
public final class PlanValidationException extends QueryValidationException {
  private final List<PlanError> errors;

  public PlanValidationException(List<PlanError> errors) {
    super(ErrorKind.PLAN_VALIDATION, render(errors));
    this.errors = List.copyOf(errors);
  }

  public List<PlanError> errors() { return errors; }

  private static String render(List<PlanError> errors) {
    StringBuilder sb = new StringBuilder("Query plan has ").append(errors.size()).append(" error(s)");
    for (PlanError e : errors) sb.append("\n  - ").append(e);
    return sb.toString();
  }
}
