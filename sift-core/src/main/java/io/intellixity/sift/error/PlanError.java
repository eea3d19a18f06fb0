package io.intellixity.sift.error;

import java.util.Objects;

/**
 * One defect found while lowering a query tree.
 *
 * @param kind  error category
 * @param step  short description of the node the defect belongs to (e.g. {@code filter#2})
 * @param message human readable detail
 */
public record PlanError(ErrorKind kind, String step, String message) {
  public PlanError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static PlanError of(String step, QueryValidationException e) {
    return new PlanError(e.kind(), step, e.getMessage());
  }

  @Override
  public String toString() {
    return (step == null ? "" : step + ": ") + kind + " " + message;
  }
}
