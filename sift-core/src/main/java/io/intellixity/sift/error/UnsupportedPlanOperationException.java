package io.intellixity.sift.error;

/** A target adapter cannot express a plan step (e.g. a client-only predicate in SQL). */
public final class UnsupportedPlanOperationException extends QueryExecutionException {
  private final String adapterId;

  public UnsupportedPlanOperationException(String adapterId, String message) {
    super(message + " (adapter '" + adapterId + "')");
    this.adapterId = adapterId;
  }

  public String adapterId() { return adapterId; }
}
