package io.intellixity.sift.error;

/** Base for failures raised while a plan is compiled for a backend or evaluated. */
public class QueryExecutionException extends SiftException {
  public QueryExecutionException(String message) {
    super(message);
  }

  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
