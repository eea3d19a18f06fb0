package io.intellixity.sift.error;

/**
 * A row value the engine cannot evaluate: integer division by zero, integer overflow, or a
 * non-finite double where an exact number is required.
 */
public final class DataException extends QueryExecutionException {
  public DataException(String message) {
    super(message);
  }

  public DataException(String message, Throwable cause) {
    super(message, cause);
  }
}
