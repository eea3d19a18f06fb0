package io.intellixity.sift.error;

/** Data-access failure while pulling rows from a backend. */
public final class SourceException extends QueryExecutionException {
  public SourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
