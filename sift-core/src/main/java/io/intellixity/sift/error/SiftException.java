package io.intellixity.sift.error;

/** Root of every error raised by the query engine. All are unchecked. */
public class SiftException extends RuntimeException {
  public SiftException(String message) {
    super(message);
  }

  public SiftException(String message, Throwable cause) {
    super(message, cause);
  }
}
