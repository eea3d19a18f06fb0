package io.intellixity.sift.error;

import java.util.Objects;

/**
 * Raised when a query references unknown entities/fields or otherwise fails build-time validation.
 * <p>
 * Always recoverable: the caller fixes the expression and retries. Registry and expression trees are left untouched.
 */
public class QueryValidationException extends SiftException {
  private final ErrorKind kind;

  public QueryValidationException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }
}
