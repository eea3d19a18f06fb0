package io.intellixity.sift.error;

import java.time.Duration;

public final class QueryTimeoutException extends QueryExecutionException {
  private final Duration timeout;

  public QueryTimeoutException(Duration timeout) {
    this(timeout, null);
  }

  public QueryTimeoutException(Duration timeout, Throwable cause) {
    super("Query exceeded timeout of " + timeout.toMillis() + "ms", cause);
    this.timeout = timeout;
  }

  public Duration timeout() { return timeout; }
}
