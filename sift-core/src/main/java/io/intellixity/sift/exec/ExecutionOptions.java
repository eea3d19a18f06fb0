package io.intellixity.sift.exec;

import java.time.Duration;

/**
 * Per-execution settings.
 *
 * @param timeout       wall-clock budget measured from the first pull; null means none
 * @param fetchSize     backend fetch-size hint; 0 leaves the driver default
 * @param allowFallback whether an engine may evaluate in-process a plan its backend cannot express
 */
public record ExecutionOptions(Duration timeout, int fetchSize, boolean allowFallback) {
  private static final ExecutionOptions DEFAULTS = new ExecutionOptions(null, 0, true);

  public ExecutionOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (fetchSize < 0) throw new IllegalArgumentException("fetchSize must be >= 0");
  }

  public static ExecutionOptions defaults() { return DEFAULTS; }

  public ExecutionOptions withTimeout(Duration timeout) { return new ExecutionOptions(timeout, fetchSize, allowFallback); }
  public ExecutionOptions withFetchSize(int fetchSize) { return new ExecutionOptions(timeout, fetchSize, allowFallback); }
  public ExecutionOptions withFallback(boolean allowFallback) { return new ExecutionOptions(timeout, fetchSize, allowFallback); }
}
