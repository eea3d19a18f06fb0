package io.intellixity.sift.query;

public enum AggregateFunction {
  COUNT,
  MIN,
  MAX,
  SUM,
  AVERAGE;

  /** Whether the function has a defined value over an empty input (0). */
  public boolean definedOnEmpty() {
    return this == COUNT || this == SUM;
  }
}
