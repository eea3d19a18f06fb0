package io.intellixity.sift.error;

public final class EmptyAggregateException extends QueryExecutionException {
  public EmptyAggregateException(String function, String field) {
    super(function + "(" + (field == null ? "*" : field) + ") is undefined over an empty input");
  }
}
