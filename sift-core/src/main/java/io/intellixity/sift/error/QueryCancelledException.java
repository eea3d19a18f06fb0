package io.intellixity.sift.error;

public final class QueryCancelledException extends QueryExecutionException {
  public QueryCancelledException() {
    super("Query was cancelled");
  }
}
