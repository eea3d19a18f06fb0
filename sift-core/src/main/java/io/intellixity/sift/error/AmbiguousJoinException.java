package io.intellixity.sift.error;

/** Join predicate could not be reduced to equalities between a left and a right field. */
public final class AmbiguousJoinException extends QueryValidationException {
  public AmbiguousJoinException(String message) {
    super(ErrorKind.AMBIGUOUS_JOIN, message);
  }
}
