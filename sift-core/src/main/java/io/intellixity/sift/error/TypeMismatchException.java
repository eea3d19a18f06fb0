package io.intellixity.sift.error;

public final class TypeMismatchException extends QueryValidationException {
  public TypeMismatchException(String message) {
    super(ErrorKind.TYPE_MISMATCH, message);
  }
}
