package io.intellixity.sift.error;

public final class UnknownFieldException extends QueryValidationException {
  private final String owner;
  private final String fieldPath;

  public UnknownFieldException(String owner, String fieldPath) {
    super(ErrorKind.UNKNOWN_FIELD, "Unknown field path '" + fieldPath + "' for '" + owner + "'");
    this.owner = owner;
    this.fieldPath = fieldPath;
  }

  public UnknownFieldException(String owner, String fieldPath, String message) {
    super(ErrorKind.UNKNOWN_FIELD, message);
    this.owner = owner;
    this.fieldPath = fieldPath;
  }

  public String owner() { return owner; }
  public String fieldPath() { return fieldPath; }
}
