package io.intellixity.sift.error;

public final class UnknownEntityException extends QueryValidationException {
  private final String entity;

  public UnknownEntityException(String entity) {
    super(ErrorKind.UNKNOWN_ENTITY, "Unknown entity '" + entity + "'");
    this.entity = entity;
  }

  public String entity() { return entity; }
}
