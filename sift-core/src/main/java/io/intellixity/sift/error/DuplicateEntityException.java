package io.intellixity.sift.error;

public final class DuplicateEntityException extends QueryValidationException {
  public DuplicateEntityException(String entity) {
    super(ErrorKind.DUPLICATE_ENTITY, "Entity '" + entity + "' is already registered");
  }
}
