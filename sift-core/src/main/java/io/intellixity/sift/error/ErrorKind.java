package io.intellixity.sift.error;

public enum ErrorKind {
  UNKNOWN_ENTITY,
  UNKNOWN_FIELD,
  TYPE_MISMATCH,
  DUPLICATE_ENTITY,
  AMBIGUOUS_JOIN,
  PLAN_VALIDATION
}
