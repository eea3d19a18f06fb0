package io.intellixity.sift.plan;

import io.intellixity.sift.model.SemanticType;

/** Type-check result; a null type means "unknown" (null literal, or an operand that already failed). */
record TypedExpr(SemanticType type, boolean nullable) {
  static final TypedExpr UNKNOWN = new TypedExpr(null, true);
  static final TypedExpr BOOLEAN = new TypedExpr(SemanticType.BOOLEAN, false);
}
