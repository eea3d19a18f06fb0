package io.intellixity.sift.query;

/**
 * Scalar expression evaluated against one row: field references, literals, comparisons,
 * boolean composition, arithmetic and client-side functions.
 * <p>
 * Implementations are immutable records, so two trees built the same way are equal.
 */
public interface Expr {
  <R> R accept(ExprVisitor<R> visitor);
}
