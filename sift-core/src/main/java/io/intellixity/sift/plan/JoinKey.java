package io.intellixity.sift.plan;

import io.intellixity.sift.query.FieldRef;

import java.util.Objects;

/**
 * One equality of a join condition, normalized so {@code left} resolves in the left input and
 * {@code right} in the right input.
 */
public record JoinKey(FieldRef left, FieldRef right) {
  public JoinKey {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public String toString() { return left + " = " + right; }
}
