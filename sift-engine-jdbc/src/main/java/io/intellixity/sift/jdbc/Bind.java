package io.intellixity.sift.jdbc;

import io.intellixity.sift.model.SemanticType;

import java.util.Objects;

/** One positional parameter of a {@link SqlStatement}. */
public record Bind(Object value, SemanticType type) {
  public Bind {
    Objects.requireNonNull(type, "type");
  }
}
