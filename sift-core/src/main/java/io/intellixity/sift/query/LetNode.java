package io.intellixity.sift.query;

import java.util.List;
import java.util.Objects;

/**
 * Binds the scalar result of a correlated sub-query to {@code name} on every input row.
 * The sub-query refers to the current outer row through {@link OuterRef}s and must end in a
 * single ungrouped aggregate.
 */
public record LetNode(QueryNode input, String name, QueryNode subQuery) implements QueryNode {
  public LetNode {
    Objects.requireNonNull(input, "input");
    if (name == null || name.isBlank()) throw new IllegalArgumentException("let name is required");
    if (name.contains(".")) throw new IllegalArgumentException("let name must not contain '.': " + name);
    Objects.requireNonNull(subQuery, "subQuery");
  }

  @Override public String kind() { return "let"; }

  /** The sub-query is a separate scope and is not a child of this node. */
  @Override public List<QueryNode> children() { return List.of(input); }

  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
