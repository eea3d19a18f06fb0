package io.intellixity.sift.query;

import java.util.List;
import java.util.Objects;

/** Stable sort: rows with equal keys keep their input order. */
public record OrderByNode(QueryNode input, List<SortField> keys) implements QueryNode {
  public OrderByNode {
    Objects.requireNonNull(input, "input");
    keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    if (keys.isEmpty()) throw new IllegalArgumentException("at least one sort key is required");
  }

  @Override public String kind() { return "orderBy"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
