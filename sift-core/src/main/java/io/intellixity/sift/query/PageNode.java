package io.intellixity.sift.query;

import java.util.List;
import java.util.Objects;

/** Skips {@code offset} rows and yields at most {@code limit} of the rest. */
public record PageNode(QueryNode input, int offset, int limit) implements QueryNode {
  public PageNode {
    Objects.requireNonNull(input, "input");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
  }

  @Override public String kind() { return "page"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
