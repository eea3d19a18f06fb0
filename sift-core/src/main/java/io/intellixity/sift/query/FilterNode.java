package io.intellixity.sift.query;

import java.util.List;
import java.util.Objects;

public record FilterNode(QueryNode input, Expr predicate) implements QueryNode {
  public FilterNode {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(predicate, "predicate");
  }

  @Override public String kind() { return "filter"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
