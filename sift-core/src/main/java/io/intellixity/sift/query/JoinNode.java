package io.intellixity.sift.query;

import java.util.List;
import java.util.Objects;

/** Inner equi-join. Left order is preserved; right matches follow in right-input order. */
public record JoinNode(QueryNode left, QueryNode right, Expr condition) implements QueryNode {
  public JoinNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    Objects.requireNonNull(condition, "condition");
  }

  @Override public String kind() { return "join"; }
  @Override public List<QueryNode> children() { return List.of(left, right); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
