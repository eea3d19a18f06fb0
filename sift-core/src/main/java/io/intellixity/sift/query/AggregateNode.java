package io.intellixity.sift.query;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregates its input. Directly over a {@link GroupByNode} it yields one row per group
 * (key columns followed by the aggregates); otherwise it yields exactly one row.
 */
public record AggregateNode(QueryNode input, List<AggregateCall> calls) implements QueryNode {
  public AggregateNode {
    Objects.requireNonNull(input, "input");
    calls = List.copyOf(Objects.requireNonNull(calls, "calls"));
    if (calls.isEmpty()) throw new IllegalArgumentException("at least one aggregate is required");
    Set<String> seen = new HashSet<>();
    for (AggregateCall c : calls) {
      if (!seen.add(c.alias())) throw new IllegalArgumentException("duplicate aggregate alias: " + c.alias());
    }
  }

  public boolean grouped() { return input instanceof GroupByNode; }

  @Override public String kind() { return "aggregate"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
