package io.intellixity.sift.query;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Groups rows by key expressions. Each output row carries the key columns plus a
 * {@value #GROUP_COLUMN} column holding the group's input rows, in first-seen key order.
 */
public record GroupByNode(QueryNode input, List<Projection> keys) implements QueryNode {
  public static final String GROUP_COLUMN = "group";

  public GroupByNode {
    Objects.requireNonNull(input, "input");
    keys = List.copyOf(Objects.requireNonNull(keys, "keys"));
    if (keys.isEmpty()) throw new IllegalArgumentException("at least one group key is required");
    Set<String> seen = new HashSet<>();
    for (Projection k : keys) {
      if (k.name().equals(GROUP_COLUMN)) throw new IllegalArgumentException("group key must not be named '" + GROUP_COLUMN + "'");
      if (!seen.add(k.name())) throw new IllegalArgumentException("duplicate group key: " + k.name());
    }
  }

  @Override public String kind() { return "groupBy"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
