package io.intellixity.sift.query;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record ProjectNode(QueryNode input, List<Projection> projections) implements QueryNode {
  public ProjectNode {
    Objects.requireNonNull(input, "input");
    projections = List.copyOf(Objects.requireNonNull(projections, "projections"));
    if (projections.isEmpty()) throw new IllegalArgumentException("at least one projection is required");
    Set<String> seen = new HashSet<>();
    for (Projection p : projections) {
      if (!seen.add(p.name())) throw new IllegalArgumentException("duplicate projection name: " + p.name());
    }
  }

  @Override public String kind() { return "project"; }
  @Override public List<QueryNode> children() { return List.of(input); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
