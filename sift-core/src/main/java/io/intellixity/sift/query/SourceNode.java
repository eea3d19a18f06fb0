package io.intellixity.sift.query;

import java.util.List;

/**
 * Leaf: all rows of a registered entity.
 *
 * @param entity registered entity name
 * @param alias  qualifier for the entity's columns (defaults to the entity name)
 */
public record SourceNode(String entity, String alias) implements QueryNode {
  public SourceNode {
    if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity is required");
    alias = (alias == null || alias.isBlank()) ? entity : alias;
    if (alias.contains(".")) throw new IllegalArgumentException("alias must not contain '.': " + alias);
  }

  @Override public String kind() { return "source"; }
  @Override public List<QueryNode> children() { return List.of(); }
  @Override public <R> R accept(QueryNodeVisitor<R> visitor) { return visitor.visit(this); }
}
