package io.intellixity.sift.query;

import java.util.List;

/**
 * Node of an immutable query tree. Composition wraps: every operation returns a new node
 * over its input(s); nothing is evaluated until the tree is planned and executed.
 */
public interface QueryNode {
  /** Short lowercase name of the operation ({@code source}, {@code filter}, ...). */
  String kind();

  List<QueryNode> children();

  <R> R accept(QueryNodeVisitor<R> visitor);
}
