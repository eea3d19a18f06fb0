package io.intellixity.sift.query;

import java.util.*;

/** AND / OR over child predicates. An empty AND is true, an empty OR is false. */
public record LogicalGroup(Clause clause, List<Expr> elements) implements Expr {
  public LogicalGroup {
    Objects.requireNonNull(clause, "clause");
    elements = List.copyOf(elements == null ? List.of() : elements);
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(clause == Clause.OR ? " OR " : " AND ", "(", ")");
    for (Expr e : elements) j.add(String.valueOf(e));
    return j.toString();
  }
}
