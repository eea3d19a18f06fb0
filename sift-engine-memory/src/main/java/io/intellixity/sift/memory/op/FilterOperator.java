package io.intellixity.sift.memory.op;

import io.intellixity.sift.memory.eval.ExprCompiler.RowPredicate;

/** Pulls rows from its child until one satisfies the predicate. */
public final class FilterOperator implements Operator {
  private final Operator child;
  private final RowPredicate predicate;
  private final Object[] outer;

  public FilterOperator(Operator child, RowPredicate predicate, Object[] outer) {
    this.child = child;
    this.predicate = predicate;
    this.outer = outer;
  }

  @Override
  public void open() { child.open(); }

  @Override
  public Object[] next() {
    Object[] r;
    while ((r = child.next()) != null) {
      if (predicate.test(r, outer)) return r;
    }
    return null;
  }

  @Override
  public void close() { child.close(); }
}
