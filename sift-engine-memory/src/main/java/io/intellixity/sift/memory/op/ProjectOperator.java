package io.intellixity.sift.memory.op;

import io.intellixity.sift.memory.eval.RowFunction;

import java.util.List;

public final class ProjectOperator implements Operator {
  private final Operator child;
  private final List<RowFunction> columns;
  private final Object[] outer;

  public ProjectOperator(Operator child, List<RowFunction> columns, Object[] outer) {
    this.child = child;
    this.columns = List.copyOf(columns);
    this.outer = outer;
  }

  @Override
  public void open() { child.open(); }

  @Override
  public Object[] next() {
    Object[] in = child.next();
    if (in == null) return null;
    Object[] out = new Object[columns.size()];
    for (int i = 0; i < out.length; i++) out[i] = columns.get(i).apply(in, outer);
    return out;
  }

  @Override
  public void close() { child.close(); }
}
