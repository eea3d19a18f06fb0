package io.intellixity.sift.memory.op;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/** Buffers its whole input and replays it in comparator order. {@link List#sort} is stable. */
public final class SortOperator implements Operator {
  private final Operator child;
  private final Comparator<Object[]> order;
  private final Runnable checkpoint;
  private Iterator<Object[]> sorted;

  public SortOperator(Operator child, Comparator<Object[]> order, Runnable checkpoint) {
    this.child = child;
    this.order = order;
    this.checkpoint = checkpoint;
  }

  @Override
  public void open() {
    child.open();
    List<Object[]> buf = new ArrayList<>();
    Object[] r;
    while ((r = child.next()) != null) {
      checkpoint.run();
      buf.add(r);
    }
    buf.sort(order);
    sorted = buf.iterator();
  }

  @Override
  public Object[] next() {
    return sorted.hasNext() ? sorted.next() : null;
  }

  @Override
  public void close() {
    child.close();
    sorted = null;
  }
}
