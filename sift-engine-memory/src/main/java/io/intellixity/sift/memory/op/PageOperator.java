package io.intellixity.sift.memory.op;

/** Skips {@code offset} rows, then yields at most {@code limit}; stops pulling once the limit is reached. */
public final class PageOperator implements Operator {
  private final Operator child;
  private final int offset;
  private final int limit;
  private int skipped;
  private int emitted;

  public PageOperator(Operator child, int offset, int limit) {
    this.child = child;
    this.offset = offset;
    this.limit = limit;
  }

  @Override
  public void open() { child.open(); }

  @Override
  public Object[] next() {
    if (emitted >= limit) return null;
    while (skipped < offset) {
      if (child.next() == null) return null;
      skipped++;
    }
    Object[] r = child.next();
    if (r != null) emitted++;
    return r;
  }

  @Override
  public void close() { child.close(); }
}
