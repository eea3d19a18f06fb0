package io.intellixity.sift.memory.op;

import io.intellixity.sift.memory.RowSource;
import io.intellixity.sift.model.EntityDescriptor;

import java.util.Iterator;

/** Streams the rows of one entity from the current session. */
public final class ScanOperator implements Operator {
  private final RowSource.Session session;
  private final EntityDescriptor entity;
  private final Runnable checkpoint;
  private Iterator<Object[]> rows;

  public ScanOperator(RowSource.Session session, EntityDescriptor entity, Runnable checkpoint) {
    this.session = session;
    this.entity = entity;
    this.checkpoint = checkpoint;
  }

  @Override
  public void open() {
    rows = session.scan(entity);
  }

  @Override
  public Object[] next() {
    checkpoint.run();
    return rows.hasNext() ? rows.next() : null;
  }

  @Override
  public void close() {
    rows = null;
  }
}
