package io.intellixity.sift.memory;

import io.intellixity.sift.exec.AbstractResultCursor;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.op.Operator;
import io.intellixity.sift.plan.LogicalPlan;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/** Cursor evaluating a plan in-process; the session is opened on the first pull. */
public final class InMemoryCursor extends AbstractResultCursor {
  private final LogicalPlan plan;
  private final RowSource source;
  private final List<String> names;
  private RowSource.Session session;
  private Operator root;

  public InMemoryCursor(String label, LogicalPlan plan, RowSource source, ExecutionOptions options) {
    this(label, plan, source, options, System::nanoTime);
  }

  public InMemoryCursor(String label, LogicalPlan plan, RowSource source, ExecutionOptions options, LongSupplier nanoClock) {
    super(label, options, nanoClock);
    this.plan = Objects.requireNonNull(plan, "plan");
    this.source = Objects.requireNonNull(source, "source");
    this.names = plan.shape().outputNames();
  }

  @Override
  protected void open() {
    session = source.openSession();
    root = new PlanInterpreter(session, this::checkpoint).build(plan);
    root.open();
  }

  @Override
  protected ResultRow fetch() {
    Object[] row = root.next();
    return row == null ? null : new ResultRow(names, row);
  }

  @Override
  protected void release() {
    try {
      if (root != null) root.close();
    } finally {
      if (session != null) session.close();
    }
  }
}
