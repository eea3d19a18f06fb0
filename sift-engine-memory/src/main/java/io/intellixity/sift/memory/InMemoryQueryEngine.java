package io.intellixity.sift.memory;

import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.spi.exec.AbstractQueryEngine;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Executes plans in-process over a {@link RowSource}.
 * <pre>
 * InMemoryStore store = new InMemoryStore(registry).addAll("Movie", movies);
 * InMemoryQueryEngine engine = new InMemoryQueryEngine(store);
 * List&lt;ResultRow&gt; rows = engine.toList(query);
 * </pre>
 */
public final class InMemoryQueryEngine extends AbstractQueryEngine<InMemoryStatement, InMemoryHandle> {
  private final LongSupplier nanoClock;

  public InMemoryQueryEngine(InMemoryHandle handle, QueryPlanner planner, LongSupplier nanoClock) {
    super(new InMemoryAdapter(), handle, planner);
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  public InMemoryQueryEngine(InMemoryHandle handle, QueryPlanner planner) {
    this(handle, planner, System::nanoTime);
  }

  public InMemoryQueryEngine(InMemoryStore store) {
    this(new InMemoryHandle("memory", store), new QueryPlanner(store.registry()));
  }

  @Override
  protected ResultCursor openCursor(InMemoryStatement statement, LogicalPlan plan, ExecutionOptions options) {
    return new InMemoryCursor(handle().id(), statement.plan(), handle().client(), options, nanoClock);
  }
}
