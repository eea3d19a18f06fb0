package io.intellixity.sift.spi.exec;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.QueryEngine;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.exec.handle.EngineHandle;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.spi.adapter.LoggingTargetAdapter;
import io.intellixity.sift.spi.adapter.NativeStatement;
import io.intellixity.sift.spi.adapter.TargetAdapter;
import io.intellixity.sift.spi.cache.LruTtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Template-method query engine.\n
 *
 * Responsibilities:\n
 * - Compile plans through the {@link TargetAdapter} (wrapped in {@link LoggingTargetAdapter})\n
 * - Cache compiled statements per plan\n
 * - Route plans the adapter declines to {@link #fallback}\n
 * - Delegate cursor creation to the backend-specific {@link #openCursor}\n
 */
public abstract class AbstractQueryEngine<S extends NativeStatement, H extends EngineHandle<?>> implements QueryEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractQueryEngine.class);

  public static final int DEFAULT_CACHE_ENTRIES = 256;

  private final TargetAdapter<S> adapter;
  private final H handle;
  private final QueryPlanner planner;
  private final LruTtlCache<LogicalPlan, S> statements;

  protected AbstractQueryEngine(TargetAdapter<S> adapter, H handle, QueryPlanner planner, LruTtlCache<LogicalPlan, S> statements) {
    this.adapter = LoggingTargetAdapter.wrap(Objects.requireNonNull(adapter, "adapter"));
    this.handle = Objects.requireNonNull(handle, "handle");
    this.planner = Objects.requireNonNull(planner, "planner");
    this.statements = Objects.requireNonNull(statements, "statements");
  }

  protected AbstractQueryEngine(TargetAdapter<S> adapter, H handle, QueryPlanner planner) {
    this(adapter, handle, planner, new LruTtlCache<>(DEFAULT_CACHE_ENTRIES, 0));
  }

  /** Creates a lazy cursor over the compiled statement. Must not touch the backend. */
  protected abstract ResultCursor openCursor(S statement, LogicalPlan plan, ExecutionOptions options);

  /**
   * Called when the adapter cannot express the plan. The default rethrows; engines that can
   * evaluate in-process override it (honouring {@link ExecutionOptions#allowFallback()}).
   */
  protected ResultCursor fallback(LogicalPlan plan, ExecutionOptions options, UnsupportedPlanOperationException cause) {
    throw cause;
  }

  @Override
  public final H handle() { return handle; }

  @Override
  public final QueryPlanner planner() { return planner; }

  protected final TargetAdapter<S> adapter() { return adapter; }

  /** Compiles (or reuses) the statement for the plan. */
  public final S compile(LogicalPlan plan) {
    Objects.requireNonNull(plan, "plan");
    return statements.getOrCompute(plan, () -> adapter.compile(plan));
  }

  @Override
  public final ResultCursor execute(LogicalPlan plan, ExecutionOptions options) {
    Objects.requireNonNull(plan, "plan");
    ExecutionOptions effective = (options == null) ? ExecutionOptions.defaults() : options;
    S stmt;
    try {
      stmt = compile(plan);
    } catch (UnsupportedPlanOperationException e) {
      if (log.isDebugEnabled()) log.debug("sift.engine op=fallback handle={} reason={}", handle.id(), e.getMessage());
      return fallback(plan, effective, e);
    }
    return openCursor(stmt, plan, effective);
  }
}
