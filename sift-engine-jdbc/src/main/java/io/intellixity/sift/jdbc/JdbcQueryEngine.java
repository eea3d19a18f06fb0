package io.intellixity.sift.jdbc;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.jdbc.dialect.SqlDialect;
import io.intellixity.sift.memory.InMemoryCursor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.spi.exec.AbstractQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Executes plans as SQL over a {@link DataSource}.\n
 *
 * Plans the dialect declines (client-only expressions, ...) are evaluated in-process over plain
 * table scans unless {@link ExecutionOptions#allowFallback()} is off, in which case the
 * {@link UnsupportedPlanOperationException} reaches the caller.\n
 */
public final class JdbcQueryEngine extends AbstractQueryEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

  private final SqlDialect dialect;
  private final LongSupplier nanoClock;

  public JdbcQueryEngine(JdbcHandle handle, SqlDialect dialect, QueryPlanner planner, LongSupplier nanoClock) {
    super(dialect, handle, planner);
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  public JdbcQueryEngine(JdbcHandle handle, SqlDialect dialect, QueryPlanner planner) {
    this(handle, dialect, planner, System::nanoTime);
  }

  /** Convenience constructor: wraps a raw DataSource into a handle. */
  public JdbcQueryEngine(DataSource ds, SqlDialect dialect, EntityRegistry registry) {
    this(new JdbcHandle("jdbc", ds), dialect, new QueryPlanner(registry));
  }

  @Override
  protected ResultCursor openCursor(SqlStatement statement, LogicalPlan plan, ExecutionOptions options) {
    return new JdbcCursor(handle(), statement, plan.shape(), options, nanoClock);
  }

  @Override
  protected ResultCursor fallback(LogicalPlan plan, ExecutionOptions options, UnsupportedPlanOperationException cause) {
    if (!options.allowFallback()) throw cause;
    if (log.isDebugEnabled()) {
      log.debug("sift.jdbc op=fallback handleId={} dialect={} reason={}", handle().id(), dialect.id(), cause.getMessage());
    }
    JdbcRowSource scans = new JdbcRowSource(handle(), dialect, options.fetchSize());
    return new InMemoryCursor(handle().id() + "/fallback", plan, scans, options, nanoClock);
  }
}
