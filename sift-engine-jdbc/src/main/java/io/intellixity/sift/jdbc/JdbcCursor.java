package io.intellixity.sift.jdbc;

import io.intellixity.sift.error.EmptyAggregateException;
import io.intellixity.sift.error.QueryCancelledException;
import io.intellixity.sift.error.QueryTimeoutException;
import io.intellixity.sift.error.SourceException;
import io.intellixity.sift.exec.AbstractResultCursor;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.Coercions;
import io.intellixity.sift.plan.Column;
import io.intellixity.sift.plan.RowShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.util.List;
import java.util.function.LongSupplier;

/** Streams a compiled SELECT; the connection is taken on the first pull and returned exactly once. */
final class JdbcCursor extends AbstractResultCursor {
  private static final Logger log = LoggerFactory.getLogger(JdbcCursor.class);

  private final JdbcHandle handle;
  private final SqlStatement stmt;
  private final List<Column> columns;
  private final List<String> names;
  private final ExecutionOptions options;

  private Connection conn;
  private volatile PreparedStatement ps;
  private ResultSet rs;
  private volatile boolean cancelled;
  private long startedAt;

  JdbcCursor(JdbcHandle handle, SqlStatement stmt, RowShape shape, ExecutionOptions options, LongSupplier nanoClock) {
    super(handle.id(), options, nanoClock);
    this.handle = handle;
    this.stmt = stmt;
    this.columns = shape.columns();
    this.names = shape.outputNames();
    this.options = options;
  }

  @Override
  protected void open() {
    try {
      startedAt = System.nanoTime();
      conn = handle.client().getConnection();
      if (handle.schema() != null) conn.setSchema(handle.schema());
      PreparedStatement p = conn.prepareStatement(stmt.sql());
      ps = p;
      if (options.fetchSize() > 0) p.setFetchSize(options.fetchSize());
      Duration left = remaining();
      if (left != null) p.setQueryTimeout((int) Math.max(1, (left.toMillis() + 999) / 1000));
      bindAll(p);
      debugSql();
      rs = p.executeQuery();
    } catch (SQLException e) {
      throw failure(e);
    }
  }

  @Override
  protected ResultRow fetch() {
    try {
      if (!rs.next()) return null;
      Object[] values = new Object[columns.size()];
      for (int i = 0; i < values.length; i++) values[i] = Coercions.coerce(rs.getObject(i + 1), columns.get(i).type());
      for (SqlStatement.Guard g : stmt.guards()) {
        if (values[g.column()] == null) throw new EmptyAggregateException(g.function(), g.field());
      }
      return new ResultRow(names, values);
    } catch (SQLException e) {
      throw failure(e);
    }
  }

  @Override
  protected void release() {
    SQLException first = null;
    for (AutoCloseable c : new AutoCloseable[] {rs, ps, conn}) {
      if (c == null) continue;
      try {
        c.close();
      } catch (SQLException e) {
        if (first == null) first = e;
      } catch (Exception e) {
        if (first == null) first = new SQLException(e);
      }
    }
    if (log.isDebugEnabled()) {
      log.debug("sift.jdbc_done op=query handleId={} durationMs={}", handle.id(), (System.nanoTime() - startedAt) / 1_000_000.0);
    }
    if (first != null) throw new SourceException("Releasing connection for " + handle.id() + " failed: " + first.getMessage(), first);
  }

  @Override
  protected void onCancel() {
    cancelled = true;
    PreparedStatement p = ps;
    if (p == null) return;
    try {
      p.cancel();
    } catch (SQLException e) {
      log.debug("sift.jdbc op=cancel handleId={} failed", handle.id(), e);
    }
  }

  private RuntimeException failure(SQLException e) {
    if (cancelled) return new QueryCancelledException();
    if (e instanceof SQLTimeoutException && options.timeout() != null) return new QueryTimeoutException(options.timeout(), e);
    return new SourceException("SQL failed on " + handle.id() + ": " + e.getMessage(), e);
  }

  private void bindAll(PreparedStatement p) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) p.setObject(i + 1, stmt.binds().get(i).value());
  }

  private void debugSql() {
    if (!log.isDebugEnabled()) return;
    log.debug("sift.jdbc op=query handleId={} schema={} bindCount={} sql={}",
        handle.id(), handle.schema(), stmt.binds().size(), stmt.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : stmt.binds()) {
        Object v = b.value();
        int len = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("sift.jdbc bind index={} type={} valueType={} valueLen={}",
            idx++, b.type().id(), v == null ? "null" : v.getClass().getName(), len);
      }
    }
  }
}
