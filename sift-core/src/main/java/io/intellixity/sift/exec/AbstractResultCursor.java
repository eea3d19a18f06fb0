package io.intellixity.sift.exec;

import io.intellixity.sift.error.QueryCancelledException;
import io.intellixity.sift.error.QueryTimeoutException;
import io.intellixity.sift.error.SiftException;
import io.intellixity.sift.error.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Template for backend cursors: owns the state machine, the timeout, cancellation and the
 * single release of the backend session.
 * <p>
 * Subclasses implement {@link #open()} (acquire the session, called on the first pull),
 * {@link #fetch()} (next row or null at the end) and {@link #release()} (called exactly once,
 * whatever way the cursor ends, if {@link #open()} was called).
 */
public abstract class AbstractResultCursor implements ResultCursor {
  private static final Logger log = LoggerFactory.getLogger(AbstractResultCursor.class);

  private final String label;
  private final Duration timeout;
  private final LongSupplier nanoClock;

  private volatile boolean cancelRequested;
  private CursorState state = CursorState.NOT_STARTED;
  private RuntimeException failure;
  private ResultRow lookahead;
  private boolean opened;
  private boolean released;
  private long deadline;
  private long startedAt;
  private long rows;

  protected AbstractResultCursor(String label, ExecutionOptions options) {
    this(label, options, System::nanoTime);
  }

  protected AbstractResultCursor(String label, ExecutionOptions options, LongSupplier nanoClock) {
    this.label = Objects.requireNonNull(label, "label");
    this.timeout = Objects.requireNonNull(options, "options").timeout();
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  /** Acquires the backend session and starts the query. */
  protected abstract void open();

  /** Returns the next row, or null when the input is exhausted. */
  protected abstract ResultRow fetch();

  /** Releases the backend session. */
  protected abstract void release();

  /** Hook for interrupting an in-flight backend call; called from the cancelling thread. */
  protected void onCancel() {}

  /** Maps a backend failure to the engine error taxonomy. */
  protected RuntimeException translate(RuntimeException e) {
    if (e instanceof SiftException) return e;
    return new SourceException("Data source failure in " + label + ": " + e.getMessage(), e);
  }

  /**
   * Fails with {@link QueryCancelledException} once cancellation was requested and with
   * {@link QueryTimeoutException} once the deadline has passed. Operators that buffer their input call it per row.
   */
  protected final void checkpoint() {
    if (cancelRequested) throw new QueryCancelledException();
    if (timeout != null && nanoClock.getAsLong() - deadline > 0) throw new QueryTimeoutException(timeout);
  }

  /** Remaining time budget, or null when no timeout is set. */
  protected final Duration remaining() {
    if (timeout == null) return null;
    long left = deadline - (opened ? nanoClock.getAsLong() : startedAt);
    return Duration.ofNanos(Math.max(left, 0));
  }

  @Override
  public final CursorState state() { return state; }

  @Override
  public final boolean hasNext() {
    if (lookahead != null) return true;
    switch (state) {
      case FAILED, CANCELLED -> throw failure;
      case COMPLETED, CLOSED -> { return false; }
      default -> { }
    }
    advance();
    return lookahead != null;
  }

  @Override
  public final ResultRow next() {
    if (!hasNext()) throw new NoSuchElementException();
    ResultRow r = lookahead;
    lookahead = null;
    rows++;
    return r;
  }

  @Override
  public final void cancel() {
    cancelRequested = true;
    onCancel();
  }

  @Override
  public final void close() {
    if (state == CursorState.NOT_STARTED || state == CursorState.RUNNING) {
      state = CursorState.CLOSED;
      lookahead = null;
      if (log.isDebugEnabled()) log.debug("sift.cursor op=close cursor={} rows={}", label, rows);
    }
    releaseOnce();
  }

  private void advance() {
    if (state == CursorState.NOT_STARTED) {
      state = CursorState.RUNNING;
      startedAt = nanoClock.getAsLong();
      deadline = timeout == null ? 0 : startedAt + timeout.toNanos();
      if (cancelRequested) {
        abort(CursorState.CANCELLED, new QueryCancelledException());
      }
      opened = true;
      try {
        open();
      } catch (RuntimeException e) {
        fail(e);
      }
    }

    ResultRow row;
    try {
      checkpoint();
      row = fetch();
      if (row != null) checkpoint();
    } catch (RuntimeException e) {
      fail(e);
      return;
    }

    if (row == null) {
      state = CursorState.COMPLETED;
      releaseOnce();
      if (log.isDebugEnabled()) {
        log.debug("sift.cursor op=complete cursor={} rows={} durationMs={}", label, rows, (nanoClock.getAsLong() - startedAt) / 1_000_000);
      }
      return;
    }
    lookahead = row;
  }

  // only cancel() ends the cursor as CANCELLED; timeouts fail it like any other error
  private void fail(RuntimeException e) {
    RuntimeException t = translate(e);
    abort(t instanceof QueryCancelledException ? CursorState.CANCELLED : CursorState.FAILED, t);
  }

  private void abort(CursorState terminal, RuntimeException e) {
    state = terminal;
    failure = e;
    lookahead = null;
    releaseOnce();
    if (log.isDebugEnabled()) log.debug("sift.cursor op={} cursor={} rows={} error={}", terminal, label, rows, e.toString());
    throw e;
  }

  private void releaseOnce() {
    if (!opened || released) return;
    released = true;
    try {
      release();
    } catch (RuntimeException e) {
      log.warn("sift.cursor op=release cursor={} failed", label, e);
      if (state == CursorState.COMPLETED || state == CursorState.RUNNING) {
        state = CursorState.FAILED;
        failure = translate(e);
        throw failure;
      }
    }
  }
}
