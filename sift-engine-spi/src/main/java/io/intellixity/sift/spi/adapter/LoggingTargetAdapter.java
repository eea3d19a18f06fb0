package io.intellixity.sift.spi.adapter;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.plan.LogicalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Decorator that logs every compiled statement at DEBUG and every declined plan at INFO. */
public final class LoggingTargetAdapter<S extends NativeStatement> implements TargetAdapter<S> {
  private static final Logger log = LoggerFactory.getLogger(LoggingTargetAdapter.class);

  private final TargetAdapter<S> delegate;

  public LoggingTargetAdapter(TargetAdapter<S> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  public static <S extends NativeStatement> TargetAdapter<S> wrap(TargetAdapter<S> adapter) {
    return (adapter instanceof LoggingTargetAdapter<S>) ? adapter : new LoggingTargetAdapter<>(adapter);
  }

  public TargetAdapter<S> delegate() { return delegate; }

  @Override
  public String id() { return delegate.id(); }

  @Override
  public S compile(LogicalPlan plan) {
    long t0 = System.nanoTime();
    S stmt;
    try {
      stmt = delegate.compile(plan);
    } catch (UnsupportedPlanOperationException e) {
      log.info("sift.adapter op=compile adapter={} declined={}", delegate.id(), e.getMessage());
      throw e;
    }
    if (log.isDebugEnabled()) {
      log.debug("sift.adapter op=compile adapter={} durationUs={} text={}", delegate.id(), (System.nanoTime() - t0) / 1_000, stmt.text());
    }
    return stmt;
  }
}
