package io.intellixity.sift.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.memory.InMemoryCursor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.spi.exec.AbstractQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Mongo backend engine using the official MongoDB Java sync driver.\n
 *
 * Plans the dialect declines (let, client-only expressions, ...) are evaluated in-process over
 * collection scans unless {@link ExecutionOptions#allowFallback()} is off.\n
 */
public final class MongoQueryEngine extends AbstractQueryEngine<MongoStatement, MongoHandle> {
  private static final Logger log = LoggerFactory.getLogger(MongoQueryEngine.class);

  private final LongSupplier nanoClock;

  public MongoQueryEngine(MongoHandle handle, MongoDialect dialect, QueryPlanner planner, LongSupplier nanoClock) {
    super(dialect, handle, planner);
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  public MongoQueryEngine(MongoHandle handle, QueryPlanner planner) {
    this(handle, new MongoDialect(), planner, System::nanoTime);
  }

  /** Convenience constructor: wraps raw client+database into a handle. */
  public MongoQueryEngine(MongoClient client, String database, EntityRegistry registry) {
    this(new MongoHandle("mongo", client, database), new QueryPlanner(registry));
  }

  @Override
  protected ResultCursor openCursor(MongoStatement statement, LogicalPlan plan, ExecutionOptions options) {
    return new MongoResultCursor(handle(), statement, plan.shape(), options, nanoClock);
  }

  @Override
  protected ResultCursor fallback(LogicalPlan plan, ExecutionOptions options, UnsupportedPlanOperationException cause) {
    if (!options.allowFallback()) throw cause;
    if (log.isDebugEnabled()) log.debug("sift.mongo op=fallback handleId={} reason={}", handle().id(), cause.getMessage());
    return new InMemoryCursor(handle().id() + "/fallback", plan, new MongoRowSource(handle(), options.fetchSize()), options, nanoClock);
  }
}
