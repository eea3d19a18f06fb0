package io.intellixity.sift.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.MongoCursor;
import io.intellixity.sift.error.EmptyAggregateException;
import io.intellixity.sift.error.QueryTimeoutException;
import io.intellixity.sift.error.SiftException;
import io.intellixity.sift.error.SourceException;
import io.intellixity.sift.exec.AbstractResultCursor;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.Coercions;
import io.intellixity.sift.plan.RowShape;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/** Streams an aggregation pipeline; the driver cursor is opened on the first pull and closed exactly once. */
final class MongoResultCursor extends AbstractResultCursor {
  private static final Logger log = LoggerFactory.getLogger(MongoResultCursor.class);

  private final MongoHandle handle;
  private final MongoStatement stmt;
  private final RowShape shape;
  private final ExecutionOptions options;

  private MongoCursor<Document> cursor;
  private boolean sawRow;
  private boolean emptyServed;

  MongoResultCursor(MongoHandle handle, MongoStatement stmt, RowShape shape, ExecutionOptions options, LongSupplier nanoClock) {
    super(handle.id(), options, nanoClock);
    this.handle = handle;
    this.stmt = stmt;
    this.shape = shape;
    this.options = options;
  }

  @Override
  protected void open() {
    if (log.isDebugEnabled()) {
      log.debug("sift.mongo op=aggregate handleId={} db={} stages={} pipeline={}",
          handle.id(), handle.database(), stmt.pipeline().size(), stmt.text());
    }
    AggregateIterable<Document> it = handle.client()
        .getDatabase(handle.database())
        .getCollection(stmt.collection())
        .aggregate(stmt.pipeline())
        .allowDiskUse(true);
    if (options.fetchSize() > 0) it = it.batchSize(options.fetchSize());
    Duration left = remaining();
    if (left != null) it = it.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
    cursor = it.cursor();
  }

  @Override
  protected ResultRow fetch() {
    if (cursor.hasNext()) {
      sawRow = true;
      ResultRow row = MongoRows.read(cursor.next(), shape, stmt.members());
      for (MongoStatement.Guard g : stmt.guards()) {
        if (row.get(g.column()) == null) throw new EmptyAggregateException(g.function(), g.field());
      }
      return row;
    }
    // $group emits nothing for empty input; an ungrouped aggregate still yields its one row
    if (stmt.emptyRow() == null || sawRow || emptyServed) return null;
    emptyServed = true;
    if (!stmt.guards().isEmpty()) {
      MongoStatement.Guard g = stmt.guards().get(0);
      throw new EmptyAggregateException(g.function(), g.field());
    }
    Object[] values = new Object[shape.size()];
    for (int i = 0; i < values.length; i++) values[i] = Coercions.coerce(stmt.emptyRow().get(i), shape.column(i).type());
    return new ResultRow(shape.outputNames(), values);
  }

  @Override
  protected void release() {
    if (cursor != null) cursor.close();
  }

  @Override
  protected RuntimeException translate(RuntimeException e) {
    if (e instanceof SiftException) return e;
    if (e instanceof MongoExecutionTimeoutException && options.timeout() != null) {
      return new QueryTimeoutException(options.timeout(), e);
    }
    if (e instanceof MongoException) {
      return new SourceException("Mongo pipeline failed on " + handle.id() + ": " + e.getMessage(), e);
    }
    return super.translate(e);
  }
}
