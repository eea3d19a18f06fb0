package io.intellixity.sift.jdbc;

import io.intellixity.sift.error.*;
import io.intellixity.sift.exec.CursorState;
import io.intellixity.sift.exec.ExecutionOptions;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.jdbc.dialect.AnsiSqlDialect;
import io.intellixity.sift.memory.InMemoryQueryEngine;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.query.*;
import io.intellixity.sift.spi.adapter.TargetAdapters;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static io.intellixity.sift.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcQueryEngineTest {
  private final CountingDataSource ds = new CountingDataSource(MovieDb.h2(null));
  private final AtomicLong clock = new AtomicLong();
  private final JdbcQueryEngine engine = new JdbcQueryEngine(new JdbcHandle("h2", ds), new AnsiSqlDialect(),
      new QueryPlanner(MovieDb.REGISTRY), clock::get);
  private final InMemoryQueryEngine memory = new InMemoryQueryEngine(MovieDb.store());
  private final QueryBuilder q = new QueryBuilder(MovieDb.REGISTRY);

  private static List<Object> column(List<ResultRow> rows, String name) {
    List<Object> out = new ArrayList<>();
    for (ResultRow r : rows) out.add(r.get(name));
    return out;
  }

  private void assertSameAsMemory(QueryNode query) {
    List<ResultRow> expected = memory.toList(query);
    assertEquals(expected, engine.toList(query));
    assertEquals(0, ds.open());
  }

  @Test
  void answersMatchTheInMemoryEngine() {
    assertSameAsMemory(q.orderBy(q.source("Movie"), SortField.asc("id")));
    assertSameAsMemory(q.project(q.orderBy(q.filter(q.source("Movie"), gt("year", 2000)), SortField.asc("title")), "title", "rating"));
    assertSameAsMemory(q.orderBy(q.source("Movie"), SortField.asc("rating"), SortField.asc("id")));
    assertSameAsMemory(q.orderBy(q.source("Movie"), SortField.desc("rating"), SortField.asc("id")));
    assertSameAsMemory(q.orderBy(q.filter(q.source("Movie"),
        or(in("year", List.of(1979, 2012)), and(isNull("rating"), not(like("title", "A%"))))), SortField.asc("id")));
    assertSameAsMemory(q.page(q.orderBy(q.source("Actor"), SortField.asc("name")), 2, 3));
  }

  @Test
  void joinsGroupsAndLetsMatchTheInMemoryEngine() {
    assertSameAsMemory(q.orderBy(q.join(q.source("Actor", "a"), q.source("Movie", "m"), fieldEq("a.movieId", "m.id")),
        SortField.asc("a.id")));
    assertSameAsMemory(q.orderBy(q.aggregate(q.groupBy(q.source("Actor"), "movieId"), AggregateCall.count(),
        AggregateCall.of(AggregateFunction.SUM, "age")), SortField.asc("movieId")));

    QueryNode castOf = q.filter(q.source("Actor", "a"), correlate("a.movieId", "m.id"));
    QueryNode withCast = q.let_(q.source("Movie", "m"), "castSize", q.count(castOf));
    assertSameAsMemory(q.orderBy(q.project(q.filter(withCast, ge("castSize", 2L)), "id", "title", "castSize"), SortField.asc("id")));
  }

  @Test
  void aggregatesOverEmptyInput() {
    QueryNode none = q.filter(q.source("Movie"), gt("year", 3000));

    ResultRow totals = engine.toList(q.aggregate(none, AggregateCall.count(), AggregateCall.of(AggregateFunction.SUM, "year"))).get(0);
    assertEquals(0L, totals.get("count"));
    assertEquals(0L, totals.get("sum_year"));

    try (ResultCursor c = engine.execute(q.aggregate(none, AggregateFunction.MAX, "rating"))) {
      assertThrows(EmptyAggregateException.class, c::hasNext);
      assertEquals(CursorState.FAILED, c.state());
    }
    assertEquals(0, ds.open());

    ResultRow avg = engine.toList(q.aggregate(q.source("Movie"), AggregateFunction.AVERAGE, "rating")).get(0);
    assertEquals(7.85, (Double) avg.get("average_rating"), 1e-9);
  }

  @Test
  void clientPredicatesFallBackToTableScans() {
    QueryNode shortTitles = q.project(q.filter(q.source("Movie"), client("short", r -> r.get("title", String.class).length() <= 5)), "title");
    assertEquals(List.of("Alien"), column(engine.toList(shortTitles), "title"));
    assertEquals(0, ds.open());

    ExecutionOptions strict = ExecutionOptions.defaults().withFallback(false);
    assertThrows(UnsupportedPlanOperationException.class, () -> engine.execute(shortTitles, strict));
    assertEquals(1, ds.opened());
  }

  @Test
  void nothingIsOpenedBeforeTheFirstPull() {
    try (ResultCursor c = engine.execute(q.source("Director"))) {
      assertEquals(0, ds.opened());
      assertEquals(CursorState.NOT_STARTED, c.state());
      assertTrue(c.hasNext());
      assertEquals(1, ds.open());
    }
    assertEquals(0, ds.open());
  }

  @Test
  void connectionIsReturnedOnEveryExit() {
    ResultCursor drained = engine.execute(q.source("Director"));
    while (drained.hasNext()) drained.next();
    assertEquals(CursorState.COMPLETED, drained.state());
    assertEquals(0, ds.open());

    ResultCursor early = engine.execute(q.source("Actor"));
    early.next();
    early.close();
    assertEquals(CursorState.CLOSED, early.state());
    assertEquals(0, ds.open());

    ResultCursor cancelled = engine.execute(q.source("Actor"));
    cancelled.next();
    cancelled.cancel();
    assertThrows(QueryCancelledException.class, cancelled::hasNext);
    assertEquals(CursorState.CANCELLED, cancelled.state());
    assertEquals(0, ds.open());
  }

  @Test
  void timeoutEndsTheCursorAndReleasesTheConnection() {
    ExecutionOptions opts = ExecutionOptions.defaults().withTimeout(Duration.ofSeconds(5));
    ResultCursor c = engine.execute(q.source("Actor"), opts);
    assertNotNull(c.next());
    clock.addAndGet(TimeUnit.SECONDS.toNanos(6));

    assertThrows(QueryTimeoutException.class, c::hasNext);
    assertEquals(CursorState.FAILED, c.state());
    assertEquals(0, ds.open());
  }

  @Test
  void backendFailuresSurfaceAsSourceErrors() {
    JdbcDataSource empty = new JdbcDataSource();
    empty.setURL("jdbc:h2:mem:sift-empty;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
    CountingDataSource noTables = new CountingDataSource(empty);
    JdbcQueryEngine broken = new JdbcQueryEngine(noTables, new AnsiSqlDialect(), MovieDb.REGISTRY);

    ResultCursor c = broken.execute(q.source("Movie"));
    SourceException e = assertThrows(SourceException.class, c::hasNext);
    assertInstanceOf(java.sql.SQLException.class, e.getCause());
    assertEquals(CursorState.FAILED, c.state());
    assertEquals(0, noTables.open());

    ds.breakIt();
    ResultCursor refused = engine.execute(q.source("Movie"));
    assertThrows(SourceException.class, refused::hasNext);
    assertEquals(CursorState.FAILED, refused.state());
  }

  @Test
  void statementsAreCompiledOncePerPlan() {
    LogicalPlan plan = engine.planner().plan(q.filter(q.source("Movie"), eq("title", "Alien")));
    assertSame(engine.compile(plan), engine.compile(plan));
    assertEquals(1, engine.toList(plan).size());
  }

  @Test
  void ansiDialectIsDiscoverable() {
    assertInstanceOf(AnsiSqlDialect.class, TargetAdapters.byId(AnsiSqlDialect.ID));
  }
}
