package io.intellixity.sift.memory;

import io.intellixity.sift.error.DataException;
import io.intellixity.sift.error.EmptyAggregateException;
import io.intellixity.sift.exec.CursorState;
import io.intellixity.sift.exec.ResultCursor;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.query.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static io.intellixity.sift.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryQueryEngineTest {
  private final InMemoryStore store = Fixtures.store();
  private final InMemoryQueryEngine engine = new InMemoryQueryEngine(store);
  private final QueryBuilder q = new QueryBuilder(Fixtures.REGISTRY);

  private static List<Object> column(List<ResultRow> rows, String name) {
    List<Object> out = new ArrayList<>();
    for (ResultRow r : rows) out.add(r.get(name));
    return out;
  }

  @Test
  void filterThenProject() {
    QueryNode titles = q.project(q.filter(q.source("Movie"), gt("year", 2015)), "title");
    List<ResultRow> rows = engine.toList(titles);
    assertEquals(List.of("Blade Runner 2049", "Arrival", "Untitled"), column(rows, "title"));
    assertEquals(List.of("title"), rows.get(0).names());
  }

  @Test
  void nestedFiltersEqualConjunction() {
    QueryNode movies = q.source("Movie");
    QueryNode nested = q.filter(q.filter(movies, gt("year", 2000)), lt("rating", 8.0));
    QueryNode conj = q.filter(movies, and(gt("year", 2000), lt("rating", 8.0)));
    assertEquals(engine.toList(conj), engine.toList(nested));
    assertEquals(List.of("Arrival", "Prometheus"), column(engine.toList(nested), "title"));
  }

  @Test
  void comparisonsWithNullAreUnknown() {
    QueryNode notHigh = q.filter(q.source("Movie"), not(gt("rating", 7.5)));
    assertEquals(List.of("Prometheus"), column(engine.toList(notHigh), "title"));

    QueryNode unrated = q.filter(q.source("Movie"), isNull("rating"));
    assertEquals(List.of("Untitled"), column(engine.toList(unrated), "title"));
  }

  @Test
  void likeAndInLists() {
    QueryNode a = q.filter(q.source("Movie"), like("title", "A%"));
    assertEquals(List.of("Alien", "Arrival"), column(engine.toList(a), "title"));

    QueryNode years = q.filter(q.source("Movie"), in("year", List.of(1979, 2012L)));
    assertEquals(List.of(1, 4), column(engine.toList(years), "id"));

    QueryNode notYears = q.filter(q.source("Movie"), nin("year", List.of(1979, 2012)));
    assertEquals(List.of(2, 3, 5), column(engine.toList(notYears), "id"));
  }

  @Test
  void orderIsStableWithNullsFirstAscending() {
    QueryNode byDirector = q.orderBy(q.source("Movie"), "directorId", SortField.Direction.ASC);
    assertEquals(List.of(5, 1, 4, 2, 3), column(engine.toList(byDirector), "id"));

    QueryNode byRatingDesc = q.orderBy(q.source("Movie"), SortField.desc("rating"), SortField.asc("title"));
    assertEquals(List.of("Alien", "Blade Runner 2049", "Arrival", "Prometheus", "Untitled"),
        column(engine.toList(byRatingDesc), "title"));
  }

  @Test
  void groupCountsAddUpToInputSize() {
    QueryNode grouped = q.aggregate(q.groupBy(q.source("Actor"), "movieId"), AggregateCall.count());
    List<ResultRow> rows = engine.toList(grouped);

    assertEquals(List.of(1, 2, 3, 4, 99), column(rows, "movieId"));
    long total = 0;
    for (ResultRow r : rows) total += r.get("count", Long.class);
    assertEquals(Fixtures.ACTORS.size(), total);
  }

  @Test
  void groupRowsCarryTheirMembers() {
    List<ResultRow> rows = engine.toList(q.groupBy(q.source("Movie"), "directorId"));
    assertEquals(List.of("directorId", "group"), rows.get(0).names());
    List<ResultRow> scott = rows.get(0).rows("group");
    assertEquals(List.of("Alien", "Prometheus"), column(scott, "title"));
  }

  @Test
  void innerJoinDropsUnmatchedRows() {
    QueryNode joined = q.join(q.source("Actor", "a"), q.source("Movie", "m"), fieldEq("a.movieId", "m.id"));
    List<ResultRow> rows = engine.toList(joined);

    assertEquals(6, rows.size());
    for (ResultRow r : rows) {
      assertNotNull(r.get("m.id"));
      assertEquals(r.get("a.movieId"), r.get("m.id"));
    }
    assertEquals(List.of("Weaver", "Gosling", "Ford", "Adams", "Fassbender", "Rapace"), column(rows, "a.name"));
  }

  @Test
  void joinThroughRelation() {
    QueryNode directed = q.project(q.joinRelation(q.source("Movie", "m"), "m.director", "d"),
        Projection.of("m.title"), Projection.as("director", field("d.name")));
    List<ResultRow> rows = engine.toList(directed);
    assertEquals(4, rows.size());
    assertEquals("Villeneuve", rows.get(1).get("director"));
  }

  @Test
  void aggregatesOverEmptyInput() {
    QueryNode none = q.filter(q.source("Movie"), gt("year", 3000));

    ResultRow totals = engine.toList(q.aggregate(none, AggregateCall.count(), AggregateCall.of(AggregateFunction.SUM, "year"))).get(0);
    assertEquals(0L, totals.get("count"));
    assertEquals(0L, totals.get("sum_year"));

    try (ResultCursor c = engine.execute(q.aggregate(none, AggregateFunction.MIN, "year"))) {
      assertThrows(EmptyAggregateException.class, c::hasNext);
      assertEquals(CursorState.FAILED, c.state());
    }
    assertThrows(EmptyAggregateException.class, () -> engine.toList(q.aggregate(none, AggregateFunction.AVERAGE, "rating")));
    assertEquals(0, store.activeSessions());
  }

  @Test
  void aggregatesSkipNulls() {
    ResultRow r = engine.toList(q.aggregate(q.source("Movie"),
        AggregateCall.of(AggregateFunction.COUNT, "rating"),
        AggregateCall.of(AggregateFunction.MAX, "releaseDate"),
        AggregateCall.of(AggregateFunction.AVERAGE, "rating"))).get(0);
    assertEquals(4L, r.get("count_rating"));
    assertEquals(LocalDate.of(2017, 10, 6), r.get("max_releaseDate"));
    assertEquals(7.85, (Double) r.get("average_rating"), 1e-9);
  }

  @Test
  void letBindsACorrelatedScalarPerRow() {
    QueryNode castOf = q.filter(q.source("Actor", "a"), correlate("a.movieId", "m.id"));
    QueryNode withCast = q.let_(q.source("Movie", "m"), "castSize", q.count(castOf));
    QueryNode big = q.project(q.filter(withCast, ge("castSize", 2L)), "title", "castSize");

    List<ResultRow> rows = engine.toList(big);
    assertEquals(List.of("Blade Runner 2049", "Prometheus"), column(rows, "title"));
    assertEquals(List.of(2L, 2L), column(rows, "castSize"));
  }

  @Test
  void pageSkipsAndLimits() {
    QueryNode page = q.page(q.orderBy(q.source("Movie"), SortField.asc("id")), 1, 2);
    assertEquals(List.of(2, 3), column(engine.toList(page), "id"));
  }

  @Test
  void clientPredicatesAndFunctionsRunInProcess() {
    QueryNode shortTitles = q.filter(q.source("Movie"), client("shortTitle", r -> r.get("title", String.class).length() <= 6));
    assertEquals(List.of("Alien"), column(engine.toList(shortTitles), "title"));

    QueryNode upper = q.project(q.source("Director"),
        Projection.as("shout", client("upper", io.intellixity.sift.model.SemanticType.STRING, r -> r.get("name", String.class).toUpperCase())));
    assertEquals(List.of("SCOTT", "VILLENEUVE"), column(engine.toList(upper), "shout"));
  }

  @Test
  void arithmeticProjection() {
    QueryNode age = q.project(q.filter(q.source("Actor"), eq("name", "Ford")),
        Projection.as("born", sub(literal(2024), field("age"))));
    assertEquals(List.of(1943), column(engine.toList(age), "born"));
  }

  @Test
  void nonFiniteRatingsCompareGroupAndAggregate() {
    store.add("Movie", new Fixtures.Movie(6, "Overrated", 2020, null, Double.POSITIVE_INFINITY, 1));
    store.add("Movie", new Fixtures.Movie(7, "Unrateable", 2021, null, Double.NaN, 2));

    // NaN orders above every number, as Double.compare does
    QueryNode high = q.filter(q.source("Movie"), gt("rating", 8));
    assertEquals(List.of("Alien", "Overrated", "Unrateable"), column(engine.toList(high), "title"));

    QueryNode listed = q.filter(q.source("Movie"), in("rating", List.of(Double.POSITIVE_INFINITY, 7)));
    assertEquals(List.of(4, 6), column(engine.toList(listed), "id"));

    List<ResultRow> groups = engine.toList(q.aggregate(q.groupBy(q.source("Movie"), "rating"), AggregateCall.count()));
    assertEquals(7, groups.size());

    ResultRow finite = engine.toList(q.aggregate(q.filter(q.source("Movie"), le("id", 6)),
        AggregateCall.of(AggregateFunction.SUM, "rating"),
        AggregateCall.of(AggregateFunction.AVERAGE, "rating"))).get(0);
    assertEquals(Double.POSITIVE_INFINITY, finite.get("sum_rating"));
    assertEquals(Double.POSITIVE_INFINITY, finite.get("average_rating"));
  }

  @Test
  void integerArithmeticFailsOnDivisionByZeroAndOverflow() {
    QueryNode ford = q.filter(q.source("Actor"), eq("name", "Ford"));

    try (ResultCursor c = engine.execute(q.project(ford, Projection.as("x", div(field("age"), literal(0)))))) {
      assertThrows(DataException.class, c::hasNext);
      assertEquals(CursorState.FAILED, c.state());
    }
    assertThrows(DataException.class,
        () -> engine.toList(q.project(ford, Projection.as("x", mul(field("age"), literal(Integer.MAX_VALUE))))));
    assertEquals(List.of(40.5), column(engine.toList(q.project(ford, Projection.as("x", div(field("age"), literal(2.0))))), "x"));
    assertEquals(0, store.activeSessions());
  }

  @Test
  void materializedResultsAreImmutableAndRepeatable() {
    List<ResultRow> rows = engine.toList(q.source("Director"));
    int opened = store.sessionsOpened();
    assertEquals(rows, new ArrayList<>(rows));
    assertEquals(opened, store.sessionsOpened());
    assertThrows(UnsupportedOperationException.class, () -> rows.add(rows.get(0)));
  }
}
