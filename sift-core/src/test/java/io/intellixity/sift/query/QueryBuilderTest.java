package io.intellixity.sift.query;

import io.intellixity.sift.error.*;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.EntityRegistryJson;
import io.intellixity.sift.plan.RowShape;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.intellixity.sift.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryBuilderTest {
  private static final EntityRegistry REGISTRY = EntityRegistryJson.loadResource("movies.json");
  private final QueryBuilder q = new QueryBuilder(REGISTRY);

  @Test
  void unknownEntityFailsAtBuildTime() {
    assertThrows(UnknownEntityException.class, () -> q.source("Film"));
  }

  @Test
  void unknownFieldFailsAtBuildTime() {
    QueryNode movies = q.source("Movie");
    assertThrows(UnknownFieldException.class, () -> q.filter(movies, gt("budget", 10)));
    assertThrows(UnknownFieldException.class, () -> q.project(movies, "budget"));
    assertThrows(UnknownFieldException.class, () -> q.orderBy(movies, SortField.asc("budget")));
  }

  @Test
  void dateFieldAgainstStringLiteralIsATypeMismatch() {
    QueryNode movies = q.source("Movie");
    assertThrows(TypeMismatchException.class, () -> q.filter(movies, gt("releaseDate", "2020-01-01")));
    assertDoesNotThrow(() -> q.filter(movies, gt("releaseDate", LocalDate.of(2020, 1, 1))));
  }

  @Test
  void predicatesMustBeBoolean() {
    QueryNode movies = q.source("Movie");
    assertThrows(TypeMismatchException.class, () -> q.filter(movies, field("title")));
    assertThrows(TypeMismatchException.class, () -> q.filter(movies, like("year", "19%")));
    assertThrows(TypeMismatchException.class, () -> q.filter(movies, in("year", List.of("a", "b"))));
  }

  @Test
  void buildingNeverMutatesInputs() {
    QueryNode movies = q.source("Movie");
    QueryNode filtered = q.filter(movies, gt("year", 2000));
    QueryNode projected = q.project(filtered, "title");
    assertEquals(new SourceNode("Movie", "Movie"), movies);
    assertSame(movies, ((FilterNode) filtered).input());
    assertSame(filtered, ((ProjectNode) projected).input());
  }

  @Test
  void joinOutputsAreQualifiedOnceTwoSourcesMeet() {
    QueryNode joined = q.join(q.source("Movie", "m"), q.source("Actor", "a"), fieldEq("m.id", "a.movieId"));
    RowShape shape = q.shape(joined);
    assertTrue(shape.outputNames().contains("m.title"));
    assertTrue(shape.outputNames().contains("a.name"));
    assertEquals("m.id", shape.outputName(0));
  }

  @Test
  void joinWithoutEqualityIsAmbiguous() {
    QueryNode m = q.source("Movie", "m");
    QueryNode a = q.source("Actor", "a");
    assertThrows(AmbiguousJoinException.class, () -> q.join(m, a, compare(field("m.id"), Operator.GT, field("a.movieId"))));
    assertThrows(AmbiguousJoinException.class, () -> q.join(m, a, or(fieldEq("m.id", "a.movieId"), fieldEq("m.id", "a.id"))));
    assertThrows(AmbiguousJoinException.class, () -> q.join(m, a, eq("m.id", 1)));
    assertThrows(AmbiguousJoinException.class, () -> q.join(m, a, fieldEq("m.id", "m.directorId")));
    assertThrows(AmbiguousJoinException.class, () -> q.join(m, q.source("Movie", "m"), fieldEq("m.id", "m.id")));
  }

  @Test
  void joinKeysMustBeComparable() {
    QueryNode m = q.source("Movie", "m");
    QueryNode a = q.source("Actor", "a");
    assertThrows(TypeMismatchException.class, () -> q.join(m, a, fieldEq("m.title", "a.movieId")));
  }

  @Test
  void joinRelationUsesTheForeignKey() {
    QueryNode viaMany = q.joinRelation(q.source("Movie", "m"), "m.actors", "a");
    assertEquals(fieldEq("m.id", "a.movieId"), ((JoinNode) viaMany).condition());

    QueryNode viaOne = q.joinRelation(q.source("Movie", "m"), "director", "d");
    assertEquals(fieldEq("m.directorId", "d.id"), ((JoinNode) viaOne).condition());

    assertThrows(UnknownFieldException.class, () -> q.joinRelation(q.source("Movie", "m"), "m.studio", "s"));
  }

  @Test
  void groupAndAggregateShapes() {
    QueryNode grouped = q.groupBy(q.source("Movie"), "year");
    assertEquals(List.of("year", "group"), q.shape(grouped).outputNames());

    QueryNode counted = q.aggregate(grouped, AggregateCall.count(), AggregateCall.of(AggregateFunction.MAX, "rating", "best"));
    assertEquals(List.of("year", "count", "best"), q.shape(counted).outputNames());

    assertThrows(TypeMismatchException.class, () -> q.aggregate(q.source("Movie"), AggregateFunction.SUM, "title"));
  }

  @Test
  void letRequiresAScalarAggregateSubQuery() {
    QueryNode movies = q.source("Movie", "m");
    QueryNode actorsOfMovie = q.filter(q.source("Actor", "a"), correlate("a.movieId", "m.id"));

    QueryNode withCount = q.let_(movies, "actorCount", q.count(actorsOfMovie));
    assertTrue(q.shape(withCount).outputNames().contains("actorCount"));

    assertThrows(TypeMismatchException.class, () -> q.let_(movies, "actors", actorsOfMovie));
    assertThrows(TypeMismatchException.class, () -> q.let_(movies, "title", q.count(actorsOfMovie)));
  }

  @Test
  void outerReferencesAreCheckedWhereTheyAreBound() {
    QueryNode unbound = q.filter(q.source("Actor"), correlate("movieId", "m.id"));
    assertThrows(UnknownFieldException.class, () -> q.let_(q.source("Movie", "mv"), "n", q.count(unbound)));

    PlanValidationException e = assertThrows(PlanValidationException.class,
        () -> new io.intellixity.sift.plan.QueryPlanner(REGISTRY).plan(unbound));
    assertEquals(ErrorKind.UNKNOWN_FIELD, e.errors().get(0).kind());
  }

  @Test
  void pageArgumentsAreChecked() {
    QueryNode movies = q.source("Movie");
    assertThrows(IllegalArgumentException.class, () -> q.page(movies, -1, 10));
    assertThrows(IllegalArgumentException.class, () -> q.page(movies, 0, 0));
  }
}
