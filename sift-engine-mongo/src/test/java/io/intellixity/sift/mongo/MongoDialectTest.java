package io.intellixity.sift.mongo;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.EntityRegistryJson;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.query.*;
import io.intellixity.sift.spi.adapter.TargetAdapters;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static io.intellixity.sift.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class MongoDialectTest {
  private static final EntityRegistry REGISTRY = EntityRegistryJson.loadResource("movies.json");

  private final QueryBuilder q = new QueryBuilder(REGISTRY);
  private final MongoDialect dialect = new MongoDialect();

  private MongoStatement compile(QueryNode node) {
    return dialect.compile(new QueryPlanner(REGISTRY).plan(node));
  }

  private static Document stage(MongoStatement s, int i) {
    return s.pipeline().get(i);
  }

  @Test
  void scanRenamesStorageFieldsAndFillsNulls() {
    MongoStatement s = compile(q.source("Movie"));
    assertEquals("movies", s.collection());
    assertEquals(Document.parse("{\"$project\": {\"_id\": 0,"
        + " \"id\": {\"$ifNull\": [\"$id\", null]}, \"title\": {\"$ifNull\": [\"$title\", null]},"
        + " \"year\": {\"$ifNull\": [\"$year\", null]}, \"releaseDate\": {\"$ifNull\": [\"$release_date\", null]},"
        + " \"rating\": {\"$ifNull\": [\"$rating\", null]}, \"directorId\": {\"$ifNull\": [\"$director_id\", null]}}}"),
        stage(s, 0));
  }

  @Test
  void filterThenProject() {
    MongoStatement s = compile(q.project(q.filter(q.source("Movie"), gt("year", 2000)), "title"));
    assertEquals(3, s.pipeline().size());
    assertEquals(Document.parse("{\"$match\": {\"year\": {\"$gt\": 2000}}}"), stage(s, 1));
    assertEquals(Document.parse("{\"$project\": {\"_id\": 0, \"title\": \"$title\"}}"), stage(s, 2));
    assertTrue(s.text().startsWith("db.movies.aggregate([{\"$project\""));
  }

  @Test
  void negationIsPushedDownWithoutMatchingNulls() {
    MongoStatement s = compile(q.filter(q.source("Movie"), not(and(gt("rating", 8.0), eq("title", "Alien")))));
    assertEquals(Document.parse("{\"$match\": {\"$or\": [{\"rating\": {\"$lte\": 8.0}},"
        + " {\"title\": {\"$nin\": [\"Alien\", null]}}]}}"), stage(s, 1));

    MongoStatement ne = compile(q.filter(q.source("Movie"), ne("rating", 7.0)));
    assertEquals(Document.parse("{\"$match\": {\"rating\": {\"$nin\": [7.0, null]}}}"), stage(ne, 1));

    MongoStatement notNull = compile(q.filter(q.source("Movie"), not(isNull("rating"))));
    assertEquals(Document.parse("{\"$match\": {\"rating\": {\"$ne\": null}}}"), stage(notNull, 1));
  }

  @Test
  void listOperatorsFollowSqlNullRules() {
    MongoStatement in = compile(q.filter(q.source("Movie"), in("year", java.util.Arrays.asList(1979, null))));
    assertEquals(Document.parse("{\"$match\": {\"year\": {\"$in\": [1979]}}}"), stage(in, 1));

    MongoStatement notIn = compile(q.filter(q.source("Movie"), nin("year", List.of(1979, 2012))));
    assertEquals(Document.parse("{\"$match\": {\"year\": {\"$nin\": [1979, 2012, null]}}}"), stage(notIn, 1));

    MongoStatement notInWithNull = compile(q.filter(q.source("Movie"), nin("year", java.util.Arrays.asList(1979, null))));
    assertEquals(Document.parse("{\"$match\": {\"$expr\": false}}"), stage(notInWithNull, 1));
  }

  @Test
  void likeBecomesAnAnchoredRegex() {
    MongoStatement s = compile(q.filter(q.source("Movie"), like("title", "A%")));
    Object regex = ((Document) stage(s, 1).get("$match")).get("title");
    Pattern p = assertInstanceOf(Pattern.class, regex);
    assertTrue(p.matcher("Alien").matches());
    assertFalse(p.matcher("Blade Runner: A Story").find());
  }

  @Test
  void fieldToFieldComparisonsUseExprWithNullGuards() {
    MongoStatement s = compile(q.filter(q.source("Actor"), compare(field("age"), Operator.GT, field("id"))));
    assertEquals(Document.parse("{\"$match\": {\"$expr\": {\"$and\": [{\"$ne\": [\"$age\", null]},"
        + " {\"$ne\": [\"$id\", null]}, {\"$gt\": [\"$age\", \"$id\"]}]}}}"), stage(s, 1));
  }

  @Test
  void joinIsALookupOverTheRightPipeline() {
    MongoStatement s = compile(q.join(q.source("Actor", "a"), q.source("Movie", "m"), fieldEq("a.movieId", "m.id")));
    assertEquals("actors", s.collection());
    Document lookup = (Document) stage(s, 1).get("$lookup");
    assertEquals("movies", lookup.getString("from"));
    assertEquals(Document.parse("{\"k0\": \"$movieId\"}"), lookup.get("let"));
    List<?> sub = (List<?>) lookup.get("pipeline");
    assertEquals(2, sub.size());
    assertEquals(Document.parse("{\"$match\": {\"$expr\": {\"$and\": [{\"$eq\": [\"$id\", \"$$k0\"]},"
        + " {\"$ne\": [\"$$k0\", null]}]}}}"), sub.get(1));
    assertEquals(Document.parse("{\"$unwind\": \"$__right\"}"), stage(s, 2));

    Document fields = (Document) stage(s, 3).get("$project");
    assertEquals("$id", fields.get("a.id"));
    assertEquals("$__right.title", fields.get("m.title"));
  }

  @Test
  void groupedAggregateProjectsKeysAndAccumulators() {
    MongoStatement s = compile(q.aggregate(q.groupBy(q.source("Actor"), "movieId"),
        AggregateCall.count(), AggregateCall.of(AggregateFunction.MAX, "age")));
    assertEquals(Document.parse("{\"$group\": {\"_id\": {\"k0\": \"$movieId\"}, \"a0\": {\"$sum\": 1},"
        + " \"a1\": {\"$max\": \"$age\"}}}"), stage(s, 1));
    assertEquals(Document.parse("{\"$project\": {\"_id\": 0, \"movieId\": \"$_id.k0\", \"count\": \"$a0\", \"max_age\": \"$a1\"}}"),
        stage(s, 2));
    assertEquals(List.of(new MongoStatement.Guard(2, "MAX", "age")), s.guards());
    assertNull(s.emptyRow());
  }

  @Test
  void ungroupedAggregateCarriesItsEmptyRow() {
    MongoStatement s = compile(q.aggregate(q.source("Movie"), AggregateCall.count(),
        AggregateCall.of(AggregateFunction.SUM, "year"), AggregateCall.of(AggregateFunction.COUNT, "rating")));
    assertEquals(Document.parse("{\"$group\": {\"_id\": null, \"a0\": {\"$sum\": 1}, \"a1\": {\"$sum\": \"$year\"},"
        + " \"a2\": {\"$sum\": {\"$cond\": [{\"$ne\": [\"$rating\", null]}, 1, 0]}}}}"), stage(s, 1));
    assertEquals(List.of(0L, 0L, 0L), s.emptyRow());
    assertTrue(s.guards().isEmpty());
  }

  @Test
  void groupRowsArePushed() {
    MongoStatement s = compile(q.groupBy(q.source("Movie"), "directorId"));
    assertEquals(Document.parse("{\"$group\": {\"_id\": {\"k0\": \"$directorId\"}, \"group\": {\"$push\": \"$$ROOT\"}}}"), stage(s, 1));
    assertEquals(List.of(1), List.copyOf(s.members().keySet()));
  }

  @Test
  void reorderingKeepsEarlierKeysAsTieBreakers() {
    MongoStatement s = compile(q.page(q.orderBy(q.orderBy(q.source("Director"), SortField.asc("id")), SortField.desc("name")), 10, 5));
    assertEquals(Document.parse("{\"$sort\": {\"id\": 1}}"), stage(s, 1));
    assertEquals(List.of("name", "id"), List.copyOf(((Document) stage(s, 2).get("$sort")).keySet()));
    assertEquals(Document.parse("{\"$sort\": {\"name\": -1, \"id\": 1}}"), stage(s, 2));
    assertEquals(Document.parse("{\"$skip\": 10}"), stage(s, 3));
    assertEquals(Document.parse("{\"$limit\": 5}"), stage(s, 4));
  }

  @Test
  void emptyPageMatchesNothing() {
    MongoStatement s = compile(q.page(q.source("Director"), 0, 0));
    assertEquals(2, s.pipeline().size());
    assertEquals(Document.parse("{\"$match\": {\"$expr\": false}}"), stage(s, 1));
  }

  @Test
  void arithmeticProjectionUsesLiterals() {
    MongoStatement s = compile(q.project(q.source("Actor"), Projection.as("born", sub(literal(2024), field("age")))));
    assertEquals(Document.parse("{\"$project\": {\"_id\": 0, \"born\": {\"$subtract\": [{\"$literal\": 2024}, \"$age\"]}}}"), stage(s, 1));
  }

  @Test
  void compilationIsReproducible() {
    QueryNode n = q.page(q.orderBy(q.filter(q.source("Movie"), like("title", "%a%")), SortField.asc("year")), 0, 3);
    assertEquals(compile(n).text(), compile(n).text());
  }

  @Test
  void declinesWhatAPipelineCannotExpress() {
    QueryNode cast = q.count(q.filter(q.source("Actor", "a"), correlate("a.movieId", "m.id")));
    UnsupportedPlanOperationException e = assertThrows(UnsupportedPlanOperationException.class,
        () -> compile(q.let_(q.source("Movie", "m"), "castSize", cast)));
    assertEquals(MongoDialect.ID, e.adapterId());

    assertThrows(UnsupportedPlanOperationException.class,
        () -> compile(q.filter(q.source("Movie"), client("odd", r -> r.get("id", Integer.class) % 2 == 1))));
    assertThrows(UnsupportedPlanOperationException.class,
        () -> compile(q.project(q.aggregate(q.source("Actor"), AggregateFunction.MIN, "age"), "min_age")));
    assertThrows(UnsupportedPlanOperationException.class,
        () -> compile(q.filter(q.count(q.source("Actor")), gt("count", 1L))));
  }

  @Test
  void discoveredById() {
    assertInstanceOf(MongoDialect.class, TargetAdapters.byId(MongoDialect.ID));
  }
}
