package io.intellixity.sift.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EntityRegistryJsonTest {
  @Test
  void loadsEntitiesFromClasspath() {
    EntityRegistry r = EntityRegistryJson.loadResource("movies.json");

    EntityDescriptor movie = r.entity("Movie");
    assertEquals("movies", movie.source());
    assertEquals("id", movie.keyField());
    assertEquals("release_date", movie.field("releaseDate").column());
    assertEquals(SemanticType.DATE, movie.field("releaseDate").type());
    assertTrue(movie.field("rating").nullable());
    assertFalse(movie.field("title").nullable());

    RelationDef actors = movie.relation("actors");
    assertEquals(Cardinality.TO_MANY, actors.cardinality());
    assertEquals("Actor", actors.targetEntity());
    assertEquals("movieId", actors.foreignKey());
  }

  @Test
  void missingResourceFails() {
    assertThrows(IllegalArgumentException.class, () -> EntityRegistryJson.loadResource("nope.json"));
  }
}
