package io.intellixity.sift.model;

import io.intellixity.sift.error.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EntityRegistryTest {
  private static EntityDescriptor movie() {
    return EntityDescriptor.builder("Movie")
        .source("movies")
        .key("id")
        .field("id", SemanticType.INT, false)
        .field("title", SemanticType.STRING, false)
        .field("releaseDate", SemanticType.DATE)
        .field("directorId", SemanticType.INT)
        .toOne("director", "Director", "directorId")
        .toMany("actors", "Actor", "movieId")
        .build();
  }

  private static EntityDescriptor director() {
    return EntityDescriptor.builder("Director").key("id")
        .field("id", SemanticType.INT, false)
        .field("name", SemanticType.STRING, false)
        .build();
  }

  private static EntityDescriptor actor() {
    return EntityDescriptor.builder("Actor").key("id")
        .field("id", SemanticType.INT, false)
        .field("movieId", SemanticType.INT, false)
        .build();
  }

  private static EntityRegistry registry() {
    return EntityRegistry.builder().register(movie()).register(director()).register(actor()).build();
  }

  @Test
  void registeringTheSameNameTwiceFails() {
    EntityRegistry.Builder b = EntityRegistry.builder().register(movie());
    DuplicateEntityException e = assertThrows(DuplicateEntityException.class, () -> b.register(movie()));
    assertEquals(ErrorKind.DUPLICATE_ENTITY, e.kind());
  }

  @Test
  void unknownEntityFails() {
    UnknownEntityException e = assertThrows(UnknownEntityException.class, () -> registry().entity("Film"));
    assertEquals("Film", e.entity());
  }

  @Test
  void resolvesPlainAndNavigatedPaths() {
    EntityRegistry r = registry();
    assertEquals(SemanticType.STRING, r.resolveField("Movie", "title").type());

    ResolvedField f = r.resolveField("Movie", "director.name");
    assertEquals("Director", f.owner().name());
    assertEquals(SemanticType.STRING, f.type());
    assertEquals(1, f.via().size());
    assertSame(f, r.resolveField("Movie", "director.name"));
  }

  @Test
  void badPathsFailWithTheMatchingError() {
    EntityRegistry r = registry();
    assertThrows(UnknownFieldException.class, () -> r.resolveField("Movie", "budget"));
    assertThrows(TypeMismatchException.class, () -> r.resolveField("Movie", "director"));
    assertThrows(TypeMismatchException.class, () -> r.resolveField("Movie", "title.length"));
    assertThrows(TypeMismatchException.class, () -> r.resolveField("Movie", "actors.id"));
  }

  @Test
  void expectedTypeIsChecked() {
    EntityRegistry r = registry();
    assertThrows(TypeMismatchException.class, () -> r.resolveField("Movie", "releaseDate", SemanticType.STRING));
    assertEquals(SemanticType.INT, r.resolveField("Movie", "id", SemanticType.LONG).type());
  }

  @Test
  void buildRejectsDanglingRelations() {
    EntityRegistry.Builder b = EntityRegistry.builder().register(movie()).register(director());
    assertThrows(UnknownEntityException.class, b::build);
  }
}
