package io.intellixity.sift.memory;

import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.EntityRegistryJson;

import java.time.LocalDate;
import java.util.List;

/** Small movie catalogue shared by the engine tests. */
final class Fixtures {
  static final EntityRegistry REGISTRY = EntityRegistryJson.loadResource("movies.json");

  record Director(int id, String name) {}

  record Movie(int id, String title, int year, LocalDate releaseDate, Double rating, Integer directorId) {}

  record Actor(int id, String name, Integer age, int movieId) {}

  static final List<Director> DIRECTORS = List.of(
      new Director(1, "Scott"),
      new Director(2, "Villeneuve"));

  static final List<Movie> MOVIES = List.of(
      new Movie(1, "Alien", 1979, LocalDate.of(1979, 5, 25), 8.5, 1),
      new Movie(2, "Blade Runner 2049", 2017, LocalDate.of(2017, 10, 6), 8.0, 2),
      new Movie(3, "Arrival", 2016, LocalDate.of(2016, 11, 11), 7.9, 2),
      new Movie(4, "Prometheus", 2012, null, 7.0, 1),
      new Movie(5, "Untitled", 2025, null, null, null));

  static final List<Actor> ACTORS = List.of(
      new Actor(1, "Weaver", 74, 1),
      new Actor(2, "Gosling", 43, 2),
      new Actor(3, "Ford", 81, 2),
      new Actor(4, "Adams", 49, 3),
      new Actor(5, "Fassbender", null, 4),
      new Actor(6, "Rapace", 44, 4),
      new Actor(7, "Ghost", 30, 99));

  private Fixtures() {}

  static InMemoryStore store() {
    return new InMemoryStore(REGISTRY)
        .addAll("Director", DIRECTORS)
        .addAll("Movie", MOVIES)
        .addAll("Actor", ACTORS);
  }
}
