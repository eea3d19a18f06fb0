package io.intellixity.sift.mongo;

import com.mongodb.MongoClientSettings;
import io.intellixity.sift.plan.RowShape;
import io.intellixity.sift.spi.adapter.NativeStatement;
import org.bson.Document;
import org.bson.codecs.Encoder;
import org.bson.json.JsonWriterSettings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Backend-native statement representation for MongoDB: one aggregation pipeline over a collection.
 *
 * @param guards   output columns of MIN / MAX / AVERAGE calls; a null value there means the aggregate had no input
 * @param emptyRow for a pipeline ending in an ungrouped aggregate, the row to yield when {@code $group} emits
 *                 nothing (null otherwise)
 * @param members  member shape of each group column, by output column index
 */
public record MongoStatement(
    String collection,
    List<Document> pipeline,
    List<Guard> guards,
    List<Object> emptyRow,
    Map<Integer, RowShape> members
) implements NativeStatement {
  public record Guard(int column, String function, String field) {}

  private static final Encoder<Document> ENCODER = MongoClientSettings.getDefaultCodecRegistry().get(Document.class);
  private static final JsonWriterSettings JSON = JsonWriterSettings.builder().build();

  public MongoStatement {
    Objects.requireNonNull(collection, "collection");
    pipeline = List.copyOf(pipeline);
    guards = List.copyOf(guards);
    if (emptyRow != null) emptyRow = Collections.unmodifiableList(new ArrayList<>(emptyRow));
    members = Map.copyOf(members);
  }

  public MongoStatement(String collection, List<Document> pipeline) {
    this(collection, pipeline, List.of(), null, Map.of());
  }

  /** Shell-style rendering, e.g. {@code db.movies.aggregate([{"$project": ...}])}. */
  @Override
  public String text() {
    List<String> stages = new ArrayList<>(pipeline.size());
    for (Document d : pipeline) stages.add(d.toJson(JSON, ENCODER));
    return "db." + collection + ".aggregate([" + String.join(", ", stages) + "])";
  }
}
