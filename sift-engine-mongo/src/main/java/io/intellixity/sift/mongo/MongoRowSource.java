package io.intellixity.sift.mongo;

import com.mongodb.MongoException;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import io.intellixity.sift.error.SourceException;
import io.intellixity.sift.memory.RowSource;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.FieldDef;
import io.intellixity.sift.model.SemanticType;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Collection scans for in-process evaluation of plans the dialect declined.\n
 *
 * Every scan is a {@code find()} over the entity's collection; driver cursors still open when the
 * session ends are closed with it.\n
 */
public final class MongoRowSource implements RowSource {
  private static final Logger log = LoggerFactory.getLogger(MongoRowSource.class);

  private final MongoHandle handle;
  private final int batchSize;

  public MongoRowSource(MongoHandle handle, int batchSize) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.batchSize = batchSize;
  }

  @Override
  public Session openSession() {
    return new MongoSession(handle.client().getDatabase(handle.database()));
  }

  private final class MongoSession implements Session {
    private final MongoDatabase db;
    private final List<MongoCursor<Document>> open = new ArrayList<>();

    MongoSession(MongoDatabase db) {
      this.db = db;
    }

    @Override
    public Iterator<Object[]> scan(EntityDescriptor entity) {
      if (log.isDebugEnabled()) log.debug("sift.mongo op=scan handleId={} entity={} collection={}", handle.id(), entity.name(), entity.source());
      List<String> columns = new ArrayList<>(entity.fields().size());
      List<SemanticType> types = new ArrayList<>(entity.fields().size());
      for (FieldDef f : entity.fields()) {
        columns.add(f.column());
        types.add(f.type());
      }
      MongoCursor<Document> cursor;
      try {
        var find = db.getCollection(entity.source()).find();
        if (batchSize > 0) find = find.batchSize(batchSize);
        cursor = find.cursor();
      } catch (MongoException e) {
        throw new SourceException("Scan of " + entity.name() + " failed: " + e.getMessage(), e);
      }
      open.add(cursor);
      return new Iterator<>() {
        private boolean done;

        @Override
        public boolean hasNext() {
          if (done) return false;
          try {
            if (cursor.hasNext()) return true;
            done = true;
            cursor.close();
            open.remove(cursor);
            return false;
          } catch (MongoException e) {
            throw new SourceException("Scan of " + entity.name() + " failed: " + e.getMessage(), e);
          }
        }

        @Override
        public Object[] next() {
          if (!hasNext()) throw new NoSuchElementException();
          return MongoRows.values(cursor.next(), columns, types);
        }
      };
    }

    @Override
    public void close() {
      for (MongoCursor<Document> c : open) c.close();
      open.clear();
    }
  }
}
