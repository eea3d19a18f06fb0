package io.intellixity.sift.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.FieldDef;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe in-memory collections keyed by entity name.\n
 *
 * Objects are converted to rows with Jackson (POJOs, records and maps are accepted; properties are
 * matched by logical field name) and coerced to the registered field types. A scan iterates a
 * snapshot, so concurrent inserts never disturb a running query.\n
 */
public final class InMemoryStore implements RowSource {
  private static final TypeReference<Map<String, Object>> MAP = new TypeReference<>() {};

  private final EntityRegistry registry;
  private final ObjectMapper mapper;
  private final Map<String, List<Object[]>> tables = new ConcurrentHashMap<>();
  private final AtomicInteger opened = new AtomicInteger();
  private final AtomicInteger active = new AtomicInteger();

  public InMemoryStore(EntityRegistry registry) {
    this(registry, defaultMapper());
  }

  public InMemoryStore(EntityRegistry registry, ObjectMapper mapper) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
  }

  public EntityRegistry registry() { return registry; }

  /** Adds one object (POJO, record or {@code Map}) to the entity's collection. */
  public InMemoryStore add(String entity, Object value) {
    EntityDescriptor e = registry.entity(entity);
    table(e).add(toRow(e, value));
    return this;
  }

  public InMemoryStore addAll(String entity, Collection<?> values) {
    EntityDescriptor e = registry.entity(entity);
    List<Object[]> rows = new ArrayList<>(values.size());
    for (Object v : values) rows.add(toRow(e, v));
    table(e).addAll(rows);
    return this;
  }

  public int size(String entity) {
    List<Object[]> t = tables.get(registry.entity(entity).name());
    return t == null ? 0 : t.size();
  }

  /** Sessions opened so far. */
  public int sessionsOpened() { return opened.get(); }

  /** Sessions currently open. */
  public int activeSessions() { return active.get(); }

  @Override
  public Session openSession() {
    opened.incrementAndGet();
    active.incrementAndGet();
    return new Session() {
      private boolean closed;

      @Override
      public Iterator<Object[]> scan(EntityDescriptor entity) {
        if (closed) throw new IllegalStateException("session is closed");
        List<Object[]> t = tables.get(entity.name());
        if (t == null) return Collections.emptyIterator();
        // copy-on-write snapshot; rows themselves are never mutated
        return t.iterator();
      }

      @Override
      public void close() {
        if (closed) return;
        closed = true;
        active.decrementAndGet();
      }
    };
  }

  private List<Object[]> table(EntityDescriptor e) {
    return tables.computeIfAbsent(e.name(), k -> new CopyOnWriteArrayList<>());
  }

  private Object[] toRow(EntityDescriptor e, Object value) {
    Objects.requireNonNull(value, "value");
    Map<String, Object> m = mapper.convertValue(value, MAP);
    Object[] row = new Object[e.fields().size()];
    for (int i = 0; i < row.length; i++) {
      FieldDef f = e.fields().get(i);
      Object raw = m.get(f.name());
      if (raw == null && !f.nullable()) {
        throw new IllegalArgumentException("Field '" + e.name() + "." + f.name() + "' is not nullable");
      }
      row[i] = Coercions.coerce(raw, f.type());
    }
    return row;
  }
}
