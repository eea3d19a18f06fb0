package io.intellixity.sift.spi.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Synchronized LRU cache with expire-after-write TTL, used for compiled statements.\n
 *
 * - LRU eviction: access-order LinkedHashMap\n
 * - TTL: 0 disables expiry\n
 * - a supplier that throws leaves no entry behind\n
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Entry<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private record Entry<V>(V value, long writeAt) {}

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    Entry<V> e = map.get(key);
    if (e == null) return null;
    if (isExpired(e, now)) {
      map.remove(key);
      return null;
    }
    return e.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    map.put(key, new Entry<>(value, nowMillis.getAsLong()));
    evictIfNeeded();
  }

  public synchronized V getOrCompute(K key, Supplier<V> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    V existing = get(key);
    if (existing != null) return existing;
    V created = supplier.get();
    put(key, created);
    return created;
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean isExpired(Entry<V> e, long now) {
    return ttlMillis > 0 && (now - e.writeAt()) >= ttlMillis;
  }

  private void pruneExpired(long now) {
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (isExpired(it.next().getValue(), now)) it.remove();
    }
  }

  private void evictIfNeeded() {
    Iterator<Map.Entry<K, Entry<V>>> it = map.entrySet().iterator();
    while (map.size() > maxEntries && it.hasNext()) {
      it.next();
      it.remove();
    }
  }
}
