package io.intellixity.sift.exec;

import java.util.*;

/**
 * Immutable, ordered mapping from output field name to value.
 * <p>
 * Values of a {@code group} column are {@code List<ResultRow>}.
 */
public final class ResultRow {
  private final List<String> names;
  private final Object[] values;

  public ResultRow(List<String> names, Object[] values) {
    Objects.requireNonNull(names, "names");
    Objects.requireNonNull(values, "values");
    if (names.size() != values.length) {
      throw new IllegalArgumentException("expected " + names.size() + " values, got " + values.length);
    }
    this.names = List.copyOf(names);
    this.values = values.clone();
  }

  /** Builds a row from an ordered map (iteration order is kept). */
  public static ResultRow of(Map<String, ?> values) {
    List<String> names = new ArrayList<>(values.keySet());
    return new ResultRow(names, values.values().toArray());
  }

  public List<String> names() { return names; }

  public int size() { return values.length; }

  public boolean has(String name) { return names.contains(name); }

  /** Value of the named field; fails for unknown names so typos do not read as null. */
  public Object get(String name) {
    int i = names.indexOf(name);
    if (i < 0) throw new IllegalArgumentException("Unknown field '" + name + "'; row has " + names);
    return values[i];
  }

  public <T> T get(String name, Class<T> type) {
    Object v = get(name);
    if (v == null) return null;
    if (!type.isInstance(v)) {
      throw new ClassCastException("Field '" + name + "' is " + v.getClass().getName() + ", not " + type.getName());
    }
    return type.cast(v);
  }

  public Object get(int index) { return values[index]; }

  /** Rows of a {@code group} column. */
  @SuppressWarnings("unchecked")
  public List<ResultRow> rows(String name) {
    Object v = get(name);
    if (v == null) return List.of();
    if (!(v instanceof List<?>)) throw new ClassCastException("Field '" + name + "' is not a row sequence");
    return (List<ResultRow>) v;
  }

  public List<Object> values() { return Collections.unmodifiableList(Arrays.asList(values.clone())); }

  public Map<String, Object> asMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < values.length; i++) m.put(names.get(i), values[i]);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ResultRow r)) return false;
    return names.equals(r.names) && Arrays.equals(values, r.values);
  }

  @Override
  public int hashCode() {
    return 31 * names.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "{", "}");
    for (int i = 0; i < values.length; i++) j.add(names.get(i) + "=" + values[i]);
    return j.toString();
  }
}
