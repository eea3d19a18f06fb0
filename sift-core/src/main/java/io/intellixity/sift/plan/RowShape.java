package io.intellixity.sift.plan;

import io.intellixity.sift.error.UnknownFieldException;

import java.util.*;

/**
 * Ordered, typed columns of the rows a plan step yields.
 * <p>
 * Output names (the keys of result rows) are the bare column name while the shape carries at most one
 * source qualifier, and {@code qualifier.name} once a join brings in a second one.
 */
public final class RowShape {
  public static final int NOT_FOUND = -1;
  public static final int AMBIGUOUS = -2;

  private static final RowShape OPAQUE = new RowShape(List.of(), true);

  private final List<Column> columns;
  private final boolean opaque;
  private final List<String> outputNames;

  public RowShape(List<Column> columns) {
    this(columns, false);
  }

  private RowShape(List<Column> columns, boolean opaque) {
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    this.opaque = opaque;

    Set<String> qualifiers = new LinkedHashSet<>();
    for (Column c : this.columns) if (c.qualifier() != null) qualifiers.add(c.qualifier());
    boolean qualify = qualifiers.size() > 1;
    List<String> names = new ArrayList<>(this.columns.size());
    for (Column c : this.columns) {
      names.add(qualify && c.qualifier() != null ? c.qualifier() + "." + c.name() : c.name());
    }
    this.outputNames = Collections.unmodifiableList(names);
  }

  /** Shape of a step whose input failed validation; lookups against it never report errors. */
  static RowShape opaque() { return OPAQUE; }

  public boolean isOpaque() { return opaque; }

  public List<Column> columns() { return columns; }
  public int size() { return columns.size(); }
  public Column column(int index) { return columns.get(index); }

  public List<String> outputNames() { return outputNames; }
  public String outputName(int index) { return outputNames.get(index); }

  public Set<String> qualifiers() {
    Set<String> out = new LinkedHashSet<>();
    for (Column c : columns) if (c.qualifier() != null) out.add(c.qualifier());
    return out;
  }

  /** Index of the column, {@link #NOT_FOUND} or {@link #AMBIGUOUS}. A null qualifier matches by name alone. */
  public int find(String qualifier, String name) {
    int found = NOT_FOUND;
    for (int i = 0; i < columns.size(); i++) {
      Column c = columns.get(i);
      if (!c.name().equals(name)) continue;
      if (qualifier != null && !qualifier.equals(c.qualifier())) continue;
      if (found != NOT_FOUND) return AMBIGUOUS;
      found = i;
    }
    return found;
  }

  /** Like {@link #find} but fails with {@link UnknownFieldException} for missing or ambiguous names. */
  public int resolve(String qualifier, String name) {
    int i = find(qualifier, name);
    String path = qualifier == null ? name : qualifier + "." + name;
    if (i == AMBIGUOUS) {
      throw new UnknownFieldException(describe(), path,
          "Field '" + path + "' is ambiguous in " + describe() + "; qualify it with one of " + qualifiers());
    }
    if (i == NOT_FOUND) throw new UnknownFieldException(describe(), path);
    return i;
  }

  public RowShape concat(RowShape other) {
    if (opaque || other.opaque) return OPAQUE;
    List<Column> out = new ArrayList<>(columns);
    out.addAll(other.columns);
    return new RowShape(out);
  }

  public RowShape append(Column column) {
    if (opaque) return OPAQUE;
    List<Column> out = new ArrayList<>(columns);
    out.add(column);
    return new RowShape(out);
  }

  private String describe() {
    Set<String> q = qualifiers();
    return q.isEmpty() ? "row" : String.join(",", q);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RowShape other)) return false;
    return opaque == other.opaque && columns.equals(other.columns);
  }

  @Override
  public int hashCode() { return Objects.hash(columns, opaque); }

  @Override
  public String toString() { return opaque ? "[?]" : columns.toString(); }
}
