package io.intellixity.sift.query;

import java.util.Locale;
import java.util.Objects;

/**
 * One aggregate output column.
 *
 * @param function aggregate function
 * @param field    aggregated value; null only for COUNT (counts rows)
 * @param alias    output column name
 */
public record AggregateCall(AggregateFunction function, Expr field, String alias) {
  public AggregateCall {
    Objects.requireNonNull(function, "function");
    if (field == null && function != AggregateFunction.COUNT) {
      throw new IllegalArgumentException(function + " requires a field");
    }
    if (alias == null || alias.isBlank()) alias = defaultAlias(function, field);
    if (alias.contains(".")) throw new IllegalArgumentException("aggregate alias must not contain '.': " + alias);
  }

  public static AggregateCall count() { return new AggregateCall(AggregateFunction.COUNT, null, null); }

  public static AggregateCall of(AggregateFunction function, String fieldPath) {
    return new AggregateCall(function, fieldPath == null ? null : FieldRef.parse(fieldPath), null);
  }

  public static AggregateCall of(AggregateFunction function, String fieldPath, String alias) {
    return new AggregateCall(function, fieldPath == null ? null : FieldRef.parse(fieldPath), alias);
  }

  private static String defaultAlias(AggregateFunction function, Expr field) {
    String fn = function.name().toLowerCase(Locale.ROOT);
    if (field instanceof FieldRef f) return fn + "_" + f.name();
    return fn;
  }
}
