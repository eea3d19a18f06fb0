package io.intellixity.sift.query;

import java.util.Objects;

/** Sort key. Nulls sort first ascending and last descending. */
public record SortField(Expr key, Direction direction) {
  public SortField {
    Objects.requireNonNull(key, "key");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String fieldPath) { return new SortField(FieldRef.parse(fieldPath), Direction.ASC); }
  public static SortField desc(String fieldPath) { return new SortField(FieldRef.parse(fieldPath), Direction.DESC); }

  public enum Direction { ASC, DESC }
}
