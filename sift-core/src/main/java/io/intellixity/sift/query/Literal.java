package io.intellixity.sift.query;

import io.intellixity.sift.model.SemanticType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Constant value. A collection value forms a list literal (right-hand side of IN / NIN).
 */
public record Literal(Object value) implements Expr {
  public Literal {
    if (value instanceof Collection<?> c) {
      List<Object> copy = new ArrayList<>(c);
      for (Object o : copy) SemanticType.ofValue(o);
      value = Collections.unmodifiableList(copy);
    } else {
      SemanticType.ofValue(value);
    }
  }

  public boolean isList() { return value instanceof List<?>; }

  public boolean isNull() { return value == null; }

  /** Semantic type of the value (element type for list literals); null for the null literal. */
  public SemanticType type() {
    if (value instanceof List<?> l) {
      SemanticType t = null;
      for (Object o : l) {
        SemanticType ot = SemanticType.ofValue(o);
        if (ot != null) t = (t == null) ? ot : (t.isNumeric() && ot.isNumeric() ? SemanticType.widen(t, ot) : t);
      }
      return t;
    }
    return SemanticType.ofValue(value);
  }

  @SuppressWarnings("unchecked")
  public List<Object> values() {
    if (value instanceof List<?> l) return (List<Object>) l;
    return value == null ? List.of() : List.of(value);
  }

  @Override
  public <R> R accept(ExprVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    if (value instanceof String s) return "'" + s.replace("'", "''") + "'";
    return String.valueOf(value);
  }
}
