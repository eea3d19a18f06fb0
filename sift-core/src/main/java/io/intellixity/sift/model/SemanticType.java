package io.intellixity.sift.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Semantic type of a field or expression.
 * <p>
 * Numeric types compare with each other; every other scalar compares only with itself.
 * {@link #ROWS} is the nested sub-sequence a group carries and is never comparable.
 */
public enum SemanticType {
  STRING("string", String.class),
  INT("int", Integer.class),
  LONG("long", Long.class),
  DOUBLE("double", Double.class),
  DECIMAL("decimal", BigDecimal.class),
  BOOLEAN("bool", Boolean.class),
  DATE("date", LocalDate.class),
  TIMESTAMP("timestamp", LocalDateTime.class),
  UUID("uuid", java.util.UUID.class),
  ROWS("rows", java.util.List.class);

  private final String id;
  private final Class<?> javaType;

  SemanticType(String id, Class<?> javaType) {
    this.id = id;
    this.javaType = javaType;
  }

  public String id() { return id; }
  public Class<?> javaType() { return javaType; }

  public boolean isNumeric() {
    return this == INT || this == LONG || this == DOUBLE || this == DECIMAL;
  }

  public boolean isScalar() { return this != ROWS; }

  /** True if values of both types may appear on either side of a comparison. */
  public boolean comparableWith(SemanticType other) {
    if (other == null) return isScalar();
    if (!isScalar() || !other.isScalar()) return false;
    if (this == other) return true;
    return isNumeric() && other.isNumeric();
  }

  /** Widest numeric type of the two (used for arithmetic and SUM). */
  public static SemanticType widen(SemanticType a, SemanticType b) {
    if (a == null) return b;
    if (b == null) return a;
    if (a == DECIMAL || b == DECIMAL) return DECIMAL;
    if (a == DOUBLE || b == DOUBLE) return DOUBLE;
    if (a == LONG || b == LONG) return LONG;
    return INT;
  }

  public static SemanticType fromId(String id) {
    if (id == null) throw new IllegalArgumentException("type id is required");
    String k = id.trim().toLowerCase(Locale.ROOT);
    for (SemanticType t : values()) {
      if (t.id.equals(k) || t.name().toLowerCase(Locale.ROOT).equals(k)) return t;
    }
    if (k.equals("integer")) return INT;
    if (k.equals("boolean")) return BOOLEAN;
    if (k.equals("datetime") || k.equals("instant")) return TIMESTAMP;
    throw new IllegalArgumentException("Unknown semantic type: " + id);
  }

  /** Type of a literal value, or null for the null literal (compatible with anything). */
  public static SemanticType ofValue(Object v) {
    if (v == null) return null;
    if (v instanceof String || v instanceof Character) return STRING;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return INT;
    if (v instanceof Long) return LONG;
    if (v instanceof BigInteger) return DECIMAL;
    if (v instanceof Double || v instanceof Float) return DOUBLE;
    if (v instanceof BigDecimal) return DECIMAL;
    if (v instanceof Boolean) return BOOLEAN;
    if (v instanceof LocalDate) return DATE;
    if (v instanceof LocalDateTime || v instanceof Instant) return TIMESTAMP;
    if (v instanceof UUID) return UUID;
    if (v instanceof java.util.List<?>) return ROWS;
    throw new IllegalArgumentException("Unsupported literal type: " + v.getClass().getName());
  }
}
