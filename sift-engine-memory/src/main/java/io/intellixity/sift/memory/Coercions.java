package io.intellixity.sift.memory;

import io.intellixity.sift.model.SemanticType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.util.UUID;

/**
 * Converts raw values (JSON-ish maps, JDBC objects, BSON values) to the Java type of a {@link SemanticType}.
 */
public final class Coercions {
  private Coercions() {}

  public static Object coerce(Object raw, SemanticType type) {
    if (raw == null) return null;
    return switch (type) {
      case STRING -> raw instanceof String ? raw : raw.toString();
      case INT -> raw instanceof Integer ? raw : number(raw, type).intValue();
      case LONG -> raw instanceof Long ? raw : number(raw, type).longValue();
      case DOUBLE -> raw instanceof Double ? raw : number(raw, type).doubleValue();
      case DECIMAL -> decimal(raw);
      case BOOLEAN -> bool(raw);
      case DATE -> date(raw);
      case TIMESTAMP -> timestamp(raw);
      case UUID -> raw instanceof UUID ? raw : UUID.fromString(raw.toString());
      case ROWS -> raw;
    };
  }

  private static Number number(Object raw, SemanticType type) {
    if (raw instanceof Number n) return n;
    if (raw instanceof String s) return new BigDecimal(s.trim());
    throw mismatch(raw, type);
  }

  private static BigDecimal decimal(Object raw) {
    if (raw instanceof BigDecimal d) return d;
    if (raw instanceof BigInteger i) return new BigDecimal(i);
    if (raw instanceof Number n) return Values.decimal(n);
    if (raw instanceof String s) return new BigDecimal(s.trim());
    throw mismatch(raw, SemanticType.DECIMAL);
  }

  private static Boolean bool(Object raw) {
    if (raw instanceof Boolean b) return b;
    if (raw instanceof Number n) return n.intValue() != 0;
    if (raw instanceof String s) return Boolean.parseBoolean(s.trim());
    throw mismatch(raw, SemanticType.BOOLEAN);
  }

  private static LocalDate date(Object raw) {
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof java.sql.Date d) return d.toLocalDate();
    if (raw instanceof LocalDateTime t) return t.toLocalDate();
    if (raw instanceof java.util.Date d) return d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
    if (raw instanceof String s) return LocalDate.parse(s.trim());
    throw mismatch(raw, SemanticType.DATE);
  }

  private static LocalDateTime timestamp(Object raw) {
    if (raw instanceof LocalDateTime t) return t;
    if (raw instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
    if (raw instanceof Instant i) return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    if (raw instanceof OffsetDateTime o) return o.atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
    if (raw instanceof java.util.Date d) return LocalDateTime.ofInstant(d.toInstant(), ZoneOffset.UTC);
    if (raw instanceof LocalDate d) return d.atStartOfDay();
    if (raw instanceof String s) return LocalDateTime.parse(s.trim());
    throw mismatch(raw, SemanticType.TIMESTAMP);
  }

  private static IllegalArgumentException mismatch(Object raw, SemanticType type) {
    return new IllegalArgumentException("Cannot convert " + raw.getClass().getName() + " to " + type.id());
  }
}
