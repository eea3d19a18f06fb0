package io.intellixity.sift.memory;

import io.intellixity.sift.error.DataException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/** Value semantics shared by in-process evaluation: comparison, join-key equality and LIKE. */
public final class Values {
  private Values() {}

  /** Orders two non-null values of comparable semantic types. Numbers of different classes compare by value. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      if (isIntegral(x) && isIntegral(y)) return Long.compare(x.longValue(), y.longValue());
      if ((isFloating(x) && isFloating(y)) || !isFinite(x) || !isFinite(y)) {
        return Double.compare(x.doubleValue(), y.doubleValue());
      }
      return decimal(x).compareTo(decimal(y));
    }
    if (a.getClass() != b.getClass() || !(a instanceof Comparable<?>)) {
      throw new IllegalArgumentException("Cannot compare " + a.getClass().getName() + " with " + b.getClass().getName());
    }
    return ((Comparable) a).compareTo(b);
  }

  /** Null-aware ordering: null sorts before every value. */
  public static int compareNullsFirst(Object a, Object b) {
    if (a == null) return b == null ? 0 : -1;
    if (b == null) return 1;
    return compare(a, b);
  }

  /** Normalizes a value for hashing so that {@code 1}, {@code 1L} and {@code 1.0} meet in the same bucket. */
  public static Object key(Object v) {
    if (v instanceof Number n) {
      if (isIntegral(n)) return n.longValue();
      if (!isFinite(n)) return n.doubleValue();
      BigDecimal d = decimal(n).stripTrailingZeros();
      try {
        return d.longValueExact();
      } catch (ArithmeticException notIntegral) {
        return d;
      }
    }
    return v;
  }

  public static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
    if (!isFinite(n)) throw new DataException("Cannot use " + n + " as an exact number");
    return BigDecimal.valueOf(n.doubleValue());
  }

  public static boolean isFloating(Number n) {
    return n instanceof Double || n instanceof Float;
  }

  /** False only for infinite and NaN doubles and floats. */
  public static boolean isFinite(Number n) {
    return !isFloating(n) || Double.isFinite(n.doubleValue());
  }

  public static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte || n instanceof BigInteger;
  }

  /** SQL LIKE: {@code %} any run, {@code _} one character, everything else literal. */
  public static Pattern likePattern(String like) {
    StringBuilder re = new StringBuilder();
    StringBuilder lit = new StringBuilder();
    for (char c : like.toCharArray()) {
      if (c == '%' || c == '_') {
        if (lit.length() > 0) {
          re.append(Pattern.quote(lit.toString()));
          lit.setLength(0);
        }
        re.append(c == '%' ? ".*" : ".");
      } else {
        lit.append(c);
      }
    }
    if (lit.length() > 0) re.append(Pattern.quote(lit.toString()));
    return Pattern.compile(re.toString(), Pattern.DOTALL);
  }
}
