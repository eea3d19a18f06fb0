package io.intellixity.sift.memory.op;

import io.intellixity.sift.error.DataException;
import io.intellixity.sift.error.EmptyAggregateException;
import io.intellixity.sift.memory.Values;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.AggregateFunction;

import java.math.BigDecimal;
import java.math.MathContext;

/** Running state of one aggregate over one group. Null inputs are skipped, except by {@code COUNT()}. */
final class Accumulator {
  private final AggregateFunction fn;
  private final SemanticType resultType;
  private final String label;

  private long count;
  private long longSum;
  private double doubleSum;
  private BigDecimal decimalSum = BigDecimal.ZERO;
  private boolean nonFinite;
  private Object extreme;

  Accumulator(AggregateFunction fn, SemanticType resultType, String label) {
    this.fn = fn;
    this.resultType = resultType;
    this.label = label;
  }

  /** @param countRow true for {@code COUNT()} without a field */
  void add(Object v, boolean countRow) {
    if (countRow) {
      count++;
      return;
    }
    if (v == null) return;
    count++;
    switch (fn) {
      case COUNT -> { }
      case MIN -> { if (extreme == null || Values.compare(v, extreme) < 0) extreme = v; }
      case MAX -> { if (extreme == null || Values.compare(v, extreme) > 0) extreme = v; }
      case SUM, AVERAGE -> addNumber((Number) v);
    }
  }

  private void addNumber(Number n) {
    if (resultType == SemanticType.DOUBLE) doubleSum += n.doubleValue();
    if (fn == AggregateFunction.AVERAGE || resultType == SemanticType.DECIMAL) {
      // an infinite or NaN input makes the average a plain double sum
      if (Values.isFinite(n)) decimalSum = decimalSum.add(Values.decimal(n));
      else nonFinite = true;
    } else if (resultType != SemanticType.DOUBLE) {
      try {
        longSum = Math.addExact(longSum, n.longValue());
      } catch (ArithmeticException e) {
        throw new DataException(fn + "(" + label + ") overflows a long", e);
      }
    }
  }

  Object result() {
    switch (fn) {
      case COUNT:
        return count;
      case SUM:
        if (resultType == SemanticType.DECIMAL) return decimalSum;
        if (resultType == SemanticType.DOUBLE) return doubleSum;
        return longSum;
      case MIN:
      case MAX:
        if (extreme == null) throw new EmptyAggregateException(fn.name(), label);
        return extreme;
      case AVERAGE:
        if (count == 0) throw new EmptyAggregateException(fn.name(), label);
        if (nonFinite) return doubleSum / count;
        BigDecimal avg = decimalSum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL128);
        return resultType == SemanticType.DECIMAL ? avg : avg.doubleValue();
      default:
        throw new IllegalStateException("Unexpected aggregate " + fn);
    }
  }
}
