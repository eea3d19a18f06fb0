package io.intellixity.sift.memory.op;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Appends the scalar result of a correlated sub-plan to every input row. The sub-plan is
 * instantiated per row with that row as its outer row.
 */
public final class LetOperator implements Operator {
  private final Operator child;
  private final Function<Object[], Operator> subPlan;

  public LetOperator(Operator child, Function<Object[], Operator> subPlan) {
    this.child = child;
    this.subPlan = subPlan;
  }

  @Override
  public void open() { child.open(); }

  @Override
  public Object[] next() {
    Object[] in = child.next();
    if (in == null) return null;
    Operator sub = subPlan.apply(in);
    Object[] result;
    try {
      sub.open();
      result = sub.next();
    } finally {
      sub.close();
    }
    if (result == null || result.length != 1) {
      throw new IllegalStateException("let sub-plan must yield exactly one scalar");
    }
    Object[] out = Arrays.copyOf(in, in.length + 1);
    out[in.length] = result[0];
    return out;
  }

  @Override
  public void close() { child.close(); }
}
