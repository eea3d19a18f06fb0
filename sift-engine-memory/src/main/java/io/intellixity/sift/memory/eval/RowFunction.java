package io.intellixity.sift.memory.eval;

/** Expression compiled against a row layout; {@code outer} is the enclosing row inside a let sub-plan, else null. */
@FunctionalInterface
public interface RowFunction {
  Object apply(Object[] row, Object[] outer);
}
