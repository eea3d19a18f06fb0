package io.intellixity.sift.memory.op;

/**
 * Pull-based physical operator over positional rows.
 * <p>
 * {@link #open()} before the first {@link #next()}; {@link #close()} releases children and is safe to call twice.
 */
public interface Operator {
  void open();

  /** Next row, or null when exhausted. */
  Object[] next();

  void close();
}
