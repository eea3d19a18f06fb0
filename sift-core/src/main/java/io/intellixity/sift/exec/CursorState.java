package io.intellixity.sift.exec;

public enum CursorState {
  /** Created; the backend has not been touched. */
  NOT_STARTED,
  RUNNING,
  /** All rows yielded, source released. */
  COMPLETED,
  /** A pull failed or the timeout elapsed; later pulls rethrow the same error. */
  FAILED,
  /** {@link ResultCursor#cancel()} was observed. */
  CANCELLED,
  /** Closed by the caller before exhaustion. */
  CLOSED;

  public boolean isTerminal() {
    return this != NOT_STARTED && this != RUNNING;
  }
}
