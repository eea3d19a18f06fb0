package io.intellixity.sift.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy, single-pass sequence of result rows.
 * <p>
 * Nothing is read from the backend until the first {@link #hasNext()} / {@link #next()}.
 * Always close the cursor (try-with-resources) unless it was drained.
 */
public interface ResultCursor extends Iterator<ResultRow>, AutoCloseable {
  CursorState state();

  /**
   * Requests cancellation. Safe to call from another thread; honoured before the next row is produced.
   * Rows already yielded stay yielded.
   */
  void cancel();

  /** Releases the backend session. Idempotent. */
  @Override
  void close();

  /** Drains the remaining rows into an immutable list and closes the cursor. */
  default List<ResultRow> toList() {
    try (ResultCursor self = this) {
      List<ResultRow> out = new ArrayList<>();
      while (self.hasNext()) out.add(self.next());
      return List.copyOf(out);
    }
  }
}
