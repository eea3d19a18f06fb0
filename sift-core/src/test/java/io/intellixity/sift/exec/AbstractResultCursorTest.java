package io.intellixity.sift.exec;

import io.intellixity.sift.error.QueryCancelledException;
import io.intellixity.sift.error.QueryTimeoutException;
import io.intellixity.sift.error.SourceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractResultCursorTest {
  /** Yields the given values, failing at {@code failAt} when it is reached. */
  static final class CountingCursor extends AbstractResultCursor {
    int opens;
    int releases;
    int fetches;
    private final int failAt;
    private final Iterator<Integer> values;

    CountingCursor(List<Integer> values, int failAt, ExecutionOptions options, AtomicLong clock) {
      super("test", options, clock::get);
      this.values = values.iterator();
      this.failAt = failAt;
    }

    @Override
    protected void open() { opens++; }

    @Override
    protected ResultRow fetch() {
      fetches++;
      if (fetches == failAt) throw new IllegalStateException("disk on fire");
      if (!values.hasNext()) return null;
      return new ResultRow(List.of("n"), new Object[] {values.next()});
    }

    @Override
    protected void release() { releases++; }
  }

  private static CountingCursor cursor(List<Integer> values, int failAt) {
    return new CountingCursor(values, failAt, ExecutionOptions.defaults(), new AtomicLong());
  }

  @Test
  void nothingHappensBeforeTheFirstPull() {
    CountingCursor c = cursor(List.of(1, 2), -1);
    assertEquals(CursorState.NOT_STARTED, c.state());
    assertEquals(0, c.opens);
    assertEquals(0, c.fetches);

    c.close();
    assertEquals(CursorState.CLOSED, c.state());
    assertEquals(0, c.releases);
  }

  @Test
  void exhaustionReleasesOnce() {
    CountingCursor c = cursor(List.of(1, 2), -1);
    assertEquals(2, c.toList().size());
    assertEquals(CursorState.COMPLETED, c.state());
    assertEquals(1, c.opens);
    assertEquals(1, c.releases);
    assertFalse(c.hasNext());
    c.close();
    assertEquals(1, c.releases);
  }

  @Test
  void failureIsMemoizedAndRethrown() {
    CountingCursor c = cursor(List.of(1, 2, 3), 2);
    assertEquals(1, c.next().get("n"));
    SourceException first = assertThrows(SourceException.class, c::hasNext);
    assertTrue(first.getCause() instanceof IllegalStateException);
    assertEquals(CursorState.FAILED, c.state());

    SourceException second = assertThrows(SourceException.class, c::next);
    assertSame(first, second);
    assertEquals(2, c.fetches);
    assertEquals(1, c.releases);
  }

  @Test
  void earlyCloseReleases() {
    CountingCursor c = cursor(List.of(1, 2, 3), -1);
    c.next();
    c.close();
    assertEquals(CursorState.CLOSED, c.state());
    assertEquals(1, c.releases);
    assertFalse(c.hasNext());
  }

  @Test
  void cancelIsHonouredBetweenRows() {
    CountingCursor c = cursor(List.of(1, 2, 3), -1);
    assertEquals(1, c.next().get("n"));
    c.cancel();
    QueryCancelledException e = assertThrows(QueryCancelledException.class, c::hasNext);
    assertEquals(CursorState.CANCELLED, c.state());
    assertSame(e, assertThrows(QueryCancelledException.class, c::hasNext));
    assertEquals(1, c.releases);
  }

  @Test
  void timeoutFailsAndReleases() {
    AtomicLong clock = new AtomicLong();
    ExecutionOptions opts = ExecutionOptions.defaults().withTimeout(Duration.ofMillis(10));
    CountingCursor c = new CountingCursor(List.of(1, 2, 3), -1, opts, clock);

    assertEquals(1, c.next().get("n"));
    clock.addAndGet(Duration.ofMillis(11).toNanos());
    QueryTimeoutException e = assertThrows(QueryTimeoutException.class, c::hasNext);
    assertEquals(Duration.ofMillis(10), e.timeout());
    assertEquals(CursorState.FAILED, c.state());
    assertSame(e, assertThrows(QueryTimeoutException.class, c::hasNext));
    assertEquals(1, c.releases);
  }
}
