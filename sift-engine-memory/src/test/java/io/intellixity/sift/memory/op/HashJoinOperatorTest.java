package io.intellixity.sift.memory.op;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class HashJoinOperatorTest {

  /** Serves fixed rows and counts open/close calls. */
  private static final class Rows implements Operator {
    private final List<Object[]> rows;
    private int pos;
    int opens;
    int closes;

    Rows(Object[]... rows) {
      this.rows = List.of(rows);
    }

    @Override public void open() { opens++; pos = 0; }
    @Override public Object[] next() { return pos < rows.size() ? rows.get(pos++) : null; }
    @Override public void close() { closes++; }
  }

  @Test
  void matchesInLeftThenRightOrderAndSkipsNullKeys() {
    Rows left = new Rows(new Object[] {1, "a"}, new Object[] {2, "b"}, new Object[] {null, "c"});
    Rows right = new Rows(new Object[] {1L, "x"}, new Object[] {1, "y"}, new Object[] {null, "z"});
    HashJoinOperator join = new HashJoinOperator(left, right, new int[] {0}, new int[] {0}, () -> {});

    join.open();
    List<String> out = new ArrayList<>();
    Object[] r;
    while ((r = join.next()) != null) out.add(r[1] + "" + r[3]);
    join.close();

    assertEquals(List.of("ax", "ay"), out);
  }

  @Test
  void buildSideIsClosedOnce() {
    Rows left = new Rows(new Object[] {1});
    Rows right = new Rows(new Object[] {1});
    HashJoinOperator join = new HashJoinOperator(left, right, new int[] {0}, new int[] {0}, () -> {});

    join.open();
    assertEquals(1, right.closes);
    assertNotNull(join.next());
    join.close();
    join.close();

    assertEquals(1, right.closes);
    assertEquals(1, right.opens);
    assertEquals(2, left.closes);
  }

  @Test
  void failedBuildStillClosesTheBuildSideOnce() {
    Rows left = new Rows(new Object[] {1});
    Rows right = new Rows(new Object[] {1}, new Object[] {2});
    HashJoinOperator join = new HashJoinOperator(left, right, new int[] {0}, new int[] {0}, () -> {
      throw new IllegalStateException("stop");
    });

    assertThrows(IllegalStateException.class, join::open);
    join.close();

    assertEquals(1, right.closes);
    assertEquals(0, left.opens);
  }
}
