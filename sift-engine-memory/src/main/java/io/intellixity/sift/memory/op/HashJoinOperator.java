package io.intellixity.sift.memory.op;

import io.intellixity.sift.memory.Values;

import java.util.*;

/**
 * Inner equi-join: buffers the right input into a hash table on open, then streams the left input
 * and emits {@code left ++ right} for every match, in left order then right order.
 * Null keys never match.
 */
public final class HashJoinOperator implements Operator {
  private final Operator left;
  private final Operator right;
  private final int[] leftKeys;
  private final int[] rightKeys;
  private final Runnable checkpoint;

  private Map<List<Object>, List<Object[]>> rightHash;
  private boolean rightClosed;
  private Object[] currentLeft;
  private List<Object[]> matches = List.of();
  private int matchIndex;

  public HashJoinOperator(Operator left, Operator right, int[] leftKeys, int[] rightKeys, Runnable checkpoint) {
    this.left = left;
    this.right = right;
    this.leftKeys = leftKeys.clone();
    this.rightKeys = rightKeys.clone();
    this.checkpoint = checkpoint;
  }

  @Override
  public void open() {
    right.open();
    rightHash = new HashMap<>();
    try {
      Object[] r;
      while ((r = right.next()) != null) {
        checkpoint.run();
        List<Object> key = key(r, rightKeys);
        if (key != null) rightHash.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
      }
    } finally {
      closeRight();
    }
    left.open();
  }

  @Override
  public Object[] next() {
    while (true) {
      if (matchIndex < matches.size()) {
        Object[] r = matches.get(matchIndex++);
        Object[] out = Arrays.copyOf(currentLeft, currentLeft.length + r.length);
        System.arraycopy(r, 0, out, currentLeft.length, r.length);
        return out;
      }
      currentLeft = left.next();
      if (currentLeft == null) return null;
      List<Object> key = key(currentLeft, leftKeys);
      List<Object[]> found = key == null ? null : rightHash.get(key);
      matches = found == null ? List.of() : found;
      matchIndex = 0;
    }
  }

  @Override
  public void close() {
    left.close();
    closeRight();
    rightHash = null;
  }

  // the build side is drained and closed during open
  private void closeRight() {
    if (rightClosed) return;
    rightClosed = true;
    right.close();
  }

  private static List<Object> key(Object[] row, int[] idx) {
    List<Object> k = new ArrayList<>(idx.length);
    for (int i : idx) {
      Object v = row[i];
      if (v == null) return null;
      k.add(Values.key(v));
    }
    return k;
  }
}
