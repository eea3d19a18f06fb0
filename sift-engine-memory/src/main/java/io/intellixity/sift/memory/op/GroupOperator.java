package io.intellixity.sift.memory.op;

import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.Values;
import io.intellixity.sift.memory.eval.RowFunction;

import java.util.*;

/**
 * Buffers its input into groups keyed by the key columns, in first-seen key order. Each output row
 * carries the key values followed by the group's rows (as {@link ResultRow}s named after the input shape).
 */
public final class GroupOperator implements Operator {
  private final Operator child;
  private final List<RowFunction> keys;
  private final List<String> inputNames;
  private final Object[] outer;
  private final Runnable checkpoint;
  private Iterator<Map.Entry<List<Object>, Group>> groups;

  private static final class Group {
    final Object[] keyValues;
    final List<ResultRow> rows = new ArrayList<>();

    Group(Object[] keyValues) { this.keyValues = keyValues; }
  }

  public GroupOperator(Operator child, List<RowFunction> keys, List<String> inputNames, Object[] outer, Runnable checkpoint) {
    this.child = child;
    this.keys = List.copyOf(keys);
    this.inputNames = List.copyOf(inputNames);
    this.outer = outer;
    this.checkpoint = checkpoint;
  }

  @Override
  public void open() {
    child.open();
    LinkedHashMap<List<Object>, Group> map = new LinkedHashMap<>();
    Object[] r;
    while ((r = child.next()) != null) {
      checkpoint.run();
      Object[] kv = new Object[keys.size()];
      List<Object> hashKey = new ArrayList<>(kv.length);
      for (int i = 0; i < kv.length; i++) {
        kv[i] = keys.get(i).apply(r, outer);
        hashKey.add(Values.key(kv[i]));
      }
      map.computeIfAbsent(hashKey, k -> new Group(kv)).rows.add(new ResultRow(inputNames, r));
    }
    groups = map.entrySet().iterator();
  }

  @Override
  public Object[] next() {
    if (!groups.hasNext()) return null;
    Group g = groups.next().getValue();
    Object[] out = Arrays.copyOf(g.keyValues, g.keyValues.length + 1);
    out[g.keyValues.length] = Collections.unmodifiableList(g.rows);
    return out;
  }

  @Override
  public void close() {
    child.close();
    groups = null;
  }
}
