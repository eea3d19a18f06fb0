package io.intellixity.sift.memory.op;

import io.intellixity.sift.memory.Values;
import io.intellixity.sift.memory.eval.RowFunction;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.AggregateFunction;

import java.util.*;

/**
 * Aggregates its whole input. With keys, emits one row per key (first-seen order) holding the keys
 * then the aggregates; without keys, emits exactly one row, also for an empty input.
 */
public final class AggregateOperator implements Operator {
  /** One aggregate column; {@code field} is null for {@code COUNT()}. */
  public record Call(AggregateFunction function, RowFunction field, SemanticType resultType, String label) {}

  private final Operator child;
  private final List<RowFunction> keys;
  private final List<Call> calls;
  private final Object[] outer;
  private final Runnable checkpoint;
  private Iterator<Map.Entry<List<Object>, Object[]>> groups;
  private Map<List<Object>, Accumulator[]> state;

  public AggregateOperator(Operator child, List<RowFunction> keys, List<Call> calls, Object[] outer, Runnable checkpoint) {
    this.child = child;
    this.keys = List.copyOf(keys);
    this.calls = List.copyOf(calls);
    this.outer = outer;
    this.checkpoint = checkpoint;
  }

  @Override
  public void open() {
    child.open();
    LinkedHashMap<List<Object>, Object[]> keyValues = new LinkedHashMap<>();
    state = new HashMap<>();
    if (keys.isEmpty()) {
      keyValues.put(List.of(), new Object[0]);
      state.put(List.of(), newAccumulators());
    }
    Object[] r;
    while ((r = child.next()) != null) {
      checkpoint.run();
      Object[] kv = new Object[keys.size()];
      List<Object> hashKey = new ArrayList<>(kv.length);
      for (int i = 0; i < kv.length; i++) {
        kv[i] = keys.get(i).apply(r, outer);
        hashKey.add(Values.key(kv[i]));
      }
      keyValues.putIfAbsent(hashKey, kv);
      Accumulator[] acc = state.computeIfAbsent(hashKey, k -> newAccumulators());
      for (int i = 0; i < calls.size(); i++) {
        Call c = calls.get(i);
        acc[i].add(c.field() == null ? null : c.field().apply(r, outer), c.field() == null);
      }
    }
    groups = keyValues.entrySet().iterator();
  }

  private Accumulator[] newAccumulators() {
    Accumulator[] acc = new Accumulator[calls.size()];
    for (int i = 0; i < acc.length; i++) {
      Call c = calls.get(i);
      acc[i] = new Accumulator(c.function(), c.resultType(), c.label());
    }
    return acc;
  }

  @Override
  public Object[] next() {
    if (!groups.hasNext()) return null;
    Map.Entry<List<Object>, Object[]> e = groups.next();
    Object[] kv = e.getValue();
    Accumulator[] acc = state.get(e.getKey());
    Object[] out = Arrays.copyOf(kv, kv.length + acc.length);
    for (int i = 0; i < acc.length; i++) out[kv.length + i] = acc[i].result();
    return out;
  }

  @Override
  public void close() {
    child.close();
    groups = null;
    state = null;
  }
}
