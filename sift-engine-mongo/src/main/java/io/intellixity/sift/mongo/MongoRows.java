package io.intellixity.sift.mongo;

import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.Coercions;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.plan.RowShape;
import org.bson.BsonBinarySubType;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Reads pipeline output documents into result rows. */
final class MongoRows {
  private MongoRows() {}

  /** Row of {@code shape} read from {@code doc}; group columns use the member shape of that column. */
  static ResultRow read(Map<String, ?> doc, RowShape shape, Map<Integer, RowShape> members) {
    Object[] values = new Object[shape.size()];
    for (int i = 0; i < values.length; i++) {
      Object raw = getByPath(doc, shape.outputName(i));
      RowShape member = members.get(i);
      values[i] = member == null ? toJava(raw, shape.column(i).type()) : rows(raw, member);
    }
    return new ResultRow(shape.outputNames(), values);
  }

  /** Values of {@code doc} in the order of {@code fields}, coerced to their types. */
  static Object[] values(Map<String, ?> doc, List<String> fields, List<SemanticType> types) {
    Object[] out = new Object[fields.size()];
    for (int i = 0; i < out.length; i++) out[i] = toJava(getByPath(doc, fields.get(i)), types.get(i));
    return out;
  }

  static Object toJava(Object raw, SemanticType type) {
    if (raw instanceof Decimal128 d) raw = d.isNaN() || d.isInfinite() ? d.doubleValue() : d.bigDecimalValue();
    else if (raw instanceof ObjectId id) raw = id.toHexString();
    else if (raw instanceof Binary b && b.getType() == BsonBinarySubType.UUID_STANDARD.getValue()) {
      ByteBuffer bb = ByteBuffer.wrap(b.getData());
      raw = new UUID(bb.getLong(), bb.getLong());
    }
    return Coercions.coerce(raw, type);
  }

  private static List<ResultRow> rows(Object raw, RowShape member) {
    if (raw == null) return List.of();
    List<ResultRow> out = new ArrayList<>();
    for (Object o : (List<?>) raw) {
      @SuppressWarnings("unchecked")
      Map<String, ?> m = (Map<String, ?>) o;
      out.add(read(m, member, Map.of()));
    }
    return List.copyOf(out);
  }

  private static Object getByPath(Map<String, ?> root, String path) {
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }
}
