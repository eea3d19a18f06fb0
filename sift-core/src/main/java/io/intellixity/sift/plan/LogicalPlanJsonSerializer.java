package io.intellixity.sift.plan;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.*;

import java.io.IOException;

/** Canonical JSON serializer for {@link LogicalPlan}. */
public final class LogicalPlanJsonSerializer extends JsonSerializer<LogicalPlan> {
  @Override
  public void serialize(LogicalPlan plan, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (plan == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeNumberField("root", plan.root().id());
    g.writeArrayFieldStart("steps");
    for (PlanStep s : plan.steps()) writeStep(s, g, serializers);
    g.writeEndArray();
    g.writeEndObject();
  }

  private void writeStep(PlanStep s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    g.writeNumberField("id", s.id());
    g.writeStringField("kind", s.kind());
    g.writeArrayFieldStart("inputs");
    for (Integer in : s.inputs()) g.writeNumber(in);
    g.writeEndArray();

    if (s instanceof ScanStep scan) {
      g.writeStringField("entity", scan.entity().name());
      g.writeStringField("source", scan.entity().source());
      g.writeStringField("alias", scan.alias());
    } else if (s instanceof FilterStep f) {
      g.writeFieldName("predicate");
      writeExpr(f.predicate(), g);
    } else if (s instanceof ProjectStep p) {
      writeProjections("projections", p.projections(), g);
    } else if (s instanceof JoinStep j) {
      g.writeArrayFieldStart("keys");
      for (JoinKey k : j.keys()) {
        g.writeStartObject();
        g.writeStringField("left", k.left().path());
        g.writeStringField("right", k.right().path());
        g.writeEndObject();
      }
      g.writeEndArray();
    } else if (s instanceof GroupStep gr) {
      writeProjections("keys", gr.keys(), g);
    } else if (s instanceof OrderStep o) {
      g.writeArrayFieldStart("keys");
      for (SortField sf : o.keys()) {
        g.writeStartObject();
        g.writeFieldName("key");
        writeExpr(sf.key(), g);
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    } else if (s instanceof AggregateStep a) {
      g.writeBooleanField("grouped", a.grouped());
      g.writeArrayFieldStart("calls");
      for (AggregateCall c : a.calls()) {
        g.writeStartObject();
        g.writeStringField("fn", c.function().name());
        if (c.field() != null) {
          g.writeFieldName("field");
          writeExpr(c.field(), g);
        }
        g.writeStringField("alias", c.alias());
        g.writeEndObject();
      }
      g.writeEndArray();
    } else if (s instanceof LetStep l) {
      g.writeStringField("name", l.name());
      g.writeFieldName("subPlan");
      serialize(l.subPlan(), g, serializers);
    } else if (s instanceof PageStep pg) {
      g.writeNumberField("offset", pg.offset());
      g.writeNumberField("limit", pg.limit());
    }

    g.writeArrayFieldStart("shape");
    for (int i = 0; i < s.shape().size(); i++) {
      Column c = s.shape().column(i);
      g.writeStartObject();
      g.writeStringField("name", s.shape().outputName(i));
      g.writeStringField("type", c.type().id());
      g.writeBooleanField("nullable", c.nullable());
      g.writeEndObject();
    }
    g.writeEndArray();
    g.writeEndObject();
  }

  private static void writeProjections(String field, java.util.List<Projection> ps, JsonGenerator g) throws IOException {
    g.writeArrayFieldStart(field);
    for (Projection p : ps) {
      g.writeStartObject();
      g.writeStringField("name", p.name());
      g.writeFieldName("expr");
      writeExpr(p.expr(), g);
      g.writeEndObject();
    }
    g.writeEndArray();
  }

  private static void writeExpr(Expr e, JsonGenerator g) throws IOException {
    if (e instanceof FieldRef f) {
      g.writeStartObject();
      g.writeStringField("field", f.path());
      g.writeEndObject();
      return;
    }
    if (e instanceof OuterRef o) {
      g.writeStartObject();
      g.writeStringField("outer", o.asField().path());
      g.writeEndObject();
      return;
    }
    if (e instanceof Literal l) {
      g.writeStartObject();
      SemanticType t = l.type();
      if (t != null) g.writeStringField("type", t.id());
      if (l.isList()) {
        g.writeArrayFieldStart("values");
        for (Object v : l.values()) writeScalar(v, g);
        g.writeEndArray();
      } else {
        g.writeFieldName("value");
        writeScalar(l.value(), g);
      }
      g.writeEndObject();
      return;
    }
    if (e instanceof Comparison c) {
      g.writeStartObject();
      g.writeStringField("op", c.operator().name());
      g.writeFieldName("left");
      writeExpr(c.left(), g);
      g.writeFieldName("right");
      writeExpr(c.right(), g);
      g.writeEndObject();
      return;
    }
    if (e instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeArrayFieldStart(lg.clause() == Clause.OR ? "or" : "and");
      for (Expr child : lg.elements()) writeExpr(child, g);
      g.writeEndArray();
      g.writeEndObject();
      return;
    }
    if (e instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeExpr(n.element(), g);
      g.writeEndObject();
      return;
    }
    if (e instanceof Arithmetic a) {
      g.writeStartObject();
      g.writeStringField("arith", a.op().name());
      g.writeFieldName("left");
      writeExpr(a.left(), g);
      g.writeFieldName("right");
      writeExpr(a.right(), g);
      g.writeEndObject();
      return;
    }
    if (e instanceof ClientPredicate p) {
      g.writeStartObject();
      g.writeStringField("clientPredicate", p.name());
      g.writeEndObject();
      return;
    }
    if (e instanceof ClientFunction f) {
      g.writeStartObject();
      g.writeStringField("clientFunction", f.name());
      g.writeStringField("type", f.type().id());
      g.writeEndObject();
      return;
    }
    throw new IllegalArgumentException("Unsupported expression: " + e.getClass().getName());
  }

  private static void writeScalar(Object v, JsonGenerator g) throws IOException {
    if (v == null) g.writeNull();
    else if (v instanceof Boolean b) g.writeBoolean(b);
    else if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) g.writeNumber(((Number) v).longValue());
    else if (v instanceof java.math.BigDecimal d) g.writeNumber(d);
    else if (v instanceof java.math.BigInteger bi) g.writeNumber(bi);
    else if (v instanceof Double || v instanceof Float) g.writeNumber(((Number) v).doubleValue());
    else g.writeString(String.valueOf(v));
  }
}
