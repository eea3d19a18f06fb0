package io.intellixity.sift.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.util.List;
import java.util.Objects;

/**
 * Validated, backend-neutral plan: steps in post-order, the last one being the root.\n
 *
 * Plans are immutable values; lowering the same tree twice yields equal plans.
 */
public record LogicalPlan(List<PlanStep> steps) {
  private static final ObjectMapper JSON = new ObjectMapper()
      .registerModule(new SimpleModule("sift-plan").addSerializer(LogicalPlan.class, new LogicalPlanJsonSerializer()))
      .enable(SerializationFeature.INDENT_OUTPUT);

  public LogicalPlan {
    steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
    if (steps.isEmpty()) throw new IllegalArgumentException("plan has no steps");
    for (int i = 0; i < steps.size(); i++) {
      PlanStep s = steps.get(i);
      if (s.id() != i) throw new IllegalArgumentException("step " + i + " has id " + s.id());
      for (Integer in : s.inputs()) {
        if (in < 0 || in >= i) throw new IllegalArgumentException("step " + i + " has invalid input " + in);
      }
    }
  }

  public PlanStep root() { return steps.get(steps.size() - 1); }

  public PlanStep step(int id) { return steps.get(id); }

  /** Shape of the rows the plan yields. */
  public RowShape shape() { return root().shape(); }

  /** Canonical JSON form. */
  public String toJson() {
    try {
      return JSON.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize plan", e);
    }
  }

  /** Human readable, one step per line. */
  public String explain() {
    StringBuilder sb = new StringBuilder();
    explain(sb, "");
    return sb.toString();
  }

  private void explain(StringBuilder sb, String indent) {
    for (PlanStep s : steps) {
      sb.append(indent).append('#').append(s.id()).append(' ').append(s.kind());
      if (!s.inputs().isEmpty()) {
        sb.append(" <-");
        for (Integer in : s.inputs()) sb.append(" #").append(in);
      }
      sb.append(' ').append(detail(s)).append(" => ").append(s.shape().outputNames()).append('\n');
      if (s instanceof LetStep l) l.subPlan().explain(sb, indent + "    ");
    }
  }

  private static String detail(PlanStep s) {
    if (s instanceof ScanStep scan) return scan.entity().name() + " as " + scan.alias();
    if (s instanceof FilterStep f) return String.valueOf(f.predicate());
    if (s instanceof ProjectStep p) return projections(p.projections());
    if (s instanceof JoinStep j) return "on " + j.keys();
    if (s instanceof GroupStep g) return "by " + projections(g.keys());
    if (s instanceof OrderStep o) {
      StringBuilder sb = new StringBuilder("by ");
      for (int i = 0; i < o.keys().size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(o.keys().get(i).key()).append(' ').append(o.keys().get(i).direction());
      }
      return sb.toString();
    }
    if (s instanceof AggregateStep a) {
      StringBuilder sb = new StringBuilder(a.grouped() ? "grouped " : "");
      for (int i = 0; i < a.calls().size(); i++) {
        var c = a.calls().get(i);
        if (i > 0) sb.append(", ");
        sb.append(c.function()).append('(').append(c.field() == null ? "*" : c.field()).append(") as ").append(c.alias());
      }
      return sb.toString();
    }
    if (s instanceof LetStep l) return l.name() + " =";
    if (s instanceof PageStep p) return "offset " + p.offset() + " limit " + p.limit();
    return "";
  }

  private static String projections(List<io.intellixity.sift.query.Projection> ps) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < ps.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(ps.get(i).expr()).append(" as ").append(ps.get(i).name());
    }
    return sb.toString();
  }
}
