package io.intellixity.sift.plan;

import io.intellixity.sift.error.*;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.FieldDef;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers a query tree into a {@link LogicalPlan}.
 * <p>
 * Children are lowered before their parent, so step ids follow post-order and join inputs keep
 * their left/right order. Every field reference is checked against the registry; {@link #plan}
 * reports all defects at once through {@link PlanValidationException} while {@link #check}
 * stops at the first one.
 */
public final class QueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

  private final EntityRegistry registry;

  public QueryPlanner(EntityRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  public EntityRegistry registry() { return registry; }

  public LogicalPlan plan(QueryNode root) {
    Objects.requireNonNull(root, "root");
    ErrorSink.Collecting sink = new ErrorSink.Collecting();
    Lowering lowering = new Lowering(sink, null, "");
    Lowered lowered = lowering.lower(root);
    if (!lowered.ok() && !sink.hasErrors()) {
      sink.report(root.kind(), unlowered(root));
    }
    if (sink.hasErrors()) {
      if (log.isDebugEnabled()) log.debug("sift.plan op=validate errors={}", sink.errors().size());
      throw new PlanValidationException(sink.errors());
    }
    LogicalPlan plan = new LogicalPlan(lowering.steps);
    if (log.isDebugEnabled()) {
      log.debug("sift.plan op=lower steps={} shape={}", plan.steps().size(), plan.shape().outputNames());
    }
    return plan;
  }

  /**
   * Validates the tree and returns the shape of its rows; throws the first defect found.\n
   *
   * Outer references are accepted unchecked here, since a correlated sub-query is built before
   * the {@code let} that binds it. {@link #plan} rejects any that are left unbound.\n
   */
  public RowShape check(QueryNode root) {
    Objects.requireNonNull(root, "root");
    return new Lowering(ErrorSink.failFast(), RowShape.opaque(), "").lower(root).shape();
  }

  // a node that failed without naming a defect must still reject the tree
  private static QueryValidationException unlowered(QueryNode root) {
    return new QueryValidationException(ErrorKind.PLAN_VALIDATION, "Query tree rooted at " + root.kind() + " could not be lowered");
  }

  private record Lowered(int id, RowShape shape) {
    static Lowered failed() { return new Lowered(-1, RowShape.opaque()); }
    boolean ok() { return id >= 0; }
  }

  private final class Lowering implements QueryNodeVisitor<Lowered> {
    private final ErrorSink sink;
    private final RowShape outer;
    private final String prefix;
    private final List<PlanStep> steps = new ArrayList<>();
    private boolean failed;

    Lowering(ErrorSink sink, RowShape outer, String prefix) {
      this.sink = sink;
      this.outer = outer;
      this.prefix = prefix;
    }

    Lowered lower(QueryNode node) {
      return node.accept(this);
    }

    private String label(String kind) {
      return prefix + kind + "#" + steps.size();
    }

    private void report(String step, QueryValidationException e) {
      failed = true;
      sink.report(step, e);
    }

    private ExprTyper typer(RowShape shape, String step) {
      return new ExprTyper(shape, outer, this::report, step);
    }

    private Lowered add(PlanStep step) {
      steps.add(step);
      return new Lowered(step.id(), step.shape());
    }

    @Override
    public Lowered visit(SourceNode node) {
      String step = label("source");
      EntityDescriptor entity;
      try {
        entity = registry.entity(node.entity());
      } catch (QueryValidationException e) {
        report(step, e);
        return Lowered.failed();
      }
      List<Column> cols = new ArrayList<>();
      for (FieldDef f : entity.fields()) cols.add(new Column(node.alias(), f.name(), f.type(), f.nullable()));
      return add(new ScanStep(steps.size(), entity, node.alias(), new RowShape(cols)));
    }

    @Override
    public Lowered visit(FilterNode node) {
      Lowered in = lower(node.input());
      String step = label("filter");
      typer(in.shape(), step).requireBoolean(node.predicate());
      if (!in.ok()) return Lowered.failed();
      return add(new FilterStep(steps.size(), in.id(), node.predicate(), in.shape()));
    }

    @Override
    public Lowered visit(ProjectNode node) {
      Lowered in = lower(node.input());
      String step = label("project");
      List<Column> cols = derivedColumns(node.projections(), in.shape(), step);
      if (!in.ok() || cols == null) return Lowered.failed();
      return add(new ProjectStep(steps.size(), in.id(), node.projections(), new RowShape(cols)));
    }

    @Override
    public Lowered visit(JoinNode node) {
      Lowered left = lower(node.left());
      Lowered right = lower(node.right());
      String step = label("join");
      if (!left.ok() || !right.ok()) return Lowered.failed();

      Set<String> shared = new LinkedHashSet<>(left.shape().qualifiers());
      shared.retainAll(right.shape().qualifiers());
      if (!shared.isEmpty()) {
        report(step, new AmbiguousJoinException("Both join inputs use alias " + shared + "; give one side a distinct alias"));
        return Lowered.failed();
      }

      List<JoinKey> keys = joinKeys(node.condition(), left.shape(), right.shape(), step);
      if (keys == null) return Lowered.failed();

      RowShape shape = left.shape().concat(right.shape());
      if (new HashSet<>(shape.outputNames()).size() != shape.size()) {
        report(step, new AmbiguousJoinException("Join output has duplicate column names: " + shape.outputNames()));
        return Lowered.failed();
      }
      return add(new JoinStep(steps.size(), left.id(), right.id(), keys, shape));
    }

    private List<JoinKey> joinKeys(Expr condition, RowShape left, RowShape right, String step) {
      List<Expr> conjuncts = new ArrayList<>();
      flattenAnd(condition, conjuncts);
      if (conjuncts.isEmpty()) {
        report(step, new AmbiguousJoinException("Join condition has no equality: " + condition));
        return null;
      }
      List<JoinKey> keys = new ArrayList<>();
      boolean ok = true;
      for (Expr e : conjuncts) {
        if (!(e instanceof Comparison c) || c.operator() != Operator.EQ
            || !(c.left() instanceof FieldRef a) || !(c.right() instanceof FieldRef b)) {
          report(step, new AmbiguousJoinException(
              "Join condition must be equalities between a left and a right field, got: " + e));
          ok = false;
          continue;
        }
        JoinKey key = attribute(a, b, left, right, step);
        if (key == null) {
          ok = false;
          continue;
        }
        Column lc = left.column(left.find(key.left().qualifier(), key.left().name()));
        Column rc = right.column(right.find(key.right().qualifier(), key.right().name()));
        if (!lc.type().comparableWith(rc.type())) {
          report(step, new TypeMismatchException("Join keys '" + key.left() + "' (" + lc.type().id()
              + ") and '" + key.right() + "' (" + rc.type().id() + ") are not comparable"));
          ok = false;
          continue;
        }
        keys.add(key);
      }
      return ok ? keys : null;
    }

    private JoinKey attribute(FieldRef a, FieldRef b, RowShape left, RowShape right, String step) {
      int al = left.find(a.qualifier(), a.name()), ar = right.find(a.qualifier(), a.name());
      int bl = left.find(b.qualifier(), b.name()), br = right.find(b.qualifier(), b.name());
      for (FieldRef f : List.of(a, b)) {
        int l = (f == a) ? al : bl, r = (f == a) ? ar : br;
        if (l == RowShape.NOT_FOUND && r == RowShape.NOT_FOUND) {
          report(step, new UnknownFieldException("join", f.path()));
          return null;
        }
      }
      if (al >= 0 && br >= 0 && ar < 0 && bl < 0) return new JoinKey(a, b);
      if (ar >= 0 && bl >= 0 && al < 0 && br < 0) return new JoinKey(b, a);
      report(step, new AmbiguousJoinException(
          "Cannot tell which join input '" + a + "' and '" + b + "' belong to; qualify them with distinct aliases"));
      return null;
    }

    private void flattenAnd(Expr e, List<Expr> out) {
      if (e instanceof LogicalGroup g && g.clause() == Clause.AND) {
        for (Expr child : g.elements()) flattenAnd(child, out);
      } else {
        out.add(e);
      }
    }

    @Override
    public Lowered visit(GroupByNode node) {
      Lowered in = lower(node.input());
      String step = label("groupBy");
      List<Column> cols = derivedColumns(node.keys(), in.shape(), step);
      if (!in.ok() || cols == null) return Lowered.failed();
      cols.add(Column.derived(GroupByNode.GROUP_COLUMN, SemanticType.ROWS, false));
      return add(new GroupStep(steps.size(), in.id(), node.keys(), new RowShape(cols)));
    }

    @Override
    public Lowered visit(OrderByNode node) {
      Lowered in = lower(node.input());
      String step = label("orderBy");
      ExprTyper t = typer(in.shape(), step);
      for (SortField sf : node.keys()) {
        TypedExpr te = t.type(sf.key());
        if (te.type() == SemanticType.ROWS) {
          report(step, new TypeMismatchException("Cannot order by grouped rows: " + sf.key()));
        }
      }
      if (!in.ok()) return Lowered.failed();
      return add(new OrderStep(steps.size(), in.id(), node.keys(), in.shape()));
    }

    @Override
    public Lowered visit(AggregateNode node) {
      Lowered in = lower(node.input());
      String step = label("aggregate");
      if (!in.ok()) {
        checkCalls(node.calls(), RowShape.opaque(), step);
        return Lowered.failed();
      }

      boolean grouped = node.grouped();
      RowShape rowsShape = grouped ? steps.get(steps.get(in.id()).inputs().get(0)).shape() : in.shape();
      List<SemanticType> types = checkCalls(node.calls(), rowsShape, step);
      if (types == null) return Lowered.failed();

      List<Column> cols = new ArrayList<>();
      if (grouped) {
        RowShape gs = in.shape();
        for (int i = 0; i < gs.size() - 1; i++) cols.add(gs.column(i));
      }
      for (int i = 0; i < node.calls().size(); i++) {
        AggregateCall c = node.calls().get(i);
        for (Column existing : cols) {
          if (existing.name().equals(c.alias())) {
            report(step, new TypeMismatchException("Aggregate alias '" + c.alias() + "' clashes with a group key"));
            return Lowered.failed();
          }
        }
        cols.add(Column.derived(c.alias(), types.get(i), false));
      }
      return add(new AggregateStep(steps.size(), in.id(), grouped, node.calls(), types, new RowShape(cols)));
    }

    private List<SemanticType> checkCalls(List<AggregateCall> calls, RowShape rows, String step) {
      ExprTyper t = typer(rows, step);
      List<SemanticType> types = new ArrayList<>();
      boolean ok = true;
      for (AggregateCall c : calls) {
        SemanticType ft = c.field() == null ? null : t.type(c.field()).type();
        if (c.field() != null && ft == null) {
          if (c.field() instanceof Literal l && l.isNull()) {
            report(step, new TypeMismatchException("Cannot infer the type of " + c.function() + " '" + c.alias() + "' from a null literal"));
          }
          ok = false;
          continue;
        }
        if (ft == SemanticType.ROWS) {
          report(step, new TypeMismatchException(c.function() + " cannot aggregate grouped rows: " + c.field()));
          ok = false;
          continue;
        }
        switch (c.function()) {
          case COUNT -> types.add(SemanticType.LONG);
          case MIN, MAX -> types.add(ft);
          case SUM, AVERAGE -> {
            if (!ft.isNumeric()) {
              report(step, new TypeMismatchException(c.function() + " requires a numeric field, '" + c.field() + "' is " + ft.id()));
              ok = false;
            } else if (c.function() == AggregateFunction.AVERAGE) {
              types.add(ft == SemanticType.DECIMAL ? SemanticType.DECIMAL : SemanticType.DOUBLE);
            } else {
              types.add(ft == SemanticType.INT ? SemanticType.LONG : ft);
            }
          }
        }
      }
      return ok ? types : null;
    }

    @Override
    public Lowered visit(LetNode node) {
      Lowered in = lower(node.input());
      String step = label("let");

      Lowering sub = new Lowering(this::report, in.shape(), prefix + "let(" + node.name() + ")/");
      Lowered subRoot = sub.lower(node.subQuery());
      if (!in.ok() || sub.failed || !subRoot.ok()) return Lowered.failed();

      PlanStep root = sub.steps.get(subRoot.id());
      if (!(root instanceof AggregateStep agg) || agg.grouped() || agg.calls().size() != 1) {
        report(step, new TypeMismatchException(
            "let '" + node.name() + "' must end in a single ungrouped aggregate, got " + root.kind()));
        return Lowered.failed();
      }
      if (in.shape().outputNames().contains(node.name())) {
        report(step, new TypeMismatchException("let '" + node.name() + "' clashes with an existing column"));
        return Lowered.failed();
      }
      RowShape shape = in.shape().append(Column.derived(node.name(), agg.callTypes().get(0), false));
      return add(new LetStep(steps.size(), in.id(), node.name(), new LogicalPlan(sub.steps), shape));
    }

    @Override
    public Lowered visit(PageNode node) {
      Lowered in = lower(node.input());
      if (!in.ok()) return Lowered.failed();
      return add(new PageStep(steps.size(), in.id(), node.offset(), node.limit(), in.shape()));
    }

    /** Types named expressions into derived columns; null when any of them failed. */
    private List<Column> derivedColumns(List<Projection> ps, RowShape shape, String step) {
      ExprTyper t = typer(shape, step);
      List<Column> cols = new ArrayList<>();
      boolean ok = true;
      for (Projection p : ps) {
        TypedExpr te = t.type(p.expr());
        if (te.type() == null) {
          if (p.expr() instanceof Literal l && l.isNull()) {
            report(step, new TypeMismatchException("Cannot infer the type of '" + p.name() + "' from a null literal"));
          }
          ok = false;
          continue;
        }
        cols.add(Column.derived(p.name(), te.type(), te.nullable()));
      }
      return ok ? cols : null;
    }
  }
}
