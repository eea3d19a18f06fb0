package io.intellixity.sift.jdbc.dialect;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.jdbc.Bind;
import io.intellixity.sift.jdbc.SqlParams;
import io.intellixity.sift.jdbc.SqlStatement;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.FieldDef;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.plan.*;
import io.intellixity.sift.query.*;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Lowers a {@link LogicalPlan} into one SELECT:\n
 * - scan, filter, project, join and let steps merge into the current query block while it is plain\n
 * - a step over a grouped, aggregated or paged block wraps it as a derived table first\n
 * - order is carried up to the block that renders it (the root, or a page)\n
 * - a let becomes a correlated scalar subquery\n
 *
 * Client-only expressions, a group without an aggregate, and MIN / MAX / AVERAGE whose emptiness
 * cannot be observed at the root are declined with {@link UnsupportedPlanOperationException}.\n
 * DB-specific dialects override hooks for quoting and paging.\n
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private int aliases;
    private final Map<String, Bind> binds = new LinkedHashMap<>();

    public String add(Bind b) {
      String name = "b" + (n++);
      binds.put(name, b);
      return ":" + name;
    }

    String alias() {
      return "t" + (aliases++);
    }
  }

  /** Pending ORDER BY term; {@code column} is the output column it sorts by, or -1 for an expression. */
  private record OrderKey(String sql, int column, SortField.Direction direction) {}

  /** One SELECT under construction. */
  private static final class Block {
    String from;
    boolean joined;
    List<String> cols;
    final List<String> where = new ArrayList<>();
    List<String> groupBy;
    boolean aggregated;
    List<OrderKey> order = List.of();
    boolean paged;
    int offset;
    int limit;
    List<SqlStatement.Guard> guards = List.of();

    boolean plain() {
      return !aggregated && groupBy == null && !paged;
    }
  }

  @Override
  public final SqlStatement compile(LogicalPlan plan) {
    Objects.requireNonNull(plan, "plan");
    RenderCtx ctx = new RenderCtx();
    Block root = new Lowering(plan, ctx, null, null).block(plan.root());
    String sql = render(root, plan.shape(), true);
    return SqlParams.compile(sql, ctx.binds, root.guards);
  }

  @Override
  public abstract String quoteIdent(String ident);

  /** Appends paging to a rendered SELECT (ORDER BY already applied). */
  protected abstract String applyPage(String sql, int offset, int limit);

  /** Renders one ORDER BY term; nulls sort first ascending and last descending. */
  protected String orderTerm(String expr, SortField.Direction direction) {
    return direction == SortField.Direction.DESC ? expr + " DESC NULLS LAST" : expr + " ASC NULLS FIRST";
  }

  /** SQL type name for casting an averaged value to floating point. */
  protected String doubleType() {
    return "DOUBLE PRECISION";
  }

  protected UnsupportedPlanOperationException unsupported(String message) {
    return new UnsupportedPlanOperationException(id(), message);
  }

  private String render(Block b, RowShape shape, boolean withOrder) {
    List<String> items = new ArrayList<>(b.cols.size());
    for (int i = 0; i < b.cols.size(); i++) {
      items.add(b.cols.get(i) + " AS " + quoteIdent(shape.outputName(i)));
    }
    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", items)).append(" FROM ").append(b.from);
    if (!b.where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", b.where));
    if (b.groupBy != null) sql.append(" GROUP BY ").append(String.join(", ", b.groupBy));
    if ((withOrder || b.paged) && !b.order.isEmpty()) {
      List<String> terms = new ArrayList<>(b.order.size());
      for (OrderKey k : b.order) terms.add(orderTerm(k.sql(), k.direction()));
      sql.append(" ORDER BY ").append(String.join(", ", terms));
    }
    String out = sql.toString();
    return b.paged ? applyPage(out, b.offset, b.limit) : out;
  }

  private final class Lowering implements PlanStepVisitor<Block> {
    private final LogicalPlan plan;
    private final RenderCtx ctx;
    private final RowShape outerShape;
    private final List<String> outerCols;

    Lowering(LogicalPlan plan, RenderCtx ctx, RowShape outerShape, List<String> outerCols) {
      this.plan = plan;
      this.ctx = ctx;
      this.outerShape = outerShape;
      this.outerCols = outerCols;
    }

    Block block(PlanStep step) {
      return step.accept(this);
    }

    private RowShape shapeOf(int id) {
      return plan.step(id).shape();
    }

    /** Input block of a step that extends the current SELECT. */
    private Block plainInput(int id) {
      Block b = block(plan.step(id));
      return b.plain() ? b : wrap(b, shapeOf(id));
    }

    private Block wrap(Block inner, RowShape shape) {
      if (!inner.guards.isEmpty()) {
        throw unsupported("MIN, MAX and AVERAGE can only be the final step of a SQL query");
      }
      String alias = ctx.alias();
      Block b = new Block();
      b.from = "(" + render(inner, shape, false) + ") " + alias;
      b.cols = new ArrayList<>(shape.size());
      for (int i = 0; i < shape.size(); i++) b.cols.add(alias + "." + quoteIdent(shape.outputName(i)));
      List<OrderKey> order = new ArrayList<>(inner.order.size());
      for (OrderKey k : inner.order) {
        if (k.column() < 0) throw unsupported("ordering by an expression that is not an output column of '" + alias + "'");
        order.add(new OrderKey(b.cols.get(k.column()), k.column(), k.direction()));
      }
      b.order = order;
      return b;
    }

    private SqlExpr exprs(RowShape shape, List<String> cols) {
      return new SqlExpr(shape, cols, outerShape, outerCols, ctx);
    }

    @Override
    public Block visit(ScanStep step) {
      EntityDescriptor e = step.entity();
      String alias = ctx.alias();
      Block b = new Block();
      b.from = quoteIdent(e.source()) + " " + alias;
      b.cols = new ArrayList<>(e.fields().size());
      for (FieldDef f : e.fields()) b.cols.add(alias + "." + quoteIdent(f.column()));
      return b;
    }

    @Override
    public Block visit(FilterStep step) {
      Block b = plainInput(step.input());
      b.where.add(exprs(step.shape(), b.cols).render(step.predicate()));
      return b;
    }

    @Override
    public Block visit(ProjectStep step) {
      Block b = plainInput(step.input());
      SqlExpr ex = exprs(shapeOf(step.input()), b.cols);
      List<String> cols = new ArrayList<>(step.projections().size());
      for (Projection p : step.projections()) cols.add(ex.render(p.expr()));

      // the FROM scope is unchanged, so pending order terms stay valid even for dropped columns
      List<OrderKey> order = new ArrayList<>(b.order.size());
      for (OrderKey k : b.order) order.add(new OrderKey(k.sql(), cols.indexOf(k.sql()), k.direction()));
      b.cols = cols;
      b.order = order;
      return b;
    }

    @Override
    public Block visit(JoinStep step) {
      Block l = plainInput(step.left());
      Block r = block(plan.step(step.right()));
      if (!r.plain() || r.joined) r = wrap(r, shapeOf(step.right()));

      RowShape ls = shapeOf(step.left());
      RowShape rs = shapeOf(step.right());
      List<String> on = new ArrayList<>(step.keys().size());
      for (JoinKey k : step.keys()) {
        String lc = l.cols.get(ls.resolve(k.left().qualifier(), k.left().name()));
        String rc = r.cols.get(rs.resolve(k.right().qualifier(), k.right().name()));
        on.add(lc + " = " + rc);
      }

      Block b = new Block();
      b.from = l.from + " INNER JOIN " + r.from + " ON " + String.join(" AND ", on);
      b.joined = true;
      b.cols = new ArrayList<>(l.cols);
      b.cols.addAll(r.cols);
      b.where.addAll(l.where);
      b.where.addAll(r.where);
      // probe order follows the left input
      b.order = l.order;
      return b;
    }

    @Override
    public Block visit(GroupStep step) {
      throw unsupported("a group must be followed by an aggregate in SQL");
    }

    @Override
    public Block visit(OrderStep step) {
      Block b = block(plan.step(step.input()));
      if (b.paged) b = wrap(b, shapeOf(step.input()));
      SqlExpr ex = exprs(step.shape(), b.cols);
      List<OrderKey> order = new ArrayList<>();
      for (SortField sf : step.keys()) {
        String sql = ex.render(sf.key());
        order.add(new OrderKey(sql, b.cols.indexOf(sql), sf.direction()));
      }
      // a stable re-sort keeps the previous order among ties
      order.addAll(b.order);
      b.order = order;
      return b;
    }

    @Override
    public Block visit(AggregateStep step) {
      Block b;
      RowShape rows;
      List<String> keys = List.of();
      if (step.grouped()) {
        GroupStep group = (GroupStep) plan.step(step.input());
        b = plainInput(group.input());
        rows = shapeOf(group.input());
        SqlExpr ex = exprs(rows, b.cols);
        keys = new ArrayList<>(group.keys().size());
        for (Projection p : group.keys()) keys.add(ex.render(p.expr()));
        b.groupBy = keys;
      } else {
        b = plainInput(step.input());
        rows = shapeOf(step.input());
      }

      SqlExpr ex = exprs(rows, b.cols);
      List<String> cols = new ArrayList<>(keys);
      List<SqlStatement.Guard> guards = new ArrayList<>();
      for (int i = 0; i < step.calls().size(); i++) {
        AggregateCall c = step.calls().get(i);
        cols.add(aggregate(c, step.callTypes().get(i), ex));
        if (!c.function().definedOnEmpty()) {
          guards.add(new SqlStatement.Guard(keys.size() + i, c.function().name(), String.valueOf(c.field())));
        }
      }
      b.cols = cols;
      b.aggregated = true;
      b.order = List.of();
      b.guards = guards;
      return b;
    }

    private String aggregate(AggregateCall c, SemanticType type, SqlExpr ex) {
      if (c.field() == null) return "COUNT(*)";
      String f = ex.render(c.field());
      return switch (c.function()) {
        case COUNT -> "COUNT(" + f + ")";
        case MIN -> "MIN(" + f + ")";
        case MAX -> "MAX(" + f + ")";
        case SUM -> "COALESCE(SUM(" + f + "), 0)";
        case AVERAGE -> type == SemanticType.DECIMAL ? "AVG(" + f + ")" : "AVG(CAST(" + f + " AS " + doubleType() + "))";
      };
    }

    @Override
    public Block visit(LetStep step) {
      Block b = plainInput(step.input());
      LogicalPlan sub = step.subPlan();
      Block s = new Lowering(sub, ctx, shapeOf(step.input()), b.cols).block(sub.root());
      if (!s.guards.isEmpty()) {
        throw unsupported("let '" + step.name() + "' uses an aggregate that fails on empty input");
      }
      b.cols.add("(" + render(s, sub.shape(), false) + ")");
      return b;
    }

    @Override
    public Block visit(PageStep step) {
      Block b = block(plan.step(step.input()));
      if (b.paged) b = wrap(b, shapeOf(step.input()));
      b.paged = true;
      b.offset = step.offset();
      b.limit = step.limit();
      return b;
    }
  }

  /** Renders a scalar expression against the columns of the current block. */
  private final class SqlExpr implements ExprVisitor<String> {
    private final RowShape shape;
    private final List<String> cols;
    private final RowShape outerShape;
    private final List<String> outerCols;
    private final RenderCtx ctx;

    SqlExpr(RowShape shape, List<String> cols, RowShape outerShape, List<String> outerCols, RenderCtx ctx) {
      this.shape = shape;
      this.cols = cols;
      this.outerShape = outerShape;
      this.outerCols = outerCols;
      this.ctx = ctx;
    }

    String render(Expr e) {
      return e.accept(this);
    }

    @Override
    public String visit(FieldRef ref) {
      return cols.get(shape.resolve(ref.qualifier(), ref.name()));
    }

    @Override
    public String visit(OuterRef ref) {
      if (outerCols == null) throw unsupported("outer reference " + ref + " outside a let");
      return outerCols.get(outerShape.resolve(ref.qualifier(), ref.name()));
    }

    @Override
    public String visit(Literal literal) {
      if (literal.isNull()) return "NULL";
      return ctx.add(new Bind(literal.value(), literal.type()));
    }

    @Override
    public String visit(Comparison c) {
      String left = render(c.left());
      Operator op = c.operator();

      if (c.right() instanceof Literal lit && lit.isNull() && (op == Operator.EQ || op == Operator.NE)) {
        return "(" + left + (op == Operator.EQ ? " IS NULL)" : " IS NOT NULL)");
      }
      if (op.isList()) {
        Literal list = (Literal) c.right();
        if (list.values().isEmpty()) {
          // unknown for a NULL operand, otherwise false (IN) or true (NOT IN)
          return "(" + left + (op == Operator.IN ? " <> " : " = ") + left + ")";
        }
        SemanticType type = list.type();
        List<String> ph = new ArrayList<>();
        for (Object v : list.values()) ph.add(v == null ? "NULL" : ctx.add(new Bind(v, type)));
        return "(" + left + " " + op.symbol() + " (" + String.join(", ", ph) + "))";
      }
      return "(" + left + " " + op.symbol() + " " + render(c.right()) + ")";
    }

    @Override
    public String visit(LogicalGroup group) {
      List<String> parts = new ArrayList<>(group.elements().size());
      for (Expr e : group.elements()) parts.add(render(e));
      if (parts.size() == 1) return parts.get(0);
      return "(" + String.join(group.clause() == Clause.OR ? " OR " : " AND ", parts) + ")";
    }

    @Override
    public String visit(NotElement not) {
      return "(NOT " + render(not.element()) + ")";
    }

    @Override
    public String visit(Arithmetic a) {
      String op = switch (a.op()) {
        case ADD -> " + ";
        case SUB -> " - ";
        case MUL -> " * ";
        case DIV -> " / ";
      };
      return "(" + render(a.left()) + op + render(a.right()) + ")";
    }

    @Override
    public String visit(ClientPredicate predicate) {
      throw unsupported("client predicate '" + predicate.name() + "' has no SQL form");
    }

    @Override
    public String visit(ClientFunction function) {
      throw unsupported("client function '" + function.name() + "' has no SQL form");
    }
  }
}
