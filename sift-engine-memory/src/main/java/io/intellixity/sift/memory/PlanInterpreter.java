package io.intellixity.sift.memory;

import io.intellixity.sift.memory.eval.ExprCompiler;
import io.intellixity.sift.memory.eval.RowFunction;
import io.intellixity.sift.memory.op.*;
import io.intellixity.sift.plan.*;
import io.intellixity.sift.query.AggregateCall;
import io.intellixity.sift.query.Projection;
import io.intellixity.sift.query.SortField;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a {@link LogicalPlan} into a tree of pull-based {@link Operator}s reading from one session.\n
 *
 * Filter, project, let, page and the probe side of a join stream; order, group, aggregate and the
 * build side of a join buffer their input.\n
 */
public final class PlanInterpreter {
  private final RowSource.Session session;
  private final Runnable checkpoint;

  public PlanInterpreter(RowSource.Session session, Runnable checkpoint) {
    this.session = session;
    this.checkpoint = checkpoint;
  }

  public Operator build(LogicalPlan plan) {
    return build(plan, null, null);
  }

  private Operator build(LogicalPlan plan, RowShape outerShape, Object[] outer) {
    return new Builder(plan, outerShape, outer).build(plan.root());
  }

  private final class Builder implements PlanStepVisitor<Operator> {
    private final LogicalPlan plan;
    private final RowShape outerShape;
    private final Object[] outer;

    Builder(LogicalPlan plan, RowShape outerShape, Object[] outer) {
      this.plan = plan;
      this.outerShape = outerShape;
      this.outer = outer;
    }

    Operator build(PlanStep step) {
      return step.accept(this);
    }

    private Operator input(int id) {
      return build(plan.step(id));
    }

    private ExprCompiler exprs(RowShape shape) {
      return new ExprCompiler(shape, outerShape);
    }

    @Override
    public Operator visit(ScanStep step) {
      return new ScanOperator(session, step.entity(), checkpoint);
    }

    @Override
    public Operator visit(FilterStep step) {
      RowShape in = plan.step(step.input()).shape();
      return new FilterOperator(input(step.input()), exprs(in).predicate(step.predicate()), outer);
    }

    @Override
    public Operator visit(ProjectStep step) {
      RowShape in = plan.step(step.input()).shape();
      return new ProjectOperator(input(step.input()), compileAll(in, step.projections()), outer);
    }

    @Override
    public Operator visit(JoinStep step) {
      RowShape l = plan.step(step.left()).shape();
      RowShape r = plan.step(step.right()).shape();
      int[] lk = new int[step.keys().size()];
      int[] rk = new int[step.keys().size()];
      for (int i = 0; i < lk.length; i++) {
        JoinKey k = step.keys().get(i);
        lk[i] = l.resolve(k.left().qualifier(), k.left().name());
        rk[i] = r.resolve(k.right().qualifier(), k.right().name());
      }
      return new HashJoinOperator(input(step.left()), input(step.right()), lk, rk, checkpoint);
    }

    @Override
    public Operator visit(GroupStep step) {
      RowShape in = plan.step(step.input()).shape();
      return new GroupOperator(input(step.input()), compileAll(in, step.keys()), in.outputNames(), outer, checkpoint);
    }

    @Override
    public Operator visit(OrderStep step) {
      RowShape in = plan.step(step.input()).shape();
      ExprCompiler ec = exprs(in);
      Comparator<Object[]> order = null;
      for (SortField sf : step.keys()) {
        RowFunction key = ec.compile(sf.key());
        Comparator<Object[]> c = (a, b) -> Values.compareNullsFirst(key.apply(a, outer), key.apply(b, outer));
        if (sf.direction() == SortField.Direction.DESC) c = c.reversed();
        order = (order == null) ? c : order.thenComparing(c);
      }
      return new SortOperator(input(step.input()), order, checkpoint);
    }

    @Override
    public Operator visit(AggregateStep step) {
      if (step.grouped()) {
        // fused: aggregate directly over the group step's input
        GroupStep group = (GroupStep) plan.step(step.input());
        RowShape rows = plan.step(group.input()).shape();
        return new AggregateOperator(input(group.input()), compileAll(rows, group.keys()), calls(step, rows), outer, checkpoint);
      }
      RowShape rows = plan.step(step.input()).shape();
      return new AggregateOperator(input(step.input()), List.of(), calls(step, rows), outer, checkpoint);
    }

    private List<AggregateOperator.Call> calls(AggregateStep step, RowShape rows) {
      ExprCompiler ec = exprs(rows);
      List<AggregateOperator.Call> out = new ArrayList<>();
      for (int i = 0; i < step.calls().size(); i++) {
        AggregateCall c = step.calls().get(i);
        RowFunction f = c.field() == null ? null : ec.compile(c.field());
        out.add(new AggregateOperator.Call(c.function(), f, step.callTypes().get(i), c.field() == null ? null : c.field().toString()));
      }
      return out;
    }

    @Override
    public Operator visit(LetStep step) {
      RowShape in = plan.step(step.input()).shape();
      LogicalPlan sub = step.subPlan();
      return new LetOperator(input(step.input()), row -> PlanInterpreter.this.build(sub, in, row));
    }

    @Override
    public Operator visit(PageStep step) {
      return new PageOperator(input(step.input()), step.offset(), step.limit());
    }

    private List<RowFunction> compileAll(RowShape shape, List<Projection> ps) {
      ExprCompiler ec = exprs(shape);
      List<RowFunction> out = new ArrayList<>(ps.size());
      for (Projection p : ps) out.add(ec.compile(p.expr()));
      return out;
    }
  }
}
