package io.intellixity.sift.memory.eval;

import io.intellixity.sift.error.DataException;
import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.memory.Values;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.plan.RowShape;
import io.intellixity.sift.query.*;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiles validated expressions into {@link RowFunction}s.
 * <p>
 * Predicates use three-valued logic: a comparison involving null yields null (unknown), AND / OR / NOT
 * follow SQL truth tables and a filter keeps only rows whose predicate is {@code TRUE}.
 */
public final class ExprCompiler implements ExprVisitor<RowFunction> {
  private final RowShape shape;
  private final RowShape outer;

  public ExprCompiler(RowShape shape, RowShape outer) {
    this.shape = shape;
    this.outer = outer;
  }

  public RowFunction compile(Expr e) {
    return e.accept(this);
  }

  /** Compiles a predicate into a test that is true only for {@code TRUE}. */
  public RowPredicate predicate(Expr e) {
    RowFunction f = compile(e);
    return (row, out) -> Boolean.TRUE.equals(f.apply(row, out));
  }

  @FunctionalInterface
  public interface RowPredicate {
    boolean test(Object[] row, Object[] outer);
  }

  @Override
  public RowFunction visit(FieldRef ref) {
    int i = shape.resolve(ref.qualifier(), ref.name());
    return (row, out) -> row[i];
  }

  @Override
  public RowFunction visit(OuterRef ref) {
    if (outer == null) throw new IllegalStateException("Outer reference outside a let sub-plan: " + ref);
    int i = outer.resolve(ref.qualifier(), ref.name());
    return (row, out) -> out[i];
  }

  @Override
  public RowFunction visit(Literal literal) {
    Object v = literal.value();
    return (row, out) -> v;
  }

  @Override
  public RowFunction visit(Comparison c) {
    RowFunction left = compile(c.left());
    Operator op = c.operator();

    if (c.right() instanceof Literal lit && lit.isNull() && (op == Operator.EQ || op == Operator.NE)) {
      boolean wantNull = op == Operator.EQ;
      return (row, out) -> (left.apply(row, out) == null) == wantNull;
    }
    if (op.isList()) {
      List<Object> values = new ArrayList<>();
      boolean hasNull = false;
      for (Object v : ((Literal) c.right()).values()) {
        if (v == null) hasNull = true;
        else values.add(v);
      }
      boolean listHasNull = hasNull;
      boolean negate = op == Operator.NIN;
      return (row, out) -> {
        Object l = left.apply(row, out);
        if (l == null) return null;
        for (Object v : values) {
          if (Values.compare(l, v) == 0) return !negate;
        }
        return listHasNull ? null : negate;
      };
    }

    RowFunction right = compile(c.right());
    if (op == Operator.LIKE) {
      if (c.right() instanceof Literal lit && lit.value() instanceof String s) {
        Pattern p = Values.likePattern(s);
        return (row, out) -> {
          Object l = left.apply(row, out);
          return l == null ? null : p.matcher((String) l).matches();
        };
      }
      return (row, out) -> {
        Object l = left.apply(row, out), r = right.apply(row, out);
        if (l == null || r == null) return null;
        return Values.likePattern((String) r).matcher((String) l).matches();
      };
    }
    return (row, out) -> {
      Object l = left.apply(row, out), r = right.apply(row, out);
      if (l == null || r == null) return null;
      int cmp = Values.compare(l, r);
      return switch (op) {
        case EQ -> cmp == 0;
        case NE -> cmp != 0;
        case GT -> cmp > 0;
        case GE -> cmp >= 0;
        case LT -> cmp < 0;
        case LE -> cmp <= 0;
        default -> throw new IllegalStateException("Unexpected operator " + op);
      };
    };
  }

  @Override
  public RowFunction visit(LogicalGroup group) {
    List<RowFunction> parts = new ArrayList<>();
    for (Expr e : group.elements()) parts.add(compile(e));
    boolean and = group.clause() == Clause.AND;
    return (row, out) -> {
      boolean unknown = false;
      for (RowFunction f : parts) {
        Object v = f.apply(row, out);
        if (v == null) unknown = true;
        else if ((Boolean) v != and) return !and;
      }
      return unknown ? null : and;
    };
  }

  @Override
  public RowFunction visit(NotElement not) {
    RowFunction f = compile(not.element());
    return (row, out) -> {
      Object v = f.apply(row, out);
      return v == null ? null : !(Boolean) v;
    };
  }

  @Override
  public RowFunction visit(Arithmetic a) {
    RowFunction left = compile(a.left());
    RowFunction right = compile(a.right());
    return (row, out) -> {
      Object l = left.apply(row, out), r = right.apply(row, out);
      if (l == null || r == null) return null;
      return arithmetic(a.op(), (Number) l, (Number) r);
    };
  }

  @Override
  public RowFunction visit(ClientPredicate predicate) {
    List<String> names = shape.outputNames();
    return (row, out) -> predicate.test().test(new ResultRow(names, row));
  }

  @Override
  public RowFunction visit(ClientFunction function) {
    List<String> names = shape.outputNames();
    SemanticType type = function.type();
    return (row, out) -> {
      Object v = function.fn().apply(new ResultRow(names, row));
      if (v != null && SemanticType.ofValue(v) != type && !(type.isNumeric() && v instanceof Number)) {
        throw new IllegalStateException("Client function '" + function.name() + "' returned " + v.getClass().getName()
            + ", declared " + type.id());
      }
      return v;
    };
  }

  /**
   * Integral and decimal arithmetic is exact: overflow and division by zero fail with
   * {@link DataException}. Doubles follow IEEE rules.
   */
  static Number arithmetic(Arithmetic.Op op, Number l, Number r) {
    try {
      return exact(op, l, r);
    } catch (ArithmeticException e) {
      throw new DataException("Cannot evaluate " + l + " " + op + " " + r + ": " + e.getMessage(), e);
    }
  }

  private static Number exact(Arithmetic.Op op, Number l, Number r) {
    if (l instanceof BigDecimal || r instanceof BigDecimal || l instanceof java.math.BigInteger || r instanceof java.math.BigInteger) {
      BigDecimal x = Values.decimal(l), y = Values.decimal(r);
      return switch (op) {
        case ADD -> x.add(y);
        case SUB -> x.subtract(y);
        case MUL -> x.multiply(y);
        case DIV -> x.divide(y, MathContext.DECIMAL128);
      };
    }
    if (Values.isFloating(l) || Values.isFloating(r)) {
      double x = l.doubleValue(), y = r.doubleValue();
      return switch (op) {
        case ADD -> x + y;
        case SUB -> x - y;
        case MUL -> x * y;
        case DIV -> x / y;
      };
    }
    if (l instanceof Long || r instanceof Long) {
      long x = l.longValue(), y = r.longValue();
      return switch (op) {
        case ADD -> Math.addExact(x, y);
        case SUB -> Math.subtractExact(x, y);
        case MUL -> Math.multiplyExact(x, y);
        case DIV -> y == -1 ? Math.negateExact(x) : x / y;
      };
    }
    int x = l.intValue(), y = r.intValue();
    return switch (op) {
      case ADD -> Math.addExact(x, y);
      case SUB -> Math.subtractExact(x, y);
      case MUL -> Math.multiplyExact(x, y);
      case DIV -> y == -1 ? Math.negateExact(x) : x / y;
    };
  }
}
