package io.intellixity.sift.plan;

import io.intellixity.sift.error.QueryValidationException;
import io.intellixity.sift.error.TypeMismatchException;
import io.intellixity.sift.error.UnknownFieldException;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.query.*;

/**
 * Type-checks a scalar expression against the shape of the rows it is evaluated on.
 * Every failure is reported to the sink; the offending sub-expression types as unknown so
 * one mistake is reported once.
 */
final class ExprTyper implements ExprVisitor<TypedExpr> {
  private final RowShape shape;
  private final RowShape outer;
  private final ErrorSink sink;
  private final String step;

  ExprTyper(RowShape shape, RowShape outer, ErrorSink sink, String step) {
    this.shape = shape;
    this.outer = outer;
    this.sink = sink;
    this.step = step;
  }

  TypedExpr type(Expr e) {
    return e.accept(this);
  }

  /** Type-checks a predicate: it must be boolean. */
  void requireBoolean(Expr e) {
    TypedExpr t = type(e);
    if (t.type() != null && t.type() != SemanticType.BOOLEAN) {
      report(new TypeMismatchException("Predicate '" + e + "' is " + t.type().id() + ", expected bool"));
    }
  }

  @Override
  public TypedExpr visit(FieldRef ref) {
    return column(shape, ref.qualifier(), ref.name());
  }

  @Override
  public TypedExpr visit(OuterRef ref) {
    if (outer == null) {
      report(new UnknownFieldException("outer", ref.asField().path(),
          "Outer reference '" + ref.asField().path() + "' is only valid inside a let sub-query"));
      return TypedExpr.UNKNOWN;
    }
    return column(outer, ref.qualifier(), ref.name());
  }

  @Override
  public TypedExpr visit(Literal literal) {
    return new TypedExpr(literal.type(), literal.isNull());
  }

  @Override
  public TypedExpr visit(Comparison c) {
    TypedExpr l = type(c.left());
    Operator op = c.operator();

    if (op.isList()) {
      if (!(c.right() instanceof Literal lit) || !lit.isList()) {
        report(new TypeMismatchException(op + " expects a list of values: " + c));
        return TypedExpr.BOOLEAN;
      }
      for (Object v : lit.values()) {
        SemanticType vt = SemanticType.ofValue(v);
        if (l.type() != null && vt != null && !l.type().comparableWith(vt)) {
          report(mismatch(c, l.type(), vt));
          break;
        }
      }
      return TypedExpr.BOOLEAN;
    }

    if (c.right() instanceof Literal lit && lit.isList()) {
      report(new TypeMismatchException(op + " does not accept a list of values: " + c));
      return TypedExpr.BOOLEAN;
    }
    TypedExpr r = type(c.right());
    if (op == Operator.LIKE) {
      if (l.type() != null && l.type() != SemanticType.STRING) report(mismatch(c, l.type(), SemanticType.STRING));
      else if (r.type() != null && r.type() != SemanticType.STRING) report(mismatch(c, SemanticType.STRING, r.type()));
      return TypedExpr.BOOLEAN;
    }
    if (l.type() != null && r.type() != null && !l.type().comparableWith(r.type())) {
      report(mismatch(c, l.type(), r.type()));
    } else if (l.type() == SemanticType.ROWS || r.type() == SemanticType.ROWS) {
      report(new TypeMismatchException("Grouped rows cannot be compared: " + c));
    } else if (op.isOrdering() && (isNullLiteral(c.left()) || isNullLiteral(c.right()))) {
      report(new TypeMismatchException("null cannot be ordered: " + c));
    }
    return TypedExpr.BOOLEAN;
  }

  @Override
  public TypedExpr visit(LogicalGroup group) {
    for (Expr e : group.elements()) requireBoolean(e);
    return TypedExpr.BOOLEAN;
  }

  @Override
  public TypedExpr visit(NotElement not) {
    requireBoolean(not.element());
    return TypedExpr.BOOLEAN;
  }

  @Override
  public TypedExpr visit(Arithmetic a) {
    TypedExpr l = type(a.left());
    TypedExpr r = type(a.right());
    boolean ok = true;
    if (l.type() != null && !l.type().isNumeric()) {
      report(new TypeMismatchException("Arithmetic on non-numeric operand '" + a.left() + "' (" + l.type().id() + ")"));
      ok = false;
    }
    if (r.type() != null && !r.type().isNumeric()) {
      report(new TypeMismatchException("Arithmetic on non-numeric operand '" + a.right() + "' (" + r.type().id() + ")"));
      ok = false;
    }
    if (!ok) return TypedExpr.UNKNOWN;
    SemanticType t = SemanticType.widen(l.type(), r.type());
    return new TypedExpr(t, l.nullable() || r.nullable());
  }

  @Override
  public TypedExpr visit(ClientPredicate predicate) {
    return TypedExpr.BOOLEAN;
  }

  @Override
  public TypedExpr visit(ClientFunction function) {
    return new TypedExpr(function.type(), true);
  }

  private TypedExpr column(RowShape s, String qualifier, String name) {
    if (s.isOpaque()) return TypedExpr.UNKNOWN;
    try {
      Column c = s.column(s.resolve(qualifier, name));
      return new TypedExpr(c.type(), c.nullable());
    } catch (QueryValidationException e) {
      report(e);
      return TypedExpr.UNKNOWN;
    }
  }

  private void report(QueryValidationException e) {
    sink.report(step, e);
  }

  private static boolean isNullLiteral(Expr e) {
    return e instanceof Literal l && l.isNull();
  }

  private static TypeMismatchException mismatch(Comparison c, SemanticType l, SemanticType r) {
    return new TypeMismatchException("Cannot compare " + l.id() + " with " + r.id() + " in '" + c + "'");
  }
}
