package io.intellixity.sift.query;

import io.intellixity.sift.exec.ResultRow;
import io.intellixity.sift.model.SemanticType;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/** Static factory for scalar expressions. String arguments name fields ({@code alias.name} or {@code name}). */
public final class Expressions {
  private Expressions() {}

  public static FieldRef field(String path) { return FieldRef.parse(path); }
  public static OuterRef outer(String path) { return OuterRef.parse(path); }
  public static Literal literal(Object value) { return new Literal(value); }

  public static Comparison eq(String field, Object value) { return cmp(field, Operator.EQ, value); }
  public static Comparison ne(String field, Object value) { return cmp(field, Operator.NE, value); }
  public static Comparison gt(String field, Object value) { return cmp(field, Operator.GT, value); }
  public static Comparison ge(String field, Object value) { return cmp(field, Operator.GE, value); }
  public static Comparison lt(String field, Object value) { return cmp(field, Operator.LT, value); }
  public static Comparison le(String field, Object value) { return cmp(field, Operator.LE, value); }
  public static Comparison like(String field, String pattern) { return cmp(field, Operator.LIKE, pattern); }

  public static Comparison in(String field, Collection<?> values) { return cmp(field, Operator.IN, values); }
  public static Comparison nin(String field, Collection<?> values) { return cmp(field, Operator.NIN, values); }

  public static Comparison isNull(String field) { return new Comparison(field(field), Operator.EQ, new Literal(null)); }
  public static Comparison isNotNull(String field) { return new Comparison(field(field), Operator.NE, new Literal(null)); }

  /** Field-to-field comparison (join conditions, correlated filters). */
  public static Comparison compare(Expr left, Operator op, Expr right) { return new Comparison(left, op, right); }

  /** {@code left.field == right.field}. */
  public static Comparison fieldEq(String leftField, String rightField) {
    return new Comparison(field(leftField), Operator.EQ, field(rightField));
  }

  /** Correlation predicate for a let sub-query: {@code innerField == outer.outerField}. */
  public static Comparison correlate(String innerField, String outerField) {
    return new Comparison(field(innerField), Operator.EQ, outer(outerField));
  }

  public static LogicalGroup and(Expr... elements) { return new LogicalGroup(Clause.AND, List.of(elements)); }
  public static LogicalGroup or(Expr... elements) { return new LogicalGroup(Clause.OR, List.of(elements)); }
  public static NotElement not(Expr element) { return new NotElement(element); }

  public static Arithmetic add(Expr l, Expr r) { return new Arithmetic(l, Arithmetic.Op.ADD, r); }
  public static Arithmetic sub(Expr l, Expr r) { return new Arithmetic(l, Arithmetic.Op.SUB, r); }
  public static Arithmetic mul(Expr l, Expr r) { return new Arithmetic(l, Arithmetic.Op.MUL, r); }
  public static Arithmetic div(Expr l, Expr r) { return new Arithmetic(l, Arithmetic.Op.DIV, r); }

  public static ClientPredicate client(String name, Predicate<ResultRow> test) { return new ClientPredicate(name, test); }

  public static ClientFunction client(String name, SemanticType type, Function<ResultRow, Object> fn) {
    return new ClientFunction(name, type, fn);
  }

  private static Comparison cmp(String field, Operator op, Object value) {
    return new Comparison(field(field), op, new Literal(value));
  }
}
