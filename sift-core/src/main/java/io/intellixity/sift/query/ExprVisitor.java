package io.intellixity.sift.query;

public interface ExprVisitor<R> {
  R visit(FieldRef ref);
  R visit(OuterRef ref);
  R visit(Literal literal);
  R visit(Comparison comparison);
  R visit(LogicalGroup group);
  R visit(NotElement not);
  R visit(Arithmetic arithmetic);
  R visit(ClientPredicate predicate);
  R visit(ClientFunction function);
}
