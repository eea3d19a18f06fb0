package io.intellixity.sift.query;

public interface QueryNodeVisitor<R> {
  R visit(SourceNode node);
  R visit(FilterNode node);
  R visit(ProjectNode node);
  R visit(JoinNode node);
  R visit(GroupByNode node);
  R visit(OrderByNode node);
  R visit(AggregateNode node);
  R visit(LetNode node);
  R visit(PageNode node);
}
