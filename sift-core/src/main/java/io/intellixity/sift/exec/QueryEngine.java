package io.intellixity.sift.exec;

import io.intellixity.sift.exec.handle.EngineHandle;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.query.QueryNode;

import java.util.List;

public interface QueryEngine<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Planner bound to the registry this engine serves. */
  QueryPlanner planner();

  /** Lazily executes the plan; no backend access happens before the first pull. */
  ResultCursor execute(LogicalPlan plan, ExecutionOptions options);

  default ResultCursor execute(LogicalPlan plan) {
    return execute(plan, ExecutionOptions.defaults());
  }

  /** Plans and lazily executes a query tree. */
  default ResultCursor execute(QueryNode query) {
    return execute(query, ExecutionOptions.defaults());
  }

  default ResultCursor execute(QueryNode query, ExecutionOptions options) {
    return execute(planner().plan(query), options);
  }

  /** Materializes every row. The first failure aborts the whole call and no partial list is returned. */
  default List<ResultRow> toList(LogicalPlan plan, ExecutionOptions options) {
    return execute(plan, options).toList();
  }

  default List<ResultRow> toList(LogicalPlan plan) {
    return toList(plan, ExecutionOptions.defaults());
  }

  default List<ResultRow> toList(QueryNode query) {
    return toList(planner().plan(query), ExecutionOptions.defaults());
  }
}
