package io.intellixity.sift.memory;

import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.spi.adapter.TargetAdapter;

/** In-process target: every plan is expressible. */
public final class InMemoryAdapter implements TargetAdapter<InMemoryStatement> {
  public static final String ID = "memory";

  @Override
  public String id() { return ID; }

  @Override
  public InMemoryStatement compile(LogicalPlan plan) {
    return new InMemoryStatement(plan, plan.explain());
  }
}
