package io.intellixity.sift.memory;

import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.spi.adapter.NativeStatement;

import java.util.Objects;

/** The plan itself; its text is the plan listing. */
public record InMemoryStatement(LogicalPlan plan, String text) implements NativeStatement {
  public InMemoryStatement {
    Objects.requireNonNull(plan, "plan");
    Objects.requireNonNull(text, "text");
  }
}
