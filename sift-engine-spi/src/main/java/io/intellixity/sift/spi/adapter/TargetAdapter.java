package io.intellixity.sift.spi.adapter;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.plan.LogicalPlan;

/**
 * Backend compiler SPI: translates a validated {@link LogicalPlan} into a native statement.\n
 *
 * Implementations are stateless and shared between threads. Compiling the same plan twice
 * yields identical text.\n
 */
public interface TargetAdapter<S extends NativeStatement> {
  String id();

  /**
   * @throws UnsupportedPlanOperationException when the backend cannot express a step of the plan
   */
  S compile(LogicalPlan plan);
}
