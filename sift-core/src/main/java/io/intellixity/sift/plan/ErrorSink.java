package io.intellixity.sift.plan;

import io.intellixity.sift.error.PlanError;
import io.intellixity.sift.error.QueryValidationException;

import java.util.ArrayList;
import java.util.List;

/** Receives validation failures while a tree is lowered: either rethrows the first or collects all. */
interface ErrorSink {
  void report(String step, QueryValidationException e);

  static ErrorSink failFast() {
    return (step, e) -> { throw e; };
  }

  final class Collecting implements ErrorSink {
    private final List<PlanError> errors = new ArrayList<>();

    @Override
    public void report(String step, QueryValidationException e) {
      errors.add(PlanError.of(step, e));
    }

    boolean hasErrors() { return !errors.isEmpty(); }
    List<PlanError> errors() { return List.copyOf(errors); }
  }
}
