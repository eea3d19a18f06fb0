package io.intellixity.sift.spi.exec;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.exec.*;
import io.intellixity.sift.exec.handle.EngineHandle;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.SemanticType;
import io.intellixity.sift.plan.FilterStep;
import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.query.ClientPredicate;
import io.intellixity.sift.query.QueryBuilder;
import io.intellixity.sift.spi.adapter.NativeStatement;
import io.intellixity.sift.spi.adapter.TargetAdapter;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.sift.query.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractQueryEngineTest {
  private static final EntityRegistry REGISTRY = EntityRegistry.builder()
      .register(EntityDescriptor.builder("Movie").key("id")
          .field("id", SemanticType.INT, false)
          .field("title", SemanticType.STRING, false)
          .build())
      .build();

  record TextStatement(String text) implements NativeStatement {}

  /** Renders the plan listing and refuses client predicates. */
  static final class CountingAdapter implements TargetAdapter<TextStatement> {
    int compiles;

    @Override public String id() { return "text"; }

    @Override
    public TextStatement compile(LogicalPlan plan) {
      compiles++;
      if (plan.steps().stream().anyMatch(s -> s instanceof FilterStep f && f.predicate() instanceof ClientPredicate)) {
        throw new UnsupportedPlanOperationException(id(), "client predicate");
      }
      return new TextStatement(plan.explain());
    }
  }

  record Handle(String id) implements EngineHandle<Object> {
    @Override public Object client() { return null; }
    @Override public String namespace() { return null; }
  }

  static final class CapturingEngine extends AbstractQueryEngine<TextStatement, Handle> {
    final List<String> opened = new ArrayList<>();
    int fallbacks;

    CapturingEngine(CountingAdapter adapter) {
      super(adapter, new Handle("test"), new QueryPlanner(REGISTRY));
    }

    @Override
    protected ResultCursor openCursor(TextStatement statement, LogicalPlan plan, ExecutionOptions options) {
      opened.add(statement.text());
      return emptyCursor(options);
    }

    @Override
    protected ResultCursor fallback(LogicalPlan plan, ExecutionOptions options, UnsupportedPlanOperationException cause) {
      if (!options.allowFallback()) return super.fallback(plan, options, cause);
      fallbacks++;
      return emptyCursor(options);
    }

    private static ResultCursor emptyCursor(ExecutionOptions options) {
      return new AbstractResultCursor("empty", options) {
        @Override protected void open() {}
        @Override protected ResultRow fetch() { return null; }
        @Override protected void release() {}
      };
    }
  }

  private final QueryBuilder q = new QueryBuilder(REGISTRY);

  @Test
  void compiledStatementsAreCachedPerPlan() {
    CountingAdapter adapter = new CountingAdapter();
    CapturingEngine engine = new CapturingEngine(adapter);
    LogicalPlan plan = engine.planner().plan(q.filter(q.source("Movie"), eq("title", "Alien")));

    engine.execute(plan).close();
    engine.execute(engine.planner().plan(q.filter(q.source("Movie"), eq("title", "Alien")))).close();

    assertEquals(1, adapter.compiles);
    assertEquals(2, engine.opened.size());
    assertEquals(engine.opened.get(0), engine.opened.get(1));
  }

  @Test
  void declinedPlansGoToFallbackUnlessDisabled() {
    CountingAdapter adapter = new CountingAdapter();
    CapturingEngine engine = new CapturingEngine(adapter);
    LogicalPlan plan = engine.planner().plan(q.filter(q.source("Movie"), client("shortTitle", r -> r.get("title", String.class).length() < 6)));

    assertTrue(engine.toList(plan).isEmpty());
    assertEquals(1, engine.fallbacks);

    ExecutionOptions strict = ExecutionOptions.defaults().withFallback(false);
    UnsupportedPlanOperationException e = assertThrows(UnsupportedPlanOperationException.class, () -> engine.execute(plan, strict));
    assertEquals("text", e.adapterId());
    assertTrue(engine.opened.isEmpty());
  }
}
