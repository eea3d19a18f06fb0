package io.intellixity.sift.memory;

import io.intellixity.sift.plan.LogicalPlan;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.query.QueryBuilder;
import io.intellixity.sift.spi.adapter.TargetAdapter;
import io.intellixity.sift.spi.adapter.TargetAdapters;
import org.junit.jupiter.api.Test;

import static io.intellixity.sift.query.Expressions.gt;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryAdapterTest {
  @Test
  void discoveredById() {
    TargetAdapter<?> adapter = TargetAdapters.byId(InMemoryAdapter.ID);
    assertInstanceOf(InMemoryAdapter.class, adapter);
  }

  @Test
  void compilesEveryPlanToItself() {
    QueryBuilder q = new QueryBuilder(Fixtures.REGISTRY);
    LogicalPlan plan = new QueryPlanner(Fixtures.REGISTRY).plan(q.project(q.filter(q.source("Movie"), gt("year", 2000)), "title"));
    InMemoryStatement stmt = new InMemoryAdapter().compile(plan);

    assertSame(plan, stmt.plan());
    assertEquals(plan.explain(), stmt.text());
    assertTrue(stmt.text().contains("filter"));
  }
}
