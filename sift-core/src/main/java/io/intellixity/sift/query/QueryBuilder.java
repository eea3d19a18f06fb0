package io.intellixity.sift.query;

import io.intellixity.sift.error.UnknownFieldException;
import io.intellixity.sift.model.Cardinality;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.EntityRegistry;
import io.intellixity.sift.model.RelationDef;
import io.intellixity.sift.plan.QueryPlanner;
import io.intellixity.sift.plan.RowShape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Fluent, validating construction of query trees.
 * <p>
 * Each call returns a new node wrapping its input and fails immediately with the specific
 * validation error (unknown entity, unknown field, type mismatch, ambiguous join). No data is read.
 * <pre>
 * QueryBuilder q = new QueryBuilder(registry);
 * QueryNode movies = q.filter(q.source("Movie"), Expressions.gt("year", 2000));
 * QueryNode titles = q.project(movies, "title");
 * </pre>
 */
public final class QueryBuilder {
  private final EntityRegistry registry;
  private final QueryPlanner planner;

  public QueryBuilder(EntityRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.planner = new QueryPlanner(registry);
  }

  public EntityRegistry registry() { return registry; }

  /** Shape of the rows the node yields. */
  public RowShape shape(QueryNode node) {
    return planner.check(node);
  }

  public QueryNode source(String entity) {
    return source(entity, entity);
  }

  public QueryNode source(String entity, String alias) {
    return checked(new SourceNode(entity, alias));
  }

  public QueryNode filter(QueryNode input, Expr predicate) {
    return checked(new FilterNode(input, predicate));
  }

  public QueryNode project(QueryNode input, Projection... projections) {
    return checked(new ProjectNode(input, Arrays.asList(projections)));
  }

  public QueryNode project(QueryNode input, String... fields) {
    List<Projection> ps = new ArrayList<>(fields.length);
    for (String f : fields) ps.add(Projection.of(f));
    return checked(new ProjectNode(input, ps));
  }

  public QueryNode orderBy(QueryNode input, String field, SortField.Direction direction) {
    return orderBy(input, new SortField(FieldRef.parse(field), direction));
  }

  public QueryNode orderBy(QueryNode input, SortField... keys) {
    return checked(new OrderByNode(input, Arrays.asList(keys)));
  }

  public QueryNode groupBy(QueryNode input, String... keys) {
    List<Projection> ps = new ArrayList<>(keys.length);
    for (String k : keys) ps.add(Projection.of(k));
    return checked(new GroupByNode(input, ps));
  }

  public QueryNode groupBy(QueryNode input, Projection... keys) {
    return checked(new GroupByNode(input, Arrays.asList(keys)));
  }

  public QueryNode join(QueryNode left, QueryNode right, Expr condition) {
    return checked(new JoinNode(left, right, condition));
  }

  /**
   * Joins {@code left} with the target of a declared relation using the relation's foreign key.
   * {@code relationPath} is {@code alias.relation} (or just {@code relation} when the left side has one source);
   * the target is added under {@code targetAlias}.
   */
  public QueryNode joinRelation(QueryNode left, String relationPath, String targetAlias) {
    FieldRef path = FieldRef.parse(relationPath);
    RowShape shape = planner.check(left);
    String alias = path.qualifier();
    if (alias == null) {
      if (shape.qualifiers().size() != 1) {
        throw new UnknownFieldException("join", relationPath, "Relation '" + relationPath + "' must be qualified with one of " + shape.qualifiers());
      }
      alias = shape.qualifiers().iterator().next();
    }
    String owner = ownerEntity(left, alias);
    if (owner == null) throw new UnknownFieldException("join", relationPath, "No source aliased '" + alias + "' in the left input");

    EntityDescriptor entity = registry.entity(owner);
    RelationDef rel = entity.relation(path.name());
    if (rel == null) throw new UnknownFieldException(owner, path.name());

    EntityDescriptor target = registry.entity(rel.targetEntity());
    QueryNode right = checked(new SourceNode(target.name(), targetAlias));
    Expr on;
    if (rel.cardinality() == Cardinality.TO_MANY) {
      on = new Comparison(new FieldRef(alias, entity.keyField()), Operator.EQ, new FieldRef(targetAlias, rel.foreignKey()));
    } else {
      on = new Comparison(new FieldRef(alias, rel.foreignKey()), Operator.EQ, new FieldRef(targetAlias, target.keyField()));
    }
    return checked(new JoinNode(left, right, on));
  }

  public QueryNode aggregate(QueryNode input, AggregateFunction fn, String field) {
    return aggregate(input, AggregateCall.of(fn, field));
  }

  public QueryNode aggregate(QueryNode input, AggregateCall... calls) {
    return checked(new AggregateNode(input, Arrays.asList(calls)));
  }

  public QueryNode count(QueryNode input) {
    return aggregate(input, AggregateCall.count());
  }

  /** Binds the scalar result of {@code subQuery} (correlated through {@link OuterRef}s) as column {@code name}. */
  public QueryNode let_(QueryNode input, String name, QueryNode subQuery) {
    return checked(new LetNode(input, name, subQuery));
  }

  public QueryNode page(QueryNode input, int offset, int limit) {
    return checked(new PageNode(input, offset, limit));
  }

  private QueryNode checked(QueryNode node) {
    planner.check(node);
    return node;
  }

  /** Entity behind a source alias in the tree, or null. */
  private static String ownerEntity(QueryNode node, String alias) {
    if (node instanceof SourceNode s) return s.alias().equals(alias) ? s.entity() : null;
    for (QueryNode child : node.children()) {
      String found = ownerEntity(child, alias);
      if (found != null) return found;
    }
    return null;
  }
}
