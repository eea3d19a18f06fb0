package io.intellixity.sift.mongo;

import io.intellixity.sift.error.UnsupportedPlanOperationException;
import io.intellixity.sift.memory.Values;
import io.intellixity.sift.model.EntityDescriptor;
import io.intellixity.sift.model.FieldDef;
import io.intellixity.sift.plan.*;
import io.intellixity.sift.query.*;
import io.intellixity.sift.spi.adapter.TargetAdapter;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Mongo dialect: lowers a {@link LogicalPlan} into one aggregation pipeline.\n
 *
 * Every row travels as a document whose field paths are the output names of the current shape
 * ({@code m.title} after a join is the embedded path {@code m -> title}). The scan stage copies the
 * storage fields under those names and turns missing fields into explicit nulls.\n
 *
 * Filters render to query operators with NOT pushed down (De Morgan), keeping SQL three-valued
 * logic: a comparison against null never matches, negated or not. Joins become {@code $lookup}
 * with a correlated sub-pipeline plus {@code $unwind}.\n
 *
 * Declined with {@link UnsupportedPlanOperationException}: let, client-only expressions, ordering
 * by an expression, a join whose right input aggregates, and an aggregate that is not the last step
 * while it is ungrouped or uses MIN / MAX / AVERAGE.\n
 */
public final class MongoDialect implements TargetAdapter<MongoStatement> {
  public static final String ID = "mongo";

  private static final String RIGHT = "__right";
  private static final Document NEVER = new Document("$expr", false);

  @Override public String id() { return ID; }

  @Override
  public MongoStatement compile(LogicalPlan plan) {
    Objects.requireNonNull(plan, "plan");
    Pipeline p = new Lowering(plan).pipeline(plan.root());
    Map<Integer, RowShape> members = new LinkedHashMap<>();
    for (int i = 0; i < p.members.size(); i++) {
      if (p.members.get(i) != null) members.put(i, p.members.get(i));
    }
    return new MongoStatement(p.collection, p.stages, p.guards, p.emptyRow, members);
  }

  private UnsupportedPlanOperationException unsupported(String message) {
    return new UnsupportedPlanOperationException(ID, message);
  }

  private record SortKey(String path, int direction) {}

  /** Pipeline under construction. */
  private static final class Pipeline {
    String collection;
    final List<Document> stages = new ArrayList<>();
    List<SortKey> order = List.of();
    // member shape per output column, null for non-group columns
    List<RowShape> members;
    List<MongoStatement.Guard> guards = List.of();
    List<Object> emptyRow;
  }

  private static String path(RowShape shape, FieldRef ref) {
    return shape.outputName(shape.resolve(ref.qualifier(), ref.name()));
  }

  private static List<RowShape> noMembers(int size) {
    return new ArrayList<>(Collections.nCopies(size, (RowShape) null));
  }

  private final class Lowering implements PlanStepVisitor<Pipeline> {
    private final LogicalPlan plan;

    Lowering(LogicalPlan plan) {
      this.plan = plan;
    }

    Pipeline pipeline(PlanStep step) {
      Pipeline p = step.accept(this);
      if (step.id() != plan.root().id() && !p.guards.isEmpty()) {
        throw unsupported("MIN, MAX and AVERAGE can only be the final step of a Mongo pipeline");
      }
      return p;
    }

    private RowShape shapeOf(int id) {
      return plan.step(id).shape();
    }

    private boolean isRoot(PlanStep step) {
      return step.id() == plan.root().id();
    }

    @Override
    public Pipeline visit(ScanStep step) {
      EntityDescriptor e = step.entity();
      Document fields = new Document("_id", 0);
      for (int i = 0; i < e.fields().size(); i++) {
        FieldDef f = e.fields().get(i);
        fields.append(step.shape().outputName(i), new Document("$ifNull", Arrays.asList("$" + f.column(), null)));
      }
      Pipeline p = new Pipeline();
      p.collection = e.source();
      p.stages.add(new Document("$project", fields));
      p.members = noMembers(e.fields().size());
      return p;
    }

    @Override
    public Pipeline visit(FilterStep step) {
      Pipeline p = pipeline(plan.step(step.input()));
      p.stages.add(new Document("$match", new Filter(shapeOf(step.input())).render(step.predicate(), false)));
      return p;
    }

    @Override
    public Pipeline visit(ProjectStep step) {
      Pipeline p = pipeline(plan.step(step.input()));
      RowShape in = shapeOf(step.input());
      Exprs exprs = new Exprs(in);
      Document fields = new Document("_id", 0);
      List<RowShape> members = new ArrayList<>(step.projections().size());
      Map<String, String> renamed = new HashMap<>();
      for (int i = 0; i < step.projections().size(); i++) {
        Projection proj = step.projections().get(i);
        String name = step.shape().outputName(i);
        fields.append(name, exprs.render(proj.expr()));
        if (proj.expr() instanceof FieldRef ref) {
          int col = in.resolve(ref.qualifier(), ref.name());
          members.add(p.members.get(col));
          renamed.putIfAbsent(in.outputName(col), name);
        } else {
          members.add(null);
        }
      }
      p.stages.add(new Document("$project", fields));
      p.members = members;
      p.order = remap(p.order, renamed);
      return p;
    }

    @Override
    public Pipeline visit(JoinStep step) {
      Pipeline left = pipeline(plan.step(step.left()));
      Pipeline right = pipeline(plan.step(step.right()));
      if (right.emptyRow != null || !right.guards.isEmpty()) {
        throw unsupported("the right input of a join cannot end in an aggregate");
      }
      RowShape ls = shapeOf(step.left());
      RowShape rs = shapeOf(step.right());

      Document let = new Document();
      List<Object> conditions = new ArrayList<>();
      for (int i = 0; i < step.keys().size(); i++) {
        JoinKey k = step.keys().get(i);
        String var = "k" + i;
        let.append(var, "$" + path(ls, k.left()));
        conditions.add(new Document("$eq", Arrays.asList("$" + path(rs, k.right()), "$$" + var)));
        conditions.add(new Document("$ne", Arrays.asList("$$" + var, null)));
      }
      List<Document> sub = new ArrayList<>(right.stages);
      sub.add(new Document("$match", new Document("$expr", new Document("$and", conditions))));

      left.stages.add(new Document("$lookup", new Document("from", right.collection)
          .append("let", let)
          .append("pipeline", sub)
          .append("as", RIGHT)));
      left.stages.add(new Document("$unwind", "$" + RIGHT));

      RowShape out = step.shape();
      Document fields = new Document("_id", 0);
      Map<String, String> renamed = new HashMap<>();
      for (int i = 0; i < ls.size(); i++) {
        fields.append(out.outputName(i), "$" + ls.outputName(i));
        renamed.put(ls.outputName(i), out.outputName(i));
      }
      for (int i = 0; i < rs.size(); i++) {
        fields.append(out.outputName(ls.size() + i), "$" + RIGHT + "." + rs.outputName(i));
      }
      left.stages.add(new Document("$project", fields));

      List<RowShape> members = new ArrayList<>(left.members);
      members.addAll(right.members);
      left.members = members;
      // probe order follows the left input
      left.order = remap(left.order, renamed);
      return left;
    }

    @Override
    public Pipeline visit(GroupStep step) {
      Pipeline p = pipeline(plan.step(step.input()));
      for (RowShape m : p.members) {
        if (m != null) throw unsupported("grouping rows that already carry groups");
      }
      RowShape in = shapeOf(step.input());
      Document group = new Document("_id", keys(step, in)).append("group", new Document("$push", "$$ROOT"));
      p.stages.add(new Document("$group", group));

      Document fields = new Document("_id", 0);
      List<RowShape> members = noMembers(step.shape().size());
      for (int i = 0; i < step.keys().size(); i++) fields.append(step.shape().outputName(i), "$_id.k" + i);
      int last = step.keys().size();
      fields.append(step.shape().outputName(last), "$group");
      members.set(last, in);
      p.stages.add(new Document("$project", fields));
      p.members = members;
      p.order = List.of();
      return p;
    }

    private Document keys(GroupStep step, RowShape in) {
      Exprs exprs = new Exprs(in);
      Document ids = new Document();
      for (int i = 0; i < step.keys().size(); i++) ids.append("k" + i, exprs.render(step.keys().get(i).expr()));
      return ids;
    }

    @Override
    public Pipeline visit(OrderStep step) {
      Pipeline p = pipeline(plan.step(step.input()));
      RowShape in = shapeOf(step.input());
      List<SortKey> order = new ArrayList<>();
      Set<String> seen = new HashSet<>();
      for (SortField sf : step.keys()) {
        if (!(sf.key() instanceof FieldRef ref)) {
          throw unsupported("ordering by an expression; project it to a column first");
        }
        String path = path(in, ref);
        if (seen.add(path)) order.add(new SortKey(path, sf.direction() == SortField.Direction.DESC ? -1 : 1));
      }
      // earlier keys break ties, which keeps a re-sort stable
      for (SortKey k : p.order) {
        if (seen.add(k.path())) order.add(k);
      }
      Document sort = new Document();
      for (SortKey k : order) sort.append(k.path(), k.direction());
      p.stages.add(new Document("$sort", sort));
      p.order = order;
      return p;
    }

    @Override
    public Pipeline visit(AggregateStep step) {
      Pipeline p;
      RowShape rows;
      Object ids;
      int keyCount = 0;
      if (step.grouped()) {
        GroupStep group = (GroupStep) plan.step(step.input());
        p = pipeline(plan.step(group.input()));
        rows = shapeOf(group.input());
        ids = keys(group, rows);
        keyCount = group.keys().size();
      } else {
        if (!isRoot(step)) throw unsupported("an ungrouped aggregate must be the last step of a Mongo pipeline");
        p = pipeline(plan.step(step.input()));
        rows = shapeOf(step.input());
        ids = null;
      }

      Exprs exprs = new Exprs(rows);
      Document group = new Document("_id", ids);
      List<MongoStatement.Guard> guards = new ArrayList<>();
      for (int i = 0; i < step.calls().size(); i++) {
        AggregateCall c = step.calls().get(i);
        group.append("a" + i, accumulator(c, exprs));
        if (!c.function().definedOnEmpty()) {
          guards.add(new MongoStatement.Guard(keyCount + i, c.function().name(), String.valueOf(c.field())));
        }
      }
      p.stages.add(new Document("$group", group));

      Document fields = new Document("_id", 0);
      for (int i = 0; i < keyCount; i++) fields.append(step.shape().outputName(i), "$_id.k" + i);
      for (int i = 0; i < step.calls().size(); i++) fields.append(step.shape().outputName(keyCount + i), "$a" + i);
      p.stages.add(new Document("$project", fields));

      if (!step.grouped()) {
        List<Object> empty = new ArrayList<>(step.calls().size());
        for (AggregateCall c : step.calls()) empty.add(c.function().definedOnEmpty() ? 0L : null);
        p.emptyRow = empty;
      }
      p.members = noMembers(step.shape().size());
      p.order = List.of();
      p.guards = guards;
      return p;
    }

    private Document accumulator(AggregateCall c, Exprs exprs) {
      if (c.field() == null) return new Document("$sum", 1);
      Object f = exprs.render(c.field());
      return switch (c.function()) {
        case COUNT -> new Document("$sum", new Document("$cond", Arrays.asList(new Document("$ne", Arrays.asList(f, null)), 1, 0)));
        case SUM -> new Document("$sum", f);
        case MIN -> new Document("$min", f);
        case MAX -> new Document("$max", f);
        case AVERAGE -> new Document("$avg", f);
      };
    }

    @Override
    public Pipeline visit(LetStep step) {
      throw unsupported("let '" + step.name() + "' needs a correlated sub-query");
    }

    @Override
    public Pipeline visit(PageStep step) {
      Pipeline p = pipeline(plan.step(step.input()));
      if (step.offset() > 0) p.stages.add(new Document("$skip", step.offset()));
      // $limit must be positive
      p.stages.add(step.limit() > 0 ? new Document("$limit", step.limit()) : new Document("$match", NEVER));
      return p;
    }
  }

  private static List<SortKey> remap(List<SortKey> order, Map<String, String> renamed) {
    List<SortKey> out = new ArrayList<>(order.size());
    for (SortKey k : order) {
      String to = renamed.get(k.path());
      if (to != null) out.add(new SortKey(to, k.direction()));
    }
    return out;
  }

  /** Aggregation-expression rendering of scalar expressions. */
  private final class Exprs implements ExprVisitor<Object> {
    private final RowShape shape;

    Exprs(RowShape shape) {
      this.shape = shape;
    }

    Object render(Expr e) {
      return e.accept(this);
    }

    @Override
    public Object visit(FieldRef ref) {
      return "$" + path(shape, ref);
    }

    @Override
    public Object visit(OuterRef ref) {
      throw unsupported("outer reference " + ref + " outside a let");
    }

    @Override
    public Object visit(Literal literal) {
      return new Document("$literal", literal.value());
    }

    @Override
    public Object visit(Arithmetic a) {
      String op = switch (a.op()) {
        case ADD -> "$add";
        case SUB -> "$subtract";
        case MUL -> "$multiply";
        case DIV -> "$divide";
      };
      return new Document(op, Arrays.asList(render(a.left()), render(a.right())));
    }

    @Override
    public Object visit(Comparison c) {
      throw unsupported("comparison " + c + " as a value");
    }

    @Override
    public Object visit(LogicalGroup group) {
      throw unsupported("logical group as a value");
    }

    @Override
    public Object visit(NotElement not) {
      throw unsupported("NOT as a value");
    }

    @Override
    public Object visit(ClientPredicate predicate) {
      throw unsupported("client predicate '" + predicate.name() + "' has no Mongo form");
    }

    @Override
    public Object visit(ClientFunction function) {
      throw unsupported("client function '" + function.name() + "' has no Mongo form");
    }
  }

  /** Query-operator rendering of predicates; {@code negate} carries a pushed-down NOT. */
  private final class Filter {
    private final RowShape shape;
    private final Exprs exprs;

    Filter(RowShape shape) {
      this.shape = shape;
      this.exprs = new Exprs(shape);
    }

    Document render(Expr e, boolean negate) {
      if (e instanceof NotElement n) return render(n.element(), !negate);
      if (e instanceof LogicalGroup g) return group(g, negate);
      if (e instanceof Comparison c) return comparison(c, negate);
      if (e instanceof FieldRef ref) return new Document(path(shape, ref), !negate);
      if (e instanceof ClientPredicate p) throw unsupported("client predicate '" + p.name() + "' has no Mongo form");
      throw unsupported("predicate " + e + " has no Mongo form");
    }

    private Document group(LogicalGroup g, boolean negate) {
      boolean or = (g.clause() == Clause.OR) ^ negate;
      List<Document> parts = new ArrayList<>(g.elements().size());
      for (Expr child : g.elements()) parts.add(render(child, negate));
      if (parts.isEmpty()) return or ? NEVER : new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document(or ? "$or" : "$and", parts);
    }

    private Document comparison(Comparison c, boolean negate) {
      Operator op = c.operator();
      if (c.left() instanceof FieldRef ref && c.right() instanceof Literal lit) {
        return fieldLiteral(path(shape, ref), op, lit, negate);
      }
      if (c.left() instanceof Literal lit && c.right() instanceof FieldRef ref && op != Operator.LIKE && !op.isList()) {
        return fieldLiteral(path(shape, ref), flip(op), lit, negate);
      }
      return expression(c, negate);
    }

    private Document fieldLiteral(String path, Operator op, Literal lit, boolean negate) {
      if (lit.isNull()) {
        if (op == Operator.EQ) return negate ? new Document(path, new Document("$ne", null)) : new Document(path, null);
        if (op == Operator.NE) return negate ? new Document(path, null) : new Document(path, new Document("$ne", null));
        return NEVER;
      }
      Object v = lit.value();
      return switch (op) {
        case EQ -> negate ? notEqual(path, v) : new Document(path, v);
        case NE -> negate ? new Document(path, v) : notEqual(path, v);
        case GT, GE, LT, LE -> new Document(path, new Document(mongoOp(negate ? negated(op) : op), v));
        case LIKE -> {
          Pattern p = Values.likePattern(String.valueOf(v));
          Pattern anchored = Pattern.compile("\\A(?:" + p.pattern() + ")\\z", p.flags());
          yield negate
              ? new Document(path, new Document("$not", anchored).append("$ne", null))
              : new Document(path, anchored);
        }
        case IN -> negate ? notIn(path, lit.values()) : in(path, lit.values());
        case NIN -> negate ? in(path, lit.values()) : notIn(path, lit.values());
      };
    }

    private Document notEqual(String path, Object v) {
      return new Document(path, new Document("$nin", Arrays.asList(v, null)));
    }

    // x IN (...) is unknown for a null x and ignores null elements
    private Document in(String path, List<Object> list) {
      List<Object> present = new ArrayList<>(list.size());
      for (Object o : list) if (o != null) present.add(o);
      return present.isEmpty() ? NEVER : new Document(path, new Document("$in", present));
    }

    // x NOT IN (...) is never true once the list holds a null
    private Document notIn(String path, List<Object> list) {
      if (list.contains(null)) return NEVER;
      List<Object> excluded = new ArrayList<>(list);
      excluded.add(null);
      return new Document(path, new Document("$nin", excluded));
    }

    private Document expression(Comparison c, boolean negate) {
      Operator op = c.operator();
      if (op == Operator.LIKE || op.isList()) throw unsupported(op + " needs a field on the left and a constant on the right");
      if (isNullLiteral(c.left()) || isNullLiteral(c.right())) return NEVER;
      Object l = exprs.render(c.left());
      Object r = exprs.render(c.right());
      List<Object> all = new ArrayList<>();
      if (!(c.left() instanceof Literal)) all.add(new Document("$ne", Arrays.asList(l, null)));
      if (!(c.right() instanceof Literal)) all.add(new Document("$ne", Arrays.asList(r, null)));
      all.add(new Document(mongoOp(negate ? negated(op) : op), Arrays.asList(l, r)));
      return new Document("$expr", new Document("$and", all));
    }
  }

  private static boolean isNullLiteral(Expr e) {
    return e instanceof Literal lit && lit.isNull();
  }

  private static Operator flip(Operator op) {
    return switch (op) {
      case GT -> Operator.LT;
      case GE -> Operator.LE;
      case LT -> Operator.GT;
      case LE -> Operator.GE;
      default -> op;
    };
  }

  private static Operator negated(Operator op) {
    return switch (op) {
      case EQ -> Operator.NE;
      case NE -> Operator.EQ;
      case GT -> Operator.LE;
      case GE -> Operator.LT;
      case LT -> Operator.GE;
      case LE -> Operator.GT;
      default -> throw new IllegalArgumentException("Cannot negate " + op);
    };
  }

  private static String mongoOp(Operator op) {
    return switch (op) {
      case EQ -> "$eq";
      case NE -> "$ne";
      case GT -> "$gt";
      case GE -> "$gte";
      case LT -> "$lt";
      case LE -> "$lte";
      default -> throw new IllegalArgumentException("No comparison operator for " + op);
    };
  }
}
