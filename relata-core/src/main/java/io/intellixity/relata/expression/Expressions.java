package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.statement.Statement;
import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Static factory DSL for expression trees.\n
 *
 * Comparison helpers accept plain values on the right-hand side and wrap them as {@link Literal}s,
 * so values always end up as bind parameters.
 */
public final class Expressions {
  private Expressions() {}

  // --- references ---

  /** {@code col("age")} or {@code col("u.age")}. */
  public static Column col(String ref) {
    if (ref == null) return new Column(null, null, null);
    int dot = ref.lastIndexOf('.');
    if (dot <= 0) return new Column(null, ref, null);
    if (ref.indexOf('.') != dot) {
      throw new QueryConstructionException(null, "column",
          "column reference '" + ref + "' has more than one qualifier; use col(table, name)");
    }
    return new Column(ref.substring(0, dot), ref.substring(dot + 1), null);
  }

  public static Column col(String table, String name) {
    return new Column(table, name, null);
  }

  public static TableRef table(String name) { return TableRef.of(name); }

  public static CteRef cte(String name) { return new CteRef(name, null); }

  public static Star star() { return new Star(null); }

  public static Star star(String table) { return new Star(table); }

  public static Subquery subquery(Statement statement) { return new Subquery(statement, null); }

  public static Subquery subquery(Statement statement, String alias) { return new Subquery(statement, alias); }

  public static Aliased alias(Expression expression, String alias) { return new Aliased(expression, alias); }

  // --- values ---

  public static Literal lit(Object value) { return Literal.of(value); }

  public static Literal lit(Object value, LogicalType type) { return new Literal(value, type); }

  static Expression operand(Object value) {
    return (value instanceof Expression e) ? e : Literal.of(value);
  }

  // --- predicates ---

  /** {@code left = right}; a null right-hand side yields {@code left IS NULL}. */
  public static Expression eq(Expression left, Object right) {
    if (right == null) return isNull(left);
    return new Comparison(left, ComparisonOperator.EQ, operand(right));
  }

  /** {@code left <> right}; a null right-hand side yields {@code left IS NOT NULL}. */
  public static Expression ne(Expression left, Object right) {
    if (right == null) return isNotNull(left);
    return new Comparison(left, ComparisonOperator.NE, operand(right));
  }

  public static Comparison lt(Expression left, Object right) { return cmp(left, ComparisonOperator.LT, right); }
  public static Comparison le(Expression left, Object right) { return cmp(left, ComparisonOperator.LE, right); }
  public static Comparison gt(Expression left, Object right) { return cmp(left, ComparisonOperator.GT, right); }
  public static Comparison ge(Expression left, Object right) { return cmp(left, ComparisonOperator.GE, right); }
  public static Comparison like(Expression left, Object pattern) { return cmp(left, ComparisonOperator.LIKE, pattern); }
  public static Comparison notLike(Expression left, Object pattern) { return cmp(left, ComparisonOperator.NOT_LIKE, pattern); }

  public static Comparison cmp(Expression left, ComparisonOperator op, Object right) {
    return new Comparison(left, op, operand(right));
  }

  public static IsNull isNull(Expression e) { return new IsNull(e, false); }

  public static IsNull isNotNull(Expression e) { return new IsNull(e, true); }

  public static InList in(Expression e, Collection<?> values) { return new InList(e, operands(values), null, false); }

  public static InList in(Expression e, Subquery subquery) { return new InList(e, null, subquery, false); }

  public static InList notIn(Expression e, Collection<?> values) { return new InList(e, operands(values), null, true); }

  public static InList notIn(Expression e, Subquery subquery) { return new InList(e, null, subquery, true); }

  public static Between between(Expression e, Object low, Object high) {
    return new Between(e, operand(low), operand(high), false);
  }

  public static Between notBetween(Expression e, Object low, Object high) {
    return new Between(e, operand(low), operand(high), true);
  }

  public static Exists exists(Statement statement) { return new Exists(new Subquery(statement, null), false); }

  public static Exists notExists(Statement statement) { return new Exists(new Subquery(statement, null), true); }

  // --- logical ---

  /** AND over the operands; nested AND groups are flattened into one. */
  public static Expression and(Expression... operands) { return and(Arrays.asList(operands)); }

  public static Expression and(List<? extends Expression> operands) {
    return group(LogicalOperator.AND, operands);
  }

  /** OR over the operands; nested OR groups are flattened into one. */
  public static Expression or(Expression... operands) { return or(Arrays.asList(operands)); }

  public static Expression or(List<? extends Expression> operands) {
    return group(LogicalOperator.OR, operands);
  }

  public static Logical not(Expression e) { return new Logical(LogicalOperator.NOT, List.of(e)); }

  private static Expression group(LogicalOperator op, List<? extends Expression> operands) {
    List<Expression> flat = new ArrayList<>();
    for (Expression e : operands) {
      if (e == null) continue;
      if (e instanceof Logical l && l.operator() == op) flat.addAll(l.children());
      else flat.add(e);
    }
    if (flat.size() == 1) return flat.get(0);
    return new Logical(op, flat);
  }

  // --- aggregates / functions ---

  public static Aggregate count() { return new Aggregate(AggregateFunction.COUNT, null, false, null); }
  public static Aggregate count(Expression e) { return new Aggregate(AggregateFunction.COUNT, e, false, null); }
  public static Aggregate countDistinct(Expression e) { return new Aggregate(AggregateFunction.COUNT, e, true, null); }
  public static Aggregate sum(Expression e) { return new Aggregate(AggregateFunction.SUM, e, false, null); }
  public static Aggregate avg(Expression e) { return new Aggregate(AggregateFunction.AVG, e, false, null); }
  public static Aggregate min(Expression e) { return new Aggregate(AggregateFunction.MIN, e, false, null); }
  public static Aggregate max(Expression e) { return new Aggregate(AggregateFunction.MAX, e, false, null); }

  public static FunctionCall fn(String name, Expression... args) { return new FunctionCall(name, List.of(args)); }

  public static Cast cast(Expression e, LogicalType type) { return new Cast(e, type); }

  /** Window over an aggregate or function call; refine with {@link Window#partitionBy} etc. */
  public static Window over(Expression function) { return new Window(function, List.of(), List.of(), null); }

  public static Window window(Expression function, List<Expression> partitionBy, List<OrderTerm> orderBy,
                              WindowFrame frame) {
    return new Window(function, partitionBy, orderBy, frame);
  }

  public static CaseWhen caseWhen(Expression condition, Object result) {
    return new CaseWhen(List.of(new CaseWhen.Branch(condition, operand(result))), null);
  }

  // --- grouping ---

  public static Grouping rollup(Expression... columns) {
    return new Grouping(Grouping.Kind.ROLLUP, List.of(List.of(columns)));
  }

  public static Grouping cube(Expression... columns) {
    return new Grouping(Grouping.Kind.CUBE, List.of(List.of(columns)));
  }

  /** {@code GROUPING SETS ((a, b), (c), ())}; pass {@code List.of()} for the grand total. */
  @SafeVarargs
  public static Grouping groupingSets(List<Expression>... sets) {
    return new Grouping(Grouping.Kind.GROUPING_SETS, List.of(sets));
  }

  /** {@code GROUPING(a, ...)}: 1 bits mark columns rolled up in a super-aggregate row. */
  public static FunctionCall grouping(Expression... columns) { return new FunctionCall("GROUPING", List.of(columns)); }

  /** Value proposed by the conflicting INSERT row; only meaningful inside an upsert's updates. */
  public static Excluded excluded(String column) { return new Excluded(column); }

  // --- arithmetic ---

  public static Arithmetic add(Expression l, Object r) { return arith(l, ArithmeticOperator.ADD, r); }
  public static Arithmetic sub(Expression l, Object r) { return arith(l, ArithmeticOperator.SUBTRACT, r); }
  public static Arithmetic mul(Expression l, Object r) { return arith(l, ArithmeticOperator.MULTIPLY, r); }
  public static Arithmetic div(Expression l, Object r) { return arith(l, ArithmeticOperator.DIVIDE, r); }
  public static Arithmetic mod(Expression l, Object r) { return arith(l, ArithmeticOperator.MODULO, r); }
  public static Arithmetic concat(Expression l, Object r) { return arith(l, ArithmeticOperator.CONCAT, r); }

  private static Arithmetic arith(Expression l, ArithmeticOperator op, Object r) {
    return new Arithmetic(l, op, operand(r));
  }

  // --- ordering ---

  public static OrderTerm asc(Expression e) { return OrderTerm.asc(e); }

  public static OrderTerm desc(Expression e) { return OrderTerm.desc(e); }

  private static List<Expression> operands(Collection<?> values) {
    List<Expression> out = new ArrayList<>();
    if (values != null) for (Object v : values) out.add(operand(v));
    return out;
  }
}
