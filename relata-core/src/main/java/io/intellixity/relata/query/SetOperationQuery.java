package io.intellixity.relata.query;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.RowMapper;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.expression.Aliased;
import io.intellixity.relata.expression.Expressions;
import io.intellixity.relata.expression.OrderTerm;
import io.intellixity.relata.expression.Subquery;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.SelectStatement;
import io.intellixity.relata.statement.SetOperationStatement;
import io.intellixity.relata.statement.SetOperator;
import io.intellixity.relata.statement.Statement;
import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static io.intellixity.relata.expression.Expressions.col;

/**
 * Left-deep chain of UNION / INTERSECT / EXCEPT over queries of one dialect.\n
 *
 * Arity is checked as each operand is added, whenever both sides have explicit select lists. The
 * first operand's column names label the result.
 */
public final class SetOperationQuery extends AbstractQuery implements Queryable {
  private Statement current;
  private final int arity;
  private final List<OrderTerm> orderBy = new ArrayList<>();
  private Long limit;
  private Long offset;

  private SetOperationQuery(StorageBackend backend, Queryable first) {
    super(first.dialect(), backend);
    this.current = first.statement();
    this.arity = arity(current);
  }

  public static SetOperationQuery of(StorageBackend backend, Queryable first) {
    Objects.requireNonNull(backend, "backend");
    if (!backend.dialect().id().equals(first.dialect().id())) {
      throw new QueryConstructionException(backend.dialect().id(), "SET OPERATION",
          "operand built for dialect " + first.dialect().id());
    }
    return new SetOperationQuery(backend, first);
  }

  /** Render-only chain. */
  public static SetOperationQuery of(Queryable first) {
    return new SetOperationQuery(null, Objects.requireNonNull(first, "first"));
  }

  public SetOperationQuery union(Queryable other) { return add(SetOperator.UNION, false, other); }

  public SetOperationQuery unionAll(Queryable other) { return add(SetOperator.UNION, true, other); }

  public SetOperationQuery intersect(Queryable other) {
    dialect().require(Capability.INTERSECT, "INTERSECT");
    return add(SetOperator.INTERSECT, false, other);
  }

  public SetOperationQuery except(Queryable other) {
    dialect().require(Capability.EXCEPT, "EXCEPT");
    return add(SetOperator.EXCEPT, false, other);
  }

  private SetOperationQuery add(SetOperator op, boolean all, Queryable other) {
    checkOpen();
    Objects.requireNonNull(other, "other");
    if (!other.dialect().id().equals(dialect().id())) {
      throw new QueryConstructionException(dialect().id(), op.name(),
          "operand built for dialect " + other.dialect().id());
    }
    Statement right = other.statement();
    int rightArity = arity(right);
    if (arity >= 0 && rightArity >= 0 && arity != rightArity) {
      throw new QueryConstructionException(dialect().id(), op.name(),
          "operand has " + rightArity + " columns, expected " + arity);
    }
    current = new SetOperationStatement(current, op, all, right);
    return this;
  }

  public SetOperationQuery orderBy(String column) { return orderBy(OrderTerm.asc(col(column))); }

  public SetOperationQuery orderByDesc(String column) { return orderBy(OrderTerm.desc(col(column))); }

  public SetOperationQuery orderBy(OrderTerm term) {
    checkOpen();
    orderBy.add(Objects.requireNonNull(term, "term"));
    return this;
  }

  public SetOperationQuery limit(long limit) {
    checkOpen();
    this.limit = limit;
    return this;
  }

  public SetOperationQuery offset(long offset) {
    checkOpen();
    this.offset = offset;
    return this;
  }

  @Override
  public Statement statement() {
    if (!(current instanceof SetOperationStatement so)) {
      throw new QueryConstructionException(dialect().id(), "SET OPERATION", "needs at least two operands");
    }
    if (offset != null && limit == null) dialect().require(Capability.OFFSET_WITHOUT_LIMIT, "OFFSET");
    if (orderBy.isEmpty() && limit == null && offset == null) return so;
    return new SetOperationStatement(so.left(), so.operator(), so.all(), so.right(), orderBy, limit, offset);
  }

  public List<Map<String, Object>> all() {
    SqlStatement sql = toSql();
    return consume().execute(sql, ExecutionOptions.defaults()).rows();
  }

  public <T> List<T> all(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    List<T> out = new ArrayList<>();
    for (Map<String, Object> row : all()) out.add(mapper.map(row));
    return out;
  }

  /** First row, fetching at most one. */
  public Optional<Map<String, Object>> one() {
    SetOperationStatement so = (SetOperationStatement) statement();
    Long one = so.limit() == null ? 1L : Math.min(so.limit(), 1L);
    SetOperationStatement s = new SetOperationStatement(so.left(), so.operator(), so.all(), so.right(),
        so.orderBy(), one, so.offset());
    List<Map<String, Object>> rows = consume().execute(dialect().compile(s), ExecutionOptions.defaults()).rows();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public <T> Optional<T> one(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return one().map(mapper::map);
  }

  /** Rows in the combined result, counted over a derived table. */
  public long count() {
    SelectStatement s = SelectStatement.builder()
        .column(new Aliased(Expressions.count(), ActiveQuery.COUNT_ALIAS))
        .from(new Subquery(statement(), ActiveQuery.COUNT_ALIAS))
        .build();
    return ActiveQuery.toLong(ActiveQuery.scalarOf(consume().execute(dialect().compile(s), ExecutionOptions.defaults())));
  }

  public boolean exists() {
    SelectStatement s = SelectStatement.builder()
        .column(Expressions.lit(1, LogicalType.INTEGER))
        .from(new Subquery(statement(), ActiveQuery.COUNT_ALIAS))
        .limit(1L)
        .build();
    return !consume().execute(dialect().compile(s), ExecutionOptions.defaults()).rows().isEmpty();
  }

  /** Select-list width when statically known, else -1. */
  static int arity(Statement s) {
    if (s instanceof SelectStatement sel) return sel.hasExplicitColumns() ? sel.columns().size() : -1;
    if (s instanceof SetOperationStatement so) return arity(so.left());
    return -1;
  }
}
