package io.intellixity.relata.query;

import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.exec.TableModel;
import io.intellixity.relata.expression.Column;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Literal;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.Assignment;
import io.intellixity.relata.statement.UpdateStatement;
import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.intellixity.relata.expression.Expressions.*;

public final class UpdateQuery extends AbstractQuery {
  private final TableRef table;
  private final Map<String, LogicalType> columnTypes = new LinkedHashMap<>();
  private final List<Assignment> assignments = new ArrayList<>();
  private Expression where;
  private final List<Expression> returning = new ArrayList<>();

  private UpdateQuery(Dialect dialect, StorageBackend backend, TableRef table) {
    super(dialect, backend);
    this.table = table;
  }

  public static UpdateQuery table(StorageBackend backend, String table) {
    return new UpdateQuery(backend.dialect(), backend, TableRef.of(table));
  }

  public static UpdateQuery table(StorageBackend backend, TableModel model) {
    UpdateQuery q = new UpdateQuery(backend.dialect(), backend, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  public static UpdateQuery table(Dialect dialect, String table) {
    return new UpdateQuery(dialect, null, TableRef.of(table));
  }

  /** {@code column = value}; the value may be an {@link Expression} such as {@code add(col("n"), 1)}. */
  public UpdateQuery set(String column, Object value) {
    checkOpen();
    assignments.add(new Assignment(new Column(null, column, null), literal(column, value)));
    return this;
  }

  public UpdateQuery where(Expression condition) {
    checkOpen();
    Objects.requireNonNull(condition, "condition");
    this.where = (where == null) ? condition : and(where, condition);
    return this;
  }

  public UpdateQuery where(String column, Object value) {
    return where(value == null ? isNull(col(column)) : eq(col(column), literal(column, value)));
  }

  public UpdateQuery returning(String... columns) {
    checkOpen();
    dialect().require(Capability.RETURNING, "RETURNING");
    for (String c : columns) returning.add(col(c));
    return this;
  }

  public UpdateStatement statement() {
    return new UpdateStatement(table, assignments, where, returning);
  }

  public SqlStatement toSql() {
    return dialect().compile(statement());
  }

  public QueryResult execute() {
    SqlStatement sql = toSql();
    return consume().execute(sql, decoding(columnTypes));
  }

  private Expression literal(String column, Object value) {
    if (value instanceof Expression e) return e;
    LogicalType t = columnTypes.get(column);
    if (value == null) return new Literal(null, t != null ? t : LogicalType.TEXT);
    return t != null ? new Literal(value, t) : Literal.of(value);
  }
}
