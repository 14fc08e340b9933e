package io.intellixity.relata.query;

import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.exec.TableModel;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Literal;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.DeleteStatement;
import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.intellixity.relata.expression.Expressions.*;

public final class DeleteQuery extends AbstractQuery {
  private final TableRef table;
  private final Map<String, LogicalType> columnTypes = new LinkedHashMap<>();
  private Expression where;
  private final List<Expression> returning = new ArrayList<>();

  private DeleteQuery(Dialect dialect, StorageBackend backend, TableRef table) {
    super(dialect, backend);
    this.table = table;
  }

  public static DeleteQuery from(StorageBackend backend, String table) {
    return new DeleteQuery(backend.dialect(), backend, TableRef.of(table));
  }

  public static DeleteQuery from(StorageBackend backend, TableModel model) {
    DeleteQuery q = new DeleteQuery(backend.dialect(), backend, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  public static DeleteQuery from(Dialect dialect, String table) {
    return new DeleteQuery(dialect, null, TableRef.of(table));
  }

  public DeleteQuery where(Expression condition) {
    checkOpen();
    Objects.requireNonNull(condition, "condition");
    this.where = (where == null) ? condition : and(where, condition);
    return this;
  }

  public DeleteQuery where(String column, Object value) {
    LogicalType t = columnTypes.get(column);
    Object v = (value == null || value instanceof Expression || t == null) ? value : new Literal(value, t);
    return where(eq(col(column), v));
  }

  public DeleteQuery returning(String... columns) {
    checkOpen();
    dialect().require(Capability.RETURNING, "RETURNING");
    for (String c : columns) returning.add(col(c));
    return this;
  }

  public DeleteStatement statement() {
    return new DeleteStatement(table, where, returning);
  }

  public SqlStatement toSql() {
    return dialect().compile(statement());
  }

  public QueryResult execute() {
    SqlStatement sql = toSql();
    return consume().execute(sql, decoding(columnTypes));
  }
}
