package io.intellixity.relata.query;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.exec.TableModel;
import io.intellixity.relata.expression.Excluded;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Literal;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.Assignment;
import io.intellixity.relata.statement.InsertStatement;
import io.intellixity.relata.statement.OnConflict;
import io.intellixity.relata.types.LogicalType;

import java.util.*;

import static io.intellixity.relata.expression.Expressions.col;

/** {@code INSERT INTO ... VALUES ...} assembler; the first row fixes the column order. */
public final class InsertQuery extends AbstractQuery {
  private final TableRef table;
  private final Map<String, LogicalType> columnTypes = new LinkedHashMap<>();
  private List<String> columns;
  private final List<List<Expression>> rows = new ArrayList<>();
  private final List<Expression> returning = new ArrayList<>();
  private OnConflict onConflict;

  private InsertQuery(Dialect dialect, StorageBackend backend, TableRef table) {
    super(dialect, backend);
    this.table = table;
  }

  public static InsertQuery into(StorageBackend backend, String table) {
    return new InsertQuery(backend.dialect(), backend, TableRef.of(table));
  }

  public static InsertQuery into(StorageBackend backend, TableModel model) {
    InsertQuery q = new InsertQuery(backend.dialect(), backend, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  public static InsertQuery into(Dialect dialect, TableModel model) {
    InsertQuery q = new InsertQuery(dialect, null, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  public static InsertQuery into(Dialect dialect, String table) {
    return new InsertQuery(dialect, null, TableRef.of(table));
  }

  /** Add one row. Every row must carry the same column set as the first. */
  public InsertQuery values(Map<String, ?> row) {
    checkOpen();
    Objects.requireNonNull(row, "row");
    if (columns == null) {
      if (row.isEmpty()) throw new QueryConstructionException(dialect().id(), "INSERT", "row has no columns");
      columns = List.copyOf(row.keySet());
    } else if (!new HashSet<>(columns).equals(row.keySet())) {
      throw new QueryConstructionException(dialect().id(), "INSERT",
          "row columns " + row.keySet() + " differ from " + columns);
    }
    List<Expression> values = new ArrayList<>(columns.size());
    for (String c : columns) values.add(literal(c, row.get(c)));
    rows.add(values);
    return this;
  }

  public InsertQuery values(List<? extends Map<String, ?>> rows) {
    for (Map<String, ?> r : rows) values(r);
    return this;
  }

  public InsertQuery columnType(String column, LogicalType type) {
    checkOpen();
    columnTypes.put(column, type);
    return this;
  }

  public InsertQuery returning(String... columns) {
    checkOpen();
    dialect().require(Capability.RETURNING, "RETURNING");
    for (String c : columns) returning.add(col(c));
    return this;
  }

  /**
   * Start an upsert. {@code target} names the unique columns whose collision triggers it; MySQL
   * ignores the target and reacts to any unique key.
   */
  public Conflict onConflict(String... target) {
    checkOpen();
    dialect().require(Capability.UPSERT, "ON CONFLICT");
    return new Conflict(List.of(target));
  }

  public InsertStatement statement() {
    return new InsertStatement(table, columns == null ? List.of() : columns, rows, returning, onConflict);
  }

  public SqlStatement toSql() {
    return dialect().compile(statement());
  }

  public QueryResult execute() {
    SqlStatement sql = toSql();
    return consume().execute(sql, decoding(columnTypes));
  }

  /** Resolution chosen after {@link #onConflict(String...)}. */
  public final class Conflict {
    private final List<String> target;

    private Conflict(List<String> target) {
      this.target = target;
    }

    public InsertQuery doNothing() {
      return conclude(OnConflict.doNothing(target));
    }

    /** Overwrite each named column with the value the insert proposed. */
    public InsertQuery doUpdate(String... columns) {
      Map<String, Object> set = new LinkedHashMap<>();
      for (String c : columns) set.put(c, new Excluded(c));
      return doUpdate(set, null);
    }

    /** Values may be {@link Expression}s (see {@code Expressions.excluded}) or plain values. */
    public InsertQuery doUpdate(Map<String, ?> assignments) {
      return doUpdate(assignments, null);
    }

    public InsertQuery doUpdate(Map<String, ?> assignments, Expression where) {
      Objects.requireNonNull(assignments, "assignments");
      if (assignments.isEmpty()) {
        throw new QueryConstructionException(dialect().id(), "ON CONFLICT", "DO UPDATE needs at least one assignment");
      }
      List<Assignment> updates = new ArrayList<>(assignments.size());
      assignments.forEach((c, v) -> updates.add(new Assignment(col(c), literal(c, v))));
      return conclude(new OnConflict(target, updates, where));
    }

    private InsertQuery conclude(OnConflict clause) {
      checkOpen();
      onConflict = clause;
      return InsertQuery.this;
    }
  }

  private Expression literal(String column, Object value) {
    if (value instanceof Expression e) return e;
    LogicalType t = columnTypes.get(column);
    return t != null ? new Literal(value, t) : Literal.of(value);
  }
}
