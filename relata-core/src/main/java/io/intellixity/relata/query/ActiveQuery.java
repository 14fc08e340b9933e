package io.intellixity.relata.query;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.exec.RowMapper;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.exec.TableModel;
import io.intellixity.relata.expression.*;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.Join;
import io.intellixity.relata.statement.JoinType;
import io.intellixity.relata.statement.LockMode;
import io.intellixity.relata.statement.SelectStatement;
import io.intellixity.relata.types.LogicalType;

import java.util.*;

import static io.intellixity.relata.expression.Expressions.*;

/**
 * Fluent single-table SELECT assembler.\n
 *
 * Each call appends immutable nodes; {@code where} and {@code having} always conjoin with what is
 * already there. {@link #toSql()} is side-effect free. Executing terminals ({@code all}, {@code one},
 * {@code count}, {@code exists}, {@code scalar}, aggregates, {@code explain}) consume the builder.
 */
public final class ActiveQuery extends AbstractQuery implements Queryable {
  static final String COUNT_ALIAS = "relata_count";

  private Expression source;
  private boolean distinct;
  private final List<Expression> columns = new ArrayList<>();
  private final List<Join> joins = new ArrayList<>();
  private Expression where;
  private final List<Expression> groupBy = new ArrayList<>();
  private Expression having;
  private final List<OrderTerm> orderBy = new ArrayList<>();
  private Long limit;
  private Long offset;
  private LockMode lock = LockMode.NONE;
  private final Map<String, LogicalType> columnTypes = new LinkedHashMap<>();

  private ActiveQuery(Dialect dialect, StorageBackend backend, Expression source) {
    super(dialect, backend);
    this.source = Objects.requireNonNull(source, "source");
  }

  public static ActiveQuery from(StorageBackend backend, String table) {
    return new ActiveQuery(backend.dialect(), backend, TableRef.of(table));
  }

  /** Query over a model table; the model's column types drive literal encoding and row decoding. */
  public static ActiveQuery from(StorageBackend backend, TableModel model) {
    ActiveQuery q = new ActiveQuery(backend.dialect(), backend, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  /** Source may be a {@link TableRef}, {@link CteRef} or aliased {@link Subquery}. */
  public static ActiveQuery from(StorageBackend backend, Expression source) {
    return new ActiveQuery(backend.dialect(), backend, source);
  }

  /** Render-only query: {@link #toSql()} works, executing terminals throw. */
  public static ActiveQuery from(Dialect dialect, String table) {
    return new ActiveQuery(dialect, null, TableRef.of(table));
  }

  public static ActiveQuery from(Dialect dialect, TableModel model) {
    ActiveQuery q = new ActiveQuery(dialect, null, TableRef.of(model.tableName()));
    q.columnTypes.putAll(model.columnTypes());
    return q;
  }

  public static ActiveQuery from(Dialect dialect, Expression source) {
    return new ActiveQuery(dialect, null, source);
  }

  // --- projection ---

  public ActiveQuery select(String... columns) {
    checkOpen();
    for (String c : columns) this.columns.add(col(c));
    return this;
  }

  public ActiveQuery select(Expression... columns) {
    checkOpen();
    this.columns.addAll(Arrays.asList(columns));
    return this;
  }

  public ActiveQuery distinct() {
    checkOpen();
    this.distinct = true;
    return this;
  }

  // --- filtering ---

  public ActiveQuery where(Expression condition) {
    checkOpen();
    Objects.requireNonNull(condition, "condition");
    this.where = (where == null) ? condition : and(where, condition);
    return this;
  }

  /** {@code column = value}, or {@code column IS NULL} for a null value. */
  public ActiveQuery where(String column, Object value) {
    return where(eq(col(column), literal(column, value)));
  }

  /** {@code column op value} with op one of {@code = != <> < <= > >= like "not like"}. */
  public ActiveQuery where(String column, String operator, Object value) {
    return where(comparison(column, operator, value));
  }

  /** OR the condition with everything accumulated so far. */
  public ActiveQuery orWhere(Expression condition) {
    checkOpen();
    Objects.requireNonNull(condition, "condition");
    this.where = (where == null) ? condition : or(where, condition);
    return this;
  }

  public ActiveQuery orWhere(String column, String operator, Object value) {
    return orWhere(comparison(column, operator, value));
  }

  public ActiveQuery whereIn(String column, Collection<?> values) {
    return where(in(col(column), literals(column, values)));
  }

  public ActiveQuery whereIn(String column, Queryable subquery) {
    return where(in(col(column), subquery(sameDialect(subquery).statement())));
  }

  public ActiveQuery whereNotIn(String column, Collection<?> values) {
    return where(notIn(col(column), literals(column, values)));
  }

  public ActiveQuery whereBetween(String column, Object low, Object high) {
    return where(between(col(column), literal(column, low), literal(column, high)));
  }

  public ActiveQuery whereLike(String column, String pattern) {
    return where(like(col(column), lit(pattern, LogicalType.TEXT)));
  }

  public ActiveQuery whereNull(String column) {
    return where(isNull(col(column)));
  }

  public ActiveQuery whereNotNull(String column) {
    return where(isNotNull(col(column)));
  }

  public ActiveQuery whereExists(Queryable subquery) {
    return where(Expressions.exists(sameDialect(subquery).statement()));
  }

  // --- joins ---

  public ActiveQuery join(String table, Expression on) { return addJoin(JoinType.INNER, TableRef.of(table), on); }

  /** Inner join on {@code leftColumn = rightColumn}. */
  public ActiveQuery join(String table, String leftColumn, String rightColumn) {
    return join(table, eq(col(leftColumn), col(rightColumn)));
  }

  public ActiveQuery join(Expression source, Expression on) { return addJoin(JoinType.INNER, source, on); }

  public ActiveQuery leftJoin(String table, Expression on) { return addJoin(JoinType.LEFT, TableRef.of(table), on); }

  public ActiveQuery leftJoin(Expression source, Expression on) { return addJoin(JoinType.LEFT, source, on); }

  public ActiveQuery rightJoin(String table, Expression on) { return rightJoin(TableRef.of(table), on); }

  public ActiveQuery rightJoin(Expression source, Expression on) {
    dialect().require(Capability.RIGHT_JOIN, "RIGHT JOIN");
    return addJoin(JoinType.RIGHT, source, on);
  }

  public ActiveQuery fullJoin(String table, Expression on) { return fullJoin(TableRef.of(table), on); }

  public ActiveQuery fullJoin(Expression source, Expression on) {
    dialect().require(Capability.FULL_OUTER_JOIN, "FULL OUTER JOIN");
    return addJoin(JoinType.FULL, source, on);
  }

  public ActiveQuery crossJoin(String table) { return addJoin(JoinType.CROSS, TableRef.of(table), null); }

  public ActiveQuery crossJoin(Expression source) { return addJoin(JoinType.CROSS, source, null); }

  private ActiveQuery addJoin(JoinType type, Expression source, Expression on) {
    checkOpen();
    joins.add(new Join(type, source, on));
    return this;
  }

  // --- grouping / ordering / paging ---

  public ActiveQuery groupBy(String... columns) {
    checkOpen();
    for (String c : columns) groupBy.add(col(c));
    return this;
  }

  public ActiveQuery groupBy(Expression... expressions) {
    checkOpen();
    groupBy.addAll(Arrays.asList(expressions));
    return this;
  }

  public ActiveQuery having(Expression condition) {
    checkOpen();
    Objects.requireNonNull(condition, "condition");
    this.having = (having == null) ? condition : and(having, condition);
    return this;
  }

  public ActiveQuery orderBy(String column) { return orderBy(OrderTerm.asc(col(column))); }

  public ActiveQuery orderByDesc(String column) { return orderBy(OrderTerm.desc(col(column))); }

  public ActiveQuery orderBy(Expression expression) { return orderBy(OrderTerm.asc(expression)); }

  public ActiveQuery orderBy(OrderTerm term) {
    checkOpen();
    if (term.nulls() != null) dialect().require(Capability.NULLS_ORDERING, "ORDER BY");
    orderBy.add(term);
    return this;
  }

  public ActiveQuery limit(long limit) {
    checkOpen();
    if (limit < 0) throw new QueryConstructionException(dialect().id(), "LIMIT", "limit must be >= 0");
    this.limit = limit;
    return this;
  }

  public ActiveQuery offset(long offset) {
    checkOpen();
    if (offset < 0) throw new QueryConstructionException(dialect().id(), "OFFSET", "offset must be >= 0");
    this.offset = offset;
    return this;
  }

  public ActiveQuery lockForUpdate() {
    checkOpen();
    dialect().require(Capability.ROW_LOCKING, "FOR UPDATE");
    this.lock = LockMode.FOR_UPDATE;
    return this;
  }

  public ActiveQuery lockForShare() {
    checkOpen();
    dialect().require(Capability.ROW_LOCKING, "FOR SHARE");
    this.lock = LockMode.FOR_SHARE;
    return this;
  }

  /** Decode result column {@code label} as {@code type}. */
  public ActiveQuery columnType(String label, LogicalType type) {
    checkOpen();
    columnTypes.put(Objects.requireNonNull(label, "label"), Objects.requireNonNull(type, "type"));
    return this;
  }

  // --- rendering ---

  @Override
  public SelectStatement statement() {
    if (offset != null && limit == null) dialect().require(Capability.OFFSET_WITHOUT_LIMIT, "OFFSET");
    return new SelectStatement(null, distinct, columns, source, joins, where, groupBy, having, orderBy, limit, offset, lock);
  }

  // --- terminals ---

  public List<Map<String, Object>> all() {
    SqlStatement sql = toSql();
    return consume().execute(sql, options()).rows();
  }

  public <T> List<T> all(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    List<T> out = new ArrayList<>();
    for (Map<String, Object> row : all()) out.add(mapper.map(row));
    return out;
  }

  /** First row, fetching at most one. */
  public Optional<Map<String, Object>> one() {
    SelectStatement s = statement().toBuilder().limit(limit == null ? 1L : Math.min(limit, 1L)).build();
    SqlStatement sql = dialect().compile(s);
    List<Map<String, Object>> rows = consume().execute(sql, options()).rows();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public <T> Optional<T> one(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return one().map(mapper::map);
  }

  /**
   * Number of rows the query would return. Grouped, distinct or paginated queries are counted
   * through a derived table so the count matches {@link #all()}.
   */
  public long count() {
    SelectStatement s = aggregateStatement(statement(), Expressions.count());
    Object v = scalarOf(consume().execute(dialect().compile(s), ExecutionOptions.defaults()));
    return toLong(v);
  }

  /** Whether at least one row matches. Renders {@code SELECT 1 ... LIMIT 1}. */
  public boolean exists() {
    SelectStatement s = existsStatement(statement());
    return !consume().execute(dialect().compile(s), ExecutionOptions.defaults()).rows().isEmpty();
  }

  /** First column of the first row, or null when there is none. */
  public Object scalar() {
    SqlStatement sql = toSql();
    return scalarOf(consume().execute(sql, options()));
  }

  public Number sum(String column) { return (Number) aggregate(Expressions.sum(col(column))); }

  public Number avg(String column) { return (Number) aggregate(Expressions.avg(col(column))); }

  public Object min(String column) { return aggregate(Expressions.min(col(column))); }

  public Object max(String column) { return aggregate(Expressions.max(col(column))); }

  /** Backend query plan for this query, as returned rows. */
  public List<Map<String, Object>> explain() {
    SqlStatement plan = dialect().explain(toSql());
    return consume().execute(plan, ExecutionOptions.defaults()).rows();
  }

  private Object aggregate(Aggregate agg) {
    SelectStatement s = aggregateStatement(statement(), agg);
    return scalarOf(consume().execute(dialect().compile(s), ExecutionOptions.defaults()));
  }

  // --- helpers ---

  Map<String, LogicalType> columnTypes() { return Collections.unmodifiableMap(columnTypes); }

  void source(Expression source) {
    checkOpen();
    this.source = Objects.requireNonNull(source, "source");
  }

  Expression source() { return source; }

  private ExecutionOptions options() {
    return decoding(columnTypes);
  }

  static SelectStatement aggregateStatement(SelectStatement base, Aggregate agg) {
    if (needsDerivedTable(base)) {
      Aggregate outer = agg;
      if (agg.argument() instanceof Column c && c.table() != null) {
        outer = new Aggregate(agg.function(), new Column(null, c.name(), null), agg.distinct(), agg.filter());
      }
      return SelectStatement.builder()
          .with(base.with())
          .column(new Aliased(outer, COUNT_ALIAS))
          .from(new Subquery(stripForDerived(base), COUNT_ALIAS))
          .build();
    }
    return base.toBuilder().columns(List.of(new Aliased(agg, COUNT_ALIAS))).orderBy(List.of()).lock(LockMode.NONE).build();
  }

  static SelectStatement existsStatement(SelectStatement base) {
    if (needsDerivedTable(base)) {
      return SelectStatement.builder()
          .with(base.with())
          .column(lit(1, LogicalType.INTEGER))
          .from(new Subquery(stripForDerived(base), COUNT_ALIAS))
          .limit(1L)
          .build();
    }
    return base.toBuilder().columns(List.of(lit(1, LogicalType.INTEGER))).orderBy(List.of()).lock(LockMode.NONE)
        .limit(1L).build();
  }

  private static boolean needsDerivedTable(SelectStatement s) {
    return s.distinct() || !s.groupBy().isEmpty() || s.having() != null || s.limit() != null || s.offset() != null;
  }

  /** Inner query of a derived table: WITH is hoisted out, ORDER BY kept only where paging depends on it. */
  private static SelectStatement stripForDerived(SelectStatement s) {
    SelectStatement.Builder b = s.toBuilder().with(null).lock(LockMode.NONE);
    if (s.limit() == null && s.offset() == null) b.orderBy(List.of());
    return b.build();
  }

  static Object scalarOf(QueryResult r) {
    if (r.rows().isEmpty()) return null;
    Map<String, Object> row = r.rows().get(0);
    return row.isEmpty() ? null : row.values().iterator().next();
  }

  static long toLong(Object v) {
    if (v == null) return 0L;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(v.toString());
  }

  private Expression literal(String column, Object value) {
    if (value == null) return null;
    if (value instanceof Expression e) return e;
    LogicalType t = columnTypes.get(unqualified(column));
    return (t != null) ? new Literal(value, t) : Literal.of(value);
  }

  private List<Expression> literals(String column, Collection<?> values) {
    List<Expression> out = new ArrayList<>();
    if (values != null) for (Object v : values) out.add(literal(column, v));
    return out;
  }

  private Expression comparison(String column, String operator, Object value) {
    Column c = col(column);
    String op = Objects.requireNonNull(operator, "operator").trim().toLowerCase(Locale.ROOT);
    return switch (op) {
      case "=", "==" -> eq(c, literal(column, value));
      case "!=", "<>" -> ne(c, literal(column, value));
      case "<" -> lt(c, literal(column, value));
      case "<=" -> le(c, literal(column, value));
      case ">" -> gt(c, literal(column, value));
      case ">=" -> ge(c, literal(column, value));
      case "like" -> like(c, literal(column, value));
      case "not like" -> notLike(c, literal(column, value));
      default -> throw new QueryConstructionException(dialect().id(), "WHERE", "unknown operator: " + operator);
    };
  }

  private Queryable sameDialect(Queryable q) {
    if (!q.dialect().id().equals(dialect().id())) {
      throw new QueryConstructionException(dialect().id(), "SUBQUERY",
          "subquery built for dialect " + q.dialect().id());
    }
    return q;
  }

  private static String unqualified(String column) {
    int dot = column.lastIndexOf('.');
    return dot < 0 ? column : column.substring(dot + 1);
  }
}
