package io.intellixity.relata.query;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.error.RecursionLimitExceededException;
import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.RowMapper;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.expression.*;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.*;
import io.intellixity.relata.types.LogicalType;

import java.util.*;

/**
 * {@code WITH [RECURSIVE] ... SELECT ...} assembler.\n
 *
 * CTEs keep their definition order. Every {@link CteRef} must name a CTE defined earlier (or, in a
 * recursive member, the CTE being defined). The main query selects from the last CTE unless
 * {@link #from(String)} says otherwise.\n
 *
 * Recursive CTEs are always depth-bounded: a depth column ({@value #DEPTH_COLUMN}) is threaded
 * through anchor and recursive member. The bound is {@value #DEFAULT_MAX_DEPTH} levels with
 * {@link DepthPolicy#FAIL} unless {@link #maxRecursionDepth(int, DepthPolicy)} says otherwise. With
 * {@link DepthPolicy#TRUNCATE} recursion silently stops at the bound; with {@link DepthPolicy#FAIL}
 * a bounded check query runs first and raises {@link RecursionLimitExceededException} when the
 * data goes deeper.
 */
public final class CteQuery extends AbstractQuery implements Queryable {
  public static final String DEPTH_COLUMN = "relata_depth";
  public static final int DEFAULT_MAX_DEPTH = 100;

  public enum DepthPolicy { FAIL, TRUNCATE }

  private record Definition(String name, List<String> columns, Statement body, Statement anchor, Statement member) {
    boolean recursive() { return member != null; }
  }

  private final Map<String, Definition> ctes = new LinkedHashMap<>();
  private ActiveQuery main;
  private String from;
  private int maxDepth = DEFAULT_MAX_DEPTH;
  private DepthPolicy depthPolicy = DepthPolicy.FAIL;

  private CteQuery(Dialect dialect, StorageBackend backend) {
    super(dialect, backend);
  }

  public static CteQuery on(StorageBackend backend) {
    return new CteQuery(backend.dialect(), backend);
  }

  /** Render-only. */
  public static CteQuery on(Dialect dialect) {
    return new CteQuery(dialect, null);
  }

  // --- definitions ---

  public CteQuery with(String name, Queryable query) {
    return with(name, List.of(), query);
  }

  public CteQuery with(String name, List<String> columns, Queryable query) {
    checkOpen();
    dialect().require(Capability.CTE, "WITH");
    Identifiers.require(name, "cte");
    checkNew(name);
    Statement body = sameDialect(query).statement();
    checkReferences(name, body, Set.of());
    ctes.put(name, new Definition(name, columns == null ? List.of() : List.copyOf(columns), body, null, null));
    return this;
  }

  /**
   * Recursive CTE {@code name(columns) AS (anchor UNION ALL recursive)}. The recursive member must
   * reference {@code name} through a {@link CteRef}.
   */
  public CteQuery withRecursive(String name, List<String> columns, Queryable anchor, Queryable recursive) {
    checkOpen();
    dialect().require(Capability.RECURSIVE_CTE, "WITH RECURSIVE");
    Identifiers.require(name, "cte");
    checkNew(name);
    Statement a = sameDialect(anchor).statement();
    Statement r = sameDialect(recursive).statement();
    checkReferences(name, a, Set.of());
    if (!CteReferences.of(r).contains(name)) {
      throw new QueryConstructionException(dialect().id(), "WITH RECURSIVE",
          "recursive member of '" + name + "' does not reference it");
    }
    checkReferences(name, r, Set.of(name));
    ctes.put(name, new Definition(name, columns == null ? List.of() : List.copyOf(columns), null, a, r));
    return this;
  }

  /** Bound every recursive CTE to {@code depth} levels (the anchor is level 1). */
  public CteQuery maxRecursionDepth(int depth, DepthPolicy policy) {
    checkOpen();
    if (depth < 1) throw new QueryConstructionException(dialect().id(), "WITH RECURSIVE", "max depth must be >= 1");
    this.maxDepth = depth;
    this.depthPolicy = Objects.requireNonNull(policy, "policy");
    return this;
  }

  // --- main query ---

  public CteQuery from(String cteName) {
    checkOpen();
    if (!ctes.containsKey(cteName)) {
      throw new QueryConstructionException(dialect().id(), "FROM", "undefined CTE: " + cteName);
    }
    this.from = cteName;
    return this;
  }

  public CteQuery select(String... columns) { edit().select(columns); return this; }

  public CteQuery select(Expression... columns) { edit().select(columns); return this; }

  public CteQuery distinct() { edit().distinct(); return this; }

  public CteQuery where(Expression condition) { edit().where(condition); return this; }

  public CteQuery where(String column, Object value) { edit().where(column, value); return this; }

  public CteQuery join(String table, Expression on) { edit().join(table, on); return this; }

  public CteQuery join(Expression source, Expression on) { edit().join(source, on); return this; }

  public CteQuery leftJoin(Expression source, Expression on) { edit().leftJoin(source, on); return this; }

  public CteQuery groupBy(String... columns) { edit().groupBy(columns); return this; }

  public CteQuery orderBy(String column) { edit().orderBy(column); return this; }

  public CteQuery orderByDesc(String column) { edit().orderByDesc(column); return this; }

  public CteQuery orderBy(OrderTerm term) { edit().orderBy(term); return this; }

  public CteQuery limit(long limit) { edit().limit(limit); return this; }

  public CteQuery offset(long offset) { edit().offset(offset); return this; }

  public CteQuery columnType(String label, LogicalType type) { edit().columnType(label, type); return this; }

  private ActiveQuery edit() {
    checkOpen();
    return main();
  }

  private ActiveQuery main() {
    if (main == null) main = ActiveQuery.from(dialect(), new CteRef(sourceName(), null));
    return main;
  }

  private String sourceName() {
    if (from != null) return from;
    if (ctes.isEmpty()) {
      throw new QueryConstructionException(dialect().id(), "WITH", "define a CTE before the main query");
    }
    String last = null;
    for (String n : ctes.keySet()) last = n;
    return last;
  }

  // --- rendering ---

  @Override
  public SelectStatement statement() {
    WithClause with = withClause();
    ActiveQuery m = main();
    m.source(new CteRef(sourceName(), null));
    SelectStatement body = m.statement();
    checkReferences(null, body, Set.of());
    SelectStatement.Builder b = body.toBuilder().with(with);
    if (body.columns().isEmpty()) {
      // keep the depth column out of SELECT *
      Definition src = ctes.get(sourceName());
      List<String> names = src.recursive() ? outputNames(src) : List.of();
      if (!names.isEmpty()) {
        List<Expression> cols = new ArrayList<>();
        for (String c : names) cols.add(new Column(null, c, null));
        b.columns(cols);
      }
    }
    return b.build();
  }

  private WithClause withClause() {
    if (ctes.isEmpty()) throw new QueryConstructionException(dialect().id(), "WITH", "no CTE defined");
    List<CteDefinition> defs = new ArrayList<>();
    for (Definition d : ctes.values()) {
      if (!d.recursive()) {
        defs.add(new CteDefinition(d.name(), d.columns(), d.body(), false));
        continue;
      }
      Statement anchor = d.anchor();
      Statement member = d.member();
      List<String> columns = d.columns();
      anchor = depthAnchor(d.name(), anchor);
      member = depthMember(d.name(), member);
      if (!columns.isEmpty()) {
        columns = new ArrayList<>(columns);
        columns.add(DEPTH_COLUMN);
      }
      defs.add(new CteDefinition(d.name(), columns, new SetOperationStatement(anchor, SetOperator.UNION, true, member), true));
    }
    return new WithClause(defs);
  }

  private SelectStatement depthAnchor(String name, Statement anchor) {
    SelectStatement s = requireSelect(name, anchor, "anchor");
    List<Expression> cols = new ArrayList<>(s.columns().isEmpty() ? List.of(new Star(null)) : s.columns());
    cols.add(new Aliased(new Cast(new Literal(1, LogicalType.INTEGER), LogicalType.INTEGER), DEPTH_COLUMN));
    return s.toBuilder().columns(cols).build();
  }

  private SelectStatement depthMember(String name, Statement member) {
    SelectStatement s = requireSelect(name, member, "recursive member");
    if (!s.hasExplicitColumns()) {
      throw new QueryConstructionException(dialect().id(), "WITH RECURSIVE",
          "recursive member of '" + name + "' must select explicit columns");
    }
    Column depth = new Column(selfQualifier(name, s), DEPTH_COLUMN, null);
    List<Expression> cols = new ArrayList<>(s.columns());
    cols.add(new Aliased(new Arithmetic(depth, ArithmeticOperator.ADD, new Literal(1, LogicalType.INTEGER)), DEPTH_COLUMN));
    Literal bound = new Literal(maxDepth, LogicalType.INTEGER);
    Expression guard = depthPolicy == DepthPolicy.TRUNCATE
        ? new Comparison(depth, ComparisonOperator.LT, bound)
        : new Comparison(depth, ComparisonOperator.LE, bound);
    Expression where = s.where() == null ? guard : Expressions.and(s.where(), guard);
    return s.toBuilder().columns(cols).where(where).build();
  }

  private SelectStatement requireSelect(String name, Statement s, String part) {
    if (s instanceof SelectStatement sel) return sel;
    throw new QueryConstructionException(dialect().id(), "WITH RECURSIVE",
        part + " of '" + name + "' must be a plain SELECT");
  }

  /** Declared columns, else the anchor's output names; empty when an anchor column has no name. */
  private static List<String> outputNames(Definition d) {
    if (!d.columns().isEmpty()) return d.columns();
    if (!(d.anchor() instanceof SelectStatement s) || !s.hasExplicitColumns()) return List.of();
    List<String> names = new ArrayList<>();
    for (Expression e : s.columns()) {
      if (e instanceof Aliased a) names.add(a.alias());
      else if (e instanceof Column c) names.add(c.alias() != null ? c.alias() : c.name());
      else return List.of();
    }
    return names;
  }

  private static String selfQualifier(String name, SelectStatement s) {
    if (s.from() instanceof CteRef r && r.name().equals(name)) return r.alias() != null ? r.alias() : r.name();
    for (Join j : s.joins()) {
      if (j.source() instanceof CteRef r && r.name().equals(name)) return r.alias() != null ? r.alias() : r.name();
    }
    return name;
  }

  /** One check query per recursive CTE: a row deeper than the bound means the data recurses past it. */
  List<SelectStatement> depthChecks() {
    if (depthPolicy != DepthPolicy.FAIL) return List.of();
    WithClause with = withClause();
    List<SelectStatement> checks = new ArrayList<>();
    for (Definition d : ctes.values()) {
      if (!d.recursive()) continue;
      checks.add(SelectStatement.builder()
          .with(with)
          .column(new Literal(1, LogicalType.INTEGER))
          .from(new CteRef(d.name(), null))
          .where(new Comparison(new Column(null, DEPTH_COLUMN, null), ComparisonOperator.GT,
              new Literal(maxDepth, LogicalType.INTEGER)))
          .limit(1L)
          .build());
    }
    return checks;
  }

  // --- terminals ---

  public List<Map<String, Object>> all() {
    SqlStatement sql = toSql();
    ExecutionOptions options = decoding(main().columnTypes());
    return checkedBackend().execute(sql, options).rows();
  }

  public <T> List<T> all(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    List<T> out = new ArrayList<>();
    for (Map<String, Object> row : all()) out.add(mapper.map(row));
    return out;
  }

  /** First row, fetching at most one. */
  public Optional<Map<String, Object>> one() {
    SelectStatement base = statement();
    SelectStatement s = base.toBuilder().limit(base.limit() == null ? 1L : Math.min(base.limit(), 1L)).build();
    SqlStatement sql = dialect().compile(s);
    ExecutionOptions options = decoding(main().columnTypes());
    List<Map<String, Object>> rows = checkedBackend().execute(sql, options).rows();
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  public <T> Optional<T> one(RowMapper<T> mapper) {
    Objects.requireNonNull(mapper, "mapper");
    return one().map(mapper::map);
  }

  public long count() {
    SqlStatement sql = dialect().compile(ActiveQuery.aggregateStatement(statement(), Expressions.count()));
    return ActiveQuery.toLong(ActiveQuery.scalarOf(checkedBackend().execute(sql, ExecutionOptions.defaults())));
  }

  public boolean exists() {
    SqlStatement sql = dialect().compile(ActiveQuery.existsStatement(statement()));
    return !checkedBackend().execute(sql, ExecutionOptions.defaults()).rows().isEmpty();
  }

  /** Consumes the query and runs the depth checks; the returned backend is clear to execute. */
  private StorageBackend checkedBackend() {
    List<SelectStatement> checks = depthChecks();
    StorageBackend backend = consume();
    for (SelectStatement check : checks) {
      if (!backend.execute(dialect().compile(check), ExecutionOptions.defaults()).rows().isEmpty()) {
        throw new RecursionLimitExceededException(dialect().id(), ((CteRef) check.from()).name(), maxDepth);
      }
    }
    return backend;
  }

  // --- checks ---

  private void checkNew(String name) {
    if (ctes.containsKey(name)) {
      throw new QueryConstructionException(dialect().id(), "WITH", "duplicate CTE name: " + name);
    }
  }

  private void checkReferences(String defining, Statement s, Set<String> extra) {
    for (String ref : CteReferences.of(s)) {
      if (ctes.containsKey(ref) || extra.contains(ref)) continue;
      String where = defining == null ? "main query" : "'" + defining + "'";
      throw new QueryConstructionException(dialect().id(), "WITH", "undefined CTE reference '" + ref + "' in " + where);
    }
  }

  private Queryable sameDialect(Queryable q) {
    Objects.requireNonNull(q, "query");
    if (!q.dialect().id().equals(dialect().id())) {
      throw new QueryConstructionException(dialect().id(), "WITH", "query built for dialect " + q.dialect().id());
    }
    return q;
  }
}
