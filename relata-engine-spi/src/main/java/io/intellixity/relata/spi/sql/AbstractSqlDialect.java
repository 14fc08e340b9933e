package io.intellixity.relata.spi.sql;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.expression.*;
import io.intellixity.relata.sql.*;
import io.intellixity.relata.statement.*;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;

import java.util.*;

/**
 * ANSI-flavored SQL renderer shared by all SQL dialects.\n
 *
 * Provides common rendering for:\n
 * - every expression node (one visitor method per variant)\n
 * - SELECT / set operations / WITH, and INSERT / UPDATE / DELETE\n
 * - capability gating before any SQL text is produced\n
 *
 * Backend dialects override the protected hooks and {@code format*} methods for quoting, paging,
 * compound operands and type names. Parentheses come from operator precedence, never from the
 * caller.
 */
public abstract class AbstractSqlDialect implements Dialect {
  private static final int PREC_OR = 1;
  private static final int PREC_AND = 2;
  private static final int PREC_NOT = 3;
  private static final int PREC_PREDICATE = 4;
  private static final int PREC_ADDITIVE = 5;
  private static final int PREC_MULTIPLICATIVE = 6;
  private static final int PREC_ATOM = 10;

  private final String id;
  private final TypeRegistry types;
  private final Set<Capability> capabilities;

  protected AbstractSqlDialect(String id, TypeRegistry types, Set<Capability> capabilities) {
    this.id = Objects.requireNonNull(id, "id");
    this.types = Objects.requireNonNull(types, "types");
    if (!id.equals(types.dialectId())) {
      throw new IllegalArgumentException("type registry built for " + types.dialectId() + ", not " + id);
    }
    this.capabilities = capabilities.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
  }

  @Override public final String id() { return id; }
  @Override public final TypeRegistry types() { return types; }
  @Override public boolean supports(Capability capability) { return capabilities.contains(capability); }

  public final Set<Capability> capabilities() { return capabilities; }

  @Override
  public PlaceholderStyle placeholderStyle() { return PlaceholderStyle.QMARK; }

  // --- format hooks ---

  @Override
  public String formatIdentifier(String name) {
    return "\"" + name.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String formatColumnReference(String table, String column) {
    return (table == null) ? formatIdentifier(column) : formatIdentifier(table) + "." + formatIdentifier(column);
  }

  @Override
  public String formatLiteralPlaceholder(int position1Based) {
    return placeholderStyle().placeholder(position1Based);
  }

  @Override
  public String formatLimitOffset(Long limit, Long offset, RenderContext ctx) {
    if (limit == null && offset == null) return "";
    if (limit == null) {
      require(Capability.OFFSET_WITHOUT_LIMIT, "OFFSET");
      return " OFFSET " + ctx.bind(offset, LogicalType.BIGINT);
    }
    String sql = " LIMIT " + ctx.bind(limit, LogicalType.BIGINT);
    if (offset != null) sql += " OFFSET " + ctx.bind(offset, LogicalType.BIGINT);
    return sql;
  }

  @Override
  public String formatReturningClause(List<Expression> columns, RenderContext ctx) {
    if (columns == null || columns.isEmpty()) return "";
    require(Capability.RETURNING, "RETURNING");
    List<String> parts = new ArrayList<>(columns.size());
    for (Expression c : columns) parts.add(selectItem(c, ctx));
    return " RETURNING " + String.join(", ", parts);
  }

  @Override
  public String formatCte(String name, boolean recursive, List<String> columns, String body) {
    StringBuilder sb = new StringBuilder(formatIdentifier(name));
    if (columns != null && !columns.isEmpty()) {
      sb.append('(');
      for (int i = 0; i < columns.size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(formatIdentifier(columns.get(i)));
      }
      sb.append(')');
    }
    return sb.append(" AS (").append(body).append(')').toString();
  }

  @Override
  public String formatWindow(List<Expression> partitionBy, List<OrderTerm> orderBy, WindowFrame frame,
                             RenderContext ctx) {
    List<String> parts = new ArrayList<>(3);
    if (!partitionBy.isEmpty()) parts.add("PARTITION BY " + list(partitionBy, ctx));
    if (!orderBy.isEmpty()) parts.add("ORDER BY " + orderTerms(orderBy, ctx));
    if (frame != null) {
      parts.add(frame.mode() + " BETWEEN " + frameBound(frame.start()) + " AND " + frameBound(frame.end()));
    }
    return "OVER (" + String.join(" ", parts) + ")";
  }

  @Override
  public String formatSetOperation(SetOperator operator, boolean all) {
    return " " + operator.name() + (all ? " ALL " : " ");
  }

  @Override
  public String formatLockClause(LockMode mode) {
    if (mode == null || mode == LockMode.NONE) return "";
    require(Capability.ROW_LOCKING, mode == LockMode.FOR_UPDATE ? "FOR UPDATE" : "FOR SHARE");
    return mode == LockMode.FOR_UPDATE ? " FOR UPDATE" : " FOR SHARE";
  }

  @Override
  public Set<IsolationLevel> supportedIsolationLevels() {
    return EnumSet.allOf(IsolationLevel.class);
  }

  @Override public String savepointSql(String name) { return "SAVEPOINT " + formatIdentifier(name); }
  @Override public String releaseSavepointSql(String name) { return "RELEASE SAVEPOINT " + formatIdentifier(name); }
  @Override public String rollbackToSavepointSql(String name) { return "ROLLBACK TO SAVEPOINT " + formatIdentifier(name); }

  /** Type name used inside {@code CAST(... AS type)}; defaults to the column type. */
  protected String castType(LogicalType type) {
    return nativeColumnType(type);
  }

  /** String concatenation of two rendered operands. */
  protected String renderConcat(String left, String right) {
    return left + " || " + right;
  }

  /**
   * One operand of {@code parent}. Plain selects render bare; operands carrying their own
   * ORDER BY / LIMIT, a WITH clause, or a nested set operation on the right are parenthesized.
   * A nested set operation on the left is also parenthesized when it binds looser than
   * {@code parent}: INTERSECT takes precedence over UNION and EXCEPT.
   */
  protected String renderSetOperand(Statement operand, SetOperationStatement parent, boolean leftmost, RenderContext ctx) {
    String sql = renderStatement(operand, ctx);
    if (operand instanceof SelectStatement s) {
      boolean tail = !s.orderBy().isEmpty() || s.limit() != null || s.offset() != null;
      boolean with = s.with() != null && !s.with().isEmpty();
      return (tail || with) ? "(" + sql + ")" : sql;
    }
    SetOperationStatement so = (SetOperationStatement) operand;
    boolean looser = parent.operator() == SetOperator.INTERSECT && so.operator() != SetOperator.INTERSECT;
    return (leftmost && !so.hasTail() && !looser) ? sql : "(" + sql + ")";
  }

  /** Contents of GROUP BY; MySQL rewrites a lone ROLLUP as a trailing {@code WITH ROLLUP}. */
  protected String renderGroupBy(List<Expression> groupBy, RenderContext ctx) {
    return list(groupBy, ctx);
  }

  protected String renderGrouping(Grouping g, RenderContext ctx) {
    switch (g.kind()) {
      case ROLLUP: require(Capability.ROLLUP, "ROLLUP"); break;
      case CUBE: require(Capability.CUBE, "CUBE"); break;
      default: require(Capability.GROUPING_SETS, "GROUPING SETS"); break;
    }
    if (g.kind() != Grouping.Kind.GROUPING_SETS) return g.kind().keyword() + "(" + list(g.columns(), ctx) + ")";
    List<String> sets = new ArrayList<>(g.sets().size());
    for (List<Expression> set : g.sets()) sets.add("(" + list(set, ctx) + ")");
    return "GROUPING SETS (" + String.join(", ", sets) + ")";
  }

  /** Upsert tail of an INSERT, ahead of RETURNING. */
  protected String renderOnConflict(InsertStatement ins, RenderContext ctx) {
    OnConflict oc = ins.onConflict();
    if (oc == null) return "";
    require(Capability.UPSERT, "ON CONFLICT");
    StringBuilder sb = new StringBuilder(" ON CONFLICT");
    if (!oc.target().isEmpty()) sb.append(" (").append(identifiers(oc.target())).append(')');
    if (oc.doNothing()) return sb.append(" DO NOTHING").toString();
    if (oc.target().isEmpty()) {
      throw new QueryConstructionException(id, "ON CONFLICT", "DO UPDATE needs a conflict target");
    }
    sb.append(" DO UPDATE SET ").append(assignments(oc.updates(), ctx));
    if (oc.where() != null) sb.append(" WHERE ").append(renderExpression(oc.where(), ctx));
    return sb.toString();
  }

  /** Reference to the proposed row inside upsert assignments. */
  protected String formatExcluded(String column) {
    return "excluded." + formatIdentifier(column);
  }

  protected String explainPrefix() {
    return "EXPLAIN ";
  }

  // --- entry points ---

  @Override
  public SqlFragment render(Expression expression) {
    RenderContext ctx = new RenderContext(this);
    String sql = renderExpression(expression, ctx);
    return new SqlFragment(sql, ctx.binds());
  }

  @Override
  public SqlStatement compile(Statement statement) {
    Objects.requireNonNull(statement, "statement");
    RenderContext ctx = new RenderContext(this);
    String sql = renderStatement(statement, ctx);
    return new SqlStatement(sql, ctx.binds(), statement.kind(), hasReturning(statement));
  }

  @Override
  public SqlStatement explain(SqlStatement statement) {
    return new SqlStatement(explainPrefix() + statement.sql(), statement.binds(), StatementKind.SELECT);
  }

  protected final String renderExpression(Expression e, RenderContext ctx) {
    return e.accept(new Renderer(ctx));
  }

  protected final String renderStatement(Statement s, RenderContext ctx) {
    if (s instanceof SelectStatement sel) return renderSelect(sel, ctx);
    if (s instanceof SetOperationStatement so) return renderSetOperation(so, ctx);
    if (s instanceof InsertStatement ins) return renderInsert(ins, ctx);
    if (s instanceof UpdateStatement upd) return renderUpdate(upd, ctx);
    if (s instanceof DeleteStatement del) return renderDelete(del, ctx);
    throw new QueryConstructionException(id, null, "unknown statement: " + s.getClass().getSimpleName());
  }

  // --- statements ---

  protected String renderSelect(SelectStatement s, RenderContext ctx) {
    StringBuilder sb = new StringBuilder();
    sb.append(renderWith(s.with(), ctx));
    sb.append("SELECT ");
    if (s.distinct()) sb.append("DISTINCT ");
    if (s.columns().isEmpty()) {
      sb.append('*');
    } else {
      for (int i = 0; i < s.columns().size(); i++) {
        if (i > 0) sb.append(", ");
        sb.append(selectItem(s.columns().get(i), ctx));
      }
    }
    if (s.from() != null) sb.append(" FROM ").append(renderExpression(s.from(), ctx));
    for (Join j : s.joins()) {
      if (j.type() == JoinType.RIGHT) require(Capability.RIGHT_JOIN, "RIGHT JOIN");
      if (j.type() == JoinType.FULL) require(Capability.FULL_OUTER_JOIN, "FULL OUTER JOIN");
      sb.append(' ').append(j.type().keyword()).append(' ').append(renderExpression(j.source(), ctx));
      if (j.on() != null) sb.append(" ON ").append(renderExpression(j.on(), ctx));
    }
    if (s.where() != null) sb.append(" WHERE ").append(renderExpression(s.where(), ctx));
    if (!s.groupBy().isEmpty()) sb.append(" GROUP BY ").append(renderGroupBy(s.groupBy(), ctx));
    if (s.having() != null) sb.append(" HAVING ").append(renderExpression(s.having(), ctx));
    if (!s.orderBy().isEmpty()) sb.append(" ORDER BY ").append(orderTerms(s.orderBy(), ctx));
    sb.append(formatLimitOffset(s.limit(), s.offset(), ctx));
    sb.append(formatLockClause(s.lock()));
    return sb.toString();
  }

  protected String renderWith(WithClause with, RenderContext ctx) {
    if (with == null || with.isEmpty()) return "";
    require(Capability.CTE, "WITH");
    boolean recursive = with.recursive();
    if (recursive) require(Capability.RECURSIVE_CTE, "WITH RECURSIVE");
    StringBuilder sb = new StringBuilder(recursive ? "WITH RECURSIVE " : "WITH ");
    for (int i = 0; i < with.definitions().size(); i++) {
      CteDefinition d = with.definitions().get(i);
      if (i > 0) sb.append(", ");
      sb.append(formatCte(d.name(), d.recursive(), d.columns(), renderStatement(d.body(), ctx)));
    }
    return sb.append(' ').toString();
  }

  protected String renderSetOperation(SetOperationStatement so, RenderContext ctx) {
    if (so.operator() == SetOperator.INTERSECT) require(Capability.INTERSECT, "INTERSECT");
    if (so.operator() == SetOperator.EXCEPT) require(Capability.EXCEPT, "EXCEPT");
    StringBuilder sb = new StringBuilder();
    sb.append(renderSetOperand(so.left(), so, true, ctx));
    sb.append(formatSetOperation(so.operator(), so.all()));
    sb.append(renderSetOperand(so.right(), so, false, ctx));
    if (!so.orderBy().isEmpty()) sb.append(" ORDER BY ").append(orderTerms(so.orderBy(), ctx));
    sb.append(formatLimitOffset(so.limit(), so.offset(), ctx));
    return sb.toString();
  }

  protected String renderInsert(InsertStatement ins, RenderContext ctx) {
    StringBuilder sb = new StringBuilder("INSERT INTO ");
    sb.append(renderExpression(ins.table(), ctx)).append(" (");
    for (int i = 0; i < ins.columns().size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(formatIdentifier(ins.columns().get(i)));
    }
    sb.append(") VALUES ");
    for (int r = 0; r < ins.rows().size(); r++) {
      if (r > 0) sb.append(", ");
      sb.append('(').append(list(ins.rows().get(r), ctx)).append(')');
    }
    sb.append(renderOnConflict(ins, ctx));
    sb.append(formatReturningClause(ins.returning(), ctx));
    return sb.toString();
  }

  protected String renderUpdate(UpdateStatement upd, RenderContext ctx) {
    StringBuilder sb = new StringBuilder("UPDATE ");
    sb.append(renderExpression(upd.table(), ctx)).append(" SET ").append(assignments(upd.assignments(), ctx));
    if (upd.where() != null) sb.append(" WHERE ").append(renderExpression(upd.where(), ctx));
    sb.append(formatReturningClause(upd.returning(), ctx));
    return sb.toString();
  }

  protected String renderDelete(DeleteStatement del, RenderContext ctx) {
    StringBuilder sb = new StringBuilder("DELETE FROM ");
    sb.append(renderExpression(del.table(), ctx));
    if (del.where() != null) sb.append(" WHERE ").append(renderExpression(del.where(), ctx));
    sb.append(formatReturningClause(del.returning(), ctx));
    return sb.toString();
  }

  // --- helpers ---

  /** Select-list item: a column's own alias is honored here and nowhere else. */
  protected final String selectItem(Expression e, RenderContext ctx) {
    String sql = renderExpression(e, ctx);
    if (e instanceof Column c && c.alias() != null) sql += " AS " + formatIdentifier(c.alias());
    return sql;
  }

  protected final String orderTerms(List<OrderTerm> terms, RenderContext ctx) {
    List<String> parts = new ArrayList<>(terms.size());
    for (OrderTerm t : terms) {
      String sql = renderExpression(t.expression(), ctx) + (t.direction() == OrderTerm.Direction.DESC ? " DESC" : " ASC");
      if (t.nulls() != null) {
        require(Capability.NULLS_ORDERING, "ORDER BY");
        sql += t.nulls() == OrderTerm.NullOrdering.FIRST ? " NULLS FIRST" : " NULLS LAST";
      }
      parts.add(sql);
    }
    return String.join(", ", parts);
  }

  protected final String list(List<? extends Expression> es, RenderContext ctx) {
    List<String> parts = new ArrayList<>(es.size());
    for (Expression e : es) parts.add(renderExpression(e, ctx));
    return String.join(", ", parts);
  }

  protected final String identifiers(List<String> names) {
    List<String> parts = new ArrayList<>(names.size());
    for (String n : names) parts.add(formatIdentifier(n));
    return String.join(", ", parts);
  }

  /** {@code "a" = v, "b" = w}; assignment targets are never table-qualified. */
  protected final String assignments(List<Assignment> as, RenderContext ctx) {
    List<String> parts = new ArrayList<>(as.size());
    for (Assignment a : as) parts.add(formatIdentifier(a.column().name()) + " = " + renderExpression(a.value(), ctx));
    return String.join(", ", parts);
  }

  private static String frameBound(WindowFrame.Bound b) {
    switch (b.kind()) {
      case UNBOUNDED_PRECEDING: return "UNBOUNDED PRECEDING";
      case PRECEDING: return b.offset() + " PRECEDING";
      case CURRENT_ROW: return "CURRENT ROW";
      case FOLLOWING: return b.offset() + " FOLLOWING";
      default: return "UNBOUNDED FOLLOWING";
    }
  }

  private static boolean hasReturning(Statement s) {
    if (s instanceof InsertStatement i) return !i.returning().isEmpty();
    if (s instanceof UpdateStatement u) return !u.returning().isEmpty();
    if (s instanceof DeleteStatement d) return !d.returning().isEmpty();
    return false;
  }

  static int precedence(Expression e) {
    if (e instanceof Logical l) {
      switch (l.operator()) {
        case OR: return PREC_OR;
        case AND: return PREC_AND;
        default: return PREC_NOT;
      }
    }
    if (e instanceof Comparison || e instanceof IsNull || e instanceof InList || e instanceof Between) {
      return PREC_PREDICATE;
    }
    if (e instanceof Arithmetic a) {
      switch (a.operator()) {
        case MULTIPLY: case DIVIDE: case MODULO: return PREC_MULTIPLICATIVE;
        default: return PREC_ADDITIVE;
      }
    }
    return PREC_ATOM;
  }

  /** Expression visitor bound to one render pass. */
  private final class Renderer implements ExpressionVisitor<String> {
    private final RenderContext ctx;

    Renderer(RenderContext ctx) {
      this.ctx = ctx;
    }

    private String r(Expression e) {
      return e.accept(this);
    }

    /** Parenthesize {@code child} when it binds looser than {@code min}. */
    private String wrap(Expression child, int min) {
      String sql = r(child);
      return precedence(child) < min ? "(" + sql + ")" : sql;
    }

    @Override
    public String visit(Column column) {
      return formatColumnReference(column.table(), column.name());
    }

    @Override
    public String visit(Literal literal) {
      return ctx.bind(literal.value(), literal.type());
    }

    @Override
    public String visit(Comparison c) {
      return wrap(c.left(), PREC_PREDICATE + 1) + " " + c.operator().symbol() + " " + wrap(c.right(), PREC_PREDICATE + 1);
    }

    @Override
    public String visit(Logical l) {
      if (l.operator() == LogicalOperator.NOT) {
        Expression child = l.children().get(0);
        String sql = r(child);
        return precedence(child) == PREC_ATOM ? "NOT " + sql : "NOT (" + sql + ")";
      }
      int p = precedence(l);
      String joiner = l.operator() == LogicalOperator.AND ? " AND " : " OR ";
      List<String> parts = new ArrayList<>(l.children().size());
      for (Expression child : l.children()) parts.add(wrap(child, p));
      return String.join(joiner, parts);
    }

    @Override
    public String visit(Aggregate a) {
      StringBuilder sb = new StringBuilder(a.function().name()).append('(');
      if (a.distinct()) sb.append("DISTINCT ");
      sb.append(a.argument() == null ? "*" : r(a.argument())).append(')');
      if (a.filter() != null) {
        require(Capability.FILTER_CLAUSE, "FILTER");
        sb.append(" FILTER (WHERE ").append(r(a.filter())).append(')');
      }
      return sb.toString();
    }

    @Override
    public String visit(Window w) {
      require(Capability.WINDOW_FUNCTIONS, "OVER");
      String fn = r(w.function());
      return fn + " " + formatWindow(w.partitionBy(), w.orderBy(), w.frame(), ctx);
    }

    @Override
    public String visit(CteRef ref) {
      String sql = formatIdentifier(ref.name());
      return ref.alias() == null ? sql : sql + " AS " + formatIdentifier(ref.alias());
    }

    @Override
    public String visit(Subquery subquery) {
      String sql = "(" + renderStatement(subquery.statement(), ctx) + ")";
      return subquery.alias() == null ? sql : sql + " AS " + formatIdentifier(subquery.alias());
    }

    @Override
    public String visit(TableRef t) {
      String sql = (t.schema() == null ? "" : formatIdentifier(t.schema()) + ".") + formatIdentifier(t.name());
      return t.alias() == null ? sql : sql + " AS " + formatIdentifier(t.alias());
    }

    @Override
    public String visit(Star star) {
      return star.table() == null ? "*" : formatIdentifier(star.table()) + ".*";
    }

    @Override
    public String visit(FunctionCall f) {
      List<String> args = new ArrayList<>(f.arguments().size());
      for (Expression a : f.arguments()) args.add(r(a));
      return f.name() + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visit(Arithmetic a) {
      int p = precedence(a);
      String left = wrap(a.left(), p);
      // right operand of a non-associative operator needs parentheses at equal precedence
      String right = wrap(a.right(), p + 1);
      if (a.operator() == ArithmeticOperator.CONCAT) return renderConcat(left, right);
      return left + " " + a.operator().symbol() + " " + right;
    }

    @Override
    public String visit(Cast c) {
      return "CAST(" + r(c.expression()) + " AS " + castType(c.type()) + ")";
    }

    @Override
    public String visit(IsNull n) {
      return wrap(n.expression(), PREC_PREDICATE + 1) + (n.negated() ? " IS NOT NULL" : " IS NULL");
    }

    @Override
    public String visit(InList in) {
      if (in.subquery() != null) {
        String left = wrap(in.expression(), PREC_PREDICATE + 1);
        return left + (in.negated() ? " NOT IN (" : " IN (") + renderStatement(in.subquery().statement(), ctx) + ")";
      }
      // empty list: constant predicate, no placeholders
      if (in.values().isEmpty()) return in.negated() ? "1 = 1" : "1 = 0";
      List<String> vals = new ArrayList<>(in.values().size());
      String left = wrap(in.expression(), PREC_PREDICATE + 1);
      for (Expression v : in.values()) vals.add(r(v));
      return left + (in.negated() ? " NOT IN (" : " IN (") + String.join(", ", vals) + ")";
    }

    @Override
    public String visit(Between b) {
      return wrap(b.expression(), PREC_PREDICATE + 1) + (b.negated() ? " NOT BETWEEN " : " BETWEEN ")
          + wrap(b.low(), PREC_PREDICATE + 1) + " AND " + wrap(b.high(), PREC_PREDICATE + 1);
    }

    @Override
    public String visit(Exists e) {
      return (e.negated() ? "NOT EXISTS (" : "EXISTS (") + renderStatement(e.subquery().statement(), ctx) + ")";
    }

    @Override
    public String visit(CaseWhen c) {
      StringBuilder sb = new StringBuilder("CASE");
      for (CaseWhen.Branch b : c.branches()) {
        sb.append(" WHEN ").append(r(b.when())).append(" THEN ").append(r(b.then()));
      }
      if (c.otherwise() != null) sb.append(" ELSE ").append(r(c.otherwise()));
      return sb.append(" END").toString();
    }

    @Override
    public String visit(Aliased a) {
      return r(a.expression()) + " AS " + formatIdentifier(a.alias());
    }

    @Override
    public String visit(Grouping g) {
      return renderGrouping(g, ctx);
    }

    @Override
    public String visit(Excluded e) {
      return formatExcluded(e.column());
    }
  }
}
