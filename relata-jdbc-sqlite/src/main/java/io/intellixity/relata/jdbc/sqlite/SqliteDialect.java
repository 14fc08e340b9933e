package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import io.intellixity.relata.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.RenderContext;
import io.intellixity.relata.statement.SelectStatement;
import io.intellixity.relata.statement.SetOperationStatement;
import io.intellixity.relata.statement.Statement;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * SQLite dialect implementation for JDBC.
 *
 * Capabilities follow the SQLite library version:\n
 * - CTE / recursive CTE since 3.8.3\n
 * - UPSERT (ON CONFLICT) since 3.24.0\n
 * - window functions since 3.25.0\n
 * - aggregate FILTER and NULLS FIRST/LAST since 3.30.0\n
 * - RETURNING since 3.35.0\n
 * - RIGHT / FULL OUTER JOIN since 3.39.0\n
 *
 * No row locking, ROLLUP, CUBE or GROUPING SETS. Compound SELECT operands cannot be parenthesized,
 * so operands with their own ORDER BY / LIMIT are wrapped as derived tables instead.
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "sqlite";
  /** Library version bundled with the sqlite-jdbc driver this module is built against. */
  public static final Version BUNDLED = new Version(3, 45, 1);

  private static final SqliteErrorTranslator ERRORS = new SqliteErrorTranslator();

  private final Version version;

  public SqliteDialect() {
    this(BUNDLED);
  }

  public SqliteDialect(Version version) {
    this(version, TypeRegistry.discover(ID));
  }

  public SqliteDialect(Version version, TypeRegistry types) {
    super(ID, types, capabilities(Objects.requireNonNull(version, "version")));
    this.version = version;
  }

  public Version version() { return version; }

  static Set<Capability> capabilities(Version v) {
    Set<Capability> caps = EnumSet.of(Capability.SAVEPOINT, Capability.INTERSECT, Capability.EXCEPT,
        Capability.OFFSET_WITHOUT_LIMIT);
    if (v.atLeast(3, 8, 3)) {
      caps.add(Capability.CTE);
      caps.add(Capability.RECURSIVE_CTE);
    }
    if (v.atLeast(3, 24, 0)) caps.add(Capability.UPSERT);
    if (v.atLeast(3, 25, 0)) caps.add(Capability.WINDOW_FUNCTIONS);
    if (v.atLeast(3, 30, 0)) {
      caps.add(Capability.FILTER_CLAUSE);
      caps.add(Capability.NULLS_ORDERING);
    }
    if (v.atLeast(3, 35, 0)) caps.add(Capability.RETURNING);
    if (v.atLeast(3, 39, 0)) {
      caps.add(Capability.RIGHT_JOIN);
      caps.add(Capability.FULL_OUTER_JOIN);
    }
    return caps;
  }

  @Override
  public JdbcErrorTranslator errorTranslator() {
    return ERRORS;
  }

  @Override
  public String lastInsertIdQuery() {
    return "SELECT last_insert_rowid()";
  }

  /** SQLite needs a LIMIT before OFFSET; -1 means unbounded. */
  @Override
  public String formatLimitOffset(Long limit, Long offset, RenderContext ctx) {
    if (limit == null && offset != null) {
      return " LIMIT -1 OFFSET " + ctx.bind(offset, LogicalType.BIGINT);
    }
    return super.formatLimitOffset(limit, offset, ctx);
  }

  /** SERIALIZABLE is the default; READ UNCOMMITTED applies to shared-cache connections only. */
  @Override
  public Set<IsolationLevel> supportedIsolationLevels() {
    return EnumSet.of(IsolationLevel.READ_UNCOMMITTED, IsolationLevel.SERIALIZABLE);
  }

  /** Compound operators share one precedence and apply left to right, so only tails and right nesting wrap. */
  @Override
  protected String renderSetOperand(Statement operand, SetOperationStatement parent, boolean leftmost, RenderContext ctx) {
    String sql = renderStatement(operand, ctx);
    boolean wrap;
    if (operand instanceof SelectStatement s) {
      wrap = !s.orderBy().isEmpty() || s.limit() != null || s.offset() != null
          || (s.with() != null && !s.with().isEmpty());
    } else {
      wrap = !leftmost || ((SetOperationStatement) operand).hasTail();
    }
    return wrap ? "SELECT * FROM (" + sql + ")" : sql;
  }

  @Override
  protected String explainPrefix() {
    return "EXPLAIN QUERY PLAN ";
  }

  /** SQLite library version, e.g. {@code 3.45.1}. */
  public record Version(int major, int minor, int patch) {
    public static Version parse(String text) {
      Objects.requireNonNull(text, "text");
      String[] parts = text.trim().split("\\.");
      try {
        int major = Integer.parseInt(parts[0]);
        int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
        int patch = parts.length > 2 ? Integer.parseInt(parts[2]) : 0;
        return new Version(major, minor, patch);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Not a SQLite version: " + text, e);
      }
    }

    public boolean atLeast(int major, int minor, int patch) {
      if (this.major != major) return this.major > major;
      if (this.minor != minor) return this.minor > minor;
      return this.patch >= patch;
    }

    @Override
    public String toString() {
      return major + "." + minor + "." + patch;
    }
  }
}
