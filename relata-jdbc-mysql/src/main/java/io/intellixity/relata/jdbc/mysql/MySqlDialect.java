package io.intellixity.relata.jdbc.mysql;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Grouping;
import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import io.intellixity.relata.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.RenderContext;
import io.intellixity.relata.statement.InsertStatement;
import io.intellixity.relata.statement.LockMode;
import io.intellixity.relata.statement.OnConflict;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * MySQL dialect implementation for JDBC.
 *
 * - backtick identifiers, {@code ?} placeholders\n
 * - CTE, recursive CTE and window functions since 8.0; INTERSECT / EXCEPT since 8.0.31\n
 * - no RETURNING, FULL OUTER JOIN, aggregate FILTER or NULLS FIRST/LAST\n
 * - OFFSET requires LIMIT\n
 * - ROLLUP only as a whole-clause {@code GROUP BY a, b WITH ROLLUP}; no CUBE or GROUPING SETS\n
 * - upserts render {@code ON DUPLICATE KEY UPDATE}, which fires on any unique key\n
 * - {@code ||} is logical OR unless PIPES_AS_CONCAT is set, so concatenation renders CONCAT()\n
 */
public final class MySqlDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "mysql";
  /** Row alias for the proposed values; {@code VALUES(col)} is deprecated from 8.0.20. */
  static final String NEW_ROW = "relata_new";
  public static final Version DEFAULT_VERSION = new Version(8, 0, 36);

  private static final MySqlErrorTranslator ERRORS = new MySqlErrorTranslator();

  private final Version version;

  public MySqlDialect() {
    this(DEFAULT_VERSION);
  }

  public MySqlDialect(Version version) {
    this(version, TypeRegistry.discover(ID));
  }

  public MySqlDialect(Version version, TypeRegistry types) {
    super(ID, types, capabilities(Objects.requireNonNull(version, "version")));
    this.version = version;
  }

  public Version version() { return version; }

  static Set<Capability> capabilities(Version v) {
    Set<Capability> caps = EnumSet.of(Capability.SAVEPOINT, Capability.ROW_LOCKING, Capability.RIGHT_JOIN,
        Capability.ROLLUP, Capability.UPSERT);
    if (v.atLeast(8, 0, 0)) {
      caps.add(Capability.CTE);
      caps.add(Capability.RECURSIVE_CTE);
      caps.add(Capability.WINDOW_FUNCTIONS);
    }
    if (v.atLeast(8, 0, 31)) {
      caps.add(Capability.INTERSECT);
      caps.add(Capability.EXCEPT);
    }
    return caps;
  }

  @Override
  public JdbcErrorTranslator errorTranslator() {
    return ERRORS;
  }

  @Override
  public boolean useGeneratedKeys() {
    return true;
  }

  @Override
  public String formatIdentifier(String name) {
    return "`" + name.replace("`", "``") + "`";
  }

  @Override
  public String formatLockClause(LockMode mode) {
    if (mode == LockMode.FOR_SHARE && !version.atLeast(8, 0, 0)) {
      require(Capability.ROW_LOCKING, "FOR SHARE");
      return " LOCK IN SHARE MODE";
    }
    return super.formatLockClause(mode);
  }

  @Override
  protected String castType(LogicalType type) {
    switch (type) {
      case BOOLEAN:
      case INTEGER:
      case BIGINT:
        return "SIGNED";
      case REAL: return "DOUBLE";
      case DECIMAL: return "DECIMAL(65,30)";
      case BLOB: return "BINARY";
      case DATE: return "DATE";
      case TIME: return "TIME(6)";
      case TIMESTAMP: return "DATETIME(6)";
      case JSON: return "JSON";
      default: return "CHAR";
    }
  }

  @Override
  protected String renderGroupBy(List<Expression> groupBy, RenderContext ctx) {
    if (groupBy.size() == 1 && groupBy.get(0) instanceof Grouping g && g.kind() == Grouping.Kind.ROLLUP) {
      require(Capability.ROLLUP, "ROLLUP");
      return list(g.columns(), ctx) + " WITH ROLLUP";
    }
    return super.renderGroupBy(groupBy, ctx);
  }

  @Override
  protected String renderGrouping(Grouping g, RenderContext ctx) {
    if (g.kind() == Grouping.Kind.ROLLUP) {
      throw new QueryConstructionException(ID, "ROLLUP", "ROLLUP must be the only GROUP BY element on mysql");
    }
    return super.renderGrouping(g, ctx);
  }

  @Override
  protected String renderOnConflict(InsertStatement ins, RenderContext ctx) {
    OnConflict oc = ins.onConflict();
    if (oc == null) return "";
    require(Capability.UPSERT, "ON DUPLICATE KEY UPDATE");
    if (oc.where() != null) {
      throw new QueryConstructionException(ID, "ON DUPLICATE KEY UPDATE",
          "conditional upsert is not supported on mysql; use a CASE expression in the assignment");
    }
    if (oc.doNothing()) {
      // self-assignment leaves the row untouched
      String c = formatIdentifier(oc.target().isEmpty() ? ins.columns().get(0) : oc.target().get(0));
      return " ON DUPLICATE KEY UPDATE " + c + " = " + c;
    }
    String alias = rowAlias() ? " AS " + formatIdentifier(NEW_ROW) : "";
    return alias + " ON DUPLICATE KEY UPDATE " + assignments(oc.updates(), ctx);
  }

  @Override
  protected String formatExcluded(String column) {
    return rowAlias()
        ? formatIdentifier(NEW_ROW) + "." + formatIdentifier(column)
        : "VALUES(" + formatIdentifier(column) + ")";
  }

  private boolean rowAlias() {
    return version.atLeast(8, 0, 19);
  }

  @Override
  protected String renderConcat(String left, String right) {
    return "CONCAT(" + left + ", " + right + ")";
  }

  /** Server version, e.g. {@code 8.0.36}. */
  public record Version(int major, int minor, int patch) {
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
