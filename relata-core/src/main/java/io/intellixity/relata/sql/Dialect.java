package io.intellixity.relata.sql;

import io.intellixity.relata.error.UnsupportedCapabilityException;
import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.OrderTerm;
import io.intellixity.relata.expression.WindowFrame;
import io.intellixity.relata.statement.LockMode;
import io.intellixity.relata.statement.SetOperator;
import io.intellixity.relata.statement.Statement;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;

import java.util.List;
import java.util.Set;

/**
 * Backend-specific SQL strategy.\n
 *
 * Expressions define structure; a dialect generates syntax. Implementations are stateless and
 * safe to share across threads, and rendering is a pure function: the same statement always
 * compiles to the same {@link SqlStatement}.
 */
public interface Dialect {
  String id();

  boolean supports(Capability capability);

  /** Fail fast with a capability error when {@code capability} is missing. */
  default void require(Capability capability, String clause) {
    if (!supports(capability)) throw new UnsupportedCapabilityException(id(), capability, clause);
  }

  TypeRegistry types();

  PlaceholderStyle placeholderStyle();

  /** Quote one identifier, escaping embedded quote characters. */
  String formatIdentifier(String name);

  /** Quote and optionally qualify a column reference; {@code table} may be null. */
  String formatColumnReference(String table, String column);

  String formatLiteralPlaceholder(int position1Based);

  /** LIMIT/OFFSET tail (leading space included) or empty; values are bound through {@code ctx}. */
  String formatLimitOffset(Long limit, Long offset, RenderContext ctx);

  /** RETURNING tail (leading space included) or empty when {@code columns} is empty. */
  String formatReturningClause(List<Expression> columns, RenderContext ctx);

  /** One CTE definition: {@code name(cols) AS (body)}. */
  String formatCte(String name, boolean recursive, List<String> columns, String body);

  /** Window clause: {@code OVER (PARTITION BY ... ORDER BY ... frame)}. */
  String formatWindow(List<Expression> partitionBy, List<OrderTerm> orderBy, WindowFrame frame, RenderContext ctx);

  /** Set operator keyword(s) with surrounding spaces, e.g. {@code " UNION ALL "}. */
  String formatSetOperation(SetOperator operator, boolean all);

  /** Row lock tail (leading space included) or empty for {@link LockMode#NONE}. */
  String formatLockClause(LockMode mode);

  default String nativeColumnType(LogicalType type) {
    return types().nativeType(type);
  }

  Set<IsolationLevel> supportedIsolationLevels();

  String savepointSql(String name);

  String releaseSavepointSql(String name);

  String rollbackToSavepointSql(String name);

  /** Render a standalone expression; placeholders are numbered from 1. */
  SqlFragment render(Expression expression);

  SqlStatement compile(Statement statement);

  /** Query-plan statement for an already compiled SELECT. */
  SqlStatement explain(SqlStatement statement);
}
