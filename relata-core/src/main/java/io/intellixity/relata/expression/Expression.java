package io.intellixity.relata.expression;

import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlFragment;

/**
 * Immutable unit of query structure.\n
 *
 * Nodes never carry SQL text. Rendering is delegated to a {@link Dialect}, which receives the node
 * through {@link #accept(ExpressionVisitor)}.
 */
public interface Expression {
  <R> R accept(ExpressionVisitor<R> visitor);

  default SqlFragment render(Dialect dialect) {
    return dialect.render(this);
  }
}
