package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.List;
import java.util.Objects;

/** {@code expr [NOT] IN (values...)} or {@code expr [NOT] IN (subquery)}; exactly one of the two is set. */
public record InList(Expression expression, List<Expression> values, Subquery subquery, boolean negated)
    implements Expression {
  public InList {
    Objects.requireNonNull(expression, "expression");
    if ((values == null) == (subquery == null)) {
      throw new QueryConstructionException(null, "IN", "IN takes either a value list or a subquery");
    }
    values = values == null ? null : List.copyOf(values);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
