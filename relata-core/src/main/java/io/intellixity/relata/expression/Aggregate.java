package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.Objects;

/**
 * Aggregate call. A null argument means {@code *} (only valid for COUNT); {@code filter} renders as
 * {@code FILTER (WHERE ...)} and needs the FILTER_CLAUSE capability.
 */
public record Aggregate(AggregateFunction function, Expression argument, boolean distinct, Expression filter)
    implements Expression {
  public Aggregate {
    Objects.requireNonNull(function, "function");
    if (argument == null && function != AggregateFunction.COUNT) {
      throw new QueryConstructionException(null, function.name(),
          function + " requires an argument");
    }
  }

  public Aggregate filter(Expression condition) {
    return new Aggregate(function, argument, distinct, Objects.requireNonNull(condition, "condition"));
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
