package io.intellixity.relata.expression;

import java.util.Objects;

public record Between(Expression expression, Expression low, Expression high, boolean negated) implements Expression {
  public Between {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(low, "low");
    Objects.requireNonNull(high, "high");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
