package io.intellixity.relata.expression;

import java.util.Objects;

public record Comparison(Expression left, ComparisonOperator operator, Expression right) implements Expression {
  public Comparison {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
