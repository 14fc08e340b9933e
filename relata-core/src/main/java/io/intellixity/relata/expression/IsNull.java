package io.intellixity.relata.expression;

import java.util.Objects;

public record IsNull(Expression expression, boolean negated) implements Expression {
  public IsNull {
    Objects.requireNonNull(expression, "expression");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
