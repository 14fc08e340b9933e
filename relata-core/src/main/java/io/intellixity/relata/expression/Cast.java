package io.intellixity.relata.expression;

import io.intellixity.relata.types.LogicalType;

import java.util.Objects;

/** {@code CAST(expr AS native)}; the native type name comes from the dialect's type registry. */
public record Cast(Expression expression, LogicalType type) implements Expression {
  public Cast {
    Objects.requireNonNull(expression, "expression");
    Objects.requireNonNull(type, "type");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
