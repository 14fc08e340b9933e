package io.intellixity.relata.expression;

import io.intellixity.relata.types.LogicalType;

import java.util.Objects;

/** A value. Always rendered as a placeholder; the value travels in the parameter list. */
public record Literal(Object value, LogicalType type) implements Expression {
  public Literal {
    Objects.requireNonNull(type, "type");
  }

  public static Literal of(Object value) {
    return new Literal(value, LogicalType.infer(value));
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    return "Literal[type=" + type + "]";
  }
}
