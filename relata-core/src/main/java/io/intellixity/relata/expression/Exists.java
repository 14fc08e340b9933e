package io.intellixity.relata.expression;

import java.util.Objects;

public record Exists(Subquery subquery, boolean negated) implements Expression {
  public Exists {
    Objects.requireNonNull(subquery, "subquery");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
