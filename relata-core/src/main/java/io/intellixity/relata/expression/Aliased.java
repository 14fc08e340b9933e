package io.intellixity.relata.expression;

import java.util.Objects;

/** Select-list item with an output name: {@code expr AS alias}. */
public record Aliased(Expression expression, String alias) implements Expression {
  public Aliased {
    Objects.requireNonNull(expression, "expression");
    alias = Identifiers.require(alias, "alias");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
