package io.intellixity.relata.expression;

import io.intellixity.relata.statement.Statement;

import java.util.Objects;

/** Nested statement used as a table source (with alias), an IN list, EXISTS operand or scalar. */
public record Subquery(Statement statement, String alias) implements Expression {
  public Subquery {
    Objects.requireNonNull(statement, "statement");
    alias = Identifiers.optional(alias, "alias");
  }

  public Subquery as(String alias) { return new Subquery(statement, alias); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
