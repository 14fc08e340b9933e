package io.intellixity.relata.expression;

/** Reference to a CTE by name, usable wherever a table source is. */
public record CteRef(String name, String alias) implements Expression {
  public CteRef {
    name = Identifiers.require(name, "cte");
    alias = Identifiers.optional(alias, "alias");
  }

  public CteRef as(String alias) { return new CteRef(name, alias); }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
