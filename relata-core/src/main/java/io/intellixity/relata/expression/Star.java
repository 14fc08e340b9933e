package io.intellixity.relata.expression;

/** {@code *} or {@code table.*}. */
public record Star(String table) implements Expression {
  public Star {
    table = Identifiers.optional(table, "table");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
