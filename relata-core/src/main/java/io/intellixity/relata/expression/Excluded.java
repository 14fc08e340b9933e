package io.intellixity.relata.expression;

/** The value an upsert tried to insert into {@code column}, usable in its update assignments. */
public record Excluded(String column) implements Expression {
  public Excluded {
    Identifiers.require(column, "column");
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
