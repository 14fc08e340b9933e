package io.intellixity.relata.expression;

/** Column reference, optionally qualified by a table (or alias) and optionally aliased. */
public record Column(String table, String name, String alias) implements Expression {
  public Column {
    table = Identifiers.optional(table, "table");
    name = Identifiers.require(name, "column");
    alias = Identifiers.optional(alias, "alias");
  }

  public Column as(String alias) { return new Column(table, name, alias); }

  /** The name rows are keyed by: the alias when present, else the column name. */
  public String label() { return alias != null ? alias : name; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
