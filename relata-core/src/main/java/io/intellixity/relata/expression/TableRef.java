package io.intellixity.relata.expression;

/** Base table, optionally schema-qualified and aliased. */
public record TableRef(String schema, String name, String alias) implements Expression {
  public TableRef {
    schema = Identifiers.optional(schema, "schema");
    name = Identifiers.require(name, "table");
    alias = Identifiers.optional(alias, "alias");
  }

  public static TableRef of(String name) { return new TableRef(null, name, null); }

  public TableRef as(String alias) { return new TableRef(schema, name, alias); }

  /** Name other clauses qualify columns with. */
  public String reference() { return alias != null ? alias : name; }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
