package io.intellixity.relata.expression;

import java.util.List;

/** Scalar or window function by name, e.g. {@code LOWER(x)} or {@code ROW_NUMBER()}. */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {
  public FunctionCall {
    name = Identifiers.function(name);
    arguments = arguments == null ? List.of() : List.copyOf(arguments);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
