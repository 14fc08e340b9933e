package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.List;
import java.util.Objects;

/** AND / OR over one or more children, or NOT over exactly one. */
public record Logical(LogicalOperator operator, List<Expression> children) implements Expression {
  public Logical {
    Objects.requireNonNull(operator, "operator");
    children = List.copyOf(Objects.requireNonNull(children, "children"));
    if (children.isEmpty()) {
      throw new QueryConstructionException(null, operator.name(), operator + " requires at least one operand");
    }
    if (operator == LogicalOperator.NOT && children.size() != 1) {
      throw new QueryConstructionException(null, "NOT", "NOT takes exactly one operand");
    }
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
