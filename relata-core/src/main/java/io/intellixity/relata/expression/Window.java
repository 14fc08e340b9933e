package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.List;
import java.util.Objects;

/** {@code function OVER (PARTITION BY ... ORDER BY ... frame)}; needs WINDOW_FUNCTIONS. */
public record Window(Expression function, List<Expression> partitionBy, List<OrderTerm> orderBy, WindowFrame frame)
    implements Expression {
  public Window {
    Objects.requireNonNull(function, "function");
    if (!(function instanceof Aggregate) && !(function instanceof FunctionCall)) {
      throw new QueryConstructionException(null, "OVER", "window function must be an aggregate or function call");
    }
    partitionBy = partitionBy == null ? List.of() : List.copyOf(partitionBy);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public Window partitionBy(Expression... expressions) {
    return new Window(function, List.of(expressions), orderBy, frame);
  }

  public Window orderBy(OrderTerm... terms) {
    return new Window(function, partitionBy, List.of(terms), frame);
  }

  public Window frame(WindowFrame frame) {
    return new Window(function, partitionBy, orderBy, frame);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
