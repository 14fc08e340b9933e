package io.intellixity.relata.expression;

import java.util.Objects;

/** ORDER BY item. {@code nulls} is null when the backend default applies. */
public record OrderTerm(Expression expression, Direction direction, NullOrdering nulls) {
  public OrderTerm {
    Objects.requireNonNull(expression, "expression");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static OrderTerm asc(Expression e) { return new OrderTerm(e, Direction.ASC, null); }
  public static OrderTerm desc(Expression e) { return new OrderTerm(e, Direction.DESC, null); }

  public OrderTerm nullsFirst() { return new OrderTerm(expression, direction, NullOrdering.FIRST); }
  public OrderTerm nullsLast() { return new OrderTerm(expression, direction, NullOrdering.LAST); }

  public enum Direction { ASC, DESC }

  public enum NullOrdering { FIRST, LAST }
}
