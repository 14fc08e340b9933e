package io.intellixity.relata.statement;

import io.intellixity.relata.expression.OrderTerm;
import io.intellixity.relata.sql.StatementKind;

import java.util.List;
import java.util.Objects;

/** {@code left op [ALL] right [ORDER BY ...] [LIMIT/OFFSET]}; operands may nest. */
public record SetOperationStatement(
    Statement left,
    SetOperator operator,
    boolean all,
    Statement right,
    List<OrderTerm> orderBy,
    Long limit,
    Long offset
) implements Statement {
  public SetOperationStatement {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(right, "right");
    if (!(left instanceof SelectStatement || left instanceof SetOperationStatement)
        || !(right instanceof SelectStatement || right instanceof SetOperationStatement)) {
      throw new IllegalArgumentException("set operation operands must be queries");
    }
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
  }

  public SetOperationStatement(Statement left, SetOperator operator, boolean all, Statement right) {
    this(left, operator, all, right, List.of(), null, null);
  }

  /** Whether an outer ORDER BY / LIMIT / OFFSET is attached. */
  public boolean hasTail() {
    return !orderBy.isEmpty() || limit != null || offset != null;
  }

  @Override
  public StatementKind kind() { return StatementKind.SELECT; }
}
