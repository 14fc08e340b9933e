package io.intellixity.relata.statement;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.StatementKind;

import java.util.List;
import java.util.Objects;

public record UpdateStatement(TableRef table, List<Assignment> assignments, Expression where,
                              List<Expression> returning) implements Statement {
  public UpdateStatement {
    Objects.requireNonNull(table, "table");
    assignments = List.copyOf(Objects.requireNonNull(assignments, "assignments"));
    if (assignments.isEmpty()) throw new QueryConstructionException(null, "SET", "UPDATE requires at least one assignment");
    returning = returning == null ? List.of() : List.copyOf(returning);
  }

  @Override
  public StatementKind kind() { return StatementKind.UPDATE; }
}
