package io.intellixity.relata.statement;

import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.StatementKind;

import java.util.List;
import java.util.Objects;

public record DeleteStatement(TableRef table, Expression where, List<Expression> returning) implements Statement {
  public DeleteStatement {
    Objects.requireNonNull(table, "table");
    returning = returning == null ? List.of() : List.copyOf(returning);
  }

  @Override
  public StatementKind kind() { return StatementKind.DELETE; }
}
