package io.intellixity.relata.statement;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Identifiers;
import io.intellixity.relata.expression.TableRef;
import io.intellixity.relata.sql.StatementKind;

import java.util.List;
import java.util.Objects;

/**
 * Multi-row {@code INSERT INTO table (columns) VALUES (...), (...) [upsert] [RETURNING ...]}.
 * {@code onConflict} is null for a plain insert.
 */
public record InsertStatement(TableRef table, List<String> columns, List<List<Expression>> rows,
                              List<Expression> returning, OnConflict onConflict) implements Statement {
  public InsertStatement {
    Objects.requireNonNull(table, "table");
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    for (String c : columns) Identifiers.require(c, "column");
    rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    returning = returning == null ? List.of() : List.copyOf(returning);
    if (columns.isEmpty() || rows.isEmpty()) {
      throw new QueryConstructionException(null, "INSERT", "INSERT requires at least one column and one row");
    }
    for (List<Expression> r : rows) {
      if (r.size() != columns.size()) {
        throw new QueryConstructionException(null, "INSERT",
            "row has " + r.size() + " values, expected " + columns.size());
      }
    }
  }

  public InsertStatement(TableRef table, List<String> columns, List<List<Expression>> rows, List<Expression> returning) {
    this(table, columns, rows, returning, null);
  }

  @Override
  public StatementKind kind() { return StatementKind.INSERT; }
}
