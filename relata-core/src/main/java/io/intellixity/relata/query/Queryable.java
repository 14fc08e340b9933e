package io.intellixity.relata.query;

import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.statement.Statement;

/** A row-producing assembler that can be compiled, nested or combined with set operators. */
public interface Queryable {
  Dialect dialect();

  /** Immutable snapshot of the current builder state. */
  Statement statement();

  default SqlStatement toSql() {
    return dialect().compile(statement());
  }
}
