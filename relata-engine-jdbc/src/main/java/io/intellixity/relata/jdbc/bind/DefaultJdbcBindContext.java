package io.intellixity.relata.jdbc.bind;

import io.intellixity.relata.sql.StatementKind;

public record DefaultJdbcBindContext(
    String dialectId,
    StatementKind statementKind,
    int position1Based
) implements JdbcBindContext {
  public DefaultJdbcBindContext {
    if (statementKind == null) throw new IllegalArgumentException("statementKind is required");
    if (position1Based <= 0) throw new IllegalArgumentException("position1Based must be >= 1");
  }
}
