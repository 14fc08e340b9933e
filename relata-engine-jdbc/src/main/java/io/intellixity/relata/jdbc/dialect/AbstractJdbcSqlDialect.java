package io.intellixity.relata.jdbc.dialect;

import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import io.intellixity.relata.spi.sql.AbstractSqlDialect;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.types.TypeRegistry;

import java.util.Set;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Rendering comes from {@link AbstractSqlDialect}; DB-specific dialects override its hooks for
 * quoting, paging, casts and set-operation operands, and supply their own error translator.\n
 */
public abstract class AbstractJdbcSqlDialect extends AbstractSqlDialect implements JdbcDialect {
  private static final JdbcErrorTranslator STANDARD = new JdbcErrorTranslator();

  protected AbstractJdbcSqlDialect(String id, TypeRegistry types, Set<Capability> capabilities) {
    super(id, types, capabilities);
  }

  @Override
  public JdbcErrorTranslator errorTranslator() {
    return STANDARD;
  }
}
