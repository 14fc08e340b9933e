package io.intellixity.relata.jdbc.postgres;

import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import io.intellixity.relata.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.relata.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.PlaceholderStyle;
import io.intellixity.relata.types.TypeRegistry;

import java.util.EnumSet;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides: {@code $n} placeholders and error translation.\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}; every capability is supported.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public static final String ID = "postgres";

  private static final PostgresErrorTranslator ERRORS = new PostgresErrorTranslator();

  public PostgresDialect() {
    this(TypeRegistry.discover(ID));
  }

  public PostgresDialect(TypeRegistry types) {
    super(ID, types, EnumSet.allOf(Capability.class));
  }

  @Override
  public PlaceholderStyle placeholderStyle() {
    return PlaceholderStyle.NUMBERED;
  }

  @Override
  public JdbcErrorTranslator errorTranslator() {
    return ERRORS;
  }
}
