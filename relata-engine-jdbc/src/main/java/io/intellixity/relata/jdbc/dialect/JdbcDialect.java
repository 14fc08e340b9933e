package io.intellixity.relata.jdbc.dialect;

import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import io.intellixity.relata.sql.Dialect;

/** Dialect for JDBC backends: rendering plus the driver-facing details the backend needs. */
public interface JdbcDialect extends Dialect {
  JdbcErrorTranslator errorTranslator();

  /** Whether INSERTs without RETURNING should ask the driver for generated keys. */
  default boolean useGeneratedKeys() { return false; }

  /** Query that reports the last inserted row id on the same connection, or null. */
  default String lastInsertIdQuery() { return null; }
}
