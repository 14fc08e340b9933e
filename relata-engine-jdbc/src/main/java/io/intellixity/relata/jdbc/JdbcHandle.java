package io.intellixity.relata.jdbc;

import javax.sql.DataSource;
import java.util.Objects;

/** A named {@link DataSource} plus the schema backends switch to after connecting. */
public final class JdbcHandle implements AutoCloseable {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  public String id() { return id; }
  public DataSource client() { return client; }
  public String schema() { return schema; }

  /** Closes the data source when it owns resources (e.g. a pool). */
  @Override
  public void close() {
    if (client instanceof AutoCloseable c) {
      try {
        c.close();
      } catch (Exception e) {
        throw new IllegalStateException("Failed to close data source for handle " + id, e);
      }
    }
  }
}
