package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.jdbc.JdbcHandle;
import io.intellixity.relata.jdbc.JdbcStorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/** Entry points for file-backed SQLite backends. Foreign keys are enforced on every connection. */
public final class SqliteBackends {
  private static final Logger log = LoggerFactory.getLogger(SqliteBackends.class);

  private SqliteBackends() {}

  public static JdbcHandle handle(Path file) {
    Objects.requireNonNull(file, "file");
    SQLiteConfig config = new SQLiteConfig();
    config.enforceForeignKeys(true);
    SQLiteDataSource ds = new SQLiteDataSource(config);
    ds.setUrl("jdbc:sqlite:" + file.toAbsolutePath());
    return new JdbcHandle("sqlite:" + file.getFileName(), ds, null);
  }

  /** Backend whose dialect matches the SQLite library the driver actually loads. */
  public static JdbcStorageBackend open(Path file) {
    JdbcHandle handle = handle(file);
    return new JdbcStorageBackend(detect(handle), handle);
  }

  public static JdbcStorageBackend open(Path file, SqliteDialect dialect) {
    return new JdbcStorageBackend(dialect, handle(file));
  }

  public static SqliteDialect detect(JdbcHandle handle) {
    try (Connection c = handle.client().getConnection()) {
      SqliteDialect.Version v = SqliteDialect.Version.parse(c.getMetaData().getDatabaseProductVersion());
      log.debug("relata.sqlite version={} handleId={}", v, handle.id());
      return new SqliteDialect(v);
    } catch (SQLException e) {
      throw new SqliteErrorTranslator().translateConnect(SqliteDialect.ID, e);
    }
  }
}
