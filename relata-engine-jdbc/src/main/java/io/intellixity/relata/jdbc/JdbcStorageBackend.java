package io.intellixity.relata.jdbc;

import io.intellixity.relata.error.QueryExecutionException;
import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.jdbc.bind.DefaultJdbcBindContext;
import io.intellixity.relata.jdbc.dialect.JdbcDialect;
import io.intellixity.relata.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.relata.spi.exec.AbstractStorageBackend;
import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.sql.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link io.intellixity.relata.exec.StorageBackend} over one JDBC {@link Connection}.\n
 *
 * - The connection is borrowed from the handle's {@link DataSource} on connect and returned on
 *   disconnect.\n
 * - Outside transactions the connection runs in autocommit mode.\n
 * - Binds go through the {@link DiscoveredBinderRegistry}; {@link SQLException}s are translated by
 *   the dialect's {@link JdbcErrorTranslator} and never escape.\n
 */
public final class JdbcStorageBackend extends AbstractStorageBackend {
  private static final Logger log = LoggerFactory.getLogger(JdbcStorageBackend.class);

  private final JdbcDialect dialect;
  private final JdbcHandle handle;
  private final DiscoveredBinderRegistry binders;

  private Connection conn;
  private int defaultIsolation = -1;
  private volatile Statement current;

  public JdbcStorageBackend(JdbcDialect dialect, JdbcHandle handle) {
    this(dialect, handle, new DiscoveredBinderRegistry(dialect.id()));
  }

  public JdbcStorageBackend(JdbcDialect dialect, DataSource dataSource) {
    this(dialect, new JdbcHandle("jdbc:" + dialect.id(), dataSource, null));
  }

  public JdbcStorageBackend(JdbcDialect dialect, JdbcHandle handle, DiscoveredBinderRegistry binders) {
    super(dialect);
    this.dialect = dialect;
    this.handle = Objects.requireNonNull(handle, "handle");
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  public JdbcHandle handle() { return handle; }

  @Override
  protected void doConnect() {
    try {
      Connection c = handle.client().getConnection();
      try {
        c.setAutoCommit(true);
        if (handle.schema() != null) c.setSchema(handle.schema());
        defaultIsolation = c.getTransactionIsolation();
      } catch (SQLException e) {
        closeAfterFailure(c, e);
        throw e;
      }
      conn = c;
      log.debug("relata.jdbc connect handleId={} schema={} dialect={}", handle.id(), handle.schema(), dialect.id());
    } catch (SQLException e) {
      throw dialect.errorTranslator().translateConnect(dialect.id(), e);
    }
  }

  @Override
  protected void doDisconnect() {
    Connection c = conn;
    conn = null;
    if (c == null) return;
    try {
      c.close();
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  @Override
  protected void doBegin(IsolationLevel isolation) {
    try {
      if (isolation != null) conn.setTransactionIsolation(isolation.jdbcLevel());
      conn.setAutoCommit(false);
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  @Override
  protected void doCommit() {
    try {
      conn.commit();
      endTransaction();
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  @Override
  protected void doRollback() {
    try {
      conn.rollback();
      endTransaction();
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  private void endTransaction() throws SQLException {
    conn.setAutoCommit(true);
    if (defaultIsolation >= 0 && conn.getTransactionIsolation() != defaultIsolation) {
      conn.setTransactionIsolation(defaultIsolation);
    }
  }

  @Override
  protected void doSetIsolation(IsolationLevel isolation) {
    try {
      conn.setTransactionIsolation(isolation.jdbcLevel());
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  @Override
  protected void doExecuteControl(String sql) {
    log.debug("relata.jdbc control handleId={} sql={}", handle.id(), sql);
    try (Statement st = conn.createStatement()) {
      st.execute(sql);
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    }
  }

  @Override
  protected QueryResult doExecute(SqlStatement ss, ExecutionOptions options) {
    JdbcPlaceholderCompiler.Compiled compiled =
        JdbcPlaceholderCompiler.compile(ss.sql(), ss.binds(), dialect.placeholderStyle());
    boolean generatedKeys = ss.kind() == StatementKind.INSERT && !ss.returnsRows() && dialect.useGeneratedKeys();
    long start = System.nanoTime();

    try (PreparedStatement ps = generatedKeys
        ? conn.prepareStatement(compiled.sql(), Statement.RETURN_GENERATED_KEYS)
        : conn.prepareStatement(compiled.sql())) {
      current = ps;
      applyTimeout(ps, options.timeout());
      bindAll(ps, ss.kind(), compiled.binds());

      if (ss.returnsRows()) {
        try (ResultSet rs = ps.executeQuery()) {
          List<Map<String, Object>> rows = reader(options).readAll(rs);
          return QueryResult.ofRows(rows, elapsed(start));
        }
      }
      if (ss.kind() == StatementKind.OTHER) {
        if (ps.execute()) {
          try (ResultSet rs = ps.getResultSet()) {
            return QueryResult.ofRows(reader(options).readAll(rs), elapsed(start));
          }
        }
        return QueryResult.ofUpdate(Math.max(ps.getUpdateCount(), 0), null, elapsed(start));
      }

      long n = ps.executeUpdate();
      Object lastId = null;
      if (ss.kind() == StatementKind.INSERT && n > 0) {
        lastId = generatedKeys ? generatedKey(ps) : lastInsertId();
      }
      return QueryResult.ofUpdate(n, lastId, elapsed(start));
    } catch (SQLException e) {
      throw dialect.errorTranslator().translate(dialect.id(), e);
    } finally {
      current = null;
    }
  }

  @Override
  protected void doCancel() {
    Statement st = current;
    if (st == null) return;
    try {
      st.cancel();
    } catch (SQLException e) {
      throw new QueryExecutionException(dialect.id(), "failed to cancel statement", e);
    }
  }

  private void bindAll(PreparedStatement ps, StatementKind kind, List<Bind> binds) {
    for (int i = 0; i < binds.size(); i++) {
      binders.bind(ps, new DefaultJdbcBindContext(dialect.id(), kind, i + 1), binds.get(i));
    }
  }

  private JdbcRowReader reader(ExecutionOptions options) {
    return new JdbcRowReader(dialect.types(), options.columnTypes());
  }

  private static void applyTimeout(PreparedStatement ps, Duration timeout) throws SQLException {
    if (timeout == null) return;
    // JDBC timeouts are whole seconds; round up so short timeouts are not disabled
    long seconds = Math.max(1, (timeout.toMillis() + 999) / 1000);
    ps.setQueryTimeout((int) Math.min(seconds, Integer.MAX_VALUE));
  }

  private static Object generatedKey(PreparedStatement ps) throws SQLException {
    try (ResultSet keys = ps.getGeneratedKeys()) {
      return keys.next() ? JdbcRowReader.normalize(keys.getObject(1)) : null;
    }
  }

  private Object lastInsertId() throws SQLException {
    String sql = dialect.lastInsertIdQuery();
    if (sql == null) return null;
    try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery(sql)) {
      return rs.next() ? rs.getObject(1) : null;
    }
  }

  private static Duration elapsed(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private static void closeAfterFailure(Connection c, SQLException primary) {
    try {
      c.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }
}
