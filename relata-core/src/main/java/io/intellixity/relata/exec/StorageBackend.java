package io.intellixity.relata.exec;

import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;

import java.util.List;
import java.util.function.Supplier;

/**
 * Synchronous execution contract over one connection.\n
 *
 * State: {@code DISCONNECTED -> CONNECTED -> IN_TRANSACTION (nested) -> CONNECTED -> DISCONNECTED}.
 * {@link #execute} and {@link #beginTransaction()} connect lazily. A backend is not safe for
 * concurrent callers; use one per thread or wrap it in {@link io.intellixity.relata.async.AsyncStorageBackend}.
 */
public interface StorageBackend extends AutoCloseable {
  Dialect dialect();

  ConnectionState state();

  void connect();

  /** Close the connection, rolling back any open transaction first. */
  void disconnect();

  QueryResult execute(SqlStatement statement, ExecutionOptions options);

  default QueryResult execute(SqlStatement statement) {
    return execute(statement, ExecutionOptions.defaults());
  }

  /** Raw SQL in the dialect's placeholder style, with driver-ready params. */
  default QueryResult execute(String sql, List<?> params, ExecutionOptions options) {
    return execute(SqlStatement.of(sql, params), options);
  }

  default QueryResult execute(String sql, List<?> params) {
    return execute(sql, params, ExecutionOptions.defaults());
  }

  /** Begin a transaction, or a savepoint when one is already open. */
  void beginTransaction();

  /** Begin a transaction with an isolation level; only valid at nesting level 0. */
  void beginTransaction(IsolationLevel level);

  void commit();

  void rollback();

  /** 0 when no transaction is open, 1 for a top-level transaction, +1 per savepoint. */
  int transactionLevel();

  default boolean inTransaction() { return transactionLevel() > 0; }

  /**
   * Isolation level for the current transaction (if nothing executed in it yet) or the next one.
   * Rejected with a transaction error once statements have run or when the dialect lacks the level.
   */
  void setIsolationLevel(IsolationLevel level);

  <T> T inTx(Propagation propagation, Supplier<T> work);

  default <T> T inTx(Supplier<T> work) {
    return inTx(Propagation.REQUIRED, work);
  }

  /** Abort the statement in flight, if any. Safe to call from another thread. */
  void cancel();

  @Override
  default void close() {
    disconnect();
  }
}
