package io.intellixity.relata.spi.exec;

import io.intellixity.relata.error.QueryCancelledException;
import io.intellixity.relata.error.QueryTimeoutException;
import io.intellixity.relata.error.RelataException;
import io.intellixity.relata.error.TransactionException;
import io.intellixity.relata.exec.*;
import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.sql.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Template-method backend over one connection.\n
 *
 * Responsibilities:\n
 * - Connection state machine with lazy connect on execute / begin\n
 * - Transaction nesting through savepoints named {@code sp_N}\n
 * - Isolation level policy (before the first statement of a transaction only)\n
 * - DDL policy: no DDL inside an open transaction unless the caller opts in\n
 * - Timeout / cancellation: the open transaction is rolled back before the error surfaces\n
 * - Propagation scoping via {@link #inTx(Propagation, Supplier)}\n
 *
 * Backends implement the {@code do*} hooks; they raise {@link RelataException}s, never driver
 * exceptions.
 */
public abstract class AbstractStorageBackend implements StorageBackend {
  private static final Logger log = LoggerFactory.getLogger(AbstractStorageBackend.class);

  private final Dialect dialect;
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private int level;
  private final Deque<String> savepoints = new ArrayDeque<>();
  private IsolationLevel pendingIsolation;
  private boolean executedInTx;
  private volatile boolean executing;
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  protected AbstractStorageBackend(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  // --- backend hooks ---

  protected abstract void doConnect();

  protected abstract void doDisconnect();

  /** Open a top-level transaction, applying {@code isolation} first when non-null. */
  protected abstract void doBegin(IsolationLevel isolation);

  protected abstract void doCommit();

  protected abstract void doRollback();

  /** Change the isolation level of the open transaction; nothing has executed in it yet. */
  protected abstract void doSetIsolation(IsolationLevel isolation);

  /** Run savepoint / control SQL without binds. */
  protected abstract void doExecuteControl(String sql);

  protected abstract QueryResult doExecute(SqlStatement statement, ExecutionOptions options);

  /** Abort the in-flight statement; called from an arbitrary thread. */
  protected abstract void doCancel();

  // --- state ---

  @Override public final Dialect dialect() { return dialect; }
  @Override public final synchronized ConnectionState state() { return state; }
  @Override public final synchronized int transactionLevel() { return level; }

  @Override
  public final synchronized void connect() {
    if (state != ConnectionState.DISCONNECTED) return;
    doConnect();
    state = ConnectionState.CONNECTED;
    log.debug("relata.exec connected dialect={}", dialect.id());
  }

  @Override
  public final synchronized void disconnect() {
    if (state == ConnectionState.DISCONNECTED) return;
    RuntimeException failure = null;
    if (level > 0) {
      log.warn("relata.exec disconnect with open transaction; rolling back dialect={} txLevel={}", dialect.id(), level);
      try {
        doRollback();
      } catch (RuntimeException e) {
        failure = e;
      }
      resetTx();
    }
    try {
      doDisconnect();
    } catch (RuntimeException e) {
      if (failure != null) e.addSuppressed(failure);
      failure = e;
    } finally {
      state = ConnectionState.DISCONNECTED;
    }
    log.debug("relata.exec disconnected dialect={}", dialect.id());
    if (failure != null) throw failure;
  }

  // --- transactions ---

  @Override
  public final synchronized void beginTransaction() {
    connect();
    if (level == 0) {
      IsolationLevel iso = pendingIsolation;
      doBegin(iso);
      pendingIsolation = null;
      executedInTx = false;
      level = 1;
      state = ConnectionState.IN_TRANSACTION;
      log.debug("relata.exec begin dialect={} isolation={}", dialect.id(), iso);
      return;
    }
    if (!dialect.supports(Capability.SAVEPOINT)) {
      throw new TransactionException(dialect.id(), "nested transactions unsupported");
    }
    String name = "sp_" + level;
    doExecuteControl(dialect.savepointSql(name));
    savepoints.push(name);
    level++;
    log.debug("relata.exec savepoint dialect={} name={} txLevel={}", dialect.id(), name, level);
  }

  @Override
  public final synchronized void beginTransaction(IsolationLevel isolation) {
    Objects.requireNonNull(isolation, "isolation");
    if (level > 0) {
      throw new TransactionException(dialect.id(), "isolation level can only be chosen for a top-level transaction");
    }
    requireIsolation(isolation);
    pendingIsolation = isolation;
    beginTransaction();
  }

  @Override
  public final synchronized void commit() {
    if (level == 0) throw new TransactionException(dialect.id(), "no transaction to commit");
    if (level > 1) {
      String name = savepoints.pop();
      doExecuteControl(dialect.releaseSavepointSql(name));
      level--;
      log.debug("relata.exec release dialect={} name={} txLevel={}", dialect.id(), name, level);
      return;
    }
    try {
      doCommit();
    } catch (RuntimeException e) {
      try {
        doRollback();
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      resetTx();
      throw e;
    }
    resetTx();
    log.debug("relata.exec commit dialect={}", dialect.id());
  }

  @Override
  public final synchronized void rollback() {
    if (level == 0) throw new TransactionException(dialect.id(), "no transaction to roll back");
    if (level > 1) {
      String name = savepoints.pop();
      doExecuteControl(dialect.rollbackToSavepointSql(name));
      doExecuteControl(dialect.releaseSavepointSql(name));
      level--;
      log.debug("relata.exec rollback_to dialect={} name={} txLevel={}", dialect.id(), name, level);
      return;
    }
    try {
      doRollback();
    } finally {
      resetTx();
    }
    log.debug("relata.exec rollback dialect={}", dialect.id());
  }

  @Override
  public final synchronized void setIsolationLevel(IsolationLevel isolation) {
    Objects.requireNonNull(isolation, "isolation");
    requireIsolation(isolation);
    if (level == 0) {
      pendingIsolation = isolation;
      return;
    }
    if (executedInTx) {
      throw new TransactionException(dialect.id(),
          "isolation level cannot change after statements have executed in the transaction");
    }
    doSetIsolation(isolation);
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    boolean existing = transactionLevel() > 0;
    return switch (propagation) {
      case REQUIRED -> existing ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (!existing) throw new TransactionException(dialect.id(), "No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case NEVER -> {
        if (existing) throw new TransactionException(dialect.id(), "Existing transaction found for propagation=NEVER");
        yield work.get();
      }
      case NESTED -> runInNewTx(work);
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    beginTransaction();
    int myLevel = transactionLevel();
    try {
      T result = work.get();
      commit();
      return result;
    } catch (RuntimeException | Error t) {
      // work may have left deeper levels open, or a timeout may already have closed ours
      try {
        while (transactionLevel() >= myLevel) rollback();
      } catch (RuntimeException re) {
        t.addSuppressed(re);
      }
      throw t;
    }
  }

  // --- execution ---

  @Override
  public final QueryResult execute(SqlStatement statement, ExecutionOptions options) {
    Objects.requireNonNull(statement, "statement");
    ExecutionOptions opts = options == null ? ExecutionOptions.defaults() : options;
    synchronized (this) {
      connect();
      StatementKind kind = statement.kind();
      if (kind == StatementKind.TRANSACTION) {
        throw new TransactionException(dialect.id(),
            "transaction control statements must go through beginTransaction/commit/rollback");
      }
      if (kind == StatementKind.DDL && level > 0 && !opts.transactionalDdl()) {
        throw new TransactionException(dialect.id(),
            "DDL inside an open transaction requires ExecutionOptions.transactionalDdl(true)");
      }
      debugSql(statement, opts);
      cancelRequested.set(false);
      executing = true;
      long start = System.nanoTime();
      try {
        QueryResult result = doExecute(statement, opts);
        if (level > 0) executedInTx = true;
        debugDone(statement, result, System.nanoTime() - start);
        return result;
      } catch (RelataException e) {
        RelataException failure = e;
        if (cancelRequested.get() && !(e instanceof QueryCancelledException)) {
          failure = new QueryCancelledException(dialect.id(), "statement cancelled", e);
        }
        if (failure instanceof QueryTimeoutException || failure instanceof QueryCancelledException) {
          abortTransaction(failure);
        } else if (level > 0) {
          executedInTx = true;
        }
        log.debug("relata.exec failed dialect={} kind={} error={}", dialect.id(), failure.kind(), failure.getMessage());
        throw failure;
      } finally {
        executing = false;
        cancelRequested.set(false);
      }
    }
  }

  /** Not synchronized: runs while {@link #execute} holds the lock. */
  @Override
  public final void cancel() {
    if (!executing) return;
    cancelRequested.set(true);
    log.debug("relata.exec cancel dialect={}", dialect.id());
    doCancel();
  }

  private void abortTransaction(RuntimeException failure) {
    if (level == 0) return;
    try {
      doRollback();
    } catch (RuntimeException re) {
      failure.addSuppressed(re);
    } finally {
      resetTx();
    }
    log.debug("relata.exec rolled back after {} dialect={}", failure.getClass().getSimpleName(), dialect.id());
  }

  private void resetTx() {
    level = 0;
    savepoints.clear();
    executedInTx = false;
    if (state == ConnectionState.IN_TRANSACTION) state = ConnectionState.CONNECTED;
  }

  private void requireIsolation(IsolationLevel isolation) {
    if (!dialect.supportedIsolationLevels().contains(isolation)) {
      throw new TransactionException(dialect.id(), "isolation level " + isolation + " not supported");
    }
  }

  private void debugSql(SqlStatement ss, ExecutionOptions opts) {
    if (!log.isDebugEnabled()) return;
    Duration timeout = opts.timeout();
    log.debug("relata.exec op={} returning={} bindCount={} dialect={} txLevel={} timeoutMs={} sql={}",
        ss.kind(), ss.returning(), ss.binds().size(), dialect.id(), level,
        timeout == null ? "none" : timeout.toMillis(), ss.sql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof byte[] bytes) ? bytes.length : -1;
        log.trace("relata.exec bind index={} type={} valueType={} valueLen={}", idx++, b.type(), vType, vLen);
      }
    }
  }

  private void debugDone(SqlStatement ss, QueryResult result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("relata.exec_done op={} durationMs={} rows={} affected={}",
        ss.kind(), durationNanos / 1_000_000.0, result.rows().size(), result.affectedRows());
  }
}
