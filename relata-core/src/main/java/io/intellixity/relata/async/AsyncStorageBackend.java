package io.intellixity.relata.async;

import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.exec.Propagation;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Non-blocking facade over one {@link StorageBackend}.\n
 *
 * Every call runs on a dedicated single thread, so calls complete in submission order and see the
 * same connection and transaction state the synchronous backend would. SQL, binding and errors are
 * those of the delegate; a failure completes the future exceptionally with the delegate's exception as cause.
 */
public final class AsyncStorageBackend implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AsyncStorageBackend.class);
  private static final AtomicInteger SEQ = new AtomicInteger();

  private final StorageBackend delegate;
  private final ExecutorService executor;

  public AsyncStorageBackend(StorageBackend delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    String name = "relata-async-" + delegate.dialect().id() + "-" + SEQ.incrementAndGet();
    this.executor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    });
  }

  public StorageBackend delegate() { return delegate; }

  public Dialect dialect() { return delegate.dialect(); }

  public CompletableFuture<Void> connect() {
    return run(delegate::connect);
  }

  public CompletableFuture<Void> disconnect() {
    return run(delegate::disconnect);
  }

  public CompletableFuture<QueryResult> execute(SqlStatement statement, ExecutionOptions options) {
    return call(() -> delegate.execute(statement, options));
  }

  public CompletableFuture<QueryResult> execute(SqlStatement statement) {
    return call(() -> delegate.execute(statement));
  }

  public CompletableFuture<QueryResult> execute(String sql, List<?> params) {
    return call(() -> delegate.execute(sql, params));
  }

  public CompletableFuture<Void> beginTransaction() {
    return run(delegate::beginTransaction);
  }

  public CompletableFuture<Void> beginTransaction(IsolationLevel level) {
    return run(() -> delegate.beginTransaction(level));
  }

  public CompletableFuture<Void> commit() {
    return run(delegate::commit);
  }

  public CompletableFuture<Void> rollback() {
    return run(delegate::rollback);
  }

  public <T> CompletableFuture<T> inTx(Propagation propagation, Supplier<T> work) {
    return call(() -> delegate.inTx(propagation, work));
  }

  /**
   * Run arbitrary blocking work (typically query assemblers bound to the delegate) on the backend
   * thread.
   */
  public <T> CompletableFuture<T> submit(Function<StorageBackend, T> work) {
    Objects.requireNonNull(work, "work");
    return call(() -> work.apply(delegate));
  }

  /** Cancels the in-flight statement directly; the queue is bypassed because its thread is busy. */
  public void cancel() {
    delegate.cancel();
  }

  /** Disconnect on the backend thread, then stop the thread. */
  @Override
  public void close() {
    try {
      run(delegate::disconnect).join();
    } finally {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
          log.warn("relata.async executor did not terminate; dialect={}", delegate.dialect().id());
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    }
  }

  private CompletableFuture<Void> run(Runnable r) {
    return CompletableFuture.runAsync(r, executor);
  }

  private <T> CompletableFuture<T> call(Supplier<T> s) {
    return CompletableFuture.supplyAsync(s, executor);
  }
}
