package io.intellixity.relata.spi.exec;

import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.IsolationLevel;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.sql.SqlStatement;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** In-memory backend that records every hook call and answers statements through a responder. */
final class RecordingBackend extends AbstractStorageBackend {
  final List<String> calls = new CopyOnWriteArrayList<>();
  final List<SqlStatement> executed = new CopyOnWriteArrayList<>();

  volatile Function<SqlStatement, QueryResult> responder = s -> QueryResult.ofRows(List.of(), Duration.ZERO);
  volatile Runnable onCancel = () -> {};
  volatile RuntimeException commitFailure;

  RecordingBackend(Dialect dialect) {
    super(dialect);
  }

  @Override protected void doConnect() { calls.add("connect"); }

  @Override protected void doDisconnect() { calls.add("disconnect"); }

  @Override
  protected void doBegin(IsolationLevel isolation) {
    calls.add(isolation == null ? "begin" : "begin " + isolation);
  }

  @Override
  protected void doCommit() {
    calls.add("commit");
    if (commitFailure != null) throw commitFailure;
  }

  @Override protected void doRollback() { calls.add("rollback"); }

  @Override protected void doSetIsolation(IsolationLevel isolation) { calls.add("isolation " + isolation); }

  @Override protected void doExecuteControl(String sql) { calls.add(sql); }

  @Override
  protected QueryResult doExecute(SqlStatement statement, ExecutionOptions options) {
    calls.add("execute");
    executed.add(statement);
    return responder.apply(statement);
  }

  @Override
  protected void doCancel() {
    calls.add("cancel");
    onCancel.run();
  }
}
