package io.intellixity.relata.spi.exec;

import io.intellixity.relata.async.AsyncStorageBackend;
import io.intellixity.relata.error.QueryExecutionException;
import io.intellixity.relata.exec.ConnectionState;
import io.intellixity.relata.exec.QueryResult;
import io.intellixity.relata.query.ActiveQuery;
import io.intellixity.relata.spi.sql.StubSqlDialect;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class AsyncStorageBackendTest {

  @Test
  void callsCompleteInSubmissionOrder() {
    RecordingBackend b = new RecordingBackend(StubSqlDialect.full());
    try (AsyncStorageBackend async = new AsyncStorageBackend(b)) {
      List<CompletableFuture<QueryResult>> futures = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        futures.add(async.execute("SELECT " + i, List.of()));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

      for (int i = 0; i < 20; i++) {
        assertEquals("SELECT " + i, b.executed.get(i).sql());
      }
    }
    assertEquals(ConnectionState.DISCONNECTED, b.state());
  }

  @Test
  void transactionStateIsSharedWithDelegate() {
    RecordingBackend b = new RecordingBackend(StubSqlDialect.full());
    try (AsyncStorageBackend async = new AsyncStorageBackend(b)) {
      async.beginTransaction().join();
      async.execute("INSERT INTO t (a) VALUES (?)", List.of(1)).join();
      async.commit().join();
      assertEquals(List.of("connect", "begin", "execute", "commit"), b.calls.subList(0, 4));
    }
  }

  @Test
  void failureCompletesExceptionallyWithDelegateError() {
    RecordingBackend b = new RecordingBackend(StubSqlDialect.full());
    b.responder = s -> {
      throw new QueryExecutionException(StubSqlDialect.ID, "no such table: t", null);
    };
    try (AsyncStorageBackend async = new AsyncStorageBackend(b)) {
      CompletionException ex = assertThrows(CompletionException.class,
          () -> async.execute("SELECT * FROM t", List.of()).join());
      assertInstanceOf(QueryExecutionException.class, ex.getCause());
    }
  }

  @Test
  void submitRunsAssemblersOnTheBackendThread() {
    RecordingBackend b = new RecordingBackend(StubSqlDialect.full());
    b.responder = s -> QueryResult.ofRows(List.of(Map.of("relata_count", 5L)), Duration.ZERO);
    try (AsyncStorageBackend async = new AsyncStorageBackend(b)) {
      long n = async.submit(backend -> ActiveQuery.from(backend, "users").count()).join();
      assertEquals(5L, n);
    }
  }
}
