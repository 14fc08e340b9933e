package io.intellixity.relata.query;

import io.intellixity.relata.exec.ExecutionOptions;
import io.intellixity.relata.exec.StorageBackend;
import io.intellixity.relata.sql.Dialect;
import io.intellixity.relata.types.LogicalType;

import java.util.Map;
import java.util.Objects;

/**
 * Single-use builder base.\n
 *
 * Mutators call {@link #checkOpen()}; executing terminals call {@link #consume()}, after which the
 * builder rejects further mutation and execution. Rendering stays available.
 */
abstract class AbstractQuery {
  private final Dialect dialect;
  private final StorageBackend backend;
  private boolean consumed;

  AbstractQuery(Dialect dialect, StorageBackend backend) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.backend = backend;
  }

  AbstractQuery(StorageBackend backend) {
    this(Objects.requireNonNull(backend, "backend").dialect(), backend);
  }

  public final Dialect dialect() { return dialect; }

  public final boolean consumed() { return consumed; }

  final void checkOpen() {
    if (consumed) throw new IllegalStateException(getClass().getSimpleName() + " already executed; build a new query");
  }

  final StorageBackend consume() {
    checkOpen();
    if (backend == null) {
      throw new IllegalStateException(getClass().getSimpleName() + " was built for rendering only (no backend)");
    }
    consumed = true;
    return backend;
  }

  static ExecutionOptions decoding(Map<String, LogicalType> columnTypes) {
    return columnTypes.isEmpty() ? ExecutionOptions.defaults() : ExecutionOptions.defaults().withColumnTypes(columnTypes);
  }
}
