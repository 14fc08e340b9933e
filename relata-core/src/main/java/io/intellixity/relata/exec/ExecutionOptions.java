package io.intellixity.relata.exec;

import io.intellixity.relata.types.LogicalType;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-call execution settings.
 *
 * @param columnTypes logical types used to decode result columns (by label); unlisted columns are
 *                    returned as normalized driver values
 * @param timeout statement timeout, or null for none
 * @param transactionalDdl allow DDL while a transaction is open
 */
public record ExecutionOptions(Map<String, LogicalType> columnTypes, Duration timeout, boolean transactionalDdl) {
  private static final ExecutionOptions DEFAULTS = new ExecutionOptions(Map.of(), null, false);

  public ExecutionOptions {
    columnTypes = columnTypes == null ? Map.of() : Map.copyOf(columnTypes);
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  public static ExecutionOptions defaults() { return DEFAULTS; }

  public ExecutionOptions withColumnTypes(Map<String, LogicalType> types) {
    Map<String, LogicalType> merged = new HashMap<>(columnTypes);
    merged.putAll(types);
    return new ExecutionOptions(merged, timeout, transactionalDdl);
  }

  public ExecutionOptions withTimeout(Duration timeout) {
    return new ExecutionOptions(columnTypes, timeout, transactionalDdl);
  }

  public ExecutionOptions transactionalDdl(boolean allow) {
    return new ExecutionOptions(columnTypes, timeout, allow);
  }
}
