package io.intellixity.relata.exec;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one statement.\n
 *
 * {@code rows} is filled only for row-returning statements; {@code lastInsertId} only for inserts
 * without RETURNING on backends that report generated keys.
 */
public record QueryResult(List<Map<String, Object>> rows, long affectedRows, Object lastInsertId, Duration duration) {
  public QueryResult {
    rows = rows == null ? List.of() : List.copyOf(rows);
    Objects.requireNonNull(duration, "duration");
  }

  public static QueryResult ofRows(List<Map<String, Object>> rows, Duration duration) {
    return new QueryResult(rows, rows == null ? 0 : rows.size(), null, duration);
  }

  public static QueryResult ofUpdate(long affectedRows, Object lastInsertId, Duration duration) {
    return new QueryResult(List.of(), affectedRows, lastInsertId, duration);
  }

  public boolean isEmpty() { return rows.isEmpty(); }
}
