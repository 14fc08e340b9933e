package io.intellixity.relata.exec;

import java.util.Map;

/** Hydrates one decoded row (column label to application value) into an application object. */
@FunctionalInterface
public interface RowMapper<T> {
  T map(Map<String, Object> row);
}
