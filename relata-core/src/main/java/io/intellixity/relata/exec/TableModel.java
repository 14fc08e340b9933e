package io.intellixity.relata.exec;

import io.intellixity.relata.expression.Identifiers;
import io.intellixity.relata.types.LogicalType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Table metadata an application hands to assemblers: name, column logical types, primary key. */
public record TableModel(String tableName, Map<String, LogicalType> columnTypes, List<String> primaryKey) {
  public TableModel {
    tableName = Identifiers.require(tableName, "table");
    Objects.requireNonNull(columnTypes, "columnTypes");
    columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
  }

  public static TableModel of(String tableName, Map<String, LogicalType> columnTypes, String... primaryKey) {
    return new TableModel(tableName, columnTypes, List.of(primaryKey));
  }

  public LogicalType typeOf(String column) { return columnTypes.get(column); }
}
