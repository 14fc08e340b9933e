package io.intellixity.relata.jdbc;

import io.intellixity.relata.error.QueryExecutionException;
import io.intellixity.relata.error.TypeConversionException;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;

import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Materializes a {@link ResultSet} into ordered rows (column label to value).\n
 *
 * Driver values are normalized first (LOBs to String / byte[], java.sql temporals to java.time,
 * SQL arrays to lists). Columns with a declared {@link LogicalType} are then decoded through the
 * dialect's {@link TypeRegistry}; the rest are returned normalized. Labels must be unique.
 */
public final class JdbcRowReader {
  private final TypeRegistry types;
  private final Map<String, LogicalType> columnTypes;

  public JdbcRowReader(TypeRegistry types, Map<String, LogicalType> columnTypes) {
    this.types = types;
    this.columnTypes = columnTypes == null ? Map.of() : columnTypes;
  }

  public List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int count = md.getColumnCount();
    String[] labels = new String[count];
    Set<String> seen = new HashSet<>();
    for (int i = 1; i <= count; i++) {
      labels[i - 1] = md.getColumnLabel(i);
      if (!seen.add(labels[i - 1])) {
        throw new QueryExecutionException(types.dialectId(),
            "duplicate result column label '" + labels[i - 1] + "'; alias one of the columns", null);
      }
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(count * 2);
      for (int i = 1; i <= count; i++) {
        String label = labels[i - 1];
        row.put(label, decode(label, normalize(rs.getObject(i))));
      }
      rows.add(row);
    }
    return rows;
  }

  private Object decode(String label, Object value) {
    LogicalType type = columnTypes.get(label);
    if (type == null || value == null) return value;
    try {
      return types.toApplication(value, type);
    } catch (TypeConversionException e) {
      throw e.at(types.dialectId(), label);
    }
  }

  static Object normalize(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof Timestamp ts) return ts.toInstant();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof java.sql.Time t) return t.toLocalTime();
    if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
    if (v instanceof Blob b) return b.getBytes(1, (int) b.length());
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return Arrays.asList(oa);
      return arr;
    }
    return v;
  }
}
