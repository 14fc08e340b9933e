package io.intellixity.relata.sql;

import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A compiled statement: dialect-native SQL text, its binds in placeholder order, and its
 * classification.\n
 *
 * The SQL never contains caller-supplied literal values.
 */
public record SqlStatement(String sql, List<Bind> binds, StatementKind kind, boolean returning) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
    kind = (kind == null) ? StatementKind.classify(sql) : kind;
  }

  public SqlStatement(String sql, List<Bind> binds, StatementKind kind) {
    this(sql, binds, kind, false);
  }

  /**
   * Statement from hand-written SQL. Params are taken as driver-ready values; their logical type
   * is inferred only to pick a binder.
   */
  public static SqlStatement of(String sql, List<?> params) {
    List<Bind> binds = new ArrayList<>();
    if (params != null) {
      for (Object p : params) binds.add(new Bind(p, LogicalType.infer(p)));
    }
    return new SqlStatement(sql, binds, StatementKind.classify(sql), StatementKind.hasReturning(sql));
  }

  public List<Object> params() {
    List<Object> out = new ArrayList<>(binds.size());
    for (Bind b : binds) out.add(b.value());
    return out;
  }

  /** Rows come back only for SELECT-like statements and DML with RETURNING. */
  public boolean returnsRows() {
    return kind == StatementKind.SELECT || (kind.isDml() && returning);
  }
}
