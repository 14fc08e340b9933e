package io.intellixity.relata.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Rendered piece of SQL plus its binds, in placeholder order. */
public record SqlFragment(String sql, List<Bind> binds) {
  public SqlFragment {
    Objects.requireNonNull(sql, "sql");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }

  public List<Object> params() {
    List<Object> out = new ArrayList<>(binds.size());
    for (Bind b : binds) out.add(b.value());
    return out;
  }
}
