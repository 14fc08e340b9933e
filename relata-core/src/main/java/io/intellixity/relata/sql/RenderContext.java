package io.intellixity.relata.sql;

import io.intellixity.relata.types.LogicalType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bind collector for one rendering pass.\n
 *
 * Values are converted through the dialect's type registry as they are bound, and placeholders
 * are numbered in the order they are emitted, which is their left-to-right order in the final SQL.
 */
public final class RenderContext {
  private final Dialect dialect;
  private final List<Bind> binds = new ArrayList<>();

  public RenderContext(Dialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public Dialect dialect() { return dialect; }

  /** Register a bind and return the placeholder text for it. */
  public String bind(Object value, LogicalType type) {
    Objects.requireNonNull(type, "type");
    Object encoded = dialect.types().toDatabase(value, type);
    binds.add(new Bind(encoded, type));
    return dialect.formatLiteralPlaceholder(binds.size());
  }

  public List<Bind> binds() { return List.copyOf(binds); }

  public int size() { return binds.size(); }
}
