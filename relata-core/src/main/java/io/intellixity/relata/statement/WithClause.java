package io.intellixity.relata.statement;

import java.util.List;

/** Ordered CTE definitions; {@code WITH RECURSIVE} when any of them is recursive. */
public record WithClause(List<CteDefinition> definitions) {
  public WithClause {
    definitions = definitions == null ? List.of() : List.copyOf(definitions);
  }

  public boolean recursive() {
    for (CteDefinition d : definitions) if (d.recursive()) return true;
    return false;
  }

  public boolean isEmpty() { return definitions.isEmpty(); }
}
