package io.intellixity.relata.statement;

import io.intellixity.relata.expression.Identifiers;

import java.util.List;
import java.util.Objects;

/**
 * One named CTE. For a recursive definition the body is a {@link SetOperationStatement} of
 * anchor {@code UNION [ALL]} recursive member.
 */
public record CteDefinition(String name, List<String> columns, Statement body, boolean recursive) {
  public CteDefinition {
    name = Identifiers.require(name, "cte");
    columns = columns == null ? List.of() : List.copyOf(columns);
    for (String c : columns) Identifiers.require(c, "column");
    Objects.requireNonNull(body, "body");
  }
}
