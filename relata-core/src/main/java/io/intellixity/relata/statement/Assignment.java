package io.intellixity.relata.statement;

import io.intellixity.relata.expression.Column;
import io.intellixity.relata.expression.Expression;

import java.util.Objects;

/** {@code column = value} in an UPDATE. */
public record Assignment(Column column, Expression value) {
  public Assignment {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }
}
