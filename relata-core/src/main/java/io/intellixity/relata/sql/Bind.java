package io.intellixity.relata.sql;

import io.intellixity.relata.types.LogicalType;

import java.util.Objects;

/** One bind parameter: the driver-ready value and the logical type it was encoded from. */
public record Bind(Object value, LogicalType type) {
  public Bind {
    Objects.requireNonNull(type, "type");
  }
}
