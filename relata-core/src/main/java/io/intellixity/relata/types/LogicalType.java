package io.intellixity.relata.types;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Backend-neutral type tag.\n
 *
 * Each logical type has one application-side Java type; every dialect maps it to exactly one
 * native column type through its {@link TypeRegistry}.
 */
public enum LogicalType {
  BOOLEAN(Boolean.class),
  INTEGER(Integer.class),
  BIGINT(Long.class),
  REAL(Double.class),
  /** Exact numeric; never routed through floating point. */
  DECIMAL(BigDecimal.class),
  TEXT(String.class),
  BLOB(byte[].class),
  DATE(LocalDate.class),
  TIME(LocalTime.class),
  /** Instant in time; stored UTC-normalized. */
  TIMESTAMP(Instant.class),
  UUID(java.util.UUID.class),
  /** JSON tree: maps, lists, strings, numbers, booleans or null. */
  JSON(Object.class);

  private final Class<?> javaType;

  LogicalType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> javaType() { return javaType; }

  /**
   * Infer the logical type of an application value.\n
   *
   * Null infers {@link #TEXT}; collections, maps and unknown objects infer {@link #JSON}.
   */
  public static LogicalType infer(Object value) {
    if (value == null) return TEXT;
    if (value instanceof Boolean) return BOOLEAN;
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) return INTEGER;
    if (value instanceof Long || value instanceof BigInteger) return BIGINT;
    if (value instanceof Double || value instanceof Float) return REAL;
    if (value instanceof BigDecimal) return DECIMAL;
    if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) return TEXT;
    if (value instanceof byte[]) return BLOB;
    if (value instanceof LocalDate) return DATE;
    if (value instanceof LocalTime) return TIME;
    if (value instanceof Instant || value instanceof OffsetDateTime || value instanceof ZonedDateTime) return TIMESTAMP;
    if (value instanceof UUID) return UUID;
    if (value instanceof Map<?, ?> || value instanceof Collection<?>) return JSON;
    return JSON;
  }
}
