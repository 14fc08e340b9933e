package io.intellixity.relata.types;

import io.intellixity.relata.error.TypeConversionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.UUID;

/** Widening of near-miss application values onto a logical type's Java type before encoding. */
final class TypeCoercions {
  private TypeCoercions() {}

  static Object coerce(Object value, LogicalType type) {
    if (value == null || type.javaType().isInstance(value)) return value;
    switch (type) {
      case INTEGER:
        if (value instanceof Short || value instanceof Byte) return ((Number) value).intValue();
        if (value instanceof Long l) return exactInt(l, type);
        break;
      case BIGINT:
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return ((Number) value).longValue();
        if (value instanceof BigInteger bi) return exactLong(bi, type);
        break;
      case REAL:
        if (value instanceof Number n) return n.doubleValue();
        break;
      case DECIMAL:
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
          return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) return new BigDecimal(bi);
        if (value instanceof Double || value instanceof Float) return new BigDecimal(value.toString());
        if (value instanceof CharSequence cs) return parseDecimal(cs.toString(), type);
        break;
      case TEXT:
        if (value instanceof CharSequence || value instanceof Character) return value.toString();
        if (value instanceof Enum<?> e) return e.name();
        break;
      case TIMESTAMP:
        if (value instanceof OffsetDateTime odt) return odt.toInstant();
        if (value instanceof ZonedDateTime zdt) return zdt.toInstant();
        if (value instanceof java.util.Date d) return d.toInstant();
        break;
      case UUID:
        if (value instanceof CharSequence cs) {
          try {
            return UUID.fromString(cs.toString().trim());
          } catch (IllegalArgumentException e) {
            throw new TypeConversionException(type, "not a UUID: length=" + cs.length(), e);
          }
        }
        break;
      case JSON:
        return value;
      default:
        break;
    }
    throw new TypeConversionException(type, "cannot convert " + value.getClass().getName() + " to " + type.javaType().getSimpleName());
  }

  private static Integer exactInt(long v, LogicalType type) {
    if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
      throw new TypeConversionException(type, "value out of INTEGER range");
    }
    return (int) v;
  }

  private static Long exactLong(BigInteger v, LogicalType type) {
    try {
      return v.longValueExact();
    } catch (ArithmeticException e) {
      throw new TypeConversionException(type, "value out of BIGINT range", e);
    }
  }

  private static BigDecimal parseDecimal(String s, LogicalType type) {
    try {
      return new BigDecimal(s.trim());
    } catch (NumberFormatException e) {
      throw new TypeConversionException(type, "not a decimal: length=" + s.length(), e);
    }
  }
}
