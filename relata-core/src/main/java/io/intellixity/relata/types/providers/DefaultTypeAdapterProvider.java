package io.intellixity.relata.types.providers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.relata.error.TypeConversionException;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeAdapter;
import io.intellixity.relata.types.TypeAdapterProvider;
import io.intellixity.relata.types.TypeRegistry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Global built-in adapters (dialectId="*"), using ANSI column type names. */
public final class DefaultTypeAdapterProvider implements TypeAdapterProvider {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Override
  public String dialectId() {
    return TypeRegistry.GLOBAL_DIALECT;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    return List.of(
        new BooleanAdapter(),
        new IntegerAdapter(),
        new BigintAdapter(),
        new RealAdapter(),
        new DecimalAdapter(),
        new TextAdapter(),
        new BlobAdapter(),
        new DateAdapter(),
        new TimeAdapter(),
        new TimestampAdapter(),
        new UuidAdapter(),
        new JsonAdapter()
    );
  }

  static final class BooleanAdapter implements TypeAdapter<Boolean> {
    @Override public LogicalType logicalType() { return LogicalType.BOOLEAN; }
    @Override public Class<Boolean> javaType() { return Boolean.class; }
    @Override public String nativeType() { return "BOOLEAN"; }
    @Override public Object toDatabase(Boolean value) { return value; }

    @Override
    public Boolean toApplication(Object raw) {
      if (raw instanceof Boolean b) return b;
      if (raw instanceof Number n) {
        long v = n.longValue();
        if (v == 0) return Boolean.FALSE;
        if (v == 1) return Boolean.TRUE;
        throw new TypeConversionException(LogicalType.BOOLEAN, "integer " + v + " is not a boolean");
      }
      if (raw instanceof String s) {
        switch (s.trim().toLowerCase()) {
          case "true": case "t": case "1": return Boolean.TRUE;
          case "false": case "f": case "0": return Boolean.FALSE;
          default: throw new TypeConversionException(LogicalType.BOOLEAN, "text is not a boolean");
        }
      }
      throw unexpected(LogicalType.BOOLEAN, raw);
    }
  }

  static final class IntegerAdapter implements TypeAdapter<Integer> {
    @Override public LogicalType logicalType() { return LogicalType.INTEGER; }
    @Override public Class<Integer> javaType() { return Integer.class; }
    @Override public String nativeType() { return "INTEGER"; }
    @Override public Object toDatabase(Integer value) { return value; }

    @Override
    public Integer toApplication(Object raw) {
      if (raw instanceof Integer i) return i;
      try {
        if (raw instanceof BigDecimal bd) return bd.intValueExact();
        if (raw instanceof Number n) return Math.toIntExact(n.longValue());
        if (raw instanceof String s) return Integer.valueOf(s.trim());
      } catch (ArithmeticException | NumberFormatException e) {
        throw new TypeConversionException(LogicalType.INTEGER, "value does not fit INTEGER", e);
      }
      throw unexpected(LogicalType.INTEGER, raw);
    }
  }

  static final class BigintAdapter implements TypeAdapter<Long> {
    @Override public LogicalType logicalType() { return LogicalType.BIGINT; }
    @Override public Class<Long> javaType() { return Long.class; }
    @Override public String nativeType() { return "BIGINT"; }
    @Override public Object toDatabase(Long value) { return value; }

    @Override
    public Long toApplication(Object raw) {
      if (raw instanceof Long l) return l;
      try {
        if (raw instanceof BigDecimal bd) return bd.longValueExact();
        if (raw instanceof BigInteger bi) return bi.longValueExact();
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) return ((Number) raw).longValue();
        if (raw instanceof String s) return Long.valueOf(s.trim());
      } catch (ArithmeticException | NumberFormatException e) {
        throw new TypeConversionException(LogicalType.BIGINT, "value does not fit BIGINT", e);
      }
      throw unexpected(LogicalType.BIGINT, raw);
    }
  }

  static final class RealAdapter implements TypeAdapter<Double> {
    @Override public LogicalType logicalType() { return LogicalType.REAL; }
    @Override public Class<Double> javaType() { return Double.class; }
    @Override public String nativeType() { return "DOUBLE PRECISION"; }
    @Override public Object toDatabase(Double value) { return value; }

    @Override
    public Double toApplication(Object raw) {
      if (raw instanceof Double d) return d;
      if (raw instanceof Number n) return n.doubleValue();
      if (raw instanceof String s) {
        try {
          return Double.valueOf(s.trim());
        } catch (NumberFormatException e) {
          throw new TypeConversionException(LogicalType.REAL, "text is not a number", e);
        }
      }
      throw unexpected(LogicalType.REAL, raw);
    }
  }

  static final class DecimalAdapter implements TypeAdapter<BigDecimal> {
    @Override public LogicalType logicalType() { return LogicalType.DECIMAL; }
    @Override public Class<BigDecimal> javaType() { return BigDecimal.class; }
    @Override public String nativeType() { return "DECIMAL"; }
    @Override public Object toDatabase(BigDecimal value) { return value; }

    @Override
    public BigDecimal toApplication(Object raw) {
      return decimal(raw);
    }
  }

  static final class TextAdapter implements TypeAdapter<String> {
    @Override public LogicalType logicalType() { return LogicalType.TEXT; }
    @Override public Class<String> javaType() { return String.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(String value) { return value; }

    @Override
    public String toApplication(Object raw) {
      if (raw instanceof String s) return s;
      if (raw instanceof byte[]) throw unexpected(LogicalType.TEXT, raw);
      return String.valueOf(raw);
    }
  }

  static final class BlobAdapter implements TypeAdapter<byte[]> {
    @Override public LogicalType logicalType() { return LogicalType.BLOB; }
    @Override public Class<byte[]> javaType() { return byte[].class; }
    @Override public String nativeType() { return "BLOB"; }
    @Override public Object toDatabase(byte[] value) { return value; }

    @Override
    public byte[] toApplication(Object raw) {
      if (raw instanceof byte[] b) return b;
      throw unexpected(LogicalType.BLOB, raw);
    }
  }

  static final class DateAdapter implements TypeAdapter<LocalDate> {
    @Override public LogicalType logicalType() { return LogicalType.DATE; }
    @Override public Class<LocalDate> javaType() { return LocalDate.class; }
    @Override public String nativeType() { return "DATE"; }
    @Override public Object toDatabase(LocalDate value) { return value; }

    @Override
    public LocalDate toApplication(Object raw) {
      return date(raw);
    }
  }

  static final class TimeAdapter implements TypeAdapter<LocalTime> {
    @Override public LogicalType logicalType() { return LogicalType.TIME; }
    @Override public Class<LocalTime> javaType() { return LocalTime.class; }
    @Override public String nativeType() { return "TIME"; }
    @Override public Object toDatabase(LocalTime value) { return value; }

    @Override
    public LocalTime toApplication(Object raw) {
      return time(raw);
    }
  }

  static final class TimestampAdapter implements TypeAdapter<Instant> {
    @Override public LogicalType logicalType() { return LogicalType.TIMESTAMP; }
    @Override public Class<Instant> javaType() { return Instant.class; }
    @Override public String nativeType() { return "TIMESTAMP WITH TIME ZONE"; }
    @Override public Object toDatabase(Instant value) { return value; }

    @Override
    public Instant toApplication(Object raw) {
      return instant(raw);
    }
  }

  static final class UuidAdapter implements TypeAdapter<UUID> {
    @Override public LogicalType logicalType() { return LogicalType.UUID; }
    @Override public Class<UUID> javaType() { return UUID.class; }
    @Override public String nativeType() { return "UUID"; }
    @Override public Object toDatabase(UUID value) { return value; }

    @Override
    public UUID toApplication(Object raw) {
      return uuid(raw);
    }
  }

  /** JSON serialized with Jackson; malformed stored text is a conversion error, never returned as-is. */
  static final class JsonAdapter implements TypeAdapter<Object> {
    @Override public LogicalType logicalType() { return LogicalType.JSON; }
    @Override public Class<Object> javaType() { return Object.class; }
    @Override public String nativeType() { return "JSON"; }

    @Override
    public Object toDatabase(Object value) {
      return writeJson(value);
    }

    @Override
    public Object toApplication(Object raw) {
      return readJson(raw);
    }
  }

  // ---- shared conversions, reused by dialect providers ----

  public static BigDecimal decimal(Object raw) {
    if (raw instanceof BigDecimal bd) return bd;
    if (raw instanceof BigInteger bi) return new BigDecimal(bi);
    if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
      return BigDecimal.valueOf(((Number) raw).longValue());
    }
    try {
      if (raw instanceof Number n) return new BigDecimal(n.toString());
      if (raw instanceof String s) return new BigDecimal(s.trim());
    } catch (NumberFormatException e) {
      throw new TypeConversionException(LogicalType.DECIMAL, "value is not a decimal", e);
    }
    throw unexpected(LogicalType.DECIMAL, raw);
  }

  public static LocalDate date(Object raw) {
    if (raw instanceof LocalDate d) return d;
    if (raw instanceof LocalDateTime ldt) return ldt.toLocalDate();
    if (raw instanceof String s) {
      try {
        return LocalDate.parse(s.trim());
      } catch (DateTimeParseException e) {
        throw new TypeConversionException(LogicalType.DATE, "text is not an ISO date", e);
      }
    }
    throw unexpected(LogicalType.DATE, raw);
  }

  public static LocalTime time(Object raw) {
    if (raw instanceof LocalTime t) return t;
    if (raw instanceof String s) {
      try {
        return LocalTime.parse(s.trim());
      } catch (DateTimeParseException e) {
        throw new TypeConversionException(LogicalType.TIME, "text is not an ISO time", e);
      }
    }
    throw unexpected(LogicalType.TIME, raw);
  }

  /** Timestamps without an offset are read as UTC. */
  public static Instant instant(Object raw) {
    if (raw instanceof Instant i) return i;
    if (raw instanceof OffsetDateTime odt) return odt.toInstant();
    if (raw instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (raw instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
    if (raw instanceof Long millis) return Instant.ofEpochMilli(millis);
    if (raw instanceof String s) {
      String t = s.trim();
      try {
        return Instant.parse(t);
      } catch (DateTimeParseException notInstant) {
        try {
          return OffsetDateTime.parse(t).toInstant();
        } catch (DateTimeParseException notOffset) {
          try {
            return LocalDateTime.parse(t.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
          } catch (DateTimeParseException e) {
            throw new TypeConversionException(LogicalType.TIMESTAMP, "text is not an ISO timestamp", e);
          }
        }
      }
    }
    throw unexpected(LogicalType.TIMESTAMP, raw);
  }

  public static UUID uuid(Object raw) {
    if (raw instanceof UUID u) return u;
    if (raw instanceof String s) {
      try {
        return UUID.fromString(s.trim());
      } catch (IllegalArgumentException e) {
        throw new TypeConversionException(LogicalType.UUID, "text is not a UUID", e);
      }
    }
    throw unexpected(LogicalType.UUID, raw);
  }

  public static String writeJson(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new TypeConversionException(LogicalType.JSON, "failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  public static Object readJson(Object raw) {
    if (raw instanceof Map<?, ?> || raw instanceof List<?>) return raw;
    String text = (raw instanceof byte[] b) ? new String(b, java.nio.charset.StandardCharsets.UTF_8) : raw.toString();
    try {
      return JSON.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new TypeConversionException(LogicalType.JSON, "stored text is not valid JSON (length=" + text.length() + ")", e);
    }
  }

  private static TypeConversionException unexpected(LogicalType type, Object raw) {
    return new TypeConversionException(type, "unexpected database value of " + raw.getClass().getName());
  }
}
