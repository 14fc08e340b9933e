package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.error.TypeConversionException;
import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeAdapter;
import io.intellixity.relata.types.TypeAdapterProvider;
import io.intellixity.relata.types.TypeAdapters;
import io.intellixity.relata.types.providers.DefaultTypeAdapterProvider;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * SQLite adapters (dialectId="sqlite").\n
 *
 * SQLite has no boolean, decimal, temporal, UUID or JSON storage class:\n
 * - BOOLEAN is stored as INTEGER 0/1\n
 * - DECIMAL as its plain string (no floating point on the way)\n
 * - DATE / TIME / TIMESTAMP as ISO-8601 TEXT, timestamps in UTC with fixed microsecond precision
 *   so text order matches time order\n
 * - UUID as lowercase TEXT, JSON as TEXT\n
 */
public final class SqliteTypeAdapterProvider implements TypeAdapterProvider {
  static final DateTimeFormatter TIMESTAMP_TEXT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

  @Override
  public String dialectId() {
    return SqliteDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    DefaultTypeAdapterProvider defaults = new DefaultTypeAdapterProvider();
    return List.of(
        new BooleanAsInteger(),
        TypeAdapters.withNativeType(global(defaults, LogicalType.BIGINT), "INTEGER"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.REAL), "REAL"),
        new DecimalAsText(),
        new DateAsText(),
        new TimeAsText(),
        new TimestampAsText(),
        new UuidAsText(),
        new JsonAsText()
    );
  }

  private static TypeAdapter<?> global(DefaultTypeAdapterProvider defaults, LogicalType type) {
    for (TypeAdapter<?> a : defaults.adapters()) {
      if (a.logicalType() == type) return a;
    }
    throw new IllegalStateException("No global adapter for " + type);
  }

  /** Only integer 0 / 1 decode; text such as "1" is a conversion error. */
  static final class BooleanAsInteger implements TypeAdapter<Boolean> {
    @Override public LogicalType logicalType() { return LogicalType.BOOLEAN; }
    @Override public Class<Boolean> javaType() { return Boolean.class; }
    @Override public String nativeType() { return "INTEGER"; }
    @Override public Object toDatabase(Boolean value) { return value ? 1 : 0; }

    @Override
    public Boolean toApplication(Object raw) {
      if (raw instanceof Boolean b) return b;
      if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
        long v = ((Number) raw).longValue();
        if (v == 0) return Boolean.FALSE;
        if (v == 1) return Boolean.TRUE;
        throw new TypeConversionException(LogicalType.BOOLEAN, "integer " + v + " is not a boolean");
      }
      throw new TypeConversionException(LogicalType.BOOLEAN,
          "expected INTEGER 0/1, got " + raw.getClass().getName());
    }
  }

  static final class DecimalAsText implements TypeAdapter<BigDecimal> {
    @Override public LogicalType logicalType() { return LogicalType.DECIMAL; }
    @Override public Class<BigDecimal> javaType() { return BigDecimal.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(BigDecimal value) { return value.toPlainString(); }
    @Override public BigDecimal toApplication(Object raw) { return DefaultTypeAdapterProvider.decimal(raw); }
  }

  static final class DateAsText implements TypeAdapter<LocalDate> {
    @Override public LogicalType logicalType() { return LogicalType.DATE; }
    @Override public Class<LocalDate> javaType() { return LocalDate.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(LocalDate value) { return value.toString(); }
    @Override public LocalDate toApplication(Object raw) { return DefaultTypeAdapterProvider.date(raw); }
  }

  static final class TimeAsText implements TypeAdapter<LocalTime> {
    @Override public LogicalType logicalType() { return LogicalType.TIME; }
    @Override public Class<LocalTime> javaType() { return LocalTime.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(LocalTime value) { return value.toString(); }
    @Override public LocalTime toApplication(Object raw) { return DefaultTypeAdapterProvider.time(raw); }
  }

  static final class TimestampAsText implements TypeAdapter<Instant> {
    @Override public LogicalType logicalType() { return LogicalType.TIMESTAMP; }
    @Override public Class<Instant> javaType() { return Instant.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(Instant value) { return TIMESTAMP_TEXT.format(value); }
    @Override public Instant toApplication(Object raw) { return DefaultTypeAdapterProvider.instant(raw); }
  }

  static final class UuidAsText implements TypeAdapter<UUID> {
    @Override public LogicalType logicalType() { return LogicalType.UUID; }
    @Override public Class<UUID> javaType() { return UUID.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(UUID value) { return value.toString(); }
    @Override public UUID toApplication(Object raw) { return DefaultTypeAdapterProvider.uuid(raw); }
  }

  static final class JsonAsText implements TypeAdapter<Object> {
    @Override public LogicalType logicalType() { return LogicalType.JSON; }
    @Override public Class<Object> javaType() { return Object.class; }
    @Override public String nativeType() { return "TEXT"; }
    @Override public Object toDatabase(Object value) { return DefaultTypeAdapterProvider.writeJson(value); }
    @Override public Object toApplication(Object raw) { return DefaultTypeAdapterProvider.readJson(raw); }
  }
}
