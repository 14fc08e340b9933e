package io.intellixity.relata.jdbc.mysql;

import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeAdapter;
import io.intellixity.relata.types.TypeAdapterProvider;
import io.intellixity.relata.types.TypeAdapters;
import io.intellixity.relata.types.providers.DefaultTypeAdapterProvider;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * MySQL adapters (dialectId="mysql").\n
 *
 * - BOOLEAN as TINYINT(1)\n
 * - TIMESTAMP as DATETIME(6) holding UTC wall-clock time, independent of the session time zone\n
 * - UUID as CHAR(36) text, JSON as the native JSON type\n
 */
public final class MySqlTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return MySqlDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    DefaultTypeAdapterProvider defaults = new DefaultTypeAdapterProvider();
    return List.of(
        TypeAdapters.withNativeType(global(defaults, LogicalType.BOOLEAN), "TINYINT(1)"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.INTEGER), "INT"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.REAL), "DOUBLE"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.DECIMAL), "DECIMAL(65,30)"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.BLOB), "LONGBLOB"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.TIME), "TIME(6)"),
        new DatetimeUtc(),
        new UuidAsChar(),
        TypeAdapters.withNativeType(global(defaults, LogicalType.JSON), "JSON")
    );
  }

  private static TypeAdapter<?> global(DefaultTypeAdapterProvider defaults, LogicalType type) {
    for (TypeAdapter<?> a : defaults.adapters()) {
      if (a.logicalType() == type) return a;
    }
    throw new IllegalStateException("No global adapter for " + type);
  }

  static final class DatetimeUtc implements TypeAdapter<Instant> {
    @Override public LogicalType logicalType() { return LogicalType.TIMESTAMP; }
    @Override public Class<Instant> javaType() { return Instant.class; }
    @Override public String nativeType() { return "DATETIME(6)"; }
    @Override public Object toDatabase(Instant value) { return LocalDateTime.ofInstant(value, ZoneOffset.UTC); }
    @Override public Instant toApplication(Object raw) { return DefaultTypeAdapterProvider.instant(raw); }
  }

  static final class UuidAsChar implements TypeAdapter<UUID> {
    @Override public LogicalType logicalType() { return LogicalType.UUID; }
    @Override public Class<UUID> javaType() { return UUID.class; }
    @Override public String nativeType() { return "CHAR(36)"; }
    @Override public Object toDatabase(UUID value) { return value.toString(); }
    @Override public UUID toApplication(Object raw) { return DefaultTypeAdapterProvider.uuid(raw); }
  }
}
