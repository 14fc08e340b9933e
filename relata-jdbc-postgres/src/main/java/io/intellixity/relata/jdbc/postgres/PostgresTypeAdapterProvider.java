package io.intellixity.relata.jdbc.postgres;

import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeAdapter;
import io.intellixity.relata.types.TypeAdapterProvider;
import io.intellixity.relata.types.TypeAdapters;
import io.intellixity.relata.types.providers.DefaultTypeAdapterProvider;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;

/**
 * Postgres adapters (dialectId="postgres").\n
 *
 * Native BOOLEAN, NUMERIC, UUID and TIMESTAMPTZ; JSON is stored as jsonb (bound through
 * {@link PostgresBinderProvider}).
 */
public final class PostgresTypeAdapterProvider implements TypeAdapterProvider {
  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  public Collection<TypeAdapter<?>> adapters() {
    DefaultTypeAdapterProvider defaults = new DefaultTypeAdapterProvider();
    return List.of(
        TypeAdapters.withNativeType(global(defaults, LogicalType.DECIMAL), "NUMERIC"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.BLOB), "BYTEA"),
        TypeAdapters.withNativeType(global(defaults, LogicalType.JSON), "JSONB"),
        new TimestampTz()
    );
  }

  private static TypeAdapter<?> global(DefaultTypeAdapterProvider defaults, LogicalType type) {
    for (TypeAdapter<?> a : defaults.adapters()) {
      if (a.logicalType() == type) return a;
    }
    throw new IllegalStateException("No global adapter for " + type);
  }

  /** Bound as a UTC OffsetDateTime, which the driver sends as timestamptz. */
  static final class TimestampTz implements TypeAdapter<Instant> {
    @Override public LogicalType logicalType() { return LogicalType.TIMESTAMP; }
    @Override public Class<Instant> javaType() { return Instant.class; }
    @Override public String nativeType() { return "TIMESTAMPTZ"; }
    @Override public Object toDatabase(Instant value) { return value.atOffset(ZoneOffset.UTC); }

    @Override
    public Instant toApplication(Object raw) {
      if (raw instanceof OffsetDateTime odt) return odt.toInstant();
      return DefaultTypeAdapterProvider.instant(raw);
    }
  }
}
