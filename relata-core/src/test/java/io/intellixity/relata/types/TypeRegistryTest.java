package io.intellixity.relata.types;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.error.TypeConversionException;
import io.intellixity.relata.types.providers.DefaultTypeAdapterProvider;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class TypeRegistryTest {

  private static TypeAdapterProvider provider(String dialectId, TypeAdapter<?>... adapters) {
    return new TypeAdapterProvider() {
      @Override public String dialectId() { return dialectId; }
      @Override public Collection<TypeAdapter<?>> adapters() { return List.of(adapters); }
    };
  }

  private static TypeAdapter<Boolean> intBoolean() {
    return new TypeAdapter<>() {
      @Override public LogicalType logicalType() { return LogicalType.BOOLEAN; }
      @Override public Class<Boolean> javaType() { return Boolean.class; }
      @Override public String nativeType() { return "INTEGER"; }
      @Override public Object toDatabase(Boolean value) { return value ? 1 : 0; }
      @Override public Boolean toApplication(Object raw) { return ((Number) raw).intValue() == 1; }
    };
  }

  @Test
  void discover_resolvesEveryLogicalTypeFromGlobalProvider() {
    TypeRegistry r = TypeRegistry.discover("test");
    for (LogicalType t : LogicalType.values()) {
      assertNotNull(r.adapter(t), "missing adapter for " + t);
    }
    assertEquals("BOOLEAN", r.nativeType(LogicalType.BOOLEAN));
    assertEquals("test", r.dialectId());
  }

  @Test
  void dialectProviderOverridesGlobal() {
    TypeRegistry r = new TypeRegistry("lite", List.of(new DefaultTypeAdapterProvider(), provider("lite", intBoolean())));
    assertEquals("INTEGER", r.nativeType(LogicalType.BOOLEAN));
    assertEquals(1, r.toDatabase(true, LogicalType.BOOLEAN));
    assertEquals(Boolean.TRUE, r.toApplication(1, LogicalType.BOOLEAN));
  }

  @Test
  void providersForOtherDialectsAreIgnored() {
    TypeRegistry r = new TypeRegistry("pg", List.of(new DefaultTypeAdapterProvider(), provider("lite", intBoolean())));
    assertEquals("BOOLEAN", r.nativeType(LogicalType.BOOLEAN));
  }

  @Test
  void duplicateMappingInOneScope_isRejectedAtConstruction() {
    QueryConstructionException ex = assertThrows(QueryConstructionException.class,
        () -> new TypeRegistry("lite", List.of(
            new DefaultTypeAdapterProvider(),
            provider("lite", intBoolean()),
            provider("lite", intBoolean()))));
    assertTrue(ex.getMessage().contains("duplicate type mapping for BOOLEAN"));
  }

  @Test
  void missingMapping_isRejectedAtConstruction() {
    QueryConstructionException ex = assertThrows(QueryConstructionException.class,
        () -> new TypeRegistry("lite", List.of(provider("lite", intBoolean()))));
    assertTrue(ex.getMessage().contains("no type mapping for logical type"));
  }

  @Test
  void decimalKeepsExactDigits() {
    TypeRegistry r = TypeRegistry.discover("test");
    Object db = r.toDatabase(new BigDecimal("12345678901234567890.000000000123"), LogicalType.DECIMAL);
    assertEquals(new BigDecimal("12345678901234567890.000000000123"), r.toApplication(db, LogicalType.DECIMAL));
    assertEquals(new BigDecimal("0.1"), r.toApplication("0.1", LogicalType.DECIMAL));
  }

  @Test
  void nearMissValuesAreWidened() {
    TypeRegistry r = TypeRegistry.discover("test");
    assertEquals(5L, r.toDatabase(5, LogicalType.BIGINT));
    assertEquals(Instant.parse("2024-01-01T10:00:00Z"),
        r.toDatabase(OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)), LogicalType.TIMESTAMP));
    UUID id = UUID.randomUUID();
    assertEquals(id, r.toDatabase(id.toString(), LogicalType.UUID));
  }

  @Test
  void outOfRangeInteger_isConversionError() {
    TypeRegistry r = TypeRegistry.discover("test");
    TypeConversionException ex = assertThrows(TypeConversionException.class,
        () -> r.toDatabase(Long.MAX_VALUE, LogicalType.INTEGER));
    assertEquals(LogicalType.INTEGER, ex.logicalType());
  }

  @Test
  void booleanNeverGuessesFromOtherIntegers() {
    TypeRegistry r = TypeRegistry.discover("test");
    assertEquals(Boolean.FALSE, r.toApplication(0L, LogicalType.BOOLEAN));
    assertThrows(TypeConversionException.class, () -> r.toApplication(2, LogicalType.BOOLEAN));
  }

  @Test
  void jsonRoundTripsThroughText() {
    TypeRegistry r = TypeRegistry.discover("test");
    Object db = r.toDatabase(Map.of("tags", List.of("a", "b")), LogicalType.JSON);
    assertInstanceOf(String.class, db);
    assertEquals(Map.of("tags", List.of("a", "b")), r.toApplication(db, LogicalType.JSON));
  }

  @Test
  void malformedStoredJson_isConversionError() {
    TypeRegistry r = TypeRegistry.discover("test");
    assertThrows(TypeConversionException.class, () -> r.toApplication("{not json", LogicalType.JSON));
  }

  @Test
  void nullsPassThroughBothWays() {
    TypeRegistry r = TypeRegistry.discover("test");
    assertNull(r.toDatabase(null, LogicalType.UUID));
    assertNull(r.toApplication(null, LogicalType.DATE));
  }

  @Test
  void conversionErrorCarriesColumnOnceAttached() {
    TypeConversionException ex = new TypeConversionException(LogicalType.DATE, "text is not an ISO date").at("lite", "born_on");
    assertEquals("born_on", ex.column());
    assertEquals("lite", ex.dialectId());
    assertTrue(ex.getMessage().contains("column born_on"));
  }
}
