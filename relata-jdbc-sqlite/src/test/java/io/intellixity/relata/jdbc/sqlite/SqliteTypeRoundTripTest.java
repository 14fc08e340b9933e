package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.types.LogicalType;
import io.intellixity.relata.types.TypeRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteTypeRoundTripTest {
  private static final TypeRegistry TYPES = new SqliteDialect().types();

  static Stream<Arguments> boundaryValues() {
    return Stream.of(
        Arguments.of(LogicalType.BOOLEAN, true),
        Arguments.of(LogicalType.BOOLEAN, false),
        Arguments.of(LogicalType.INTEGER, 0),
        Arguments.of(LogicalType.INTEGER, Integer.MIN_VALUE),
        Arguments.of(LogicalType.BIGINT, 0L),
        Arguments.of(LogicalType.BIGINT, Long.MAX_VALUE),
        Arguments.of(LogicalType.REAL, 0.0d),
        Arguments.of(LogicalType.REAL, -1.5d),
        Arguments.of(LogicalType.DECIMAL, BigDecimal.ZERO),
        Arguments.of(LogicalType.DECIMAL, new BigDecimal("-12.50")),
        Arguments.of(LogicalType.DECIMAL, new BigDecimal("12345678901234567890.123456789")),
        Arguments.of(LogicalType.TEXT, ""),
        Arguments.of(LogicalType.TEXT, "it's \"quoted\" \u00e9"),
        Arguments.of(LogicalType.BLOB, new byte[0]),
        Arguments.of(LogicalType.BLOB, new byte[] {0, -1, 127}),
        Arguments.of(LogicalType.DATE, LocalDate.of(1970, 1, 1)),
        Arguments.of(LogicalType.TIME, LocalTime.MIDNIGHT),
        Arguments.of(LogicalType.TIME, LocalTime.of(23, 59, 59, 123_456_000)),
        Arguments.of(LogicalType.TIMESTAMP, Instant.EPOCH),
        Arguments.of(LogicalType.TIMESTAMP, Instant.parse("2024-03-01T10:15:30.123456Z")),
        Arguments.of(LogicalType.UUID, UUID.fromString("00000000-0000-0000-0000-000000000000")),
        Arguments.of(LogicalType.UUID, UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301")),
        Arguments.of(LogicalType.JSON, Map.of()),
        Arguments.of(LogicalType.JSON, List.of()),
        Arguments.of(LogicalType.JSON, Map.of("tags", List.of("a", 1, true)))
    );
  }

  @ParameterizedTest(name = "{0} {1}")
  @MethodSource("boundaryValues")
  void valueSurvivesEncodeAndDecode(LogicalType type, Object value) {
    Object back = TYPES.toApplication(TYPES.toDatabase(value, type), type);
    if (value instanceof byte[] bytes) {
      assertArrayEquals(bytes, (byte[]) back);
    } else {
      assertEquals(value, back);
    }
  }

  @Test
  void everyLogicalTypeHasANativeColumnType() {
    for (LogicalType t : LogicalType.values()) {
      assertFalse(TYPES.nativeType(t).isBlank(), t.name());
    }
  }
}
