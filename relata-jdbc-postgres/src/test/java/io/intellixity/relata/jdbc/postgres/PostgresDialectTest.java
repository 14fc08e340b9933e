package io.intellixity.relata.jdbc.postgres;

import io.intellixity.relata.error.ConcurrencyException;
import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.IntegrityConstraintException.Violation;
import io.intellixity.relata.error.RelataException;
import io.intellixity.relata.jdbc.JdbcPlaceholderCompiler;
import io.intellixity.relata.query.ActiveQuery;
import io.intellixity.relata.query.CteQuery;
import io.intellixity.relata.query.InsertQuery;
import io.intellixity.relata.query.SetOperationQuery;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.types.LogicalType;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.intellixity.relata.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  @Test
  void numberedPlaceholdersContinueAcrossCteAndMainQuery() {
    SqlStatement s = CteQuery.on(d)
        .with("adults", ActiveQuery.from(d, "users").where("age", ">=", 18))
        .where("status", "active")
        .limit(10)
        .toSql();

    assertEquals("WITH \"adults\" AS (SELECT * FROM \"users\" WHERE \"age\" >= $1) "
        + "SELECT * FROM \"adults\" WHERE \"status\" = $2 LIMIT $3", s.sql());
    assertEquals(List.of(18, "active", 10L), s.params());
  }

  @Test
  void unionThenIntersectKeepsLeftGrouping() {
    SqlStatement s = SetOperationQuery.of(ActiveQuery.from(d, "a").select("id").where("x", 1))
        .union(ActiveQuery.from(d, "b").select("id"))
        .intersect(ActiveQuery.from(d, "c").select("id").where("y", 2))
        .toSql();

    assertEquals("(SELECT \"id\" FROM \"a\" WHERE \"x\" = $1 UNION SELECT \"id\" FROM \"b\") "
        + "INTERSECT SELECT \"id\" FROM \"c\" WHERE \"y\" = $2", s.sql());
    assertEquals(List.of(1, 2), s.params());
  }

  @Test
  void subqueryPlaceholdersAreNumberedInTextOrder() {
    SqlStatement s = ActiveQuery.from(d, "orders")
        .where("total", ">", 100)
        .whereIn("user_id", ActiveQuery.from(d, "users").select("id").where("country", "NO"))
        .toSql();

    assertEquals("SELECT * FROM \"orders\" WHERE \"total\" > $1 AND \"user_id\" IN "
        + "(SELECT \"id\" FROM \"users\" WHERE \"country\" = $2)", s.sql());

    JdbcPlaceholderCompiler.Compiled c = JdbcPlaceholderCompiler.compile(s.sql(), s.binds(), d.placeholderStyle());
    assertFalse(c.sql().contains("$"));
    assertEquals(2, c.binds().size());
  }

  @Test
  void everyCapabilityIsAvailable() {
    for (Capability c : Capability.values()) assertTrue(d.supports(c), c.name());
    SqlStatement s = ActiveQuery.from(d, "accounts").where("id", 7).lockForUpdate().toSql();
    assertEquals("SELECT * FROM \"accounts\" WHERE \"id\" = $1 FOR UPDATE", s.sql());
  }

  @Test
  void upsertWithGuardUsesNumberedPlaceholders() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("sku", "A-1");
    row.put("stock", 5);
    Map<String, Object> set = new LinkedHashMap<>();
    set.put("stock", add(col("inventory.stock"), excluded("stock")));
    SqlStatement s = InsertQuery.into(d, "inventory").values(row)
        .onConflict("sku").doUpdate(set, lt(col("inventory.stock"), 1000))
        .returning("stock")
        .toSql();

    assertEquals("INSERT INTO \"inventory\" (\"sku\", \"stock\") VALUES ($1, $2) ON CONFLICT (\"sku\") "
        + "DO UPDATE SET \"stock\" = \"inventory\".\"stock\" + excluded.\"stock\" "
        + "WHERE \"inventory\".\"stock\" < $3 RETURNING \"stock\"", s.sql());
    assertEquals(List.of("A-1", 5, 1000), s.params());
  }

  @Test
  void groupingSetsWithGroupingFunction() {
    SqlStatement s = ActiveQuery.from(d, "sales")
        .select(col("region"), col("year"), alias(grouping(col("region"), col("year")), "level"),
            alias(sum(col("amount")), "total"))
        .groupBy(groupingSets(List.of(col("region"), col("year")), List.of(col("region")), List.of()))
        .having(gt(sum(col("amount")), 0))
        .toSql();

    assertEquals("SELECT \"region\", \"year\", GROUPING(\"region\", \"year\") AS \"level\", SUM(\"amount\") AS \"total\" "
        + "FROM \"sales\" GROUP BY GROUPING SETS ((\"region\", \"year\"), (\"region\"), ()) HAVING SUM(\"amount\") > $1",
        s.sql());
  }

  @Test
  void nativeTypes() {
    assertEquals("JSONB", d.types().nativeType(LogicalType.JSON));
    assertEquals("NUMERIC", d.types().nativeType(LogicalType.DECIMAL));
    assertEquals("BYTEA", d.types().nativeType(LogicalType.BLOB));
    assertEquals("TIMESTAMPTZ", d.types().nativeType(LogicalType.TIMESTAMP));
    assertEquals("BOOLEAN", d.types().nativeType(LogicalType.BOOLEAN));
    assertEquals("UUID", d.types().nativeType(LogicalType.UUID));

    SqlStatement s = ActiveQuery.from(d, "t").select(cast(col("x"), LogicalType.JSON)).toSql();
    assertEquals("SELECT CAST(\"x\" AS JSONB) FROM \"t\"", s.sql());
  }

  @Test
  void timestampsTravelAsUtcOffsetDateTime() {
    Instant at = Instant.parse("2024-03-01T10:15:30Z");
    assertEquals(at.atOffset(ZoneOffset.UTC), d.types().toDatabase(at, LogicalType.TIMESTAMP));
    assertEquals(at, d.types().toApplication(OffsetDateTime.parse("2024-03-01T12:15:30+02:00"), LogicalType.TIMESTAMP));

    UUID id = UUID.randomUUID();
    assertEquals(id, d.types().toDatabase(id, LogicalType.UUID));
  }

  @Test
  void serverErrorsKeepConstraintName() {
    ServerErrorMessage sem = new ServerErrorMessage(
        "SERROR\0C23505\0Mduplicate key value violates unique constraint\0nusers_email_key\0\0");
    RelataException e = d.errorTranslator().translate(d.id(), new PSQLException(sem));

    IntegrityConstraintException ice = assertInstanceOf(IntegrityConstraintException.class, e);
    assertEquals(Violation.UNIQUE, ice.violation());
    assertEquals("users_email_key", ice.constraint());
  }

  @Test
  void concurrencyStates() {
    assertEquals(ConcurrencyException.Reason.DEADLOCK,
        ((ConcurrencyException) d.errorTranslator().translate(d.id(), new SQLException("deadlock", "40P01"))).reason());
    assertEquals(ConcurrencyException.Reason.LOCK_TIMEOUT,
        ((ConcurrencyException) d.errorTranslator().translate(d.id(), new SQLException("lock", "55P03"))).reason());
    assertEquals(Violation.FOREIGN_KEY,
        ((IntegrityConstraintException) d.errorTranslator().translate(d.id(), new SQLException("fk", "23503"))).violation());
  }
}
