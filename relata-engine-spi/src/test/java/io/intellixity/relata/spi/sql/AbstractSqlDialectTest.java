package io.intellixity.relata.spi.sql;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.error.UnsupportedCapabilityException;
import io.intellixity.relata.expression.OrderTerm;
import io.intellixity.relata.query.ActiveQuery;
import io.intellixity.relata.query.InsertQuery;
import io.intellixity.relata.query.UpdateQuery;
import io.intellixity.relata.query.DeleteQuery;
import io.intellixity.relata.sql.Capability;
import io.intellixity.relata.sql.SqlFragment;
import io.intellixity.relata.sql.SqlStatement;
import io.intellixity.relata.sql.StatementKind;
import io.intellixity.relata.types.LogicalType;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.relata.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDialectTest {
  private final StubSqlDialect d = StubSqlDialect.full();

  @Test
  void whereChainRendersPlaceholdersInOrder() {
    SqlStatement s = ActiveQuery.from(d, "users")
        .where("age", ">=", 18)
        .where("status", "active")
        .orderBy("name")
        .limit(10)
        .toSql();

    assertEquals("SELECT * FROM \"users\" WHERE \"age\" >= ? AND \"status\" = ? ORDER BY \"name\" ASC LIMIT ?", s.sql());
    assertEquals(List.of(18, "active", 10L), s.params());
    assertEquals(StatementKind.SELECT, s.kind());
  }

  @Test
  void valuesNeverReachSqlText() {
    String hostile = "x'; DROP TABLE users; --";
    SqlStatement s = ActiveQuery.from(d, "users").where("name", hostile).toSql();
    assertFalse(s.sql().contains("DROP"));
    assertEquals(List.of(hostile), s.params());
  }

  @Test
  void identifiersAreQuotedWithEmbeddedQuotesDoubled() {
    SqlStatement s = ActiveQuery.from(d, "we\"ird").select("a\"b").toSql();
    assertEquals("SELECT \"a\"\"b\" FROM \"we\"\"ird\"", s.sql());
  }

  @Test
  void compilingTwiceGivesEqualStatements() {
    ActiveQuery q = ActiveQuery.from(d, "users").where("age", ">", 18).whereIn("role", List.of("a", "b"));
    assertEquals(q.toSql(), q.toSql());
  }

  @Test
  void orGroupInsideAndIsParenthesized() {
    SqlStatement s = ActiveQuery.from(d, "t")
        .where(or(eq(col("a"), 1), eq(col("b"), 2)))
        .where(eq(col("c"), 3))
        .toSql();
    assertEquals("SELECT * FROM \"t\" WHERE (\"a\" = ? OR \"b\" = ?) AND \"c\" = ?", s.sql());
    assertEquals(List.of(1, 2, 3), s.params());
  }

  @Test
  void orWhereWrapsEverythingAccumulated() {
    SqlStatement s = ActiveQuery.from(d, "t")
        .where("a", 1)
        .where("b", 2)
        .orWhere("c", "=", 3)
        .toSql();
    assertEquals("SELECT * FROM \"t\" WHERE \"a\" = ? AND \"b\" = ? OR \"c\" = ?", s.sql());
  }

  @Test
  void notParenthesizesCompoundOperand() {
    assertEquals("NOT (\"a\" = ? AND \"b\" = ?)", d.render(not(and(eq(col("a"), 1), eq(col("b"), 2)))).sql());
    assertEquals("NOT \"active\"", d.render(not(col("active"))).sql());
  }

  @Test
  void arithmeticFollowsOperatorPrecedence() {
    assertEquals("\"a\" - (\"b\" - \"c\")", d.render(sub(col("a"), sub(col("b"), col("c")))).sql());
    assertEquals("(\"a\" + ?) * \"b\"", d.render(mul(add(col("a"), 1), col("b"))).sql());
    assertEquals("\"a\" * \"b\" + ?", d.render(add(mul(col("a"), col("b")), 1)).sql());
    assertEquals("\"first\" || \"last\"", d.render(concat(col("first"), col("last"))).sql());
  }

  @Test
  void emptyInListIsConstantPredicate() {
    SqlStatement in = ActiveQuery.from(d, "t").whereIn("id", List.of()).toSql();
    assertEquals("SELECT * FROM \"t\" WHERE 1 = 0", in.sql());
    assertTrue(in.binds().isEmpty());

    SqlStatement notIn = ActiveQuery.from(d, "t").whereNotIn("id", List.of()).toSql();
    assertEquals("SELECT * FROM \"t\" WHERE 1 = 1", notIn.sql());
  }

  @Test
  void betweenNullAndLikePredicates() {
    SqlStatement s = ActiveQuery.from(d, "t")
        .whereBetween("age", 18, 30)
        .whereNull("deleted_at")
        .whereLike("name", "jo%")
        .toSql();
    assertEquals("SELECT * FROM \"t\" WHERE \"age\" BETWEEN ? AND ? AND \"deleted_at\" IS NULL AND \"name\" LIKE ?", s.sql());
    assertEquals(List.of(18, 30, "jo%"), s.params());
  }

  @Test
  void numberedPlaceholdersContinueThroughSubqueries() {
    StubSqlDialect pg = StubSqlDialect.numbered();
    ActiveQuery big = ActiveQuery.from(pg, "orders").select("user_id").where("total", ">", 100);
    SqlStatement s = ActiveQuery.from(pg, "users")
        .where("age", ">", 18)
        .whereIn("id", big)
        .where("status", "active")
        .toSql();

    assertEquals("SELECT * FROM \"users\" WHERE \"age\" > $1 AND \"id\" IN "
        + "(SELECT \"user_id\" FROM \"orders\" WHERE \"total\" > $2) AND \"status\" = $3", s.sql());
    assertEquals(List.of(18, 100, "active"), s.params());
  }

  @Test
  void joinsGroupingAndAliases() {
    SqlStatement s = ActiveQuery.from(d, table("users").as("u"))
        .select(col("u.id"), alias(count(col("o.id")), "orders"))
        .leftJoin(table("orders").as("o"), eq(col("o.user_id"), col("u.id")))
        .groupBy("u.id")
        .having(gt(count(col("o.id")), 2))
        .toSql();

    assertEquals("SELECT \"u\".\"id\", COUNT(\"o\".\"id\") AS \"orders\" FROM \"users\" AS \"u\" "
        + "LEFT JOIN \"orders\" AS \"o\" ON \"o\".\"user_id\" = \"u\".\"id\" "
        + "GROUP BY \"u\".\"id\" HAVING COUNT(\"o\".\"id\") > ?", s.sql());
  }

  @Test
  void windowAndFilterRenderWhenSupported() {
    SqlStatement s = ActiveQuery.from(d, "scores")
        .select(alias(over(fn("row_number")).partitionBy(col("team")).orderBy(OrderTerm.desc(col("points"))), "rank"))
        .toSql();
    assertEquals("SELECT row_number() OVER (PARTITION BY \"team\" ORDER BY \"points\" DESC) AS \"rank\" FROM \"scores\"", s.sql());

    SqlFragment f = d.render(count().filter(eq(col("paid"), true)));
    assertEquals("COUNT(*) FILTER (WHERE \"paid\" = ?)", f.sql());
    assertEquals(List.of(true), f.params());
  }

  @Test
  void offsetOnlyRendersWhenAllowed() {
    assertEquals("SELECT * FROM \"t\" OFFSET ?", ActiveQuery.from(d, "t").offset(5).toSql().sql());
  }

  @Test
  void castUsesNativeTypeName() {
    assertEquals("CAST(\"n\" AS BIGINT)", d.render(cast(col("n"), LogicalType.BIGINT)).sql());
  }

  @Test
  void missingCapabilitiesFailBeforeSqlIsProduced() {
    StubSqlDialect bare = StubSqlDialect.bare();

    UnsupportedCapabilityException lock = assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").lockForUpdate());
    assertEquals(Capability.ROW_LOCKING, lock.capability());
    assertEquals(StubSqlDialect.ID, lock.dialectId());

    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").rightJoin("u", eq(col("t.id"), col("u.id"))));
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").offset(5).toSql());
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").orderBy(OrderTerm.asc(col("a")).nullsLast()));
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").select(over(fn("row_number"))).toSql());
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").select(count().filter(eq(col("a"), 1))).toSql());
    assertThrows(UnsupportedCapabilityException.class,
        () -> InsertQuery.into(bare, "t").values(Map.of("a", 1)).returning("id"));
  }

  @Test
  void insertUpdateDeleteRender() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("name", "ann");
    row.put("age", 31);
    SqlStatement ins = InsertQuery.into(d, "users").values(row).returning("id").toSql();
    assertEquals("INSERT INTO \"users\" (\"name\", \"age\") VALUES (?, ?) RETURNING \"id\"", ins.sql());
    assertEquals(StatementKind.INSERT, ins.kind());
    assertTrue(ins.returnsRows());

    SqlStatement upd = UpdateQuery.table(d, "users").set("age", 32).where("name", "ann").toSql();
    assertEquals("UPDATE \"users\" SET \"age\" = ? WHERE \"name\" = ?", upd.sql());
    assertEquals(List.of(32, "ann"), upd.params());
    assertFalse(upd.returnsRows());

    SqlStatement del = DeleteQuery.from(d, "users").where("age", null).toSql();
    assertEquals("DELETE FROM \"users\" WHERE \"age\" IS NULL", del.sql());
    assertEquals(StatementKind.DELETE, del.kind());
  }

  @Test
  void groupingElementsRenderInsideGroupBy() {
    SqlStatement rollup = ActiveQuery.from(d, "sales")
        .select(col("region"), col("city"), alias(sum(col("amount")), "total"))
        .groupBy(rollup(col("region"), col("city")))
        .toSql();
    assertEquals("SELECT \"region\", \"city\", SUM(\"amount\") AS \"total\" FROM \"sales\" "
        + "GROUP BY ROLLUP(\"region\", \"city\")", rollup.sql());

    SqlStatement cube = ActiveQuery.from(d, "sales").select(col("a"), col("b"), alias(grouping(col("a"), col("b")), "g"))
        .groupBy(cube(col("a"), col("b")))
        .toSql();
    assertEquals("SELECT \"a\", \"b\", GROUPING(\"a\", \"b\") AS \"g\" FROM \"sales\" GROUP BY CUBE(\"a\", \"b\")",
        cube.sql());

    SqlStatement sets = ActiveQuery.from(d, "sales").select(col("a"), col("b"))
        .groupBy(col("y"), groupingSets(List.of(col("a"), col("b")), List.of(col("c")), List.of()))
        .toSql();
    assertEquals("SELECT \"a\", \"b\" FROM \"sales\" GROUP BY \"y\", GROUPING SETS ((\"a\", \"b\"), (\"c\"), ())",
        sets.sql());
  }

  @Test
  void groupingElementsNeedAColumnList() {
    assertThrows(QueryConstructionException.class, () -> rollup());
    assertThrows(QueryConstructionException.class, () -> groupingSets());
  }

  @Test
  void upsertRendersConflictTargetAndExcludedValues() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("key", "k1");
    row.put("value", "v1");

    SqlStatement nothing = InsertQuery.into(d, "items").values(Map.of("item_id", 7)).onConflict("item_id").doNothing().toSql();
    assertEquals("INSERT INTO \"items\" (\"item_id\") VALUES (?) ON CONFLICT (\"item_id\") DO NOTHING", nothing.sql());
    assertEquals(List.of(7), nothing.params());

    SqlStatement update = InsertQuery.into(d, "kv").values(row).onConflict("key").doUpdate("value").returning("key").toSql();
    assertEquals("INSERT INTO \"kv\" (\"key\", \"value\") VALUES (?, ?) "
        + "ON CONFLICT (\"key\") DO UPDATE SET \"value\" = excluded.\"value\" RETURNING \"key\"", update.sql());
    assertEquals(List.of("k1", "v1"), update.params());

    Map<String, Object> set = new LinkedHashMap<>();
    set.put("value", excluded("value"));
    set.put("hits", add(col("kv.hits"), 1));
    SqlStatement guarded = InsertQuery.into(d, "kv").values(row)
        .onConflict("key").doUpdate(set, ne(col("kv.value"), excluded("value")))
        .toSql();
    assertEquals("INSERT INTO \"kv\" (\"key\", \"value\") VALUES (?, ?) ON CONFLICT (\"key\") DO UPDATE SET "
        + "\"value\" = excluded.\"value\", \"hits\" = \"kv\".\"hits\" + ? "
        + "WHERE \"kv\".\"value\" <> excluded.\"value\"", guarded.sql());
    assertEquals(List.of("k1", "v1", 1), guarded.params());
  }

  @Test
  void upsertUpdateNeedsTargetAndAssignments() {
    InsertQuery untargeted = InsertQuery.into(d, "kv").values(Map.of("key", "k")).onConflict().doUpdate("key");
    QueryConstructionException e = assertThrows(QueryConstructionException.class, untargeted::toSql);
    assertEquals("ON CONFLICT", e.clause());

    assertThrows(QueryConstructionException.class,
        () -> InsertQuery.into(d, "kv").values(Map.of("key", "k")).onConflict("key").doUpdate());
    assertEquals("INSERT INTO \"kv\" (\"key\") VALUES (?) ON CONFLICT DO NOTHING",
        InsertQuery.into(d, "kv").values(Map.of("key", "k")).onConflict().doNothing().toSql().sql());
  }

  @Test
  void groupingAndUpsertNeedCapabilities() {
    StubSqlDialect bare = StubSqlDialect.bare();
    UnsupportedCapabilityException rollup = assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").select("a").groupBy(rollup(col("a"))).toSql());
    assertEquals(Capability.ROLLUP, rollup.capability());
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").select("a").groupBy(cube(col("a"))).toSql());
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(bare, "t").select("a").groupBy(groupingSets(List.of(col("a")))).toSql());

    UnsupportedCapabilityException upsert = assertThrows(UnsupportedCapabilityException.class,
        () -> InsertQuery.into(bare, "t").values(Map.of("a", 1)).onConflict("a"));
    assertEquals(Capability.UPSERT, upsert.capability());
  }

  @Test
  void explainPrefixesCompiledSelect() {
    SqlStatement plan = d.explain(ActiveQuery.from(d, "t").where("a", 1).toSql());
    assertEquals("EXPLAIN SELECT * FROM \"t\" WHERE \"a\" = ?", plan.sql());
    assertEquals(List.of(1), plan.params());
  }
}
