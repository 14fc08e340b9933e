package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.IntegrityConstraintException.Violation;
import io.intellixity.relata.error.RecursionLimitExceededException;
import io.intellixity.relata.error.UnsupportedCapabilityException;
import io.intellixity.relata.exec.ConnectionState;
import io.intellixity.relata.exec.Propagation;
import io.intellixity.relata.exec.TableModel;
import io.intellixity.relata.jdbc.JdbcStorageBackend;
import io.intellixity.relata.query.ActiveQuery;
import io.intellixity.relata.query.CteQuery;
import io.intellixity.relata.query.CteQuery.DepthPolicy;
import io.intellixity.relata.query.InsertQuery;
import io.intellixity.relata.query.SetOperationQuery;
import io.intellixity.relata.query.UpdateQuery;
import io.intellixity.relata.types.LogicalType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.intellixity.relata.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class SqliteBackendTest {
  @TempDir
  Path dir;

  private JdbcStorageBackend backend;

  @BeforeEach
  void open() {
    backend = SqliteBackends.open(dir.resolve("app.db"));
  }

  @AfterEach
  void close() {
    backend.close();
  }

  private void ddl(String sql) {
    backend.execute(sql, List.of());
  }

  private void employees(int[][] rows) {
    ddl("CREATE TABLE employees (id INTEGER PRIMARY KEY, manager_id INTEGER)");
    for (int[] r : rows) {
      Map<String, Object> row = new HashMap<>();
      row.put("id", r[0]);
      row.put("manager_id", r[1] == 0 ? null : r[1]);
      InsertQuery.into(backend, "employees").columnType("manager_id", LogicalType.INTEGER).values(row).execute();
    }
  }

  private CteQuery subordinatesOf(int managerId) {
    ActiveQuery anchor = ActiveQuery.from(backend.dialect(), "employees")
        .select("id", "manager_id")
        .where("manager_id", managerId);
    ActiveQuery member = ActiveQuery.from(backend.dialect(), table("employees").as("e"))
        .select(col("e.id"), col("e.manager_id"))
        .join(cte("subordinates").as("s"), eq(col("e.manager_id"), col("s.id")));
    return CteQuery.on(backend).withRecursive("subordinates", List.of("id", "manager_id"), anchor, member);
  }

  private static List<Integer> ids(List<Map<String, Object>> rows) {
    List<Integer> out = new ArrayList<>();
    for (Map<String, Object> r : rows) out.add(((Number) r.get("id")).intValue());
    return out;
  }

  @Test
  void detectsBundledLibraryVersion() {
    SqliteDialect d = (SqliteDialect) backend.dialect();
    assertTrue(d.version().atLeast(3, 35, 0), d.version().toString());
    assertEquals(ConnectionState.DISCONNECTED, backend.state());
  }

  @Test
  void recursiveCteReturnsTransitiveReports() {
    employees(new int[][] {{1, 0}, {2, 1}, {3, 1}, {4, 2}, {5, 4}, {6, 0}});

    List<Map<String, Object>> rows = subordinatesOf(1).orderBy("id").all();

    assertEquals(List.of(2, 3, 4, 5), ids(rows));
  }

  @Test
  void depthBoundPassesWhenDataIsShallowEnough() {
    employees(new int[][] {{1, 0}, {2, 1}, {3, 1}, {4, 2}, {5, 4}});

    List<Map<String, Object>> rows = subordinatesOf(1).maxRecursionDepth(10, DepthPolicy.FAIL).orderBy("id").all();

    assertEquals(List.of(2, 3, 4, 5), ids(rows));
    assertFalse(rows.get(0).containsKey(CteQuery.DEPTH_COLUMN));
  }

  @Test
  void cyclicHierarchyIsRejectedUnderFailPolicy() {
    employees(new int[][] {{1, 3}, {2, 1}, {3, 2}});

    RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
        () -> subordinatesOf(1).maxRecursionDepth(10, DepthPolicy.FAIL).all());
    assertEquals("subordinates", e.cteName());
    assertEquals(10, e.maxDepth());
  }

  @Test
  void cyclicHierarchyIsRejectedWithoutExplicitBound() {
    employees(new int[][] {{1, 3}, {2, 1}, {3, 2}});

    RecursionLimitExceededException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
        () -> assertThrows(RecursionLimitExceededException.class, () -> subordinatesOf(1).all()));
    assertEquals(CteQuery.DEFAULT_MAX_DEPTH, e.maxDepth());
  }

  @Test
  void cyclicHierarchyTerminatesUnderTruncatePolicy() {
    employees(new int[][] {{1, 3}, {2, 1}, {3, 2}});

    List<Map<String, Object>> rows = subordinatesOf(1)
        .maxRecursionDepth(10, DepthPolicy.TRUNCATE)
        .select("id")
        .distinct()
        .orderBy("id")
        .all();

    assertEquals(List.of(1, 2, 3), ids(rows));
  }

  @Test
  void rowLockingFailsBeforeTouchingTheDatabase() {
    assertThrows(UnsupportedCapabilityException.class,
        () -> ActiveQuery.from(backend, "users").lockForUpdate().all());
    assertEquals(ConnectionState.DISCONNECTED, backend.state());
  }

  @Test
  void booleanIsStoredAsIntegerAndReadBackAsBoolean() {
    ddl("CREATE TABLE flags (id INTEGER PRIMARY KEY, active INTEGER NOT NULL)");
    InsertQuery.into(backend, "flags").values(Map.of("id", 1, "active", true)).execute();

    Map<String, Object> raw = backend.execute("SELECT typeof(active) AS t, active FROM flags", List.of()).rows().get(0);
    assertEquals("integer", raw.get("t"));
    assertEquals(1, ((Number) raw.get("active")).intValue());

    Map<String, Object> row = ActiveQuery.from(backend, "flags")
        .select("active")
        .columnType("active", LogicalType.BOOLEAN)
        .one()
        .orElseThrow();
    assertEquals(Boolean.TRUE, row.get("active"));
  }

  @Test
  void tableModelTypesRoundTrip() {
    ddl("CREATE TABLE payments (id TEXT PRIMARY KEY, amount TEXT, paid_at TEXT, meta TEXT)");
    TableModel model = TableModel.of("payments", Map.of(
        "id", LogicalType.UUID,
        "amount", LogicalType.DECIMAL,
        "paid_at", LogicalType.TIMESTAMP,
        "meta", LogicalType.JSON), "id");
    UUID id = UUID.randomUUID();
    Instant paidAt = Instant.parse("2024-03-01T10:15:30.123456Z");

    InsertQuery.into(backend, model)
        .values(Map.of("id", id, "amount", new BigDecimal("19.90"), "paid_at", paidAt, "meta", Map.of("tags", List.of("a"))))
        .execute();

    Map<String, Object> row = ActiveQuery.from(backend, model).one().orElseThrow();
    assertEquals(id, row.get("id"));
    assertEquals(new BigDecimal("19.90"), row.get("amount"));
    assertEquals(paidAt, row.get("paid_at"));
    assertEquals(Map.of("tags", List.of("a")), row.get("meta"));
  }

  @Test
  void constraintViolationsAreClassified() {
    ddl("CREATE TABLE teams (id INTEGER PRIMARY KEY)");
    ddl("CREATE TABLE users (id INTEGER PRIMARY KEY, email TEXT NOT NULL UNIQUE, team_id INTEGER REFERENCES teams(id))");
    InsertQuery.into(backend, "users").values(Map.of("id", 1, "email", "a@x")).execute();

    IntegrityConstraintException unique = assertThrows(IntegrityConstraintException.class,
        () -> InsertQuery.into(backend, "users").values(Map.of("id", 2, "email", "a@x")).execute());
    assertEquals(Violation.UNIQUE, unique.violation());
    assertEquals("users.email", unique.constraint());

    IntegrityConstraintException fk = assertThrows(IntegrityConstraintException.class,
        () -> InsertQuery.into(backend, "users").values(Map.of("id", 3, "email", "b@x", "team_id", 9)).execute());
    assertEquals(Violation.FOREIGN_KEY, fk.violation());

    IntegrityConstraintException notNull = assertThrows(IntegrityConstraintException.class,
        () -> UpdateQuery.table(backend, "users").set("email", null).where("id", 1).execute());
    assertEquals(Violation.NOT_NULL, notNull.violation());
  }

  @Test
  void insertReturningAndRowId() {
    ddl("CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT)");

    assertEquals(1L, ((Number) InsertQuery.into(backend, "notes").values(Map.of("body", "a")).execute().lastInsertId())
        .longValue());
    List<Map<String, Object>> returned = InsertQuery.into(backend, "notes")
        .values(Map.of("body", "b"))
        .returning("id", "body")
        .execute()
        .rows();
    assertEquals(2, ((Number) returned.get(0).get("id")).intValue());
    assertEquals("b", returned.get(0).get("body"));
  }

  @Test
  void upsertResolvesConflictsInPlace() {
    ddl("CREATE TABLE counters (name TEXT PRIMARY KEY, label TEXT, hits INTEGER NOT NULL DEFAULT 0)");
    InsertQuery.into(backend, "counters").values(Map.of("name", "a", "label", "one")).execute();

    InsertQuery.into(backend, "counters").values(Map.of("name", "a", "label", "ignored"))
        .onConflict("name").doNothing().execute();
    assertEquals("one", label("a"));

    Map<String, Object> bump = new LinkedHashMap<>();
    bump.put("label", excluded("label"));
    bump.put("hits", add(col("counters.hits"), 1));
    InsertQuery.into(backend, "counters").values(Map.of("name", "a", "label", "two")).onConflict("name").doUpdate(bump).execute();
    InsertQuery.into(backend, "counters").values(Map.of("name", "b", "label", "new")).onConflict("name").doUpdate(bump).execute();

    Map<String, Object> a = ActiveQuery.from(backend, "counters").where("name", "a").one().orElseThrow();
    assertEquals("two", a.get("label"));
    assertEquals(1, ((Number) a.get("hits")).intValue());
    assertEquals("new", label("b"));
    assertEquals(2L, ActiveQuery.from(backend, "counters").count());

    InsertQuery.into(backend, "counters").values(Map.of("name", "a", "label", "three"))
        .onConflict("name").doUpdate(Map.of("label", excluded("label")), gt(col("counters.hits"), 5))
        .execute();
    assertEquals("two", label("a"));
  }

  private Object label(String name) {
    return ActiveQuery.from(backend, "counters").select("label").where("name", name).one().orElseThrow().get("label");
  }

  @Test
  void offsetWithoutLimitAndWrappedSetOperandsExecute() {
    ddl("CREATE TABLE a (name TEXT)");
    ddl("CREATE TABLE b (name TEXT)");
    for (String n : List.of("x", "y")) InsertQuery.into(backend, "a").values(Map.of("name", n)).execute();
    for (String n : List.of("p", "q", "r")) InsertQuery.into(backend, "b").values(Map.of("name", n)).execute();

    List<Map<String, Object>> tail = ActiveQuery.from(backend, "b").select("name").orderBy("name").offset(1).all();
    assertEquals(List.of(Map.of("name", "q"), Map.of("name", "r")), tail);

    List<Map<String, Object>> union = SetOperationQuery.of(backend, ActiveQuery.from(backend.dialect(), "a").select("name"))
        .union(ActiveQuery.from(backend.dialect(), "b").select("name").orderByDesc("name").limit(1))
        .orderBy("name")
        .all();
    assertEquals(List.of(Map.of("name", "r"), Map.of("name", "x"), Map.of("name", "y")), union);
  }

  @Test
  void cteAndSetOperationTerminalsExecute() {
    employees(new int[][] {{1, 0}, {2, 1}, {3, 1}, {4, 2}});

    assertEquals(3L, subordinatesOf(1).count());
    assertTrue(subordinatesOf(2).exists());
    assertFalse(subordinatesOf(4).exists());
    assertEquals(2, ((Number) subordinatesOf(1).orderBy("id").one().orElseThrow().get("id")).intValue());

    ActiveQuery managers = ActiveQuery.from(backend.dialect(), "employees").select("manager_id").where(isNotNull(col("manager_id")));
    ActiveQuery all = ActiveQuery.from(backend.dialect(), "employees").select("id");
    assertEquals(2L, SetOperationQuery.of(backend, managers).intersect(all).count());
    assertFalse(SetOperationQuery.of(backend, ActiveQuery.from(backend.dialect(), "employees").select("id").where("id", 4))
        .except(ActiveQuery.from(backend.dialect(), "employees").select("id"))
        .exists());
  }

  @Test
  void savepointsNestInsideTransactions() {
    ddl("CREATE TABLE notes (id INTEGER PRIMARY KEY, body TEXT)");

    backend.inTx(() -> {
      InsertQuery.into(backend, "notes").values(Map.of("body", "kept")).execute();
      assertThrows(IllegalStateException.class, () -> backend.inTx(Propagation.NESTED, () -> {
        InsertQuery.into(backend, "notes").values(Map.of("body", "dropped")).execute();
        throw new IllegalStateException("undo");
      }));
      return null;
    });

    assertEquals(List.of(Map.of("body", "kept")), ActiveQuery.from(backend, "notes").select("body").all());
  }

  @Test
  void windowFunctionsRunOnBundledLibrary() {
    ddl("CREATE TABLE scores (player TEXT, points INTEGER)");
    InsertQuery.into(backend, "scores").values(List.of(
        Map.of("player", "ann", "points", 10),
        Map.of("player", "bob", "points", 30),
        Map.of("player", "cid", "points", 20))).execute();

    List<Map<String, Object>> rows = ActiveQuery.from(backend, "scores")
        .select(col("player"), alias(window(fn("ROW_NUMBER"), List.of(), List.of(desc(col("points"))), null), "rank"))
        .orderBy("player")
        .all();

    assertEquals(3, ((Number) rows.get(0).get("rank")).intValue());
    assertEquals(1, ((Number) rows.get(1).get("rank")).intValue());
  }
}
