package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.statement.Assignment;
import io.intellixity.relata.statement.OnConflict;
import io.intellixity.relata.types.LogicalType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.relata.expression.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

final class ExpressionsTest {
  @Test
  void col_splitsQualifier() {
    Column c = col("e.manager_id");
    assertEquals("e", c.table());
    assertEquals("manager_id", c.name());
    assertNull(col("age").table());
    assertEquals("total", col("o.amount").as("total").label());
  }

  @Test
  void col_rejectsSchemaQualifiedReference() {
    QueryConstructionException e = assertThrows(QueryConstructionException.class, () -> col("s.t.c"));
    assertTrue(e.getMessage().contains("more than one qualifier"), e.getMessage());
  }

  @Test
  void and_flattensNestedGroups() {
    Expression a = gt(col("age"), 18);
    Expression b = eq(col("status"), "active");
    Expression c = lt(col("score"), 10);

    Logical l = (Logical) and(and(a, b), c);
    assertEquals(LogicalOperator.AND, l.operator());
    assertEquals(List.of(a, b, c), l.children());
  }

  @Test
  void or_doesNotAbsorbAndGroups() {
    Expression a = gt(col("age"), 18);
    Expression b = eq(col("status"), "active");
    Expression c = lt(col("score"), 10);

    Logical l = (Logical) or(and(a, b), c);
    assertEquals(2, l.children().size());
    assertInstanceOf(Logical.class, l.children().get(0));
  }

  @Test
  void singleOperandGroup_isTheOperandItself() {
    Expression a = gt(col("age"), 18);
    assertSame(a, and(a));
    assertSame(a, or(a, null));
  }

  @Test
  void eqNull_becomesIsNull() {
    IsNull n = (IsNull) eq(col("deleted_at"), null);
    assertFalse(n.negated());
    assertTrue(((IsNull) ne(col("deleted_at"), null)).negated());
  }

  @Test
  void plainValuesBecomeTypedLiterals() {
    Comparison c = (Comparison) eq(col("id"), 10L);
    Literal lit = (Literal) c.right();
    assertEquals(10L, lit.value());
    assertEquals(LogicalType.BIGINT, lit.type());
  }

  @Test
  void literalToStringNeverShowsValue() {
    assertFalse(lit("s3cret").toString().contains("s3cret"));
  }

  @Test
  void blankIdentifiers_areRejected() {
    assertThrows(QueryConstructionException.class, () -> col(" "));
    assertThrows(QueryConstructionException.class, () -> col("t", "a\0b"));
  }

  @Test
  void functionNamesMustBePlainWords() {
    assertEquals("lower", fn("lower", col("name")).name());
    assertThrows(QueryConstructionException.class, () -> fn("lower(x); DROP TABLE t; --", col("name")));
  }

  @Test
  void notTakesExactlyOneOperand() {
    assertThrows(QueryConstructionException.class,
        () -> new Logical(LogicalOperator.NOT, List.of(col("a"), col("b"))));
    assertThrows(QueryConstructionException.class, () -> new Logical(LogicalOperator.AND, List.of()));
  }

  @Test
  void groupingSets_keepEmptySetAsGrandTotal() {
    Grouping g = groupingSets(List.of(col("a"), col("b")), List.of());
    assertEquals(Grouping.Kind.GROUPING_SETS, g.kind());
    assertEquals(2, g.sets().size());
    assertTrue(g.sets().get(1).isEmpty());
    assertEquals(List.of(col("x")), rollup(col("x")).columns());
    assertThrows(QueryConstructionException.class,
        () -> new Grouping(Grouping.Kind.CUBE, List.of(List.of(col("a")), List.of(col("b")))));
  }

  @Test
  void onConflict_whereNeedsAssignments() {
    assertTrue(OnConflict.doNothing(List.of("id")).doNothing());
    assertThrows(QueryConstructionException.class, () -> new OnConflict(List.of("id"), List.of(), eq(col("a"), 1)));
    OnConflict update = new OnConflict(List.of("id"), List.of(new Assignment(col("a"), excluded("a"))), null);
    assertFalse(update.doNothing());
  }
}
