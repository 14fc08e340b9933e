package io.intellixity.relata.expression;

/** One method per node variant; adding a variant breaks every renderer at compile time. */
public interface ExpressionVisitor<R> {
  R visit(Column column);
  R visit(Literal literal);
  R visit(Comparison comparison);
  R visit(Logical logical);
  R visit(Aggregate aggregate);
  R visit(Window window);
  R visit(CteRef cteRef);
  R visit(Subquery subquery);
  R visit(TableRef tableRef);
  R visit(Star star);
  R visit(FunctionCall functionCall);
  R visit(Arithmetic arithmetic);
  R visit(Cast cast);
  R visit(IsNull isNull);
  R visit(InList inList);
  R visit(Between between);
  R visit(Exists exists);
  R visit(CaseWhen caseWhen);
  R visit(Aliased aliased);
  R visit(Grouping grouping);
  R visit(Excluded excluded);
}
