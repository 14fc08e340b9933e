package io.intellixity.relata.query;

import io.intellixity.relata.expression.*;
import io.intellixity.relata.statement.*;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Collects the CTE names referenced anywhere in a statement, including nested subqueries. */
final class CteReferences implements ExpressionVisitor<Void> {
  private final Set<String> names = new LinkedHashSet<>();

  private CteReferences() {}

  static Set<String> of(Statement statement) {
    CteReferences r = new CteReferences();
    r.statement(statement);
    return r.names;
  }

  private void statement(Statement s) {
    if (s instanceof SelectStatement sel) {
      // names defined by a nested WITH are local to it
      Set<String> local = new LinkedHashSet<>();
      CteReferences inner = new CteReferences();
      if (sel.with() != null) {
        for (CteDefinition d : sel.with().definitions()) {
          local.add(d.name());
          inner.statement(d.body());
        }
      }
      inner.all(sel.columns());
      inner.expr(sel.from());
      for (Join j : sel.joins()) {
        inner.expr(j.source());
        inner.expr(j.on());
      }
      inner.expr(sel.where());
      inner.all(sel.groupBy());
      inner.expr(sel.having());
      for (OrderTerm o : sel.orderBy()) inner.expr(o.expression());
      for (String n : inner.names) if (!local.contains(n)) names.add(n);
    } else if (s instanceof SetOperationStatement so) {
      statement(so.left());
      statement(so.right());
      for (OrderTerm o : so.orderBy()) expr(o.expression());
    } else if (s instanceof InsertStatement ins) {
      for (List<Expression> row : ins.rows()) all(row);
      if (ins.onConflict() != null) {
        for (Assignment a : ins.onConflict().updates()) expr(a.value());
        expr(ins.onConflict().where());
      }
    } else if (s instanceof UpdateStatement up) {
      for (Assignment a : up.assignments()) expr(a.value());
      expr(up.where());
    } else if (s instanceof DeleteStatement del) {
      expr(del.where());
    }
  }

  private void expr(Expression e) {
    if (e != null) e.accept(this);
  }

  private void all(List<? extends Expression> es) {
    if (es != null) for (Expression e : es) expr(e);
  }

  @Override public Void visit(Column column) { return null; }
  @Override public Void visit(Literal literal) { return null; }
  @Override public Void visit(Comparison c) { expr(c.left()); expr(c.right()); return null; }
  @Override public Void visit(Logical l) { all(l.children()); return null; }

  @Override
  public Void visit(Aggregate a) {
    expr(a.argument());
    expr(a.filter());
    return null;
  }

  @Override
  public Void visit(Window w) {
    expr(w.function());
    all(w.partitionBy());
    for (OrderTerm o : w.orderBy()) expr(o.expression());
    return null;
  }

  @Override public Void visit(CteRef cteRef) { names.add(cteRef.name()); return null; }
  @Override public Void visit(Subquery subquery) { statement(subquery.statement()); return null; }
  @Override public Void visit(TableRef tableRef) { return null; }
  @Override public Void visit(Star star) { return null; }
  @Override public Void visit(FunctionCall f) { all(f.arguments()); return null; }
  @Override public Void visit(Arithmetic a) { expr(a.left()); expr(a.right()); return null; }
  @Override public Void visit(Cast c) { expr(c.expression()); return null; }
  @Override public Void visit(IsNull n) { expr(n.expression()); return null; }

  @Override
  public Void visit(InList in) {
    expr(in.expression());
    all(in.values());
    expr(in.subquery());
    return null;
  }

  @Override public Void visit(Between b) { expr(b.expression()); expr(b.low()); expr(b.high()); return null; }
  @Override public Void visit(Exists e) { expr(e.subquery()); return null; }

  @Override
  public Void visit(CaseWhen c) {
    for (CaseWhen.Branch b : c.branches()) {
      expr(b.when());
      expr(b.then());
    }
    expr(c.otherwise());
    return null;
  }

  @Override public Void visit(Aliased a) { expr(a.expression()); return null; }

  @Override
  public Void visit(Grouping g) {
    for (List<Expression> set : g.sets()) all(set);
    return null;
  }

  @Override public Void visit(Excluded excluded) { return null; }
}
