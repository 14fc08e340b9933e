package io.intellixity.relata.statement;

import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.OrderTerm;
import io.intellixity.relata.expression.Star;
import io.intellixity.relata.sql.StatementKind;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [WITH ...] SELECT [DISTINCT] columns FROM from joins WHERE ... GROUP BY ... HAVING ...
 * ORDER BY ... LIMIT/OFFSET [lock]}.\n
 *
 * An empty column list means {@code *}. {@code from} may be null for table-less selects.
 */
public record SelectStatement(
    WithClause with,
    boolean distinct,
    List<Expression> columns,
    Expression from,
    List<Join> joins,
    Expression where,
    List<Expression> groupBy,
    Expression having,
    List<OrderTerm> orderBy,
    Long limit,
    Long offset,
    LockMode lock
) implements Statement {
  public SelectStatement {
    columns = columns == null ? List.of() : List.copyOf(columns);
    joins = joins == null ? List.of() : List.copyOf(joins);
    groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
    orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    lock = lock == null ? LockMode.NONE : lock;
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset != null && offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  @Override
  public StatementKind kind() { return StatementKind.SELECT; }

  /** Whether the select list names its columns (no {@code *}), so its arity is known statically. */
  public boolean hasExplicitColumns() {
    if (columns.isEmpty()) return false;
    for (Expression c : columns) if (c instanceof Star) return false;
    return true;
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.with = with;
    b.distinct = distinct;
    b.columns.addAll(columns);
    b.from = from;
    b.joins.addAll(joins);
    b.where = where;
    b.groupBy.addAll(groupBy);
    b.having = having;
    b.orderBy.addAll(orderBy);
    b.limit = limit;
    b.offset = offset;
    b.lock = lock;
    return b;
  }

  public static Builder builder() { return new Builder(); }

  public static final class Builder {
    private WithClause with;
    private boolean distinct;
    private final List<Expression> columns = new ArrayList<>();
    private Expression from;
    private final List<Join> joins = new ArrayList<>();
    private Expression where;
    private final List<Expression> groupBy = new ArrayList<>();
    private Expression having;
    private final List<OrderTerm> orderBy = new ArrayList<>();
    private Long limit;
    private Long offset;
    private LockMode lock = LockMode.NONE;

    public Builder with(WithClause with) { this.with = with; return this; }
    public Builder distinct(boolean distinct) { this.distinct = distinct; return this; }
    public Builder columns(List<? extends Expression> cols) { columns.clear(); columns.addAll(cols); return this; }
    public Builder column(Expression col) { columns.add(col); return this; }
    public Builder from(Expression from) { this.from = from; return this; }
    public Builder join(Join join) { joins.add(join); return this; }
    public Builder where(Expression where) { this.where = where; return this; }
    public Builder groupBy(List<? extends Expression> g) { groupBy.clear(); groupBy.addAll(g); return this; }
    public Builder having(Expression having) { this.having = having; return this; }
    public Builder orderBy(List<OrderTerm> o) { orderBy.clear(); orderBy.addAll(o); return this; }
    public Builder limit(Long limit) { this.limit = limit; return this; }
    public Builder offset(Long offset) { this.offset = offset; return this; }
    public Builder lock(LockMode lock) { this.lock = lock; return this; }

    public SelectStatement build() {
      return new SelectStatement(with, distinct, columns, from, joins, where, groupBy, having, orderBy, limit, offset, lock);
    }
  }
}
