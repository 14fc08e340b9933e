package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.List;
import java.util.Objects;

/**
 * GROUP BY element that produces super-aggregate rows.\n
 *
 * ROLLUP and CUBE carry exactly one column set. GROUPING SETS carries one or more sets; an empty
 * set is the grand total {@code ()}.
 */
public record Grouping(Kind kind, List<List<Expression>> sets) implements Expression {
  public enum Kind {
    ROLLUP("ROLLUP"),
    CUBE("CUBE"),
    GROUPING_SETS("GROUPING SETS");

    private final String keyword;

    Kind(String keyword) {
      this.keyword = keyword;
    }

    public String keyword() { return keyword; }
  }

  public Grouping {
    Objects.requireNonNull(kind, "kind");
    sets = sets == null ? List.of() : sets.stream().map(List::copyOf).toList();
    if (sets.isEmpty()) {
      throw new QueryConstructionException(null, kind.keyword(), kind.keyword() + " needs at least one column set");
    }
    if (kind != Kind.GROUPING_SETS && (sets.size() != 1 || sets.get(0).isEmpty())) {
      throw new QueryConstructionException(null, kind.keyword(), kind.keyword() + " takes one non-empty column list");
    }
  }

  /** Columns of a ROLLUP or CUBE. */
  public List<Expression> columns() {
    return sets.get(0);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) {
    return visitor.visit(this);
  }
}
