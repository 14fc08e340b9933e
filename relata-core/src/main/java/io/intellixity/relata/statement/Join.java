package io.intellixity.relata.statement;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.expression.Expression;

import java.util.Objects;

/** {@code type JOIN source [ON on]}; CROSS joins carry no condition, every other type requires one. */
public record Join(JoinType type, Expression source, Expression on) {
  public Join {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    if (type == JoinType.CROSS && on != null) {
      throw new QueryConstructionException(null, "JOIN", "CROSS JOIN takes no ON condition");
    }
    if (type != JoinType.CROSS && on == null) {
      throw new QueryConstructionException(null, "JOIN", type + " join requires an ON condition");
    }
  }
}
