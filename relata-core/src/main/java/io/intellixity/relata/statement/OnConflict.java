package io.intellixity.relata.statement;

import io.intellixity.relata.error.QueryConstructionException;
import io.intellixity.relata.expression.Expression;
import io.intellixity.relata.expression.Identifiers;

import java.util.List;

/**
 * Upsert tail of an INSERT: {@code ON CONFLICT (target) DO NOTHING | DO UPDATE SET ... [WHERE ...]}.\n
 *
 * No assignments means DO NOTHING. {@code where} filters which conflicting rows get updated and
 * is only valid together with assignments.
 */
public record OnConflict(List<String> target, List<Assignment> updates, Expression where) {
  public OnConflict {
    target = target == null ? List.of() : List.copyOf(target);
    for (String c : target) Identifiers.require(c, "column");
    updates = updates == null ? List.of() : List.copyOf(updates);
    if (where != null && updates.isEmpty()) {
      throw new QueryConstructionException(null, "ON CONFLICT", "WHERE needs DO UPDATE assignments");
    }
  }

  public static OnConflict doNothing(List<String> target) {
    return new OnConflict(target, List.of(), null);
  }

  public boolean doNothing() {
    return updates.isEmpty();
  }
}
