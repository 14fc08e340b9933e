package io.intellixity.relata.expression;

import io.intellixity.relata.error.QueryConstructionException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Searched CASE. {@code otherwise} may be null. */
public record CaseWhen(List<Branch> branches, Expression otherwise) implements Expression {
  public CaseWhen {
    branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
    if (branches.isEmpty()) throw new QueryConstructionException(null, "CASE", "CASE requires at least one WHEN");
  }

  public CaseWhen when(Expression condition, Expression result) {
    List<Branch> out = new ArrayList<>(branches);
    out.add(new Branch(condition, result));
    return new CaseWhen(out, otherwise);
  }

  public CaseWhen otherwise(Expression result) {
    return new CaseWhen(branches, result);
  }

  public record Branch(Expression when, Expression then) {
    public Branch {
      Objects.requireNonNull(when, "when");
      Objects.requireNonNull(then, "then");
    }
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visit(this); }
}
