package io.intellixity.relata.error;

/** The database rejected a statement because it violates a constraint. */
public final class IntegrityConstraintException extends RelataException {
  public enum Violation { UNIQUE, FOREIGN_KEY, NOT_NULL, CHECK, OTHER }

  private final Violation violation;
  private final String constraint;

  public IntegrityConstraintException(String dialectId, Violation violation, String constraint,
                                      String message, Throwable cause) {
    super(ErrorKind.INTEGRITY, dialectId, null,
        message + " (violation=" + violation + (constraint == null ? "" : ", constraint=" + constraint) + ")", cause);
    this.violation = violation == null ? Violation.OTHER : violation;
    this.constraint = constraint;
  }

  public Violation violation() { return violation; }

  /** Constraint (or {@code table.column}) named by the backend, or null when it does not say. */
  public String constraint() { return constraint; }
}
