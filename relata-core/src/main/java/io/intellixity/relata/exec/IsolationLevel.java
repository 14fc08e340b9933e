package io.intellixity.relata.exec;

public enum IsolationLevel {
  READ_UNCOMMITTED(1),
  READ_COMMITTED(2),
  REPEATABLE_READ(4),
  SERIALIZABLE(8);

  private final int jdbcLevel;

  IsolationLevel(int jdbcLevel) {
    this.jdbcLevel = jdbcLevel;
  }

  /** Matching {@code java.sql.Connection.TRANSACTION_*} constant. */
  public int jdbcLevel() { return jdbcLevel; }

  /** SQL spelling, e.g. {@code READ COMMITTED}. */
  public String sql() { return name().replace('_', ' '); }
}
