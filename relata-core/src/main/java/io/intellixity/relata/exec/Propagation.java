package io.intellixity.relata.exec;

/**
 * Transaction propagation behavior for {@link StorageBackend#inTx(Propagation, java.util.function.Supplier)}.
 * <p>
 * Modeled on Spring's propagation settings, without any Spring dependency. A backend owns a single
 * connection, so there is no suspension and therefore no REQUIRES_NEW.
 */
public enum Propagation {
  /** Join the current transaction, begin one if none is open. */
  REQUIRED,

  /** Join the current transaction, run non-transactionally if none is open. */
  SUPPORTS,

  /** Join the current transaction, throw if none is open. */
  MANDATORY,

  /** Run non-transactionally, throw if a transaction is open. */
  NEVER,

  /** Run inside a savepoint when a transaction is open, otherwise behave like {@link #REQUIRED}. */
  NESTED
}
