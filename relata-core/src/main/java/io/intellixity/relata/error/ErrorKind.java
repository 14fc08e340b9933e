package io.intellixity.relata.error;

/** Backend-neutral failure categories surfaced by the engine. */
public enum ErrorKind {
  /** Malformed query structure; raised before any I/O. */
  CONSTRUCTION,
  /** Construct not supported by the active dialect; raised at render time. */
  CAPABILITY,
  /** Transport or authentication failure. */
  CONNECTION,
  /** Unique, foreign key, not-null or check violation. */
  INTEGRITY,
  /** Deadlock, lock timeout, serialization failure or optimistic version mismatch. */
  CONCURRENCY,
  /** A value has no valid mapping to or from its logical type. */
  TYPE_CONVERSION,
  /** Any other statement failure reported by the database. */
  EXECUTION,
  TIMEOUT,
  CANCELLED,
  /** Invalid transaction state transition. */
  TRANSACTION
}
