package io.intellixity.relata.error;

/**
 * Lock contention or version conflict.
 * <p>
 * Deadlocks and serialization failures may be retried by the caller; lock timeouts should not be
 * retried without backoff.
 */
public final class ConcurrencyException extends RelataException {
  public enum Reason { DEADLOCK, LOCK_TIMEOUT, SERIALIZATION, OPTIMISTIC_VERSION }

  private final Reason reason;

  public ConcurrencyException(String dialectId, Reason reason, String message, Throwable cause) {
    super(ErrorKind.CONCURRENCY, dialectId, null, message + " (reason=" + reason + ")", cause);
    this.reason = reason;
  }

  public Reason reason() { return reason; }

  @Override
  public boolean retryable() {
    return reason == Reason.DEADLOCK || reason == Reason.SERIALIZATION;
  }
}
