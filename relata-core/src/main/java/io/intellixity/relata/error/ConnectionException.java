package io.intellixity.relata.error;

/** Failure to reach or authenticate against the database. Potentially transient. */
public final class ConnectionException extends RelataException {
  public ConnectionException(String dialectId, String message, Throwable cause) {
    super(ErrorKind.CONNECTION, dialectId, null, message, cause);
  }

  @Override
  public boolean retryable() { return true; }
}
