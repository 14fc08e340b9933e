package io.intellixity.relata.error;

/** Statement exceeded its timeout. Any open transaction has been rolled back. */
public final class QueryTimeoutException extends RelataException {
  public QueryTimeoutException(String dialectId, String message, Throwable cause) {
    super(ErrorKind.TIMEOUT, dialectId, null, message, cause);
  }
}
