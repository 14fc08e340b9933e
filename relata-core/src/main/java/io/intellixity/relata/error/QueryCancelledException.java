package io.intellixity.relata.error;

/** In-flight statement was cancelled; partial results were discarded. */
public final class QueryCancelledException extends RelataException {
  public QueryCancelledException(String dialectId, String message, Throwable cause) {
    super(ErrorKind.CANCELLED, dialectId, null, message, cause);
  }
}
