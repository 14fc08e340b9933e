package io.intellixity.relata.error;

/** Statement failure reported by the database that fits no narrower category. */
public class QueryExecutionException extends RelataException {
  public QueryExecutionException(String dialectId, String message, Throwable cause) {
    super(ErrorKind.EXECUTION, dialectId, null, message, cause);
  }

  protected QueryExecutionException(String dialectId, String clause, String message) {
    super(ErrorKind.EXECUTION, dialectId, clause, message);
  }
}
