package io.intellixity.relata.error;

/**
 * Raised when a query is malformed: undefined CTE reference, mismatched set-operation arity,
 * unmapped logical type, invalid identifier and similar.
 * <p>
 * Always raised before any I/O; the remedy is fixing the query construction.
 */
public final class QueryConstructionException extends RelataException {
  public QueryConstructionException(String message) {
    this(null, null, message);
  }

  public QueryConstructionException(String dialectId, String clause, String message) {
    super(ErrorKind.CONSTRUCTION, dialectId, clause, message);
  }

  public QueryConstructionException(String dialectId, String clause, String message, Throwable cause) {
    super(ErrorKind.CONSTRUCTION, dialectId, clause, message, cause);
  }
}
