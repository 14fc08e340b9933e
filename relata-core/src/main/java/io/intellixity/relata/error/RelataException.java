package io.intellixity.relata.error;

/**
 * Base of the engine's error taxonomy.
 * <p>
 * The message always names the {@link ErrorKind}, the dialect involved (when known) and, for
 * construction and capability errors, the offending clause.
 */
public class RelataException extends RuntimeException {
  private final ErrorKind kind;
  private final String dialectId;
  private final String clause;

  public RelataException(ErrorKind kind, String dialectId, String clause, String message) {
    this(kind, dialectId, clause, message, null);
  }

  public RelataException(ErrorKind kind, String dialectId, String clause, String message, Throwable cause) {
    super(format(kind, dialectId, clause, message), cause);
    this.kind = kind == null ? ErrorKind.EXECUTION : kind;
    this.dialectId = dialectId;
    this.clause = clause;
  }

  public ErrorKind kind() { return kind; }
  public String dialectId() { return dialectId; }
  public String clause() { return clause; }

  /** Whether a caller may reasonably retry the same operation. The engine itself never retries. */
  public boolean retryable() { return false; }

  private static String format(ErrorKind kind, String dialectId, String clause, String message) {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(kind == null ? ErrorKind.EXECUTION : kind).append(']');
    if (dialectId != null) sb.append(" dialect=").append(dialectId);
    if (clause != null) sb.append(" clause=").append(clause);
    sb.append(": ").append(message);
    return sb.toString();
  }
}
