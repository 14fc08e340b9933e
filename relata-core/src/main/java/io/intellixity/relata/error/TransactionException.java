package io.intellixity.relata.error;

/** Invalid transaction operation: nesting without savepoints, late isolation change, DDL policy. */
public final class TransactionException extends RelataException {
  public TransactionException(String dialectId, String message) {
    super(ErrorKind.TRANSACTION, dialectId, null, message);
  }

  public TransactionException(String dialectId, String message, Throwable cause) {
    super(ErrorKind.TRANSACTION, dialectId, null, message, cause);
  }
}
