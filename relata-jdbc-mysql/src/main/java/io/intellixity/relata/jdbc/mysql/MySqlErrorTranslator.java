package io.intellixity.relata.jdbc.mysql;

import io.intellixity.relata.error.ConcurrencyException;
import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.IntegrityConstraintException.Violation;
import io.intellixity.relata.error.QueryTimeoutException;
import io.intellixity.relata.error.RelataException;
import io.intellixity.relata.jdbc.JdbcErrorTranslator;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** MySQL server error numbers; SQLState 23000 alone does not tell the violation apart. */
final class MySqlErrorTranslator extends JdbcErrorTranslator {
  private static final Pattern DUPLICATE_KEY = Pattern.compile("for key '([^']+)'");
  private static final Pattern NAMED_CONSTRAINT = Pattern.compile("CONSTRAINT `([^`]+)`");

  @Override
  protected RelataException translateVendor(String dialectId, SQLException e) {
    String msg = e.getMessage() == null ? "" : e.getMessage();
    switch (e.getErrorCode()) {
      case 1062:
        return new IntegrityConstraintException(dialectId, Violation.UNIQUE, group(DUPLICATE_KEY, msg), msg, e);
      case 1451:
      case 1452:
        return new IntegrityConstraintException(dialectId, Violation.FOREIGN_KEY, group(NAMED_CONSTRAINT, msg), msg, e);
      case 1048:
        return new IntegrityConstraintException(dialectId, Violation.NOT_NULL, null, msg, e);
      case 3819:
        return new IntegrityConstraintException(dialectId, Violation.CHECK, null, msg, e);
      case 1213:
        return new ConcurrencyException(dialectId, ConcurrencyException.Reason.DEADLOCK, msg, e);
      case 1205:
        return new ConcurrencyException(dialectId, ConcurrencyException.Reason.LOCK_TIMEOUT, msg, e);
      case 1317:
      case 3024:
        return new QueryTimeoutException(dialectId, "statement interrupted: " + msg, e);
      default:
        return null;
    }
  }

  private static String group(Pattern p, String msg) {
    Matcher m = p.matcher(msg);
    return m.find() ? m.group(1) : null;
  }
}
