package io.intellixity.relata.jdbc.sqlite;

import io.intellixity.relata.error.ConcurrencyException;
import io.intellixity.relata.error.ConnectionException;
import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.IntegrityConstraintException.Violation;
import io.intellixity.relata.error.QueryTimeoutException;
import io.intellixity.relata.error.RelataException;
import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** SQLite result codes: the driver reports no SQLState, so mapping goes by extended result code. */
final class SqliteErrorTranslator extends JdbcErrorTranslator {
  private static final Pattern CONSTRAINT = Pattern.compile("constraint failed: ([^)\\s]+)");

  @Override
  protected RelataException translateVendor(String dialectId, SQLException e) {
    if (!(e instanceof SQLiteException se)) return null;
    SQLiteErrorCode code = se.getResultCode();
    String name = code == null ? "" : code.name();
    String msg = e.getMessage() == null ? name : e.getMessage();

    if (name.startsWith("SQLITE_CONSTRAINT")) {
      return new IntegrityConstraintException(dialectId, resultCodeViolation(name), constraintName(msg), msg, e);
    }
    if (name.startsWith("SQLITE_BUSY") || name.startsWith("SQLITE_LOCKED")) {
      return new ConcurrencyException(dialectId, ConcurrencyException.Reason.LOCK_TIMEOUT, msg, e);
    }
    if (name.equals("SQLITE_INTERRUPT")) {
      return new QueryTimeoutException(dialectId, "statement interrupted: " + msg, e);
    }
    if (name.startsWith("SQLITE_CANTOPEN") || name.equals("SQLITE_NOTADB") || name.equals("SQLITE_AUTH")) {
      return new ConnectionException(dialectId, msg, e);
    }
    return null;
  }

  static Violation resultCodeViolation(String codeName) {
    if (codeName.endsWith("_UNIQUE") || codeName.endsWith("_PRIMARYKEY")) return Violation.UNIQUE;
    if (codeName.endsWith("_FOREIGNKEY")) return Violation.FOREIGN_KEY;
    if (codeName.endsWith("_NOTNULL")) return Violation.NOT_NULL;
    if (codeName.endsWith("_CHECK")) return Violation.CHECK;
    return Violation.OTHER;
  }

  static String constraintName(String message) {
    Matcher m = CONSTRAINT.matcher(message);
    return m.find() ? m.group(1) : null;
  }
}
