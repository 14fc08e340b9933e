package io.intellixity.relata.jdbc;

import io.intellixity.relata.error.ConcurrencyException;
import io.intellixity.relata.error.ConnectionException;
import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.IntegrityConstraintException.Violation;
import io.intellixity.relata.error.QueryExecutionException;
import io.intellixity.relata.error.QueryTimeoutException;
import io.intellixity.relata.error.RelataException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Maps {@link SQLException}s onto the engine's error taxonomy.\n
 *
 * Resolution:\n
 * - {@link #translateVendor} (dialect subclasses: vendor error codes and messages)\n
 * - SQLState classes: 08 connection, 23 integrity, 40 concurrency, 57014 / HYT00 timeout\n
 * - anything else is a {@link QueryExecutionException}\n
 */
public class JdbcErrorTranslator {
  public final RelataException translate(String dialectId, SQLException e) {
    RelataException vendor = translateVendor(dialectId, e);
    if (vendor != null) return vendor;
    return translateStandard(dialectId, e);
  }

  /** Failures while obtaining or configuring a connection are always connection errors. */
  public final RelataException translateConnect(String dialectId, SQLException e) {
    return new ConnectionException(dialectId, "failed to open connection: " + e.getMessage(), e);
  }

  /** Dialect-specific mapping; null falls through to the SQLState mapping. */
  protected RelataException translateVendor(String dialectId, SQLException e) {
    return null;
  }

  protected RelataException translateStandard(String dialectId, SQLException e) {
    String state = e.getSQLState() == null ? "" : e.getSQLState();
    String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();

    if (e instanceof SQLTimeoutException || state.equals("57014") || state.startsWith("HYT")) {
      return new QueryTimeoutException(dialectId, "statement timed out: " + msg, e);
    }
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException
        || state.startsWith("08")) {
      return new ConnectionException(dialectId, msg, e);
    }
    if (state.startsWith("23")) {
      return new IntegrityConstraintException(dialectId, violation(state), null, msg, e);
    }
    if (state.equals("40001")) {
      return new ConcurrencyException(dialectId, ConcurrencyException.Reason.SERIALIZATION, msg, e);
    }
    if (state.startsWith("40")) {
      ConcurrencyException.Reason reason = msg.toLowerCase().contains("deadlock")
          ? ConcurrencyException.Reason.DEADLOCK
          : ConcurrencyException.Reason.SERIALIZATION;
      return new ConcurrencyException(dialectId, reason, msg, e);
    }
    return new QueryExecutionException(dialectId, msg + (state.isEmpty() ? "" : " (sqlState=" + state + ")"), e);
  }

  /** Integrity sub-kind from an SQLSTATE 23xxx code. */
  protected static Violation violation(String state) {
    switch (state) {
      case "23505": return Violation.UNIQUE;
      case "23503": return Violation.FOREIGN_KEY;
      case "23502": return Violation.NOT_NULL;
      case "23514": return Violation.CHECK;
      default: return Violation.OTHER;
    }
  }
}
