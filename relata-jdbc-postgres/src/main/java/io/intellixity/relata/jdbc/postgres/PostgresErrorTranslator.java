package io.intellixity.relata.jdbc.postgres;

import io.intellixity.relata.error.ConcurrencyException;
import io.intellixity.relata.error.IntegrityConstraintException;
import io.intellixity.relata.error.RelataException;
import io.intellixity.relata.jdbc.JdbcErrorTranslator;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/** Postgres SQLStates, with the constraint name taken from the server error message. */
final class PostgresErrorTranslator extends JdbcErrorTranslator {
  @Override
  protected RelataException translateVendor(String dialectId, SQLException e) {
    String state = e.getSQLState();
    if (state == null) return null;
    String msg = e.getMessage();

    if (state.startsWith("23")) {
      return new IntegrityConstraintException(dialectId, violation(state), constraint(e), msg, e);
    }
    switch (state) {
      case "40P01":
        return new ConcurrencyException(dialectId, ConcurrencyException.Reason.DEADLOCK, msg, e);
      case "40001":
        return new ConcurrencyException(dialectId, ConcurrencyException.Reason.SERIALIZATION, msg, e);
      case "55P03":
        return new ConcurrencyException(dialectId, ConcurrencyException.Reason.LOCK_TIMEOUT, msg, e);
      default:
        return null;
    }
  }

  private static String constraint(SQLException e) {
    if (!(e instanceof PSQLException pe)) return null;
    ServerErrorMessage sem = pe.getServerErrorMessage();
    return sem == null ? null : sem.getConstraint();
  }
}
