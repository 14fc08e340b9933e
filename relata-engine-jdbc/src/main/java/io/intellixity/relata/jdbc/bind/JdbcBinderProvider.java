package io.intellixity.relata.jdbc.bind;

import io.intellixity.relata.error.QueryExecutionException;
import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.spi.bind.BindContext;
import io.intellixity.relata.spi.bind.Binder;
import io.intellixity.relata.spi.bind.BinderProvider;
import io.intellixity.relata.types.LogicalType;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TimeZone;

/**
 * JDBC-family binder base.\n
 *
 * Dialect providers (e.g. postgres, mysql) should extend this and add dialect binders.\n
 * Dialect binders are evaluated before base JDBC binders.\n
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?, ?>> binders() {
    List<Binder<?, ?>> out = new ArrayList<>();
    out.addAll(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<Binder<?, ?>> dialectBinders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<Binder<?, ?>> jdbcBinders() {
    return List.of(
        new JdbcNullBinder(),
        new JdbcInstantToTimestampBinder(),
        new JdbcBytesBinder(),
        new JdbcSetObjectBinder()
    );
  }

  /** Position of a JDBC bind; any other context is a wiring error. */
  protected static int position(BindContext ctx) {
    if (!(ctx instanceof JdbcBindContext jc)) throw new IllegalArgumentException("Expected JdbcBindContext");
    return jc.position1Based();
  }

  protected static QueryExecutionException bindFailure(BindContext ctx, Bind bind, SQLException e) {
    return new QueryExecutionException(ctx.dialectId(),
        "failed to bind parameter " + position(ctx) + " (type=" + bind.type() + ")", e);
  }

  /** java.sql.Types constant used for a typed NULL. */
  public static int sqlType(LogicalType type) {
    switch (type) {
      case BOOLEAN: return Types.BOOLEAN;
      case INTEGER: return Types.INTEGER;
      case BIGINT: return Types.BIGINT;
      case REAL: return Types.DOUBLE;
      case DECIMAL: return Types.DECIMAL;
      case BLOB: return Types.VARBINARY;
      case DATE: return Types.DATE;
      case TIME: return Types.TIME;
      case TIMESTAMP: return Types.TIMESTAMP;
      default: return Types.VARCHAR;
    }
  }

  /** Typed NULL from the bind's logical type. */
  static final class JdbcNullBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(BindContext ctx, Bind bind, Object value) { return value == null; }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Bind bind, Object value) {
      try {
        ps.setNull(position(ctx), sqlType(bind.type()));
      } catch (SQLException e) {
        throw bindFailure(ctx, bind, e);
      }
    }
  }

  /** Bind Instant as a UTC JDBC Timestamp, independent of the JVM default zone. */
  static final class JdbcInstantToTimestampBinder implements Binder<PreparedStatement, Instant> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Instant> valueType() { return Instant.class; }
    @Override public boolean supports(BindContext ctx, Bind bind, Instant value) { return true; }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Bind bind, Instant value) {
      try {
        ps.setTimestamp(position(ctx), Timestamp.from(value), Calendar.getInstance(TimeZone.getTimeZone("UTC")));
      } catch (SQLException e) {
        throw bindFailure(ctx, bind, e);
      }
    }
  }

  static final class JdbcBytesBinder implements Binder<PreparedStatement, byte[]> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<byte[]> valueType() { return byte[].class; }
    @Override public boolean supports(BindContext ctx, Bind bind, byte[] value) { return true; }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Bind bind, byte[] value) {
      try {
        ps.setBytes(position(ctx), value);
      } catch (SQLException e) {
        throw bindFailure(ctx, bind, e);
      }
    }
  }

  static final class JdbcSetObjectBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }
    @Override public boolean supports(BindContext ctx, Bind bind, Object value) { return true; }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Bind bind, Object value) {
      try {
        ps.setObject(position(ctx), value);
      } catch (SQLException e) {
        throw bindFailure(ctx, bind, e);
      }
    }
  }
}
