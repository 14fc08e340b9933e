package io.intellixity.relata.jdbc.postgres;

import io.intellixity.relata.jdbc.bind.JdbcBinderProvider;
import io.intellixity.relata.spi.bind.BindContext;
import io.intellixity.relata.spi.bind.Binder;
import io.intellixity.relata.sql.Bind;
import io.intellixity.relata.types.LogicalType;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

/** Postgres-specific JDBC binders (dialectId="postgres"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return PostgresDialect.ID;
  }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new PostgresJsonbBinder());
  }

  /** JSON text as a jsonb PGobject; a plain varchar bind would not coerce into jsonb columns. */
  static final class PostgresJsonbBinder implements Binder<PreparedStatement, Object> {
    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public Class<Object> valueType() { return Object.class; }

    @Override
    public boolean supports(BindContext ctx, Bind bind, Object encodedValue) {
      return bind != null && bind.type() == LogicalType.JSON;
    }

    @Override
    public void bind(PreparedStatement ps, BindContext ctx, Bind bind, Object encodedValue) {
      int pos = position(ctx);
      try {
        if (encodedValue == null) {
          ps.setNull(pos, Types.OTHER);
          return;
        }
        PGobject obj = new PGobject();
        obj.setType("jsonb");
        obj.setValue(String.valueOf(encodedValue));
        ps.setObject(pos, obj);
      } catch (SQLException e) {
        throw bindFailure(ctx, bind, e);
      }
    }
  }
}
