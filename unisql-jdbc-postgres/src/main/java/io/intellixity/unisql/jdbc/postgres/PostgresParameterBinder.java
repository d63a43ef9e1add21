package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.jdbc.bind.JdbcParameterBinder;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Collection;
import java.util.Map;

/** Maps and collections bind as {@code jsonb}; everything else follows the base JDBC rules. */
public final class PostgresParameterBinder extends JdbcParameterBinder {
  public static final PostgresParameterBinder INSTANCE = new PostgresParameterBinder();

  @Override
  protected boolean bindDialect(PreparedStatement ps, int position, Object value) throws SQLException {
    if (!(value instanceof Map<?, ?>) && !(value instanceof Collection<?>)) return false;
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(toJson(value));
    ps.setObject(position, obj);
    return true;
  }
}
