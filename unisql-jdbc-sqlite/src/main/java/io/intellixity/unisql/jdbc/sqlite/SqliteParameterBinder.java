package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.jdbc.bind.JdbcParameterBinder;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.UUID;

/** SQLite has no boolean or uuid storage class: booleans bind as 1/0, uuids as text. */
public final class SqliteParameterBinder extends JdbcParameterBinder {
  public static final SqliteParameterBinder INSTANCE = new SqliteParameterBinder();

  @Override
  protected boolean bindDialect(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value instanceof Boolean b) {
      ps.setInt(position, b ? 1 : 0);
      return true;
    }
    if (value instanceof UUID u) {
      ps.setString(position, u.toString());
      return true;
    }
    return false;
  }
}
