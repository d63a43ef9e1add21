package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.jdbc.JdbcRowReader;
import io.intellixity.unisql.result.ResultParsing;
import org.postgresql.util.PGobject;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Unwraps {@link PGobject}: json/jsonb objects and arrays are parsed, other types become their text. */
public final class PostgresRowReader extends JdbcRowReader {
  public static final PostgresRowReader INSTANCE = new PostgresRowReader();

  @Override
  protected Object readValue(ResultSet rs, int index) throws SQLException {
    Object v = super.readValue(rs, index);
    if (!(v instanceof PGobject pg)) return v;
    String text = pg.getValue();
    if ("json".equals(pg.getType()) || "jsonb".equals(pg.getType())) {
      return ResultParsing.tryParseJsonString(text).orElse(text);
    }
    return text;
  }
}
