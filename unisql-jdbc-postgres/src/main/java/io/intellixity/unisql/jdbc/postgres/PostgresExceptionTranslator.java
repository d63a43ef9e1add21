package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.jdbc.SqlStateExceptionTranslator;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQLState translation plus the constraint, table and column names the server attaches to
 * {@link PSQLException}s.
 */
public final class PostgresExceptionTranslator extends SqlStateExceptionTranslator {
  public static final PostgresExceptionTranslator INSTANCE = new PostgresExceptionTranslator();

  // DETAIL: Key (org_id, email)=(1, a@x) already exists.
  private static final Pattern KEY_COLUMNS = Pattern.compile("Key \\(([^)]+)\\)=");

  @Override
  protected String constraintName(SQLException e) {
    ServerErrorMessage m = serverMessage(e);
    return m == null ? null : m.getConstraint();
  }

  @Override
  protected String tableName(SQLException e) {
    ServerErrorMessage m = serverMessage(e);
    return m == null ? null : m.getTable();
  }

  @Override
  protected List<String> columns(SQLException e) {
    ServerErrorMessage m = serverMessage(e);
    if (m == null) return List.of();
    if (m.getColumn() != null) return List.of(m.getColumn());
    if (m.getDetail() == null) return List.of();
    Matcher km = KEY_COLUMNS.matcher(m.getDetail());
    if (!km.find()) return List.of();
    List<String> out = new ArrayList<>();
    for (String c : km.group(1).split(",")) out.add(c.trim().replace("\"", ""));
    return out;
  }

  private static ServerErrorMessage serverMessage(SQLException e) {
    return (e instanceof PSQLException pe) ? pe.getServerErrorMessage() : null;
  }
}
