package io.intellixity.unisql.jdbc.sqlite;

import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.jdbc.SqlStateExceptionTranslator;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * sqlite-jdbc reports no SQLState; translation goes by {@link org.sqlite.SQLiteErrorCode} name
 * and, for constraint failures, by the engine message ({@code UNIQUE constraint failed: t.a, t.b}).
 */
public final class SqliteExceptionTranslator extends SqlStateExceptionTranslator {
  public static final SqliteExceptionTranslator INSTANCE = new SqliteExceptionTranslator();

  private static final Pattern CONSTRAINT_COLUMNS =
      Pattern.compile("(?:UNIQUE|NOT NULL) constraint failed: ([\\w.]+(?:, [\\w.]+)*)");

  @Override
  protected DriverException translateVendor(SQLException e, String sql, List<?> params) {
    if (!(e instanceof SQLiteException se)) return null;
    String code = se.getResultCode().name();
    String msg = message(e);

    if (code.startsWith("SQLITE_BUSY") || code.startsWith("SQLITE_LOCKED")) {
      // normalised so retry detection sees one code for every busy variant
      return new QueryException(msg, ErrorCode.QUERY_FAILED, "SQLITE_BUSY", sql, params, e);
    }
    if (code.equals("SQLITE_CONSTRAINT_UNIQUE") || code.equals("SQLITE_CONSTRAINT_PRIMARYKEY")
        || msg.contains("UNIQUE constraint failed")) {
      return unique(e, sql, params);
    }
    if (code.equals("SQLITE_CONSTRAINT_FOREIGNKEY") || msg.contains("FOREIGN KEY constraint failed")) {
      return foreignKey(e, sql, params);
    }
    if (code.equals("SQLITE_CONSTRAINT_NOTNULL") || msg.contains("NOT NULL constraint failed")) {
      return new QueryException(msg, ErrorCode.NOT_NULL_CONSTRAINT, code, sql, params, e);
    }
    if (code.equals("SQLITE_CONSTRAINT_CHECK") || msg.contains("CHECK constraint failed")) {
      return new QueryException(msg, ErrorCode.CHECK_CONSTRAINT, code, sql, params, e);
    }
    if (code.equals("SQLITE_ERROR") && (msg.contains("syntax error") || msg.contains("no such"))) {
      return new QueryException(msg, ErrorCode.QUERY_SYNTAX, code, sql, params, e);
    }
    return new QueryException(msg, ErrorCode.QUERY_FAILED, code, sql, params, e);
  }

  @Override
  protected String nativeCode(SQLException e) {
    if (e instanceof SQLiteException se) return se.getResultCode().name();
    return super.nativeCode(e);
  }

  @Override
  protected String tableName(SQLException e) {
    List<String> qualified = qualifiedColumns(e);
    if (qualified.isEmpty()) return null;
    String first = qualified.get(0);
    int dot = first.indexOf('.');
    return dot < 0 ? null : first.substring(0, dot);
  }

  @Override
  protected List<String> columns(SQLException e) {
    List<String> out = new ArrayList<>();
    for (String q : qualifiedColumns(e)) {
      int dot = q.indexOf('.');
      out.add(dot < 0 ? q : q.substring(dot + 1));
    }
    return out;
  }

  private static List<String> qualifiedColumns(SQLException e) {
    String msg = e.getMessage();
    if (msg == null) return List.of();
    Matcher m = CONSTRAINT_COLUMNS.matcher(msg);
    if (!m.find()) return List.of();
    return List.of(m.group(1).split(", "));
  }
}
