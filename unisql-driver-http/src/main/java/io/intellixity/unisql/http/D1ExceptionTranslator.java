package io.intellixity.unisql.http;

import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.UniqueConstraintException;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Transport failures become {@link ConnectionException}s; API errors are classified by the SQLite
 * message the endpoint relays. The native code is the first D1 error code, or {@code HTTP_<status>}
 * when the body carried none.
 */
public final class D1ExceptionTranslator implements ExceptionTranslator {
  public static final D1ExceptionTranslator INSTANCE = new D1ExceptionTranslator();

  // UNIQUE constraint failed: users.email: SQLITE_CONSTRAINT
  private static final Pattern CONSTRAINT_TARGET = Pattern.compile("constraint failed: ([\\w.]+(?:, [\\w.]+)*)");

  @Override
  public DriverException translate(Throwable error, String sql, List<?> params) {
    if (error instanceof DriverException de) return de;
    if (error instanceof D1ApiException api) return translateApi(api, sql, params);
    if (error instanceof HttpTimeoutException) {
      return new ConnectionException("D1 request timed out: " + error.getMessage(), ErrorCode.CONNECTION_TIMEOUT, null, error);
    }
    if (error instanceof IOException || error instanceof InterruptedException) {
      return new ConnectionException("D1 request failed: " + error, ErrorCode.CONNECTION_FAILED, null, error);
    }
    return ExceptionTranslator.GENERIC.translate(error, sql, params);
  }

  private static DriverException translateApi(D1ApiException e, String sql, List<?> params) {
    String msg = e.getMessage();
    String code = e.codes().isEmpty() ? "HTTP_" + e.status() : String.valueOf(e.codes().get(0));

    if (e.status() == 401 || e.status() == 403) {
      return new ConnectionException(msg, ErrorCode.CONNECTION_FAILED, code, e);
    }
    if (e.status() == 429 || e.status() >= 500) {
      return new ConnectionException(msg, ErrorCode.CONNECTION_TIMEOUT, code, e);
    }
    if (msg.contains("UNIQUE constraint failed")) {
      Target t = target(msg);
      return new UniqueConstraintException(msg, null, t.table(), t.columns(), code, sql, params, e);
    }
    if (msg.contains("FOREIGN KEY constraint failed")) {
      return new ForeignKeyException(msg, null, null, code, sql, params, e);
    }
    if (msg.contains("NOT NULL constraint failed")) {
      return new QueryException(msg, ErrorCode.NOT_NULL_CONSTRAINT, code, sql, params, e);
    }
    if (msg.contains("CHECK constraint failed")) {
      return new QueryException(msg, ErrorCode.CHECK_CONSTRAINT, code, sql, params, e);
    }
    if (msg.contains("syntax error") || msg.contains("no such table") || msg.contains("no such column")) {
      return new QueryException(msg, ErrorCode.QUERY_SYNTAX, code, sql, params, e);
    }
    return new QueryException(msg, ErrorCode.QUERY_FAILED, code, sql, params, e);
  }

  private static Target target(String msg) {
    Matcher m = CONSTRAINT_TARGET.matcher(msg);
    if (!m.find()) return new Target(null, List.of());
    String table = null;
    List<String> columns = new ArrayList<>();
    for (String part : m.group(1).split(", ")) {
      int dot = part.indexOf('.');
      if (dot < 0) continue;
      table = part.substring(0, dot);
      columns.add(part.substring(dot + 1));
    }
    return new Target(table, columns);
  }

  private record Target(String table, List<String> columns) {}
}
