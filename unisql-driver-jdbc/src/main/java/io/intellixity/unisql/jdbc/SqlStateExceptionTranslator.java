package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.error.ForeignKeyException;
import io.intellixity.unisql.error.QueryException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.error.UniqueConstraintException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.List;

/**
 * Translates {@link SQLException}s by SQLState class.
 * <p>
 * Vendor modules extend this: {@link #translateVendor} for vendor error codes that SQLState does
 * not distinguish, and the metadata hooks to fill in constraint, table and column names.
 */
public class SqlStateExceptionTranslator implements ExceptionTranslator {
  public static final SqlStateExceptionTranslator INSTANCE = new SqlStateExceptionTranslator();

  @Override
  public final DriverException translate(Throwable error, String sql, List<?> params) {
    if (error instanceof DriverException de) return de;
    SQLException se = findSqlException(error);
    if (se == null) return ExceptionTranslator.GENERIC.translate(error, sql, params);

    DriverException vendor = translateVendor(se, sql, params);
    if (vendor != null) return vendor;
    return translateSqlState(se, sql, params);
  }

  /** Vendor-code translation; null falls through to SQLState rules. */
  protected DriverException translateVendor(SQLException e, String sql, List<?> params) {
    return null;
  }

  protected String constraintName(SQLException e) { return null; }

  protected String tableName(SQLException e) { return null; }

  protected List<String> columns(SQLException e) { return List.of(); }

  /** SQLState, or the vendor code when the driver reports no state. */
  protected String nativeCode(SQLException e) {
    if (e.getSQLState() != null) return e.getSQLState();
    return e.getErrorCode() == 0 ? null : String.valueOf(e.getErrorCode());
  }

  protected final DriverException translateSqlState(SQLException e, String sql, List<?> params) {
    String state = e.getSQLState();
    String code = nativeCode(e);
    String msg = message(e);

    if (e instanceof SQLTransientConnectionException) {
      return new ConnectionException(msg, ErrorCode.CONNECTION_TIMEOUT, code, e);
    }
    if (e instanceof SQLTimeoutException || "57014".equals(state)) {
      return new QueryException(msg, ErrorCode.QUERY_TIMEOUT, code, sql, params, e);
    }
    if (state == null) return new QueryException(msg, ErrorCode.QUERY_FAILED, code, sql, params, e);

    switch (state) {
      case "23505":
        return unique(e, sql, params);
      case "23503":
        return foreignKey(e, sql, params);
      case "23502":
        return new QueryException(msg, ErrorCode.NOT_NULL_CONSTRAINT, code, sql, params, e);
      case "23514":
        return new QueryException(msg, ErrorCode.CHECK_CONSTRAINT, code, sql, params, e);
      case "40001":
        return new TransactionException(msg, ErrorCode.SERIALIZATION_FAILURE, code, e);
      case "40P01":
        return new TransactionException(msg, ErrorCode.DEADLOCK, code, e);
      default:
        break;
    }
    if (state.startsWith("08")) return new ConnectionException(msg, ErrorCode.CONNECTION_FAILED, code, e);
    if (state.startsWith("42")) return new QueryException(msg, ErrorCode.QUERY_SYNTAX, code, sql, params, e);
    return new QueryException(msg, ErrorCode.QUERY_FAILED, code, sql, params, e);
  }

  protected final UniqueConstraintException unique(SQLException e, String sql, List<?> params) {
    return new UniqueConstraintException(message(e), constraintName(e), tableName(e), columns(e),
        nativeCode(e), sql, params, e);
  }

  protected final ForeignKeyException foreignKey(SQLException e, String sql, List<?> params) {
    return new ForeignKeyException(message(e), constraintName(e), tableName(e), nativeCode(e), sql, params, e);
  }

  protected static String message(SQLException e) {
    return (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
  }

  private static SQLException findSqlException(Throwable error) {
    Throwable t = error;
    for (int depth = 0; t != null && depth < 8; depth++, t = t.getCause()) {
      if (t instanceof SQLException se) return se;
    }
    return null;
  }
}
