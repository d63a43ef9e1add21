package io.intellixity.unisql.error;

import java.sql.SQLException;
import java.util.List;

/**
 * Adapter-boundary translation of backend-native failures into the driver error taxonomy.
 * <p>
 * Implementations must be idempotent: a {@link DriverException} is returned unchanged.
 */
@FunctionalInterface
public interface ExceptionTranslator {
  DriverException translate(Throwable error, String sql, List<?> params);

  /** Fallback used when an adapter has nothing more specific: wraps everything as a query failure. */
  ExceptionTranslator GENERIC = (error, sql, params) -> {
    if (error instanceof DriverException de) return de;
    String msg = (error == null || error.getMessage() == null) ? "Query failed" : error.getMessage();
    String nativeCode = (error instanceof SQLException se) ? se.getSQLState() : null;
    return new QueryException(msg, ErrorCode.QUERY_FAILED, nativeCode, sql, params, error);
  };
}
