package io.intellixity.unisql.error;

import java.sql.SQLException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Central retry-eligibility check.
 * <p>
 * Decided by error code, never by exception class: the same class can be retryable or not depending
 * on the backend code underneath it.
 */
public final class Retryables {
  private static final Set<ErrorCode> RETRYABLE_CODES = EnumSet.of(
      ErrorCode.DEADLOCK,
      ErrorCode.SERIALIZATION_FAILURE,
      ErrorCode.CONNECTION_TIMEOUT,
      ErrorCode.QUERY_TIMEOUT
  );

  /** Postgres serialization failure and deadlock, SQLite busy, MySQL deadlock and lock wait timeout. */
  private static final Set<String> RETRYABLE_NATIVE_CODES = Set.of("40001", "40P01", "SQLITE_BUSY", "1213", "1205");

  private Retryables() {}

  public static boolean isRetryable(Throwable error) {
    if (error == null) return false;
    if (error instanceof DriverException de) {
      if (RETRYABLE_CODES.contains(de.code())) return true;
      return isRetryableNativeCode(de.nativeCode());
    }
    if (error instanceof SQLException se) {
      return isRetryableNativeCode(se.getSQLState()) || isRetryableNativeCode(String.valueOf(se.getErrorCode()));
    }
    return false;
  }

  public static boolean isRetryableNativeCode(String nativeCode) {
    return nativeCode != null && RETRYABLE_NATIVE_CODES.contains(nativeCode);
  }
}
