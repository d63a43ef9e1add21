package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.TransactionException;

import java.sql.Connection;
import java.time.Duration;
import java.util.Objects;

/** One open JDBC transaction: its dedicated connection and an optional deadline. */
public final class JdbcTransaction {
  private final Connection connection;
  private final long deadlineNanos;
  private final Duration timeout;

  public JdbcTransaction(Connection connection, Duration timeout) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.timeout = timeout;
    this.deadlineNanos = (timeout == null) ? 0L : System.nanoTime() + timeout.toNanos();
  }

  public Connection connection() { return connection; }

  /**
   * JDBC query timeout for the next statement: whole seconds left before the deadline, rounded up;
   * 0 when the transaction has no deadline.
   *
   * @throws TransactionException with {@link ErrorCode#TRANSACTION_TIMEOUT} once the deadline passed
   */
  public int remainingTimeoutSeconds() {
    if (timeout == null) return 0;
    long left = deadlineNanos - System.nanoTime();
    if (left <= 0) {
      throw new TransactionException("Transaction exceeded its timeout of " + timeout.toMillis() + "ms",
          ErrorCode.TRANSACTION_TIMEOUT, null, null);
    }
    long seconds = (left + 999_999_999L) / 1_000_000_000L;
    return (int) Math.min(Integer.MAX_VALUE, Math.max(1L, seconds));
  }
}
