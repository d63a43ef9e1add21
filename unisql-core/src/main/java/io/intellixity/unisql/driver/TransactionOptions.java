package io.intellixity.unisql.driver;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-transaction options. Both values are optional; a null field means "backend default".
 */
public record TransactionOptions(IsolationLevel isolationLevel, Duration timeout) {
  public static final TransactionOptions DEFAULTS = new TransactionOptions(null, null);

  public TransactionOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
  }

  public static TransactionOptions isolation(IsolationLevel level) {
    return new TransactionOptions(level, null);
  }

  public static TransactionOptions timeout(Duration timeout) {
    return new TransactionOptions(null, timeout);
  }

  public TransactionOptions withIsolation(IsolationLevel level) {
    return new TransactionOptions(level, timeout);
  }

  public TransactionOptions withTimeout(Duration t) {
    return new TransactionOptions(isolationLevel, t);
  }

  public Optional<IsolationLevel> isolationOpt() { return Optional.ofNullable(isolationLevel); }

  public Optional<Duration> timeoutOpt() { return Optional.ofNullable(timeout); }
}
