package io.intellixity.unisql.driver;

/** What {@link Driver#withTransaction} does on a backend that cannot open a transaction. */
public enum NonTransactionalPolicy {
  /** Run the callback directly against the driver and emit a warning that no isolation is provided. */
  WARN_AND_RUN,
  /** Throw {@link io.intellixity.unisql.error.FeatureNotSupportedException} before the callback runs. */
  FAIL_FAST
}
