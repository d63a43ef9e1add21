package io.intellixity.unisql.driver;

import java.util.Objects;

/**
 * Capability flags read by the transaction controller and the batch executor.
 *
 * @param supportsTransactions backend can open interactive transactions
 * @param supportsBatch        backend has a native atomic multi-statement primitive
 * @param nonTransactionalPolicy applies only when {@code supportsTransactions} is false
 */
public record DriverCapabilities(boolean supportsTransactions,
                                 boolean supportsBatch,
                                 NonTransactionalPolicy nonTransactionalPolicy) {
  public DriverCapabilities {
    Objects.requireNonNull(nonTransactionalPolicy, "nonTransactionalPolicy");
  }

  /** Defaults the policy: warn-and-run when a native batch exists, fail-fast when nothing does. */
  public static DriverCapabilities of(boolean supportsTransactions, boolean supportsBatch) {
    NonTransactionalPolicy policy = (supportsTransactions || supportsBatch)
        ? NonTransactionalPolicy.WARN_AND_RUN
        : NonTransactionalPolicy.FAIL_FAST;
    return new DriverCapabilities(supportsTransactions, supportsBatch, policy);
  }

  public DriverCapabilities withPolicy(NonTransactionalPolicy policy) {
    return new DriverCapabilities(supportsTransactions, supportsBatch, policy);
  }
}
