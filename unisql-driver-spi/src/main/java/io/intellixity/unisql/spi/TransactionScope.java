package io.intellixity.unisql.spi;

import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.TransactionException;

import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One open top-level transaction plus its stack of savepoints.
 * <p>
 * Savepoint blocks on the same transaction are serialised through {@link #savepointLock} so two
 * call sites sharing a bound view never interleave SAVEPOINT/RELEASE on one connection.
 */
final class TransactionScope<T> {
  private final T tx;
  private final Deque<String> savepoints = new ConcurrentLinkedDeque<>();
  private final ReentrantLock savepointLock = new ReentrantLock();
  private volatile String unusableReason;

  TransactionScope(T tx) {
    this.tx = Objects.requireNonNull(tx, "tx");
  }

  T tx() { return tx; }

  int depth() { return 1 + savepoints.size(); }

  void lockSavepoints() { savepointLock.lock(); }

  void unlockSavepoints() { savepointLock.unlock(); }

  void pushSavepoint(String name) { savepoints.push(name); }

  void popSavepoint(String name) { savepoints.remove(name); }

  /** Called once commit or rollback has run; views captured by the callback stop working. */
  void complete() { markUnusable("it has already completed"); }

  void invalidate() { markUnusable("the driver was disconnected"); }

  private synchronized void markUnusable(String reason) {
    if (unusableReason == null) unusableReason = reason;
  }

  void ensureUsable() {
    String reason = unusableReason;
    if (reason != null) {
      throw new TransactionException("Transaction is no longer usable: " + reason,
          ErrorCode.TRANSACTION_FAILED, null, null);
    }
  }
}
