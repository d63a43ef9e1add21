package io.intellixity.unisql.driver;

/**
 * Body of a transaction. The argument is a driver bound to the open transaction; any exception
 * thrown rolls the transaction (or savepoint) back.
 */
@FunctionalInterface
public interface TransactionCallback<R> {
  R apply(Driver tx);
}
