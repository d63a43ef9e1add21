package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionCallback;
import io.intellixity.unisql.driver.TransactionOptions;

import java.util.List;

/**
 * Internal operations a {@link TransactionBoundDriver} forwards to its owning driver. Passed at
 * construction; the view never reaches into the driver any other way.
 */
interface TransactionOps<T> {
  /** Owning driver; used for metadata and the per-thread execution context only. */
  Driver owner();

  QueryResult executeIn(TransactionScope<T> scope, String sql, List<Object> params);

  <R> R nest(TransactionScope<T> scope, TransactionCallback<R> callback, Driver view, TransactionOptions options);
}
