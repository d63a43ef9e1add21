package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.QueryExecutionContext;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionCallback;
import io.intellixity.unisql.driver.TransactionOptions;
import io.intellixity.unisql.instrument.SpanNames;
import io.intellixity.unisql.result.ResultParser;
import io.intellixity.unisql.sql.PlaceholderStyle;
import io.intellixity.unisql.sql.Sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Driver} pinned to one open transaction.
 * <p>
 * Every statement runs on the bound transaction; nothing here initialises or closes the owning
 * driver's client. {@link #withTransaction} nests through a savepoint on the same transaction.
 */
public final class TransactionBoundDriver<T> implements Driver {
  private final TransactionOps<T> ops;
  private final TransactionScope<T> scope;
  private final DriverInstrumentation instrumentation;

  TransactionBoundDriver(TransactionOps<T> ops, TransactionScope<T> scope, DriverInstrumentation instrumentation) {
    this.ops = Objects.requireNonNull(ops, "ops");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.instrumentation = Objects.requireNonNull(instrumentation, "instrumentation");
  }

  /** The transaction handle this view is bound to (a JDBC transaction, an SQLite connection, ...). */
  public T transaction() { return scope.tx(); }

  @Override public Dialect dialect() { return ops.owner().dialect(); }
  @Override public String driverName() { return ops.owner().driverName(); }
  @Override public DriverCapabilities capabilities() { return ops.owner().capabilities(); }
  @Override public PlaceholderStyle placeholderStyle() { return ops.owner().placeholderStyle(); }
  @Override public ResultParser resultParser() { return ops.owner().resultParser(); }

  @Override
  public QueryResult execute(Sql sql) {
    Objects.requireNonNull(sql, "sql");
    return run(sql.toStatement(placeholderStyle()), sql.values());
  }

  @Override
  public QueryResult executeRaw(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    return run(sql, params == null ? List.of() : new ArrayList<>(params));
  }

  private QueryResult run(String sql, List<Object> params) {
    return instrumentation.query(sql, params, context(), () -> ops.executeIn(scope, sql, params));
  }

  @Override
  public <R> R withTransaction(TransactionCallback<R> callback, TransactionOptions options) {
    Objects.requireNonNull(callback, "callback");
    return instrumentation.span(SpanNames.TRANSACTION, instrumentation.contextAttributes(context()),
        () -> ops.nest(scope, callback, this, options));
  }

  /** Sequential on the bound transaction, inside its own savepoint so a failure undoes the whole batch. */
  @Override
  public List<QueryResult> executeBatch(List<BatchQuery> queries) {
    Objects.requireNonNull(queries, "queries");
    if (queries.isEmpty()) return List.of();
    Map<String, Object> attrs = instrumentation.contextAttributes(context());
    attrs.put(SpanNames.ATTR_DB_BATCH_SIZE, queries.size());
    List<BatchQuery> batch = List.copyOf(queries);
    return instrumentation.span(SpanNames.BATCH, attrs, () -> ops.nest(scope, tx -> {
      List<QueryResult> out = new ArrayList<>(batch.size());
      for (BatchQuery q : batch) out.add(tx.executeRaw(q.sql(), q.params()));
      return Collections.unmodifiableList(out);
    }, this, null));
  }

  /** Already connected through the owning driver. */
  @Override public void connect() {}

  /** The owning driver owns the connection; closing it from here is not allowed. */
  @Override public void disconnect() {}

  @Override public boolean inTransaction() { return true; }
  @Override public int transactionDepth() { return scope.depth(); }

  @Override public void setContext(QueryExecutionContext context) { ops.owner().setContext(context); }
  @Override public void clearContext() { ops.owner().clearContext(); }
  @Override public QueryExecutionContext context() { return ops.owner().context(); }
}
