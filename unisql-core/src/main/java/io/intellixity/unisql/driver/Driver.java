package io.intellixity.unisql.driver;

import io.intellixity.unisql.result.ResultParser;
import io.intellixity.unisql.sql.PlaceholderStyle;
import io.intellixity.unisql.sql.Sql;

import java.util.List;

/**
 * Uniform operation contract over every supported SQL backend.
 * <p>
 * Every failure surfaces as a {@link io.intellixity.unisql.error.DriverException} subtype; backend
 * native exception types never cross this interface.
 */
public interface Driver {
  Dialect dialect();

  /** Identifier used in logs and spans, e.g. {@code postgres} or {@code d1-http}. */
  String driverName();

  DriverCapabilities capabilities();

  /** Placeholder syntax this driver renders {@link Sql} values with. */
  default PlaceholderStyle placeholderStyle() { return dialect().placeholderStyle(); }

  /** Result normalisation applied by upstream mappers; {@link ResultParser#NONE} when the backend needs none. */
  ResultParser resultParser();

  QueryResult execute(Sql sql);

  /** Runs raw SQL written in this driver's placeholder style. */
  QueryResult executeRaw(String sql, List<?> params);

  default QueryResult executeRaw(String sql) {
    return executeRaw(sql, List.of());
  }

  /**
   * Runs the callback in a transaction. Called while a transaction is already open on this thread
   * (or on a bound view), nests via a savepoint instead.
   */
  <R> R withTransaction(TransactionCallback<R> callback, TransactionOptions options);

  default <R> R withTransaction(TransactionCallback<R> callback) {
    return withTransaction(callback, TransactionOptions.DEFAULTS);
  }

  /** Order-preserving; one result per query. Empty input never touches the backend. */
  List<QueryResult> executeBatch(List<BatchQuery> queries);

  /** Eagerly initialises the backend client. */
  void connect();

  /** Closes the backend client. The driver can be reused afterwards. */
  void disconnect();

  boolean inTransaction();

  /** 0 when idle, 1 inside a top-level transaction, +1 per open savepoint. */
  int transactionDepth();

  void setContext(QueryExecutionContext context);

  default void setContext(String model, Operation operation) {
    setContext(QueryExecutionContext.of(model, operation));
  }

  void clearContext();

  QueryExecutionContext context();
}
