package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.BatchQuery;
import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.Driver;
import io.intellixity.unisql.driver.DriverCapabilities;
import io.intellixity.unisql.driver.NonTransactionalPolicy;
import io.intellixity.unisql.driver.QueryExecutionContext;
import io.intellixity.unisql.driver.QueryResult;
import io.intellixity.unisql.driver.TransactionCallback;
import io.intellixity.unisql.driver.TransactionOptions;
import io.intellixity.unisql.error.ConnectionException;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.error.ErrorCode;
import io.intellixity.unisql.error.ExceptionTranslator;
import io.intellixity.unisql.error.FeatureNotSupportedException;
import io.intellixity.unisql.error.TransactionException;
import io.intellixity.unisql.instrument.InstrumentationContext;
import io.intellixity.unisql.instrument.SpanNames;
import io.intellixity.unisql.result.ResultParser;
import io.intellixity.unisql.sql.Sql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Template-method base for every backend adapter.
 * <p>
 * Owns the lazily created client, the per-thread transaction state, savepoint nesting, the
 * three-tier batch policy and instrumentation. Adapters implement the primitive hooks:
 * <ul>
 *   <li>{@link #initClient()} / {@link #closeClient(Object)}</li>
 *   <li>{@link #execute(Object, String, List)} / {@link #executeRaw(Object, String, List)}</li>
 *   <li>{@link #begin(Object, TransactionOptions)}, {@link #commit(Object)}, {@link #rollback(Object)},
 *       {@link #release(Object)} and {@link #executeInTransaction(Object, String, List)} when the backend
 *       supports transactions</li>
 *   <li>{@link #executeNativeBatch(Object, List)} when it supports an atomic batch</li>
 * </ul>
 * Hooks may throw anything; failures are translated through {@link #exceptionTranslator()} before
 * they leave the driver.
 *
 * @param <C> backend client (pool, data source, connection, HTTP client)
 * @param <T> open-transaction handle
 */
public abstract class AbstractDriver<C, T> implements Driver {
  private static final Logger log = LoggerFactory.getLogger(AbstractDriver.class);

  private final Dialect dialect;
  private final String driverName;
  private final DriverCapabilities capabilities;
  private final ResultParser resultParser;
  private final LazyClient<C> client;

  /** Per-instance slot: a transaction opened by another driver on this thread is never reused. */
  private final ThreadLocal<TransactionScope<T>> currentScope = new ThreadLocal<>();
  private final Set<TransactionScope<T>> activeScopes = ConcurrentHashMap.newKeySet();
  private final ThreadLocal<QueryExecutionContext> context = new ThreadLocal<>();
  private final AtomicLong savepointCounter = new AtomicLong();
  private final TransactionOps<T> ops = new Ops();

  private volatile DriverInstrumentation instrumentation;

  protected AbstractDriver(Dialect dialect, String driverName, DriverCapabilities capabilities, ResultParser resultParser) {
    this(dialect, driverName, capabilities, resultParser, null);
  }

  /** Wraps an existing client; the driver starts out connected. */
  protected AbstractDriver(Dialect dialect, String driverName, DriverCapabilities capabilities,
                           ResultParser resultParser, C existingClient) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.driverName = Objects.requireNonNull(driverName, "driverName");
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.resultParser = (resultParser == null) ? ResultParser.NONE : resultParser;
    this.instrumentation = new DriverInstrumentation(dialect, driverName, InstrumentationContext.NONE);
    this.client = new LazyClient<>(this::initClient, this::translateConnect, this::closeTranslated, existingClient);
  }

  // --- adapter hooks ---

  protected abstract C initClient() throws Exception;

  protected abstract void closeClient(C client) throws Exception;

  /** Runs a statement rendered from {@link Sql}. Must pick rowCount by statement shape. */
  protected abstract QueryResult execute(C client, String sql, List<Object> params) throws Exception;

  /** Runs caller-written SQL. Defaults to {@link #execute(Object, String, List)}. */
  protected QueryResult executeRaw(C client, String sql, List<Object> params) throws Exception {
    return execute(client, sql, params);
  }

  protected T begin(C client, TransactionOptions options) throws Exception {
    throw new FeatureNotSupportedException("transaction", "begin");
  }

  protected void commit(T tx) throws Exception {
    throw new FeatureNotSupportedException("transaction", "commit");
  }

  protected void rollback(T tx) throws Exception {
    throw new FeatureNotSupportedException("transaction", "rollback");
  }

  /** Returns per-transaction resources (a pooled connection) after commit or rollback. */
  protected void release(T tx) throws Exception {}

  protected QueryResult executeInTransaction(T tx, String sql, List<Object> params) throws Exception {
    throw new FeatureNotSupportedException("transaction", "execute");
  }

  protected void savepoint(T tx, String name) throws Exception {
    executeInTransaction(tx, "SAVEPOINT " + name, List.of());
  }

  protected void releaseSavepoint(T tx, String name) throws Exception {
    executeInTransaction(tx, "RELEASE SAVEPOINT " + name, List.of());
  }

  protected void rollbackToSavepoint(T tx, String name) throws Exception {
    executeInTransaction(tx, "ROLLBACK TO SAVEPOINT " + name, List.of());
  }

  /** Native all-or-nothing batch; only called when {@link DriverCapabilities#supportsBatch()}. */
  protected List<QueryResult> executeNativeBatch(C client, List<BatchQuery> queries) throws Exception {
    throw new FeatureNotSupportedException("batch", "executeBatch");
  }

  protected ExceptionTranslator exceptionTranslator() {
    return ExceptionTranslator.GENERIC;
  }

  // --- configuration ---

  public final void setInstrumentation(InstrumentationContext context) {
    this.instrumentation = new DriverInstrumentation(dialect, driverName, context);
  }

  public final InstrumentationContext instrumentationContext() {
    return instrumentation.context();
  }

  protected final DriverInstrumentation instrumentation() {
    return instrumentation;
  }

  @Override public final Dialect dialect() { return dialect; }
  @Override public final String driverName() { return driverName; }
  @Override public final DriverCapabilities capabilities() { return capabilities; }
  @Override public final ResultParser resultParser() { return resultParser; }

  public final Map<String, Object> baseAttributes() {
    return instrumentation.baseAttributes();
  }

  public final Map<String, Object> contextAttributes() {
    return instrumentation.contextAttributes(context());
  }

  // --- lazy client ---

  protected final C getClient() {
    return client.get();
  }

  public final boolean isConnected() {
    return client.isInitialized();
  }

  @Override
  public final void connect() {
    instrumentation.span(SpanNames.CONNECT, baseAttributes(), this::getClient);
  }

  @Override
  public final void disconnect() {
    instrumentation.run(SpanNames.DISCONNECT, baseAttributes(), () -> {
      for (TransactionScope<T> scope : activeScopes) scope.invalidate();
      activeScopes.clear();
      currentScope.remove();
      client.close();
    });
  }

  // --- execution ---

  @Override
  public final QueryResult execute(Sql sql) {
    Objects.requireNonNull(sql, "sql");
    String text = sql.toStatement(placeholderStyle());
    List<Object> params = sql.values();
    return instrumentation.query(text, params, context(), () -> runStatement(text, params, false));
  }

  @Override
  public final QueryResult executeRaw(String sql, List<?> params) {
    Objects.requireNonNull(sql, "sql");
    List<Object> values = (params == null) ? List.of() : new ArrayList<>(params);
    return instrumentation.query(sql, values, context(), () -> runStatement(sql, values, true));
  }

  /** On a thread that holds a transaction on this driver, statements run on that transaction. */
  private QueryResult runStatement(String sql, List<Object> params, boolean raw) {
    TransactionScope<T> scope = currentScope.get();
    if (scope != null) return ops.executeIn(scope, sql, params);
    C c = getClient();
    try {
      return raw ? executeRaw(c, sql, params) : execute(c, sql, params);
    } catch (Exception e) {
      throw translate(e, sql, params);
    }
  }

  // --- transactions ---

  @Override
  public final <R> R withTransaction(TransactionCallback<R> callback, TransactionOptions options) {
    Objects.requireNonNull(callback, "callback");
    TransactionOptions opts = (options == null) ? TransactionOptions.DEFAULTS : options;

    TransactionScope<T> existing = currentScope.get();
    if (existing != null) {
      TransactionBoundDriver<T> view = new TransactionBoundDriver<>(ops, existing, instrumentation);
      return instrumentation.span(SpanNames.TRANSACTION, contextAttributes(),
          () -> ops.nest(existing, callback, view, opts));
    }
    if (!capabilities.supportsTransactions()) return runWithoutTransaction(callback);
    return instrumentation.span(SpanNames.TRANSACTION, contextAttributes(), () -> runTopLevel(callback, opts));
  }

  private <R> R runWithoutTransaction(TransactionCallback<R> callback) {
    if (capabilities.nonTransactionalPolicy() == NonTransactionalPolicy.FAIL_FAST) {
      throw new FeatureNotSupportedException("transaction", "withTransaction",
          driverName + " cannot run statements atomically; issue them one by one.");
    }
    instrumentation.warn(driverName + " does not support interactive transactions; the callback runs "
            + "without isolation and earlier writes are not rolled back on failure. Use executeBatch for atomic writes.",
        Map.of("feature", "transaction"), context());
    return callback.apply(this);
  }

  private <R> R runTopLevel(TransactionCallback<R> callback, TransactionOptions options) {
    C c = getClient();
    T tx;
    try {
      tx = begin(c, options);
    } catch (Exception e) {
      throw translateTx(e, "begin");
    }

    TransactionScope<T> scope = new TransactionScope<>(tx);
    currentScope.set(scope);
    activeScopes.add(scope);
    Throwable failure = null;
    try {
      R result = callback.apply(new TransactionBoundDriver<>(ops, scope, instrumentation));
      scope.ensureUsable();
      try {
        commit(tx);
      } catch (Exception e) {
        throw translateTx(e, "commit");
      }
      return result;
    } catch (RuntimeException | Error e) {
      failure = e;
      try {
        rollback(tx);
      } catch (Exception re) {
        e.addSuppressed(translateTx(re, "rollback"));
      }
      throw e;
    } finally {
      scope.complete();
      currentScope.remove();
      activeScopes.remove(scope);
      releaseAfter(tx, failure);
    }
  }

  private void releaseAfter(T tx, Throwable failure) {
    try {
      release(tx);
    } catch (Exception e) {
      DriverException translated = translateTx(e, "release");
      if (failure == null) throw translated;
      failure.addSuppressed(translated);
    }
  }

  /** Savepoint block: SAVEPOINT, callback, RELEASE; ROLLBACK TO and rethrow on failure. */
  private <R> R runNested(TransactionScope<T> scope, TransactionCallback<R> callback, Driver view, TransactionOptions options) {
    scope.ensureUsable();
    if (options != null && options.isolationLevel() != null) {
      instrumentation.warn("Isolation level " + options.isolationLevel()
          + " ignored for a nested transaction; savepoints inherit the enclosing transaction's isolation.",
          Map.of("feature", "isolationLevel"), context());
    }
    T tx = scope.tx();
    scope.lockSavepoints();
    try {
      String name = nextSavepointName();
      try {
        savepoint(tx, name);
      } catch (Exception e) {
        throw translateTx(e, "savepoint");
      }
      scope.pushSavepoint(name);
      try {
        R result = callback.apply(view);
        try {
          releaseSavepoint(tx, name);
        } catch (Exception e) {
          throw translateTx(e, "release savepoint");
        }
        return result;
      } catch (RuntimeException | Error e) {
        try {
          rollbackToSavepoint(tx, name);
        } catch (Exception re) {
          e.addSuppressed(translateTx(re, "rollback to savepoint"));
        }
        throw e;
      } finally {
        scope.popSavepoint(name);
      }
    } finally {
      scope.unlockSavepoints();
    }
  }

  /** Unique per driver instance: counter plus wall-clock millis. */
  protected final String nextSavepointName() {
    return "sp_" + savepointCounter.incrementAndGet() + "_" + System.currentTimeMillis();
  }

  @Override
  public final boolean inTransaction() {
    return currentScope.get() != null;
  }

  @Override
  public final int transactionDepth() {
    TransactionScope<T> scope = currentScope.get();
    return scope == null ? 0 : scope.depth();
  }

  // --- batch ---

  /**
   * Three tiers, in order: native atomic batch; sequential inside a transaction (the caller's
   * transaction when this thread holds one, otherwise a new one); sequential with a non-atomicity
   * warning.
   */
  @Override
  public final List<QueryResult> executeBatch(List<BatchQuery> queries) {
    Objects.requireNonNull(queries, "queries");
    if (queries.isEmpty()) return List.of();
    List<BatchQuery> batch = List.copyOf(queries);
    Map<String, Object> attrs = contextAttributes();
    attrs.put(SpanNames.ATTR_DB_BATCH_SIZE, batch.size());
    return instrumentation.span(SpanNames.BATCH, attrs, () -> runBatch(batch));
  }

  private List<QueryResult> runBatch(List<BatchQuery> batch) {
    TransactionScope<T> scope = currentScope.get();
    if (scope != null) {
      // savepoint keeps the batch all-or-nothing while the enclosing transaction stays open
      TransactionBoundDriver<T> view = new TransactionBoundDriver<>(ops, scope, instrumentation);
      return runNested(scope, tx -> runSequential(tx, batch), view, null);
    }
    if (capabilities.supportsBatch()) return runNativeBatch(batch);
    if (capabilities.supportsTransactions()) return withTransaction(tx -> runSequential(tx, batch));

    instrumentation.warn("Batch of " + batch.size() + " statements is not atomic on " + driverName
            + ": a failure leaves earlier statements committed and skips the rest.",
        Map.of("feature", "batch", "batchSize", batch.size()), context());
    return runSequential(this, batch);
  }

  private static List<QueryResult> runSequential(Driver target, List<BatchQuery> batch) {
    List<QueryResult> out = new ArrayList<>(batch.size());
    for (BatchQuery q : batch) out.add(target.executeRaw(q.sql(), q.params()));
    return Collections.unmodifiableList(out);
  }

  private List<QueryResult> runNativeBatch(List<BatchQuery> batch) {
    String summary = batch.stream().map(BatchQuery::sql).collect(Collectors.joining(";\n"));
    List<Object> params = batch.stream().map(q -> (Object) q.params()).collect(Collectors.toList());
    return instrumentation.query(summary, params, context(), () -> {
      C c = getClient();
      List<QueryResult> results;
      try {
        results = executeNativeBatch(c, batch);
      } catch (Exception e) {
        throw translate(e, summary, params);
      }
      if (results == null || results.size() != batch.size()) {
        throw new DriverException("Native batch returned " + (results == null ? 0 : results.size())
            + " results for " + batch.size() + " statements", ErrorCode.INTERNAL_ERROR);
      }
      return List.copyOf(results);
    });
  }

  // --- context ---

  @Override
  public final void setContext(QueryExecutionContext ctx) {
    if (ctx == null || ctx.isEmpty()) context.remove();
    else context.set(ctx);
  }

  @Override
  public final void clearContext() {
    context.remove();
  }

  @Override
  public final QueryExecutionContext context() {
    QueryExecutionContext ctx = context.get();
    return ctx == null ? QueryExecutionContext.NONE : ctx;
  }

  // --- error translation ---

  protected final DriverException translate(Throwable error, String sql, List<?> params) {
    if (error instanceof DriverException de) return de;
    if (error instanceof InterruptedException) Thread.currentThread().interrupt();
    DriverException out = exceptionTranslator().translate(error, sql, params);
    return (out == null) ? ExceptionTranslator.GENERIC.translate(error, sql, params) : out;
  }

  private DriverException translateTx(Throwable error, String step) {
    DriverException de = translate(error, null, null);
    if (de instanceof TransactionException || de instanceof ConnectionException) return de;
    if (error instanceof DriverException) return de;
    return new TransactionException("Transaction " + step + " failed: " + de.getMessage(),
        de.code() == ErrorCode.QUERY_FAILED ? ErrorCode.TRANSACTION_FAILED : de.code(), de.nativeCode(), error);
  }

  private DriverException translateConnect(Throwable error) {
    DriverException de = translate(error, null, null);
    if (de instanceof ConnectionException || error instanceof DriverException) return de;
    log.debug("unisql.connect_failed driver={} error={}", driverName, String.valueOf(error));
    return new ConnectionException("Failed to initialize " + driverName + " client: " + de.getMessage(),
        ErrorCode.CONNECTION_FAILED, de.nativeCode(), error);
  }

  private void closeTranslated(C c) {
    try {
      closeClient(c);
    } catch (Exception e) {
      throw new ConnectionException("Failed to close " + driverName + " client: " + e.getMessage(),
          ErrorCode.CONNECTION_CLOSED, null, e);
    }
  }

  private final class Ops implements TransactionOps<T> {
    @Override
    public Driver owner() {
      return AbstractDriver.this;
    }

    @Override
    public QueryResult executeIn(TransactionScope<T> scope, String sql, List<Object> params) {
      scope.ensureUsable();
      try {
        return executeInTransaction(scope.tx(), sql, params);
      } catch (Exception e) {
        throw translate(e, sql, params);
      }
    }

    @Override
    public <R> R nest(TransactionScope<T> scope, TransactionCallback<R> callback, Driver view, TransactionOptions options) {
      return runNested(scope, callback, view, options);
    }
  }
}
