package io.intellixity.unisql.spi;

import io.intellixity.unisql.driver.Dialect;
import io.intellixity.unisql.driver.QueryExecutionContext;
import io.intellixity.unisql.error.DriverException;
import io.intellixity.unisql.instrument.InstrumentationContext;
import io.intellixity.unisql.instrument.QueryLogEvent;
import io.intellixity.unisql.instrument.QueryLogger;
import io.intellixity.unisql.instrument.SpanNames;
import io.intellixity.unisql.instrument.SpanSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Spans and structured query logs around driver calls.
 * <p>
 * Observability only: the wrapped call's return value and exception are passed through untouched,
 * and a failing {@link QueryLogger} is reported on SLF4J instead of failing the call.
 */
public final class DriverInstrumentation {
  private static final Logger log = LoggerFactory.getLogger(DriverInstrumentation.class);

  private final Dialect dialect;
  private final String driverName;
  private final InstrumentationContext context;

  public DriverInstrumentation(Dialect dialect, String driverName, InstrumentationContext context) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.driverName = Objects.requireNonNull(driverName, "driverName");
    this.context = (context == null) ? InstrumentationContext.NONE : context;
  }

  public InstrumentationContext context() { return context; }

  public Map<String, Object> baseAttributes() {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put(SpanNames.ATTR_DB_SYSTEM, dialect.id());
    attrs.put(SpanNames.ATTR_DB_DRIVER, driverName);
    return attrs;
  }

  public Map<String, Object> contextAttributes(QueryExecutionContext qc) {
    Map<String, Object> attrs = baseAttributes();
    if (qc != null && qc.model() != null) attrs.put(SpanNames.ATTR_DB_COLLECTION, qc.model());
    if (qc != null && qc.operation() != null) attrs.put(SpanNames.ATTR_DB_OPERATION, qc.operation().id());
    return attrs;
  }

  /** Execute-span plus one QUERY or ERROR event. */
  public <R> R query(String sql, List<Object> params, QueryExecutionContext qc, Supplier<R> work) {
    long start = System.nanoTime();
    Supplier<R> logged = () -> {
      try {
        R out = work.get();
        logQuery(sql, params, qc, start, null);
        return out;
      } catch (RuntimeException | Error e) {
        logQuery(sql, params, qc, start, e);
        throw e;
      }
    };
    if (!context.hasTracer()) return logged.get();

    Map<String, Object> attrs = contextAttributes(qc);
    if (context.traceSql() && sql != null) attrs.put(SpanNames.ATTR_DB_QUERY_TEXT, sql);
    if (context.traceParams() && params != null) attrs.put(SpanNames.ATTR_DB_QUERY_PARAMS, params);
    return context.tracer().inSpan(SpanSpec.of(SpanNames.EXECUTE, attrs), logged);
  }

  /** Span only; used for transaction, batch, connect and disconnect. */
  public <R> R span(String name, Map<String, Object> attributes, Supplier<R> work) {
    if (!context.hasTracer()) return work.get();
    return context.tracer().inSpan(SpanSpec.of(name, attributes), work);
  }

  public void run(String name, Map<String, Object> attributes, Runnable work) {
    span(name, attributes, () -> {
      work.run();
      return null;
    });
  }

  /**
   * Degradation warnings go to the query logger when one is configured, otherwise to SLF4J at WARN,
   * so they are never silent.
   */
  public void warn(String message, Map<String, Object> meta, QueryExecutionContext qc) {
    QueryLogger logger = context.logger();
    if (logger == null) {
      log.warn("unisql.warning driver={} model={} op={} message={} meta={}",
          driverName, qc == null ? null : qc.model(),
          (qc == null || qc.operation() == null) ? null : qc.operation().id(), message, meta);
      return;
    }
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("driver", driverName);
    if (meta != null) m.putAll(meta);
    m.put("message", message);
    emit(logger, new QueryLogEvent(QueryLogEvent.Level.WARNING, Instant.now(), null,
        qc == null ? null : qc.model(), qc == null ? null : qc.operation(), null, null, null, m));
  }

  private void logQuery(String sql, List<Object> params, QueryExecutionContext qc, long startNanos, Throwable error) {
    QueryLogger logger = context.logger();
    if (logger == null) return;
    if (error instanceof DriverException de) {
      if (de.isLogged()) return;
      de.markLogged();
    }
    Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
    QueryLogEvent event = new QueryLogEvent(
        error == null ? QueryLogEvent.Level.QUERY : QueryLogEvent.Level.ERROR,
        Instant.now(),
        duration,
        qc == null ? null : qc.model(),
        qc == null ? null : qc.operation(),
        logger.includeSql() ? sql : null,
        logger.includeParams() ? params : null,
        error,
        Map.of(SpanNames.ATTR_DB_DRIVER, driverName));
    emit(logger, event);
  }

  private static void emit(QueryLogger logger, QueryLogEvent event) {
    try {
      logger.log(event);
    } catch (RuntimeException e) {
      log.warn("unisql.query_logger_failed level={} error={}", event.level(), e.toString(), e);
    }
  }
}
