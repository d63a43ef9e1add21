package io.intellixity.unisql.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link QueryLogger}: QUERY events at DEBUG, WARNING at WARN, ERROR at ERROR.
 */
public final class Slf4jQueryLogger implements QueryLogger {
  private static final Logger DEFAULT_LOG = LoggerFactory.getLogger("io.intellixity.unisql.query");

  private final Logger log;
  private final boolean includeSql;
  private final boolean includeParams;

  public Slf4jQueryLogger() {
    this(DEFAULT_LOG, true, false);
  }

  public Slf4jQueryLogger(boolean includeSql, boolean includeParams) {
    this(DEFAULT_LOG, includeSql, includeParams);
  }

  public Slf4jQueryLogger(Logger log, boolean includeSql, boolean includeParams) {
    this.log = (log == null) ? DEFAULT_LOG : log;
    this.includeSql = includeSql;
    this.includeParams = includeParams;
  }

  @Override public boolean includeSql() { return includeSql; }
  @Override public boolean includeParams() { return includeParams; }

  @Override
  public void log(QueryLogEvent e) {
    switch (e.level()) {
      case QUERY -> {
        if (!log.isDebugEnabled()) return;
        log.debug("unisql.query model={} op={} durationMs={} sql={} params={}",
            e.model(), opId(e), millis(e), e.sql(), e.params());
      }
      case WARNING -> log.warn("unisql.warning model={} op={} message={} meta={}",
          e.model(), opId(e), e.message(), e.meta());
      case ERROR -> log.error("unisql.error model={} op={} durationMs={} sql={} error={}",
          e.model(), opId(e), millis(e), e.sql(), e.error() == null ? null : e.error().toString());
    }
  }

  private static String opId(QueryLogEvent e) {
    return e.operation() == null ? null : e.operation().id();
  }

  private static Object millis(QueryLogEvent e) {
    return e.duration() == null ? null : e.duration().toNanos() / 1_000_000.0;
  }
}
