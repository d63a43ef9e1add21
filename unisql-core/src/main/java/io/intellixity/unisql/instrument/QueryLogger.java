package io.intellixity.unisql.instrument;

/**
 * Receives structured query, warning and error events.
 * <p>
 * {@link #includeSql()} and {@link #includeParams()} tell drivers which fields to populate;
 * parameter values may carry personal data, so they are off by default.
 */
@FunctionalInterface
public interface QueryLogger {
  void log(QueryLogEvent event);

  default boolean includeSql() { return true; }

  default boolean includeParams() { return false; }
}
