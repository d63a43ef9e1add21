package io.intellixity.unisql.instrument;

import io.intellixity.unisql.driver.Operation;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Structured record handed to a {@link QueryLogger}. Optional fields are null when absent. */
public record QueryLogEvent(Level level,
                            Instant timestamp,
                            Duration duration,
                            String model,
                            Operation operation,
                            String sql,
                            List<Object> params,
                            Throwable error,
                            Map<String, Object> meta) {
  public enum Level { QUERY, WARNING, ERROR }

  public QueryLogEvent {
    Objects.requireNonNull(level, "level");
    timestamp = (timestamp == null) ? Instant.now() : timestamp;
    meta = (meta == null) ? Map.of() : meta;
  }

  public static QueryLogEvent warning(String message, Map<String, Object> meta) {
    Map<String, Object> m = new LinkedHashMap<>();
    if (meta != null) m.putAll(meta);
    m.put("message", message);
    return new QueryLogEvent(Level.WARNING, Instant.now(), null, null, null, null, null, null, m);
  }

  public String message() {
    Object m = meta.get("message");
    return m == null ? null : String.valueOf(m);
  }
}
