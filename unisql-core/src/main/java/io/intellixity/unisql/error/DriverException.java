package io.intellixity.unisql.error;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the driver error taxonomy.
 * <p>
 * Adapters translate backend-native failures into one of the subclasses before they cross the
 * driver boundary; callers never see a raw {@link java.sql.SQLException} or HTTP client error.
 */
public class DriverException extends RuntimeException {
  private final ErrorCode code;
  private final String nativeCode;
  private final Instant timestamp;
  private volatile boolean logged;

  public DriverException(String message, ErrorCode code) {
    this(message, code, null, null);
  }

  public DriverException(String message, ErrorCode code, Throwable cause) {
    this(message, code, null, cause);
  }

  public DriverException(String message, ErrorCode code, String nativeCode, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.nativeCode = nativeCode;
    this.timestamp = Instant.now();
  }

  public final ErrorCode code() { return code; }

  /** Backend-native code (SQLState, vendor code, engine error name) or null when unknown. */
  public final String nativeCode() { return nativeCode; }

  public final Instant timestamp() { return timestamp; }

  public boolean isRetryable() {
    return Retryables.isRetryable(this);
  }

  /** True once a query log event carrying this error was emitted. */
  public final boolean isLogged() { return logged; }

  public final void markLogged() { this.logged = true; }

  /** Structured view for log sinks. */
  public Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("type", getClass().getSimpleName());
    out.put("message", getMessage());
    out.put("code", code.code());
    if (nativeCode != null) out.put("nativeCode", nativeCode);
    out.put("timestamp", timestamp.toString());
    if (getCause() != null) out.put("cause", getCause().getMessage());
    return out;
  }
}
