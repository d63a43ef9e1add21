package io.intellixity.unisql.error;

import java.util.Map;
import java.util.Objects;

/**
 * The backend cannot provide a feature: transactions on a stateless HTTP engine, or an optional
 * extension (pgvector, PostGIS) that is not enabled.
 */
public class FeatureNotSupportedException extends DriverException {
  private final String feature;
  private final String method;
  private final String suggestion;

  public FeatureNotSupportedException(String feature, String method) {
    this(feature, method, null);
  }

  public FeatureNotSupportedException(String feature, String method, String suggestion) {
    super(message(feature, method, suggestion), ErrorCode.FEATURE_NOT_SUPPORTED);
    this.feature = Objects.requireNonNull(feature, "feature");
    this.method = Objects.requireNonNull(method, "method");
    this.suggestion = suggestion;
  }

  private static String message(String feature, String method, String suggestion) {
    return (suggestion == null || suggestion.isBlank())
        ? feature + "." + method + " is not supported by this driver."
        : feature + "." + method + " is not supported. " + suggestion;
  }

  public String feature() { return feature; }

  public String method() { return method; }

  public String suggestion() { return suggestion; }

  @Override
  public Map<String, Object> toMap() {
    Map<String, Object> out = super.toMap();
    out.put("feature", feature);
    out.put("method", method);
    if (suggestion != null) out.put("suggestion", suggestion);
    return out;
  }
}
