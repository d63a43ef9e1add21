package io.intellixity.unisql.spi;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Typed reads over the flat property maps handed to {@link DriverFactory#create(Map)}. */
public final class DriverProperties {
  private final Map<String, String> props;

  public DriverProperties(Map<String, String> props) {
    this.props = (props == null) ? Map.of() : props;
  }

  public String get(String key) {
    String v = props.get(key);
    return (v == null || v.isBlank()) ? null : v.trim();
  }

  public String get(String key, String defaultValue) {
    String v = get(key);
    return v == null ? defaultValue : v;
  }

  public String require(String key) {
    String v = get(key);
    if (v == null) throw new IllegalArgumentException("Missing driver property: " + key);
    return v;
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String v = get(key);
    return v == null ? defaultValue : Boolean.parseBoolean(v);
  }

  public int getInt(String key, int defaultValue) {
    String v = get(key);
    if (v == null) return defaultValue;
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Driver property " + key + " is not an integer: " + v, e);
    }
  }

  /** Milliseconds. */
  public Duration getDuration(String key, Duration defaultValue) {
    String v = get(key);
    if (v == null) return defaultValue;
    try {
      return Duration.ofMillis(Long.parseLong(v));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Driver property " + key + " is not a millisecond count: " + v, e);
    }
  }

  /** Entries under {@code prefix}, with the prefix stripped. */
  public Map<String, String> withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : props.entrySet()) {
      if (e.getKey().startsWith(prefix)) out.put(e.getKey().substring(prefix.length()), e.getValue());
    }
    return out;
  }
}
