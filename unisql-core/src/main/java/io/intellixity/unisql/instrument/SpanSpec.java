package io.intellixity.unisql.instrument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Name and attributes of a span about to be opened. */
public record SpanSpec(String name, Map<String, Object> attributes) {
  public SpanSpec {
    Objects.requireNonNull(name, "name");
    attributes = (attributes == null || attributes.isEmpty())
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static SpanSpec of(String name, Map<String, Object> attributes) {
    return new SpanSpec(name, attributes);
  }

  public Object attribute(String key) {
    return attributes.get(key);
  }
}
