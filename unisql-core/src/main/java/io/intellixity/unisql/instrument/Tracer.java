package io.intellixity.unisql.instrument;

import java.util.function.Supplier;

/**
 * Side-channel tracing hook. Implementations run {@code body} exactly once and return its value
 * (or rethrow its exception) unchanged.
 */
@FunctionalInterface
public interface Tracer {
  <T> T inSpan(SpanSpec span, Supplier<T> body);
}
