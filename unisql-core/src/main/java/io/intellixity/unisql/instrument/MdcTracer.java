package io.intellixity.unisql.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link Tracer} that exposes the active span through the SLF4J {@link MDC}, so every log line
 * written inside the span carries its name and attributes. Nested spans restore the outer MDC on
 * exit.
 */
public final class MdcTracer implements Tracer {
  private static final Logger log = LoggerFactory.getLogger(MdcTracer.class);

  public static final String MDC_SPAN = "unisql.span";

  @Override
  public <T> T inSpan(SpanSpec span, Supplier<T> body) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    MDC.put(MDC_SPAN, span.name());
    for (Map.Entry<String, Object> a : span.attributes().entrySet()) {
      if (a.getValue() != null) MDC.put(a.getKey(), String.valueOf(a.getValue()));
    }
    long start = System.nanoTime();
    boolean ok = false;
    try {
      T out = body.get();
      ok = true;
      return out;
    } finally {
      if (log.isTraceEnabled()) {
        log.trace("unisql.span name={} ok={} durationMs={}", span.name(), ok, (System.nanoTime() - start) / 1_000_000.0);
      }
      if (previous == null) MDC.clear();
      else MDC.setContextMap(previous);
    }
  }
}
