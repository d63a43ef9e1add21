package io.intellixity.unisql.instrument;

/**
 * Optional tracer and logger injected into a driver. Either may be null.
 *
 * @param traceSql    put statement text on execute spans
 * @param traceParams put parameter values on execute spans; may expose personal data
 */
public record InstrumentationContext(Tracer tracer, QueryLogger logger, boolean traceSql, boolean traceParams) {
  public static final InstrumentationContext NONE = new InstrumentationContext(null, null, true, false);

  public InstrumentationContext(Tracer tracer, QueryLogger logger) {
    this(tracer, logger, true, false);
  }

  public static InstrumentationContext of(Tracer tracer, QueryLogger logger) {
    return new InstrumentationContext(tracer, logger);
  }

  public static InstrumentationContext logging(QueryLogger logger) {
    return new InstrumentationContext(null, logger);
  }

  public static InstrumentationContext tracing(Tracer tracer) {
    return new InstrumentationContext(tracer, null);
  }

  public InstrumentationContext withTraceParams(boolean include) {
    return new InstrumentationContext(tracer, logger, traceSql, include);
  }

  public boolean hasTracer() { return tracer != null; }

  public boolean hasLogger() { return logger != null; }
}
