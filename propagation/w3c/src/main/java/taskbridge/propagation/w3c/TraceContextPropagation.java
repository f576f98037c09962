/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

import brave.internal.Nullable;
import brave.propagation.Propagation;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContext.Injector;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static java.util.Arrays.asList;

/**
 * Propagates trace identity in the W3C <a href="https://www.w3.org/TR/trace-context-1/">trace
 * context</a> format: {@code traceparent} carries the trace ID, span ID and sampled flag, and
 * {@code tracestate} is forwarded unchanged to the next hop.
 *
 * <p>This only carries identity. Compose it with {@link brave.baggage.BaggagePropagation} to carry
 * baggage, whose keys never overlap the two defined here.
 */
public final class TraceContextPropagation extends Propagation.Factory
  implements Propagation<String> {
  static final String TRACEPARENT = "traceparent", TRACESTATE = "tracestate";

  static final TraceContextPropagation INSTANCE = new TraceContextPropagation();

  public static Propagation.Factory create() {
    return INSTANCE;
  }

  // Use nested class to ensure logger isn't initialized unless it is accessed once.
  private static final class LoggerHolder {
    static final Logger LOG = Logger.getLogger(TraceContextPropagation.class.getName());
  }

  final List<String> keys = Collections.unmodifiableList(asList(TRACEPARENT, TRACESTATE));

  TraceContextPropagation() {
  }

  @Override public List<String> keys() {
    return keys;
  }

  /** The {@code traceparent} format has no room for 64-bit trace IDs. */
  @Override public boolean requires128BitTraceId() {
    return true;
  }

  @Override public Propagation<String> get() {
    return this;
  }

  @Override public <R> Injector<R> injector(Setter<R, String> setter) {
    if (setter == null) throw new NullPointerException("setter == null");
    return new TraceContextInjector<>(setter);
  }

  @Override public <R> Extractor<R> extractor(Getter<R, String> getter) {
    if (getter == null) throw new NullPointerException("getter == null");
    return new TraceContextExtractor<>(getter);
  }

  @Override public String toString() {
    return "TraceContextPropagation{}";
  }

  /**
   * Logs at fine level, as invalid input is routine when headers come from arbitrary producers.
   * Avoids array allocation when fine level is disabled.
   */
  static void log(String msg, @Nullable Object param) {
    Logger logger = LoggerHolder.LOG;
    if (!logger.isLoggable(Level.FINE)) return;
    LogRecord lr = new LogRecord(Level.FINE, msg);
    if (param != null) lr.setParameters(new Object[] {param});
    logger.log(lr);
  }
}
