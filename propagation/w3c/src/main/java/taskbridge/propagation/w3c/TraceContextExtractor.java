/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

import brave.propagation.Propagation.Getter;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContextOrSamplingFlags;

import static taskbridge.propagation.w3c.TraceContextPropagation.TRACEPARENT;
import static taskbridge.propagation.w3c.TraceContextPropagation.TRACESTATE;
import static taskbridge.propagation.w3c.TraceparentFormat.parseTraceparentFormat;

final class TraceContextExtractor<R> implements Extractor<R> {
  final Getter<R, String> getter;

  TraceContextExtractor(Getter<R, String> getter) {
    this.getter = getter;
  }

  @Override public TraceContextOrSamplingFlags extract(R request) {
    if (request == null) throw new NullPointerException("request == null");
    String traceparent = getter.get(request, TRACEPARENT);
    if (traceparent == null) return TraceContextOrSamplingFlags.EMPTY;

    TraceContext context = parseTraceparentFormat(traceparent);
    // tracestate is meaningless without a valid traceparent, so it is dropped with it
    if (context == null) return TraceContextOrSamplingFlags.EMPTY;

    String tracestate = getter.get(request, TRACESTATE);
    if (tracestate == null || tracestate.trim().isEmpty()) {
      return TraceContextOrSamplingFlags.create(context);
    }
    return TraceContextOrSamplingFlags.newBuilder(context)
      .addExtra(new Tracestate(tracestate))
      .build();
  }

  @Override public String toString() {
    return "TraceContextExtractor{getter=" + getter + "}";
  }
}
