/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

import brave.propagation.Propagation.Setter;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Injector;

import static taskbridge.propagation.w3c.TraceContextPropagation.TRACEPARENT;
import static taskbridge.propagation.w3c.TraceContextPropagation.TRACESTATE;
import static taskbridge.propagation.w3c.TraceparentFormat.writeTraceparentFormat;

final class TraceContextInjector<R> implements Injector<R> {
  final Setter<R, String> setter;

  TraceContextInjector(Setter<R, String> setter) {
    this.setter = setter;
  }

  @Override public void inject(TraceContext context, R request) {
    setter.put(request, TRACEPARENT, writeTraceparentFormat(context));
    Tracestate tracestate = context.findExtra(Tracestate.class);
    if (tracestate != null) setter.put(request, TRACESTATE, tracestate.value);
  }

  @Override public String toString() {
    return "TraceContextInjector{setter=" + setter + "}";
  }
}
