/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

import brave.propagation.Propagation;
import brave.propagation.TraceContext;
import brave.propagation.TraceContext.Extractor;
import brave.propagation.TraceContext.Injector;
import brave.propagation.TraceContextOrSamplingFlags;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TraceContextPropagationTest {
  Map<String, String> request = new LinkedHashMap<>();
  Propagation.Factory factory = TraceContextPropagation.create();
  Injector<Map<String, String>> injector = factory.get().injector(Map::put);
  Extractor<Map<String, String>> extractor = factory.get().extractor(Map::get);

  TraceContext sampledContext = TraceContext.newBuilder()
    .traceIdHigh(Long.parseUnsignedLong("67891233abcdef01", 16))
    .traceId(Long.parseUnsignedLong("2345678912345678", 16))
    .spanId(Long.parseUnsignedLong("463ac35c9f6413ad", 16))
    .sampled(true)
    .build();
  String validTraceparent = "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01";
  String otherState = "congo=t61rcWkgMzE,rojo=00f067aa0ba902b7";

  @Test void keys() {
    assertThat(factory.get().keys()).containsExactly("traceparent", "tracestate");
  }

  @Test void requires128BitTraceId() {
    assertThat(factory.requires128BitTraceId()).isTrue();
    assertThat(factory.supportsJoin()).isFalse();
  }

  @Test void injects_traceparent_only_when_no_tracestate() {
    injector.inject(sampledContext, request);

    assertThat(request).containsExactly(entry("traceparent", validTraceparent));
  }

  @Test void injects_leaves_other_keys_alone() {
    request.put("task-priority", "high");

    injector.inject(sampledContext, request);

    assertThat(request).containsExactly(
      entry("task-priority", "high"),
      entry("traceparent", validTraceparent)
    );
  }

  @Test void inject_idempotent() {
    injector.inject(sampledContext, request);
    Map<String, String> once = new LinkedHashMap<>(request);

    injector.inject(sampledContext, request);

    assertThat(request).isEqualTo(once);
  }

  @Test void extracts_traceparent() {
    request.put("traceparent", validTraceparent);

    assertThat(extractor.extract(request))
      .isEqualTo(TraceContextOrSamplingFlags.create(sampledContext));
  }

  @Test void extracts_nothing_when_absent() {
    assertThat(extractor.extract(request)).isSameAs(TraceContextOrSamplingFlags.EMPTY);
  }

  @Test void extracts_nothing_when_malformed() {
    request.put("traceparent", "00-garbage");
    request.put("tracestate", otherState);

    assertThat(extractor.extract(request)).isSameAs(TraceContextOrSamplingFlags.EMPTY);
  }

  @Test void roundTrip() {
    injector.inject(sampledContext, request);

    TraceContext extracted = extractor.extract(request).context();
    assertThat(extracted.traceIdString()).isEqualTo(sampledContext.traceIdString());
    assertThat(extracted.spanIdString()).isEqualTo(sampledContext.spanIdString());
    assertThat(extracted.sampled()).isTrue();
  }

  @Test void forwards_tracestate() {
    request.put("traceparent", validTraceparent);
    request.put("tracestate", otherState);

    TraceContextOrSamplingFlags extracted = extractor.extract(request);
    assertThat(extracted.context().findExtra(Tracestate.class))
      .isEqualTo(new Tracestate(otherState));

    Map<String, String> downstream = new LinkedHashMap<>();
    TraceContext child = extracted.context().toBuilder()
      .spanId(Long.parseUnsignedLong("b7ad6b7169203331", 16))
      .build();
    injector.inject(child, downstream);

    assertThat(downstream).containsExactly(
      entry("traceparent", "00-67891233abcdef012345678912345678-b7ad6b7169203331-01"),
      entry("tracestate", otherState)
    );
  }

  @Test void ignores_blank_tracestate() {
    request.put("traceparent", validTraceparent);
    request.put("tracestate", " ");

    assertThat(extractor.extract(request).context().extra()).isEmpty();
  }
}
