/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class TaskHeadersTest {
  Map<String, Object> headers = new LinkedHashMap<>();
  Map<String, String> carrier = new LinkedHashMap<>();

  @Test void toCarrier_keepsOnlyStrings() {
    headers.put("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");
    headers.put("attempt", 3);
    headers.put("urgent", true);
    headers.put("tags", Arrays.asList("a", "b"));
    headers.put("missing", null);
    headers.put("tenant", "acme");

    assertThat(TaskHeaders.toCarrier(headers)).containsExactly(
      entry("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01"),
      entry("tenant", "acme")
    );
  }

  @Test void toCarrier_nullHeaders() {
    assertThat(TaskHeaders.toCarrier(null)).isEmpty();
  }

  @Test void toCarrier_copies() {
    headers.put("tenant", "acme");

    TaskHeaders.toCarrier(headers).put("tenant", "other");

    assertThat(headers).containsEntry("tenant", "acme");
  }

  @Test void fromCarrier_allocatesWhenNull() {
    carrier.put("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");

    Map<String, Object> result = TaskHeaders.fromCarrier(carrier, null);

    assertThat(result).containsExactly(
      entry("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01")
    );
  }

  @Test void fromCarrier_writesInPlace() {
    assertThat(TaskHeaders.fromCarrier(carrier, headers)).isSameAs(headers);
  }

  @Test void fromCarrier_overwritesCollidingKeys() {
    headers.put("traceparent", 42);
    carrier.put("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");

    TaskHeaders.fromCarrier(carrier, headers);

    assertThat(headers).containsEntry(
      "traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");
  }

  @Test void fromCarrier_leavesOtherHeaders() {
    headers.put("attempt", 3);
    headers.put("routing", "fast");
    carrier.put("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");

    TaskHeaders.fromCarrier(carrier, headers);

    assertThat(headers).containsExactly(
      entry("attempt", 3),
      entry("routing", "fast"),
      entry("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01")
    );
  }
}
