/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tasks;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/** Brokers ship signatures as JSON, so header values only keep their JSON type. */
class SignatureJsonTest {
  ObjectMapper mapper = new ObjectMapper();

  @Test void headersSurviveAsJsonTypes() throws Exception {
    Signature signature = Signature.create("add");
    Map<String, Object> headers = new LinkedHashMap<>();
    headers.put("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01");
    headers.put("attempt", 3);
    headers.put("urgent", true);
    signature.setHeaders(headers);

    Signature read = mapper.readValue(mapper.writeValueAsBytes(signature), Signature.class);

    assertThat(read.getHeaders()).containsExactly(
      entry("traceparent", "00-67891233abcdef012345678912345678-463ac35c9f6413ad-01"),
      entry("attempt", 3),
      entry("urgent", true)
    );
  }

  @Test void chordCallbackSurvives() throws Exception {
    Signature member = Signature.create("add");
    Signature callback = Signature.create("sum");
    Chord.create(Group.create(member), callback);

    Signature read = mapper.readValue(mapper.writeValueAsBytes(member), Signature.class);

    assertThat(read.getChordCallback().getUuid()).isEqualTo(callback.getUuid());
    assertThat(read.getGroupUuid()).isEqualTo(member.getGroupUuid());
    assertThat(read.getGroupTaskCount()).isEqualTo(1);
  }
}
