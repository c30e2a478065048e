/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import org.junit.jupiter.api.Test;
import tracecore.TraceId;
import tracecore.internal.codec.JsonWriter;

import static org.assertj.core.api.Assertions.assertThat;

class B3ContextJsonWriterTest {

  @Test void write_child() {
    B3Context context = B3Context.newBuilder()
      .traceId(TraceId.create(1L))
      .spanId(3L)
      .parentId(2L)
      .sampled(true)
      .debug(true)
      .putBaggage("user", "alice")
      .build();

    assertThat(JsonWriter.write(B3ContextJsonWriter.INSTANCE, context)).isEqualTo(
      "{\"trace_id\":\"0000000000000001\",\"span_id\":\"0000000000000003\","
        + "\"parent_id\":\"0000000000000002\",\"flags\":[\"DEBUG\",\"SAMPLED\"],"
        + "\"baggage\":{\"user\":\"alice\"}}");
  }

  @Test void write_rootOmitsParent() {
    B3Context context = B3Context.newBuilder().traceId(TraceId.create(1L)).spanId(3L).build();

    assertThat(JsonWriter.write(B3ContextJsonWriter.INSTANCE, context)).isEqualTo(
      "{\"trace_id\":\"0000000000000001\",\"span_id\":\"0000000000000003\","
        + "\"flags\":[],\"baggage\":{}}");
  }
}
