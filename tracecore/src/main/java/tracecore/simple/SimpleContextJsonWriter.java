/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import java.util.Map;
import tracecore.internal.codec.JsonWriter;

/** Writes {@code {"trace_id":n,"span_id":n,"sampled":b,"baggage":{}}} with unsigned IDs. */
public enum SimpleContextJsonWriter implements JsonWriter.Writer<SimpleContext> {
  INSTANCE;

  @Override public void write(SimpleContext value, JsonWriter out) {
    out.beginObject();
    out.name("trace_id").unsignedValue(value.traceId());
    out.name("span_id").unsignedValue(value.spanId());
    out.name("sampled").value(value.sampled());
    out.name("baggage").beginObject();
    for (Map.Entry<String, String> entry : value.baggage().entrySet()) {
      out.name(entry.getKey()).value(entry.getValue());
    }
    out.endObject();
    out.endObject();
  }
}
