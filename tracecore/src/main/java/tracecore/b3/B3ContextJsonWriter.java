/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import java.util.Map;
import tracecore.internal.codec.JsonWriter;

/**
 * Writes a B3 context with lower-hex IDs. {@code parent_id} is omitted when absent and flags are
 * written by name.
 */
public enum B3ContextJsonWriter implements JsonWriter.Writer<B3Context> {
  INSTANCE;

  @Override public void write(B3Context value, JsonWriter out) {
    out.beginObject();
    out.name("trace_id").value(value.traceIdString());
    out.name("span_id").value(value.spanIdString());
    String parentId = value.parentIdString();
    if (parentId != null) out.name("parent_id").value(parentId);
    out.name("flags").beginArray();
    for (B3Flag flag : value.flags()) out.value(flag.name());
    out.endArray();
    out.name("baggage").beginObject();
    for (Map.Entry<String, String> entry : value.baggage().entrySet()) {
      out.name(entry.getKey()).value(entry.getValue());
    }
    out.endObject();
    out.endObject();
  }
}
