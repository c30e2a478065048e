/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import java.time.Duration;
import java.util.Map;
import tracecore.Reference;
import tracecore.SpanContext;
import tracecore.internal.codec.JsonWriter;

/**
 * Writes a finished span as one JSON object: operation, ISO-8601 start, duration in seconds,
 * context, references, tags and logs. The context is written by the supplied writer.
 */
public final class FinishedSpanJsonWriter<C extends SpanContext>
  implements JsonWriter.Writer<FinishedSpan<C>> {

  public static <C extends SpanContext> FinishedSpanJsonWriter<C> create(
    JsonWriter.Writer<C> contextWriter) {
    if (contextWriter == null) throw new NullPointerException("contextWriter == null");
    return new FinishedSpanJsonWriter<>(contextWriter);
  }

  final JsonWriter.Writer<C> contextWriter;

  FinishedSpanJsonWriter(JsonWriter.Writer<C> contextWriter) {
    this.contextWriter = contextWriter;
  }

  @Override public void write(FinishedSpan<C> span, JsonWriter out) {
    out.beginObject();
    out.name("operation").value(span.operationName());
    out.name("start").value(span.start().toString());
    out.name("duration").value(seconds(span.duration()));
    out.name("context");
    contextWriter.write(span.context(), out);

    out.name("references").beginArray();
    for (Reference<C> reference : span.references()) {
      out.beginObject();
      out.name(reference.kind() == Reference.Kind.CHILD_OF ? "child_of" : "follows_from");
      contextWriter.write(reference.context(), out);
      out.endObject();
    }
    out.endArray();

    out.name("tags").beginObject();
    for (Map.Entry<String, String> tag : span.tags().entrySet()) {
      out.name(tag.getKey()).value(tag.getValue());
    }
    out.endObject();

    out.name("logs").beginArray();
    for (LogRecord log : span.logs()) {
      out.beginObject();
      out.name("time").value(log.timestamp().toString());
      out.name("fields").beginArray();
      for (Map.Entry<String, String> field : log.fields()) {
        out.beginObject().name(field.getKey()).value(field.getValue()).endObject();
      }
      out.endArray();
      out.endObject();
    }
    out.endArray();
    out.endObject();
  }

  static double seconds(Duration duration) {
    return duration.getSeconds() + duration.getNano() / 1_000_000_000d;
  }

  @Override public String toString() {
    return "FinishedSpanJsonWriter(" + contextWriter + ")";
  }
}
