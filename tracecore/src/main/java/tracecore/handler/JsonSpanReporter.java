/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import java.util.function.Consumer;
import tracecore.SpanContext;
import tracecore.internal.Platform;
import tracecore.internal.codec.JsonWriter;

/**
 * Prints each finished span as a single line of JSON. By default, lines go to the tracer's logger
 * at INFO level.
 */
public final class JsonSpanReporter<C extends SpanContext> implements SpanReporter<C> {

  /** Logs each span through the platform logger. */
  public static <C extends SpanContext> JsonSpanReporter<C> create(
    JsonWriter.Writer<C> contextWriter) {
    Platform platform = Platform.get();
    return create(contextWriter, platform::logInfo);
  }

  public static <C extends SpanContext> JsonSpanReporter<C> create(
    JsonWriter.Writer<C> contextWriter, Consumer<String> sink) {
    if (sink == null) throw new NullPointerException("sink == null");
    return new JsonSpanReporter<>(FinishedSpanJsonWriter.create(contextWriter), sink);
  }

  final FinishedSpanJsonWriter<C> writer;
  final Consumer<String> sink;

  JsonSpanReporter(FinishedSpanJsonWriter<C> writer, Consumer<String> sink) {
    this.writer = writer;
    this.sink = sink;
  }

  @Override public void report(FinishedSpan<C> span) {
    if (span == null) throw new NullPointerException("span == null");
    sink.accept(JsonWriter.write(writer, span));
  }

  @Override public String toString() {
    return "JsonSpanReporter{" + writer + "}";
  }
}
