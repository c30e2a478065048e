/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import tracecore.b3.B3Context;
import tracecore.internal.Platform;
import zipkin2.Endpoint;
import zipkin2.Span;
import zipkin2.reporter.Reporter;

/**
 * Converts finished B3 spans into Zipkin's model and passes them to a {@link Reporter}. Unsampled
 * spans are dropped unless {@link Builder#alwaysReportSpans()} is set.
 *
 * <p>Failures converting or reporting a span are logged and never propagate to the caller.
 */
public final class ZipkinSpanReporter implements SpanReporter<B3Context> {

  public static Builder newBuilder(Reporter<Span> spanReporter) {
    return new Builder(spanReporter);
  }

  public static final class Builder {
    final Reporter<Span> spanReporter;
    String localServiceName;
    boolean alwaysReportSpans;

    Builder(Reporter<Span> spanReporter) {
      if (spanReporter == null) throw new NullPointerException("spanReporter == null");
      this.spanReporter = spanReporter;
    }

    /** Lower-case label of the service recording spans. Unset means no local endpoint. */
    public Builder localServiceName(String localServiceName) {
      if (localServiceName == null || localServiceName.isEmpty()) {
        throw new IllegalArgumentException("localServiceName is empty");
      }
      this.localServiceName = localServiceName;
      return this;
    }

    /** Reports spans even when they are not sampled. Useful when a collector decides. */
    public Builder alwaysReportSpans() {
      this.alwaysReportSpans = true;
      return this;
    }

    public ZipkinSpanReporter build() {
      return new ZipkinSpanReporter(this);
    }
  }

  final Reporter<Span> spanReporter;
  final Endpoint localEndpoint;
  final boolean alwaysReportSpans;

  ZipkinSpanReporter(Builder builder) {
    this.spanReporter = builder.spanReporter;
    this.localEndpoint = builder.localServiceName != null
      ? Endpoint.newBuilder().serviceName(builder.localServiceName).build()
      : null;
    this.alwaysReportSpans = builder.alwaysReportSpans;
  }

  @Override public void report(FinishedSpan<B3Context> span) {
    if (span == null) throw new NullPointerException("span == null");
    if (!alwaysReportSpans && !span.context().sampled()) return;
    try {
      // zipkin2.Span rejects zero IDs, which B3 extraction accepts
      spanReporter.report(convert(span));
    } catch (RuntimeException e) {
      Platform.get().log("error reporting {0}", span, e);
    }
  }

  Span convert(FinishedSpan<B3Context> span) {
    B3Context context = span.context();
    Span.Builder result = Span.newBuilder()
      .traceId(context.traceIdString())
      .id(context.spanId())
      .name(span.operationName())
      .timestamp(epochMicros(span.start()))
      .duration(Math.max(1L, micros(span.duration())));

    Long parentId = context.parentId();
    if (parentId != null) result.parentId(parentId);
    if (context.debug()) result.debug(true);
    if (localEndpoint != null) result.localEndpoint(localEndpoint);

    for (Map.Entry<String, String> tag : span.tags().entrySet()) {
      result.putTag(tag.getKey(), tag.getValue());
    }
    for (LogRecord log : span.logs()) {
      result.addAnnotation(epochMicros(log.timestamp()), annotationValue(log));
    }
    return result.build();
  }

  /** A lone event field becomes the annotation as-is. Otherwise fields are joined as k=v. */
  static String annotationValue(LogRecord log) {
    List<Map.Entry<String, String>> fields = log.fields();
    if (fields.size() == 1 && LogRecord.EVENT.equals(fields.get(0).getKey())) {
      return fields.get(0).getValue();
    }
    StringBuilder result = new StringBuilder();
    for (Map.Entry<String, String> field : fields) {
      if (result.length() > 0) result.append(' ');
      result.append(field.getKey()).append('=').append(field.getValue());
    }
    return result.toString();
  }

  static long epochMicros(Instant instant) {
    return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000L;
  }

  static long micros(Duration duration) {
    return duration.getSeconds() * 1_000_000L + duration.getNano() / 1_000L;
  }

  @Override public String toString() {
    return "ZipkinSpanReporter{" + spanReporter + "}";
  }
}
