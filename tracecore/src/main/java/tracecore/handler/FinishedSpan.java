/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tracecore.Reference;
import tracecore.SpanContext;

/**
 * A span that has ended, as handed to a {@link SpanReporter}. Recording timing, tags and logs
 * while the span is in progress is the host's job: this type only carries the result.
 *
 * @param <C> the context type of the tracer that created the span
 */
//@Immutable
public final class FinishedSpan<C extends SpanContext> {
  public static <C extends SpanContext> Builder<C> newBuilder() {
    return new Builder<>();
  }

  final String operationName;
  final Instant start;
  final Duration duration;
  final C context;
  final List<Reference<C>> references;
  final Map<String, String> tags;
  final List<LogRecord> logs;

  FinishedSpan(Builder<C> builder) {
    this.operationName = builder.operationName;
    this.start = builder.start;
    this.duration = builder.duration;
    this.context = builder.context;
    this.references = Collections.unmodifiableList(new ArrayList<>(builder.references));
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
    this.logs = Collections.unmodifiableList(new ArrayList<>(builder.logs));
  }

  public String operationName() {
    return operationName;
  }

  public Instant start() {
    return start;
  }

  public Duration duration() {
    return duration;
  }

  public C context() {
    return context;
  }

  /** References the span was started with, in order. */
  public List<Reference<C>> references() {
    return references;
  }

  /** Tags in the order they were first added. */
  public Map<String, String> tags() {
    return tags;
  }

  /** Log records in the order they were recorded. */
  public List<LogRecord> logs() {
    return logs;
  }

  @Override public String toString() {
    return "FinishedSpan{operationName=" + operationName
      + ", context=" + context
      + ", start=" + start
      + ", duration=" + duration
      + "}";
  }

  public static final class Builder<C extends SpanContext> {
    String operationName;
    Instant start;
    Duration duration;
    C context;
    final List<Reference<C>> references = new ArrayList<>();
    final Map<String, String> tags = new LinkedHashMap<>();
    final List<LogRecord> logs = new ArrayList<>();

    public Builder<C> operationName(String operationName) {
      if (operationName == null) throw new NullPointerException("operationName == null");
      this.operationName = operationName;
      return this;
    }

    public Builder<C> start(Instant start) {
      if (start == null) throw new NullPointerException("start == null");
      this.start = start;
      return this;
    }

    public Builder<C> duration(Duration duration) {
      if (duration == null) throw new NullPointerException("duration == null");
      if (duration.isNegative()) throw new IllegalArgumentException("duration < 0: " + duration);
      this.duration = duration;
      return this;
    }

    public Builder<C> context(C context) {
      if (context == null) throw new NullPointerException("context == null");
      this.context = context;
      return this;
    }

    public Builder<C> addReference(Reference<C> reference) {
      if (reference == null) throw new NullPointerException("reference == null");
      references.add(reference);
      return this;
    }

    public Builder<C> putTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      tags.put(key, value);
      return this;
    }

    public Builder<C> addLog(LogRecord log) {
      if (log == null) throw new NullPointerException("log == null");
      logs.add(log);
      return this;
    }

    public FinishedSpan<C> build() {
      String missing = "";
      if (operationName == null) missing += " operationName";
      if (start == null) missing += " start";
      if (duration == null) missing += " duration";
      if (context == null) missing += " context";
      if (!"".equals(missing)) throw new IllegalStateException("Missing:" + missing);
      return new FinishedSpan<>(this);
    }

    Builder() {
    }
  }
}
