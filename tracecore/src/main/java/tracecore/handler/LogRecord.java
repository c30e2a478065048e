/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A timestamped, ordered list of labeled fields recorded on a span. Labels may repeat.
 *
 * <p>Conventional labels are {@link #EVENT}, {@link #MESSAGE}, {@link #STACK} and {@link
 * #ERROR_KIND}; any other label is allowed.
 */
//@Immutable
public final class LogRecord {
  public static final String EVENT = "event";
  public static final String MESSAGE = "message";
  public static final String STACK = "stack";
  public static final String ERROR_KIND = "error.kind";

  public static Builder newBuilder(Instant timestamp) {
    return new Builder(timestamp);
  }

  final Instant timestamp;
  final List<Map.Entry<String, String>> fields;

  LogRecord(Builder builder) {
    this.timestamp = builder.timestamp;
    this.fields = Collections.unmodifiableList(new ArrayList<>(builder.fields));
  }

  public Instant timestamp() {
    return timestamp;
  }

  /** Fields in the order they were added. */
  public List<Map.Entry<String, String>> fields() {
    return fields;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof LogRecord)) return false;
    LogRecord that = (LogRecord) o;
    return timestamp.equals(that.timestamp) && fields.equals(that.fields);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= timestamp.hashCode();
    h *= 1000003;
    h ^= fields.hashCode();
    return h;
  }

  @Override public String toString() {
    return "LogRecord{timestamp=" + timestamp + ", fields=" + fields + "}";
  }

  public static final class Builder {
    final Instant timestamp;
    final List<Map.Entry<String, String>> fields = new ArrayList<>();

    Builder(Instant timestamp) {
      if (timestamp == null) throw new NullPointerException("timestamp == null");
      this.timestamp = timestamp;
    }

    public Builder field(String label, String value) {
      if (label == null) throw new NullPointerException("label == null");
      if (value == null) throw new NullPointerException("value == null");
      fields.add(new SimpleImmutableEntry<>(label, value));
      return this;
    }

    public Builder event(String value) {
      return field(EVENT, value);
    }

    public Builder message(String value) {
      return field(MESSAGE, value);
    }

    /** Records the throwable's class name as {@link #ERROR_KIND} and its stack trace. */
    public Builder error(Throwable error) {
      if (error == null) throw new NullPointerException("error == null");
      field(ERROR_KIND, error.getClass().getName());
      StringWriter stack = new StringWriter();
      error.printStackTrace(new PrintWriter(stack));
      return field(STACK, stack.toString());
    }

    public LogRecord build() {
      return new LogRecord(this);
    }
  }
}
