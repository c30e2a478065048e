/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import tracecore.SpanContext;
import tracecore.internal.Nullable;

/**
 * Minimal context: a 64-bit trace ID, a 64-bit span ID, a sampled decision and baggage.
 *
 * <p>There is no parent ID. A child is linked to its parent by the shared trace ID and the
 * references recorded on the span.
 */
//@Immutable
public final class SimpleContext implements SpanContext {
  public static Builder newBuilder() {
    return new Builder();
  }

  final long traceId, spanId;
  final boolean sampled;
  final Map<String, String> baggage;

  SimpleContext(long traceId, long spanId, boolean sampled, Map<String, String> baggage) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.sampled = sampled;
    this.baggage = baggage;
  }

  /** Unsigned 8-byte identifier for a trace, set on all spans within it. */
  public long traceId() {
    return traceId;
  }

  /** Returns the trace ID as an unsigned decimal. */
  @Override public String traceIdString() {
    return Long.toUnsignedString(traceId);
  }

  @Override public long spanId() {
    return spanId;
  }

  /** Returns the span ID as an unsigned decimal. */
  @Override public String spanIdString() {
    return Long.toUnsignedString(spanId);
  }

  @Override public boolean sampled() {
    return sampled;
  }

  @Override public Map<String, String> baggage() {
    return baggage;
  }

  @Override @Nullable public String baggageItem(String key) {
    if (key == null) throw new NullPointerException("key == null");
    return baggage.get(key);
  }

  @Override public SimpleContext withBaggageItem(String key, String value) {
    return toBuilder().putBaggage(key, value).build();
  }

  public SimpleContext withSampled(boolean sampled) {
    if (this.sampled == sampled) return this;
    return new SimpleContext(traceId, spanId, sampled, baggage);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SimpleContext)) return false;
    SimpleContext that = (SimpleContext) o;
    return traceId == that.traceId
      && spanId == that.spanId
      && sampled == that.sampled
      && baggage.equals(that.baggage);
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= (int) ((traceId >>> 32) ^ traceId);
    h *= 1000003;
    h ^= (int) ((spanId >>> 32) ^ spanId);
    h *= 1000003;
    h ^= sampled ? 1231 : 1237;
    h *= 1000003;
    h ^= baggage.hashCode();
    return h;
  }

  /** Returns {@code $traceId/$spanId} in unsigned decimal */
  @Override public String toString() {
    return traceIdString() + "/" + spanIdString();
  }

  public static final class Builder {
    long traceId, spanId;
    boolean sampled;
    Map<String, String> baggage;

    Builder(SimpleContext context) {
      traceId = context.traceId;
      spanId = context.spanId;
      sampled = context.sampled;
      if (!context.baggage.isEmpty()) baggage = new LinkedHashMap<>(context.baggage);
    }

    /** @see SimpleContext#traceId() */
    public Builder traceId(long traceId) {
      this.traceId = traceId;
      return this;
    }

    /** @see SimpleContext#spanId() */
    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    /** @see SimpleContext#sampled() */
    public Builder sampled(boolean sampled) {
      this.sampled = sampled;
      return this;
    }

    /** Replaces all baggage with a copy of the input. */
    public Builder baggage(Map<String, String> baggage) {
      if (baggage == null) throw new NullPointerException("baggage == null");
      this.baggage = baggage.isEmpty() ? null : new LinkedHashMap<>(baggage);
      return this;
    }

    public Builder putBaggage(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      if (baggage == null) baggage = new LinkedHashMap<>();
      baggage.put(key, value);
      return this;
    }

    public SimpleContext build() {
      Map<String, String> baggage = this.baggage == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(this.baggage));
      return new SimpleContext(traceId, spanId, sampled, baggage);
    }

    Builder() {
    }
  }
}
