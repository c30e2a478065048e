/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import tracecore.SpanContext;
import tracecore.TraceId;
import tracecore.internal.Nullable;

import static tracecore.internal.HexCodec.toLowerHex;

/**
 * Contains trace identifiers and flags compatible with <a href="https://github.com/openzipkin/b3-propagation">B3
 * Propagation</a>.
 *
 * <p>Unlike {@link tracecore.simple.SimpleContext}, the trace ID can be 128-bit and the parent
 * span ID is explicit. {@link #sampled()} is derived from the {@link B3Flag#SAMPLED} flag, so
 * the two never disagree.
 */
//@Immutable
public final class B3Context implements SpanContext {
  public static Builder newBuilder() {
    return new Builder();
  }

  final TraceId traceId;
  final long spanId, parentId;
  final boolean hasParentId;
  final int flags; // bit field of B3Flag
  final Map<String, String> baggage;

  B3Context(TraceId traceId, long spanId, boolean hasParentId, long parentId, int flags,
    Map<String, String> baggage) {
    this.traceId = traceId;
    this.spanId = spanId;
    this.hasParentId = hasParentId;
    this.parentId = parentId;
    this.flags = flags;
    this.baggage = baggage;
  }

  /** Identifier shared by all spans in this trace. */
  public TraceId traceId() {
    return traceId;
  }

  /** Returns 32 lower-hex characters for a 128-bit trace ID, otherwise 16. */
  @Override public String traceIdString() {
    return traceId.toLowerHex();
  }

  @Override public long spanId() {
    return spanId;
  }

  volatile String spanIdString; // Lazily initialized and cached.

  /** Returns the span ID as 16 lower-hex characters. */
  @Override public String spanIdString() {
    String r = spanIdString;
    if (r == null) r = spanIdString = toLowerHex(spanId);
    return r;
  }

  /** The parent's {@link #spanId()}, or null if this is the root span of a trace. */
  @Nullable public Long parentId() {
    return hasParentId ? parentId : null;
  }

  volatile String parentIdString; // Lazily initialized and cached.

  /** Returns the parent ID as 16 lower-hex characters, or null if absent. */
  @Nullable public String parentIdString() {
    if (!hasParentId) return null;
    String r = parentIdString;
    if (r == null) r = parentIdString = toLowerHex(parentId);
    return r;
  }

  /** Returns a snapshot of the flags set on this context. */
  public Set<B3Flag> flags() {
    return B3Flag.fromBits(flags);
  }

  public boolean hasFlag(B3Flag flag) {
    if (flag == null) throw new NullPointerException("flag == null");
    return (flags & flag.bit) == flag.bit;
  }

  /** Returns true when {@link B3Flag#SAMPLED} is set. */
  @Override public boolean sampled() {
    return hasFlag(B3Flag.SAMPLED);
  }

  /** Returns true when {@link B3Flag#DEBUG} is set. Debug is independent of sampled. */
  public boolean debug() {
    return hasFlag(B3Flag.DEBUG);
  }

  /** Returns a copy with {@link B3Flag#SAMPLED} added or removed. */
  public B3Context withSampled(boolean sampled) {
    return withFlag(B3Flag.SAMPLED, sampled);
  }

  /** Returns a copy with the flag added or removed. */
  public B3Context withFlag(B3Flag flag, boolean set) {
    if (flag == null) throw new NullPointerException("flag == null");
    int newFlags = set ? flags | flag.bit : flags & ~flag.bit;
    if (newFlags == flags) return this;
    return new B3Context(traceId, spanId, hasParentId, parentId, newFlags, baggage);
  }

  @Override public Map<String, String> baggage() {
    return baggage;
  }

  @Override @Nullable public String baggageItem(String key) {
    if (key == null) throw new NullPointerException("key == null");
    return baggage.get(key);
  }

  @Override public B3Context withBaggageItem(String key, String value) {
    return toBuilder().putBaggage(key, value).build();
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof B3Context)) return false;
    B3Context that = (B3Context) o;
    return traceId.equals(that.traceId)
      && spanId == that.spanId
      && hasParentId == that.hasParentId
      && parentId == that.parentId
      && flags == that.flags
      && baggage.equals(that.baggage);
  }

  volatile int hashCode; // Lazily initialized and cached.

  @Override public int hashCode() {
    int h = hashCode;
    if (h == 0) {
      h = 1000003;
      h ^= traceId.hashCode();
      h *= 1000003;
      h ^= (int) ((spanId >>> 32) ^ spanId);
      h *= 1000003;
      h ^= hasParentId ? (int) ((parentId >>> 32) ^ parentId) : 1237;
      h *= 1000003;
      h ^= flags;
      h *= 1000003;
      h ^= baggage.hashCode();
      hashCode = h;
    }
    return h;
  }

  /** Returns {@code $traceId/$spanId} in lower-hex */
  @Override public String toString() {
    return traceIdString() + "/" + spanIdString();
  }

  public static final class Builder {
    TraceId traceId;
    long spanId, parentId;
    boolean hasParentId;
    int flags;
    Map<String, String> baggage;

    Builder(B3Context context) {
      traceId = context.traceId;
      spanId = context.spanId;
      hasParentId = context.hasParentId;
      parentId = context.parentId;
      flags = context.flags;
      if (!context.baggage.isEmpty()) baggage = new LinkedHashMap<>(context.baggage);
    }

    /** @see B3Context#traceId() */
    public Builder traceId(TraceId traceId) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      this.traceId = traceId;
      return this;
    }

    /** @see B3Context#spanId() */
    public Builder spanId(long spanId) {
      this.spanId = spanId;
      return this;
    }

    /** @see B3Context#parentId() */
    public Builder parentId(long parentId) {
      this.hasParentId = true;
      this.parentId = parentId;
      return this;
    }

    /** @see B3Context#parentId() */
    public Builder parentId(@Nullable Long parentId) {
      if (parentId == null) {
        this.hasParentId = false;
        this.parentId = 0L;
        return this;
      }
      return parentId(parentId.longValue());
    }

    /** Replaces all flags with the input. */
    public Builder flags(Set<B3Flag> flags) {
      if (flags == null) throw new NullPointerException("flags == null");
      this.flags = B3Flag.toBits(flags);
      return this;
    }

    public Builder flag(B3Flag flag, boolean set) {
      if (flag == null) throw new NullPointerException("flag == null");
      if (set) {
        flags |= flag.bit;
      } else {
        flags &= ~flag.bit;
      }
      return this;
    }

    /** @see B3Context#sampled() */
    public Builder sampled(boolean sampled) {
      return flag(B3Flag.SAMPLED, sampled);
    }

    /** @see B3Context#debug() */
    public Builder debug(boolean debug) {
      return flag(B3Flag.DEBUG, debug);
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

    public B3Context build() {
      if (traceId == null) throw new IllegalStateException("Missing: traceId");
      Map<String, String> baggage = this.baggage == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(this.baggage));
      return new B3Context(traceId, spanId, hasParentId, parentId, flags, baggage);
    }

    Builder() { // no external implementations
    }
  }
}
