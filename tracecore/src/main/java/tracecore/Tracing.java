/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import tracecore.b3.B3Tracer;
import tracecore.sampler.Sampler;
import tracecore.simple.SimpleTracer;

/**
 * This provides utilities needed for trace instrumentation. For example, a {@link SimpleTracer}
 * or a {@link B3Tracer}.
 *
 * <p>Instances built via {@link #newBuilder()} share one {@link IdGenerator} and one {@link
 * Sampler} across both tracers. Configuration is programmatic only: nothing is read from the
 * environment.
 */
public final class Tracing {
  public static Builder newBuilder() {
    return new Builder();
  }

  final Sampler sampler;
  final IdGenerator idGenerator;
  final boolean traceId128Bit;
  final SimpleTracer simpleTracer;
  final B3Tracer b3Tracer;

  Tracing(Builder builder) {
    this.sampler = builder.sampler;
    this.idGenerator = builder.idGenerator;
    this.traceId128Bit = builder.traceId128Bit;
    this.simpleTracer = new SimpleTracer(idGenerator, sampler);
    this.b3Tracer = new B3Tracer(idGenerator, sampler, traceId128Bit);
  }

  /** Creates contexts with 64-bit decimal-encoded identifiers. */
  public SimpleTracer simpleTracer() {
    return simpleTracer;
  }

  /** Creates B3-compatible contexts, with 128-bit trace IDs when {@link #traceId128Bit()}. */
  public B3Tracer b3Tracer() {
    return b3Tracer;
  }

  public Sampler sampler() {
    return sampler;
  }

  public IdGenerator idGenerator() {
    return idGenerator;
  }

  public boolean traceId128Bit() {
    return traceId128Bit;
  }

  @Override public String toString() {
    return "Tracing{sampler=" + sampler
      + ", idGenerator=" + idGenerator
      + ", traceId128Bit=" + traceId128Bit
      + "}";
  }

  public static final class Builder {
    Sampler sampler = Sampler.ALWAYS_SAMPLE;
    IdGenerator idGenerator = IdGenerator.RANDOM;
    boolean traceId128Bit = true;

    /**
     * Decides whether new traces are recorded. Defaults to {@link Sampler#ALWAYS_SAMPLE}.
     *
     * <p>The sampler is only consulted when a context is created without a parent and without a
     * {@link SpanOptions#sampled() sampling override}.
     */
    public Builder sampler(Sampler sampler) {
      if (sampler == null) throw new NullPointerException("sampler == null");
      this.sampler = sampler;
      return this;
    }

    /** Source of trace and span IDs. Defaults to {@link IdGenerator#RANDOM}. */
    public Builder idGenerator(IdGenerator idGenerator) {
      if (idGenerator == null) throw new NullPointerException("idGenerator == null");
      this.idGenerator = idGenerator;
      return this;
    }

    /**
     * When true, new B3 root contexts get a 128-bit trace ID drawn from two independent random
     * values. Defaults to true. Simple contexts always use 64-bit trace IDs.
     */
    public Builder traceId128Bit(boolean traceId128Bit) {
      this.traceId128Bit = traceId128Bit;
      return this;
    }

    public Tracing build() {
      return new Tracing(this);
    }

    Builder() {
    }
  }
}
