/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.List;
import tracecore.internal.Nullable;
import tracecore.sampler.Sampler;

/**
 * Creates contexts for new spans, either as the root of a new trace or as the child of an
 * existing context.
 *
 * <p>Tracers hold no per-span state and are safe to share across threads. The only shared mutable
 * state they touch is the {@link IdGenerator} and the {@link Sampler}.
 *
 * @param <C> the context type this tracer creates
 * @see Tracing#simpleTracer()
 * @see Tracing#b3Tracer()
 */
public abstract class Tracer<C extends SpanContext> {
  final IdGenerator idGenerator;
  final Sampler sampler;

  protected Tracer(IdGenerator idGenerator, Sampler sampler) {
    if (idGenerator == null) throw new NullPointerException("idGenerator == null");
    if (sampler == null) throw new NullPointerException("sampler == null");
    this.idGenerator = idGenerator;
    this.sampler = sampler;
  }

  /**
   * Returns a child of the parent chosen by {@link #findParent(List)}, or a new trace when there
   * isn't one.
   */
  public final C nextContext(SpanOptions<C> options) {
    if (options == null) throw new NullPointerException("options == null");
    Reference<C> parent = findParent(options.references());
    if (parent != null) return newChild(parent.context());
    return newRootContext(options.operationName(), options.sampled());
  }

  /**
   * Starts a new trace. The sampler decides unless {@code sampled} is non-null, in which case it
   * is not called at all.
   */
  public abstract C newRootContext(String operationName, @Nullable Boolean sampled);

  /**
   * Returns a context in the same trace as the parent, with a new span ID and the parent's
   * sampling decision. Baggage is not inherited.
   */
  public abstract C newChild(C parent);

  /**
   * Chooses which reference, if any, a new context derives from. The policy differs by context
   * type, so each implementation documents its own.
   */
  @Nullable public abstract Reference<C> findParent(List<Reference<C>> references);

  public final IdGenerator idGenerator() {
    return idGenerator;
  }

  public final Sampler sampler() {
    return sampler;
  }

  /** Returns the override when present, otherwise asks the sampler. */
  protected final boolean decideSampled(
    TraceId traceId, String operationName, @Nullable Boolean sampled) {
    if (sampled != null) return sampled;
    return sampler.isSampled(traceId, operationName);
  }
}
