/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import java.util.List;
import tracecore.IdGenerator;
import tracecore.Reference;
import tracecore.TraceId;
import tracecore.Tracer;
import tracecore.internal.Nullable;
import tracecore.sampler.Sampler;

/**
 * Creates {@link SimpleContext simple contexts}. Trace IDs are always 64-bit.
 *
 * <p>The parent of a new context is the first reference, whether it is {@link
 * Reference.Kind#CHILD_OF child-of} or {@link Reference.Kind#FOLLOWS_FROM follows-from}. This
 * differs from {@link tracecore.b3.B3Tracer}, which only derives from child-of references.
 */
public final class SimpleTracer extends Tracer<SimpleContext> {

  public SimpleTracer(IdGenerator idGenerator, Sampler sampler) {
    super(idGenerator, sampler);
  }

  @Override public SimpleContext newRootContext(String operationName, @Nullable Boolean sampled) {
    if (operationName == null) throw new NullPointerException("operationName == null");
    TraceId traceId = idGenerator().nextTraceId(false);
    long spanId = idGenerator().nextId();
    return SimpleContext.newBuilder()
      .traceId(traceId.low())
      .spanId(spanId)
      .sampled(decideSampled(traceId, operationName, sampled))
      .build();
  }

  @Override public SimpleContext newChild(SimpleContext parent) {
    if (parent == null) throw new NullPointerException("parent == null");
    return SimpleContext.newBuilder()
      .traceId(parent.traceId())
      .spanId(idGenerator().nextId())
      .sampled(parent.sampled())
      .build();
  }

  /** Returns the first reference regardless of its kind, or null if there are none. */
  @Override @Nullable
  public Reference<SimpleContext> findParent(List<Reference<SimpleContext>> references) {
    if (references == null) throw new NullPointerException("references == null");
    return references.isEmpty() ? null : references.get(0);
  }

  @Override public String toString() {
    return "SimpleTracer{sampler=" + sampler() + "}";
  }
}
