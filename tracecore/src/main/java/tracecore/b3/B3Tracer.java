/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import java.util.Collections;
import java.util.List;
import tracecore.IdGenerator;
import tracecore.Reference;
import tracecore.TraceId;
import tracecore.Tracer;
import tracecore.internal.Nullable;
import tracecore.sampler.Sampler;

/**
 * Creates {@link B3Context B3 contexts}.
 *
 * <p>The parent of a new context is the first {@link Reference.Kind#CHILD_OF child-of} reference.
 * When only {@link Reference.Kind#FOLLOWS_FROM follows-from} references are present, a new trace
 * is started. This differs from {@link tracecore.simple.SimpleTracer}, which takes the first
 * reference of any kind.
 */
public final class B3Tracer extends Tracer<B3Context> {
  final boolean traceId128Bit;

  public B3Tracer(IdGenerator idGenerator, Sampler sampler, boolean traceId128Bit) {
    super(idGenerator, sampler);
    this.traceId128Bit = traceId128Bit;
  }

  public boolean traceId128Bit() {
    return traceId128Bit;
  }

  @Override public B3Context newRootContext(String operationName, @Nullable Boolean sampled) {
    if (operationName == null) throw new NullPointerException("operationName == null");
    TraceId traceId = idGenerator().nextTraceId(traceId128Bit);
    long spanId = idGenerator().nextId();
    return B3Context.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(decideSampled(traceId, operationName, sampled))
      .build();
  }

  /** Copies the parent's trace ID and all of its flags, so debug carries to every descendant. */
  @Override public B3Context newChild(B3Context parent) {
    if (parent == null) throw new NullPointerException("parent == null");
    return new B3Context(
      parent.traceId,
      idGenerator().nextId(),
      true,
      parent.spanId,
      parent.flags,
      Collections.emptyMap()
    );
  }

  /** Returns the first child-of reference, or null if there are none. */
  @Override @Nullable
  public Reference<B3Context> findParent(List<Reference<B3Context>> references) {
    if (references == null) throw new NullPointerException("references == null");
    for (int i = 0, length = references.size(); i < length; i++) {
      Reference<B3Context> reference = references.get(i);
      if (reference.kind() == Reference.Kind.CHILD_OF) return reference;
    }
    return null;
  }

  @Override public String toString() {
    return "B3Tracer{sampler=" + sampler() + ", traceId128Bit=" + traceId128Bit + "}";
  }
}
