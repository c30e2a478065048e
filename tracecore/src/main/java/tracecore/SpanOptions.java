/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import tracecore.internal.Nullable;

/**
 * Input to {@link Tracer#nextContext(SpanOptions)}: the operation being started, its ordered
 * references and an optional sampling override.
 */
//@Immutable
public final class SpanOptions<C extends SpanContext> {

  public static <C extends SpanContext> Builder<C> newBuilder(String operationName) {
    return new Builder<>(operationName);
  }

  final String operationName;
  final List<Reference<C>> references;
  @Nullable final Boolean sampled;

  SpanOptions(Builder<C> builder) {
    this.operationName = builder.operationName;
    this.references = builder.references.isEmpty()
      ? Collections.emptyList()
      : Collections.unmodifiableList(new ArrayList<>(builder.references));
    this.sampled = builder.sampled;
  }

  /** Name of the operation, passed to the sampler when starting a new trace. */
  public String operationName() {
    return operationName;
  }

  /** References in the order they were added. */
  public List<Reference<C>> references() {
    return references;
  }

  /**
   * Overrides the sampler when starting a new trace:
   * <pre><ul>
   *   <li>True means record the trace regardless of the sampler</li>
   *   <li>False means drop the trace regardless of the sampler</li>
   *   <li>Null means defer to the sampler</li>
   * </ul></pre>
   *
   * <p>This has no effect on child contexts, which always inherit their parent's decision.
   */
  @Nullable public Boolean sampled() {
    return sampled;
  }

  @Override public String toString() {
    return "SpanOptions{operationName=" + operationName
      + ", references=" + references
      + ", sampled=" + sampled
      + "}";
  }

  public static final class Builder<C extends SpanContext> {
    final String operationName;
    final List<Reference<C>> references = new ArrayList<>();
    Boolean sampled;

    Builder(String operationName) {
      if (operationName == null) throw new NullPointerException("operationName == null");
      this.operationName = operationName;
    }

    public Builder<C> addReference(Reference<C> reference) {
      if (reference == null) throw new NullPointerException("reference == null");
      references.add(reference);
      return this;
    }

    public Builder<C> childOf(C parent) {
      return addReference(Reference.childOf(parent));
    }

    public Builder<C> followsFrom(C parent) {
      return addReference(Reference.followsFrom(parent));
    }

    /** @see SpanOptions#sampled() */
    public Builder<C> sampled(@Nullable Boolean sampled) {
      this.sampled = sampled;
      return this;
    }

    public SpanOptions<C> build() {
      return new SpanOptions<>(this);
    }
  }
}
