/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tracecore.IdGenerator;
import tracecore.Reference;
import tracecore.SpanOptions;
import tracecore.TraceId;
import tracecore.sampler.Sampler;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tracecore.FixedIds.sequence;

@ExtendWith(MockitoExtension.class)
class SimpleTracerTest {
  @Mock Sampler sampler;

  SimpleContext parent = SimpleContext.newBuilder().traceId(10L).spanId(20L).sampled(true)
    .putBaggage("user", "alice").build();
  SimpleContext other = SimpleContext.newBuilder().traceId(30L).spanId(40L).build();

  @Test void nextContext_root_usesSampler() {
    when(sampler.isSampled(TraceId.create(1L), "get-user")).thenReturn(true);
    SimpleTracer tracer = new SimpleTracer(sequence(1L, 2L), sampler);

    SimpleContext root =
      tracer.nextContext(SpanOptions.<SimpleContext>newBuilder("get-user").build());

    assertThat(root.traceId()).isEqualTo(1L);
    assertThat(root.spanId()).isEqualTo(2L);
    assertThat(root.sampled()).isTrue();
    assertThat(root.baggage()).isEmpty();
    verify(sampler).isSampled(TraceId.create(1L), "get-user");
  }

  @Test void nextContext_root_samplerDeclines() {
    when(sampler.isSampled(any(TraceId.class), anyString())).thenReturn(false);
    SimpleTracer tracer = new SimpleTracer(sequence(1L, 2L), sampler);

    assertThat(tracer.nextContext(SpanOptions.<SimpleContext>newBuilder("get").build()).sampled())
      .isFalse();
  }

  @Test void nextContext_root_overrideSkipsSampler() {
    SimpleTracer tracer = new SimpleTracer(sequence(1L, 2L), sampler);

    SimpleContext root = tracer.nextContext(
      SpanOptions.<SimpleContext>newBuilder("get").sampled(true).build());

    assertThat(root.sampled()).isTrue();
    verifyNoInteractions(sampler);
  }

  @Test void nextContext_child_inheritsTraceAndSampled() {
    SimpleTracer tracer = new SimpleTracer(sequence(99L), sampler);

    SimpleContext child = tracer.nextContext(
      SpanOptions.<SimpleContext>newBuilder("child").childOf(parent).build());

    assertThat(child.traceId()).isEqualTo(parent.traceId());
    assertThat(child.sampled()).isEqualTo(parent.sampled());
    assertThat(child.spanId()).isEqualTo(99L);
    assertThat(child.baggage()).isEmpty();
    verifyNoInteractions(sampler);
  }

  @Test void nextContext_child_ignoresSampledOverride() {
    SimpleTracer tracer = new SimpleTracer(sequence(99L), sampler);

    SimpleContext child = tracer.nextContext(
      SpanOptions.<SimpleContext>newBuilder("child").childOf(parent).sampled(false).build());

    assertThat(child.sampled()).isTrue();
  }

  /** Any reference kind continues the trace, and the first one wins. */
  @Test void findParent_firstReferenceOfAnyKind() {
    SimpleTracer tracer = new SimpleTracer(IdGenerator.RANDOM, sampler);

    assertThat(tracer.findParent(asList(Reference.followsFrom(other), Reference.childOf(parent))))
      .isEqualTo(Reference.followsFrom(other));
    assertThat(tracer.findParent(emptyList())).isNull();
  }

  @Test void nextContext_followsFromContinuesTrace() {
    SimpleTracer tracer = new SimpleTracer(sequence(99L), sampler);

    SimpleContext child = tracer.nextContext(
      SpanOptions.<SimpleContext>newBuilder("child").followsFrom(other).childOf(parent).build());

    assertThat(child.traceId()).isEqualTo(other.traceId());
    assertThat(child.sampled()).isFalse();
  }

  @Test void nextContext_randomIdsAreNonZero() {
    SimpleTracer tracer = new SimpleTracer(IdGenerator.RANDOM, Sampler.ALWAYS_SAMPLE);

    for (int i = 0; i < 1000; i++) {
      SimpleContext root = tracer.nextContext(SpanOptions.<SimpleContext>newBuilder("a").build());
      assertThat(root.traceId()).isNotZero();
      assertThat(root.spanId()).isNotZero();
    }
  }
}
