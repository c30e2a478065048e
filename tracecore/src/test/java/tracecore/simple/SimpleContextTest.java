/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class SimpleContextTest {
  SimpleContext context = SimpleContext.newBuilder().traceId(1L).spanId(2L).sampled(true).build();

  @Test void idStrings_unsignedDecimal() {
    SimpleContext highBits = context.toBuilder().traceId(-1L).spanId(Long.MIN_VALUE).build();

    assertThat(highBits.traceIdString()).isEqualTo("18446744073709551615");
    assertThat(highBits.spanIdString()).isEqualTo("9223372036854775808");
  }

  @Test void withBaggageItem_returnsCopy() {
    SimpleContext withBaggage = context.withBaggageItem("user", "alice");

    assertThat(context.baggage()).isEmpty();
    assertThat(withBaggage.baggage()).containsExactly(entry("user", "alice"));
    assertThat(withBaggage.baggageItem("user")).isEqualTo("alice");
    assertThat(withBaggage.baggageItem("missing")).isNull();
  }

  @Test void withBaggageItem_replacesExisting() {
    SimpleContext replaced =
      context.withBaggageItem("user", "alice").withBaggageItem("user", "bob");

    assertThat(replaced.baggage()).containsExactly(entry("user", "bob"));
  }

  @Test void withSampled() {
    assertThat(context.withSampled(true)).isSameAs(context);
    assertThat(context.withSampled(false).sampled()).isFalse();
    assertThat(context.withSampled(false).spanId()).isEqualTo(2L);
  }

  @Test void baggage_copiedAndUnmodifiable() {
    Map<String, String> input = new LinkedHashMap<>();
    input.put("a", "1");
    SimpleContext withBaggage = context.toBuilder().baggage(input).build();
    input.put("b", "2");

    assertThat(withBaggage.baggage()).containsOnlyKeys("a");
    assertThatThrownBy(() -> withBaggage.baggage().put("c", "3"))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test void equalsAndHashCode() {
    SimpleContext same = SimpleContext.newBuilder().traceId(1L).spanId(2L).sampled(true).build();

    assertThat(context)
      .isEqualTo(same)
      .hasSameHashCodeAs(same)
      .isNotEqualTo(same.withSampled(false))
      .isNotEqualTo(same.withBaggageItem("a", "b"));
  }

  @Test void testToString() {
    assertThat(context).hasToString("1/2");
  }
}
