/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static java.util.Collections.singletonMap;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class BaggageCodecTest {
  Map<String, String> textMap = new LinkedHashMap<>();

  @Test void inject_prefixesKeys() {
    BaggageCodec.inject(singletonMap("user", "alice"), textMap);

    assertThat(textMap).containsExactly(entry("ot-baggage-user", "alice"));
  }

  @Test void extract_stripsPrefixAndSkipsOtherKeys() {
    textMap.put("x-b3-traceid", "0000000000000001");
    textMap.put("ot-baggage-user", "alice");
    textMap.put("ot-baggage-", "empty key");
    textMap.put("baggage-user", "bob");

    assertThat(BaggageCodec.extract(textMap))
      .containsExactly(entry("user", "alice"), entry("", "empty key"));
  }

  @Test void extract_noBaggage() {
    textMap.put("x-b3-traceid", "0000000000000001");

    assertThat(BaggageCodec.extract(textMap)).isEmpty();
  }

  @Test void extract_unmodifiable() {
    textMap.put("ot-baggage-user", "alice");

    assertThatThrownBy(() -> BaggageCodec.extract(textMap).put("a", "b"))
      .isInstanceOf(UnsupportedOperationException.class);
  }
}
