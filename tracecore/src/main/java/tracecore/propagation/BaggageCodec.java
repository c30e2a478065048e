/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes and reads baggage as text map entries. Each item is a separate entry whose key is the
 * baggage key prefixed with {@value #PREFIX}. Any string is a valid value, so baggage entries never
 * cause extraction to fail.
 */
public final class BaggageCodec {
  public static final String PREFIX = "ot-baggage-";

  public static void inject(Map<String, String> baggage, Map<String, String> textMap) {
    for (Map.Entry<String, String> entry : baggage.entrySet()) {
      textMap.put(PREFIX + entry.getKey(), entry.getValue());
    }
  }

  /** Returns baggage entries with the prefix removed. */
  public static Map<String, String> extract(Map<String, String> textMap) {
    Map<String, String> result = null;
    for (Map.Entry<String, String> entry : textMap.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(PREFIX) || entry.getValue() == null) continue;
      if (result == null) result = new LinkedHashMap<>();
      result.put(key.substring(PREFIX.length()), entry.getValue());
    }
    return result == null ? Collections.emptyMap() : Collections.unmodifiableMap(result);
  }

  BaggageCodec() {
  }
}
