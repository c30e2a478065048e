/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import tracecore.SpanContext;

/**
 * Injects and extracts {@link SpanContext contexts} as text into carriers that travel in-band
 * across process boundaries.
 *
 * <h3>Carriers</h3>
 * <p>The primary carrier is a text map: a flat map of string keys to string values. HTTP headers
 * are supported by relabeling. Injection writes the same names and values as the text map, and
 * extraction lower-cases every header name before reading it as a text map. Baggage keys are
 * part of the header name, so they come back lower-case: a context whose baggage keys contain
 * upper-case letters does not survive an HTTP round trip unchanged. Use lower-case baggage keys
 * when contexts cross HTTP.
 *
 * <h3>Failure</h3>
 * <p>Injection never fails. Extraction either returns a complete context or throws {@link
 * MalformedCarrierException}. It never returns a partially populated context.
 *
 * @param <C> the context type carried
 */
public interface Propagation<C extends SpanContext> {

  /**
   * Returns the reserved field names used by this format, not including baggage. Useful to clear
   * stale fields from a re-used carrier before injecting a new context.
   */
  List<String> keys();

  /**
   * Writes the context's reserved fields and baggage into the text map, replacing any values
   * already present under the same keys.
   */
  void inject(C context, Map<String, String> textMap);

  /**
   * Reads a context from the text map.
   *
   * @throws MalformedCarrierException if a mandatory field is absent or malformed
   */
  C extract(Map<String, String> textMap);

  /** Like {@link #inject(SpanContext, Map)}, except into HTTP headers. */
  default void inject(C context, HttpHeaders headers) {
    if (headers == null) throw new NullPointerException("headers == null");
    Map<String, String> textMap = new LinkedHashMap<>();
    inject(context, textMap);
    for (Map.Entry<String, String> entry : textMap.entrySet()) {
      headers.put(entry.getKey(), entry.getValue());
    }
  }

  /**
   * Like {@link #extract(Map)}, except from HTTP headers, whose names are compared without regard
   * to case. Baggage keys are returned lower-case.
   *
   * @throws MalformedCarrierException if a mandatory field is absent or malformed
   */
  default C extract(HttpHeaders headers) {
    if (headers == null) throw new NullPointerException("headers == null");
    return extract(headers.toLowerCaseTextMap());
  }
}
