/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import tracecore.internal.Nullable;

/**
 * HTTP header carrier. Names are compared without regard to case, and the case of the most recent
 * {@link #put(String, String)} is kept for display.
 *
 * <p>This type is not thread-safe, as it models a single request's headers.
 */
public final class HttpHeaders {
  public static HttpHeaders create() {
    return new HttpHeaders();
  }

  final TreeMap<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

  /** Replaces any value of a header with the same name, regardless of case. */
  public HttpHeaders put(String name, String value) {
    if (name == null) throw new NullPointerException("name == null");
    if (value == null) throw new NullPointerException("value == null");
    headers.remove(name);
    headers.put(name, value);
    return this;
  }

  /** Returns the header value, or null if absent. */
  @Nullable public String get(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return headers.get(name);
  }

  /** Removes the header, regardless of case. Returns the prior value or null. */
  @Nullable public String remove(String name) {
    if (name == null) throw new NullPointerException("name == null");
    return headers.remove(name);
  }

  public Set<String> names() {
    return Collections.unmodifiableSet(headers.keySet());
  }

  public int size() {
    return headers.size();
  }

  public boolean isEmpty() {
    return headers.isEmpty();
  }

  /** Returns a copy keyed by lower-case header names, suitable for text map extraction. */
  public Map<String, String> toLowerCaseTextMap() {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      result.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue());
    }
    return result;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof HttpHeaders)) return false;
    return toLowerCaseTextMap().equals(((HttpHeaders) o).toLowerCaseTextMap());
  }

  @Override public int hashCode() {
    return toLowerCaseTextMap().hashCode();
  }

  @Override public String toString() {
    return "HttpHeaders" + headers;
  }

  HttpHeaders() {
  }
}
