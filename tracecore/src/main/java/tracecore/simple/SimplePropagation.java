/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.simple;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import tracecore.propagation.BaggageCodec;
import tracecore.propagation.FieldPolicy;
import tracecore.propagation.Propagation;

import static java.util.Arrays.asList;

/**
 * Propagates {@link SimpleContext} as text. Identifiers are unsigned decimal and sampled is "1" or
 * "0". Each baggage item is a separate {@value BaggageCodec#PREFIX} entry.
 *
 * <p>For example, a sampled context with baggage "user" of "alice":
 * <pre>{@code
 * ot-tracer-traceid: 8308243580325542683
 * ot-tracer-spanid: 5040379853120389226
 * ot-tracer-sampled: 1
 * ot-baggage-user: alice
 * }</pre>
 */
public final class SimplePropagation implements Propagation<SimpleContext> {
  static final SimplePropagation INSTANCE = new SimplePropagation();

  public static Propagation<SimpleContext> get() {
    return INSTANCE;
  }

  /**
   * Reserved fields and how extraction treats them. All are mandatory in this format: {@link
   * FieldPolicy} decides whether a missing or invalid value fails extraction.
   */
  public enum Field {
    TRACE_ID("ot-tracer-traceid", FieldPolicy.REQUIRED),
    SPAN_ID("ot-tracer-spanid", FieldPolicy.REQUIRED),
    SAMPLED("ot-tracer-sampled", FieldPolicy.REQUIRED);

    final String key;
    final FieldPolicy policy;

    Field(String key, FieldPolicy policy) {
      this.key = key;
      this.policy = policy;
    }

    public String key() {
      return key;
    }

    public FieldPolicy policy() {
      return policy;
    }
  }

  static final List<String> KEYS = Collections.unmodifiableList(
    asList(Field.TRACE_ID.key, Field.SPAN_ID.key, Field.SAMPLED.key)
  );

  @Override public List<String> keys() {
    return KEYS;
  }

  @Override public void inject(SimpleContext context, Map<String, String> textMap) {
    if (context == null) throw new NullPointerException("context == null");
    if (textMap == null) throw new NullPointerException("textMap == null");
    textMap.put(Field.TRACE_ID.key, context.traceIdString());
    textMap.put(Field.SPAN_ID.key, context.spanIdString());
    textMap.put(Field.SAMPLED.key, context.sampled() ? "1" : "0");
    BaggageCodec.inject(context.baggage(), textMap);
  }

  @Override public SimpleContext extract(Map<String, String> textMap) {
    if (textMap == null) throw new NullPointerException("textMap == null");
    long traceId = parseId(textMap, Field.TRACE_ID);
    long spanId = parseId(textMap, Field.SPAN_ID);
    boolean sampled = parseSampled(textMap);
    return SimpleContext.newBuilder()
      .traceId(traceId)
      .spanId(spanId)
      .sampled(sampled)
      .baggage(BaggageCodec.extract(textMap))
      .build();
  }

  /** Returns the ID, or zero when an optional field is absent or invalid. */
  static long parseId(Map<String, String> textMap, Field field) {
    String value = field.policy.read(textMap, field.key);
    if (value == null) return 0L;
    if (!isDecimal(value)) {
      field.policy.invalid(field.key, value, "an unsigned decimal");
      return 0L;
    }
    try {
      return Long.parseUnsignedLong(value);
    } catch (NumberFormatException e) { // more than 64 bits
      field.policy.invalid(field.key, value, "an unsigned 64-bit decimal");
      return 0L;
    }
  }

  /** A decimal whose value is 1 is sampled, so "01" is too. Any other decimal is not. */
  static boolean parseSampled(Map<String, String> textMap) {
    Field field = Field.SAMPLED;
    String value = field.policy.read(textMap, field.key);
    if (value == null) return false;
    if (!isDecimal(value)) {
      field.policy.invalid(field.key, value, "a decimal");
      return false;
    }
    int last = value.length() - 1, i = 0;
    while (i < last && value.charAt(i) == '0') i++;
    return i == last && value.charAt(i) == '1';
  }

  static boolean isDecimal(String value) {
    int length = value.length();
    if (length == 0) return false;
    for (int i = 0; i < length; i++) {
      char c = value.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  @Override public String toString() {
    return "SimplePropagation";
  }

  SimplePropagation() {
  }
}
