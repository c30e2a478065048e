/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import tracecore.TraceId;
import tracecore.internal.Nullable;
import tracecore.propagation.BaggageCodec;
import tracecore.propagation.FieldPolicy;
import tracecore.propagation.Propagation;

import static java.util.Arrays.asList;
import static tracecore.internal.HexCodec.hexToUnsignedLong;
import static tracecore.internal.HexCodec.isHex;

/**
 * Implements <a href="https://github.com/openzipkin/b3-propagation">B3 Propagation</a> with
 * several fields prefixed with "x-b3-", plus {@value BaggageCodec#PREFIX} baggage entries.
 *
 * <p>For example, a sampled child span:
 * <pre>{@code
 * x-b3-traceid: 463ac35c9f6413ad48485a3953bb6124
 * x-b3-spanid: a2fb4a1d1a96d312
 * x-b3-parentspanid: 0020000000000001
 * x-b3-sampled: true
 * x-b3-flags: 0
 * }</pre>
 *
 * <p>Each {@link Field} carries a {@link FieldPolicy}. A required field that is missing or
 * unreadable fails extraction. An optional one takes its default: an unreadable parent span ID is
 * treated as absent, and any flag value other than the one that sets it leaves the flag unset.
 */
public final class B3Propagation implements Propagation<B3Context> {
  static final B3Propagation INSTANCE = new B3Propagation();

  public static Propagation<B3Context> get() {
    return INSTANCE;
  }

  /** Reserved fields and how extraction treats them. */
  public enum Field {
    /** 128 or 64-bit trace ID lower-hex encoded into 32 or 16 characters */
    TRACE_ID("x-b3-traceid", FieldPolicy.REQUIRED),
    /** 64-bit span ID lower-hex encoded into 16 characters */
    SPAN_ID("x-b3-spanid", FieldPolicy.REQUIRED),
    /** 64-bit parent span ID lower-hex encoded into 16 characters (absent on root span) */
    PARENT_SPAN_ID("x-b3-parentspanid", FieldPolicy.OPTIONAL),
    /** "true" sets {@link B3Flag#SAMPLED}. Anything else leaves it unset. */
    SAMPLED("x-b3-sampled", FieldPolicy.OPTIONAL),
    /** "1" sets {@link B3Flag#DEBUG}. Anything else leaves it unset. */
    FLAGS("x-b3-flags", FieldPolicy.OPTIONAL);

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

  static final List<String> KEYS = Collections.unmodifiableList(asList(
    Field.TRACE_ID.key,
    Field.SPAN_ID.key,
    Field.PARENT_SPAN_ID.key,
    Field.SAMPLED.key,
    Field.FLAGS.key
  ));

  @Override public List<String> keys() {
    return KEYS;
  }

  @Override public void inject(B3Context context, Map<String, String> textMap) {
    if (context == null) throw new NullPointerException("context == null");
    if (textMap == null) throw new NullPointerException("textMap == null");
    textMap.put(Field.TRACE_ID.key, context.traceIdString());
    textMap.put(Field.SPAN_ID.key, context.spanIdString());
    String parentId = context.parentIdString();
    if (parentId != null) textMap.put(Field.PARENT_SPAN_ID.key, parentId);
    textMap.put(Field.SAMPLED.key, context.sampled() ? "true" : "false");
    textMap.put(Field.FLAGS.key, context.debug() ? "1" : "0");
    BaggageCodec.inject(context.baggage(), textMap);
  }

  @Override public B3Context extract(Map<String, String> textMap) {
    if (textMap == null) throw new NullPointerException("textMap == null");
    B3Context.Builder result = B3Context.newBuilder()
      .traceId(parseTraceId(textMap))
      .spanId(parseSpanId(textMap, Field.SPAN_ID));

    Field parent = Field.PARENT_SPAN_ID;
    String parentId = parent.policy.read(textMap, parent.key);
    if (isHexId(parentId)) {
      result.parentId(hexToUnsignedLong(parentId, 0, 16));
    } else if (parentId != null) { // an unreadable optional parent leaves the parent absent
      parent.policy.invalid(parent.key, parentId, "a 16 character hex string");
    }

    result.sampled(parseFlag(textMap, Field.SAMPLED, "true", "false"));
    result.debug(parseFlag(textMap, Field.FLAGS, "1", "0"));
    return result.baggage(BaggageCodec.extract(textMap)).build();
  }

  /** Returns the trace ID, or zero when the field is optional and absent or invalid. */
  static TraceId parseTraceId(Map<String, String> textMap) {
    Field field = Field.TRACE_ID;
    String value = field.policy.read(textMap, field.key);
    if (value == null) return TraceId.create(0L);
    TraceId traceId = TraceId.parseHex(value);
    if (traceId != null) return traceId;
    field.policy.invalid(field.key, value, "a 16 or 32 character hex string");
    return TraceId.create(0L);
  }

  /** Returns the ID, or zero when the field is optional and absent or invalid. */
  static long parseSpanId(Map<String, String> textMap, Field field) {
    String value = field.policy.read(textMap, field.key);
    if (value == null) return 0L;
    if (isHexId(value)) return hexToUnsignedLong(value, 0, 16);
    field.policy.invalid(field.key, value, "a 16 character hex string");
    return 0L;
  }

  /** Returns true on the set value, false on the unset value or when optional and unreadable. */
  static boolean parseFlag(Map<String, String> textMap, Field field, String set, String unset) {
    String value = field.policy.read(textMap, field.key);
    if (value == null) return false;
    if (set.equals(value)) return true;
    if (!unset.equals(value)) field.policy.invalid(field.key, value, set + " or " + unset);
    return false;
  }

  static boolean isHexId(@Nullable String value) {
    return value != null && value.length() == 16 && isHex(value, 0, 16);
  }

  @Override public String toString() {
    return "B3Propagation";
  }

  B3Propagation() {
  }
}
