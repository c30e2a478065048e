/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.Map;
import tracecore.internal.Nullable;

/**
 * Identity and propagation state of a span, shared by the simple and B3 context types.
 *
 * <p>Implementations are immutable. Methods that look like setters return a new instance, so you
 * need to read the result.
 */
public interface SpanContext {

  /** Text form of the trace ID, in the encoding native to the context type. */
  String traceIdString();

  /** Unique 8-byte identifier of this span within a trace. */
  long spanId();

  /** Text form of the span ID, in the encoding native to the context type. */
  String spanIdString();

  /** True if spans in this trace are recorded. Decided once per trace and never re-sampled. */
  boolean sampled();

  /** Unmodifiable view of items propagated with this context across process boundaries. */
  Map<String, String> baggage();

  /** Returns the baggage value for the given key, or null if absent. */
  @Nullable String baggageItem(String key);

  /** Returns a copy of this context which includes the given baggage item. */
  SpanContext withBaggageItem(String key, String value);
}
