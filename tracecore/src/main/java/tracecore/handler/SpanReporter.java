/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.handler;

import tracecore.SpanContext;

/**
 * Receives spans once they finish, for serialization or output. Implementations must be safe to
 * call from multiple threads.
 *
 * @param <C> the context type of the spans reported
 */
// @FunctionalInterface, as this may be implemented with a lambda. Do not add methods.
public interface SpanReporter<C extends SpanContext> {

  void report(FinishedSpan<C> span);

  /** Returns a reporter that drops every span. */
  static <C extends SpanContext> SpanReporter<C> noop() {
    return span -> {
    };
  }
}
