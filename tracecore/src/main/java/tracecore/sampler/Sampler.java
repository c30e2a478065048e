/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.sampler;

import tracecore.TraceId;

/**
 * Sampler is responsible for deciding if a particular trace should be "sampled", i.e. whether the
 * overhead of tracing will occur and/or if a trace will be reported to the collection tier.
 *
 * <p>The decision happens once, at the root of the trace, and is propagated downstream. Child
 * contexts never consult the sampler. Implementations must be safe to call concurrently.
 */
// abstract for factory-method support
public abstract class Sampler {

  public static final Sampler ALWAYS_SAMPLE = new Sampler() {
    @Override public boolean isSampled(TraceId traceId, String operationName) {
      return true;
    }

    @Override public String toString() {
      return "AlwaysSample";
    }
  };

  public static final Sampler NEVER_SAMPLE = new Sampler() {
    @Override public boolean isSampled(TraceId traceId, String operationName) {
      return false;
    }

    @Override public String toString() {
      return "NeverSample";
    }
  };

  /**
   * Returns true if the trace should be recorded.
   *
   * @param traceId the new trace's identifier, can be ignored
   * @param operationName name of the root operation, can be ignored
   */
  public abstract boolean isSampled(TraceId traceId, String operationName);
}
