/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.Random;
import tracecore.internal.Platform;

/**
 * Source of trace and span identifiers. Implementations must be safe for concurrent use without
 * external locking.
 *
 * <p>No uniqueness is guaranteed beyond what random 64-bit values give. Zero is never returned, as
 * B3 receivers read a zero ID as absent.
 */
public abstract class IdGenerator {

  /** Draws from a {@link java.util.concurrent.ThreadLocalRandom}, so threads never contend. */
  public static final IdGenerator RANDOM = new IdGenerator() {
    @Override long randomLong() {
      return Platform.get().randomLong();
    }

    @Override public String toString() {
      return "ThreadLocalRandom";
    }
  };

  /**
   * Draws from the supplied random, which is internally synchronized. Use this when you need a
   * reproducible sequence of IDs, for example in tests.
   */
  public static IdGenerator create(final Random random) {
    if (random == null) throw new NullPointerException("random == null");
    return new IdGenerator() {
      @Override long randomLong() {
        return random.nextLong();
      }

      @Override public String toString() {
        return "IdGenerator(" + random + ")";
      }
    };
  }

  /** Returns a non-zero random 64-bit value. */
  public long nextId() {
    long nextId = randomLong();
    while (nextId == 0L) {
      nextId = randomLong();
    }
    return nextId;
  }

  /**
   * Returns a trace ID made from one draw, or two independent draws (high, low) when {@code
   * traceId128Bit} is set.
   */
  public TraceId nextTraceId(boolean traceId128Bit) {
    if (!traceId128Bit) return TraceId.create(nextId());
    long high = nextId();
    return TraceId.create(high, nextId());
  }

  abstract long randomLong();

  IdGenerator() { // no external implementations
  }
}
