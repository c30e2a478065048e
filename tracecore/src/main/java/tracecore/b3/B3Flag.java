/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.b3;

import java.util.EnumSet;
import java.util.Set;

/**
 * Orthogonal flags of a {@link B3Context}. A bit field is used internally as opposed to several
 * booleans, which allows checking or copying all flags at once.
 *
 * <p>Only {@link #SAMPLED} and {@link #DEBUG} are propagated in B3 headers. The others are local.
 */
public enum B3Flag {
  /** Request to override any storage or collector layer sampling. */
  DEBUG(1 << 3),
  /** A sampling decision was made, as opposed to deferred. */
  SAMPLING_SET(1 << 2),
  /** Spans in this trace are recorded. */
  SAMPLED(1 << 1),
  /** The context started the trace. */
  IS_ROOT(1 << 4);

  final int bit;

  B3Flag(int bit) {
    this.bit = bit;
  }

  static int toBits(Iterable<B3Flag> flags) {
    int result = 0;
    for (B3Flag flag : flags) {
      if (flag == null) throw new NullPointerException("flag == null");
      result |= flag.bit;
    }
    return result;
  }

  static Set<B3Flag> fromBits(int bits) {
    EnumSet<B3Flag> result = EnumSet.noneOf(B3Flag.class);
    for (B3Flag flag : values()) {
      if ((bits & flag.bit) == flag.bit) result.add(flag);
    }
    return result;
  }
}
