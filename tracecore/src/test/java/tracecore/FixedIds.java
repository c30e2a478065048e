/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import java.util.Random;

/** Id generators with predictable output for tests. */
public final class FixedIds {

  /** Returns a generator that yields the given values in order, then fails. */
  public static IdGenerator sequence(long... values) {
    return IdGenerator.create(new Random() {
      static final long serialVersionUID = 0L;
      int i;

      @Override public long nextLong() {
        if (i == values.length) throw new AssertionError("ran out of ids after " + i);
        return values[i++];
      }
    });
  }

  FixedIds() {
  }
}
