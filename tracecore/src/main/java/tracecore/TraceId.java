/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore;

import tracecore.internal.HexCodec;
import tracecore.internal.Nullable;

import static tracecore.internal.HexCodec.hexToUnsignedLong;
import static tracecore.internal.HexCodec.isHex;
import static tracecore.internal.HexCodec.writeHexLong;

/**
 * Identifier shared by every span in a trace: mandatory low 64 bits and optional high 64 bits.
 *
 * <p>Presence of the high bits is tracked separately from their value. A 128-bit trace ID whose
 * high bits happen to be zero still renders as 32 hex characters.
 */
//@Immutable
public final class TraceId {

  /** Returns a 64-bit trace ID. */
  public static TraceId create(long low) {
    return new TraceId(false, 0L, low);
  }

  /** Returns a 128-bit trace ID. */
  public static TraceId create(long high, long low) {
    return new TraceId(true, high, low);
  }

  /**
   * Parses a 16 or 32 character hex string, where the left-most 16 characters of a 32 character
   * string are the high bits. Returns null if the input is any other length or isn't hex.
   */
  @Nullable public static TraceId parseHex(@Nullable CharSequence hex) {
    if (hex == null) return null;
    int length = hex.length();
    if (length != 16 && length != 32) return null;
    if (!isHex(hex, 0, length)) return null;
    if (length == 16) return create(hexToUnsignedLong(hex, 0, 16));
    return create(hexToUnsignedLong(hex, 0, 16), hexToUnsignedLong(hex, 16, 32));
  }

  final boolean hasHigh;
  final long high, low;

  TraceId(boolean hasHigh, long high, long low) {
    this.hasHigh = hasHigh;
    this.high = high;
    this.low = low;
  }

  /** True when this trace ID carries 128 bits. */
  public boolean hasHigh() {
    return hasHigh;
  }

  /** The upper 64 bits, or zero when {@link #hasHigh() absent}. */
  public long high() {
    return high;
  }

  /** The lower 64 bits, always present. */
  public long low() {
    return low;
  }

  volatile String hexString; // Lazily initialized and cached.

  /** Returns 32 lower-hex characters when {@link #hasHigh()}, otherwise 16. */
  public String toLowerHex() {
    String r = hexString;
    if (r == null) {
      if (hasHigh) {
        char[] result = new char[32];
        writeHexLong(result, 0, high);
        writeHexLong(result, 16, low);
        r = new String(result);
      } else {
        r = HexCodec.toLowerHex(low);
      }
      hexString = r;
    }
    return r;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceId)) return false;
    TraceId that = (TraceId) o;
    return hasHigh == that.hasHigh && high == that.high && low == that.low;
  }

  @Override public int hashCode() {
    int h = 1000003;
    h ^= hasHigh ? 1231 : 1237;
    h *= 1000003;
    h ^= (int) ((high >>> 32) ^ high);
    h *= 1000003;
    h ^= (int) ((low >>> 32) ^ low);
    return h;
  }

  @Override public String toString() {
    return toLowerHex();
  }
}
