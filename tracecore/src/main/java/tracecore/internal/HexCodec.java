/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.internal;

// code originally imported from zipkin.Util
public final class HexCodec {

  /**
   * Returns true if every character in the range is a hex digit. Both lower and upper case are
   * accepted, as some peers upper-case identifiers when relaying headers.
   */
  public static boolean isHex(CharSequence hex, int beginIndex, int endIndex) {
    if (beginIndex >= endIndex) return false;
    for (int i = beginIndex; i < endIndex; i++) {
      if (digit(hex.charAt(i)) == -1) return false;
    }
    return true;
  }

  /**
   * Parses up to 16 hex characters with no prefix into an unsigned long.
   *
   * @throws NumberFormatException if the range is empty, longer than 16 characters, or contains a
   * character that isn't a hex digit
   */
  public static long hexToUnsignedLong(CharSequence hex, int beginIndex, int endIndex) {
    if (endIndex - beginIndex > 16 || !isHex(hex, beginIndex, endIndex)) {
      throw new NumberFormatException(
        hex + " should be a 1 to 16 character hex string with no prefix");
    }
    long result = 0;
    for (int i = beginIndex; i < endIndex; i++) {
      result = (result << 4) | digit(hex.charAt(i));
    }
    return result;
  }

  static int digit(char c) {
    if (c >= '0' && c <= '9') return c - '0';
    if (c >= 'a' && c <= 'f') return c - 'a' + 10;
    if (c >= 'A' && c <= 'F') return c - 'A' + 10;
    return -1;
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static String toLowerHex(long v) {
    char[] data = new char[16];
    writeHexLong(data, 0, v);
    return new String(data);
  }

  /** Inspired by {@code okio.Buffer.writeLong} */
  public static void writeHexLong(char[] data, int pos, long v) {
    writeHexByte(data, pos + 0, (byte) ((v >>> 56L) & 0xff));
    writeHexByte(data, pos + 2, (byte) ((v >>> 48L) & 0xff));
    writeHexByte(data, pos + 4, (byte) ((v >>> 40L) & 0xff));
    writeHexByte(data, pos + 6, (byte) ((v >>> 32L) & 0xff));
    writeHexByte(data, pos + 8, (byte) ((v >>> 24L) & 0xff));
    writeHexByte(data, pos + 10, (byte) ((v >>> 16L) & 0xff));
    writeHexByte(data, pos + 12, (byte) ((v >>> 8L) & 0xff));
    writeHexByte(data, pos + 14, (byte) (v & 0xff));
  }

  static final char[] HEX_DIGITS =
    {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

  static void writeHexByte(char[] data, int pos, byte b) {
    data[pos + 0] = HEX_DIGITS[(b >> 4) & 0xf];
    data[pos + 1] = HEX_DIGITS[b & 0xf];
  }

  HexCodec() {
  }
}
