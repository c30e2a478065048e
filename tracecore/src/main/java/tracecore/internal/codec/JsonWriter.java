/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.internal.codec;

import java.util.Arrays;

import static tracecore.internal.codec.JsonEscaper.jsonEscape;

/**
 * Streams compact JSON into a {@link StringBuilder}. Commas and colons are placed automatically,
 * so a {@link Writer} only calls the structural methods in order.
 *
 * <p>This type is not thread-safe. Create one per document.
 */
public final class JsonWriter {
  /** Writes a value as one JSON element. */
  public interface Writer<T> {
    void write(T value, JsonWriter out);
  }

  /** Returns the compact JSON form of the value. */
  public static <T> String write(Writer<T> writer, T value) {
    if (writer == null) throw new NullPointerException("writer == null");
    if (value == null) throw new NullPointerException("value == null");
    JsonWriter out = new JsonWriter();
    writer.write(value, out);
    if (out.depth != 0) {
      throw new IllegalStateException(
        "Bug found using " + writer.getClass().getSimpleName() + ": unclosed " + out.buf);
    }
    return out.buf.toString();
  }

  final StringBuilder buf = new StringBuilder(256);
  // true at a depth when the enclosing object or array already has an element
  boolean[] hasElement = new boolean[8];
  int depth;
  boolean afterName;

  public JsonWriter beginObject() {
    beforeValue();
    buf.append('{');
    push();
    return this;
  }

  public JsonWriter endObject() {
    pop();
    buf.append('}');
    return this;
  }

  public JsonWriter beginArray() {
    beforeValue();
    buf.append('[');
    push();
    return this;
  }

  public JsonWriter endArray() {
    pop();
    buf.append(']');
    return this;
  }

  public JsonWriter name(String name) {
    if (name == null) throw new NullPointerException("name == null");
    if (depth == 0 || afterName) throw new IllegalStateException("name outside of an object");
    if (hasElement[depth - 1]) buf.append(',');
    hasElement[depth - 1] = true;
    quoted(name);
    buf.append(':');
    afterName = true;
    return this;
  }

  public JsonWriter value(String value) {
    if (value == null) throw new NullPointerException("value == null");
    beforeValue();
    quoted(value);
    return this;
  }

  public JsonWriter value(boolean value) {
    beforeValue();
    buf.append(value);
    return this;
  }

  public JsonWriter value(long value) {
    beforeValue();
    buf.append(value);
    return this;
  }

  /** Writes the input as an unsigned 64-bit number. */
  public JsonWriter unsignedValue(long value) {
    beforeValue();
    buf.append(Long.toUnsignedString(value));
    return this;
  }

  public JsonWriter value(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("JSON forbids NaN and infinities: " + value);
    }
    beforeValue();
    buf.append(value);
    return this;
  }

  void quoted(String value) {
    buf.append('"');
    jsonEscape(value, buf);
    buf.append('"');
  }

  void beforeValue() {
    if (afterName) {
      afterName = false;
      return;
    }
    if (depth == 0) return;
    if (hasElement[depth - 1]) buf.append(',');
    hasElement[depth - 1] = true;
  }

  void push() {
    if (depth == hasElement.length) hasElement = Arrays.copyOf(hasElement, depth * 2);
    hasElement[depth++] = false;
  }

  void pop() {
    if (depth == 0 || afterName) throw new IllegalStateException("nothing to close");
    depth--;
  }

  @Override public String toString() {
    return buf.toString();
  }
}
