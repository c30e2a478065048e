/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.internal.codec;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonWriterTest {

  @Test void write_nestedStructures() {
    JsonWriter.Writer<List<String>> writer = (value, out) -> {
      out.beginObject();
      out.name("names").beginArray();
      for (String name : value) out.value(name);
      out.endArray();
      out.name("empty").beginObject().endObject();
      out.name("count").value(value.size());
      out.name("ok").value(true);
      out.endObject();
    };

    assertThat(JsonWriter.write(writer, Arrays.asList("a", "b")))
      .isEqualTo("{\"names\":[\"a\",\"b\"],\"empty\":{},\"count\":2,\"ok\":true}");
  }

  @Test void unsignedValue_writesHighBitNumbersAsPositive() {
    assertThat(JsonWriter.write((value, out) -> out.unsignedValue(value), -1L))
      .isEqualTo("18446744073709551615");
  }

  @Test void value_double() {
    assertThat(JsonWriter.write((value, out) -> out.value(value.doubleValue()), 0.25))
      .isEqualTo("0.25");
  }

  @Test void value_double_rejectsNaN() {
    assertThatThrownBy(() -> new JsonWriter().value(Double.NaN))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void value_escapesStrings() {
    assertThat(JsonWriter.write((value, out) -> out.value(value), "\"a\\b\"\n\u0001\u2028"))
      .isEqualTo("\"\\\"a\\\\b\\\"\\n\\u0001\\u2028\"");
  }

  @Test void value_passesThroughNonAscii() {
    assertThat(JsonWriter.write((value, out) -> out.value(value), "\u00e9t\u00e9"))
      .isEqualTo("\"\u00e9t\u00e9\"");
  }

  @Test void write_failsOnUnclosedDocument() {
    class BuggyWriter implements JsonWriter.Writer<Object> {
      @Override public void write(Object value, JsonWriter out) {
        out.beginObject().name("a").value("b");
      }
    }

    assertThatThrownBy(() -> JsonWriter.write(new BuggyWriter(), "foo"))
      .isInstanceOf(IllegalStateException.class)
      .hasMessage("Bug found using BuggyWriter: unclosed {\"a\":\"b\"");
  }

  @Test void name_outsideObject() {
    assertThatThrownBy(() -> new JsonWriter().name("a"))
      .isInstanceOf(IllegalStateException.class);
  }

  @Test void endObject_withoutBegin() {
    assertThatThrownBy(() -> new JsonWriter().endObject())
      .isInstanceOf(IllegalStateException.class);
  }

  @Test void deepNesting_growsStack() {
    JsonWriter out = new JsonWriter();
    for (int i = 0; i < 20; i++) out.beginArray();
    for (int i = 0; i < 20; i++) out.endArray();
    assertThat(out.toString()).isEqualTo("[[[[[[[[[[[[[[[[[[[[]]]]]]]]]]]]]]]]]]]]");
  }
}
