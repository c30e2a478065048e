/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldPolicyTest {
  Map<String, String> textMap = new LinkedHashMap<>();

  @Test void read_present() {
    textMap.put("x-b3-spanid", "0000000000000003");

    assertThat(FieldPolicy.REQUIRED.read(textMap, "x-b3-spanid")).isEqualTo("0000000000000003");
    assertThat(FieldPolicy.OPTIONAL.read(textMap, "x-b3-spanid")).isEqualTo("0000000000000003");
  }

  @Test void read_missingRequired() {
    assertThatThrownBy(() -> FieldPolicy.REQUIRED.read(textMap, "x-b3-spanid"))
      .isInstanceOf(MalformedCarrierException.class)
      .hasMessage("x-b3-spanid was missing");
  }

  @Test void read_missingOptional() {
    assertThat(FieldPolicy.OPTIONAL.read(textMap, "x-b3-parentspanid")).isNull();
  }

  @Test void invalid_required() {
    assertThatThrownBy(() -> FieldPolicy.REQUIRED.invalid("x-b3-spanid", "zz", "hex"))
      .isInstanceOf(MalformedCarrierException.class)
      .hasMessage("Invalid input: expected hex for x-b3-spanid, but found 'zz'");
  }

  @Test void invalid_optionalReturnsNormally() {
    FieldPolicy.OPTIONAL.invalid("x-b3-parentspanid", "zz", "hex");
  }
}
