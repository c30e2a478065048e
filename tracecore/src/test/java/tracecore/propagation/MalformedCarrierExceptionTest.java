/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MalformedCarrierExceptionTest {

  @Test void missing() {
    MalformedCarrierException e = MalformedCarrierException.missing("x-b3-spanid");

    assertThat(e).isInstanceOf(IllegalArgumentException.class)
      .hasMessage("x-b3-spanid was missing");
    assertThat(e.field()).isEqualTo("x-b3-spanid");
  }

  @Test void malformed() {
    MalformedCarrierException e =
      MalformedCarrierException.malformed("ot-tracer-spanid", "abc", "an unsigned decimal");

    assertThat(e)
      .hasMessage("Invalid input: expected an unsigned decimal for ot-tracer-spanid,"
        + " but found 'abc'");
    assertThat(e.field()).isEqualTo("ot-tracer-spanid");
  }
}
