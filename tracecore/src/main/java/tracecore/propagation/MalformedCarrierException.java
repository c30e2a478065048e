/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

/**
 * Thrown when a context cannot be reconstructed from a carrier because a mandatory field is absent
 * or cannot be parsed. Optional fields never cause this exception.
 */
public final class MalformedCarrierException extends IllegalArgumentException {
  static final long serialVersionUID = 0L;

  public static MalformedCarrierException missing(String field) {
    return new MalformedCarrierException(field, field + " was missing");
  }

  public static MalformedCarrierException malformed(String field, String value, String expected) {
    return new MalformedCarrierException(field,
      "Invalid input: expected " + expected + " for " + field + ", but found '" + value + "'");
  }

  final String field;

  MalformedCarrierException(String field, String message) {
    super(message);
    this.field = field;
  }

  /** Name of the first mandatory field that could not be read. */
  public String field() {
    return field;
  }
}
