/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.propagation;

import java.util.Map;
import tracecore.internal.Nullable;
import tracecore.internal.Platform;

/**
 * How extraction treats a reserved field that is absent or cannot be parsed. Unparsable values
 * and missing required fields are logged at FINE.
 */
public enum FieldPolicy {
  /** Extraction fails with {@link MalformedCarrierException}. */
  REQUIRED {
    @Override void onMissing(String key) {
      Platform.get().log("{0} was missing", key, null);
      throw MalformedCarrierException.missing(key);
    }

    @Override void onInvalid(MalformedCarrierException e) {
      throw e;
    }
  },
  /** The field takes its default value and extraction continues. */
  OPTIONAL {
    @Override void onMissing(String key) { // default applies
    }

    @Override void onInvalid(MalformedCarrierException e) { // default applies
    }
  };

  /**
   * Returns the value of the key, or null when it is absent and this policy allows that.
   *
   * @throws MalformedCarrierException if the key is absent and {@link #REQUIRED}
   */
  @Nullable public String read(Map<String, String> textMap, String key) {
    if (textMap == null) throw new NullPointerException("textMap == null");
    if (key == null) throw new NullPointerException("key == null");
    String value = textMap.get(key);
    if (value != null) return value;
    onMissing(key);
    return null;
  }

  /**
   * Call when a present value cannot be parsed. Returns normally when the caller should use the
   * field's default.
   *
   * @throws MalformedCarrierException if {@link #REQUIRED}
   */
  public void invalid(String key, String value, String expected) {
    MalformedCarrierException e = MalformedCarrierException.malformed(key, value, expected);
    Platform.get().log(e.getMessage(), null);
    onInvalid(e);
  }

  abstract void onMissing(String key);

  abstract void onInvalid(MalformedCarrierException e);
}
