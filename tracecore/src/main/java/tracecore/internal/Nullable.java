/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracecore.internal;

import java.lang.annotation.RetentionPolicy;

/**
 * Marks a field, parameter or return value that can be null. This avoids a dependency on one of
 * the many jsr305 jars.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(RetentionPolicy.SOURCE)
public @interface Nullable {
}
