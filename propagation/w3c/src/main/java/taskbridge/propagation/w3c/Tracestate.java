/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

/**
 * Holds the {@code tracestate} value received alongside a {@code traceparent}, so that it can be
 * written back when this trace continues downstream.
 *
 * <p>The value is opaque: vendors own their entries and this process has none of its own.
 */
final class Tracestate {
  final String value;

  Tracestate(String value) {
    this.value = value;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Tracestate)) return false;
    return value.equals(((Tracestate) o).value);
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public String toString() {
    return "Tracestate{" + value + "}";
  }
}
