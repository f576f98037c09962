/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.tracing;

import brave.internal.Nullable;
import brave.propagation.Propagation.Getter;
import brave.propagation.Propagation.Setter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts between task headers, whose values can be of any type, and the string-only carrier that
 * propagation formats read and write.
 */
public final class TaskHeaders {
  static final Setter<Map<String, String>, String> SETTER =
    new Setter<Map<String, String>, String>() {
      @Override public void put(Map<String, String> carrier, String key, String value) {
        carrier.put(key, value);
      }

      @Override public String toString() {
        return "Map::put";
      }
    };

  static final Getter<Map<String, String>, String> GETTER =
    new Getter<Map<String, String>, String>() {
      @Override public String get(Map<String, String> carrier, String key) {
        return carrier.get(key);
      }

      @Override public String toString() {
        return "Map::get";
      }
    };

  /**
   * Copies the string-valued entries of the headers into a new carrier. Other values are skipped:
   * headers can hold application data that was never a propagation field.
   */
  public static Map<String, String> toCarrier(@Nullable Map<String, ?> headers) {
    Map<String, String> carrier = new LinkedHashMap<>();
    if (headers == null) return carrier;
    for (Map.Entry<String, ?> entry : headers.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String) carrier.put(entry.getKey(), (String) value);
    }
    return carrier;
  }

  /**
   * Writes every carrier entry into the headers, replacing any value under the same key. Other
   * headers are left as they are.
   *
   * @param headers possibly {@code null}, in which case a new map is allocated
   * @return the headers written to, which the caller must keep in place of its input
   */
  public static Map<String, Object> fromCarrier(
    Map<String, String> carrier, @Nullable Map<String, Object> headers) {
    if (carrier == null) throw new NullPointerException("carrier == null");
    if (headers == null) headers = new LinkedHashMap<>();
    headers.putAll(carrier);
    return headers;
  }

  TaskHeaders() {
  }
}
