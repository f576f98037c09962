/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package taskbridge.propagation.w3c;

import brave.internal.Nullable;
import brave.propagation.TraceContext;

import static taskbridge.propagation.w3c.TraceContextPropagation.log;

/** Implements https://www.w3.org/TR/trace-context-1/#traceparent-header */
final class TraceparentFormat {
  /** Version '00' is fixed length, though future versions may append fields. */
  static final int FORMAT_LENGTH = 3 + 32 + 1 + 16 + 3; // 00-traceid128-spanid-01

  static final int // offsets of each field
    VERSION = 0,
    TRACE_ID_HIGH = 3,
    TRACE_ID = 19,
    PARENT_ID = 36,
    TRACE_FLAGS = 53;

  static final char[] HEX_DIGITS =
    {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b', 'c', 'd', 'e', 'f'};

  /** Writes the trace ID, span ID and sampled flag of the context as version 00. */
  static String writeTraceparentFormat(TraceContext context) {
    char[] result = new char[FORMAT_LENGTH];
    result[0] = '0';
    result[1] = '0';
    result[2] = '-';
    writeHexLong(result, TRACE_ID_HIGH, context.traceIdHigh());
    writeHexLong(result, TRACE_ID, context.traceId());
    result[PARENT_ID - 1] = '-';
    writeHexLong(result, PARENT_ID, context.spanId());
    result[TRACE_FLAGS - 1] = '-';
    result[TRACE_FLAGS] = '0';
    // Only the sampled flag is defined. Unsampled and undecided both write 00.
    result[TRACE_FLAGS + 1] = Boolean.TRUE.equals(context.sampled()) ? '1' : '0';
    return new String(result);
  }

  /** Returns {@code null} and logs when the input is not a valid {@code traceparent}. */
  @Nullable static TraceContext parseTraceparentFormat(String traceparent) {
    String value = traceparent.trim();
    int length = value.length();
    if (length < FORMAT_LENGTH) {
      log("Invalid input: traceparent is too short {0}", value);
      return null;
    }

    if (value.charAt(TRACE_ID_HIGH - 1) != '-'
      || value.charAt(PARENT_ID - 1) != '-'
      || value.charAt(TRACE_FLAGS - 1) != '-') {
      log("Invalid input: traceparent fields must be hyphen delimited {0}", value);
      return null;
    }

    if (!isLowerHex(value, VERSION, 2)
      || !isLowerHex(value, TRACE_ID_HIGH, 32)
      || !isLowerHex(value, PARENT_ID, 16)
      || !isLowerHex(value, TRACE_FLAGS, 2)) {
      log("Invalid input: only valid characters are lower-hex {0}", value);
      return null;
    }

    int version = (int) lowerHexToLong(value, VERSION, 2);
    // 8-bit unsigned 255 is disallowed https://www.w3.org/TR/trace-context-1/#version
    if (version == 0xff) {
      log("Invalid input: version ff {0}", value);
      return null;
    }

    if (version == 0 && length > FORMAT_LENGTH) {
      log("Invalid input: traceparent version 00 is too long {0}", value);
      return null;
    } else if (length > FORMAT_LENGTH && value.charAt(FORMAT_LENGTH) != '-') {
      // Later versions may only add hyphen delimited fields
      log("Invalid input: traceparent has trailing data {0}", value);
      return null;
    }

    long traceIdHigh = lowerHexToLong(value, TRACE_ID_HIGH, 16);
    long traceId = lowerHexToLong(value, TRACE_ID, 16);
    if (traceIdHigh == 0L && traceId == 0L) {
      log("Invalid input: trace ID is all zeros {0}", value);
      return null;
    }

    long spanId = lowerHexToLong(value, PARENT_ID, 16);
    if (spanId == 0L) {
      log("Invalid input: parent ID is all zeros {0}", value);
      return null;
    }

    int flags = (int) lowerHexToLong(value, TRACE_FLAGS, 2);
    // Only one flag is defined at version 0: sampled. Later versions ignore unknown flags.
    if (version == 0 && (flags & ~1) != 0) {
      log("Invalid input: only choices for trace flags are 00 or 01 {0}", value);
      return null;
    }

    return TraceContext.newBuilder()
      .traceIdHigh(traceIdHigh)
      .traceId(traceId)
      .spanId(spanId)
      .sampled((flags & 1) == 1)
      .build();
  }

  static boolean isLowerHex(CharSequence value, int beginIndex, int length) {
    for (int i = beginIndex, endIndex = beginIndex + length; i < endIndex; i++) {
      char c = value.charAt(i);
      if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) return false;
    }
    return true;
  }

  /** Decodes up to 16 characters already validated with {@link #isLowerHex}. */
  static long lowerHexToLong(CharSequence value, int beginIndex, int length) {
    long result = 0L;
    for (int i = beginIndex, endIndex = beginIndex + length; i < endIndex; i++) {
      char c = value.charAt(i);
      result <<= 4;
      result |= c <= '9' ? c - '0' : c - 'a' + 10;
    }
    return result;
  }

  static void writeHexLong(char[] data, int pos, long v) {
    for (int shift = 60, i = pos; shift >= 0; shift -= 4, i++) {
      data[i] = HEX_DIGITS[(int) ((v >>> shift) & 0xf)];
    }
  }

  TraceparentFormat() {
  }
}
