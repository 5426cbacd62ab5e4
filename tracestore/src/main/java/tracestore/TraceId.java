/*
 * Copyright The tracestore Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore;

import java.io.Serializable;

import static zipkin2.internal.HexCodec.lowerHexToUnsignedLong;

/**
 * A 128-bit trace identifier, stored as two unsigned halves. A {@link #high()} of zero means the
 * trace identifier is 64-bit.
 */
//@Immutable
public final class TraceId implements Comparable<TraceId>, Serializable {
  private static final long serialVersionUID = 0L;
  static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

  public static TraceId create(long high, long low) {
    if (high == 0L && low == 0L) throw new IllegalArgumentException("empty trace ID");
    return new TraceId(high, low);
  }

  /**
   * Parses a 1 to 32 character lower-hex trace ID. Inputs shorter than 16 or between 17 and 31
   * characters are left-padded with zeros.
   */
  public static TraceId fromHex(String hexTraceId) {
    // make sure we have a 16 or 32 character trace ID
    hexTraceId = zipkin2.Span.normalizeTraceId(hexTraceId);
    long high = hexTraceId.length() == 32 ? lowerHexToUnsignedLong(hexTraceId, 0) : 0L;
    long low = lowerHexToUnsignedLong(hexTraceId);
    return create(high, low);
  }

  /** Upper 64 bits of the trace ID, or zero if the trace ID is 64-bit. */
  public long high() {
    return high;
  }

  /** Lower 64 bits of the trace ID. */
  public long low() {
    return low;
  }

  /** Returns 16 or 32 lower-hex characters, depending on whether {@link #high()} is set. */
  public String toHex() {
    char[] data = new char[high != 0L ? 32 : 16];
    int pos = 0;
    if (high != 0L) {
      writeHexLong(data, pos, high);
      pos += 16;
    }
    writeHexLong(data, pos, low);
    return new String(data);
  }

  static void writeHexLong(char[] data, int pos, long v) {
    for (int shift = 60; shift >= 0; shift -= 4) {
      data[pos++] = HEX_DIGITS[(int) ((v >>> shift) & 0xf)];
    }
  }

  final long high, low;

  TraceId(long high, long low) {
    this.high = high;
    this.low = low;
  }

  @Override public int compareTo(TraceId that) {
    int result = Long.compareUnsigned(high, that.high);
    return result != 0 ? result : Long.compareUnsigned(low, that.low);
  }

  @Override public String toString() {
    return toHex();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceId)) return false;
    TraceId that = (TraceId) o;
    return high == that.high && low == that.low;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= (int) ((high >>> 32) ^ high);
    h *= 1000003;
    h ^= (int) ((low >>> 32) ^ low);
    return h;
  }
}
