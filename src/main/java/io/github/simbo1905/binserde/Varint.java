// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/// Variable length unsigned integers: seven bits per byte, least significant group first, with the high
/// bit set on every byte but the last. Signed values go through [#zigZagEncode(long)] first so that small
/// negative numbers stay short.
final class Varint {

  /// A 64 bit value never needs more than ten groups.
  static final int MAX_BYTES = 10;

  private Varint() {
  }

  /// Write `value` treated as unsigned.
  static void write(OutputStream out, long value) throws IOException {
    while ((value & ~0x7FL) != 0) {
      out.write((int) ((value & 0x7F) | 0x80));
      value >>>= 7;
    }
    out.write((int) value);
  }

  /// Read an unsigned value.
  /// @throws BinserdeException of kind SIZE_OVERFLOW if the groups do not fit in 64 bits
  static long read(InputStream in) throws IOException {
    long result = 0;
    for (int i = 0; i < MAX_BYTES; i++) {
      final int b = in.read();
      if (b < 0) {
        throw new EOFException("stream ended inside a varint");
      }
      // the tenth group only has room for the top bit
      if (i == MAX_BYTES - 1 && (b & 0x7F) > 1) {
        throw BinserdeException.sizeOverflow("varint exceeds 64 bits");
      }
      result |= (long) (b & 0x7F) << (7 * i);
      if ((b & 0x80) == 0) {
        return result;
      }
    }
    throw BinserdeException.sizeOverflow("varint longer than " + MAX_BYTES + " bytes");
  }

  static long zigZagEncode(long n) {
    return (n << 1) ^ (n >> 63);
  }

  static long zigZagDecode(long n) {
    return (n >>> 1) ^ -(n & 1);
  }

  /// Number of bytes [#write(OutputStream, long)] emits for `value`.
  static int sizeOf(long value) {
    final int bits = 64 - Long.numberOfLeadingZeros(value);
    return bits == 0 ? 1 : (bits + 6) / 7;
  }
}
