// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;

import static io.github.simbo1905.binserde.TestBytes.bytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VarintTest {

  static byte[] encode(long value) throws IOException {
    final var out = new ByteArrayOutputStream();
    Varint.write(out, value);
    return out.toByteArray();
  }

  static long decode(byte[] bytes) throws IOException {
    return Varint.read(new ByteArrayInputStream(bytes));
  }

  @Property
  void unsignedRoundTrip(@ForAll long value) throws IOException {
    final byte[] encoded = encode(value);
    assertThat(decode(encoded)).isEqualTo(value);
    final int bits = 64 - Long.numberOfLeadingZeros(value);
    assertThat(encoded).hasSize(bits == 0 ? 1 : (bits + 6) / 7);
    assertThat(Varint.sizeOf(value)).isEqualTo(encoded.length);
  }

  @Property
  void zigZagRoundTrip(@ForAll long value) {
    assertThat(Varint.zigZagDecode(Varint.zigZagEncode(value))).isEqualTo(value);
  }

  @Property
  void lastByteHasHighBitClear(@ForAll long value) throws IOException {
    final byte[] encoded = encode(value);
    for (int i = 0; i < encoded.length - 1; i++) {
      assertThat(encoded[i] & 0x80).isEqualTo(0x80);
    }
    assertThat(encoded[encoded.length - 1] & 0x80).isZero();
  }

  @Example
  void knownEncodings() throws IOException {
    assertThat(encode(0)).isEqualTo(bytes(0x00));
    assertThat(encode(127)).isEqualTo(bytes(0x7F));
    assertThat(encode(128)).isEqualTo(bytes(0x80, 0x01));
    assertThat(encode(300)).isEqualTo(bytes(0xAC, 0x02));
    assertThat(encode(-1L)).isEqualTo(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x01));
  }

  @Example
  void zigZagMapsSmallMagnitudesToSmallNumbers() {
    assertThat(Varint.zigZagEncode(0)).isEqualTo(0);
    assertThat(Varint.zigZagEncode(-1)).isEqualTo(1);
    assertThat(Varint.zigZagEncode(1)).isEqualTo(2);
    assertThat(Varint.zigZagEncode(-3)).isEqualTo(5);
    assertThat(Varint.zigZagEncode(-35)).isEqualTo(69);
    assertThat(Varint.zigZagEncode(Long.MIN_VALUE)).isEqualTo(-1L);
  }

  @Example
  void elevenGroupsOverflow() {
    final byte[] tooLong = bytes(0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x80, 0x81, 0x00);
    assertThatThrownBy(() -> decode(tooLong))
        .isInstanceOfSatisfying(BinserdeException.class,
            e -> assertThat(e.kind()).isEqualTo(BinserdeException.Kind.SIZE_OVERFLOW));
  }

  @Example
  void tenthGroupBeyondSixtyFourBitsOverflows() {
    final byte[] tooBig = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x02);
    assertThatThrownBy(() -> decode(tooBig))
        .isInstanceOfSatisfying(BinserdeException.class,
            e -> assertThat(e.kind()).isEqualTo(BinserdeException.Kind.SIZE_OVERFLOW));
  }

  @Example
  void truncatedInputIsEof() {
    assertThatThrownBy(() -> decode(bytes(0x80, 0x80))).isInstanceOf(EOFException.class);
  }
}
