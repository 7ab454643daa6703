// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// Reads payload bytes from an [InputStream]. In dedup mode strings are table indices resolved against a
/// [DedupContext] that was fully read before the payload. The stream is never closed here.
public final class BinDeserializerBase implements BinDeserializer {
  private final InputStream in;
  private final Mode mode;
  private final DedupContext dedup;
  private final boolean dedupEnabled;

  public BinDeserializerBase(InputStream in, DedupContext dedup, Mode mode) {
    this(Objects.requireNonNull(in), Objects.requireNonNull(mode), Objects.requireNonNull(dedup), true);
  }

  private BinDeserializerBase(InputStream in, Mode mode, DedupContext dedup, boolean dedupEnabled) {
    this.in = in;
    this.mode = mode;
    this.dedup = dedup;
    this.dedupEnabled = dedupEnabled;
  }

  @Override
  public Mode mode() {
    return mode;
  }

  @Override
  public BinDeserializer withoutDedup() {
    return dedupEnabled ? new BinDeserializerBase(in, mode, dedup, false) : this;
  }

  @Override
  public String readStr() {
    if (mode.useDedup() && dedupEnabled) {
      final long index = readUsize();
      LOGGER.finer(() -> "BinDeserializerBase resolving string index " + index);
      return dedup.lookup(index);
    }
    return Utf8.decode(readRaw(readLength()));
  }

  @Override
  public boolean readBool() {
    return get() != 0;
  }

  @Override
  public byte readByte() {
    return (byte) get();
  }

  @Override
  public short readShort() {
    if (mode.fixedSizeUseVarint()) {
      final long value = Varint.zigZagDecode(varint());
      if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
        throw BinserdeException.sizeOverflow("value " + value + " does not fit in a short");
      }
      return (short) value;
    }
    return (short) littleEndian(Short.BYTES);
  }

  @Override
  public short readUnsignedShort() {
    if (mode.fixedSizeUseVarint()) {
      final long value = varint();
      if ((value & ~0xFFFFL) != 0) {
        throw BinserdeException.sizeOverflow("value " + Long.toUnsignedString(value) + " does not fit in 16 bits");
      }
      return (short) value;
    }
    return (short) littleEndian(Short.BYTES);
  }

  @Override
  public int readInt() {
    if (mode.fixedSizeUseVarint()) {
      final long value = Varint.zigZagDecode(varint());
      if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
        throw BinserdeException.sizeOverflow("value " + value + " does not fit in an int");
      }
      return (int) value;
    }
    return (int) littleEndian(Integer.BYTES);
  }

  @Override
  public int readUnsignedInt() {
    if (mode.fixedSizeUseVarint()) {
      final long value = varint();
      if ((value & ~0xFFFF_FFFFL) != 0) {
        throw BinserdeException.sizeOverflow("value " + Long.toUnsignedString(value) + " does not fit in 32 bits");
      }
      return (int) value;
    }
    return (int) littleEndian(Integer.BYTES);
  }

  @Override
  public long readLong() {
    return mode.fixedSizeUseVarint() ? Varint.zigZagDecode(varint()) : littleEndian(Long.BYTES);
  }

  @Override
  public long readUnsignedLong() {
    return mode.fixedSizeUseVarint() ? varint() : littleEndian(Long.BYTES);
  }

  @Override
  public float readFloat() {
    return Float.intBitsToFloat((int) littleEndian(Integer.BYTES));
  }

  @Override
  public double readDouble() {
    return Double.longBitsToDouble(littleEndian(Long.BYTES));
  }

  @Override
  public long readUsize() {
    return varint();
  }

  @Override
  public byte[] readRaw(int length) {
    try {
      return readFully(in, length);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  /// Reads exactly `length` bytes. The buffer grows with the data actually present, so a corrupt
  /// length fails at end of stream rather than allocating up front.
  static byte[] readFully(InputStream in, int length) throws IOException {
    final byte[] bytes = in.readNBytes(length);
    if (bytes.length != length) {
      throw new EOFException("expected " + length + " bytes but stream ended after " + bytes.length);
    }
    return bytes;
  }

  private long littleEndian(int width) {
    long value = 0;
    for (int i = 0; i < width; i++) {
      value |= (long) get() << (8 * i);
    }
    return value;
  }

  private long varint() {
    try {
      return Varint.read(in);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  private int get() {
    try {
      final int b = in.read();
      if (b < 0) {
        throw new EOFException("unexpected end of stream");
      }
      return b;
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }
}
