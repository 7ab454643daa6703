// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// Writes the payload bytes to an [OutputStream].
///
/// In dedup mode this serializer keeps its own [DedupContext] and interns strings as it meets them.
/// Because the traversal is the same one the [PrescanSerializer] ran over the same value, the indices
/// it assigns are the ones already written to the table. No context is shared between the two passes.
///
/// The stream is never closed or flushed here; it belongs to the caller.
public final class BinSerializerBase implements BinSerializer {
  private final OutputStream out;
  private final Mode mode;
  private final DedupContext dedup;
  private final boolean dedupEnabled;

  public BinSerializerBase(OutputStream out, Mode mode) {
    this(Objects.requireNonNull(out), Objects.requireNonNull(mode), new DedupContext(), true);
  }

  private BinSerializerBase(OutputStream out, Mode mode, DedupContext dedup, boolean dedupEnabled) {
    this.out = out;
    this.mode = mode;
    this.dedup = dedup;
    this.dedupEnabled = dedupEnabled;
  }

  @Override
  public Mode mode() {
    return mode;
  }

  @Override
  public BinSerializer withoutDedup() {
    return dedupEnabled ? new BinSerializerBase(out, mode, dedup, false) : this;
  }

  @Override
  public void writeStr(String value) {
    Objects.requireNonNull(value, "string must not be null");
    if (mode.useDedup() && dedupEnabled) {
      final int index = dedup.intern(value);
      LOGGER.finer(() -> "BinSerializerBase writing string index " + index);
      writeUsize(index);
    } else {
      final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
      writeUsize(bytes.length);
      writeRaw(bytes);
    }
  }

  @Override
  public void writeBool(boolean value) {
    put(value ? 0xFF : 0x00);
  }

  @Override
  public void writeByte(byte value) {
    put(value);
  }

  @Override
  public void writeShort(short value) {
    if (mode.fixedSizeUseVarint()) {
      varint(Varint.zigZagEncode(value));
    } else {
      littleEndian(value, Short.BYTES);
    }
  }

  @Override
  public void writeUnsignedShort(short value) {
    if (mode.fixedSizeUseVarint()) {
      varint(Short.toUnsignedLong(value));
    } else {
      littleEndian(value, Short.BYTES);
    }
  }

  @Override
  public void writeInt(int value) {
    if (mode.fixedSizeUseVarint()) {
      varint(Varint.zigZagEncode(value));
    } else {
      littleEndian(value, Integer.BYTES);
    }
  }

  @Override
  public void writeUnsignedInt(int value) {
    if (mode.fixedSizeUseVarint()) {
      varint(Integer.toUnsignedLong(value));
    } else {
      littleEndian(value, Integer.BYTES);
    }
  }

  @Override
  public void writeLong(long value) {
    if (mode.fixedSizeUseVarint()) {
      varint(Varint.zigZagEncode(value));
    } else {
      littleEndian(value, Long.BYTES);
    }
  }

  @Override
  public void writeUnsignedLong(long value) {
    if (mode.fixedSizeUseVarint()) {
      varint(value);
    } else {
      littleEndian(value, Long.BYTES);
    }
  }

  @Override
  public void writeFloat(float value) {
    littleEndian(Float.floatToRawIntBits(value), Integer.BYTES);
  }

  @Override
  public void writeDouble(double value) {
    littleEndian(Double.doubleToRawLongBits(value), Long.BYTES);
  }

  @Override
  public void writeUsize(long value) {
    varint(value);
  }

  @Override
  public void writeRaw(byte[] bytes) {
    try {
      out.write(bytes);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  private void littleEndian(long value, int width) {
    try {
      for (int i = 0; i < width; i++) {
        out.write((int) (value >>> (8 * i)));
      }
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  private void varint(long value) {
    try {
      Varint.write(out, value);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  private void put(int b) {
    try {
      out.write(b);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }
}
