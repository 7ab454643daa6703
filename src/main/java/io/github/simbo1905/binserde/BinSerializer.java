// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The write half of the capability contract. [BinSerialize] implementations talk only to this interface,
/// which lets the same traversal run against [PrescanSerializer] (collect strings) and
/// [BinSerializerBase] (emit bytes).
///
/// Lengths, discriminants and table indices are always varints. Fixed-width integers are little-endian
/// unless the [Mode] asks for varints. Structural operations are default methods so that every
/// realization traverses containers identically.
public interface BinSerializer {

  Mode mode();

  /// `0xFF` for true, `0x00` for false.
  void writeBool(boolean value);

  void writeByte(byte value);

  void writeShort(short value);

  void writeUnsignedShort(short value);

  void writeInt(int value);

  void writeUnsignedInt(int value);

  void writeLong(long value);

  void writeUnsignedLong(long value);

  void writeFloat(float value);

  void writeDouble(double value);

  /// A length or count. Always a varint.
  void writeUsize(long value);

  /// Bytes with no length prefix.
  void writeRaw(byte[] bytes);

  /// A string, deduplicated when the mode says so and this serializer has not been
  /// [switched off][#withoutDedup()].
  void writeStr(String value);

  /// A view on this serializer that writes every string inline. Backs `@NoDedup` fields.
  BinSerializer withoutDedup();

  default void writeChar(char value) {
    writeUnsignedShort((short) value);
  }

  /// Presence flag as a bool, then the value if present.
  default <T> void writeOption(Optional<T> value, BinSerialize<? super T> inner) {
    Objects.requireNonNull(value, "optional must not be null");
    writeBool(value.isPresent());
    if (value.isPresent()) {
      inner.serialize(value.get(), this);
    }
  }

  /// Element count then each element in iteration order.
  default <T> void writeSeq(Collection<? extends T> items, BinSerialize<? super T> element) {
    writeUsize(items.size());
    for (T item : items) {
      element.serialize(Objects.requireNonNull(item, "null element"), this);
    }
  }

  /// Entry count then key and value of each entry in iteration order.
  default <K, V> void writeMap(Map<? extends K, ? extends V> map,
                               BinSerialize<? super K> key,
                               BinSerialize<? super V> value) {
    writeUsize(map.size());
    for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
      key.serialize(Objects.requireNonNull(entry.getKey(), "null key"), this);
      value.serialize(Objects.requireNonNull(entry.getValue(), "null value"), this);
    }
  }

  /// Zero-based position of the variant in its declaration.
  default void writeVariant(int discriminant) {
    if (discriminant < 0) {
      throw new IllegalArgumentException("Negative discriminant " + discriminant);
    }
    writeUsize(discriminant);
  }
}
