// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// The read half of the capability contract, mirroring [BinSerializer] call for call.
public interface BinDeserializer {

  /// Initial capacity cap for containers so a corrupt count cannot force a huge allocation up front.
  int MAX_PREALLOCATION = 4096;

  Mode mode();

  /// Any non-zero byte reads as true.
  boolean readBool();

  byte readByte();

  short readShort();

  short readUnsignedShort();

  int readInt();

  int readUnsignedInt();

  long readLong();

  long readUnsignedLong();

  float readFloat();

  double readDouble();

  long readUsize();

  byte[] readRaw(int length);

  String readStr();

  BinDeserializer withoutDedup();

  default char readChar() {
    return (char) readUnsignedShort();
  }

  /// A count that must fit an `int`.
  default int readLength() {
    return DedupContext.toLength(readUsize());
  }

  default <T> Optional<T> readOption(BinDeserialize<? extends T> inner) {
    return readBool() ? Optional.of(inner.deserialize(this)) : Optional.empty();
  }

  /// Lazily decode `count` elements. Nothing is read until the iterator is advanced.
  default <T> DecodeIterator<T> iterate(int count, BinDeserialize<? extends T> element) {
    return new DecodeIterator<>(this, count, element);
  }

  default <T> List<T> readSeq(BinDeserialize<? extends T> element) {
    final int count = readLength();
    final List<T> result = new ArrayList<>(Math.min(count, MAX_PREALLOCATION));
    return readSeqInto(result, count, element);
  }

  /// Clears `target` and refills it, keeping its backing storage.
  default <T, C extends Collection<T>> C readSeqInto(C target, BinDeserialize<? extends T> element) {
    return readSeqInto(target, readLength(), element);
  }

  private <T, C extends Collection<T>> C readSeqInto(C target, int count, BinDeserialize<? extends T> element) {
    target.clear();
    iterate(count, element).forEachRemaining(target::add);
    return target;
  }

  default <K, V> Map<K, V> readMap(BinDeserialize<? extends K> key, BinDeserialize<? extends V> value) {
    final int count = readLength();
    final Map<K, V> result = new LinkedHashMap<>(Math.min(count, MAX_PREALLOCATION));
    return readMapInto(result, count, key, value);
  }

  /// Clears `target` and refills it.
  default <K, V, M extends Map<K, V>> M readMapInto(M target,
                                                    BinDeserialize<? extends K> key,
                                                    BinDeserialize<? extends V> value) {
    return readMapInto(target, readLength(), key, value);
  }

  private <K, V, M extends Map<K, V>> M readMapInto(M target, int count,
                                                    BinDeserialize<? extends K> key,
                                                    BinDeserialize<? extends V> value) {
    target.clear();
    final BinDeserialize<Map.Entry<K, V>> entry = d -> {
      final K k = key.deserialize(d);
      return new AbstractMap.SimpleImmutableEntry<>(k, value.deserialize(d));
    };
    iterate(count, entry).forEachRemaining(e -> target.put(e.getKey(), e.getValue()));
    return target;
  }

  default int readVariant() {
    return DedupContext.toLength(readUsize());
  }
}
