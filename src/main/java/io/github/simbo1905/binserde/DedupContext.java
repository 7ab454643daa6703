// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// The string table of a deduplicated buffer.
///
/// On the write side strings are [interned][#intern(String)] in traversal order and each distinct
/// string gets the next index, starting at zero. The table is then written ahead of the payload as
/// `varint(count)` followed by `varint(utf8 length) utf8 bytes` per entry in index order.
///
/// On the read side [#readFrom(InputStream)] rebuilds the table before any payload byte is read and
/// [#lookup(long)] resolves indices. A context belongs to one call and is not thread safe.
public final class DedupContext {
  private final List<String> strings;
  private final Map<String, Integer> indices;

  public DedupContext() {
    this(new ArrayList<>());
  }

  private DedupContext(List<String> strings) {
    this.strings = strings;
    this.indices = new HashMap<>();
  }

  /// Returns the index of `value`, assigning the next free one the first time it is seen.
  public int intern(String value) {
    final Integer existing = indices.get(value);
    if (existing != null) {
      return existing;
    }
    final int index = strings.size();
    strings.add(value);
    indices.put(value, index);
    LOGGER.finer(() -> "DedupContext interned #" + index + " (" + value.length() + " chars)");
    return index;
  }

  /// Resolves an index read from the payload.
  /// @throws BinserdeException of kind STR_OUT_OF_RANGE if the table has no such entry
  public String lookup(long index) {
    if (index < 0 || index >= strings.size()) {
      throw BinserdeException.strOutOfRange(index, strings.size());
    }
    return strings.get((int) index);
  }

  public int size() {
    return strings.size();
  }

  /// Write the table in index order.
  public void writeTo(OutputStream out) {
    try {
      Varint.write(out, strings.size());
      for (String s : strings) {
        final byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        Varint.write(out, bytes.length);
        out.write(bytes);
      }
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
    LOGGER.fine(() -> "DedupContext wrote table of " + strings.size() + " strings");
  }

  /// Read a table written by [#writeTo(OutputStream)].
  public static DedupContext readFrom(InputStream in) {
    try {
      final int count = toLength(Varint.read(in));
      final var strings = new ArrayList<String>(Math.min(count, 1024));
      for (int i = 0; i < count; i++) {
        strings.add(Utf8.decode(BinDeserializerBase.readFully(in, toLength(Varint.read(in)))));
      }
      LOGGER.fine(() -> "DedupContext read table of " + count + " strings");
      return new DedupContext(strings);
    } catch (IOException e) {
      throw BinserdeException.io(e);
    }
  }

  static int toLength(long value) {
    if (value < 0 || value > Integer.MAX_VALUE) {
      throw BinserdeException.sizeOverflow("length " + Long.toUnsignedString(value) + " does not fit in an int");
    }
    return (int) value;
  }

  @Override
  public String toString() {
    return "DedupContext{size=" + strings.size() + "}";
  }
}
