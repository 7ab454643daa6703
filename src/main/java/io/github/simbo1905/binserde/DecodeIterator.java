// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/// Decodes a known number of elements one at a time.
///
/// Each [#next()] reads exactly one element from the underlying deserializer. The first failure is
/// rethrown to the caller and ends the iteration, so the rest of the stream is never touched. The
/// iterator cannot be restarted.
public final class DecodeIterator<T> implements Iterator<T> {
  private final BinDeserializer deserializer;
  private final BinDeserialize<? extends T> element;
  private int remaining;
  private boolean failed;

  DecodeIterator(BinDeserializer deserializer, int count, BinDeserialize<? extends T> element) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative: " + count);
    }
    this.deserializer = Objects.requireNonNull(deserializer);
    this.element = Objects.requireNonNull(element);
    this.remaining = count;
  }

  @Override
  public boolean hasNext() {
    return !failed && remaining > 0;
  }

  @Override
  public T next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    final T value;
    try {
      value = element.deserialize(deserializer);
    } catch (RuntimeException e) {
      failed = true;
      throw e;
    }
    remaining--;
    return value;
  }

  /// Elements not yet decoded.
  public int remaining() {
    return failed ? 0 : remaining;
  }

  /// Whether an element failed to decode.
  public boolean failed() {
    return failed;
  }
}
