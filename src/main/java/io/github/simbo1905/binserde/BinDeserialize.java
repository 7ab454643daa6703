// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

/// Reads a value of type `T` with the [BinDeserializer] calls mirroring its [BinSerialize].
@FunctionalInterface
public interface BinDeserialize<T> {
  T deserialize(BinDeserializer deserializer);

  /// Read into `target`, reusing its storage where the type allows it, and return the result.
  /// Types with nothing to reuse read a fresh value.
  default T deserializeInPlace(T target, BinDeserializer deserializer) {
    return deserialize(deserializer);
  }
}
