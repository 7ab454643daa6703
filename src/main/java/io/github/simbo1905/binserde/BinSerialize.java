// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

/// Writes a value of type `T` as a fixed, deterministic sequence of [BinSerializer] calls.
///
/// The same implementation drives both the dedup prescan and the real write, so it must visit the same
/// fields and elements in the same order, and make the same `withoutDedup()` choices, every time it is
/// called on the same value. Breaking that makes deduplicated strings decode to the wrong text.
@FunctionalInterface
public interface BinSerialize<T> {
  void serialize(T value, BinSerializer serializer);
}
