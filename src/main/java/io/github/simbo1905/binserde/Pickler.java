// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import org.jetbrains.annotations.NotNull;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Main interface of the binserde library: encode and decode one root type in the compact binary format.
///
/// ```java
/// record MyData(String v1, Optional<Long> v2) {}
///
/// final var pickler = Pickler.forClass(MyData.class);
/// final byte[] bytes = pickler.serialize(new MyData("Some Text", Optional.of(12415165L)), Mode.dedup());
/// final MyData copy = pickler.deserialize(bytes, Mode.dedup());
/// ```
///
/// A buffer must be read with the [Mode] it was written with. The format carries no type information and
/// no version; records are written component by component in declaration order.
public interface Pickler<T> {

  Logger LOGGER = Logger.getLogger(Pickler.class.getName());

  /// The serde that drives every call.
  Serde<T> serde();

  /// Derive a pickler for a record, enum or sealed interface and everything reachable from it.
  /// @param clazz The root class
  /// @return A pickler instance
  static <T> Pickler<T> forClass(Class<T> clazz) {
    return forClass(clazz, Map.of());
  }

  /// Derive a pickler, using `customSerdes` for the listed classes wherever they appear.
  /// @param clazz The root class (record, enum, or sealed interface)
  /// @param customSerdes Serdes for value types the library does not know, such as `UUID`
  /// @return A pickler instance
  static <T> Pickler<T> forClass(@NotNull Class<T> clazz, @NotNull Map<Class<?>, Serde<?>> customSerdes) {
    Objects.requireNonNull(clazz, "Class must not be null");
    Objects.requireNonNull(customSerdes, "Custom serdes map must not be null");
    if (!clazz.isRecord() && !clazz.isEnum() && !clazz.isSealed()) {
      throw new IllegalArgumentException("Class must be a record, enum, or sealed interface: " + clazz);
    }
    customSerdes.forEach((k, v) -> {
      Objects.requireNonNull(k, "Custom serdes map must not contain null keys");
      Objects.requireNonNull(v, "Custom serde for " + k + " must not be null");
    });
    @SuppressWarnings("unchecked") final var serde = (Serde<T>) new SerdeResolver(customSerdes).resolve(clazz);
    LOGGER.info(() -> "Created pickler for " + clazz.getName() + " using " + serde);
    return new PicklerImpl<>(clazz, serde);
  }

  /// Wrap a hand written serde.
  static <T> Pickler<T> of(@NotNull Class<T> clazz, @NotNull Serde<T> serde) {
    return new PicklerImpl<>(Objects.requireNonNull(clazz), Objects.requireNonNull(serde));
  }

  default byte[] serialize(T value) {
    return BinSerde.serialize(value, serde());
  }

  default byte[] serialize(T value, Mode mode) {
    return BinSerde.serialize(value, serde(), mode);
  }

  default void serialize(OutputStream out, T value) {
    BinSerde.serializeInto(out, value, serde());
  }

  default void serialize(OutputStream out, T value, Mode mode) {
    BinSerde.serializeInto(out, value, serde(), mode);
  }

  default T deserialize(byte[] bytes) {
    return BinSerde.deserialize(bytes, serde());
  }

  default T deserialize(byte[] bytes, Mode mode) {
    return BinSerde.deserialize(bytes, serde(), mode);
  }

  default T deserialize(InputStream in) {
    return BinSerde.deserializeFrom(in, serde());
  }

  default T deserialize(InputStream in, Mode mode) {
    return BinSerde.deserializeFrom(in, serde(), mode);
  }

  /// Decode into `target`, reusing the containers it holds. Returns the decoded value.
  default T deserializeInPlace(T target, InputStream in) {
    return BinSerde.deserializeInPlace(target, in, serde());
  }

  default T deserializeInPlace(T target, InputStream in, Mode mode) {
    return BinSerde.deserializeInPlace(target, in, serde(), mode);
  }

  /// Exact encoded size of `value`, including the string table in dedup mode.
  default long sizeOf(T value, Mode mode) {
    return BinSerde.serializedSize(value, serde(), mode);
  }

  default long sizeOf(T value) {
    return sizeOf(value, Mode.defaults());
  }
}
