// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// A sealed interface as a sum type: the discriminant is the zero-based position of the value's class in
/// the `permits` clause, followed by that variant's own encoding.
final class SealedSerde<T> implements Serde<T> {
  final Class<T> sealedType;
  final Class<?>[] permitted;
  final Serde<Object>[] variants;

  SealedSerde(Class<T> sealedType, Serde<?>[] variants) {
    assert sealedType.isSealed() : "User type must be sealed: " + sealedType;
    this.sealedType = Objects.requireNonNull(sealedType);
    this.permitted = sealedType.getPermittedSubclasses();
    if (variants.length != permitted.length) {
      throw new IllegalArgumentException("Expected " + permitted.length + " variant serdes for " + sealedType +
          " but got " + variants.length);
    }
    @SuppressWarnings("unchecked") final var raw = (Serde<Object>[]) variants.clone();
    this.variants = raw;
    LOGGER.fine(() -> "SealedSerde " + sealedType.getName() + " variants: " +
        Arrays.stream(permitted).map(Class::getSimpleName).collect(Collectors.joining(", ")));
  }

  @Override
  public void serialize(T value, BinSerializer serializer) {
    Objects.requireNonNull(value);
    final int discriminant = discriminantOf(value);
    serializer.writeVariant(discriminant);
    variants[discriminant].serialize(value, serializer);
  }

  @Override
  public T deserialize(BinDeserializer deserializer) {
    return cast(variants[readDiscriminant(deserializer)].deserialize(deserializer));
  }

  /// Reuses the target only when the wire carries the same variant.
  @Override
  public T deserializeInPlace(T target, BinDeserializer deserializer) {
    final int discriminant = readDiscriminant(deserializer);
    if (permitted[discriminant].isInstance(target)) {
      return cast(variants[discriminant].deserializeInPlace(target, deserializer));
    }
    return cast(variants[discriminant].deserialize(deserializer));
  }

  int discriminantOf(Object value) {
    for (int i = 0; i < permitted.length; i++) {
      if (permitted[i].isInstance(value)) {
        return i;
      }
    }
    throw new IllegalArgumentException("Expected a permitted subclass of " + sealedType + " but got " +
        value.getClass());
  }

  private int readDiscriminant(BinDeserializer deserializer) {
    final int discriminant = deserializer.readVariant();
    if (discriminant >= permitted.length) {
      throw BinserdeException.custom("Invalid discriminant " + discriminant + " for " +
          sealedType.getSimpleName() + " with " + permitted.length + " variants");
    }
    return discriminant;
  }

  private T cast(Object value) {
    return sealedType.cast(value);
  }

  @Override
  public String toString() {
    return "SealedSerde{sealedType=" + sealedType + "}";
  }
}
