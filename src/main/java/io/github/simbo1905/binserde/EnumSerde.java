// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// Enum constants written as their zero-based declaration position.
final class EnumSerde<E extends Enum<E>> implements Serde<E> {
  final Class<E> enumType;
  final E[] enumConstants;

  EnumSerde(@NotNull Class<E> enumType) {
    assert enumType.isEnum() : "User type must be an enum: " + enumType;
    this.enumType = Objects.requireNonNull(enumType);
    this.enumConstants = enumType.getEnumConstants();
    LOGGER.fine(() -> "EnumSerde " + enumType.getName() + " with " + enumConstants.length + " constants");
  }

  @Override
  public void serialize(E value, BinSerializer serializer) {
    Objects.requireNonNull(value);
    serializer.writeVariant(value.ordinal());
  }

  @Override
  public E deserialize(BinDeserializer deserializer) {
    final int ordinal = deserializer.readVariant();
    if (ordinal >= enumConstants.length) {
      throw BinserdeException.custom("Invalid discriminant " + ordinal + " for " + enumType.getSimpleName() +
          " with " + enumConstants.length + " constants");
    }
    return enumConstants[ordinal];
  }

  @Override
  public String toString() {
    return "EnumSerde{enumType=" + enumType + "}";
  }
}
