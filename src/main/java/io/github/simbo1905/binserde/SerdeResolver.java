// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// Recursive descent over Java types that builds the serde for each one. This is where the field-by-field
/// traversal of a user type is derived: records become [RecordSerde], enums [EnumSerde] and sealed
/// interfaces [SealedSerde]. Types that refer back to themselves resolve through a [Deferred] placeholder.
final class SerdeResolver {
  private final Map<Class<?>, Serde<?>> custom;
  private final Map<Type, Serde<?>> resolved = new HashMap<>();

  SerdeResolver(Map<Class<?>, Serde<?>> custom) {
    this.custom = Map.copyOf(custom);
  }

  Serde<?> resolve(Type type) {
    final Serde<?> cached = resolved.get(type);
    if (cached != null) {
      return cached;
    }
    LOGGER.finer(() -> "Resolving serde for type: " + type.getTypeName());
    final Serde<?> serde;
    if (type instanceof Class<?> clazz) {
      serde = resolveClass(clazz);
    } else if (type instanceof ParameterizedType parameterized) {
      serde = resolveParameterized(parameterized);
    } else if (type instanceof GenericArrayType genericArray) {
      final Class<?> component = rawClass(genericArray.getGenericComponentType());
      serde = Serdes.array(Array.newInstance(component, 0).getClass(), resolve(genericArray.getGenericComponentType()));
    } else {
      throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
    }
    resolved.put(type, serde);
    return serde;
  }

  private Serde<?> resolveClass(Class<?> clazz) {
    final Serde<?> customSerde = custom.get(clazz);
    if (customSerde != null) {
      return customSerde;
    }
    if (clazz == boolean.class || clazz == Boolean.class) {
      return Serdes.bool();
    } else if (clazz == byte.class || clazz == Byte.class) {
      return Serdes.i8();
    } else if (clazz == short.class || clazz == Short.class) {
      return Serdes.i16();
    } else if (clazz == char.class || clazz == Character.class) {
      return Serdes.character();
    } else if (clazz == int.class || clazz == Integer.class) {
      return Serdes.i32();
    } else if (clazz == long.class || clazz == Long.class) {
      return Serdes.i64();
    } else if (clazz == float.class || clazz == Float.class) {
      return Serdes.f32();
    } else if (clazz == double.class || clazz == Double.class) {
      return Serdes.f64();
    } else if (clazz == String.class) {
      return Serdes.string();
    } else if (clazz == byte[].class) {
      return Serdes.bytes();
    } else if (clazz.isArray()) {
      return Serdes.array(clazz, resolve(clazz.getComponentType()));
    } else if (clazz.isEnum()) {
      return enumSerde(clazz);
    } else if (clazz.isRecord()) {
      return recordSerde(clazz);
    } else if (clazz.isSealed()) {
      return sealedSerde(clazz);
    }
    throw new IllegalArgumentException("Unsupported type: " + clazz.getName() +
        ". Register a custom serde for it or use a record, enum or sealed interface.");
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private Serde<?> enumSerde(Class<?> clazz) {
    return new EnumSerde(clazz);
  }

  private Serde<?> resolveParameterized(ParameterizedType type) {
    final Class<?> raw = rawClass(type);
    final Type[] args = type.getActualTypeArguments();
    if (raw == Optional.class) {
      return Serdes.optional(resolve(args[0]));
    } else if (raw == List.class) {
      return Serdes.list(resolve(args[0]));
    } else if (raw == Set.class) {
      return Serdes.set(resolve(args[0]));
    } else if (raw == Map.class) {
      return Serdes.map(resolve(args[0]), resolve(args[1]));
    } else if (custom.containsKey(raw)) {
      return custom.get(raw);
    } else if (raw.isRecord() || raw.isSealed()) {
      // generic user types are resolved on their erasure
      return resolve(raw);
    }
    throw new IllegalArgumentException("Unsupported type: " + type.getTypeName() +
        ". Only Optional, List, Set and Map are supported as generic containers.");
  }

  private <T> Serde<T> recordSerde(Class<T> clazz) {
    final var deferred = new Deferred<T>(clazz);
    resolved.put(clazz, deferred);
    final RecordComponent[] components = clazz.getRecordComponents();
    final Serde<?>[] serdes = Arrays.stream(components)
        .map(component -> component.isAnnotationPresent(Skip.class) ? null : resolve(component.getGenericType()))
        .toArray(Serde<?>[]::new);
    final var serde = new RecordSerde<>(clazz, serdes);
    deferred.delegate = serde;
    return serde;
  }

  private <T> Serde<T> sealedSerde(Class<T> clazz) {
    final var deferred = new Deferred<T>(clazz);
    resolved.put(clazz, deferred);
    final Serde<?>[] variants = Arrays.stream(clazz.getPermittedSubclasses())
        .map(this::resolve)
        .toArray(Serde<?>[]::new);
    final var serde = new SealedSerde<>(clazz, variants);
    deferred.delegate = serde;
    return serde;
  }

  static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> clazz) {
      return clazz;
    } else if (type instanceof ParameterizedType parameterized) {
      return (Class<?>) parameterized.getRawType();
    } else if (type instanceof GenericArrayType genericArray) {
      return Array.newInstance(rawClass(genericArray.getGenericComponentType()), 0).getClass();
    }
    throw new IllegalArgumentException("Unsupported type: " + type.getTypeName());
  }

  /// Stands in for a type whose serde is still being built, so that recursive types terminate.
  static final class Deferred<T> implements Serde<T> {
    final Class<T> type;
    Serde<T> delegate;

    Deferred(Class<T> type) {
      this.type = type;
    }

    private Serde<T> delegate() {
      return Objects.requireNonNull(delegate, () -> "serde for " + type + " used before it was resolved");
    }

    @Override
    public void serialize(T value, BinSerializer serializer) {
      delegate().serialize(value, serializer);
    }

    @Override
    public T deserialize(BinDeserializer deserializer) {
      return delegate().deserialize(deserializer);
    }

    @Override
    public T deserializeInPlace(T target, BinDeserializer deserializer) {
      return delegate().deserializeInPlace(target, deserializer);
    }
  }
}
