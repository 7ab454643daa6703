// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// A record written as its components in declaration order, with no count or type marker.
///
/// Components marked [Skip] are never visited and decode to their type's default. Components marked
/// [NoDedup] are written through [BinSerializer#withoutDedup()].
final class RecordSerde<T> implements Serde<T> {
  final Class<T> userType;
  final MethodHandle recordConstructor;
  final MethodHandle[] componentAccessors;
  final RecordComponent[] components;
  final boolean[] skipped;
  final Serde<Object>[] serdes;

  /// @param serdes one serde per component; entries for skipped components are ignored and may be null
  RecordSerde(Class<T> userType, Serde<?>[] serdes) {
    assert userType.isRecord() : "User type must be a record: " + userType;
    this.userType = Objects.requireNonNull(userType);
    this.components = userType.getRecordComponents();
    if (serdes.length != components.length) {
      throw new IllegalArgumentException("Expected " + components.length + " serdes for " + userType +
          " but got " + serdes.length);
    }

    try {
      final Class<?>[] parameterTypes = Arrays.stream(components)
          .map(RecordComponent::getType)
          .toArray(Class<?>[]::new);
      final Constructor<T> constructor = userType.getDeclaredConstructor(parameterTypes);
      constructor.setAccessible(true);
      this.recordConstructor = MethodHandles.lookup().unreflectConstructor(constructor);
    } catch (ReflectiveOperationException | RuntimeException e) {
      throw new IllegalArgumentException("Failed to create constructor handle for " + userType, e);
    }

    componentAccessors = Arrays.stream(components)
        .map(component -> {
          try {
            final var accessor = component.getAccessor();
            accessor.setAccessible(true);
            return MethodHandles.lookup().unreflect(accessor);
          } catch (ReflectiveOperationException | RuntimeException e) {
            throw new IllegalArgumentException("Failed to create accessor for " + component.getName(), e);
          }
        })
        .toArray(MethodHandle[]::new);

    skipped = new boolean[components.length];
    @SuppressWarnings("unchecked") final Serde<Object>[] raw = (Serde<Object>[]) new Serde[components.length];
    this.serdes = raw;
    IntStream.range(0, components.length).forEach(i -> {
      final RecordComponent rc = components[i];
      skipped[i] = rc.isAnnotationPresent(Skip.class);
      if (!skipped[i]) {
        @SuppressWarnings("unchecked") final var serde = (Serde<Object>) Objects.requireNonNull(serdes[i],
            "no serde for component " + rc.getName());
        this.serdes[i] = rc.isAnnotationPresent(NoDedup.class) ? Serdes.noDedup(serde) : serde;
      }
    });

    LOGGER.fine(() -> "RecordSerde " + userType.getName() + " components: " +
        IntStream.range(0, components.length)
            .mapToObj(i -> components[i].getName() + (skipped[i] ? "(skip)" : "") +
                (components[i].isAnnotationPresent(NoDedup.class) ? "(no_dedup)" : ""))
            .collect(Collectors.joining(", ")));
  }

  @Override
  public void serialize(T record, BinSerializer serializer) {
    Objects.requireNonNull(record);
    if (!userType.isAssignableFrom(record.getClass())) {
      throw new IllegalArgumentException("Expected " + userType + " but got " + record.getClass());
    }
    for (int i = 0; i < components.length; i++) {
      if (skipped[i]) {
        continue;
      }
      final String name = components[i].getName();
      final Object value = Objects.requireNonNull(component(record, i),
          () -> "null component " + userType.getSimpleName() + "." + name + " (use Optional for absent values)");
      serdes[i].serialize(value, serializer);
    }
  }

  @Override
  public T deserialize(BinDeserializer deserializer) {
    final Object[] args = new Object[components.length];
    for (int i = 0; i < components.length; i++) {
      args[i] = skipped[i] ? defaultValue(components[i].getType()) : serdes[i].deserialize(deserializer);
    }
    return construct(args);
  }

  /// Records are immutable, so a new record is returned, but each component is decoded in place into
  /// the target's current component value.
  @Override
  public T deserializeInPlace(T target, BinDeserializer deserializer) {
    final Object[] args = new Object[components.length];
    for (int i = 0; i < components.length; i++) {
      if (skipped[i]) {
        args[i] = defaultValue(components[i].getType());
      } else {
        final Object current = component(target, i);
        args[i] = current == null ? serdes[i].deserialize(deserializer) : serdes[i].deserializeInPlace(current, deserializer);
      }
    }
    return construct(args);
  }

  private Object component(T record, int i) {
    try {
      return componentAccessors[i].invoke(record);
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to read " + components[i].getName() + " of " + userType, e);
    }
  }

  private T construct(Object[] args) {
    LOGGER.finer(() -> "RecordSerde " + userType.getSimpleName() + " constructing from " + Arrays.toString(args));
    try {
      @SuppressWarnings("unchecked") final var result = (T) recordConstructor.invokeWithArguments(args);
      return result;
    } catch (RuntimeException e) {
      throw e;
    } catch (Throwable e) {
      throw new IllegalStateException("Failed to construct " + userType, e);
    }
  }

  /// What a skipped component decodes to.
  static Object defaultValue(Class<?> type) {
    if (type == boolean.class) {
      return false;
    } else if (type == byte.class) {
      return (byte) 0;
    } else if (type == short.class) {
      return (short) 0;
    } else if (type == char.class) {
      return '\0';
    } else if (type == int.class) {
      return 0;
    } else if (type == long.class) {
      return 0L;
    } else if (type == float.class) {
      return 0.0f;
    } else if (type == double.class) {
      return 0.0d;
    } else if (type == String.class) {
      return "";
    } else if (type == Optional.class) {
      return Optional.empty();
    } else if (type == List.class) {
      return new ArrayList<>();
    } else if (type == Set.class) {
      return new LinkedHashSet<>();
    } else if (type == Map.class) {
      return new LinkedHashMap<>();
    }
    return null;
  }

  @Override
  public String toString() {
    return "RecordSerde{userType=" + userType + "}";
  }
}
