// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.lang.reflect.Array;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Serdes for the built-in value types and containers.
public final class Serdes {

  private static final Serde<Boolean> BOOL = Serde.of((v, s) -> s.writeBool(v), BinDeserializer::readBool);
  private static final Serde<Byte> I8 = Serde.of((v, s) -> s.writeByte(v), BinDeserializer::readByte);
  private static final Serde<Short> I16 = Serde.of((v, s) -> s.writeShort(v), BinDeserializer::readShort);
  private static final Serde<Short> U16 =
      Serde.of((v, s) -> s.writeUnsignedShort(v), BinDeserializer::readUnsignedShort);
  private static final Serde<Character> CHAR = Serde.of((v, s) -> s.writeChar(v), BinDeserializer::readChar);
  private static final Serde<Integer> I32 = Serde.of((v, s) -> s.writeInt(v), BinDeserializer::readInt);
  private static final Serde<Integer> U32 =
      Serde.of((v, s) -> s.writeUnsignedInt(v), BinDeserializer::readUnsignedInt);
  private static final Serde<Long> I64 = Serde.of((v, s) -> s.writeLong(v), BinDeserializer::readLong);
  private static final Serde<Long> U64 =
      Serde.of((v, s) -> s.writeUnsignedLong(v), BinDeserializer::readUnsignedLong);
  private static final Serde<Float> F32 = Serde.of((v, s) -> s.writeFloat(v), BinDeserializer::readFloat);
  private static final Serde<Double> F64 = Serde.of((v, s) -> s.writeDouble(v), BinDeserializer::readDouble);
  private static final Serde<String> STRING = Serde.of((v, s) -> s.writeStr(v), BinDeserializer::readStr);
  private static final Serde<byte[]> BYTES = Serde.of(
      (v, s) -> {
        s.writeUsize(v.length);
        s.writeRaw(v);
      },
      d -> d.readRaw(d.readLength()));

  private Serdes() {
  }

  public static Serde<Boolean> bool() {
    return BOOL;
  }

  public static Serde<Byte> i8() {
    return I8;
  }

  public static Serde<Short> i16() {
    return I16;
  }

  public static Serde<Short> u16() {
    return U16;
  }

  public static Serde<Character> character() {
    return CHAR;
  }

  public static Serde<Integer> i32() {
    return I32;
  }

  public static Serde<Integer> u32() {
    return U32;
  }

  public static Serde<Long> i64() {
    return I64;
  }

  public static Serde<Long> u64() {
    return U64;
  }

  public static Serde<Float> f32() {
    return F32;
  }

  public static Serde<Double> f64() {
    return F64;
  }

  /// Deduplicated when the mode asks for it.
  public static Serde<String> string() {
    return STRING;
  }

  /// Always inline.
  public static Serde<String> stringNoDedup() {
    return noDedup(STRING);
  }

  /// Length prefixed raw bytes.
  public static Serde<byte[]> bytes() {
    return BYTES;
  }

  /// Runs `inner` with deduplication switched off for every string it reaches.
  public static <T> Serde<T> noDedup(Serde<T> inner) {
    Objects.requireNonNull(inner);
    return new Serde<>() {
      @Override
      public void serialize(T value, BinSerializer serializer) {
        inner.serialize(value, serializer.withoutDedup());
      }

      @Override
      public T deserialize(BinDeserializer deserializer) {
        return inner.deserialize(deserializer.withoutDedup());
      }

      @Override
      public T deserializeInPlace(T target, BinDeserializer deserializer) {
        return inner.deserializeInPlace(target, deserializer.withoutDedup());
      }
    };
  }

  public static <T> Serde<Optional<T>> optional(Serde<T> inner) {
    Objects.requireNonNull(inner);
    return Serde.of((v, s) -> s.writeOption(v, inner), d -> d.readOption(inner));
  }

  /// Reads into an `ArrayList`; in place decoding refills a mutable target list.
  public static <T> Serde<List<T>> list(Serde<T> element) {
    Objects.requireNonNull(element);
    return new Serde<>() {
      @Override
      public void serialize(List<T> value, BinSerializer serializer) {
        serializer.writeSeq(value, element);
      }

      @Override
      public List<T> deserialize(BinDeserializer deserializer) {
        return deserializer.readSeq(element);
      }

      @Override
      public List<T> deserializeInPlace(List<T> target, BinDeserializer deserializer) {
        return reusable(target) ? deserializer.readSeqInto(target, element) : deserialize(deserializer);
      }
    };
  }

  /// Reads into a `LinkedHashSet`, preserving wire order.
  public static <T> Serde<Set<T>> set(Serde<T> element) {
    Objects.requireNonNull(element);
    return new Serde<>() {
      @Override
      public void serialize(Set<T> value, BinSerializer serializer) {
        serializer.writeSeq(value, element);
      }

      @Override
      public Set<T> deserialize(BinDeserializer deserializer) {
        return deserializer.readSeqInto(new LinkedHashSet<>(), element);
      }

      @Override
      public Set<T> deserializeInPlace(Set<T> target, BinDeserializer deserializer) {
        return reusable(target) ? deserializer.readSeqInto(target, element) : deserialize(deserializer);
      }
    };
  }

  /// Reads into a `LinkedHashMap`, preserving wire order.
  public static <K, V> Serde<Map<K, V>> map(Serde<K> key, Serde<V> value) {
    Objects.requireNonNull(key);
    Objects.requireNonNull(value);
    return new Serde<>() {
      @Override
      public void serialize(Map<K, V> map, BinSerializer serializer) {
        serializer.writeMap(map, key, value);
      }

      @Override
      public Map<K, V> deserialize(BinDeserializer deserializer) {
        return deserializer.readMap(key, value);
      }

      @Override
      public Map<K, V> deserializeInPlace(Map<K, V> target, BinDeserializer deserializer) {
        return reusable(target) ? deserializer.readMapInto(target, key, value) : deserialize(deserializer);
      }
    };
  }

  /// Arrays of any component type, primitive ones included, written as a sequence.
  /// In place decoding fills the target array when it already has the right length.
  @SuppressWarnings("unchecked")
  public static <A> Serde<A> array(Class<A> arrayType, Serde<?> element) {
    Objects.requireNonNull(arrayType);
    Objects.requireNonNull(element);
    if (!arrayType.isArray()) {
      throw new IllegalArgumentException("Not an array type: " + arrayType);
    }
    final Class<?> componentType = arrayType.getComponentType();
    final var raw = (Serde<Object>) element;
    return new Serde<>() {
      @Override
      public void serialize(A value, BinSerializer serializer) {
        final int length = Array.getLength(value);
        serializer.writeUsize(length);
        for (int i = 0; i < length; i++) {
          raw.serialize(Objects.requireNonNull(Array.get(value, i), "null array element"), serializer);
        }
      }

      @Override
      public A deserialize(BinDeserializer deserializer) {
        return build(deserializer.readLength(), deserializer);
      }

      @Override
      public A deserializeInPlace(A target, BinDeserializer deserializer) {
        final int length = deserializer.readLength();
        if (Array.getLength(target) != length) {
          return build(length, deserializer);
        }
        final var elements = deserializer.iterate(length, raw);
        for (int i = 0; elements.hasNext(); i++) {
          Array.set(target, i, elements.next());
        }
        return target;
      }

      // collect first so a corrupt length fails on missing data rather than on allocation
      private A build(int length, BinDeserializer deserializer) {
        final List<Object> items = new ArrayList<>(Math.min(length, BinDeserializer.MAX_PREALLOCATION));
        deserializer.iterate(length, raw).forEachRemaining(items::add);
        final Object array = Array.newInstance(componentType, length);
        for (int i = 0; i < length; i++) {
          Array.set(array, i, items.get(i));
        }
        return (A) array;
      }
    };
  }

  /// Enum constants as their zero-based declaration position.
  public static <E extends Enum<E>> Serde<E> enumeration(Class<E> enumType) {
    return new EnumSerde<>(enumType);
  }

  static boolean reusable(Collection<?> target) {
    return target instanceof ArrayList || target instanceof LinkedList || target instanceof ArrayDeque
        || target instanceof HashSet || target instanceof TreeSet;
  }

  static boolean reusable(Map<?, ?> target) {
    return target instanceof HashMap || target instanceof TreeMap;
  }
}
