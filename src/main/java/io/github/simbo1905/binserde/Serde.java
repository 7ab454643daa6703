// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Objects;
import java.util.function.Function;

/// Both directions for one type.
public interface Serde<T> extends BinSerialize<T>, BinDeserialize<T> {

  static <T> Serde<T> of(BinSerialize<T> writer, BinDeserialize<T> reader) {
    Objects.requireNonNull(writer, "writer must not be null");
    Objects.requireNonNull(reader, "reader must not be null");
    return new Serde<>() {
      @Override
      public void serialize(T value, BinSerializer serializer) {
        writer.serialize(value, serializer);
      }

      @Override
      public T deserialize(BinDeserializer deserializer) {
        return reader.deserialize(deserializer);
      }

      @Override
      public T deserializeInPlace(T target, BinDeserializer deserializer) {
        return reader.deserializeInPlace(target, deserializer);
      }
    };
  }

  /// A serde for `U` that travels on the wire as a `T`, e.g. a `UUID` written as its string form.
  default <U> Serde<U> xmap(Function<? super T, ? extends U> decode, Function<? super U, ? extends T> encode) {
    Objects.requireNonNull(decode);
    Objects.requireNonNull(encode);
    final Serde<T> self = this;
    return of(
        (value, serializer) -> self.serialize(encode.apply(value), serializer),
        deserializer -> decode.apply(self.deserialize(deserializer)));
  }
}
