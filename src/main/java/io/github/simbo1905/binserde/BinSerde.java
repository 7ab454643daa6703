// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

import static io.github.simbo1905.binserde.Pickler.LOGGER;

/// Entry points that sequence a whole encode or decode.
///
/// Encoding with dedup runs a [PrescanSerializer] over the value, writes the resulting table, then runs a
/// [BinSerializerBase] over the same value to write the payload. Without dedup there is a single pass.
/// Decoding reads the table (if any) in full and then the payload.
///
/// Streams passed in are neither flushed nor closed.
public final class BinSerde {

  private BinSerde() {
  }

  public static <T> byte[] serialize(T value, BinSerialize<? super T> serialize) {
    return serialize(value, serialize, Mode.defaults());
  }

  public static <T> byte[] serialize(T value, BinSerialize<? super T> serialize, Mode mode) {
    final var out = new ByteArrayOutputStream();
    serializeInto(out, value, serialize, mode);
    return out.toByteArray();
  }

  public static <T> void serializeInto(OutputStream out, T value, BinSerialize<? super T> serialize) {
    serializeInto(out, value, serialize, Mode.defaults());
  }

  public static <T> void serializeInto(@NotNull OutputStream out, @NotNull T value,
                                       @NotNull BinSerialize<? super T> serialize, @NotNull Mode mode) {
    Objects.requireNonNull(out, "out must not be null");
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(serialize, "serialize must not be null");
    Objects.requireNonNull(mode, "mode must not be null");
    if (mode.useDedup()) {
      final var prescan = new PrescanSerializer(mode);
      serialize.serialize(value, prescan);
      LOGGER.fine(() -> "BinSerde prescan of " + value.getClass().getSimpleName() + " found " +
          prescan.dedup().size() + " distinct strings");
      prescan.dedup().writeTo(out);
    }
    serialize.serialize(value, new BinSerializerBase(out, mode));
  }

  /// Number of bytes [#serialize(Object, BinSerialize, Mode)] would produce, table included.
  public static <T> long serializedSize(T value, BinSerialize<? super T> serialize, Mode mode) {
    final var counter = new CountingOutputStream();
    serializeInto(counter, value, serialize, mode);
    return counter.count;
  }

  public static <T> long serializedSize(T value, BinSerialize<? super T> serialize) {
    return serializedSize(value, serialize, Mode.defaults());
  }

  public static <T> T deserialize(byte[] bytes, BinDeserialize<T> deserialize) {
    return deserialize(bytes, deserialize, Mode.defaults());
  }

  public static <T> T deserialize(byte[] bytes, BinDeserialize<T> deserialize, Mode mode) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    return deserializeFrom(new ByteArrayInputStream(bytes), deserialize, mode);
  }

  public static <T> T deserializeFrom(InputStream in, BinDeserialize<T> deserialize) {
    return deserializeFrom(in, deserialize, Mode.defaults());
  }

  public static <T> T deserializeFrom(@NotNull InputStream in, @NotNull BinDeserialize<T> deserialize,
                                      @NotNull Mode mode) {
    Objects.requireNonNull(deserialize, "deserialize must not be null");
    return deserialize.deserialize(open(in, mode));
  }

  public static <T> T deserializeInPlace(T target, InputStream in, BinDeserialize<T> deserialize) {
    return deserializeInPlace(target, in, deserialize, Mode.defaults());
  }

  /// Decode into `target`, reusing its containers where possible. Returns the decoded value, which is
  /// `target` itself for mutable types and a new instance for immutable ones such as records.
  public static <T> T deserializeInPlace(@NotNull T target, @NotNull InputStream in,
                                         @NotNull BinDeserialize<T> deserialize, @NotNull Mode mode) {
    Objects.requireNonNull(target, "target must not be null");
    Objects.requireNonNull(deserialize, "deserialize must not be null");
    return deserialize.deserializeInPlace(target, open(in, mode));
  }

  private static BinDeserializer open(InputStream in, Mode mode) {
    Objects.requireNonNull(in, "in must not be null");
    Objects.requireNonNull(mode, "mode must not be null");
    final DedupContext context = mode.useDedup() ? DedupContext.readFrom(in) : new DedupContext();
    return new BinDeserializerBase(in, context, mode);
  }

  private static final class CountingOutputStream extends OutputStream {
    long count;

    @Override
    public void write(int b) {
      count++;
    }

    @Override
    public void write(byte[] b, int off, int len) {
      Objects.checkFromIndexSize(off, len, b.length);
      count += len;
    }
  }
}
