// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.binserde.TestBytes.bytes;
import static io.github.simbo1905.binserde.TestBytes.concat;
import static io.github.simbo1905.binserde.TestBytes.repeat;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Byte-exact checks of the wire format through the static entry points.
public class BinSerdeTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  public record TwoStrings(String s1, String s2) {
  }

  static final Serde<TwoStrings> TWO_STRINGS = Serde.of(
      (v, s) -> {
        s.writeStr(v.s1());
        s.writeStr(v.s2());
      },
      d -> new TwoStrings(d.readStr(), d.readStr()));

  @Test
  void stringIsLengthPrefixedUtf8() {
    assertThat(BinSerde.serialize("abc", Serdes.string())).isEqualTo(bytes(0x03, 0x61, 0x62, 0x63));
  }

  @Test
  void booleansAreFullBytes() {
    assertThat(BinSerde.serialize(true, Serdes.bool())).isEqualTo(bytes(0xFF));
    assertThat(BinSerde.serialize(false, Serdes.bool())).isEqualTo(bytes(0x00));
  }

  @Test
  void shortsAsZigZagVarints() {
    final byte[] encoded = BinSerde.serialize(List.of((short) 1, (short) -3, (short) -35),
        Serdes.list(Serdes.i16()), Mode.defaults().withFixedSizeUseVarint(true));
    assertThat(encoded).isEqualTo(bytes(0x03, 0x02, 0x05, 0x45));
  }

  @Test
  void fixedWidthIntegersAreLittleEndian() {
    assertThat(BinSerde.serialize((short) 0x0102, Serdes.i16())).isEqualTo(bytes(0x02, 0x01));
    assertThat(BinSerde.serialize(0x01020304, Serdes.i32())).isEqualTo(bytes(0x04, 0x03, 0x02, 0x01));
    assertThat(BinSerde.serialize(-1L, Serdes.i64())).isEqualTo(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF));
    assertThat(BinSerde.serialize(1.0f, Serdes.f32())).isEqualTo(bytes(0x00, 0x00, 0x80, 0x3F));
  }

  @Test
  void unsignedVarintsAreNotZigZagged() {
    final Mode varint = Mode.defaults().withFixedSizeUseVarint(true);
    assertThat(BinSerde.serialize(3, Serdes.u32(), varint)).isEqualTo(bytes(0x03));
    assertThat(BinSerde.serialize(3, Serdes.i32(), varint)).isEqualTo(bytes(0x06));
    assertThat(BinSerde.deserialize(BinSerde.serialize(-1, Serdes.u32(), varint), Serdes.u32(), varint)).isEqualTo(-1);
    assertThat(BinSerde.deserialize(BinSerde.serialize(-1L, Serdes.u64(), varint), Serdes.u64(), varint)).isEqualTo(-1L);
  }

  @Test
  void repeatedStringIsStoredOnceUnderDedup() {
    final String x20 = "x".repeat(20);
    final var value = new TwoStrings(x20, x20);

    final byte[] dedup = BinSerde.serialize(value, TWO_STRINGS, Mode.dedup());
    assertThat(dedup).isEqualTo(concat(bytes(0x01, 0x14), repeat('x', 20), bytes(0x00, 0x00)));

    final byte[] inline = BinSerde.serialize(value, TWO_STRINGS);
    assertThat(inline).isEqualTo(concat(bytes(0x14), repeat('x', 20), bytes(0x14), repeat('x', 20)));
    assertThat(dedup.length).isLessThan(inline.length);

    assertThat(BinSerde.deserialize(dedup, TWO_STRINGS, Mode.dedup())).isEqualTo(value);
    assertThat(BinSerde.deserialize(inline, TWO_STRINGS)).isEqualTo(value);
  }

  @Test
  void withoutDedupWritesInlineUnderDedupMode() {
    final Serde<TwoStrings> secondInline = Serde.of(
        (v, s) -> {
          s.writeStr(v.s1());
          s.withoutDedup().writeStr(v.s2());
        },
        d -> new TwoStrings(d.readStr(), d.withoutDedup().readStr()));
    final var value = new TwoStrings("same", "same");

    final byte[] encoded = BinSerde.serialize(value, secondInline, Mode.dedup());
    // table with one entry, index 0, then the second string inline
    assertThat(encoded).isEqualTo(bytes(0x01, 0x04, 's', 'a', 'm', 'e', 0x00, 0x04, 's', 'a', 'm', 'e'));
    assertThat(BinSerde.deserialize(encoded, secondInline, Mode.dedup())).isEqualTo(value);
  }

  @Test
  void outOfRangeIndexFailsRatherThanReadingGarbage() {
    // table of one string, payload refers to index 1 then 0
    final byte[] corrupt = bytes(0x01, 0x01, 'a', 0x01, 0x00);
    assertThatThrownBy(() -> BinSerde.deserialize(corrupt, TWO_STRINGS, Mode.dedup()))
        .isInstanceOfSatisfying(BinserdeException.class, e -> {
          assertThat(e.kind()).isEqualTo(BinserdeException.Kind.STR_OUT_OF_RANGE);
          assertThat(e.index()).isEqualTo(1);
        });
  }

  @Test
  void indicesStayBelowTableCount() {
    final var words = List.of("a", "b", "a", "c", "b", "a", "d");
    final byte[] encoded = BinSerde.serialize(words, Serdes.list(Serdes.string()), Mode.dedup());
    // table: 4 distinct strings in first-occurrence order
    assertThat(encoded).isEqualTo(bytes(
        0x04, 0x01, 'a', 0x01, 'b', 0x01, 'c', 0x01, 'd',
        0x07, 0x00, 0x01, 0x00, 0x02, 0x01, 0x00, 0x03));
    assertThat(BinSerde.deserialize(encoded, Serdes.list(Serdes.string()), Mode.dedup())).isEqualTo(words);
  }

  @Test
  void optionalIsBoolTagThenValue() {
    final var serde = Serdes.optional(Serdes.i8());
    assertThat(BinSerde.serialize(Optional.of((byte) 7), serde)).isEqualTo(bytes(0xFF, 0x07));
    assertThat(BinSerde.serialize(Optional.<Byte>empty(), serde)).isEqualTo(bytes(0x00));
    assertThat(BinSerde.deserialize(bytes(0x00), serde)).isEmpty();
    assertThat(BinSerde.deserialize(bytes(0xFF, 0x07), serde)).contains((byte) 7);
  }

  @Test
  void mapIsCountThenPairs() {
    final var map = new LinkedHashMap<String, Byte>();
    map.put("k", (byte) 1);
    map.put("j", (byte) 2);
    final var serde = Serdes.map(Serdes.string(), Serdes.i8());
    final byte[] encoded = BinSerde.serialize(map, serde);
    assertThat(encoded).isEqualTo(bytes(0x02, 0x01, 'k', 0x01, 0x01, 'j', 0x02));
    assertThat(BinSerde.deserialize(encoded, serde)).containsExactly(Map.entry("k", (byte) 1), Map.entry("j", (byte) 2));
  }

  @Test
  void invalidUtf8IsReported() {
    assertThatThrownBy(() -> BinSerde.deserialize(bytes(0x02, 0xC3, 0x28), Serdes.string()))
        .isInstanceOfSatisfying(BinserdeException.class,
            e -> assertThat(e.kind()).isEqualTo(BinserdeException.Kind.INVALID_UTF8));
  }

  @Test
  void truncatedPayloadIsAnIoError() {
    assertThatThrownBy(() -> BinSerde.deserialize(bytes(0x05, 'a', 'b'), Serdes.string()))
        .isInstanceOfSatisfying(BinserdeException.class, e -> {
          assertThat(e.kind()).isEqualTo(BinserdeException.Kind.IO);
          assertThat(e).hasCauseInstanceOf(IOException.class);
        });
  }

  @Test
  void varintThatDoesNotFitAnIntOverflows() {
    final Mode varint = Mode.defaults().withFixedSizeUseVarint(true);
    final byte[] big = BinSerde.serialize(1L << 40, Serdes.i64(), varint);
    assertThatThrownBy(() -> BinSerde.deserialize(big, Serdes.i32(), varint))
        .isInstanceOfSatisfying(BinserdeException.class,
            e -> assertThat(e.kind()).isEqualTo(BinserdeException.Kind.SIZE_OVERFLOW));
  }

  @Test
  void customErrorsPropagateUnchanged() {
    final Serde<String> picky = Serdes.string().xmap(
        s -> {
          if (s.isEmpty()) {
            throw BinserdeException.custom("empty name");
          }
          return s;
        },
        s -> s);
    assertThatThrownBy(() -> BinSerde.deserialize(bytes(0x00), picky))
        .isInstanceOfSatisfying(BinserdeException.class, e -> {
          assertThat(e.kind()).isEqualTo(BinserdeException.Kind.CUSTOM);
          assertThat(e).hasMessage("empty name");
        });
  }

  @Test
  void streamsAreLeftOpenAndCanCarrySeveralValues() {
    final var out = new TrackingOutputStream();
    BinSerde.serializeInto(out, new TwoStrings("one", "two"), TWO_STRINGS, Mode.dedup());
    BinSerde.serializeInto(out, new TwoStrings("three", "three"), TWO_STRINGS, Mode.dedup());
    assertThat(out.closed).isFalse();

    final var in = new ByteArrayInputStream(out.toByteArray());
    assertThat(BinSerde.deserializeFrom(in, TWO_STRINGS, Mode.dedup())).isEqualTo(new TwoStrings("one", "two"));
    assertThat(BinSerde.deserializeFrom(in, TWO_STRINGS, Mode.dedup())).isEqualTo(new TwoStrings("three", "three"));
    assertThat(in.available()).isZero();
  }

  @Test
  void serializedSizeMatchesOutput() {
    final var value = new TwoStrings("hello", "hello");
    for (Mode mode : List.of(Mode.defaults(), Mode.dedup(), Mode.dedup().withFixedSizeUseVarint(true))) {
      assertThat(BinSerde.serializedSize(value, TWO_STRINGS, mode))
          .isEqualTo(BinSerde.serialize(value, TWO_STRINGS, mode).length);
    }
  }

  @Test
  void inPlaceRefillsMutableContainers() {
    final var serde = Serdes.map(Serdes.string(), Serdes.list(Serdes.i32()));
    final Map<String, List<Integer>> source = Map.of("a", List.of(1, 2, 3));
    final byte[] encoded = BinSerde.serialize(source, serde, Mode.dedup());

    final var target = new HashMap<String, List<Integer>>();
    target.put("stale", new ArrayList<>(List.of(9)));
    final var result = BinSerde.deserializeInPlace(target, new ByteArrayInputStream(encoded), serde, Mode.dedup());
    assertThat(result).isSameAs(target);
    assertThat(result).isEqualTo(source);
  }

  @Test
  void inPlaceOnImmutableTargetAllocates() {
    final var serde = Serdes.list(Serdes.i32());
    final byte[] encoded = BinSerde.serialize(List.of(4, 5), serde);
    final List<Integer> immutable = List.of(1);
    final var result = BinSerde.deserializeInPlace(immutable, new ByteArrayInputStream(encoded), serde);
    assertThat(result).containsExactly(4, 5);
    assertThat(immutable).containsExactly(1);
  }

  static final class TrackingOutputStream extends OutputStream {
    final ByteArrayOutputStream delegate = new ByteArrayOutputStream();
    boolean closed;

    @Override
    public void write(int b) {
      delegate.write(b);
    }

    @Override
    public void close() {
      closed = true;
    }

    byte[] toByteArray() {
      return delegate.toByteArray();
    }
  }
}
