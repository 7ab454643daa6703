// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.util.Objects;

/// The single failure type raised while encoding or decoding. The [Kind] says what went wrong.
/// Every failure is fatal to the call that raised it: nothing is retried and no partial value is returned.
public final class BinserdeException extends RuntimeException {

  /// What went wrong.
  public enum Kind {
    /// The underlying stream failed or ended early.
    IO,
    /// A number did not fit the width it had to be converted to, such as a length beyond `int` range.
    SIZE_OVERFLOW,
    /// String bytes were not valid UTF-8.
    INVALID_UTF8,
    /// A deduplicated string referred past the end of the string table.
    STR_OUT_OF_RANGE,
    /// Raised by a user supplied serde.
    CUSTOM
  }

  private final Kind kind;
  private final long index;

  private BinserdeException(Kind kind, String message, Throwable cause, long index) {
    super(message, cause);
    this.kind = kind;
    this.index = index;
  }

  public static BinserdeException io(IOException cause) {
    Objects.requireNonNull(cause);
    return new BinserdeException(Kind.IO, "I/O error: " + cause.getMessage(), cause, -1);
  }

  public static BinserdeException sizeOverflow(String message) {
    return new BinserdeException(Kind.SIZE_OVERFLOW, message, null, -1);
  }

  public static BinserdeException invalidUtf8(CharacterCodingException cause) {
    return new BinserdeException(Kind.INVALID_UTF8, "invalid UTF-8 string", cause, -1);
  }

  public static BinserdeException strOutOfRange(long index, int count) {
    return new BinserdeException(Kind.STR_OUT_OF_RANGE,
        "indexed string out of range: " + Long.toUnsignedString(index) + " (table holds " + count + ")", null, index);
  }

  public static BinserdeException custom(String message) {
    return new BinserdeException(Kind.CUSTOM, message, null, -1);
  }

  public Kind kind() {
    return kind;
  }

  /// The offending table index for [Kind#STR_OUT_OF_RANGE], otherwise -1.
  public long index() {
    return index;
  }
}
