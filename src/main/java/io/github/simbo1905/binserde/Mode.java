// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Arrays;

/// Wire format options. A `Mode` is a plain value that is handed to every serializer and deserializer
/// when it is created. The same mode must be used to read a buffer as was used to write it.
///
/// - `useDedup` writes a string table ahead of the payload and replaces each string with its table index.
/// - `fixedSizeUseVarint` writes fixed-width integers as varints (zig-zag for signed types) rather than
///   as little-endian fixed-width bytes.
public record Mode(boolean useDedup, boolean fixedSizeUseVarint) {

  static final String DEDUP_PROPERTY = "binserde.Mode.dedup";
  static final String FIXED_SIZE_USE_VARINT_PROPERTY = "binserde.Mode.fixedSizeUseVarint";

  private static final Mode DEFAULTS = new Mode(false, false);
  private static final Mode DEDUP = new Mode(true, false);

  /// Both options off: strings are written inline and fixed-width integers as raw bytes.
  public static Mode defaults() {
    return DEFAULTS;
  }

  /// Deduplicate strings through a table written ahead of the payload.
  public static Mode dedup() {
    return DEDUP;
  }

  public Mode withDedup(boolean useDedup) {
    return new Mode(useDedup, fixedSizeUseVarint);
  }

  public Mode withFixedSizeUseVarint(boolean fixedSizeUseVarint) {
    return new Mode(useDedup, fixedSizeUseVarint);
  }

  /// Build a mode from the system properties `binserde.Mode.dedup` and `binserde.Mode.fixedSizeUseVarint`.
  /// Unset properties default to `false`. This is only ever called explicitly; no code path falls back to it.
  public static Mode fromSystemProperties() {
    return new Mode(
        booleanProperty(DEDUP_PROPERTY),
        booleanProperty(FIXED_SIZE_USE_VARINT_PROPERTY));
  }

  private static boolean booleanProperty(String name) {
    final String value = System.getProperty(name, "false").trim().toLowerCase();
    switch (value) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("Invalid value for " + name + ": " + value + ". Must be one of: " +
            Arrays.toString(new String[]{"true", "false"}));
    }
  }
}
