// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import java.util.Objects;

/// Runs a traversal without writing anything, collecting the strings that the real write will
/// deduplicate. Only [#writeStr(String)] has an effect; it interns into the owned [DedupContext]
/// exactly when [BinSerializerBase] would write an index.
public final class PrescanSerializer implements BinSerializer {
  private final Mode mode;
  private final DedupContext dedup;
  private final boolean dedupEnabled;

  public PrescanSerializer(Mode mode) {
    this(Objects.requireNonNull(mode), new DedupContext(), true);
  }

  private PrescanSerializer(Mode mode, DedupContext dedup, boolean dedupEnabled) {
    this.mode = mode;
    this.dedup = dedup;
    this.dedupEnabled = dedupEnabled;
  }

  /// The strings collected so far, in first-occurrence order.
  public DedupContext dedup() {
    return dedup;
  }

  @Override
  public Mode mode() {
    return mode;
  }

  @Override
  public void writeStr(String value) {
    Objects.requireNonNull(value, "string must not be null");
    if (mode.useDedup() && dedupEnabled) {
      dedup.intern(value);
    }
  }

  @Override
  public BinSerializer withoutDedup() {
    return dedupEnabled ? new PrescanSerializer(mode, dedup, false) : this;
  }

  @Override
  public void writeBool(boolean value) {
  }

  @Override
  public void writeByte(byte value) {
  }

  @Override
  public void writeShort(short value) {
  }

  @Override
  public void writeUnsignedShort(short value) {
  }

  @Override
  public void writeInt(int value) {
  }

  @Override
  public void writeUnsignedInt(int value) {
  }

  @Override
  public void writeLong(long value) {
  }

  @Override
  public void writeUnsignedLong(long value) {
  }

  @Override
  public void writeFloat(float value) {
  }

  @Override
  public void writeDouble(double value) {
  }

  @Override
  public void writeUsize(long value) {
  }

  @Override
  public void writeRaw(byte[] bytes) {
  }
}
