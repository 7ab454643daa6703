// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ModeTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty(Mode.DEDUP_PROPERTY);
    System.clearProperty(Mode.FIXED_SIZE_USE_VARINT_PROPERTY);
  }

  @Test
  void defaultsAreAllOff() {
    assertThat(Mode.defaults()).isEqualTo(new Mode(false, false));
    assertThat(Mode.dedup()).isEqualTo(new Mode(true, false));
  }

  @Test
  void buildersReturnNewValues() {
    final Mode base = Mode.dedup();
    final Mode varint = base.withFixedSizeUseVarint(true);
    assertThat(varint).isEqualTo(new Mode(true, true));
    assertThat(base.fixedSizeUseVarint()).isFalse();
    assertThat(varint.withDedup(false)).isEqualTo(new Mode(false, true));
  }

  @Test
  void fromSystemProperties() {
    assertThat(Mode.fromSystemProperties()).isEqualTo(Mode.defaults());
    System.setProperty(Mode.DEDUP_PROPERTY, "TRUE");
    System.setProperty(Mode.FIXED_SIZE_USE_VARINT_PROPERTY, "true");
    assertThat(Mode.fromSystemProperties()).isEqualTo(new Mode(true, true));
  }

  @Test
  void invalidPropertyIsRejected() {
    System.setProperty(Mode.DEDUP_PROPERTY, "yes");
    assertThatThrownBy(Mode::fromSystemProperties)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining(Mode.DEDUP_PROPERTY);
  }
}
