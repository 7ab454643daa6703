// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.binserde;

/// Binds a root class to its serde.
record PicklerImpl<T>(Class<T> rootClass, Serde<T> serde) implements Pickler<T> {

  @Override
  public String toString() {
    return "Pickler{rootClass=" + rootClass.getName() + ", serde=" + serde + "}";
  }
}
