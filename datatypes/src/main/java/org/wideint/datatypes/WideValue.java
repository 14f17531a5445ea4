/*
 * Copyright contributors to Besu.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License is distributed on
 * an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package org.wideint.datatypes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;

/**
 * A fixed-width secret integer held as little-endian 64-bit secret limbs.
 *
 * <p>Instances are immutable and may be shared freely as inputs to further operations. Limb 0 is
 * least significant. For types narrower than 64 bits the single limb keeps its bits at and above
 * the width at zero.
 */
public final class WideValue {
  // region Internals
  // --------------------------------------------------------------------------
  private final IntType type;
  private final SecretWord[] limbs;

  // --------------------------------------------------------------------------
  // endregion

  private WideValue(final IntType type, final SecretWord[] limbs) {
    this.type = type;
    this.limbs = limbs;
  }

  /**
   * Assembles a value from its limbs.
   *
   * @param type integer type of the value.
   * @param limbs little-endian limbs, exactly {@code type.limbCount()} of them.
   * @return the wide value.
   */
  public static WideValue of(final IntType type, final SecretWord... limbs) {
    checkNotNull(type, "type");
    checkNotNull(limbs, "limbs");
    checkArgument(
        limbs.length == type.limbCount(),
        "%s needs %s limbs but got %s",
        type,
        type.limbCount(),
        limbs.length);
    for (SecretWord limb : limbs) checkNotNull(limb, "limb");
    return new WideValue(type, limbs.clone());
  }

  public IntType type() {
    return type;
  }

  public int limbCount() {
    return limbs.length;
  }

  /**
   * Limb at a position.
   *
   * @param index 0 for the least significant limb.
   * @return the secret limb.
   */
  public SecretWord limb(final int index) {
    checkElementIndex(index, limbs.length, "limb index");
    return limbs[index];
  }

  /**
   * The most significant limb, which carries the sign bit of signed types.
   *
   * @return the top limb.
   */
  public SecretWord topLimb() {
    return limbs[limbs.length - 1];
  }

  /**
   * Copy of the limbs.
   *
   * @return little-endian limbs.
   */
  public SecretWord[] limbs() {
    return limbs.clone();
  }

  /**
   * Same limbs read as another type of equal width, e.g. a signed value viewed as unsigned.
   *
   * @param other type with the same width.
   * @return a value sharing these limbs.
   */
  public WideValue reinterpret(final IntType other) {
    checkArgument(
        other.bitWidth() == type.bitWidth(), "Cannot reinterpret %s as %s", type, other);
    return other == type ? this : new WideValue(other, limbs);
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof WideValue)) return false;
    WideValue other = (WideValue) obj;
    return type == other.type && Arrays.equals(limbs, other.limbs);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + Arrays.hashCode(limbs);
  }

  @Override
  public String toString() {
    return type + Arrays.toString(limbs);
  }
}
