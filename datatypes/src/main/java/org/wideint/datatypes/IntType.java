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

import java.math.BigInteger;

/**
 * Fixed-width integer types supported by the limb layer.
 *
 * <p>Signedness belongs to the type: the same limbs read as {@link #UINT128} or {@link #INT128}
 * denote different integers.
 */
public enum IntType {
  UINT8(8, false),
  UINT16(16, false),
  UINT32(32, false),
  UINT64(64, false),
  UINT128(128, false),
  UINT256(256, false),
  INT8(8, true),
  INT16(16, true),
  INT32(32, true),
  INT64(64, true),
  INT128(128, true),
  INT256(256, true);

  /** Fixed number of bits per limb. */
  public static final int BITS_PER_LIMB = 64;

  private final int bitWidth;
  private final boolean signed;
  private final BigInteger minValue;
  private final BigInteger maxValue;

  IntType(final int bitWidth, final boolean signed) {
    this.bitWidth = bitWidth;
    this.signed = signed;
    if (signed) {
      this.minValue = BigInteger.ONE.shiftLeft(bitWidth - 1).negate();
      this.maxValue = BigInteger.ONE.shiftLeft(bitWidth - 1).subtract(BigInteger.ONE);
    } else {
      this.minValue = BigInteger.ZERO;
      this.maxValue = BigInteger.ONE.shiftLeft(bitWidth).subtract(BigInteger.ONE);
    }
  }

  /**
   * Looks up the type for a width and signedness.
   *
   * @param bitWidth one of 8, 16, 32, 64, 128 or 256.
   * @param signed whether values are read as two's complement.
   * @return the matching type.
   */
  public static IntType of(final int bitWidth, final boolean signed) {
    for (IntType type : values()) {
      if (type.bitWidth == bitWidth && type.signed == signed) return type;
    }
    throw new IllegalArgumentException("Unsupported integer width: " + bitWidth);
  }

  public int bitWidth() {
    return bitWidth;
  }

  public boolean isSigned() {
    return signed;
  }

  /**
   * Number of 64-bit limbs holding a value of this type.
   *
   * @return ceil(width / 64).
   */
  public int limbCount() {
    return (bitWidth + BITS_PER_LIMB - 1) / BITS_PER_LIMB;
  }

  /**
   * Whether the type is narrower than one limb, in which case the bits of the limb at and above
   * the width are kept at zero.
   *
   * @return true for widths below 64.
   */
  public boolean isNarrow() {
    return bitWidth < BITS_PER_LIMB;
  }

  public BigInteger minValue() {
    return minValue;
  }

  public BigInteger maxValue() {
    return maxValue;
  }

  /**
   * Whether a plaintext can be represented without wrapping.
   *
   * @param value plaintext integer.
   * @return true if {@code minValue() <= value <= maxValue()}.
   */
  public boolean isRepresentable(final BigInteger value) {
    return value.compareTo(minValue) >= 0 && value.compareTo(maxValue) <= 0;
  }

  /**
   * The type with the same width and the given signedness.
   *
   * @param signed whether the result type is signed.
   * @return the matching type of the same width.
   */
  public IntType withSignedness(final boolean signed) {
    return of(bitWidth, signed);
  }
}
