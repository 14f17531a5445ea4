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
package org.wideint.arithmetic;

import static com.google.common.base.Preconditions.checkArgument;

import org.wideint.datatypes.IntType;
import org.wideint.datatypes.LimbCodec;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/** Bitwise operations and public-amount shifts of wide values. */
public final class LimbBitwise {
  // Fixed number of bits per limb
  private static final int N_BITS_PER_LIMB = IntType.BITS_PER_LIMB;

  private LimbBitwise() {}

  // region Logical
  // --------------------------------------------------------------------------

  public static WideValue and(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.and(a.limb(i), b.limb(i));
    }
    return WideValue.of(type, limbs);
  }

  public static WideValue or(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.or(a.limb(i), b.limb(i));
    }
    return WideValue.of(type, limbs);
  }

  public static WideValue xor(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.xor(a.limb(i), b.limb(i));
    }
    return WideValue.of(type, limbs);
  }

  public static WideValue not(final WordBackend backend, final WideValue a) {
    SecretWord[] limbs = new SecretWord[a.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = LimbVectors.not(backend, a.type(), i, a.limb(i));
    }
    return WideValue.of(a.type(), limbs);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Shifts
  // --------------------------------------------------------------------------

  /**
   * Logical left shift; bits shifted past the width are dropped.
   *
   * @param backend word backend.
   * @param value value to shift.
   * @param shift public amount, zero or more.
   * @return {@code (value << shift) mod 2^width}, zero when {@code shift >= width}.
   */
  public static WideValue shl(final WordBackend backend, final WideValue value, final int shift) {
    checkArgument(shift >= 0, "Negative shift amount %s", shift);
    IntType type = value.type();
    if (shift == 0) return value;
    if (shift >= type.bitWidth()) return LimbVectors.zero(backend, type);

    int limbShift = shift / N_BITS_PER_LIMB;
    int bitShift = shift % N_BITS_PER_LIMB;
    SecretWord[] limbs = new SecretWord[value.limbCount()];
    SecretWord zero = null;
    for (int i = limbs.length - 1; i >= 0; i--) {
      int src = i - limbShift;
      if (src < 0) {
        if (zero == null) zero = LimbVectors.word(backend, 0L);
        limbs[i] = zero;
        continue;
      }
      SecretWord limb = bitShift == 0 ? value.limb(src) : backend.shl(value.limb(src), bitShift);
      if (bitShift != 0 && src > 0) {
        // bits carried in from the limb below
        limb = backend.or(limb, backend.shr(value.limb(src - 1), N_BITS_PER_LIMB - bitShift));
      }
      limbs[i] = LimbVectors.canonical(backend, type, limb);
    }
    return WideValue.of(type, limbs);
  }

  /**
   * Right shift: logical for unsigned types, arithmetic (sign filling) for signed ones.
   *
   * @param backend word backend.
   * @param value value to shift.
   * @param shift public amount, zero or more.
   * @return {@code value >> shift}; past the width, zero or minus one for negative signed values.
   */
  public static WideValue shr(final WordBackend backend, final WideValue value, final int shift) {
    checkArgument(shift >= 0, "Negative shift amount %s", shift);
    IntType type = value.type();
    if (shift == 0) return value;
    int effective = Math.min(shift, type.bitWidth());
    WideValue logical =
        effective == type.bitWidth()
            ? LimbVectors.zero(backend, type)
            : shiftRightLogical(backend, value, effective);
    if (!type.isSigned()) return logical;
    return signFill(backend, value, logical, effective);
  }

  private static WideValue shiftRightLogical(
      final WordBackend backend, final WideValue value, final int shift) {
    int limbShift = shift / N_BITS_PER_LIMB;
    int bitShift = shift % N_BITS_PER_LIMB;
    int n = value.limbCount();
    SecretWord[] limbs = new SecretWord[n];
    SecretWord zero = null;
    for (int i = 0; i < n; i++) {
      int src = i + limbShift;
      if (src >= n) {
        if (zero == null) zero = LimbVectors.word(backend, 0L);
        limbs[i] = zero;
        continue;
      }
      SecretWord limb = bitShift == 0 ? value.limb(src) : backend.shr(value.limb(src), bitShift);
      if (bitShift != 0 && src + 1 < n) {
        limb = backend.or(limb, backend.shl(value.limb(src + 1), N_BITS_PER_LIMB - bitShift));
      }
      limbs[i] = limb;
    }
    return WideValue.of(value.type(), limbs);
  }

  /**
   * Sets the top {@code shift} bits of a logically shifted value when the original is negative.
   *
   * @param backend word backend.
   * @param original value before the shift.
   * @param logical value after the logical shift.
   * @param shift shift amount, at most the width.
   * @return the arithmetic shift.
   */
  private static WideValue signFill(
      final WordBackend backend,
      final WideValue original,
      final WideValue logical,
      final int shift) {
    IntType type = original.type();
    SecretWord sign = LimbVectors.signBit(backend, original);
    // all ones when negative, zero otherwise
    SecretWord fill = backend.sub(LimbVectors.word(backend, 0L), sign);
    int fillFrom = type.bitWidth() - shift;
    SecretWord[] limbs = new SecretWord[logical.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      long fillMask = fillMask(type, i, fillFrom);
      if (fillMask == 0L) {
        limbs[i] = logical.limb(i);
        continue;
      }
      SecretWord filled = backend.and(fill, LimbVectors.word(backend, fillMask));
      limbs[i] = backend.or(logical.limb(i), filled);
    }
    return WideValue.of(type, limbs);
  }

  private static long fillMask(final IntType type, final int index, final int fillFrom) {
    int limbStart = index * N_BITS_PER_LIMB;
    int from = Math.max(fillFrom - limbStart, 0);
    if (from >= N_BITS_PER_LIMB) return 0L;
    return LimbCodec.limbMask(type, index) & (-1L << from);
  }

  // --------------------------------------------------------------------------
  // endregion
}
