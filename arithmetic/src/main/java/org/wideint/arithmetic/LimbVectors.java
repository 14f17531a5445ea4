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

import java.math.BigInteger;

import org.wideint.datatypes.IntType;
import org.wideint.datatypes.LimbCodec;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/**
 * Limb vector helpers shared by the composer, the comparator and the boundary layer.
 *
 * <p>Every helper takes the backend explicitly. Constants are injected with {@code setPublic} on
 * each use; nothing is cached.
 */
public final class LimbVectors {

  private LimbVectors() {}

  // region Constants
  // --------------------------------------------------------------------------

  static SecretWord word(final WordBackend backend, final long value) {
    return backend.setPublic(value);
  }

  /**
   * Injects a public integer as a wide value, wrapping it modulo 2^width.
   *
   * @param backend word backend.
   * @param type target type.
   * @param value plaintext integer.
   * @return the secret value.
   */
  static WideValue constant(final WordBackend backend, final IntType type, final BigInteger value) {
    return fromPlainLimbs(backend, type, LimbCodec.toLimbs(value, type));
  }

  static WideValue fromPlainLimbs(
      final WordBackend backend, final IntType type, final long[] plain) {
    SecretWord[] limbs = new SecretWord[plain.length];
    for (int i = 0; i < plain.length; i++) {
      limbs[i] = backend.setPublic(plain[i]);
    }
    return WideValue.of(type, limbs);
  }

  static WideValue zero(final WordBackend backend, final IntType type) {
    return constant(backend, type, BigInteger.ZERO);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Canonical form
  // --------------------------------------------------------------------------

  /**
   * Clears the bits of a limb that lie at or above the width of a narrow type.
   *
   * @param backend word backend.
   * @param type type of the value the limb belongs to.
   * @param limb raw 64-bit result.
   * @return the limb itself for full-limb types, the masked limb otherwise.
   */
  static SecretWord canonical(
      final WordBackend backend, final IntType type, final SecretWord limb) {
    if (!type.isNarrow()) return limb;
    return backend.and(limb, word(backend, LimbCodec.mask(type.bitWidth())));
  }

  /**
   * Bitwise NOT of one limb, restricted to the significant bits of the type.
   *
   * @param backend word backend.
   * @param type type of the value.
   * @param index limb position.
   * @param limb limb to invert.
   * @return inverted limb.
   */
  static SecretWord not(
      final WordBackend backend, final IntType type, final int index, final SecretWord limb) {
    return backend.xor(limb, word(backend, LimbCodec.limbMask(type, index)));
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Sign and magnitude
  // --------------------------------------------------------------------------

  /**
   * Sign bit of a value read as two's complement.
   *
   * @param backend word backend.
   * @param value any value; its type's width locates the sign bit.
   * @return word holding 1 for negative and 0 for non-negative.
   */
  static SecretWord signBit(final WordBackend backend, final WideValue value) {
    // narrow limbs are canonical, nothing sits above the sign bit
    return backend.shr(value.topLimb(), LimbCodec.signBitInTopLimb(value.type()));
  }

  /**
   * Whether the secret value fits in its lowest limbs, i.e. every higher limb is zero.
   *
   * @param backend word backend.
   * @param value value to inspect, read as unsigned.
   * @param nLimbs number of low limbs allowed to be non-zero.
   * @return secret predicate.
   */
  public static SecretBool fitsInLimbs(
      final WordBackend backend, final WideValue value, final int nLimbs) {
    checkArgument(nLimbs >= 1 && nLimbs <= value.limbCount(), "Invalid limb count %s", nLimbs);
    SecretWord zero = word(backend, 0L);
    SecretWord fits = word(backend, 1L);
    for (int i = nLimbs; i < value.limbCount(); i++) {
      fits = backend.and(fits, backend.eq(value.limb(i), zero));
    }
    return SecretBool.of(fits);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Splitting and widening
  // --------------------------------------------------------------------------

  /**
   * Lower half of a multi-limb value, as the unsigned type of half the width.
   *
   * @param value value of 128 or 256 bits.
   * @return the low limbs.
   */
  static WideValue lowHalf(final WideValue value) {
    IntType half = halfType(value.type());
    SecretWord[] limbs = new SecretWord[half.limbCount()];
    System.arraycopy(value.limbs(), 0, limbs, 0, limbs.length);
    return WideValue.of(half, limbs);
  }

  /**
   * Upper half of a multi-limb value, as the unsigned type of half the width.
   *
   * @param value value of 128 or 256 bits.
   * @return the high limbs.
   */
  static WideValue highHalf(final WideValue value) {
    IntType half = halfType(value.type());
    SecretWord[] limbs = new SecretWord[half.limbCount()];
    System.arraycopy(value.limbs(), half.limbCount(), limbs, 0, limbs.length);
    return WideValue.of(half, limbs);
  }

  /**
   * Joins a low and a high half into a value of twice the width.
   *
   * @param type type of the result.
   * @param low low half.
   * @param high high half.
   * @return the joined value.
   */
  static WideValue join(final IntType type, final WideValue low, final WideValue high) {
    checkArgument(
        low.limbCount() + high.limbCount() == type.limbCount(), "Halves do not make a %s", type);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    System.arraycopy(low.limbs(), 0, limbs, 0, low.limbCount());
    System.arraycopy(high.limbs(), 0, limbs, low.limbCount(), high.limbCount());
    return WideValue.of(type, limbs);
  }

  /**
   * Zero-extends a value to a wider type.
   *
   * @param backend word backend.
   * @param value value to extend, read as unsigned.
   * @param type wider type.
   * @return value with zero upper limbs.
   */
  static WideValue zeroExtend(
      final WordBackend backend, final WideValue value, final IntType type) {
    checkArgument(type.limbCount() >= value.limbCount(), "%s is narrower than %s", type, value);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = i < value.limbCount() ? value.limb(i) : word(backend, 0L);
    }
    return WideValue.of(type, limbs);
  }

  private static IntType halfType(final IntType type) {
    checkArgument(type.limbCount() >= 2, "%s has a single limb", type);
    return IntType.of(type.bitWidth() / 2, false);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Type checks
  // --------------------------------------------------------------------------

  static IntType commonType(final WideValue a, final WideValue b) {
    checkArgument(a.type() == b.type(), "Mismatched operand types %s and %s", a.type(), b.type());
    return a.type();
  }

  // --------------------------------------------------------------------------
  // endregion
}
