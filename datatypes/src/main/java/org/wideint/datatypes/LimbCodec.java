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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Plaintext codec between integers and little-endian 64-bit limb vectors.
 *
 * <p>Limbs hold the two's complement bit pattern of a value reduced modulo 2^width. For types
 * narrower than one limb the bits at and above the width are zero.
 */
public final class LimbCodec {
  // Fixed number of bytes per limb.
  private static final int N_BYTES_PER_LIMB = 8;

  private LimbCodec() {}

  // region Conversions
  // --------------------------------------------------------------------------

  /**
   * Splits an integer into limbs, wrapping it modulo 2^width first.
   *
   * @param value plaintext integer, any sign and magnitude.
   * @param type target type.
   * @return {@code type.limbCount()} little-endian limbs.
   */
  public static long[] toLimbs(final BigInteger value, final IntType type) {
    BigInteger reduced = value.mod(BigInteger.ONE.shiftLeft(type.bitWidth()));
    long[] limbs = new long[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = reduced.shiftRight(IntType.BITS_PER_LIMB * i).longValue();
    }
    return limbs;
  }

  /**
   * Reassembles limbs into an integer, reading the top bit as a sign for signed types.
   *
   * @param limbs little-endian limbs; bits above the width are ignored.
   * @param type type of the value.
   * @return the integer denoted by the limbs.
   */
  public static BigInteger fromLimbs(final long[] limbs, final IntType type) {
    checkArgument(
        limbs.length == type.limbCount(),
        "%s needs %s limbs but got %s",
        type,
        type.limbCount(),
        limbs.length);
    ByteBuffer buf =
        ByteBuffer.allocate(N_BYTES_PER_LIMB * limbs.length).order(ByteOrder.BIG_ENDIAN);
    for (int i = limbs.length - 1; i >= 0; i--) {
      long limb = limbs[i];
      if (i == limbs.length - 1) limb &= mask(type.bitWidth());
      buf.putLong(limb); // reverse order for little-endian limbs
    }
    BigInteger unsigned = new BigInteger(1, buf.array());
    if (type.isSigned() && unsigned.testBit(type.bitWidth() - 1)) {
      return unsigned.subtract(BigInteger.ONE.shiftLeft(type.bitWidth()));
    }
    return unsigned;
  }

  /**
   * Reduces an integer to the value a fixed-width type holds after wraparound.
   *
   * @param value exact mathematical result.
   * @param type target type.
   * @return value modulo 2^width, read with the type's signedness.
   */
  public static BigInteger truncate(final BigInteger value, final IntType type) {
    return fromLimbs(toLimbs(value, type), type);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Masks
  // --------------------------------------------------------------------------

  /**
   * Low-bits mask of a single limb.
   *
   * @param width number of significant bits, 64 or more meaning the whole limb.
   * @return mask with the low {@code min(width, 64)} bits set.
   */
  public static long mask(final int width) {
    return width >= IntType.BITS_PER_LIMB ? -1L : (1L << width) - 1;
  }

  /**
   * Mask of the significant bits of one limb of a type.
   *
   * @param type integer type.
   * @param index limb position.
   * @return all ones for full limbs, the width mask for narrow types.
   */
  public static long limbMask(final IntType type, final int index) {
    int remaining = type.bitWidth() - IntType.BITS_PER_LIMB * index;
    return mask(remaining);
  }

  /**
   * Position of the sign bit inside the top limb.
   *
   * @param type integer type.
   * @return bit index in {@code 0..63}.
   */
  public static int signBitInTopLimb(final IntType type) {
    return (type.bitWidth() - 1) % IntType.BITS_PER_LIMB;
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Magnitude
  // --------------------------------------------------------------------------

  /**
   * Number of limbs up to and including the most significant non-zero one.
   *
   * @param limbs little-endian limbs.
   * @return 0 for zero, otherwise the index of the top non-zero limb plus one.
   */
  public static int nSetLimbs(final long[] limbs) {
    int offset = limbs.length - 1;
    while ((offset >= 0) && (limbs[offset] == 0)) offset--;
    return offset + 1;
  }

  /**
   * Whether an unsigned limb vector fits in its lowest limbs.
   *
   * @param limbs little-endian limbs.
   * @param nLimbs number of low limbs allowed to be non-zero.
   * @return true if every limb at or above {@code nLimbs} is zero.
   */
  public static boolean fitsInLimbs(final long[] limbs, final int nLimbs) {
    return nSetLimbs(limbs) <= nLimbs;
  }

  // --------------------------------------------------------------------------
  // endregion
}
