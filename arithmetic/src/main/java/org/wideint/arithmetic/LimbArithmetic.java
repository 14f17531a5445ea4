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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/**
 * Fixed-width arithmetic composed from 64-bit backend words.
 *
 * <p>Results wrap modulo 2^width. Limbs are little-endian and carries ripple from limb 0 upwards,
 * so the calls along a carry chain are issued in limb order.
 */
public final class LimbArithmetic {
  private static final Logger LOG = LoggerFactory.getLogger(LimbArithmetic.class);

  // Mask of a 32-bit half word.
  private static final long MASK_32 = 0xFFFFFFFFL;

  private LimbArithmetic() {}

  /** A limb vector together with the carry (or borrow) out of its top limb. */
  static final class Carried {
    final WideValue value;
    final SecretWord carry;

    Carried(final WideValue value, final SecretWord carry) {
      this.value = value;
      this.carry = carry;
    }
  }

  // region Addition and subtraction
  // --------------------------------------------------------------------------

  public static WideValue add(final WordBackend backend, final WideValue a, final WideValue b) {
    return addWithCarry(backend, a, b).value;
  }

  /**
   * Subtraction. Signed values are subtracted as {@code a + negate(b)}, unsigned ones with a
   * borrow chain; both wrap to the same bits.
   *
   * @param backend word backend.
   * @param a minuend.
   * @param b subtrahend, same type as {@code a}.
   * @return {@code (a - b) mod 2^width}.
   */
  public static WideValue sub(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    if (type.isSigned()) return add(backend, a, negate(backend, b));
    return subWithBorrow(backend, a, b).value;
  }

  /**
   * Two's complement negation: bitwise NOT then plus one.
   *
   * @param backend word backend.
   * @param a value to negate.
   * @return {@code (2^width - a) mod 2^width}, typed as {@code a}.
   */
  public static WideValue negate(final WordBackend backend, final WideValue a) {
    IntType type = a.type();
    SecretWord[] inverted = new SecretWord[a.limbCount()];
    for (int i = 0; i < inverted.length; i++) {
      inverted[i] = LimbVectors.not(backend, type, i, a.limb(i));
    }
    WideValue one = LimbVectors.constant(backend, type, BigInteger.ONE);
    return add(backend, WideValue.of(type, inverted), one);
  }

  /**
   * Ripple-carry addition.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand.
   * @return the wrapped sum and the carry out of bit {@code width - 1}.
   */
  static Carried addWithCarry(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    if (type.isNarrow()) {
      SecretWord raw = backend.add(a.limb(0), b.limb(0));
      SecretWord spill = backend.shr(raw, type.bitWidth());
      SecretWord carry = backend.ne(spill, LimbVectors.word(backend, 0L));
      return new Carried(WideValue.of(type, LimbVectors.canonical(backend, type, raw)), carry);
    }
    SecretWord[] sum = new SecretWord[type.limbCount()];
    SecretWord carry = null;
    for (int i = 0; i < sum.length; i++) {
      SecretWord s = backend.add(a.limb(i), b.limb(i));
      SecretWord c = backend.lt(s, a.limb(i));
      if (carry != null) {
        SecretWord partial = s;
        s = backend.add(partial, carry);
        c = backend.or(c, backend.lt(s, partial));
      }
      sum[i] = s;
      carry = c;
    }
    return new Carried(WideValue.of(type, sum), carry);
  }

  /**
   * Ripple-borrow subtraction.
   *
   * @param backend word backend.
   * @param a minuend.
   * @param b subtrahend.
   * @return the wrapped difference and the borrow out of the top limb, i.e. unsigned {@code a <
   *     b}.
   */
  static Carried subWithBorrow(final WordBackend backend, final WideValue a, final WideValue b) {
    IntType type = LimbVectors.commonType(a, b);
    SecretWord[] diff = new SecretWord[type.limbCount()];
    SecretWord borrow = null;
    for (int i = 0; i < diff.length; i++) {
      SecretWord d = backend.sub(a.limb(i), b.limb(i));
      SecretWord o = backend.lt(a.limb(i), b.limb(i));
      if (borrow != null) {
        SecretWord partial = d;
        d = backend.sub(partial, borrow);
        o = backend.or(o, backend.lt(partial, borrow));
      }
      diff[i] = LimbVectors.canonical(backend, type, d);
      borrow = o;
    }
    return new Carried(WideValue.of(type, diff), borrow);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Multiplication
  // --------------------------------------------------------------------------

  public static WideValue mul(final WordBackend backend, final WideValue a, final WideValue b) {
    return mul(backend, Operand.secret(a), Operand.secret(b));
  }

  /**
   * Schoolbook multiplication truncated to the operands' width.
   *
   * <p>Public operands are injected limb by limb; their zero limbs contribute no partial product.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand.
   * @return {@code (a * b) mod 2^width}.
   */
  public static WideValue mul(final WordBackend backend, final Operand a, final Operand b) {
    IntType type = checkOperands(a, b);
    if (type.isNarrow()) {
      SecretWord raw = backend.mul(limbOf(backend, a, 0), limbOf(backend, b, 0));
      return WideValue.of(type, LimbVectors.canonical(backend, type, raw));
    }
    return WideValue.of(type, multiplyAccumulate(backend, a, b, type.limbCount()));
  }

  /**
   * Full double-width product of two full-limb values, read as unsigned.
   *
   * @param backend word backend.
   * @param a left operand, 64 bits or wider.
   * @param b right operand.
   * @return the {@code 2 * limbCount} limbs of {@code a * b}.
   */
  static SecretWord[] fullProduct(final WordBackend backend, final Operand a, final Operand b) {
    IntType type = checkOperands(a, b);
    checkArgument(!type.isNarrow(), "%s fits in one limb product", type);
    return multiplyAccumulate(backend, a, b, 2 * type.limbCount());
  }

  static IntType checkOperands(final Operand a, final Operand b) {
    checkArgument(a.type() == b.type(), "Mismatched operand types %s and %s", a.type(), b.type());
    checkArgument(
        a.visibility() == Operand.Visibility.SECRET || b.visibility() == Operand.Visibility.SECRET,
        "At least one operand must be secret");
    return a.type();
  }

  private static SecretWord[] multiplyAccumulate(
      final WordBackend backend, final Operand a, final Operand b, final int outLimbs) {
    int n = a.type().limbCount();
    SecretWord[] aLimbs = limbsOf(backend, a);
    SecretWord[] bLimbs = limbsOf(backend, b);
    // null entries are known zeros
    SecretWord[] acc = new SecretWord[outLimbs];

    for (int i = 0; i < n && i < outLimbs; i++) {
      if (aLimbs[i] == null) continue;
      SecretWord carry = null;
      int k = i;
      for (int j = 0; j < n && k < outLimbs; j++, k++) {
        boolean last = k == outLimbs - 1;
        SecretWord lo = null;
        SecretWord hi = null;
        if (bLimbs[j] != null) {
          if (last) {
            lo = backend.mul(aLimbs[i], bLimbs[j]);
          } else {
            SecretWord[] wide = mulWide(backend, aLimbs[i], bLimbs[j]);
            lo = wide[0];
            hi = wide[1];
          }
        }
        // t = lo + acc[k] + carry, with the bits above 64 going to the next column
        SecretWord sum = lo;
        SecretWord next = hi;
        for (SecretWord term : new SecretWord[] {acc[k], carry}) {
          if (term == null) continue;
          if (sum == null) {
            sum = term;
            continue;
          }
          SecretWord partial = backend.add(sum, term);
          if (!last) {
            SecretWord overflow = backend.lt(partial, sum);
            next = next == null ? overflow : backend.add(next, overflow);
          }
          sum = partial;
        }
        acc[k] = sum;
        carry = next;
      }
      if (k < outLimbs) acc[k] = carry;
    }

    SecretWord zero = null;
    for (int k = 0; k < outLimbs; k++) {
      if (acc[k] == null) {
        if (zero == null) zero = LimbVectors.word(backend, 0L);
        acc[k] = zero;
      }
    }
    return acc;
  }

  /**
   * Full 64x64 to 128-bit product from 32-bit half words.
   *
   * @param backend word backend.
   * @param a left word.
   * @param b right word.
   * @return the low and high words of the unsigned product.
   */
  static SecretWord[] mulWide(final WordBackend backend, final SecretWord a, final SecretWord b) {
    SecretWord mask = LimbVectors.word(backend, MASK_32);
    SecretWord a0 = backend.and(a, mask);
    SecretWord a1 = backend.shr(a, 32);
    SecretWord b0 = backend.and(b, mask);
    SecretWord b1 = backend.shr(b, 32);

    SecretWord p00 = backend.mul(a0, b0);
    SecretWord p01 = backend.mul(a0, b1);
    SecretWord p10 = backend.mul(a1, b0);
    SecretWord p11 = backend.mul(a1, b1);

    SecretWord mid =
        backend.add(
            backend.add(backend.shr(p00, 32), backend.and(p01, mask)), backend.and(p10, mask));
    SecretWord lo = backend.or(backend.and(p00, mask), backend.shl(mid, 32));
    SecretWord hi =
        backend.add(
            backend.add(p11, backend.shr(p01, 32)),
            backend.add(backend.shr(p10, 32), backend.shr(mid, 32)));
    return new SecretWord[] {lo, hi};
  }

  private static SecretWord[] limbsOf(final WordBackend backend, final Operand operand) {
    SecretWord[] limbs = new SecretWord[operand.type().limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = operand.isKnownZeroLimb(i) ? null : limbOf(backend, operand, i);
    }
    return limbs;
  }

  private static SecretWord limbOf(final WordBackend backend, final Operand operand, final int i) {
    switch (operand.visibility()) {
      case SECRET:
        return operand.secretValue().limb(i);
      case PUBLIC:
        return LimbVectors.word(backend, operand.plainLimb(i));
      default:
        throw new IllegalStateException("Unknown visibility " + operand.visibility());
    }
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Division
  // --------------------------------------------------------------------------

  /**
   * Quotient, truncated toward zero for signed types.
   *
   * <p>Up to 64 bits this is one backend division and a zero divisor throws. At 128 bits values
   * that need their high limb are divided by {@link RevealingDivision}, where a zero divisor yields
   * zero. At 256 bits every division goes through {@link RevealingDivision} and only the low 128
   * bits of the quotient are kept.
   *
   * @param backend word backend.
   * @param config division policy.
   * @param a dividend.
   * @param b divisor, same type as {@code a}.
   * @return the quotient.
   * @throws org.wideint.datatypes.DivisionByZeroException on the exact path with a zero divisor.
   */
  public static WideValue div(
      final WordBackend backend, final WideIntConfig config, final WideValue a, final WideValue b) {
    return divide(backend, config, a, b, false);
  }

  /**
   * Remainder, taking the sign of the dividend for signed types. Follows the same width regimes
   * as {@link #div(WordBackend, WideIntConfig, WideValue, WideValue)}.
   *
   * @param backend word backend.
   * @param config division policy.
   * @param a dividend.
   * @param b divisor, same type as {@code a}.
   * @return the remainder.
   */
  public static WideValue rem(
      final WordBackend backend, final WideIntConfig config, final WideValue a, final WideValue b) {
    return divide(backend, config, a, b, true);
  }

  private static WideValue divide(
      final WordBackend backend,
      final WideIntConfig config,
      final WideValue a,
      final WideValue b,
      final boolean remainder) {
    IntType type = LimbVectors.commonType(a, b);
    if (!type.isSigned()) return divideUnsigned(backend, config, a, b, remainder);

    IntType unsigned = type.withSignedness(false);
    SecretWord signA = LimbVectors.signBit(backend, a);
    SecretWord signB = LimbVectors.signBit(backend, b);
    WideValue magA = magnitude(backend, a, signA).reinterpret(unsigned);
    WideValue magB = magnitude(backend, b, signB).reinterpret(unsigned);
    WideValue result = divideUnsigned(backend, config, magA, magB, remainder);
    // the remainder follows the dividend, the quotient is negative when the signs differ
    SecretWord negative = remainder ? signA : backend.xor(signA, signB);
    return Selector.select(backend, SecretBool.of(negative), negate(backend, result), result)
        .reinterpret(type);
  }

  private static WideValue magnitude(
      final WordBackend backend, final WideValue value, final SecretWord sign) {
    return Selector.select(backend, SecretBool.of(sign), negate(backend, value), value);
  }

  private static WideValue divideUnsigned(
      final WordBackend backend,
      final WideIntConfig config,
      final WideValue a,
      final WideValue b,
      final boolean remainder) {
    IntType type = a.type();
    switch (type.limbCount()) {
      case 1:
        SecretWord word =
            remainder ? backend.rem(a.limb(0), b.limb(0)) : backend.div(a.limb(0), b.limb(0));
        return WideValue.of(type, word);
      case 2:
        return divide128(backend, config, a, b, remainder);
      default:
        WideValue full = RevealingDivision.divide(backend, config, a, b, remainder);
        return truncateToLowHalf(backend, full);
    }
  }

  private static WideValue divide128(
      final WordBackend backend,
      final WideIntConfig config,
      final WideValue a,
      final WideValue b,
      final boolean remainder) {
    boolean dividendFits = backend.decrypt(LimbVectors.fitsInLimbs(backend, a, 1).word()) == 1L;
    boolean divisorFits = backend.decrypt(LimbVectors.fitsInLimbs(backend, b, 1).word()) == 1L;
    if (dividendFits && divisorFits) {
      LOG.trace("128-bit division on single limbs");
      SecretWord low =
          remainder ? backend.rem(a.limb(0), b.limb(0)) : backend.div(a.limb(0), b.limb(0));
      return LimbVectors.zeroExtend(backend, WideValue.of(IntType.UINT64, low), a.type());
    }
    if (dividendFits) {
      // divisor >= 2^64 > dividend
      LOG.trace("128-bit division with divisor above dividend");
      return remainder ? a : LimbVectors.zero(backend, a.type());
    }
    LOG.trace("128-bit division on a dividend wider than one limb");
    return RevealingDivision.divide(backend, config, a, b, remainder);
  }

  private static WideValue truncateToLowHalf(final WordBackend backend, final WideValue value) {
    WideValue low = LimbVectors.lowHalf(value);
    return LimbVectors.zeroExtend(backend, low, value.type());
  }

  // --------------------------------------------------------------------------
  // endregion
}
