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

import java.math.BigInteger;

import org.wideint.datatypes.ArithmeticOverflowException;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/**
 * Arithmetic that detects results outside the range of the operands' type.
 *
 * <p>The {@code WithOverflowBit} variants return the wrapped result with a secret flag and never
 * fail. The plain variants decrypt the flag and throw {@link ArithmeticOverflowException} when it
 * is set.
 */
public final class CheckedArithmetic {

  private CheckedArithmetic() {}

  // region Flag returning
  // --------------------------------------------------------------------------

  /**
   * Addition with overflow flag: the carry out for unsigned types, for signed types operands of
   * the same sign giving a result of the other sign.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand.
   * @return wrapped sum and overflow flag.
   */
  public static OverflowResult addWithOverflowBit(
      final WordBackend backend, final WideValue a, final WideValue b) {
    LimbArithmetic.Carried sum = LimbArithmetic.addWithCarry(backend, a, b);
    if (!a.type().isSigned()) return OverflowResult.of(sum.value, SecretBool.of(sum.carry));
    SecretWord signA = LimbVectors.signBit(backend, a);
    SecretWord signB = LimbVectors.signBit(backend, b);
    SecretWord signR = LimbVectors.signBit(backend, sum.value);
    SecretWord overflow = backend.and(backend.eq(signA, signB), backend.ne(signR, signA));
    return OverflowResult.of(sum.value, SecretBool.of(overflow));
  }

  /**
   * Subtraction with overflow flag: the borrow out for unsigned types, for signed types operands
   * of different signs giving a result whose sign differs from the minuend.
   *
   * @param backend word backend.
   * @param a minuend.
   * @param b subtrahend.
   * @return wrapped difference and overflow flag.
   */
  public static OverflowResult subWithOverflowBit(
      final WordBackend backend, final WideValue a, final WideValue b) {
    if (!LimbVectors.commonType(a, b).isSigned()) {
      LimbArithmetic.Carried diff = LimbArithmetic.subWithBorrow(backend, a, b);
      return OverflowResult.of(diff.value, SecretBool.of(diff.carry));
    }
    WideValue diff = LimbArithmetic.sub(backend, a, b);
    SecretWord signA = LimbVectors.signBit(backend, a);
    SecretWord signB = LimbVectors.signBit(backend, b);
    SecretWord signR = LimbVectors.signBit(backend, diff);
    SecretWord overflow = backend.and(backend.ne(signA, signB), backend.ne(signR, signA));
    return OverflowResult.of(diff, SecretBool.of(overflow));
  }

  /**
   * Multiplication with overflow flag, set when the exact product needs bits beyond the type.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand.
   * @return wrapped product and overflow flag.
   */
  public static OverflowResult mulWithOverflowBit(
      final WordBackend backend, final Operand a, final Operand b) {
    IntType type = LimbArithmetic.checkOperands(a, b);
    if (!type.isSigned()) return unsignedProduct(backend, a, b);

    // multiply magnitudes, then restore the sign
    IntType unsigned = type.withSignedness(false);
    SecretWord signA = signOf(backend, a);
    SecretWord signB = signOf(backend, b);
    SecretWord negative = backend.xor(signA, signB);
    OverflowResult magnitude =
        unsignedProduct(backend, magnitudeOf(backend, a, signA), magnitudeOf(backend, b, signB));

    // |result| may reach 2^(w-1) only when the result is negative
    WideValue low = magnitude.value();
    BigInteger positiveLimit = type.maxValue();
    BigInteger negativeLimit = positiveLimit.add(BigInteger.ONE);
    SecretBool abovePositive =
        LimbComparator.gt(backend, low, LimbVectors.constant(backend, unsigned, positiveLimit));
    SecretBool aboveNegative =
        LimbComparator.gt(backend, low, LimbVectors.constant(backend, unsigned, negativeLimit));
    SecretWord outOfRange = backend.mux(negative, aboveNegative.word(), abovePositive.word());
    SecretWord overflow = backend.or(magnitude.overflow().word(), outOfRange);

    WideValue negated = LimbArithmetic.negate(backend, low);
    WideValue value =
        Selector.select(backend, SecretBool.of(negative), negated, low).reinterpret(type);
    return OverflowResult.of(value, SecretBool.of(overflow));
  }

  private static OverflowResult unsignedProduct(
      final WordBackend backend, final Operand a, final Operand b) {
    IntType type = a.type();
    SecretWord zero = LimbVectors.word(backend, 0L);
    if (type.isNarrow()) {
      // the full product of two narrow limbs fits in one word
      SecretWord raw = backend.mul(a.materialize(backend).limb(0), b.materialize(backend).limb(0));
      SecretWord high = backend.ne(backend.shr(raw, type.bitWidth()), zero);
      return OverflowResult.of(
          WideValue.of(type, LimbVectors.canonical(backend, type, raw)), SecretBool.of(high));
    }
    SecretWord[] product = LimbArithmetic.fullProduct(backend, a, b);
    int n = type.limbCount();
    SecretWord[] low = new SecretWord[n];
    System.arraycopy(product, 0, low, 0, n);
    SecretWord high = backend.ne(product[n], zero);
    for (int k = n + 1; k < product.length; k++) {
      high = backend.or(high, backend.ne(product[k], zero));
    }
    return OverflowResult.of(WideValue.of(type, low), SecretBool.of(high));
  }

  private static SecretWord signOf(final WordBackend backend, final Operand operand) {
    switch (operand.visibility()) {
      case SECRET:
        return LimbVectors.signBit(backend, operand.secretValue());
      case PUBLIC:
        return LimbVectors.word(backend, operand.plainValue().signum() < 0 ? 1L : 0L);
      default:
        throw new IllegalStateException("Unknown visibility " + operand.visibility());
    }
  }

  private static Operand magnitudeOf(
      final WordBackend backend, final Operand operand, final SecretWord sign) {
    IntType unsigned = operand.type().withSignedness(false);
    switch (operand.visibility()) {
      case SECRET:
        WideValue value = operand.secretValue();
        WideValue abs =
            Selector.select(
                backend, SecretBool.of(sign), LimbArithmetic.negate(backend, value), value);
        return Operand.secret(abs.reinterpret(unsigned));
      case PUBLIC:
        return Operand.plain(unsigned, operand.plainValue().abs());
      default:
        throw new IllegalStateException("Unknown visibility " + operand.visibility());
    }
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Hard failing
  // --------------------------------------------------------------------------

  public static WideValue add(final WordBackend backend, final WideValue a, final WideValue b) {
    return requireNoOverflow(backend, addWithOverflowBit(backend, a, b), "addition");
  }

  public static WideValue sub(final WordBackend backend, final WideValue a, final WideValue b) {
    return requireNoOverflow(backend, subWithOverflowBit(backend, a, b), "subtraction");
  }

  public static WideValue mul(final WordBackend backend, final Operand a, final Operand b) {
    return requireNoOverflow(backend, mulWithOverflowBit(backend, a, b), "multiplication");
  }

  private static WideValue requireNoOverflow(
      final WordBackend backend, final OverflowResult result, final String operation) {
    if (backend.decrypt(result.overflow().word()) != 0L) {
      throw new ArithmeticOverflowException(
          "Checked " + operation + " overflows " + result.value().type());
    }
    return result.value();
  }

  // --------------------------------------------------------------------------
  // endregion
}
