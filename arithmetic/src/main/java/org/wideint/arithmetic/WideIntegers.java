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

import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;

import org.apache.tuweni.bytes.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wideint.datatypes.CombinedCiphertext;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.WideCiphertext;
import org.wideint.datatypes.WideInputProof;
import org.wideint.datatypes.WideUserCiphertext;
import org.wideint.datatypes.WideValue;

/**
 * Entry point of the fixed-width secret integer operations, bound to one word backend.
 *
 * <p>Every operation is uniform across {@link IntType}s. Binary operations require both operands
 * to have the same type. The {@code Lhs} and {@code Rhs} variants take the named side as a public
 * constant; they change which backend calls are made, not the result.
 */
public class WideIntegers {
  private static final Logger LOG = LoggerFactory.getLogger(WideIntegers.class);

  private final WordBackend backend;
  private final WideIntConfig config;

  public WideIntegers(final WordBackend backend) {
    this(backend, WideIntConfig.DEFAULT);
  }

  /**
   * Binds the operations to a backend.
   *
   * @param backend word backend every operation calls.
   * @param config settings.
   */
  public WideIntegers(final WordBackend backend, final WideIntConfig config) {
    this.backend = checkNotNull(backend, "backend");
    this.config = checkNotNull(config, "config");
    LOG.debug("Wide integer operations on {} with {}", backend.getClass().getSimpleName(), config);
  }

  public WordBackend backend() {
    return backend;
  }

  public WideIntConfig config() {
    return config;
  }

  // region Arithmetic
  // --------------------------------------------------------------------------

  public WideValue add(final WideValue a, final WideValue b) {
    return LimbArithmetic.add(backend, a, b);
  }

  public WideValue sub(final WideValue a, final WideValue b) {
    return LimbArithmetic.sub(backend, a, b);
  }

  public WideValue negate(final WideValue a) {
    return LimbArithmetic.negate(backend, a);
  }

  public WideValue mul(final WideValue a, final WideValue b) {
    return LimbArithmetic.mul(backend, a, b);
  }

  public WideValue mul(final Operand a, final Operand b) {
    return LimbArithmetic.mul(backend, a, b);
  }

  public WideValue mulLhs(final BigInteger a, final WideValue b) {
    return mul(Operand.plain(b.type(), a), Operand.secret(b));
  }

  public WideValue mulRhs(final WideValue a, final BigInteger b) {
    return mul(Operand.secret(a), Operand.plain(a.type(), b));
  }

  /**
   * Division, truncating toward zero.
   *
   * @param a dividend.
   * @param b divisor.
   * @return the quotient.
   * @see LimbArithmetic#div(WordBackend, WideIntConfig, WideValue, WideValue)
   */
  public WideValue div(final WideValue a, final WideValue b) {
    return LimbArithmetic.div(backend, config, a, b);
  }

  public WideValue div(final Operand a, final Operand b) {
    LimbArithmetic.checkOperands(a, b);
    return div(a.materialize(backend), b.materialize(backend));
  }

  public WideValue divLhs(final BigInteger a, final WideValue b) {
    return div(Operand.plain(b.type(), a), Operand.secret(b));
  }

  public WideValue divRhs(final WideValue a, final BigInteger b) {
    return div(Operand.secret(a), Operand.plain(a.type(), b));
  }

  public WideValue rem(final WideValue a, final WideValue b) {
    return LimbArithmetic.rem(backend, config, a, b);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Checked arithmetic
  // --------------------------------------------------------------------------

  public WideValue checkedAdd(final WideValue a, final WideValue b) {
    return CheckedArithmetic.add(backend, a, b);
  }

  public WideValue checkedAddLhs(final BigInteger a, final WideValue b) {
    return checkedAdd(setPublic(a, b.type()), b);
  }

  public WideValue checkedAddRhs(final WideValue a, final BigInteger b) {
    return checkedAdd(a, setPublic(b, a.type()));
  }

  public WideValue checkedSub(final WideValue a, final WideValue b) {
    return CheckedArithmetic.sub(backend, a, b);
  }

  public WideValue checkedSubLhs(final BigInteger a, final WideValue b) {
    return checkedSub(setPublic(a, b.type()), b);
  }

  public WideValue checkedSubRhs(final WideValue a, final BigInteger b) {
    return checkedSub(a, setPublic(b, a.type()));
  }

  public WideValue checkedMul(final WideValue a, final WideValue b) {
    return CheckedArithmetic.mul(backend, Operand.secret(a), Operand.secret(b));
  }

  public WideValue checkedMulLhs(final BigInteger a, final WideValue b) {
    return CheckedArithmetic.mul(backend, Operand.plain(b.type(), a), Operand.secret(b));
  }

  public WideValue checkedMulRhs(final WideValue a, final BigInteger b) {
    return CheckedArithmetic.mul(backend, Operand.secret(a), Operand.plain(a.type(), b));
  }

  public OverflowResult checkedAddWithOverflowBit(final WideValue a, final WideValue b) {
    return CheckedArithmetic.addWithOverflowBit(backend, a, b);
  }

  public OverflowResult checkedAddWithOverflowBitLhs(final BigInteger a, final WideValue b) {
    return checkedAddWithOverflowBit(setPublic(a, b.type()), b);
  }

  public OverflowResult checkedAddWithOverflowBitRhs(final WideValue a, final BigInteger b) {
    return checkedAddWithOverflowBit(a, setPublic(b, a.type()));
  }

  public OverflowResult checkedSubWithOverflowBit(final WideValue a, final WideValue b) {
    return CheckedArithmetic.subWithOverflowBit(backend, a, b);
  }

  public OverflowResult checkedSubWithOverflowBitLhs(final BigInteger a, final WideValue b) {
    return checkedSubWithOverflowBit(setPublic(a, b.type()), b);
  }

  public OverflowResult checkedSubWithOverflowBitRhs(final WideValue a, final BigInteger b) {
    return checkedSubWithOverflowBit(a, setPublic(b, a.type()));
  }

  public OverflowResult checkedMulWithOverflowBit(final WideValue a, final WideValue b) {
    return CheckedArithmetic.mulWithOverflowBit(backend, Operand.secret(a), Operand.secret(b));
  }

  public OverflowResult checkedMulWithOverflowBitLhs(final BigInteger a, final WideValue b) {
    return CheckedArithmetic.mulWithOverflowBit(
        backend, Operand.plain(b.type(), a), Operand.secret(b));
  }

  public OverflowResult checkedMulWithOverflowBitRhs(final WideValue a, final BigInteger b) {
    return CheckedArithmetic.mulWithOverflowBit(
        backend, Operand.secret(a), Operand.plain(a.type(), b));
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Bitwise and shifts
  // --------------------------------------------------------------------------

  public WideValue and(final WideValue a, final WideValue b) {
    return LimbBitwise.and(backend, a, b);
  }

  public WideValue or(final WideValue a, final WideValue b) {
    return LimbBitwise.or(backend, a, b);
  }

  public WideValue xor(final WideValue a, final WideValue b) {
    return LimbBitwise.xor(backend, a, b);
  }

  public WideValue not(final WideValue a) {
    return LimbBitwise.not(backend, a);
  }

  public WideValue shl(final WideValue a, final int shift) {
    return LimbBitwise.shl(backend, a, shift);
  }

  public WideValue shr(final WideValue a, final int shift) {
    return LimbBitwise.shr(backend, a, shift);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Comparisons and selection
  // --------------------------------------------------------------------------

  public SecretBool eq(final WideValue a, final WideValue b) {
    return LimbComparator.eq(backend, a, b);
  }

  public SecretBool ne(final WideValue a, final WideValue b) {
    return LimbComparator.ne(backend, a, b);
  }

  public SecretBool lt(final WideValue a, final WideValue b) {
    return LimbComparator.lt(backend, a, b);
  }

  public SecretBool le(final WideValue a, final WideValue b) {
    return LimbComparator.le(backend, a, b);
  }

  public SecretBool gt(final WideValue a, final WideValue b) {
    return LimbComparator.gt(backend, a, b);
  }

  public SecretBool ge(final WideValue a, final WideValue b) {
    return LimbComparator.ge(backend, a, b);
  }

  public WideValue min(final WideValue a, final WideValue b) {
    return LimbComparator.min(backend, a, b);
  }

  public WideValue max(final WideValue a, final WideValue b) {
    return LimbComparator.max(backend, a, b);
  }

  public WideValue select(final SecretBool cond, final WideValue a, final WideValue b) {
    return Selector.select(backend, cond, a, b);
  }

  public WideValue mux(final SecretBool cond, final WideValue a, final WideValue b) {
    return select(cond, a, b);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Boundary
  // --------------------------------------------------------------------------

  public WideValue validateCiphertext(final WideInputProof proof) {
    return Boundary.validateCiphertext(backend, proof);
  }

  public WideValue setPublic(final BigInteger value, final IntType type) {
    return Boundary.setPublic(backend, value, type);
  }

  public BigInteger decrypt(final WideValue value) {
    return Boundary.decrypt(backend, value);
  }

  public WideValue random(final IntType type) {
    return Boundary.random(backend, type);
  }

  public WideValue randomBounded(final IntType type, final int bits) {
    return Boundary.randomBounded(backend, type, bits);
  }

  public WideValue onboard(final WideCiphertext ciphertext) {
    return Boundary.onboard(backend, ciphertext);
  }

  public WideCiphertext offboard(final WideValue value) {
    return Boundary.offboard(backend, value);
  }

  public WideUserCiphertext offboardToUser(final WideValue value, final Bytes recipientKey) {
    return Boundary.offboardToUser(backend, value, recipientKey);
  }

  public CombinedCiphertext offboardCombined(final WideValue value, final Bytes recipientKey) {
    return Boundary.offboardCombined(backend, value, recipientKey);
  }

  // --------------------------------------------------------------------------
  // endregion
}
