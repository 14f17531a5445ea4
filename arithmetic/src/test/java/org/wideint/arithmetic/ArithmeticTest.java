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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.util.Random;

import org.apache.tuweni.bytes.Bytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

public class ArithmeticTest {
  private static final Bytes NETWORK_KEY =
      Bytes.fromHexString("0x6b65792d666f722d61726974686d657469632d74657374730000000000000001");
  private static final BigInteger TWO_64 = BigInteger.ONE.shiftLeft(64);
  private static final BigInteger TWO_128 = BigInteger.ONE.shiftLeft(128);

  private final ClearTextWordBackend backend = new ClearTextWordBackend(NETWORK_KEY, new Random(1));
  private final WideIntegers ints = new WideIntegers(backend);

  private WideValue value(final BigInteger v, final IntType type) {
    return ints.setPublic(v, type);
  }

  private WideValue value(final long v, final IntType type) {
    return value(BigInteger.valueOf(v), type);
  }

  // region Addition

  @Test
  public void testAdd_uint8Wraps() {
    WideValue sum = ints.add(value(200, IntType.UINT8), value(100, IntType.UINT8));
    assertThat(ints.decrypt(sum)).isEqualTo(BigInteger.valueOf(44));
  }

  @Test
  public void testAdd_narrowLimbStaysCanonical() {
    WideValue sum = ints.add(value(200, IntType.UINT8), value(100, IntType.UINT8));
    assertThat(backend.decrypt(sum.limb(0))).isEqualTo(44L);
  }

  @Test
  public void testAdd_int64InRange() {
    WideValue sum =
        ints.add(value(-8_000_000_000L, IntType.INT64), value(3_000_000_000L, IntType.INT64));
    assertThat(ints.decrypt(sum)).isEqualTo(BigInteger.valueOf(-5_000_000_000L));
  }

  @Test
  public void testAdd_carryCrossesLimb() {
    WideValue a = value(TWO_64.subtract(BigInteger.ONE), IntType.UINT128);
    WideValue sum = ints.add(a, value(1, IntType.UINT128));
    assertThat(ints.decrypt(sum)).isEqualTo(TWO_64);
  }

  @Test
  public void testAdd_carryRipplesThroughAllLimbs() {
    BigInteger a = BigInteger.ONE.shiftLeft(192).subtract(BigInteger.ONE);
    WideValue sum = ints.add(value(a, IntType.UINT256), value(1, IntType.UINT256));
    assertThat(ints.decrypt(sum)).isEqualTo(BigInteger.ONE.shiftLeft(192));
  }

  @ParameterizedTest
  @EnumSource(
      value = IntType.class,
      names = {"UINT8", "UINT16", "UINT32", "UINT64", "UINT128", "UINT256"})
  public void testAdd_maxPlusOneIsZero(final IntType type) {
    WideValue sum = ints.add(value(type.maxValue(), type), value(1, type));
    assertThat(ints.decrypt(sum)).isEqualTo(BigInteger.ZERO);
  }

  @ParameterizedTest
  @EnumSource(
      value = IntType.class,
      names = {"INT8", "INT16", "INT32", "INT64", "INT128", "INT256"})
  public void testAdd_signedMaxPlusOneIsMin(final IntType type) {
    WideValue sum = ints.add(value(type.maxValue(), type), value(1, type));
    assertThat(ints.decrypt(sum)).isEqualTo(type.minValue());
  }

  // endregion

  // region Subtraction and negation

  @Test
  public void testSub_uint8Wraps() {
    WideValue diff = ints.sub(value(30, IntType.UINT8), value(100, IntType.UINT8));
    assertThat(ints.decrypt(diff)).isEqualTo(BigInteger.valueOf(186));
  }

  @Test
  public void testSub_borrowCrossesLimb() {
    WideValue diff = ints.sub(value(TWO_64, IntType.UINT128), value(1, IntType.UINT128));
    assertThat(ints.decrypt(diff)).isEqualTo(TWO_64.subtract(BigInteger.ONE));
  }

  @Test
  public void testSub_zeroMinusOneIsMax() {
    WideValue diff = ints.sub(value(0, IntType.UINT256), value(1, IntType.UINT256));
    assertThat(ints.decrypt(diff)).isEqualTo(IntType.UINT256.maxValue());
  }

  @Test
  public void testSub_int256MinMinusMax() {
    IntType type = IntType.INT256;
    WideValue diff = ints.sub(value(type.minValue(), type), value(type.maxValue(), type));
    BigInteger exact = type.minValue().subtract(type.maxValue());
    assertThat(ints.decrypt(diff)).isEqualTo(BigInteger.ONE);
    assertThat(exact.mod(BigInteger.ONE.shiftLeft(256))).isEqualTo(BigInteger.ONE);
  }

  @Test
  public void testSub_int16Negative() {
    WideValue diff = ints.sub(value(-300, IntType.INT16), value(500, IntType.INT16));
    assertThat(ints.decrypt(diff)).isEqualTo(BigInteger.valueOf(-800));
  }

  @Test
  public void testNegate() {
    assertThat(ints.decrypt(ints.negate(value(5, IntType.INT128))))
        .isEqualTo(BigInteger.valueOf(-5));
    assertThat(ints.decrypt(ints.negate(value(1, IntType.UINT16))))
        .isEqualTo(BigInteger.valueOf(65535));
    assertThat(ints.decrypt(ints.negate(value(0, IntType.UINT256)))).isEqualTo(BigInteger.ZERO);
  }

  @ParameterizedTest
  @EnumSource(
      value = IntType.class,
      names = {"INT8", "INT16", "INT32", "INT64", "INT128", "INT256"})
  public void testNegate_minIsMin(final IntType type) {
    WideValue negated = ints.negate(value(type.minValue(), type));
    assertThat(ints.decrypt(negated)).isEqualTo(type.minValue());
  }

  // endregion

  // region Multiplication

  @Test
  public void testMul_uint256Wraps() {
    WideValue a = value(TWO_128, IntType.UINT256);
    assertThat(ints.decrypt(ints.mul(a, a))).isEqualTo(BigInteger.ZERO);
  }

  @Test
  public void testMul_uint32Wraps() {
    WideValue a = value(0xFFFF_FFFFL, IntType.UINT32);
    assertThat(ints.decrypt(ints.mul(a, a))).isEqualTo(BigInteger.ONE);
  }

  @Test
  public void testMul_uint128PartialProductsCarry() {
    BigInteger max64 = TWO_64.subtract(BigInteger.ONE);
    BigInteger a = max64.multiply(TWO_64).add(max64);
    WideValue product = ints.mul(value(a, IntType.UINT128), value(a, IntType.UINT128));
    assertThat(ints.decrypt(product)).isEqualTo(a.multiply(a).mod(TWO_128));
  }

  @Test
  public void testMul_signed() {
    assertThat(ints.decrypt(ints.mul(value(-3, IntType.INT64), value(7, IntType.INT64))))
        .isEqualTo(BigInteger.valueOf(-21));
    assertThat(ints.decrypt(ints.mul(value(-12, IntType.INT8), value(-10, IntType.INT8))))
        .isEqualTo(BigInteger.valueOf(120));
    BigInteger a = BigInteger.ONE.shiftLeft(100).negate();
    BigInteger b = BigInteger.ONE.shiftLeft(100).add(BigInteger.TWO);
    WideValue product = ints.mul(value(a, IntType.INT256), value(b, IntType.INT256));
    assertThat(ints.decrypt(product)).isEqualTo(a.multiply(b));
  }

  @Test
  public void testMul_callingConventionsAgree() {
    BigInteger a = new BigInteger("123456789012345678901234567890");
    BigInteger b = new BigInteger("98765432109876543210");
    IntType type = IntType.UINT256;
    BigInteger expected = a.multiply(b);

    WideValue secretA = value(a, type);
    WideValue secretB = value(b, type);
    assertThat(ints.decrypt(ints.mul(secretA, secretB))).isEqualTo(expected);
    assertThat(ints.decrypt(ints.mulLhs(a, secretB))).isEqualTo(expected);
    assertThat(ints.decrypt(ints.mulRhs(secretA, b))).isEqualTo(expected);
    assertThat(ints.decrypt(ints.mul(Operand.plain(type, a), Operand.secret(secretB))))
        .isEqualTo(expected);
  }

  @Test
  public void testMul_publicZeroLimbsSkipPartialProducts() {
    CountingWordBackend counting = new CountingWordBackend(backend);
    WideIntegers counted = new WideIntegers(counting);
    WideValue a = value(IntType.UINT256.maxValue(), IntType.UINT256);

    counted.mul(a, value(3, IntType.UINT256));
    int secretMuls = counting.count("mul");
    counting.reset();
    WideValue product = counted.mulRhs(a, BigInteger.valueOf(3));
    int publicMuls = counting.count("mul");

    assertThat(publicMuls).isLessThan(secretMuls);
    assertThat(ints.decrypt(product))
        .isEqualTo(IntType.UINT256.maxValue().multiply(BigInteger.valueOf(3)).mod(TWO_128.pow(2)));
  }

  @Test
  public void testMul_rejectsTwoPublicOperands() {
    Operand a = Operand.plain(IntType.UINT64, BigInteger.TEN);
    assertThatThrownBy(() -> ints.mul(a, a)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testMul_rejectsMismatchedTypes() {
    assertThatThrownBy(() -> ints.mul(value(1, IntType.UINT64), value(1, IntType.INT64)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testMulWide_fullWords() {
    SecretWord max = backend.setPublic(-1L);
    SecretWord[] product = LimbArithmetic.mulWide(backend, max, max);
    assertThat(backend.decrypt(product[0])).isEqualTo(1L);
    assertThat(backend.decrypt(product[1])).isEqualTo(-2L);
  }

  @Test
  public void testMulWide_matchesMultiplyHigh() {
    Random random = new Random(11);
    for (int i = 0; i < 200; i++) {
      long x = random.nextLong();
      long y = random.nextLong();
      SecretWord[] product =
          LimbArithmetic.mulWide(backend, backend.setPublic(x), backend.setPublic(y));
      assertThat(backend.decrypt(product[0])).isEqualTo(x * y);
      // unsigned high word from the signed one
      long high = Math.multiplyHigh(x, y) + ((x >> 63) & y) + ((y >> 63) & x);
      assertThat(backend.decrypt(product[1])).isEqualTo(high);
    }
  }

  // endregion
}
