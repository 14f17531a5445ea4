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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import org.apache.tuweni.bytes.Bytes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.WideValue;

public class ComparatorTest {
  private static final Bytes NETWORK_KEY = Bytes.fromHexString("0x636f6d70617261746f72");

  private final ClearTextWordBackend backend = new ClearTextWordBackend(NETWORK_KEY, new Random(2));
  private final WideIntegers ints = new WideIntegers(backend);

  private WideValue value(final BigInteger v, final IntType type) {
    return ints.setPublic(v, type);
  }

  private boolean reveal(final SecretBool b) {
    return SecretBools.decrypt(backend, b);
  }

  /**
   * Small and large magnitudes of both signs for each signed width: below and above 2^(w/2).
   *
   * @return (type, a, b) triples covering the four sign quadrants and both magnitude regimes.
   */
  static Stream<Arguments> signedQuadrants() {
    List<Arguments> cases = new ArrayList<>();
    for (int width : new int[] {8, 16, 32, 64, 128, 256}) {
      IntType type = IntType.of(width, true);
      BigInteger small = BigInteger.valueOf(3);
      BigInteger large = BigInteger.ONE.shiftLeft(width / 2).add(BigInteger.valueOf(5));
      List<BigInteger> values =
          List.of(
              small,
              large,
              small.negate(),
              large.negate(),
              type.maxValue(),
              type.minValue(),
              BigInteger.ZERO);
      for (BigInteger a : values) {
        for (BigInteger b : values) {
          cases.add(Arguments.of(type, a, b));
        }
      }
    }
    return cases.stream();
  }

  static Stream<Arguments> unsignedPairs() {
    List<Arguments> cases = new ArrayList<>();
    for (int width : new int[] {8, 16, 32, 64, 128, 256}) {
      IntType type = IntType.of(width, false);
      BigInteger small = BigInteger.valueOf(7);
      BigInteger large = BigInteger.ONE.shiftLeft(width - 1).add(BigInteger.ONE);
      List<BigInteger> values = List.of(BigInteger.ZERO, small, large, type.maxValue());
      for (BigInteger a : values) {
        for (BigInteger b : values) {
          cases.add(Arguments.of(type, a, b));
        }
      }
    }
    return cases.stream();
  }

  // region Ordering

  @ParameterizedTest
  @MethodSource("signedQuadrants")
  public void testSignedOrdering_matchesExact(
      final IntType type, final BigInteger a, final BigInteger b) {
    assertOrdering(type, a, b);
  }

  @ParameterizedTest
  @MethodSource("unsignedPairs")
  public void testUnsignedOrdering_matchesExact(
      final IntType type, final BigInteger a, final BigInteger b) {
    assertOrdering(type, a, b);
  }

  private void assertOrdering(final IntType type, final BigInteger a, final BigInteger b) {
    WideValue x = value(a, type);
    WideValue y = value(b, type);
    int cmp = a.compareTo(b);
    assertThat(reveal(ints.lt(x, y))).isEqualTo(cmp < 0);
    assertThat(reveal(ints.le(x, y))).isEqualTo(cmp <= 0);
    assertThat(reveal(ints.gt(x, y))).isEqualTo(cmp > 0);
    assertThat(reveal(ints.ge(x, y))).isEqualTo(cmp >= 0);
    assertThat(reveal(ints.eq(x, y))).isEqualTo(cmp == 0);
    assertThat(reveal(ints.ne(x, y))).isEqualTo(cmp != 0);
    assertThat(ints.decrypt(ints.min(x, y))).isEqualTo(a.min(b));
    assertThat(ints.decrypt(ints.max(x, y))).isEqualTo(a.max(b));
  }

  @Test
  public void testGt_int256LargeAgainstSmallPositive() {
    BigInteger k = new BigInteger("123456789");
    WideValue a = value(BigInteger.ONE.shiftLeft(200).add(k), IntType.INT256);
    WideValue b = value(k, IntType.INT256);
    assertThat(reveal(ints.gt(a, b))).isTrue();
    assertThat(reveal(ints.gt(b, a))).isFalse();
  }

  @Test
  public void testLt_sameBitsDifferentSignedness() {
    BigInteger allOnes = IntType.UINT128.maxValue();
    WideValue unsigned = value(allOnes, IntType.UINT128);
    WideValue one = value(BigInteger.ONE, IntType.UINT128);
    assertThat(reveal(ints.lt(unsigned, one))).isFalse();
    WideValue minusOne = unsigned.reinterpret(IntType.INT128);
    assertThat(reveal(ints.lt(minusOne, one.reinterpret(IntType.INT128)))).isTrue();
  }

  @Test
  public void testTrichotomy_randomValues() {
    for (int i = 0; i < 100; i++) {
      WideValue x = ints.random(IntType.INT256);
      WideValue y = i % 10 == 0 ? x : ints.random(IntType.INT256);
      int holding = 0;
      if (reveal(ints.lt(x, y))) holding++;
      if (reveal(ints.eq(x, y))) holding++;
      if (reveal(ints.gt(x, y))) holding++;
      assertThat(holding).isEqualTo(1);
      assertThat(reveal(ints.eq(y, x))).isEqualTo(reveal(ints.eq(x, y)));
    }
  }

  // endregion

  // region Equality

  @Test
  public void testEq_reflexive() {
    for (IntType type : IntType.values()) {
      WideValue x = ints.random(type);
      assertThat(reveal(ints.eq(x, x))).isTrue();
      assertThat(reveal(ints.ne(x, x))).isFalse();
    }
  }

  @Test
  public void testEq_differsOnlyInTopLimb() {
    WideValue a = value(BigInteger.ONE.shiftLeft(192), IntType.UINT256);
    WideValue b = value(BigInteger.ZERO, IntType.UINT256);
    assertThat(reveal(ints.eq(a, b))).isFalse();
    assertThat(reveal(ints.ne(a, b))).isTrue();
  }

  // endregion
}
