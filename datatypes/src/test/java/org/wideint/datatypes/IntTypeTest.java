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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

public class IntTypeTest {

  @ParameterizedTest
  @ValueSource(ints = {8, 16, 32, 64, 128, 256})
  public void testOf_roundTripsWidthAndSign(final int width) {
    assertThat(IntType.of(width, false).bitWidth()).isEqualTo(width);
    assertThat(IntType.of(width, false).isSigned()).isFalse();
    assertThat(IntType.of(width, true).bitWidth()).isEqualTo(width);
    assertThat(IntType.of(width, true).isSigned()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 24, 512})
  public void testOf_rejectsUnsupportedWidth(final int width) {
    assertThatThrownBy(() -> IntType.of(width, false)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testLimbCount() {
    assertThat(IntType.UINT8.limbCount()).isEqualTo(1);
    assertThat(IntType.INT32.limbCount()).isEqualTo(1);
    assertThat(IntType.UINT64.limbCount()).isEqualTo(1);
    assertThat(IntType.INT128.limbCount()).isEqualTo(2);
    assertThat(IntType.UINT256.limbCount()).isEqualTo(4);
  }

  @Test
  public void testIsNarrow() {
    assertThat(IntType.UINT32.isNarrow()).isTrue();
    assertThat(IntType.INT8.isNarrow()).isTrue();
    assertThat(IntType.UINT64.isNarrow()).isFalse();
    assertThat(IntType.INT256.isNarrow()).isFalse();
  }

  @Test
  public void testRange_signed256() {
    BigInteger max = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    assertThat(IntType.INT256.maxValue()).isEqualTo(max);
    assertThat(IntType.INT256.minValue()).isEqualTo(max.add(BigInteger.ONE).negate());
  }

  @Test
  public void testRange_unsigned8() {
    assertThat(IntType.UINT8.minValue()).isEqualTo(BigInteger.ZERO);
    assertThat(IntType.UINT8.maxValue()).isEqualTo(BigInteger.valueOf(255));
  }

  @ParameterizedTest
  @EnumSource(IntType.class)
  public void testIsRepresentable_bounds(final IntType type) {
    assertThat(type.isRepresentable(type.minValue())).isTrue();
    assertThat(type.isRepresentable(type.maxValue())).isTrue();
    assertThat(type.isRepresentable(type.minValue().subtract(BigInteger.ONE))).isFalse();
    assertThat(type.isRepresentable(type.maxValue().add(BigInteger.ONE))).isFalse();
  }

  @ParameterizedTest
  @EnumSource(IntType.class)
  public void testWithSignedness_keepsWidth(final IntType type) {
    IntType flipped = type.withSignedness(!type.isSigned());
    assertThat(flipped.bitWidth()).isEqualTo(type.bitWidth());
    assertThat(flipped.isSigned()).isNotEqualTo(type.isSigned());
    assertThat(flipped.withSignedness(type.isSigned())).isEqualTo(type);
  }
}
