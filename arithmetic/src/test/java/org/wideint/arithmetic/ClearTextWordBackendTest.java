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

import java.util.Random;

import org.apache.tuweni.bytes.Bytes;
import org.apache.tuweni.bytes.MutableBytes;
import org.junit.jupiter.api.Test;
import org.wideint.datatypes.BackendException;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.DivisionByZeroException;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.InvalidProofException;
import org.wideint.datatypes.SecretWord;

public class ClearTextWordBackendTest {
  private static final Bytes NETWORK_KEY = Bytes.fromHexString("0x776f726473");

  private final ClearTextWordBackend backend =
      new ClearTextWordBackend(NETWORK_KEY, new Random(14));

  private SecretWord word(final long value) {
    return backend.setPublic(value);
  }

  @Test
  public void testArithmetic_wrapsAt64Bits() {
    assertThat(backend.decrypt(backend.add(word(-1L), word(2L)))).isEqualTo(1L);
    assertThat(backend.decrypt(backend.sub(word(0L), word(1L)))).isEqualTo(-1L);
    assertThat(backend.decrypt(backend.mul(word(1L << 62), word(8L)))).isEqualTo(0L);
  }

  @Test
  public void testDivision_isUnsigned() {
    assertThat(backend.decrypt(backend.div(word(-1L), word(2L)))).isEqualTo(Long.MAX_VALUE);
    assertThat(backend.decrypt(backend.rem(word(-1L), word(10L)))).isEqualTo(5L);
  }

  @Test
  public void testDivision_byZeroFails() {
    assertThatThrownBy(() -> backend.div(word(1L), word(0L)))
        .isInstanceOf(DivisionByZeroException.class);
    assertThatThrownBy(() -> backend.rem(word(1L), word(0L)))
        .isInstanceOf(DivisionByZeroException.class);
  }

  @Test
  public void testComparisons_areUnsignedBooleans() {
    assertThat(backend.decrypt(backend.lt(word(1L), word(-1L)))).isEqualTo(1L);
    assertThat(backend.decrypt(backend.gt(word(1L), word(-1L)))).isEqualTo(0L);
    assertThat(backend.decrypt(backend.le(word(3L), word(3L)))).isEqualTo(1L);
    assertThat(backend.decrypt(backend.ge(word(2L), word(3L)))).isEqualTo(0L);
    assertThat(backend.decrypt(backend.eq(word(3L), word(3L)))).isEqualTo(1L);
    assertThat(backend.decrypt(backend.ne(word(3L), word(3L)))).isEqualTo(0L);
  }

  @Test
  public void testShifts_areLogicalAndBounded() {
    assertThat(backend.decrypt(backend.shr(word(-1L), 60))).isEqualTo(0xFL);
    assertThat(backend.decrypt(backend.shl(word(3L), 63))).isEqualTo(Long.MIN_VALUE);
    assertThatThrownBy(() -> backend.shl(word(1L), 64))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testMux() {
    assertThat(backend.decrypt(backend.mux(word(1L), word(10L), word(20L)))).isEqualTo(10L);
    assertThat(backend.decrypt(backend.mux(word(0L), word(10L), word(20L)))).isEqualTo(20L);
  }

  @Test
  public void testUnknownHandleFails() {
    SecretWord foreign = SecretWord.ofHandle(Long.MAX_VALUE);
    assertThatThrownBy(() -> backend.decrypt(foreign)).isInstanceOf(BackendException.class);
  }

  @Test
  public void testRandom_respectsBitCount() {
    for (int i = 0; i < 50; i++) {
      assertThat(backend.decrypt(backend.random(5)) >>> 5).isEqualTo(0L);
    }
    assertThatThrownBy(() -> backend.random(65)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testOffboard_isNotPlaintext() {
    Ciphertext first = backend.offboard(word(42L));
    Ciphertext second = backend.offboard(word(42L));
    assertThat(first.payload().size()).isEqualTo(16);
    assertThat(first).isNotEqualTo(second);
    assertThat(backend.decrypt(backend.onboard(first))).isEqualTo(42L);
    assertThat(backend.decrypt(backend.onboard(second))).isEqualTo(42L);
  }

  @Test
  public void testValidateCiphertext_checksProof() {
    InputProof input = backend.encryptInput(99L);
    assertThat(backend.decrypt(backend.validateCiphertext(input))).isEqualTo(99L);

    MutableBytes flipped = input.ciphertext().payload().mutableCopy();
    flipped.set(15, (byte) (flipped.get(15) ^ 1));
    InputProof tampered = InputProof.of(Ciphertext.wrap(flipped), input.proof());
    assertThatThrownBy(() -> backend.validateCiphertext(tampered))
        .isInstanceOf(InvalidProofException.class);
  }

  @Test
  public void testIssuedWords_growsWithEachResult() {
    int before = backend.issuedWords();
    backend.add(word(1L), word(2L));
    assertThat(backend.issuedWords()).isEqualTo(before + 3);
  }
}
