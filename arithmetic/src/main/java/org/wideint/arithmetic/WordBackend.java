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

import org.apache.tuweni.bytes.Bytes;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.UserCiphertext;

/**
 * Primitive operations of a secure computation backend over single 64-bit secret words.
 *
 * <p>Words are unsigned 64-bit integers. {@code add}, {@code sub} and {@code mul} wrap modulo
 * 2^64. {@code div}, {@code rem} and the ordering comparisons are unsigned. Comparisons return a
 * word holding 0 or 1. Every call is synchronous: it returns a fresh word or throws, in which case
 * the enclosing operation is aborted.
 */
public interface WordBackend {

  // region Arithmetic
  // --------------------------------------------------------------------------

  SecretWord add(SecretWord a, SecretWord b);

  SecretWord sub(SecretWord a, SecretWord b);

  SecretWord mul(SecretWord a, SecretWord b);

  /**
   * Unsigned division.
   *
   * @param a dividend.
   * @param b divisor.
   * @return floor(a / b).
   * @throws org.wideint.datatypes.DivisionByZeroException if {@code b} holds zero.
   */
  SecretWord div(SecretWord a, SecretWord b);

  /**
   * Unsigned remainder.
   *
   * @param a dividend.
   * @param b divisor.
   * @return a mod b.
   * @throws org.wideint.datatypes.DivisionByZeroException if {@code b} holds zero.
   */
  SecretWord rem(SecretWord a, SecretWord b);

  // --------------------------------------------------------------------------
  // endregion

  // region Bitwise
  // --------------------------------------------------------------------------

  SecretWord and(SecretWord a, SecretWord b);

  SecretWord or(SecretWord a, SecretWord b);

  SecretWord xor(SecretWord a, SecretWord b);

  /**
   * Logical left shift by a public amount.
   *
   * @param a word to shift.
   * @param shift amount in {@code 0..63}.
   * @return a shifted left, wrapped to 64 bits.
   */
  SecretWord shl(SecretWord a, int shift);

  /**
   * Logical right shift by a public amount.
   *
   * @param a word to shift.
   * @param shift amount in {@code 0..63}.
   * @return a shifted right, zero filled.
   */
  SecretWord shr(SecretWord a, int shift);

  // --------------------------------------------------------------------------
  // endregion

  // region Comparisons
  // --------------------------------------------------------------------------

  SecretWord eq(SecretWord a, SecretWord b);

  SecretWord ne(SecretWord a, SecretWord b);

  SecretWord lt(SecretWord a, SecretWord b);

  SecretWord le(SecretWord a, SecretWord b);

  SecretWord gt(SecretWord a, SecretWord b);

  SecretWord ge(SecretWord a, SecretWord b);

  /**
   * Branchless selection.
   *
   * @param cond word holding 0 or 1.
   * @param a returned when {@code cond} is 1.
   * @param b returned when {@code cond} is 0.
   * @return a fresh word equal to the selected input.
   */
  SecretWord mux(SecretWord cond, SecretWord a, SecretWord b);

  // --------------------------------------------------------------------------
  // endregion

  // region Boundary
  // --------------------------------------------------------------------------

  /**
   * Reveals a word.
   *
   * @param a secret word.
   * @return its 64-bit pattern.
   */
  long decrypt(SecretWord a);

  /**
   * Injects a public constant.
   *
   * @param value 64-bit pattern.
   * @return a secret word holding it.
   */
  SecretWord setPublic(long value);

  /**
   * Draws a uniformly random word.
   *
   * @param bits number of random low bits, in {@code 1..64}.
   * @return a secret word uniform over [0, 2^bits).
   */
  SecretWord random(int bits);

  /**
   * Checks a client input and admits it as a secret word.
   *
   * @param proof ciphertext and proof of correct encryption.
   * @return the validated secret word.
   * @throws org.wideint.datatypes.InvalidProofException if validation fails.
   */
  SecretWord validateCiphertext(InputProof proof);

  Ciphertext offboard(SecretWord a);

  SecretWord onboard(Ciphertext ciphertext);

  /**
   * Re-encrypts a word to a recipient key.
   *
   * @param a secret word.
   * @param recipientKey recipient public key.
   * @return ciphertext only the recipient can decrypt.
   */
  UserCiphertext offboardToUser(SecretWord a, Bytes recipientKey);

  // --------------------------------------------------------------------------
  // endregion
}
