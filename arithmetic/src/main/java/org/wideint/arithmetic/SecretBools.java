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

import org.apache.tuweni.bytes.Bytes;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.UserCiphertext;

/** Operations on secret booleans, each backed by a single 0/1 word. */
public final class SecretBools {

  private SecretBools() {}

  public static SecretBool and(final WordBackend backend, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.and(a.word(), b.word()));
  }

  public static SecretBool or(final WordBackend backend, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.or(a.word(), b.word()));
  }

  public static SecretBool xor(final WordBackend backend, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.xor(a.word(), b.word()));
  }

  public static SecretBool not(final WordBackend backend, final SecretBool a) {
    return SecretBool.of(backend.xor(a.word(), backend.setPublic(1L)));
  }

  public static SecretBool eq(final WordBackend backend, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.eq(a.word(), b.word()));
  }

  public static SecretBool ne(final WordBackend backend, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.ne(a.word(), b.word()));
  }

  /**
   * Branchless choice between two booleans.
   *
   * @param backend word backend.
   * @param cond condition.
   * @param a result when {@code cond} is true.
   * @param b result when {@code cond} is false.
   * @return the selected boolean.
   */
  public static SecretBool mux(
      final WordBackend backend, final SecretBool cond, final SecretBool a, final SecretBool b) {
    return SecretBool.of(backend.mux(cond.word(), a.word(), b.word()));
  }

  public static SecretBool setPublic(final WordBackend backend, final boolean value) {
    return SecretBool.of(backend.setPublic(value ? 1L : 0L));
  }

  public static boolean decrypt(final WordBackend backend, final SecretBool value) {
    return backend.decrypt(value.word()) != 0L;
  }

  /**
   * Validates a client-supplied boolean. Any non-zero input reads as true.
   *
   * @param backend word backend.
   * @param proof ciphertext and proof of one word.
   * @return the secret boolean.
   */
  public static SecretBool validateCiphertext(final WordBackend backend, final InputProof proof) {
    checkNotNull(proof, "proof");
    SecretWord word = backend.validateCiphertext(proof);
    return SecretBool.of(backend.ne(word, backend.setPublic(0L)));
  }

  public static Ciphertext offboard(final WordBackend backend, final SecretBool value) {
    return backend.offboard(value.word());
  }

  public static SecretBool onboard(final WordBackend backend, final Ciphertext ciphertext) {
    return SecretBool.of(backend.onboard(ciphertext));
  }

  public static UserCiphertext offboardToUser(
      final WordBackend backend, final SecretBool value, final Bytes recipientKey) {
    return backend.offboardToUser(value.word(), recipientKey);
  }
}
