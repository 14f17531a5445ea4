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
import static com.google.common.base.Preconditions.checkNotNull;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.apache.tuweni.bytes.Bytes;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.CombinedCiphertext;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.LimbCodec;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.UserCiphertext;
import org.wideint.datatypes.WideCiphertext;
import org.wideint.datatypes.WideInputProof;
import org.wideint.datatypes.WideUserCiphertext;
import org.wideint.datatypes.WideValue;

/**
 * Conversions between wide values and their plaintext, durable and client-supplied forms.
 *
 * <p>Multi-limb conversions collect every limb before building a result, so a failing limb call
 * leaves nothing behind.
 */
public final class Boundary {

  private Boundary() {}

  // region Ingest
  // --------------------------------------------------------------------------

  /**
   * Validates a client input limb by limb.
   *
   * @param backend word backend.
   * @param proof per-limb ciphertexts and proofs.
   * @return the secret value.
   * @throws org.wideint.datatypes.InvalidProofException if any limb fails validation.
   */
  public static WideValue validateCiphertext(
      final WordBackend backend, final WideInputProof proof) {
    checkNotNull(proof, "proof");
    IntType type = proof.type();
    List<InputProof> inputs = proof.limbs();
    SecretWord[] limbs = new SecretWord[inputs.size()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.validateCiphertext(inputs.get(i));
    }
    return canonical(backend, type, limbs);
  }

  /**
   * Injects a plaintext as a public constant.
   *
   * @param backend word backend.
   * @param value plaintext, which must be representable in {@code type}.
   * @param type target type.
   * @return the value.
   */
  public static WideValue setPublic(
      final WordBackend backend, final BigInteger value, final IntType type) {
    checkNotNull(value, "value");
    checkArgument(type.isRepresentable(value), "%s is out of range for %s", value, type);
    return LimbVectors.constant(backend, type, value);
  }

  public static WideValue onboard(final WordBackend backend, final WideCiphertext ciphertext) {
    checkNotNull(ciphertext, "ciphertext");
    List<Ciphertext> stored = ciphertext.limbs();
    SecretWord[] limbs = new SecretWord[stored.size()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.onboard(stored.get(i));
    }
    return canonical(backend, ciphertext.type(), limbs);
  }

  private static WideValue canonical(
      final WordBackend backend, final IntType type, final SecretWord[] limbs) {
    if (type.isNarrow()) limbs[0] = LimbVectors.canonical(backend, type, limbs[0]);
    return WideValue.of(type, limbs);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Randomness
  // --------------------------------------------------------------------------

  /**
   * Uniform value over the whole type.
   *
   * @param backend word backend.
   * @param type type of the value.
   * @return random value; for signed types every bit pattern is equally likely.
   */
  public static WideValue random(final WordBackend backend, final IntType type) {
    return randomBounded(backend, type, type.bitWidth());
  }

  /**
   * Uniform value over {@code [0, 2^bits)}.
   *
   * @param backend word backend.
   * @param type type of the value.
   * @param bits number of random low bits, from 1 to the type's width.
   * @return random value with every higher bit zero.
   */
  public static WideValue randomBounded(
      final WordBackend backend, final IntType type, final int bits) {
    checkArgument(
        bits >= 1 && bits <= type.bitWidth(), "Random bits %s out of range for %s", bits, type);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    SecretWord zero = null;
    for (int i = 0; i < limbs.length; i++) {
      int remaining = bits - IntType.BITS_PER_LIMB * i;
      if (remaining <= 0) {
        if (zero == null) zero = LimbVectors.word(backend, 0L);
        limbs[i] = zero;
      } else {
        limbs[i] = backend.random(Math.min(remaining, IntType.BITS_PER_LIMB));
      }
    }
    return WideValue.of(type, limbs);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Egress
  // --------------------------------------------------------------------------

  /**
   * Decrypts a value.
   *
   * @param backend word backend.
   * @param value secret value.
   * @return the integer, read with the signedness of the value's type.
   */
  public static BigInteger decrypt(final WordBackend backend, final WideValue value) {
    long[] plain = new long[value.limbCount()];
    for (int i = 0; i < plain.length; i++) {
      plain[i] = backend.decrypt(value.limb(i));
    }
    return LimbCodec.fromLimbs(plain, value.type());
  }

  public static WideCiphertext offboard(final WordBackend backend, final WideValue value) {
    List<Ciphertext> limbs = new ArrayList<>(value.limbCount());
    for (int i = 0; i < value.limbCount(); i++) {
      limbs.add(backend.offboard(value.limb(i)));
    }
    return WideCiphertext.of(value.type(), limbs);
  }

  /**
   * Re-encrypts a value to one recipient. The value itself is left untouched.
   *
   * @param backend word backend.
   * @param value secret value.
   * @param recipientKey the recipient's key.
   * @return per-limb user ciphertexts.
   */
  public static WideUserCiphertext offboardToUser(
      final WordBackend backend, final WideValue value, final Bytes recipientKey) {
    checkNotNull(recipientKey, "recipientKey");
    List<UserCiphertext> limbs = new ArrayList<>(value.limbCount());
    for (int i = 0; i < value.limbCount(); i++) {
      limbs.add(backend.offboardToUser(value.limb(i), recipientKey));
    }
    return WideUserCiphertext.of(value.type(), limbs);
  }

  /**
   * Stores a value under the network key and re-encrypts it to a recipient in one call.
   *
   * @param backend word backend.
   * @param value secret value.
   * @param recipientKey the recipient's key.
   * @return both ciphertexts.
   */
  public static CombinedCiphertext offboardCombined(
      final WordBackend backend, final WideValue value, final Bytes recipientKey) {
    WideCiphertext network = offboard(backend, value);
    WideUserCiphertext user = offboardToUser(backend, value, recipientKey);
    return CombinedCiphertext.of(network, user);
  }

  // --------------------------------------------------------------------------
  // endregion
}
