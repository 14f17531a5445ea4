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
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.apache.tuweni.bytes.Bytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wideint.datatypes.BackendException;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.DivisionByZeroException;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.InvalidProofException;
import org.wideint.datatypes.LimbCodec;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.UserCiphertext;
import org.wideint.datatypes.WideInputProof;
import org.wideint.datatypes.WideUserCiphertext;

/**
 * Local simulation of a word backend that keeps every word in the clear.
 *
 * <p>It offers no secrecy at all and exists to exercise the limb layer without a secure
 * computation network. Durable forms are still encrypted with an HMAC-SHA256 keystream so that
 * offboarded values and user ciphertexts do not carry plaintext, and client inputs carry an HMAC
 * proof that {@link #validateCiphertext(InputProof)} checks.
 */
public final class ClearTextWordBackend implements WordBackend {
  private static final Logger LOG = LoggerFactory.getLogger(ClearTextWordBackend.class);

  // Ciphertext layout: 8 bytes nonce, 8 bytes masked value.
  private static final int NONCE_SIZE = 8;
  private static final int CIPHERTEXT_SIZE = 16;
  private static final int PROOF_SIZE = 16;

  // Domain separation of the keystreams and proofs.
  private static final byte NETWORK_DOMAIN = 0x01;
  private static final byte USER_DOMAIN = 0x02;
  private static final byte PROOF_DOMAIN = 0x03;

  private final Map<Long, Long> words = new ConcurrentHashMap<>();
  private final AtomicLong nextHandle = new AtomicLong(1);
  private final HashFunction networkMac;
  private final Random random;

  /** Creates a backend with a fresh random network key. */
  public ClearTextWordBackend() {
    this(randomKey(), new SecureRandom());
  }

  /**
   * Creates a backend with a given network key and randomness source.
   *
   * @param networkKey key of the durable ciphertexts and input proofs.
   * @param random source of nonces and of {@link #random(int)}.
   */
  public ClearTextWordBackend(final Bytes networkKey, final Random random) {
    checkArgument(!networkKey.isEmpty(), "Network key must not be empty");
    this.networkMac = Hashing.hmacSha256(networkKey.toArrayUnsafe());
    this.random = checkNotNull(random, "random");
    LOG.debug("Created clear-text word backend");
  }

  private static Bytes randomKey() {
    byte[] key = new byte[32];
    new SecureRandom().nextBytes(key);
    return Bytes.wrap(key);
  }

  // region Word storage
  // --------------------------------------------------------------------------

  private SecretWord store(final long value) {
    long handle = nextHandle.getAndIncrement();
    words.put(handle, value);
    return SecretWord.ofHandle(handle);
  }

  private long load(final SecretWord word) {
    checkNotNull(word, "word");
    Long value = words.get(word.handle());
    if (value == null) {
      throw new BackendException("Unknown secret word handle " + word.handle());
    }
    return value;
  }

  private SecretWord bool(final boolean value) {
    return store(value ? 1L : 0L);
  }

  /**
   * Number of words issued so far.
   *
   * @return count of live handles.
   */
  @VisibleForTesting
  int issuedWords() {
    return words.size();
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Arithmetic, bitwise and comparisons
  // --------------------------------------------------------------------------

  @Override
  public SecretWord add(final SecretWord a, final SecretWord b) {
    return store(load(a) + load(b));
  }

  @Override
  public SecretWord sub(final SecretWord a, final SecretWord b) {
    return store(load(a) - load(b));
  }

  @Override
  public SecretWord mul(final SecretWord a, final SecretWord b) {
    return store(load(a) * load(b));
  }

  @Override
  public SecretWord div(final SecretWord a, final SecretWord b) {
    long divisor = load(b);
    if (divisor == 0) throw new DivisionByZeroException("Division by a secret zero");
    return store(Long.divideUnsigned(load(a), divisor));
  }

  @Override
  public SecretWord rem(final SecretWord a, final SecretWord b) {
    long divisor = load(b);
    if (divisor == 0) throw new DivisionByZeroException("Remainder by a secret zero");
    return store(Long.remainderUnsigned(load(a), divisor));
  }

  @Override
  public SecretWord and(final SecretWord a, final SecretWord b) {
    return store(load(a) & load(b));
  }

  @Override
  public SecretWord or(final SecretWord a, final SecretWord b) {
    return store(load(a) | load(b));
  }

  @Override
  public SecretWord xor(final SecretWord a, final SecretWord b) {
    return store(load(a) ^ load(b));
  }

  @Override
  public SecretWord shl(final SecretWord a, final int shift) {
    checkArgument(shift >= 0 && shift < 64, "Shift out of range: %s", shift);
    return store(load(a) << shift);
  }

  @Override
  public SecretWord shr(final SecretWord a, final int shift) {
    checkArgument(shift >= 0 && shift < 64, "Shift out of range: %s", shift);
    return store(load(a) >>> shift);
  }

  @Override
  public SecretWord eq(final SecretWord a, final SecretWord b) {
    return bool(load(a) == load(b));
  }

  @Override
  public SecretWord ne(final SecretWord a, final SecretWord b) {
    return bool(load(a) != load(b));
  }

  @Override
  public SecretWord lt(final SecretWord a, final SecretWord b) {
    return bool(Long.compareUnsigned(load(a), load(b)) < 0);
  }

  @Override
  public SecretWord le(final SecretWord a, final SecretWord b) {
    return bool(Long.compareUnsigned(load(a), load(b)) <= 0);
  }

  @Override
  public SecretWord gt(final SecretWord a, final SecretWord b) {
    return bool(Long.compareUnsigned(load(a), load(b)) > 0);
  }

  @Override
  public SecretWord ge(final SecretWord a, final SecretWord b) {
    return bool(Long.compareUnsigned(load(a), load(b)) >= 0);
  }

  @Override
  public SecretWord mux(final SecretWord cond, final SecretWord a, final SecretWord b) {
    long c = load(cond);
    long x = load(a);
    long y = load(b);
    if (c != 0 && c != 1) throw new BackendException("Selector is not a boolean word");
    return store(c == 1 ? x : y);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Boundary
  // --------------------------------------------------------------------------

  @Override
  public long decrypt(final SecretWord a) {
    return load(a);
  }

  @Override
  public SecretWord setPublic(final long value) {
    return store(value);
  }

  @Override
  public SecretWord random(final int bits) {
    checkArgument(bits >= 1 && bits <= 64, "Random bit count out of range: %s", bits);
    return store(random.nextLong() & LimbCodec.mask(bits));
  }

  @Override
  public SecretWord validateCiphertext(final InputProof proof) {
    checkNotNull(proof, "proof");
    Bytes payload = proof.ciphertext().payload();
    if (payload.size() != CIPHERTEXT_SIZE || proof.proof().size() != PROOF_SIZE) {
      throw new InvalidProofException("Malformed input ciphertext");
    }
    byte[] expected = proofOf(payload).toArrayUnsafe();
    if (!MessageDigest.isEqual(expected, proof.proof().toArrayUnsafe())) {
      throw new InvalidProofException("Input proof does not match its ciphertext");
    }
    return store(open(networkMac, NETWORK_DOMAIN, payload));
  }

  @Override
  public Ciphertext offboard(final SecretWord a) {
    return Ciphertext.wrap(seal(networkMac, NETWORK_DOMAIN, load(a)));
  }

  @Override
  public SecretWord onboard(final Ciphertext ciphertext) {
    checkNotNull(ciphertext, "ciphertext");
    if (ciphertext.payload().size() != CIPHERTEXT_SIZE) {
      throw new BackendException(
          "Malformed ciphertext of " + ciphertext.payload().size() + " bytes");
    }
    return store(open(networkMac, NETWORK_DOMAIN, ciphertext.payload()));
  }

  @Override
  public UserCiphertext offboardToUser(final SecretWord a, final Bytes recipientKey) {
    checkArgument(!recipientKey.isEmpty(), "Recipient key must not be empty");
    HashFunction userMac = Hashing.hmacSha256(recipientKey.toArrayUnsafe());
    return UserCiphertext.wrap(seal(userMac, USER_DOMAIN, load(a)), recipientKey);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Client side
  // --------------------------------------------------------------------------

  /**
   * Encrypts a client input word under this backend's network key, with its proof.
   *
   * @param value 64-bit pattern.
   * @return input accepted by {@link #validateCiphertext(InputProof)}.
   */
  public InputProof encryptInput(final long value) {
    Bytes payload = seal(networkMac, NETWORK_DOMAIN, value);
    return InputProof.of(Ciphertext.wrap(payload), proofOf(payload));
  }

  /**
   * Encrypts a wide client input limb by limb.
   *
   * @param type type of the input.
   * @param value plaintext, wrapped modulo 2^width.
   * @return per-limb inputs, least significant first.
   */
  public WideInputProof encryptInput(final IntType type, final BigInteger value) {
    long[] limbs = LimbCodec.toLimbs(value, type);
    List<InputProof> proofs = new ArrayList<>(limbs.length);
    for (long limb : limbs) {
      proofs.add(encryptInput(limb));
    }
    return WideInputProof.of(type, proofs);
  }

  /**
   * Recipient-side decryption of a user ciphertext.
   *
   * @param ciphertext ciphertext produced by {@link #offboardToUser(SecretWord, Bytes)}.
   * @param recipientKey the recipient's key.
   * @return the 64-bit pattern.
   */
  public static long decryptForUser(final UserCiphertext ciphertext, final Bytes recipientKey) {
    checkArgument(ciphertext.payload().size() == CIPHERTEXT_SIZE, "Malformed user ciphertext");
    HashFunction userMac = Hashing.hmacSha256(recipientKey.toArrayUnsafe());
    return open(userMac, USER_DOMAIN, ciphertext.payload());
  }

  /**
   * Recipient-side decryption of a wide user ciphertext.
   *
   * @param ciphertext per-limb user ciphertexts.
   * @param recipientKey the recipient's key.
   * @return the integer, read with the signedness of the ciphertext's type.
   */
  public static BigInteger decryptForUser(
      final WideUserCiphertext ciphertext, final Bytes recipientKey) {
    List<UserCiphertext> limbs = ciphertext.limbs();
    long[] plain = new long[limbs.size()];
    for (int i = 0; i < plain.length; i++) {
      plain[i] = decryptForUser(limbs.get(i), recipientKey);
    }
    return LimbCodec.fromLimbs(plain, ciphertext.type());
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Keystream
  // --------------------------------------------------------------------------

  private Bytes seal(final HashFunction mac, final byte domain, final long value) {
    byte[] nonce = new byte[NONCE_SIZE];
    random.nextBytes(nonce);
    Bytes nonceBytes = Bytes.wrap(nonce);
    long masked = value ^ keystream(mac, domain, nonceBytes);
    return Bytes.concatenate(nonceBytes, Bytes.ofUnsignedLong(masked));
  }

  private static long open(final HashFunction mac, final byte domain, final Bytes payload) {
    Bytes nonce = payload.slice(0, NONCE_SIZE);
    long masked = payload.slice(NONCE_SIZE, 8).toLong();
    return masked ^ keystream(mac, domain, nonce);
  }

  private static long keystream(final HashFunction mac, final byte domain, final Bytes nonce) {
    byte[] digest =
        mac.newHasher().putByte(domain).putBytes(nonce.toArrayUnsafe()).hash().asBytes();
    return Bytes.wrap(digest, 0, 8).toLong();
  }

  private Bytes proofOf(final Bytes payload) {
    byte[] digest =
        networkMac
            .newHasher()
            .putByte(PROOF_DOMAIN)
            .putBytes(payload.toArrayUnsafe())
            .hash()
            .asBytes();
    return Bytes.wrap(digest, 0, PROOF_SIZE);
  }

  // --------------------------------------------------------------------------
  // endregion
}
