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
import static com.google.common.base.Preconditions.checkState;

import java.math.BigInteger;

import org.wideint.datatypes.IntType;
import org.wideint.datatypes.LimbCodec;
import org.wideint.datatypes.WideValue;

/**
 * One operand of a binary operation, tagged with whether the backend sees it as a secret value
 * or as a public constant.
 *
 * <p>The tag only changes which backend calls an operation issues, never its numeric result.
 */
public final class Operand {

  /** How an operand reaches the backend. */
  public enum Visibility {
    /** Already a secret value. */
    SECRET,
    /** Plaintext constant, injected with {@code setPublic}. */
    PUBLIC
  }

  private final Visibility visibility;
  private final IntType type;
  private final WideValue secret;
  private final long[] plainLimbs;

  private Operand(
      final Visibility visibility,
      final IntType type,
      final WideValue secret,
      final long[] plainLimbs) {
    this.visibility = visibility;
    this.type = type;
    this.secret = secret;
    this.plainLimbs = plainLimbs;
  }

  /**
   * Secret operand.
   *
   * @param value secret value.
   * @return the operand.
   */
  public static Operand secret(final WideValue value) {
    checkNotNull(value, "value");
    return new Operand(Visibility.SECRET, value.type(), value, null);
  }

  /**
   * Public constant operand.
   *
   * @param type type of the constant.
   * @param value plaintext, which must be representable in the type.
   * @return the operand.
   */
  public static Operand plain(final IntType type, final BigInteger value) {
    checkNotNull(value, "value");
    checkArgument(type.isRepresentable(value), "%s is out of range for %s", value, type);
    return new Operand(Visibility.PUBLIC, type, null, LimbCodec.toLimbs(value, type));
  }

  public Visibility visibility() {
    return visibility;
  }

  public IntType type() {
    return type;
  }

  /**
   * The secret value of a {@link Visibility#SECRET} operand.
   *
   * @return the value.
   */
  public WideValue secretValue() {
    checkState(visibility == Visibility.SECRET, "Operand is public");
    return secret;
  }

  /**
   * Plaintext limb of a {@link Visibility#PUBLIC} operand.
   *
   * @param index limb position.
   * @return the limb bit pattern.
   */
  public long plainLimb(final int index) {
    checkState(visibility == Visibility.PUBLIC, "Operand is secret");
    return plainLimbs[index];
  }

  /**
   * Plaintext of a {@link Visibility#PUBLIC} operand.
   *
   * @return the value, read with the operand type's signedness.
   */
  public BigInteger plainValue() {
    checkState(visibility == Visibility.PUBLIC, "Operand is secret");
    return LimbCodec.fromLimbs(plainLimbs, type);
  }

  /**
   * Whether limb {@code index} is known to be zero without asking the backend.
   *
   * @param index limb position.
   * @return true only for zero limbs of public operands.
   */
  boolean isKnownZeroLimb(final int index) {
    return visibility == Visibility.PUBLIC && plainLimbs[index] == 0L;
  }

  /**
   * The operand as a secret value, injecting public limbs through the backend.
   *
   * @param backend word backend.
   * @return secret value of the operand.
   */
  WideValue materialize(final WordBackend backend) {
    switch (visibility) {
      case SECRET:
        return secret;
      case PUBLIC:
        return LimbVectors.fromPlainLimbs(backend, type, plainLimbs);
      default:
        throw new IllegalStateException("Unknown visibility " + visibility);
    }
  }

  @Override
  public String toString() {
    return visibility == Visibility.SECRET
        ? "Operand(secret " + secret + ")"
        : "Operand(public " + plainValue() + ": " + type + ")";
  }
}
