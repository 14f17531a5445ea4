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

import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/**
 * Comparisons of wide values. Ordering follows the signedness of the operands' type.
 *
 * <p>Every comparison runs over all limbs; the most significant unequal limb decides the
 * outcome through secret flags, not through control flow.
 */
public final class LimbComparator {

  private LimbComparator() {}

  // region Equality
  // --------------------------------------------------------------------------

  public static SecretBool eq(final WordBackend backend, final WideValue a, final WideValue b) {
    LimbVectors.commonType(a, b);
    SecretWord equal = backend.eq(a.limb(0), b.limb(0));
    for (int i = 1; i < a.limbCount(); i++) {
      equal = backend.and(equal, backend.eq(a.limb(i), b.limb(i)));
    }
    return SecretBool.of(equal);
  }

  public static SecretBool ne(final WordBackend backend, final WideValue a, final WideValue b) {
    LimbVectors.commonType(a, b);
    SecretWord differ = backend.ne(a.limb(0), b.limb(0));
    for (int i = 1; i < a.limbCount(); i++) {
      differ = backend.or(differ, backend.ne(a.limb(i), b.limb(i)));
    }
    return SecretBool.of(differ);
  }

  // --------------------------------------------------------------------------
  // endregion

  // region Ordering
  // --------------------------------------------------------------------------

  /**
   * Strictly less than.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand, same type as {@code a}.
   * @return secret {@code a < b}.
   */
  public static SecretBool lt(final WordBackend backend, final WideValue a, final WideValue b) {
    return compare(backend, a, b, false);
  }

  /**
   * Less than or equal.
   *
   * @param backend word backend.
   * @param a left operand.
   * @param b right operand, same type as {@code a}.
   * @return secret {@code a <= b}.
   */
  public static SecretBool le(final WordBackend backend, final WideValue a, final WideValue b) {
    return compare(backend, a, b, true);
  }

  public static SecretBool gt(final WordBackend backend, final WideValue a, final WideValue b) {
    return compare(backend, b, a, false);
  }

  public static SecretBool ge(final WordBackend backend, final WideValue a, final WideValue b) {
    return compare(backend, b, a, true);
  }

  public static WideValue min(final WordBackend backend, final WideValue a, final WideValue b) {
    return Selector.select(backend, le(backend, a, b), a, b);
  }

  public static WideValue max(final WordBackend backend, final WideValue a, final WideValue b) {
    return Selector.select(backend, ge(backend, a, b), a, b);
  }

  private static SecretBool compare(
      final WordBackend backend, final WideValue a, final WideValue b, final boolean orEqual) {
    IntType type = LimbVectors.commonType(a, b);
    SecretWord unsigned = compareUnsigned(backend, a, b, orEqual);
    if (!type.isSigned()) return SecretBool.of(unsigned);
    // differing signs: a is below b exactly when a is negative
    SecretWord signA = LimbVectors.signBit(backend, a);
    SecretWord signB = LimbVectors.signBit(backend, b);
    SecretWord signsDiffer = backend.xor(signA, signB);
    return SecretBool.of(backend.mux(signsDiffer, signA, unsigned));
  }

  /**
   * Unsigned comparison of the limb vectors, most significant limb first.
   *
   * @param backend word backend.
   * @param a left limbs.
   * @param b right limbs.
   * @param orEqual whether equal vectors compare true.
   * @return secret {@code a < b} or {@code a <= b}.
   */
  static SecretWord compareUnsigned(
      final WordBackend backend, final WideValue a, final WideValue b, final boolean orEqual) {
    int top = a.limbCount() - 1;
    if (top == 0) {
      return orEqual ? backend.le(a.limb(0), b.limb(0)) : backend.lt(a.limb(0), b.limb(0));
    }
    SecretWord less = backend.lt(a.limb(top), b.limb(top));
    SecretWord equalSoFar = backend.eq(a.limb(top), b.limb(top));
    for (int i = top - 1; i >= 0; i--) {
      SecretWord lessHere = backend.lt(a.limb(i), b.limb(i));
      less = backend.or(less, backend.and(equalSoFar, lessHere));
      equalSoFar = backend.and(equalSoFar, backend.eq(a.limb(i), b.limb(i)));
    }
    return orEqual ? backend.or(less, equalSoFar) : less;
  }

  // --------------------------------------------------------------------------
  // endregion
}
