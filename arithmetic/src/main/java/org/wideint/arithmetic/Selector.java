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

import org.wideint.datatypes.IntType;
import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.WideValue;

/** Branchless selection between two wide values. */
public final class Selector {

  private Selector() {}

  /**
   * Limb-wise selection: one backend {@code mux} per limb whichever value the condition picks.
   *
   * @param backend word backend.
   * @param cond secret condition.
   * @param a value returned when {@code cond} is true.
   * @param b value returned when {@code cond} is false.
   * @return the selected value, typed as {@code a}.
   */
  public static WideValue select(
      final WordBackend backend, final SecretBool cond, final WideValue a, final WideValue b) {
    checkNotNull(cond, "cond");
    IntType type = LimbVectors.commonType(a, b);
    SecretWord[] limbs = new SecretWord[type.limbCount()];
    for (int i = 0; i < limbs.length; i++) {
      limbs[i] = backend.mux(cond.word(), a.limb(i), b.limb(i));
    }
    return WideValue.of(type, limbs);
  }
}
