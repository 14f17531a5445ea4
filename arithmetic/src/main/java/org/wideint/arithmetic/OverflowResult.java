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

import org.wideint.datatypes.SecretBool;
import org.wideint.datatypes.WideValue;

/** Wrapped result of a checked operation together with its secret overflow flag. */
public final class OverflowResult {
  private final WideValue value;
  private final SecretBool overflow;

  private OverflowResult(final WideValue value, final SecretBool overflow) {
    this.value = value;
    this.overflow = overflow;
  }

  public static OverflowResult of(final WideValue value, final SecretBool overflow) {
    return new OverflowResult(checkNotNull(value, "value"), checkNotNull(overflow, "overflow"));
  }

  /**
   * The result modulo 2^width, identical to the unchecked operation.
   *
   * @return the wrapped value.
   */
  public WideValue value() {
    return value;
  }

  public SecretBool overflow() {
    return overflow;
  }

  @Override
  public String toString() {
    return "OverflowResult(" + value + ", " + overflow + ")";
  }
}
