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

import java.math.BigInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.WideValue;

/**
 * Reduced-privacy division: both operands are decrypted, divided in the clear and the result is
 * injected back as a public constant.
 *
 * <p>Anyone observing the backend learns the dividend, the divisor and the result. A zero divisor
 * yields zero for both the quotient and the remainder. Callers that cannot accept the reveal turn
 * it off with {@link WideIntConfig#revealingDivisionAllowed()}.
 */
public final class RevealingDivision {
  private static final Logger LOG = LoggerFactory.getLogger(RevealingDivision.class);

  private RevealingDivision() {}

  /**
   * Divides two unsigned values by revealing them.
   *
   * @param backend word backend.
   * @param config division policy.
   * @param a dividend, read as unsigned.
   * @param b divisor, read as unsigned.
   * @param remainder whether to return the remainder instead of the quotient.
   * @return the quotient or remainder, typed as {@code a}.
   * @throws UnsupportedOperationException if the configuration forbids revealing operands.
   */
  public static WideValue divide(
      final WordBackend backend,
      final WideIntConfig config,
      final WideValue a,
      final WideValue b,
      final boolean remainder) {
    IntType type = LimbVectors.commonType(a, b);
    if (!config.revealingDivisionAllowed()) {
      throw new UnsupportedOperationException(
          "Division of " + type + " needs to reveal its operands, which is disabled");
    }
    LOG.debug("Revealing {} operands to compute a {}", type, remainder ? "remainder" : "quotient");
    IntType unsigned = type.withSignedness(false);
    BigInteger dividend = Boundary.decrypt(backend, a.reinterpret(unsigned));
    BigInteger divisor = Boundary.decrypt(backend, b.reinterpret(unsigned));
    BigInteger result;
    if (divisor.signum() == 0) {
      result = BigInteger.ZERO;
    } else {
      result = remainder ? dividend.mod(divisor) : dividend.divide(divisor);
    }
    return LimbVectors.constant(backend, type, result);
  }
}
