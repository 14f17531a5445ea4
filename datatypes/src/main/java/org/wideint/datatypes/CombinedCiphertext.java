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
package org.wideint.datatypes;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of offboarding a value to durable storage and to a recipient in one call. The network
 * form stays canonical; the user form is an additional copy.
 */
public final class CombinedCiphertext {
  private final WideCiphertext network;
  private final WideUserCiphertext user;

  private CombinedCiphertext(final WideCiphertext network, final WideUserCiphertext user) {
    this.network = network;
    this.user = user;
  }

  public static CombinedCiphertext of(final WideCiphertext network, final WideUserCiphertext user) {
    checkNotNull(network, "network");
    checkNotNull(user, "user");
    checkArgument(network.type() == user.type(), "Mismatched types %s / %s", network, user);
    return new CombinedCiphertext(network, user);
  }

  public WideCiphertext network() {
    return network;
  }

  public WideUserCiphertext user() {
    return user;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof CombinedCiphertext)) return false;
    CombinedCiphertext other = (CombinedCiphertext) obj;
    return network.equals(other.network) && user.equals(other.user);
  }

  @Override
  public int hashCode() {
    return 31 * network.hashCode() + user.hashCode();
  }

  @Override
  public String toString() {
    return "CombinedCiphertext{" + network + ", " + user + "}";
  }
}
