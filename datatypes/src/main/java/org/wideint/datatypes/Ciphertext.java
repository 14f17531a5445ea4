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

import static com.google.common.base.Preconditions.checkNotNull;

import org.apache.tuweni.bytes.Bytes;

/** Durable encryption of one secret word under the network key, suitable for storage. */
public final class Ciphertext {
  private final Bytes payload;

  private Ciphertext(final Bytes payload) {
    this.payload = payload;
  }

  /**
   * Wraps a serialized ciphertext.
   *
   * @param payload backend-specific serialized form.
   * @return the ciphertext.
   */
  public static Ciphertext wrap(final Bytes payload) {
    return new Ciphertext(checkNotNull(payload, "payload"));
  }

  public Bytes payload() {
    return payload;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof Ciphertext)) return false;
    return payload.equals(((Ciphertext) obj).payload);
  }

  @Override
  public int hashCode() {
    return payload.hashCode();
  }

  @Override
  public String toString() {
    return "Ciphertext(" + payload.toHexString() + ")";
  }
}
