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

/**
 * A secret word re-encrypted to one recipient's key. Only the holder of that key can decrypt it,
 * and only outside the backend.
 */
public final class UserCiphertext {
  private final Bytes payload;
  private final Bytes recipientKey;

  private UserCiphertext(final Bytes payload, final Bytes recipientKey) {
    this.payload = payload;
    this.recipientKey = recipientKey;
  }

  /**
   * Wraps a key-switched ciphertext.
   *
   * @param payload backend-specific serialized form.
   * @param recipientKey public identifier of the recipient key the payload is bound to.
   * @return the user ciphertext.
   */
  public static UserCiphertext wrap(final Bytes payload, final Bytes recipientKey) {
    return new UserCiphertext(
        checkNotNull(payload, "payload"), checkNotNull(recipientKey, "recipientKey"));
  }

  public Bytes payload() {
    return payload;
  }

  public Bytes recipientKey() {
    return recipientKey;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof UserCiphertext)) return false;
    UserCiphertext other = (UserCiphertext) obj;
    return payload.equals(other.payload) && recipientKey.equals(other.recipientKey);
  }

  @Override
  public int hashCode() {
    return 31 * payload.hashCode() + recipientKey.hashCode();
  }

  @Override
  public String toString() {
    return "UserCiphertext(" + payload.toHexString() + ")";
  }
}
