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

/**
 * Opaque handle to one 64-bit secret value held by a word backend.
 *
 * <p>The handle carries no plaintext. Two handles are equal when the backend issued the same id,
 * which says nothing about the secret values behind them.
 */
public final class SecretWord {
  private final long handle;

  private SecretWord(final long handle) {
    this.handle = handle;
  }

  /**
   * Wraps a backend-issued handle.
   *
   * @param handle backend id.
   * @return the secret word handle.
   */
  public static SecretWord ofHandle(final long handle) {
    return new SecretWord(handle);
  }

  public long handle() {
    return handle;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SecretWord)) return false;
    SecretWord other = (SecretWord) obj;
    return handle == other.handle;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(handle);
  }

  @Override
  public String toString() {
    return "SecretWord#" + handle;
  }
}
