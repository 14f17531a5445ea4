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

/** A secret boolean: a secret word whose value is 0 or 1. */
public final class SecretBool {
  private final SecretWord word;

  private SecretBool(final SecretWord word) {
    this.word = word;
  }

  /**
   * Reads a secret word as a boolean. The caller guarantees the word holds 0 or 1.
   *
   * @param word secret 0/1 word.
   * @return the boolean view of the word.
   */
  public static SecretBool of(final SecretWord word) {
    return new SecretBool(checkNotNull(word, "word"));
  }

  public SecretWord word() {
    return word;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof SecretBool)) return false;
    return word.equals(((SecretBool) obj).word);
  }

  @Override
  public int hashCode() {
    return word.hashCode();
  }

  @Override
  public String toString() {
    return "SecretBool(" + word + ")";
  }
}
