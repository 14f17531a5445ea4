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
 * Externally supplied encrypted word together with a proof of correct encryption. It must be
 * validated by the backend before it is trusted as a secret word.
 */
public final class InputProof {
  private final Ciphertext ciphertext;
  private final Bytes proof;

  private InputProof(final Ciphertext ciphertext, final Bytes proof) {
    this.ciphertext = ciphertext;
    this.proof = proof;
  }

  public static InputProof of(final Ciphertext ciphertext, final Bytes proof) {
    return new InputProof(checkNotNull(ciphertext, "ciphertext"), checkNotNull(proof, "proof"));
  }

  public Ciphertext ciphertext() {
    return ciphertext;
  }

  public Bytes proof() {
    return proof;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof InputProof)) return false;
    InputProof other = (InputProof) obj;
    return ciphertext.equals(other.ciphertext) && proof.equals(other.proof);
  }

  @Override
  public int hashCode() {
    return 31 * ciphertext.hashCode() + proof.hashCode();
  }

  @Override
  public String toString() {
    return "InputProof(" + ciphertext + ", proof=" + proof.toHexString() + ")";
  }
}
