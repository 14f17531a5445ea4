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

import java.util.List;

import com.google.common.collect.ImmutableList;

/** Client input for a wide value: one proven ciphertext per limb, least significant first. */
public final class WideInputProof {
  private final IntType type;
  private final ImmutableList<InputProof> limbs;

  private WideInputProof(final IntType type, final ImmutableList<InputProof> limbs) {
    this.type = type;
    this.limbs = limbs;
  }

  public static WideInputProof of(final IntType type, final List<InputProof> limbs) {
    checkNotNull(type, "type");
    ImmutableList<InputProof> copy = ImmutableList.copyOf(limbs);
    checkArgument(
        copy.size() == type.limbCount(),
        "%s needs %s limb proofs but got %s",
        type,
        type.limbCount(),
        copy.size());
    return new WideInputProof(type, copy);
  }

  public IntType type() {
    return type;
  }

  public List<InputProof> limbs() {
    return limbs;
  }

  /**
   * Copy with one limb replaced, e.g. to build a tampered input in tests.
   *
   * @param index limb position.
   * @param proof replacement proof.
   * @return a new input proof.
   */
  public WideInputProof withLimb(final int index, final InputProof proof) {
    ImmutableList.Builder<InputProof> builder = ImmutableList.builder();
    for (int i = 0; i < limbs.size(); i++) {
      builder.add(i == index ? checkNotNull(proof, "proof") : limbs.get(i));
    }
    return new WideInputProof(type, builder.build());
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof WideInputProof)) return false;
    WideInputProof other = (WideInputProof) obj;
    return type == other.type && limbs.equals(other.limbs);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + limbs.hashCode();
  }

  @Override
  public String toString() {
    return "WideInputProof{" + type + ", " + limbs + "}";
  }
}
