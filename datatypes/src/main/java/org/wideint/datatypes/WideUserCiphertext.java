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

/** A wide value re-encrypted limb by limb to one recipient. */
public final class WideUserCiphertext {
  private final IntType type;
  private final ImmutableList<UserCiphertext> limbs;

  private WideUserCiphertext(final IntType type, final ImmutableList<UserCiphertext> limbs) {
    this.type = type;
    this.limbs = limbs;
  }

  public static WideUserCiphertext of(final IntType type, final List<UserCiphertext> limbs) {
    checkNotNull(type, "type");
    ImmutableList<UserCiphertext> copy = ImmutableList.copyOf(limbs);
    checkArgument(
        copy.size() == type.limbCount(),
        "%s needs %s limb ciphertexts but got %s",
        type,
        type.limbCount(),
        copy.size());
    return new WideUserCiphertext(type, copy);
  }

  public IntType type() {
    return type;
  }

  public List<UserCiphertext> limbs() {
    return limbs;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof WideUserCiphertext)) return false;
    WideUserCiphertext other = (WideUserCiphertext) obj;
    return type == other.type && limbs.equals(other.limbs);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + limbs.hashCode();
  }

  @Override
  public String toString() {
    return "WideUserCiphertext{" + type + ", " + limbs + "}";
  }
}
