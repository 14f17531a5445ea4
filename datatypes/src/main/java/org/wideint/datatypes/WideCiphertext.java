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

/** Durable network-key form of a wide value: one ciphertext per limb, least significant first. */
public final class WideCiphertext {
  private final IntType type;
  private final ImmutableList<Ciphertext> limbs;

  private WideCiphertext(final IntType type, final ImmutableList<Ciphertext> limbs) {
    this.type = type;
    this.limbs = limbs;
  }

  public static WideCiphertext of(final IntType type, final List<Ciphertext> limbs) {
    checkNotNull(type, "type");
    ImmutableList<Ciphertext> copy = ImmutableList.copyOf(limbs);
    checkArgument(
        copy.size() == type.limbCount(),
        "%s needs %s limb ciphertexts but got %s",
        type,
        type.limbCount(),
        copy.size());
    return new WideCiphertext(type, copy);
  }

  public IntType type() {
    return type;
  }

  public List<Ciphertext> limbs() {
    return limbs;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof WideCiphertext)) return false;
    WideCiphertext other = (WideCiphertext) obj;
    return type == other.type && limbs.equals(other.limbs);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + limbs.hashCode();
  }

  @Override
  public String toString() {
    return "WideCiphertext{" + type + ", " + limbs + "}";
  }
}
