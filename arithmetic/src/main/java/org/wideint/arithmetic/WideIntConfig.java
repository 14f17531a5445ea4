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

/** Immutable settings of a {@link WideIntegers} instance. */
public final class WideIntConfig {

  /** Defaults: revealing division allowed. */
  public static final WideIntConfig DEFAULT = builder().build();

  private final boolean revealingDivisionAllowed;

  private WideIntConfig(final Builder builder) {
    this.revealingDivisionAllowed = builder.revealingDivisionAllowed;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Whether 128- and 256-bit divisions may fall back to {@link RevealingDivision}. When false such
   * divisions throw {@link UnsupportedOperationException}.
   *
   * @return true by default.
   */
  public boolean revealingDivisionAllowed() {
    return revealingDivisionAllowed;
  }

  @Override
  public String toString() {
    return "WideIntConfig{revealingDivisionAllowed=" + revealingDivisionAllowed + "}";
  }

  /** Builder of {@link WideIntConfig}. */
  public static final class Builder {
    private boolean revealingDivisionAllowed = true;

    private Builder() {}

    public Builder revealingDivisionAllowed(final boolean allowed) {
      this.revealingDivisionAllowed = allowed;
      return this;
    }

    public WideIntConfig build() {
      return new WideIntConfig(this);
    }
  }
}
