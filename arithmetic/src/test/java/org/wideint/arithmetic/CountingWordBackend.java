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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import org.apache.tuweni.bytes.Bytes;
import org.wideint.datatypes.Ciphertext;
import org.wideint.datatypes.InputProof;
import org.wideint.datatypes.SecretWord;
import org.wideint.datatypes.UserCiphertext;

/** Word backend decorator recording the sequence of primitive calls. */
public class CountingWordBackend implements WordBackend {
  private final WordBackend delegate;
  private final List<String> calls = new ArrayList<>();

  public CountingWordBackend(final WordBackend delegate) {
    this.delegate = delegate;
  }

  public ImmutableList<String> calls() {
    return ImmutableList.copyOf(calls);
  }

  public Multiset<String> counts() {
    return HashMultiset.create(calls);
  }

  public int count(final String primitive) {
    return counts().count(primitive);
  }

  public void reset() {
    calls.clear();
  }

  private void record(final String primitive) {
    calls.add(primitive);
  }

  @Override
  public SecretWord add(final SecretWord a, final SecretWord b) {
    record("add");
    return delegate.add(a, b);
  }

  @Override
  public SecretWord sub(final SecretWord a, final SecretWord b) {
    record("sub");
    return delegate.sub(a, b);
  }

  @Override
  public SecretWord mul(final SecretWord a, final SecretWord b) {
    record("mul");
    return delegate.mul(a, b);
  }

  @Override
  public SecretWord div(final SecretWord a, final SecretWord b) {
    record("div");
    return delegate.div(a, b);
  }

  @Override
  public SecretWord rem(final SecretWord a, final SecretWord b) {
    record("rem");
    return delegate.rem(a, b);
  }

  @Override
  public SecretWord and(final SecretWord a, final SecretWord b) {
    record("and");
    return delegate.and(a, b);
  }

  @Override
  public SecretWord or(final SecretWord a, final SecretWord b) {
    record("or");
    return delegate.or(a, b);
  }

  @Override
  public SecretWord xor(final SecretWord a, final SecretWord b) {
    record("xor");
    return delegate.xor(a, b);
  }

  @Override
  public SecretWord shl(final SecretWord a, final int shift) {
    record("shl");
    return delegate.shl(a, shift);
  }

  @Override
  public SecretWord shr(final SecretWord a, final int shift) {
    record("shr");
    return delegate.shr(a, shift);
  }

  @Override
  public SecretWord eq(final SecretWord a, final SecretWord b) {
    record("eq");
    return delegate.eq(a, b);
  }

  @Override
  public SecretWord ne(final SecretWord a, final SecretWord b) {
    record("ne");
    return delegate.ne(a, b);
  }

  @Override
  public SecretWord lt(final SecretWord a, final SecretWord b) {
    record("lt");
    return delegate.lt(a, b);
  }

  @Override
  public SecretWord le(final SecretWord a, final SecretWord b) {
    record("le");
    return delegate.le(a, b);
  }

  @Override
  public SecretWord gt(final SecretWord a, final SecretWord b) {
    record("gt");
    return delegate.gt(a, b);
  }

  @Override
  public SecretWord ge(final SecretWord a, final SecretWord b) {
    record("ge");
    return delegate.ge(a, b);
  }

  @Override
  public SecretWord mux(final SecretWord cond, final SecretWord a, final SecretWord b) {
    record("mux");
    return delegate.mux(cond, a, b);
  }

  @Override
  public long decrypt(final SecretWord a) {
    record("decrypt");
    return delegate.decrypt(a);
  }

  @Override
  public SecretWord setPublic(final long value) {
    record("setPublic");
    return delegate.setPublic(value);
  }

  @Override
  public SecretWord random(final int bits) {
    record("random");
    return delegate.random(bits);
  }

  @Override
  public SecretWord validateCiphertext(final InputProof proof) {
    record("validateCiphertext");
    return delegate.validateCiphertext(proof);
  }

  @Override
  public Ciphertext offboard(final SecretWord a) {
    record("offboard");
    return delegate.offboard(a);
  }

  @Override
  public SecretWord onboard(final Ciphertext ciphertext) {
    record("onboard");
    return delegate.onboard(ciphertext);
  }

  @Override
  public UserCiphertext offboardToUser(final SecretWord a, final Bytes recipientKey) {
    record("offboardToUser");
    return delegate.offboardToUser(a, recipientKey);
  }
}
