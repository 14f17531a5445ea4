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

import java.math.BigInteger;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.apache.tuweni.bytes.Bytes;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.wideint.datatypes.IntType;
import org.wideint.datatypes.WideValue;

/** Cost of the composed operations over the clear-text backend, dominated by word calls. */
@State(Scope.Thread)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(value = TimeUnit.MICROSECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@BenchmarkMode(Mode.AverageTime)
public class WideArithmeticBenchmark {
  protected static final int SAMPLE_SIZE = 1_000;

  @Param({"UINT64", "UINT128", "INT256"})
  private IntType type;

  protected WideIntegers ints;
  protected WideValue[] aPool;
  protected WideValue[] bPool;
  protected BigInteger[] publicPool;
  protected int index;

  @Setup()
  public void setUp() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final byte[] key = new byte[32];
    random.nextBytes(key);
    ints =
        new WideIntegers(
            new ClearTextWordBackend(Bytes.wrap(key), new Random(random.nextLong())));
    aPool = new WideValue[SAMPLE_SIZE];
    bPool = new WideValue[SAMPLE_SIZE];
    publicPool = new BigInteger[SAMPLE_SIZE];
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      aPool[i] = ints.random(type);
      bPool[i] = ints.randomBounded(type, Math.max(1, type.bitWidth() / 2));
      publicPool[i] = BigInteger.valueOf(1 + random.nextInt(1 << 20));
    }
    index = 0;
  }

  @Benchmark
  public void add(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.add(aPool[i], bPool[i]));
  }

  @Benchmark
  public void mul(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.mul(aPool[i], bPool[i]));
  }

  @Benchmark
  public void mulRhs(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.mulRhs(aPool[i], publicPool[i]));
  }

  @Benchmark
  public void checkedMulWithOverflowBit(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.checkedMulWithOverflowBit(aPool[i], bPool[i]));
  }

  @Benchmark
  public void lt(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.lt(aPool[i], bPool[i]));
  }

  @Benchmark
  public void shl(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(ints.shl(aPool[i], 1 + i % (type.bitWidth() - 1)));
  }
}
