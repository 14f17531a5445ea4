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

import java.math.BigInteger;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

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

@State(Scope.Thread)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@OutputTimeUnit(value = TimeUnit.NANOSECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@BenchmarkMode(Mode.AverageTime)
public class LimbCodecBenchmark {

  protected static final int SAMPLE_SIZE = 30_000;

  @Param({"UINT64", "INT128", "UINT256"})
  private IntType type;

  protected BigInteger[] valuePool;
  protected long[][] limbPool;
  protected int index;

  @Setup()
  public void setUp() {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    valuePool = new BigInteger[SAMPLE_SIZE];
    limbPool = new long[SAMPLE_SIZE][];
    for (int i = 0; i < SAMPLE_SIZE; i++) {
      final int bits = 1 + random.nextInt(type.bitWidth()); // [1, width]
      final BigInteger value = LimbCodec.truncate(new BigInteger(bits, random), type);
      valuePool[i] = value;
      limbPool[i] = LimbCodec.toLimbs(value, type);
    }
    index = 0;
  }

  @Benchmark
  public void baseline(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(i);
  }

  @Benchmark
  public void toLimbs(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(LimbCodec.toLimbs(valuePool[i], type));
  }

  @Benchmark
  public void fromLimbs(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(LimbCodec.fromLimbs(limbPool[i], type));
  }

  @Benchmark
  public void nSetLimbs(final Blackhole blackhole) {
    final int i = index;
    index = (index + 1) % SAMPLE_SIZE;
    blackhole.consume(LimbCodec.nSetLimbs(limbPool[i]));
  }
}
