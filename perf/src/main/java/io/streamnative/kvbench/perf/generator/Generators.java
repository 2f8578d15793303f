/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamnative.kvbench.perf.generator;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

public final class Generators {
    /** Exponent of every Zipfian distribution the benchmark draws from. */
    public static final double ZIPF_EXPONENT = 1.0;

    private Generators() {}

    public static SizeGenerator createSizeGenerator(long range, long seed) {
        final RandomGenerator rng = new Well19937c(seed);
        return new SizeGenerator(zipf(rng, range, "size range"));
    }

    public static ByteGenerator createByteGenerator(long cardinality, long seed) {
        final RandomGenerator rng = new Well19937c(seed);
        return new ByteGenerator(zipf(rng, cardinality, "key cardinality"), rng);
    }

    public static OperationGenerator createOperationGenerator(
            double readPercent, double writePercent, long seed) {
        if (readPercent < 0 || writePercent < 0 || readPercent + writePercent > 1.0) {
            throw new IllegalArgumentException(
                    "invalid operation mix. read: " + readPercent + ", write: " + writePercent);
        }
        return new OperationGenerator(new Well19937c(seed), readPercent, writePercent);
    }

    private static ZipfDistribution zipf(RandomGenerator rng, long elements, String what) {
        if (elements < 1) {
            throw new IllegalArgumentException(what + " must be at least 1 but was " + elements);
        }
        if (elements > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    what + " can not be larger than " + Integer.MAX_VALUE + " but was " + elements);
        }
        return new ZipfDistribution(rng, (int) elements, ZIPF_EXPONENT);
    }
}
