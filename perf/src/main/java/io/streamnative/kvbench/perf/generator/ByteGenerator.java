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

/**
 * Produces key and value payloads.
 *
 * <p>Keys are skewed: a Zipfian index over the key space is drawn first and the key bytes are
 * derived from that index alone, so that few keys are hot and each index always maps to the same
 * key. Values come from the generator's own stream and are never repeated on purpose.
 *
 * <p>Not thread safe. Every worker owns its generator.
 */
public final class ByteGenerator {
    private final ZipfDistribution zipf;
    private final RandomGenerator rng;

    ByteGenerator(ZipfDistribution zipf, RandomGenerator rng) {
        this.zipf = zipf;
        this.rng = rng;
    }

    /** The next key index, in {@code [1, cardinality]}. */
    public long nextIndex() {
        return zipf.sample();
    }

    public byte[] nextKey(int size) {
        return keyOf(nextIndex(), size);
    }

    public byte[] nextValue(int size) {
        final byte[] bytes = new byte[size];
        rng.nextBytes(bytes);
        return bytes;
    }

    public long cardinality() {
        return zipf.getNumberOfElements();
    }

    /** The key bytes a given index maps to. */
    public static byte[] keyOf(long index, int size) {
        return DeterministicBytes.of(index, size);
    }
}
