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

/** Draws sizes from a Zipfian distribution over {@code [1, range]}. */
public final class SizeGenerator {
    private final ZipfDistribution zipf;

    SizeGenerator(ZipfDistribution zipf) {
        this.zipf = zipf;
    }

    /**
     * The next sample, in {@code [1, range]}. Callers add it to the floor of the size range they are
     * generating for.
     */
    public long nextSize() {
        return zipf.sample();
    }

    public long range() {
        return zipf.getNumberOfElements();
    }
}
