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

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Picks the next operation of a worker by drawing {@code x} uniformly from {@code [0, 1)}: reads own
 * {@code [0, read)}, writes own {@code [read, read + write)} and the remainder, if any, is skipped.
 */
public final class OperationGenerator implements Generator<OperationType> {
    private final RandomGenerator rng;
    private final double readThreshold;
    private final double writeThreshold;

    OperationGenerator(RandomGenerator rng, double readPercent, double writePercent) {
        this.rng = rng;
        this.readThreshold = readPercent;
        this.writeThreshold = readPercent + writePercent;
    }

    @Override
    public OperationType nextValue() {
        return select(rng.nextDouble());
    }

    OperationType select(double x) {
        if (x < readThreshold) {
            return OperationType.READ;
        } else if (x < writeThreshold) {
            return OperationType.WRITE;
        }
        return OperationType.SKIP;
    }
}
