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

/**
 * Derives independent seeds for every random stream of a benchmark from the single seed the run was
 * started with, so that a run can be repeated exactly.
 */
public final class Seeds {

    /* Stream identifiers. Worker streams are offset by the worker index. */
    public static final long LOAD_VALUE_SIZE = 1;
    public static final long WORKER_OPERATION = 1L << 20;
    public static final long WORKER_VALUE_SIZE = 2L << 20;
    public static final long WORKER_BYTES = 3L << 20;

    private Seeds() {}

    public static long derive(long seed, long stream) {
        return mix(seed + mix(stream));
    }

    /** The SplitMix64 finalizer. */
    static long mix(long z) {
        z += 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
