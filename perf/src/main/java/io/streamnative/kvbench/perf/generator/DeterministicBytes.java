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

import java.util.Random;

/**
 * Fills buffers from a byte source seeded by a logical index. The same index always produces the
 * same bytes, in whichever thread and order it is requested.
 */
public final class DeterministicBytes {

    private DeterministicBytes() {}

    /** Fills the buffers one after the other from a single source seeded with {@code index}. */
    public static void fill(long index, byte[]... buffers) {
        final Random source = new Random(index);
        for (byte[] buffer : buffers) {
            source.nextBytes(buffer);
        }
    }

    public static byte[] of(long index, int size) {
        final byte[] bytes = new byte[size];
        fill(index, bytes);
        return bytes;
    }
}
