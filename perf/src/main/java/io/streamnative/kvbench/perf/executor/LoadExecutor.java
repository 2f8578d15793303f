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
package io.streamnative.kvbench.perf.executor;

import io.streamnative.kvbench.perf.generator.DeterministicBytes;
import io.streamnative.kvbench.perf.generator.Generators;
import io.streamnative.kvbench.perf.generator.SizeGenerator;
import io.streamnative.kvbench.perf.workload.ValueSizeRange;
import io.streamnative.kvbench.perf.workload.Workload;
import io.streamnative.kvbench.storage.Storage;
import io.streamnative.kvbench.storage.StorageException;
import java.time.Duration;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Populates the storage with the key universe of a workload, sequentially, on the calling thread.
 *
 * <p>Record {@code i} of {@code 0 .. loadInsertCount} gets its key and value bytes from a source
 * seeded with {@code i}, so the loaded keys do not depend on the seed of the run. Only the value
 * sizes do.
 */
@Slf4j
@RequiredArgsConstructor
public final class LoadExecutor {
    private final long seed;

    /**
     * Writes every record of the workload. The storage must have been initialized.
     *
     * @return the time spent inside {@link Storage#set(byte[], byte[])} calls.
     * @throws StorageException on the first failed write. The load is abandoned.
     */
    public Duration load(@NonNull Storage storage, @NonNull Workload workload)
            throws StorageException {
        final long count = workload.loadInsertCount();
        final ValueSizeRange valueRange = workload.valueSizeRange();
        final SizeGenerator valueSizeGenerator =
                Generators.createSizeGenerator(valueRange.width(), seed);
        final int keySize = workload.keySize();
        final long progressStep = Math.max(count / 10, 1);

        long elapsedNanos = 0;
        for (long i = 0; i < count; i++) {
            final int valueSize = (int) (valueSizeGenerator.nextSize() + valueRange.minInclusive());
            final byte[] key = new byte[keySize];
            final byte[] value = new byte[valueSize];
            DeterministicBytes.fill(i, key, value);

            final long start = System.nanoTime();
            storage.set(key, value);
            elapsedNanos += System.nanoTime() - start;

            if ((i + 1) % progressStep == 0) {
                log.debug("loaded {}/{} records", i + 1, count);
            }
        }
        return Duration.ofNanos(elapsedNanos);
    }
}
