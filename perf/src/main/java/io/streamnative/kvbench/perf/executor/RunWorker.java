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

import io.streamnative.kvbench.perf.generator.ByteGenerator;
import io.streamnative.kvbench.perf.generator.Generator;
import io.streamnative.kvbench.perf.generator.OperationType;
import io.streamnative.kvbench.perf.generator.SizeGenerator;
import io.streamnative.kvbench.perf.stats.RunResult;
import io.streamnative.kvbench.perf.workload.Workload;
import io.streamnative.kvbench.storage.Storage;
import java.util.concurrent.Callable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * One worker of the run phase. It owns its generators and its {@link RunResult}; the storage is the
 * only state shared with other workers.
 */
@Slf4j
final class RunWorker implements Callable<RunResult> {
    private final int index;
    private final Storage storage;
    private final long operationCount;
    private final int keySize;
    private final int valueSizeFloor;
    private final Generator<OperationType> operationGenerator;
    private final ByteGenerator byteGenerator;
    private final SizeGenerator valueSizeGenerator;

    RunWorker(
            int index,
            @NonNull Storage storage,
            @NonNull Workload workload,
            @NonNull Generator<OperationType> operationGenerator,
            @NonNull ByteGenerator byteGenerator,
            @NonNull SizeGenerator valueSizeGenerator) {
        this.index = index;
        this.storage = storage;
        this.operationCount = workload.operationCount();
        this.keySize = workload.keySize();
        this.valueSizeFloor = workload.valueSizeRange().minInclusive();
        this.operationGenerator = operationGenerator;
        this.byteGenerator = byteGenerator;
        this.valueSizeGenerator = valueSizeGenerator;
    }

    @Override
    public RunResult call() throws Exception {
        log.debug("worker {} started, {} operations", index, operationCount);
        final RunResult result = new RunResult();
        for (long i = 0; i < operationCount; i++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("worker " + index + " was cancelled");
            }
            final OperationType operationType = operationGenerator.nextValue();
            final byte[] key = byteGenerator.nextKey(keySize);
            switch (operationType) {
                case READ -> {
                    final long start = System.nanoTime();
                    storage.get(key);
                    result.recordRead(System.nanoTime() - start);
                }
                case WRITE -> {
                    final int valueSize = (int) (valueSizeGenerator.nextSize() + valueSizeFloor);
                    final byte[] value = byteGenerator.nextValue(valueSize);
                    final long start = System.nanoTime();
                    storage.set(key, value);
                    result.recordWrite(System.nanoTime() - start);
                }
                case SKIP -> result.recordSkip();
                default -> throw new IllegalStateException("unknown operation: " + operationType);
            }
        }
        log.debug(
                "worker {} done. reads: {}, writes: {}, skipped: {}",
                index,
                result.getReadOps(),
                result.getWriteOps(),
                result.getSkippedOps());
        return result;
    }
}
