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

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.streamnative.kvbench.perf.generator.Generators;
import io.streamnative.kvbench.perf.generator.Seeds;
import io.streamnative.kvbench.perf.stats.RunResult;
import io.streamnative.kvbench.perf.workload.Workload;
import io.streamnative.kvbench.storage.Storage;
import java.time.Duration;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the measured phase: {@code threadCount} workers on dedicated threads, each issuing {@code
 * operationCount} operations. The calling thread blocks until every worker has joined.
 *
 * <p>The first worker failure cancels the others and fails the phase. No partial result is
 * returned, and the phase does not complete, normally or not, before every worker thread has
 * stopped: the caller may close the storage as soon as {@link #run} returns or throws.
 */
@Slf4j
@RequiredArgsConstructor
public final class RunExecutor {
    private final long seed;

    public RunPhaseResult run(@NonNull Storage storage, @NonNull Workload workload) {
        final int threadCount = workload.threadCount();
        final RunWorker[] workers = new RunWorker[threadCount];
        for (int i = 0; i < threadCount; i++) {
            workers[i] = createWorker(i, storage, workload);
        }

        final ExecutorService executor =
                Executors.newFixedThreadPool(
                        threadCount,
                        new ThreadFactoryBuilder().setNameFormat("kvbench-worker-%d").build());
        try {
            final CompletionService<RunResult> completion = new ExecutorCompletionService<>(executor);
            final long start = System.nanoTime();
            for (RunWorker worker : workers) {
                completion.submit(worker);
            }
            RunResult merged = new RunResult();
            for (int i = 0; i < threadCount; i++) {
                merged = merged.merge(completion.take().get());
            }
            final Duration wallTime = Duration.ofNanos(System.nanoTime() - start);
            return new RunPhaseResult(wallTime, merged);
        } catch (ExecutionException e) {
            log.warn("run phase aborted, a worker failed: {}", e.getCause().toString());
            throw new WorkloadExecutionException("Run phase failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkloadExecutionException("Interrupted while waiting for the workers", e);
        } finally {
            executor.shutdownNow();
            // a cancelled worker stops after its current storage call returns
            Uninterruptibles.awaitTerminationUninterruptibly(executor);
        }
    }

    private RunWorker createWorker(int index, Storage storage, Workload workload) {
        return new RunWorker(
                index,
                storage,
                workload,
                Generators.createOperationGenerator(
                        workload.readPercent(),
                        workload.writePercent(),
                        Seeds.derive(seed, Seeds.WORKER_OPERATION + index)),
                Generators.createByteGenerator(
                        workload.loadInsertCount(), Seeds.derive(seed, Seeds.WORKER_BYTES + index)),
                Generators.createSizeGenerator(
                        workload.valueSizeRange().width(),
                        Seeds.derive(seed, Seeds.WORKER_VALUE_SIZE + index)));
    }
}
