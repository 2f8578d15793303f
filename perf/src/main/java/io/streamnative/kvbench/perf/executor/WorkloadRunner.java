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

import io.streamnative.kvbench.perf.generator.Seeds;
import io.streamnative.kvbench.perf.stats.WorkloadStats;
import io.streamnative.kvbench.perf.workload.Workload;
import io.streamnative.kvbench.perf.workload.Workloads;
import io.streamnative.kvbench.storage.Storage;
import io.streamnative.kvbench.storage.StorageException;
import java.time.Duration;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes a workload against a storage: validation, storage initialization, the load phase and the
 * run phase, in that order. All randomness is derived from the seed the runner was created with.
 */
@Slf4j
public final class WorkloadRunner {
    @Getter private final long seed;
    private final LoadExecutor loadExecutor;
    private final RunExecutor runExecutor;

    public WorkloadRunner(long seed) {
        this.seed = seed;
        this.loadExecutor = new LoadExecutor(Seeds.derive(seed, Seeds.LOAD_VALUE_SIZE));
        this.runExecutor = new RunExecutor(seed);
    }

    /**
     * @throws io.streamnative.kvbench.perf.workload.InvalidWorkloadException before any storage call
     *     if the workload is invalid.
     * @throws StorageException if initializing the storage or a load phase write failed.
     * @throws WorkloadExecutionException if the run phase failed.
     */
    public WorkloadStats execute(@NonNull Workload workload, @NonNull Storage storage)
            throws StorageException {
        Workloads.validate(workload);
        final WorkloadStats stats = new WorkloadStats();

        storage.init();
        log.info(
                "load phase is starting. workload={}, records={}", workload.name(),
                workload.loadInsertCount());
        final Duration loadTime = loadExecutor.load(storage, workload);
        stats.recordLoad(loadTime, workload.loadInsertCount());
        log.info("load phase is done in {} ms", loadTime.toMillis());

        log.info(
                "run phase is starting. workload={}, threads={}, operations per thread={}",
                workload.name(),
                workload.threadCount(),
                workload.operationCount());
        final RunPhaseResult run = runExecutor.run(storage, workload);
        stats.recordRun(run.wallTime(), run.merged());
        log.info("run phase is done in {} ms", run.wallTime().toMillis());
        return stats;
    }
}
