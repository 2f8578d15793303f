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
package io.streamnative.kvbench.perf.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.streamnative.kvbench.perf.stats.WorkloadStats;
import io.streamnative.kvbench.perf.workload.Workload;
import io.streamnative.kvbench.perf.workload.WorkloadDescriptor;
import java.time.Duration;
import lombok.NonNull;

public record BenchmarkReport(
        /* definitions section */
        String storage,
        WorkloadDescriptor workload,
        long seed,
        /* metadata section */
        long timestamp,
        /* load section */
        Section load,
        /* run read section */
        Section read,
        /* run write section */
        Section write,
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        long skippedOps) {

    /**
     * @param timeNanos the load time for the load section, the run phase wall time otherwise.
     * @param throughput ops per second of time spent inside storage calls, summed over workers.
     * @param wallThroughput ops per second of run phase wall time. Absent for the load section.
     * @param latencyMicros absent for the load section.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Section(
            long ops,
            long timeNanos,
            double throughput,
            Double wallThroughput,
            HistogramSnapshot latencyMicros) {

        public Duration time() {
            return Duration.ofNanos(timeNanos);
        }
    }

    public static BenchmarkReport from(
            @NonNull String storage, @NonNull Workload workload, long seed,
            @NonNull WorkloadStats stats) {
        final long runWallNanos = stats.getRunWallTime().toNanos();
        return new BenchmarkReport(
                storage,
                WorkloadDescriptor.copyOf(workload),
                seed,
                System.currentTimeMillis(),
                new Section(
                        stats.getLoadOps(),
                        stats.getLoadTime().toNanos(),
                        stats.loadThroughput(),
                        null,
                        null),
                new Section(
                        stats.getRunReadOps(),
                        runWallNanos,
                        stats.readThroughput(),
                        stats.readWallThroughput(),
                        HistogramSnapshot.fromHistogram(stats.getRunReadHistogram())),
                new Section(
                        stats.getRunWriteOps(),
                        runWallNanos,
                        stats.writeThroughput(),
                        stats.writeWallThroughput(),
                        HistogramSnapshot.fromHistogram(stats.getRunWriteHistogram())),
                stats.getRunSkippedOps());
    }
}
