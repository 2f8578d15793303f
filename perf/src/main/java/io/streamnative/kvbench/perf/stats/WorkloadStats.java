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
package io.streamnative.kvbench.perf.stats;

import java.time.Duration;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import org.HdrHistogram.Histogram;

/**
 * The outcome of one benchmark invocation.
 *
 * <p>{@link #getRunWallTime()} is the elapsed time of the whole run phase, while the read and write
 * times are summed over all workers. With more than one worker the two can not be compared with
 * each other.
 *
 * <p>Histograms are handed out as copies, their counts always match the recorded op counts.
 */
@Getter
public final class WorkloadStats {
    private Duration loadTime = Duration.ZERO;
    private long loadOps;

    private Duration runWallTime = Duration.ZERO;
    private Duration runReadTime = Duration.ZERO;
    private long runReadOps;
    @Getter(AccessLevel.NONE)
    private Histogram runReadHistogram = LatencyHistograms.create();
    private Duration runWriteTime = Duration.ZERO;
    private long runWriteOps;
    @Getter(AccessLevel.NONE)
    private Histogram runWriteHistogram = LatencyHistograms.create();
    private long runSkippedOps;

    public void recordLoad(@NonNull Duration loadTime, long loadOps) {
        this.loadTime = loadTime;
        this.loadOps = loadOps;
    }

    public void recordRun(@NonNull Duration wallTime, @NonNull RunResult merged) {
        this.runWallTime = wallTime;
        this.runReadTime = merged.readDuration();
        this.runReadOps = merged.getReadOps();
        this.runReadHistogram = merged.getReadHistogram();
        this.runWriteTime = merged.writeDuration();
        this.runWriteOps = merged.getWriteOps();
        this.runWriteHistogram = merged.getWriteHistogram();
        this.runSkippedOps = merged.getSkippedOps();
    }

    public Histogram getRunReadHistogram() {
        return runReadHistogram.copy();
    }

    public Histogram getRunWriteHistogram() {
        return runWriteHistogram.copy();
    }

    public double loadThroughput() {
        return throughput(loadOps, loadTime);
    }

    /** Reads per second of time spent in reads, summed across workers. */
    public double readThroughput() {
        return throughput(runReadOps, runReadTime);
    }

    /** Writes per second of time spent in writes, summed across workers. */
    public double writeThroughput() {
        return throughput(runWriteOps, runWriteTime);
    }

    /** Reads per second of run phase wall time. */
    public double readWallThroughput() {
        return throughput(runReadOps, runWallTime);
    }

    /** Writes per second of run phase wall time. */
    public double writeWallThroughput() {
        return throughput(runWriteOps, runWallTime);
    }

    public static double throughput(long ops, @NonNull Duration duration) {
        if (ops == 0 || duration.isZero() || duration.isNegative()) {
            return 0.0;
        }
        return ops / (duration.toNanos() / 1e9);
    }
}
