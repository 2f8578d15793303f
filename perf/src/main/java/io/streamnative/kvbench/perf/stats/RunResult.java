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
 * What one worker measured during the run phase. Only the time spent inside storage calls is
 * accumulated.
 *
 * <p>Instances are confined to their worker until the worker completes.
 */
@Getter
public final class RunResult {
    private long readNanos;
    private long readOps;
    @Getter(AccessLevel.NONE)
    private final Histogram readHistogram;
    private long writeNanos;
    private long writeOps;
    @Getter(AccessLevel.NONE)
    private final Histogram writeHistogram;
    private long skippedOps;

    public RunResult() {
        this(LatencyHistograms.create(), LatencyHistograms.create());
    }

    private RunResult(Histogram readHistogram, Histogram writeHistogram) {
        this.readHistogram = readHistogram;
        this.writeHistogram = writeHistogram;
    }

    public void recordRead(long elapsedNanos) {
        readNanos += elapsedNanos;
        readOps++;
        LatencyHistograms.record(readHistogram, Math.floorDiv(elapsedNanos, 1_000L));
    }

    public void recordWrite(long elapsedNanos) {
        writeNanos += elapsedNanos;
        writeOps++;
        LatencyHistograms.record(writeHistogram, Math.floorDiv(elapsedNanos, 1_000L));
    }

    public void recordSkip() {
        skippedOps++;
    }

    /** A copy of the read latencies. Recording into it leaves this result unchanged. */
    public Histogram getReadHistogram() {
        return readHistogram.copy();
    }

    /** A copy of the write latencies. Recording into it leaves this result unchanged. */
    public Histogram getWriteHistogram() {
        return writeHistogram.copy();
    }

    public Duration readDuration() {
        return Duration.ofNanos(readNanos);
    }

    public Duration writeDuration() {
        return Duration.ofNanos(writeNanos);
    }

    public long totalOps() {
        return readOps + writeOps + skippedOps;
    }

    /**
     * A new result combining both operands: durations and counts add up and histograms are united.
     * Neither operand is modified, and the operation is commutative and associative.
     */
    public RunResult merge(@NonNull RunResult other) {
        final RunResult merged =
                new RunResult(
                        LatencyHistograms.union(readHistogram, other.readHistogram),
                        LatencyHistograms.union(writeHistogram, other.writeHistogram));
        merged.readNanos = readNanos + other.readNanos;
        merged.readOps = readOps + other.readOps;
        merged.writeNanos = writeNanos + other.writeNanos;
        merged.writeOps = writeOps + other.writeOps;
        merged.skippedOps = skippedOps + other.skippedOps;
        return merged;
    }
}
