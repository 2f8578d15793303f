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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class WorkloadStatsTest {

    @Test
    void throughput() {
        assertThat(WorkloadStats.throughput(1_000, Duration.ofSeconds(1))).isEqualTo(1_000.0);
        assertThat(WorkloadStats.throughput(500, Duration.ofMillis(250))).isCloseTo(2_000.0, within(1e-9));
        assertThat(WorkloadStats.throughput(0, Duration.ofSeconds(1))).isZero();
        assertThat(WorkloadStats.throughput(10, Duration.ZERO)).isZero();
    }

    @Test
    void summedAndWallThroughputAreDistinct() {
        RunResult merged = new RunResult();
        for (int i = 0; i < 100; i++) {
            merged.recordRead(40_000_000);
        }
        for (int i = 0; i < 10; i++) {
            merged.recordWrite(100_000_000);
        }
        merged.recordSkip();

        WorkloadStats stats = new WorkloadStats();
        stats.recordLoad(Duration.ofSeconds(2), 1_000);
        stats.recordRun(Duration.ofSeconds(1), merged);

        assertThat(stats.loadThroughput()).isEqualTo(500.0);
        assertThat(stats.getRunReadTime()).isEqualTo(Duration.ofSeconds(4));
        assertThat(stats.readThroughput()).isEqualTo(25.0);
        assertThat(stats.readWallThroughput()).isEqualTo(100.0);
        assertThat(stats.getRunWriteTime()).isEqualTo(Duration.ofSeconds(1));
        assertThat(stats.writeThroughput()).isEqualTo(10.0);
        assertThat(stats.writeWallThroughput()).isEqualTo(10.0);
        assertThat(stats.getRunSkippedOps()).isEqualTo(1);
        assertThat(stats.getRunReadHistogram().getTotalCount()).isEqualTo(stats.getRunReadOps());
    }

    @Test
    void histogramsAreHandedOutAsCopies() {
        RunResult merged = new RunResult();
        merged.recordRead(5_000);
        WorkloadStats stats = new WorkloadStats();
        stats.recordRun(Duration.ofSeconds(1), merged);

        stats.getRunReadHistogram().recordValue(10);
        stats.getRunWriteHistogram().recordValue(10);
        merged.recordRead(5_000);

        assertThat(stats.getRunReadHistogram().getTotalCount()).isEqualTo(stats.getRunReadOps()).isEqualTo(1);
        assertThat(stats.getRunWriteHistogram().getTotalCount()).isEqualTo(stats.getRunWriteOps()).isZero();
    }

    @Test
    void freshStatsAreZero() {
        WorkloadStats stats = new WorkloadStats();
        assertThat(stats.loadThroughput()).isZero();
        assertThat(stats.readThroughput()).isZero();
        assertThat(stats.getRunReadHistogram().getTotalCount()).isZero();
    }
}
