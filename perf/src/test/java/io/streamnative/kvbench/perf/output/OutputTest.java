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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamnative.kvbench.perf.stats.RunResult;
import io.streamnative.kvbench.perf.stats.WorkloadStats;
import io.streamnative.kvbench.perf.workload.ValueSizeRange;
import io.streamnative.kvbench.perf.workload.WorkloadDescriptor;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class OutputTest {

    private static final WorkloadDescriptor workload =
            WorkloadDescriptor.builder()
                    .name("read-write")
                    .loadInsertCount(1_000)
                    .operationCount(100)
                    .readPercent(0.5)
                    .writePercent(0.5)
                    .keySize(8)
                    .valueSizeRange(new ValueSizeRange(16, 32))
                    .threadCount(2)
                    .build();

    private static BenchmarkReport report(RunResult merged) {
        WorkloadStats stats = new WorkloadStats();
        stats.recordLoad(Duration.ofSeconds(1), 1_000);
        stats.recordRun(Duration.ofMillis(500), merged);
        return BenchmarkReport.from("mem-btree", workload, 42, stats);
    }

    private static RunResult someOperations() {
        RunResult merged = new RunResult();
        for (int i = 1; i <= 100; i++) {
            merged.recordRead(i * 1_000L);
            merged.recordWrite(i * 2_000L);
        }
        merged.recordSkip();
        return merged;
    }

    @Test
    void textSections() {
        String text = TextOutput.render(report(someOperations()));

        assertThat(text)
                .startsWith("=== LOAD ===\nops: 1_000 | time: 1.0s | throughput: 1_000 ops/s\n")
                .contains("=== RUN READ ===\nops: 100 | time: 500.0ms | throughput: 19_801 ops/s | p50: 50 µs")
                .contains("=== RUN WRITE ===\nops: 100 |")
                .contains("p99.9: 200 µs")
                .endsWith("skipped ops: 1");
    }

    @Test
    void textWithoutRunOperations() {
        String text = TextOutput.render(report(new RunResult()));

        assertThat(text)
                .contains("=== RUN READ ===\nops: 0 | time: 500.0ms | throughput: 0 ops/s"
                        + " | p50: - µs | p95: - µs | p99: - µs | p99.9: - µs")
                .doesNotContain("skipped ops");
    }

    @Test
    void textOutputPrintsHeader() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (Output output =
                Outputs.createOutput(
                        OutputTypes.TEXT, false, new PrintStream(bytes, true, StandardCharsets.UTF_8))) {
            output.report(report(someOperations()));
        }
        assertThat(bytes.toString(StandardCharsets.UTF_8))
                .startsWith("database: mem-btree, workload: read-write\n")
                .contains("=== LOAD ===");
    }

    @Test
    void jsonDocument() throws Exception {
        LogOutput output = new LogOutput(false);
        String json = output.toJson(report(someOperations()));

        JsonNode root = new ObjectMapper().readTree(json);
        assertThat(root.get("storage").asText()).isEqualTo("mem-btree");
        assertThat(root.get("seed").asLong()).isEqualTo(42);
        assertThat(root.get("workload").get("name").asText()).isEqualTo("read-write");
        assertThat(root.get("workload").get("valueSizeRange").get("minInclusive").asInt()).isEqualTo(16);
        assertThat(root.get("load").get("ops").asLong()).isEqualTo(1_000);
        assertThat(root.get("load").has("latencyMicros")).isFalse();
        assertThat(root.get("load").has("wallThroughput")).isFalse();
        assertThat(root.get("read").get("wallThroughput").asDouble()).isEqualTo(200.0);
        assertThat(root.get("read").get("latencyMicros").get("count").asLong()).isEqualTo(100);
        assertThat(root.get("read").get("latencyMicros").has("empty")).isFalse();
        assertThat(root.get("skippedOps").asLong()).isEqualTo(1);
        output.report(report(someOperations()));
    }

    @Test
    void jsonWithoutRunOperations() throws Exception {
        String json = new LogOutput(true).toJson(report(new RunResult()));

        JsonNode latency = new ObjectMapper().readTree(json).get("write").get("latencyMicros");
        assertThat(latency.get("count").asLong()).isZero();
        assertThat(latency.has("p50")).isFalse();
        assertThat(json).contains(System.lineSeparator());
    }

    @Test
    void outputTypes() {
        assertThat(OutputTypes.fromString("JSON")).isEqualTo(OutputTypes.JSON);
        assertThat(OutputTypes.fromString("text")).isEqualTo(OutputTypes.TEXT);
        assertThatThrownBy(() -> OutputTypes.fromString("csv"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
