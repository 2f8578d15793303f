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

import static io.streamnative.kvbench.perf.output.Formats.duration;
import static io.streamnative.kvbench.perf.output.Formats.grouped;
import static io.streamnative.kvbench.perf.output.Formats.throughput;

import java.io.PrintStream;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/** Prints the three report sections, load, run read and run write, as plain text. */
@RequiredArgsConstructor
final class TextOutput implements Output {
    private final PrintStream out;

    @Override
    public void report(BenchmarkReport report) {
        out.println("database: " + report.storage() + ", workload: " + report.workload().name());
        out.println("==============================");
        out.println(render(report));
        out.flush();
    }

    static String render(@NonNull BenchmarkReport report) {
        final BenchmarkReport.Section load = report.load();
        final StringBuilder sb = new StringBuilder();
        sb.append("=== LOAD ===\n");
        sb.append("ops: ")
                .append(grouped(load.ops()))
                .append(" | time: ")
                .append(duration(load.time()))
                .append(" | throughput: ")
                .append(throughput(load.throughput()))
                .append(" ops/s\n");
        sb.append("=== RUN READ ===\n");
        appendRunSection(sb, report.read());
        sb.append('\n');
        sb.append("=== RUN WRITE ===\n");
        appendRunSection(sb, report.write());
        if (report.skippedOps() > 0) {
            sb.append("\nskipped ops: ").append(grouped(report.skippedOps()));
        }
        return sb.toString();
    }

    private static void appendRunSection(StringBuilder sb, BenchmarkReport.Section section) {
        final HistogramSnapshot latency = section.latencyMicros();
        sb.append("ops: ")
                .append(grouped(section.ops()))
                .append(" | time: ")
                .append(duration(section.time()))
                .append(" | throughput: ")
                .append(throughput(section.throughput()))
                .append(" ops/s | p50: ")
                .append(grouped(latency.p50()))
                .append(" µs | p95: ")
                .append(grouped(latency.p95()))
                .append(" µs | p99: ")
                .append(grouped(latency.p99()))
                .append(" µs | p99.9: ")
                .append(grouped(latency.p999()))
                .append(" µs");
    }

    @Override
    public void close() {
        out.flush();
    }
}
