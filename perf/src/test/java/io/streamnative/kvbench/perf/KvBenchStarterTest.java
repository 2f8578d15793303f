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
package io.streamnative.kvbench.perf;

import static org.assertj.core.api.Assertions.assertThat;

import io.streamnative.kvbench.perf.workload.WorkloadType;
import io.streamnative.kvbench.storage.StorageType;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import picocli.CommandLine;

class KvBenchStarterTest {

    @TempDir Path dir;
    Path properties;
    ByteArrayOutputStream stdout;
    KvBenchOptions options;

    @BeforeEach
    void setUp() throws Exception {
        properties = dir.resolve("small.properties");
        Files.write(
                properties,
                List.of(
                        "loadInsertCount=100",
                        "operationCount=50",
                        "keySize=8",
                        "valueSizeMin=16",
                        "valueSizeMax=32",
                        "threadCount=4"));
        stdout = new ByteArrayOutputStream();
        options = new KvBenchOptions();
        options.out = new PrintStream(stdout, true, StandardCharsets.UTF_8);
    }

    private int execute(String... args) {
        return KvBenchStarter.newCommandLine(options).execute(args);
    }

    @ParameterizedTest
    @EnumSource(StorageType.class)
    void runsEveryStorage(StorageType storage) {
        int exitCode = execute("read-write", storage.toString(), "-p", properties.toString(), "--seed", "7");

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8))
                .contains("database: " + storage + ", workload: read-write")
                .contains("=== LOAD ===\nops: 100 |")
                .contains("=== RUN READ ===")
                .contains("=== RUN WRITE ===");
    }

    @Test
    void parsesOptions() {
        new CommandLine(options)
                .parseArgs("read-heavy", "rocksdb", "--seed", "5", "--output", "json");

        assertThat(options.workload).isEqualTo(WorkloadType.READ_HEAVY);
        assertThat(options.storage).isEqualTo(StorageType.ROCKSDB);
        assertThat(options.seed).isEqualTo(5L);
        assertThat(options.outputType).isEqualTo("json");
        assertThat(options.outputPretty).isTrue();
        assertThat(options.properties).isNull();
    }

    @Test
    void jsonGoesToTheLog() {
        int exitCode =
                execute("read-only", "mem-btree", "-p", properties.toString(), "--output", "json");

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void unknownNamesAreRejected() {
        assertThat(execute("scan", "mem-btree")).isNotZero();
        assertThat(execute("read-write", "sled")).isNotZero();
        assertThat(execute()).isNotZero();
    }

    @Test
    void invalidWorkloadFails() throws Exception {
        Files.write(properties, List.of("readPercent=0.9", "writePercent=0.9"));

        assertThat(execute("read-write", "mem-btree", "-p", properties.toString())).isEqualTo(1);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }
}
