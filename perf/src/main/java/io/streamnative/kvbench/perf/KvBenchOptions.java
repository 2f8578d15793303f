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

import io.streamnative.kvbench.perf.executor.WorkloadRunner;
import io.streamnative.kvbench.perf.output.BenchmarkReport;
import io.streamnative.kvbench.perf.output.Output;
import io.streamnative.kvbench.perf.output.OutputTypes;
import io.streamnative.kvbench.perf.output.Outputs;
import io.streamnative.kvbench.perf.stats.WorkloadStats;
import io.streamnative.kvbench.perf.workload.WorkloadDescriptor;
import io.streamnative.kvbench.perf.workload.WorkloadType;
import io.streamnative.kvbench.storage.Storage;
import io.streamnative.kvbench.storage.StorageType;
import io.streamnative.kvbench.storage.Storages;
import java.io.File;
import java.io.PrintStream;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(
        name = "kvbench",
        mixinStandardHelpOptions = true,
        description = "Loads a key-value storage, then measures a mixed read/write workload against it.")
public final class KvBenchOptions implements Callable<Integer> {

    @CommandLine.Parameters(
            index = "0",
            converter = WorkloadTypeConverter.class,
            description = "The workload. supported: read-write,read-heavy,read-only")
    WorkloadType workload;

    @CommandLine.Parameters(
            index = "1",
            converter = StorageTypeConverter.class,
            description = "The storage. supported: mem-btree,rocksdb-txn,rocksdb")
    StorageType storage;

    @CommandLine.Option(
            names = {"-p", "--properties"},
            description = "Properties file overriding fields of the workload")
    File properties;

    @CommandLine.Option(
            names = {"--seed"},
            description = "Seed of all generated traffic. Random when absent")
    Long seed;

    @CommandLine.Option(
            names = {"--output"},
            description = "The output type. supported: text,json")
    String outputType = "text";

    @CommandLine.Option(
            names = {"--output-pretty"},
            description = "Whether to pretty print the json output.")
    boolean outputPretty = true;

    PrintStream out = System.out;

    @Override
    public Integer call() throws Exception {
        WorkloadDescriptor descriptor = workload.descriptor();
        if (properties != null) {
            descriptor = descriptor.withProperties(properties);
        }
        final long effectiveSeed = seed != null ? seed : ThreadLocalRandom.current().nextLong();
        log.info(
                "starting benchmark. storage={}, workload={}, seed={}", storage, descriptor,
                effectiveSeed);

        final WorkloadRunner runner = new WorkloadRunner(effectiveSeed);
        try (Storage db = Storages.create(storage);
                Output output = Outputs.createOutput(OutputTypes.fromString(outputType), outputPretty, out)) {
            final WorkloadStats stats = runner.execute(descriptor, db);
            output.report(BenchmarkReport.from(storage.toString(), descriptor, effectiveSeed, stats));
        }
        return 0;
    }

    static final class WorkloadTypeConverter implements CommandLine.ITypeConverter<WorkloadType> {
        @Override
        public WorkloadType convert(String value) {
            return WorkloadType.fromString(value);
        }
    }

    static final class StorageTypeConverter implements CommandLine.ITypeConverter<StorageType> {
        @Override
        public StorageType convert(String value) {
            return StorageType.fromString(value);
        }
    }
}
