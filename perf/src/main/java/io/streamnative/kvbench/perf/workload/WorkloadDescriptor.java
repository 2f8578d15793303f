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
package io.streamnative.kvbench.perf.workload;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import lombok.Builder;
import lombok.NonNull;

/** An immutable, validated {@link Workload}. */
@Builder(toBuilder = true)
public record WorkloadDescriptor(
        String name,
        long loadInsertCount,
        long operationCount,
        double readPercent,
        double writePercent,
        int keySize,
        ValueSizeRange valueSizeRange,
        int threadCount)
        implements Workload {

    public WorkloadDescriptor {
        Workloads.validate(
                loadInsertCount, operationCount, readPercent, writePercent, keySize, threadCount);
        if (name == null || name.isEmpty()) {
            throw new InvalidWorkloadException("Workload name must not be null or empty.");
        }
        if (valueSizeRange == null) {
            throw new InvalidWorkloadException("Value size range must be set.");
        }
    }

    public static WorkloadDescriptor copyOf(@NonNull Workload workload) {
        if (workload instanceof WorkloadDescriptor descriptor) {
            return descriptor;
        }
        return new WorkloadDescriptor(
                workload.name(),
                workload.loadInsertCount(),
                workload.operationCount(),
                workload.readPercent(),
                workload.writePercent(),
                workload.keySize(),
                workload.valueSizeRange(),
                workload.threadCount());
    }

    /**
     * Overrides the fields of this workload with the entries of a properties file.
     *
     * @see #withProperties(Properties)
     */
    public WorkloadDescriptor withProperties(@NonNull File propertiesFile) {
        final Properties properties = new Properties();
        try (InputStream input = new FileInputStream(propertiesFile)) {
            properties.load(input);
        } catch (IOException ex) {
            throw new InvalidWorkloadException(
                    "Failed to load workload properties from file: " + propertiesFile, ex);
        }
        return withProperties(properties);
    }

    /**
     * Returns a copy of this workload with the fields named by the property keys replaced. Known keys
     * are {@code name}, {@code loadInsertCount}, {@code operationCount}, {@code readPercent}, {@code
     * writePercent}, {@code keySize}, {@code valueSizeMin}, {@code valueSizeMax} and {@code
     * threadCount}.
     *
     * @throws InvalidWorkloadException if a key is unknown, a value can not be parsed or the
     *     resulting workload is invalid.
     */
    public WorkloadDescriptor withProperties(@NonNull Properties properties) {
        final WorkloadDescriptorBuilder builder = toBuilder();
        int valueSizeMin = valueSizeRange.minInclusive();
        int valueSizeMax = valueSizeRange.maxExclusive();
        for (String key : properties.stringPropertyNames()) {
            final String value = properties.getProperty(key).trim();
            try {
                switch (key) {
                    case "name" -> builder.name(value);
                    case "loadInsertCount" -> builder.loadInsertCount(Long.parseLong(value));
                    case "operationCount" -> builder.operationCount(Long.parseLong(value));
                    case "readPercent" -> builder.readPercent(Double.parseDouble(value));
                    case "writePercent" -> builder.writePercent(Double.parseDouble(value));
                    case "keySize" -> builder.keySize(Integer.parseInt(value));
                    case "valueSizeMin" -> valueSizeMin = Integer.parseInt(value);
                    case "valueSizeMax" -> valueSizeMax = Integer.parseInt(value);
                    case "threadCount" -> builder.threadCount(Integer.parseInt(value));
                    default -> throw new InvalidWorkloadException("Unknown workload property: " + key);
                }
            } catch (NumberFormatException ex) {
                throw new InvalidWorkloadException(
                        "Invalid value for workload property " + key + ": " + value, ex);
            }
        }
        return builder.valueSizeRange(new ValueSizeRange(valueSizeMin, valueSizeMax)).build();
    }
}
