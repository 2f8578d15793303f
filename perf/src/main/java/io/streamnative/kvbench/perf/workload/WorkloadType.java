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

import static java.util.Objects.requireNonNull;

import java.util.Locale;
import lombok.Getter;

/** The predefined workloads. */
public enum WorkloadType {
    READ_WRITE("read-write", 0.5, 0.5),
    READ_HEAVY("read-heavy", 0.95, 0.05),
    READ_ONLY("read-only", 1.0, 0.0);

    static final long LOAD_INSERT_COUNT = 10_000;
    static final long OPERATION_COUNT = 8_000;
    static final int KEY_SIZE = 128;
    static final ValueSizeRange VALUE_SIZE_RANGE = new ValueSizeRange(512, 1024);
    static final int THREAD_COUNT = 16;

    @Getter private final String displayName;
    private final double readPercent;
    private final double writePercent;

    WorkloadType(String displayName, double readPercent, double writePercent) {
        this.displayName = displayName;
        this.readPercent = readPercent;
        this.writePercent = writePercent;
    }

    public WorkloadDescriptor descriptor() {
        return WorkloadDescriptor.builder()
                .name(displayName)
                .loadInsertCount(LOAD_INSERT_COUNT)
                .operationCount(OPERATION_COUNT)
                .readPercent(readPercent)
                .writePercent(writePercent)
                .keySize(KEY_SIZE)
                .valueSizeRange(VALUE_SIZE_RANGE)
                .threadCount(THREAD_COUNT)
                .build();
    }

    public static WorkloadType fromString(String type) {
        requireNonNull(type);
        final String normalized = type.toLowerCase(Locale.ROOT);
        for (WorkloadType wType : WorkloadType.values()) {
            if (wType.displayName.equals(normalized)
                    || wType.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return wType;
            }
        }
        throw new IllegalArgumentException("unknown workload type:" + type);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
