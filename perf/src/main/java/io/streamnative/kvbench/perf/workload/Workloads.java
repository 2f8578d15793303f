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

import com.google.common.base.Strings;
import lombok.NonNull;

public final class Workloads {

    private Workloads() {}

    /**
     * Checks the constraints every workload must satisfy. The Zipfian domains derived from a valid
     * workload, its key space when operations are issued and the width of its value size range, are
     * never empty and fit in an {@code int}.
     *
     * @throws InvalidWorkloadException on the first violated constraint.
     */
    public static void validate(@NonNull Workload workload) {
        if (Strings.isNullOrEmpty(workload.name())) {
            throw new InvalidWorkloadException("Workload name must not be null or empty.");
        }
        validate(
                workload.loadInsertCount(),
                workload.operationCount(),
                workload.readPercent(),
                workload.writePercent(),
                workload.keySize(),
                workload.threadCount());
        if (workload.valueSizeRange() == null) {
            throw new InvalidWorkloadException("Value size range must be set.");
        }
    }

    static void validate(
            long loadInsertCount,
            long operationCount,
            double readPercent,
            double writePercent,
            int keySize,
            int threadCount) {
        if (loadInsertCount < 0) {
            throw new InvalidWorkloadException(
                    "Load insert count must not be negative: " + loadInsertCount);
        }
        if (loadInsertCount > Integer.MAX_VALUE) {
            throw new InvalidWorkloadException(
                    "Load insert count can not be larger than "
                            + Integer.MAX_VALUE
                            + ": "
                            + loadInsertCount);
        }
        if (operationCount < 0) {
            throw new InvalidWorkloadException(
                    "Operation count must not be negative: " + operationCount);
        }
        if (operationCount > 0 && loadInsertCount == 0) {
            throw new InvalidWorkloadException(
                    "Load insert count must be at least 1 when operations are issued");
        }
        checkPercent("Read", readPercent);
        checkPercent("Write", writePercent);
        if (readPercent + writePercent <= 0.0) {
            throw new InvalidWorkloadException("Read and write both cannot be zero percent");
        }
        if (readPercent + writePercent > 1.0) {
            throw new InvalidWorkloadException(
                    "Read and write cannot combine to above 1: " + (readPercent + writePercent));
        }
        if (keySize <= 0) {
            throw new InvalidWorkloadException("Key size must be greater than zero: " + keySize);
        }
        if (threadCount <= 0) {
            throw new InvalidWorkloadException(
                    "Thread count must be greater than zero: " + threadCount);
        }
    }

    private static void checkPercent(String what, double percent) {
        if (Double.isNaN(percent) || percent < 0.0) {
            throw new InvalidWorkloadException(
                    what + " percent must be larger than or equal to 0: " + percent);
        }
        if (percent > 1.0) {
            throw new InvalidWorkloadException(
                    what + " percent must be less than or equal to 1: " + percent);
        }
    }
}
