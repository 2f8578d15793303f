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

/**
 * The statistical shape of a benchmark. All accessors are pure.
 *
 * <p>The total number of operations issued in the run phase is {@code threadCount() *
 * operationCount()}.
 */
public interface Workload {

    String name();

    /** How many records to insert during the load phase. This is also the run phase key space. */
    long loadInsertCount();

    /** How many operations each worker executes in the run phase. */
    long operationCount();

    /** Share of run phase operations that are reads, in {@code [0, 1]}. */
    double readPercent();

    /** Share of run phase operations that are writes, in {@code [0, 1]}. */
    double writePercent();

    /** Length in bytes of every key. */
    int keySize();

    ValueSizeRange valueSizeRange();

    /** How many workers execute the run phase in parallel. */
    int threadCount();
}
