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
package io.streamnative.kvbench.perf.executor;

/** The run phase did not complete. The cause is the failure of the first worker that failed. */
public final class WorkloadExecutionException extends RuntimeException {

    public WorkloadExecutionException(String message) {
        super(message);
    }

    public WorkloadExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
