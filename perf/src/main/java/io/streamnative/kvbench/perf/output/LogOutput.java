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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/** Logs the report as a JSON document. */
@Slf4j
final class LogOutput implements Output {
    private static final ObjectMapper mapper = new ObjectMapper();
    private final boolean pretty;

    LogOutput(boolean pretty) {
        this.pretty = pretty;
    }

    @Override
    public void report(BenchmarkReport report) {
        log.info(toJson(report));
    }

    String toJson(BenchmarkReport report) {
        try {
            if (pretty) {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
            }
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new OutputException("Failed to serialize the report", ex);
        }
    }

    @Override
    public void close() {}
}
