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

import static io.streamnative.kvbench.perf.stats.LatencyHistograms.valueAtQuantile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.OptionalLong;
import org.HdrHistogram.Histogram;

/** Latency percentiles in microseconds. A {@code null} percentile means nothing was recorded. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HistogramSnapshot(long count, Long p50, Long p95, Long p99, Long p999, Long max) {

    public static HistogramSnapshot fromHistogram(Histogram histogram) {
        final long count = histogram.getTotalCount();
        return new HistogramSnapshot(
                count,
                boxed(valueAtQuantile(histogram, 0.50)),
                boxed(valueAtQuantile(histogram, 0.95)),
                boxed(valueAtQuantile(histogram, 0.99)),
                boxed(valueAtQuantile(histogram, 0.999)),
                count == 0 ? null : histogram.getMaxValue());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return count == 0;
    }

    private static Long boxed(OptionalLong value) {
        return value.isPresent() ? value.getAsLong() : null;
    }
}
