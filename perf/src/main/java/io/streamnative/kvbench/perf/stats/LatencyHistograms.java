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
package io.streamnative.kvbench.perf.stats;

import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.HdrHistogram.Histogram;

/** Latency histograms in microseconds, from 1 µs to 10 s with 3 significant digits. */
@Slf4j
public final class LatencyHistograms {
    public static final long LOWEST_DISCERNIBLE_MICROS = 1;
    public static final long HIGHEST_TRACKABLE_MICROS = TimeUnit.SECONDS.toMicros(10);
    public static final int SIGNIFICANT_DIGITS = 3;

    /** The quantiles every report shows. */
    public static final double[] REPORTED_QUANTILES = {0.50, 0.95, 0.99, 0.999};

    private LatencyHistograms() {}

    public static Histogram create() {
        return new Histogram(
                LOWEST_DISCERNIBLE_MICROS, HIGHEST_TRACKABLE_MICROS, SIGNIFICANT_DIGITS);
    }

    /**
     * Records one sample. Samples above the trackable range saturate at {@link
     * #HIGHEST_TRACKABLE_MICROS} so that the count still matches the number of operations.
     */
    public static void record(@NonNull Histogram histogram, long micros) {
        long value = micros;
        if (value > HIGHEST_TRACKABLE_MICROS) {
            log.debug("Latency {} µs exceeds the histogram range, recording it as {} µs", micros,
                    HIGHEST_TRACKABLE_MICROS);
            value = HIGHEST_TRACKABLE_MICROS;
        } else if (value < 0) {
            value = 0;
        }
        histogram.recordValue(value);
    }

    /**
     * The value at quantile {@code q} in {@code [0, 1]}, or empty when nothing was recorded.
     */
    public static OptionalLong valueAtQuantile(@NonNull Histogram histogram, double q) {
        if (q < 0.0 || q > 1.0) {
            throw new IllegalArgumentException("quantile must be within [0, 1]: " + q);
        }
        if (histogram.getTotalCount() == 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(histogram.getValueAtPercentile(q * 100.0));
    }

    /** A new histogram holding the samples of both arguments. The arguments are not modified. */
    public static Histogram union(@NonNull Histogram a, @NonNull Histogram b) {
        final Histogram merged = a.copy();
        merged.add(b);
        return merged;
    }
}
