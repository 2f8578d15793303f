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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.OptionalLong;
import java.util.Random;
import org.HdrHistogram.Histogram;
import org.junit.jupiter.api.Test;

class LatencyHistogramsTest {

    @Test
    void emptyHistogramHasNoData() {
        Histogram histogram = LatencyHistograms.create();
        for (double q : LatencyHistograms.REPORTED_QUANTILES) {
            assertThat(LatencyHistograms.valueAtQuantile(histogram, q)).isEmpty();
        }
    }

    @Test
    void quantileOutOfRange() {
        Histogram histogram = LatencyHistograms.create();
        assertThatThrownBy(() -> LatencyHistograms.valueAtQuantile(histogram, 1.5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LatencyHistograms.valueAtQuantile(histogram, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void percentilesAreMonotonic() {
        Histogram histogram = LatencyHistograms.create();
        Random random = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            LatencyHistograms.record(histogram, 1 + random.nextInt(50_000));
        }
        long previous = 0;
        for (double q : LatencyHistograms.REPORTED_QUANTILES) {
            OptionalLong value = LatencyHistograms.valueAtQuantile(histogram, q);
            assertThat(value).isPresent();
            assertThat(value.getAsLong()).isGreaterThanOrEqualTo(previous);
            previous = value.getAsLong();
        }
    }

    @Test
    void outOfRangeSamplesSaturate() {
        Histogram histogram = LatencyHistograms.create();
        LatencyHistograms.record(histogram, LatencyHistograms.HIGHEST_TRACKABLE_MICROS * 3);
        LatencyHistograms.record(histogram, -5);
        LatencyHistograms.record(histogram, 0);

        assertThat(histogram.getTotalCount()).isEqualTo(3);
        assertThat(histogram.getMaxValue())
                .isEqualTo(histogram.highestEquivalentValue(LatencyHistograms.HIGHEST_TRACKABLE_MICROS));
        assertThat(histogram.getMinValue()).isZero();
    }

    @Test
    void unionLeavesOperandsUntouched() {
        Histogram a = LatencyHistograms.create();
        Histogram b = LatencyHistograms.create();
        LatencyHistograms.record(a, 10);
        LatencyHistograms.record(b, 20);
        LatencyHistograms.record(b, 30);

        Histogram union = LatencyHistograms.union(a, b);
        assertThat(union.getTotalCount()).isEqualTo(3);
        assertThat(a.getTotalCount()).isEqualTo(1);
        assertThat(b.getTotalCount()).isEqualTo(2);
    }
}
