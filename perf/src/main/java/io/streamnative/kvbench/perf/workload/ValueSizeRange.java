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

/** Value lengths in bytes, {@code [minInclusive, maxExclusive)}. The range is never empty. */
public record ValueSizeRange(int minInclusive, int maxExclusive) {

    public ValueSizeRange {
        if (minInclusive < 0) {
            throw new InvalidWorkloadException(
                    "Value size lower bound must not be negative: " + minInclusive);
        }
        if (maxExclusive <= minInclusive) {
            throw new InvalidWorkloadException(
                    "Invalid value size range: [" + minInclusive + ", " + maxExclusive + ")");
        }
    }

    public int width() {
        return maxExclusive - minInclusive;
    }

    @Override
    public String toString() {
        return minInclusive + ".." + maxExclusive;
    }
}
