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

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.util.Locale;

public final class Formats {
    /** Printed in place of a percentile when nothing was recorded. */
    public static final String NO_DATA = "-";

    private static final ThreadLocal<DecimalFormat> GROUPED =
            ThreadLocal.withInitial(
                    () -> {
                        final DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
                        symbols.setGroupingSeparator('_');
                        return new DecimalFormat("#,##0", symbols);
                    });

    private Formats() {}

    /** {@code 1234567} is printed as {@code 1_234_567}. */
    public static String grouped(long value) {
        return GROUPED.get().format(value);
    }

    public static String grouped(Long value) {
        return value == null ? NO_DATA : grouped(value.longValue());
    }

    /** Whole operations per second, truncated. */
    public static String throughput(double opsPerSecond) {
        return grouped((long) opsPerSecond);
    }

    /**
     * A duration with one decimal in the largest unit that keeps the integral part non-zero, e.g.
     * {@code 1.5s}, {@code 12.3ms}, {@code 4.0µs} or {@code 850.0ns}.
     */
    public static String duration(Duration duration) {
        final long nanos = duration.toNanos();
        if (nanos >= 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.1fs", nanos / 1e9);
        } else if (nanos >= 1_000_000L) {
            return String.format(Locale.ROOT, "%.1fms", nanos / 1e6);
        } else if (nanos >= 1_000L) {
            return String.format(Locale.ROOT, "%.1fµs", nanos / 1e3);
        }
        return String.format(Locale.ROOT, "%.1fns", (double) nanos);
    }
}
