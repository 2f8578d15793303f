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
package io.streamnative.kvbench.perf.generator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class OperationGeneratorTest {

    @ParameterizedTest
    @CsvSource({
        "0.5, 0.5, 0.0, READ",
        "0.5, 0.5, 0.49, READ",
        "0.5, 0.5, 0.5, WRITE",
        "0.5, 0.5, 0.99, WRITE",
        "1.0, 0.0, 0.999, READ",
        "0.0, 1.0, 0.0, WRITE",
        "0.3, 0.3, 0.6, SKIP",
        "0.3, 0.3, 0.9, SKIP",
    })
    void select(double read, double write, double x, OperationType expected) {
        OperationGenerator generator = Generators.createOperationGenerator(read, write, 1);
        assertThat(generator.select(x)).isEqualTo(expected);
    }

    @Test
    void mixFollowsPercentages() {
        OperationGenerator generator = Generators.createOperationGenerator(0.7, 0.2, 11);
        Map<OperationType, Integer> counts = new EnumMap<>(OperationType.class);
        for (int i = 0; i < 100_000; i++) {
            counts.merge(generator.nextValue(), 1, Integer::sum);
        }
        assertThat(counts.get(OperationType.READ)).isBetween(69_000, 71_000);
        assertThat(counts.get(OperationType.WRITE)).isBetween(19_000, 21_000);
        assertThat(counts.get(OperationType.SKIP)).isBetween(9_000, 11_000);
    }

    @Test
    void completePartitionNeverSkips() {
        OperationGenerator generator = Generators.createOperationGenerator(0.95, 0.05, 3);
        for (int i = 0; i < 10_000; i++) {
            assertThat(generator.nextValue()).isNotEqualTo(OperationType.SKIP);
        }
    }

    @Test
    void invalidMix() {
        assertThatThrownBy(() -> Generators.createOperationGenerator(0.8, 0.3, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Generators.createOperationGenerator(-0.1, 0.3, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
