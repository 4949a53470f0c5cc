/*
 * Copyright 2025 AxonOps
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

package com.axonops.perfcounter.api;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

class CounterSampleCalculatorTest {

    private static final long FREQ = 1000;

    @Test
    void numberOfItemsIsNewestRawValue() {
        RawSample old = RawSample.of(0, 5, 0, CounterType.NUMBER_OF_ITEMS);
        RawSample latest = RawSample.of(0, 42, 0, CounterType.NUMBER_OF_ITEMS);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isEqualTo(42f);
        assertThat(CounterSampleCalculator.calculate(RawSample.EMPTY, latest)).isEqualTo(42f);
    }

    @Test
    void rawFractionUsesNewestSampleOnly() {
        RawSample latest = new RawSample(0, 25, 200, 0, CounterType.RAW_FRACTION);

        assertThat(CounterSampleCalculator.calculate(RawSample.EMPTY, latest)).isEqualTo(12.5f);
    }

    @Test
    void rawFractionWithZeroBaseIsZero() {
        RawSample latest = new RawSample(0, 25, 0, 0, CounterType.RAW_FRACTION);

        assertThat(CounterSampleCalculator.calculate(RawSample.EMPTY, latest)).isZero();
    }

    @Test
    void counterDeltaSubtractsRawValues() {
        RawSample old = RawSample.of(0, 100, 0, CounterType.COUNTER_DELTA);
        RawSample latest = RawSample.of(0, 130, 0, CounterType.COUNTER_DELTA);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isEqualTo(30f);
    }

    @Test
    void rateOfCountsPerSecond() {
        RawSample old = RawSample.of(2_000, 100, FREQ, CounterType.RATE_OF_COUNTS_PER_SECOND);
        RawSample latest = RawSample.of(4_000, 300, FREQ, CounterType.RATE_OF_COUNTS_PER_SECOND);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isEqualTo(100f);
    }

    @Test
    void rateWithoutElapsedTimeIsZero() {
        RawSample old = RawSample.of(2_000, 100, FREQ, CounterType.RATE_OF_COUNTS_PER_SECOND);
        RawSample latest = RawSample.of(2_000, 300, FREQ, CounterType.RATE_OF_COUNTS_PER_SECOND);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isZero();
    }

    @Test
    void sampleFractionUsesBaseDelta() {
        RawSample old = new RawSample(0, 10, 100, 0, CounterType.SAMPLE_FRACTION);
        RawSample latest = new RawSample(0, 40, 300, 0, CounterType.SAMPLE_FRACTION);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isCloseTo(15f, within(0.0001f));
    }

    @Test
    void averageCount() {
        RawSample old = new RawSample(0, 1_000, 10, 0, CounterType.AVERAGE_COUNT);
        RawSample latest = new RawSample(0, 1_600, 13, 0, CounterType.AVERAGE_COUNT);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isEqualTo(200f);
    }

    @Test
    void averageCountWithUnchangedBaseIsZero() {
        RawSample old = new RawSample(0, 1_000, 10, 0, CounterType.AVERAGE_COUNT);
        RawSample latest = new RawSample(0, 1_600, 10, 0, CounterType.AVERAGE_COUNT);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isZero();
    }

    @Test
    void percentTimer() {
        RawSample old = RawSample.of(1_000, 0, FREQ, CounterType.PERCENT_TIMER);
        RawSample latest = RawSample.of(3_000, 500, FREQ, CounterType.PERCENT_TIMER);

        assertThat(CounterSampleCalculator.calculate(old, latest)).isEqualTo(25f);
    }

    @ParameterizedTest
    @EnumSource(CounterType.class)
    void twoSampleTypesAgainstEmptyAreZero(CounterType type) {
        RawSample latest = new RawSample(5_000, 77, 9, FREQ, type);

        float value = CounterSampleCalculator.calculate(RawSample.EMPTY, latest);

        if (type.isTwoSample()) {
            assertThat(value).isZero();
        } else {
            assertThat(value).isNotNaN().isNotEqualTo(Float.POSITIVE_INFINITY);
        }
    }
}
