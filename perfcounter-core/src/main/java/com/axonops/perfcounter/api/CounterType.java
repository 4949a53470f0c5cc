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

/**
 * How a counter's raw values are turned into a displayed value.
 *
 * <p>Instantaneous types need only the newest sample. All other types compare two samples and
 * are computed by {@link CounterSampleCalculator} from the difference between them.
 *
 * @since 1.0.0
 */
public enum CounterType {

    /** Instantaneous gauge: the raw value as-is (queue length, bytes in use, process id). */
    NUMBER_OF_ITEMS(false),

    /** Instantaneous ratio: {@code 100 * raw / base}. */
    RAW_FRACTION(false),

    /** Difference between the raw values of two samples. */
    COUNTER_DELTA(true),

    /** Events per second: raw difference divided by elapsed seconds. */
    RATE_OF_COUNTS_PER_SECOND(true),

    /** Percentage of two cumulative counts: {@code 100 * deltaRaw / deltaBase}. */
    SAMPLE_FRACTION(true),

    /** Average per operation: {@code deltaRaw / deltaBase}. */
    AVERAGE_COUNT(true),

    /**
     * Percentage of elapsed time spent active. The raw value counts busy time in the same tick
     * unit as the sample timestamp.
     */
    PERCENT_TIMER(true);

    private final boolean twoSample;

    CounterType(boolean twoSample) {
        this.twoSample = twoSample;
    }

    /**
     * @return true if the value is derived from the difference of two samples
     */
    public boolean isTwoSample() {
        return twoSample;
    }
}
