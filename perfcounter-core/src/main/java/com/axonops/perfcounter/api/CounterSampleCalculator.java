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
 * Standard two-sample formula for computing a counter value.
 *
 * <p>Any denominator that is zero or negative yields {@code 0}, as does a two-sample type whose
 * old sample is {@link RawSample#EMPTY}. The result is therefore always a finite number.
 *
 * @since 1.0.0
 */
public final class CounterSampleCalculator {

    private CounterSampleCalculator() {
        // Utility class
    }

    /**
     * Computes the counter value from two samples.
     *
     * @param oldSample the reference sample
     * @param newSample the newest sample; its counter type selects the formula
     * @return the computed value
     */
    public static float calculate(RawSample oldSample, RawSample newSample) {
        CounterType type = newSample.counterType();
        if (type.isTwoSample() && oldSample.isEmpty()) {
            return 0f;
        }

        switch (type) {
            case NUMBER_OF_ITEMS:
                return newSample.rawValue();
            case RAW_FRACTION:
                return ratio(newSample.rawValue(), newSample.baseValue()) * 100f;
            case COUNTER_DELTA:
                return newSample.rawValue() - oldSample.rawValue();
            case RATE_OF_COUNTS_PER_SECOND: {
                long elapsedTicks = newSample.timestamp() - oldSample.timestamp();
                if (elapsedTicks <= 0 || newSample.systemFrequency() == 0) {
                    return 0f;
                }
                double seconds = (double) elapsedTicks / newSample.systemFrequency();
                return (float) ((newSample.rawValue() - oldSample.rawValue()) / seconds);
            }
            case SAMPLE_FRACTION:
                return ratio(newSample.rawValue() - oldSample.rawValue(),
                    newSample.baseValue() - oldSample.baseValue()) * 100f;
            case AVERAGE_COUNT:
                return ratio(newSample.rawValue() - oldSample.rawValue(),
                    newSample.baseValue() - oldSample.baseValue());
            case PERCENT_TIMER:
                return ratio(newSample.rawValue() - oldSample.rawValue(),
                    newSample.timestamp() - oldSample.timestamp()) * 100f;
            default:
                throw new IllegalStateException("Unknown counter type: " + type);
        }
    }

    private static float ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0f;
        }
        return (float) ((double) numerator / denominator);
    }
}
