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

import java.util.Objects;

/**
 * One reading from a performance counter.
 *
 * <p>Immutable once produced by a {@link CounterHandle}. {@link #EMPTY} is the all-zero sentinel
 * meaning "no sample yet".
 *
 * @param timestamp monotonic timestamp in provider ticks
 * @param rawValue the counter's raw value
 * @param baseValue denominator for fraction and average types, 0 when unused
 * @param systemFrequency ticks per second of {@code timestamp}, 0 when the counter is not
 *     frequency based
 * @param counterType how the raw value is interpreted
 * @since 1.0.0
 */
public record RawSample(
    long timestamp, long rawValue, long baseValue, long systemFrequency, CounterType counterType) {

  /** No sample yet. */
  public static final RawSample EMPTY = new RawSample(0, 0, 0, 0, CounterType.NUMBER_OF_ITEMS);

  public RawSample {
    Objects.requireNonNull(counterType, "counterType cannot be null");
  }

  /** Sample for a counter that has no base value. */
  public static RawSample of(
      long timestamp, long rawValue, long systemFrequency, CounterType counterType) {
    return new RawSample(timestamp, rawValue, 0, systemFrequency, counterType);
  }

  public boolean isEmpty() {
    return equals(EMPTY);
  }

  public boolean isFrequencyBased() {
    return systemFrequency != 0;
  }
}
