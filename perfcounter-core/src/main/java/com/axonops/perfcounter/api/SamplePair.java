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
 * The two samples a {@link RateSampler} retains between calls.
 *
 * <p>Immutable. Every update produces a new pair, so the sampler's whole state is a single field
 * assignment.
 *
 * @param previous reference sample deltas are measured from
 * @param current most recently retained sample, the last rotation point
 * @since 1.0.0
 */
public record SamplePair(RawSample previous, RawSample current) {

  /** Initial state: no samples retained. */
  public static final SamplePair EMPTY = new SamplePair(RawSample.EMPTY, RawSample.EMPTY);

  public SamplePair {
    Objects.requireNonNull(previous, "previous cannot be null");
    Objects.requireNonNull(current, "current cannot be null");
  }

  /**
   * Shifts {@code current} into {@code previous} and adopts {@code next}.
   */
  public SamplePair advance(RawSample next) {
    return new SamplePair(current, next);
  }

  /**
   * Like {@link #advance(RawSample)}, but when no previous sample exists yet {@code next} is also
   * used as the previous sample, so the first delta is measured against itself.
   */
  public SamplePair advanceSeeded(RawSample next) {
    return new SamplePair(current.isEmpty() ? next : current, next);
  }
}
