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
 * Connection to exactly one performance counter.
 *
 * <p>Handles are obtained from {@link CounterProvider#open(CounterPath, boolean)} and are owned
 * by a single caller. They are not thread-safe.
 *
 * @since 1.0.0
 */
public interface CounterHandle extends AutoCloseable {

    /**
     * @return the path this handle was opened with
     */
    CounterPath path();

    /**
     * Pulls a new raw reading.
     *
     * @return the sample, never {@link RawSample#EMPTY}
     * @throws CounterReadException if the counter can no longer be read or the handle is closed
     */
    RawSample nextRawSample();

    /**
     * Releases the underlying resources. Idempotent.
     */
    @Override
    void close();
}
