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

package com.axonops.perfcounter.metrics;

import java.util.function.Supplier;

/**
 * Sink for the instrumentation samplers report about themselves.
 *
 * <p>Samplers, instance resolution and handle tracking all report here, so the library behaves
 * the same with or without a metrics backend. Names are the relative names in
 * {@link MetricNames}; an implementation adds its own namespace.
 *
 * <p>Implementations must be thread-safe. One registry is usually shared by every sampler.
 *
 * @since 1.0.0
 */
public interface SamplerMetricsRegistry {

    /**
     * Adds one to a counter.
     *
     * @param name relative metric name, e.g. {@link MetricNames#SAMPLES_READ}
     */
    void incrementCounter(String name);

    /**
     * Records one latency observation.
     *
     * @param name relative metric name, e.g. {@link MetricNames#SAMPLES_READ_LATENCY}
     * @param durationNanos elapsed time in nanoseconds
     */
    void recordLatency(String name, long durationNanos);

    /**
     * Records the time elapsed since {@code startNanos}.
     *
     * @param startNanos a {@link System#nanoTime()} reading taken when the operation began
     */
    default void recordLatencySince(String name, long startNanos) {
        recordLatency(name, System.nanoTime() - startNanos);
    }

    /**
     * Exposes a value computed on every read, replacing any gauge of the same name.
     */
    void registerGauge(String name, Supplier<? extends Number> valueSupplier);

    /**
     * Exposes a value computed on every read unless a gauge of the same name already exists.
     *
     * <p>Safe to call concurrently and repeatedly: exactly one gauge ends up registered and no
     * call fails because another registered first.
     */
    void registerGaugeIfAbsent(String name, Supplier<? extends Number> valueSupplier);

    void removeGauge(String name);
}
