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

package com.axonops.perfcounter.util;

import com.axonops.perfcounter.metrics.MetricNames;
import com.axonops.perfcounter.metrics.SamplerMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks counter handle usage for monitoring. A growing active count is the leak signal.
 *
 * CRITICAL: Tracks ACTIVE (currently open) handles separately from the cumulative totals.
 *
 * @since 1.0.0
 */
public final class HandleTracker {
    private static final Logger logger = LoggerFactory.getLogger(HandleTracker.class);

    private final AtomicInteger activeHandles = new AtomicInteger(0);

    private final LongAdder totalOpened = new LongAdder();
    private final LongAdder totalClosed = new LongAdder();
    private final LongAdder totalOpenFailures = new LongAdder();

    public HandleTracker() {
        // Instance per owner
    }

    /**
     * Tracks a handle being opened.
     *
     * @param metricsRegistry metrics registry of the sampler that owns the handle
     */
    public void trackOpened(SamplerMetricsRegistry metricsRegistry) {
        int current = activeHandles.incrementAndGet();
        totalOpened.increment();
        metricsRegistry.incrementCounter(MetricNames.HANDLES_OPENED);
        metricsRegistry.registerGaugeIfAbsent(MetricNames.HANDLES_ACTIVE, activeHandles::get);
        logger.trace("PerfCounter: Handle opened - active: {}, cumulative: {}", current, totalOpened.sum());
    }

    /**
     * Tracks a failed attempt to open a handle.
     *
     * @param metricsRegistry metrics registry of the sampler being opened
     */
    public void trackOpenFailed(SamplerMetricsRegistry metricsRegistry) {
        totalOpenFailures.increment();
        metricsRegistry.incrementCounter(MetricNames.ERRORS_OPEN);
    }

    /**
     * Tracks a handle being closed.
     *
     * @param metricsRegistry metrics registry of the sampler that owned the handle
     */
    public void trackClosed(SamplerMetricsRegistry metricsRegistry) {
        int current = activeHandles.decrementAndGet();
        totalClosed.increment();
        metricsRegistry.incrementCounter(MetricNames.HANDLES_CLOSED);

        if (current < 0) {
            logger.error("PerfCounter: Handle count went negative! This is a bug.");
            activeHandles.set(0);
        }
        logger.trace("PerfCounter: Handle closed - active: {}, cumulative closed: {}", current, totalClosed.sum());
    }

    public int getActiveHandleCount() {
        return activeHandles.get();
    }

    public long getTotalOpened() {
        return totalOpened.sum();
    }

    public long getTotalClosed() {
        return totalClosed.sum();
    }

    public long getTotalOpenFailures() {
        return totalOpenFailures.sum();
    }

    /**
     * Snapshot of all tracked values.
     */
    public HandleStatistics getStatistics() {
        return new HandleStatistics(
            activeHandles.get(),
            totalOpened.sum(),
            totalClosed.sum(),
            totalOpenFailures.sum());
    }

    /**
     * Resets all counters (for testing only).
     */
    public void reset() {
        activeHandles.set(0);
        totalOpened.reset();
        totalClosed.reset();
        totalOpenFailures.reset();
        logger.trace("PerfCounter: HandleTracker reset");
    }

    /**
     * Handle statistics snapshot.
     */
    public record HandleStatistics(
        int activeHandles,
        long totalOpened,
        long totalClosed,
        long openFailures
    ) {
        /**
         * Consistency check: every opened handle is either closed or still active.
         *
         * <p>Open handles are visible through {@link #activeHandles()}; this check does not find
         * them. It turns false when a close had no matching open, which happens after
         * {@link HandleTracker#reset()} while samplers were still open, or when a snapshot is
         * taken between the updates of a concurrent open or close.
         */
        public boolean isConsistent() {
            return totalOpened == totalClosed + activeHandles;
        }
    }
}
