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

import com.axonops.perfcounter.config.SamplerConfig;
import com.axonops.perfcounter.metrics.MetricNames;
import com.axonops.perfcounter.metrics.NoOpMetricsRegistry;
import com.axonops.perfcounter.metrics.SamplerMetricsRegistry;
import com.axonops.perfcounter.util.HandleTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Samples one performance counter and turns successive raw samples into a value.
 *
 * <h2>Sampling</h2>
 *
 * <p>Each {@link #value()} call reads a fresh raw sample and computes the result against the
 * retained previous sample. For frequency-based counters the retained pair only advances once
 * more than {@link #ROTATION_THRESHOLD_SECONDS} have elapsed since the last rotation point, so
 * callers polling many times per second still get deltas over a meaningful interval. Counters
 * without a frequency advance on every call.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>NOT thread-safe. Callers that share a sampler between threads must synchronize externally.
 * Independent samplers do not interact.
 *
 * <pre>{@code
 * SamplerConfig config = SamplerConfig.builder()
 *     .category("Process")
 *     .counter("% Processor Time")
 *     .build();
 *
 * try (RateSampler sampler = RateSampler.open(config, CounterProviders.platformDefault())) {
 *     float cpu = sampler.value();
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RateSampler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RateSampler.class);

    /**
     * Minimum elapsed time, in seconds, before a frequency-based counter's retained samples
     * advance. Counter subsystems need about a second between reads for a stable rate.
     */
    public static final float ROTATION_THRESHOLD_SECONDS = 0.5f;

    private static final HandleTracker handleTracker = new HandleTracker();

    private final CounterHandle handle;
    private final SamplerMetricsRegistry metricsRegistry;
    private final boolean tracked;

    private SamplePair samples = SamplePair.EMPTY;
    private boolean closed = false;

    /**
     * Wraps an already open handle. The sampler takes ownership of it.
     *
     * <p>No warm-up read is performed; use {@link #open(SamplerConfig, CounterProvider)} for the
     * full initialization sequence.
     *
     * @param handle open counter handle
     */
    public RateSampler(CounterHandle handle) {
        this(handle, NoOpMetricsRegistry.INSTANCE);
    }

    public RateSampler(CounterHandle handle, SamplerMetricsRegistry metricsRegistry) {
        this(handle, metricsRegistry, false);
    }

    private RateSampler(CounterHandle handle, SamplerMetricsRegistry metricsRegistry, boolean tracked) {
        this.handle = Objects.requireNonNull(handle, "handle cannot be null");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
        this.tracked = tracked;
    }

    /**
     * Opens a sampler, resolving the process instance when required.
     *
     * @param config counter to sample
     * @param provider counter subsystem
     * @return an initialized sampler that has performed one warm-up read
     * @throws CounterConfigurationException if the counter cannot be opened or first read
     */
    public static RateSampler open(SamplerConfig config, CounterProvider provider) {
        Objects.requireNonNull(config, "config cannot be null");
        return open(config, provider, new ProcessInstanceResolver(provider, config.metricsRegistry()));
    }

    /**
     * Opens a sampler using the given resolver for process instance auto-detection.
     *
     * @param config counter to sample
     * @param provider counter subsystem
     * @param resolver resolver consulted when {@link SamplerConfig#autoDetectsInstance()}
     * @return an initialized sampler that has performed one warm-up read
     * @throws CounterConfigurationException if the counter cannot be opened or first read
     */
    public static RateSampler open(SamplerConfig config, CounterProvider provider,
                                   ProcessInstanceResolver resolver) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(provider, "provider cannot be null");
        Objects.requireNonNull(resolver, "resolver cannot be null");

        SamplerMetricsRegistry metrics = config.metricsRegistry();
        String instance = config.instance();
        if (config.autoDetectsInstance()) {
            instance = resolver.instanceName(config.category());
        }
        CounterPath path = new CounterPath(config.category(), config.counter(), instance, config.machineName());

        CounterHandle handle;
        try {
            handle = provider.open(path, config.readOnly());
        } catch (CounterConfigurationException e) {
            handleTracker.trackOpenFailed(metrics);
            throw e;
        } catch (RuntimeException e) {
            handleTracker.trackOpenFailed(metrics);
            throw new CounterConfigurationException("Cannot open counter " + path, e);
        }

        // From here on the handle belongs to the sampler; every failure path closes it
        RateSampler sampler = new RateSampler(handle, metrics, true);
        try {
            handleTracker.trackOpened(metrics);
        } catch (RuntimeException e) {
            sampler.close();
            throw new CounterConfigurationException("Cannot track counter " + path, e);
        }
        try {
            // Primes the frequency-based path so the first caller-visible value has a reference
            sampler.value();
        } catch (RuntimeException e) {
            sampler.close();
            throw new CounterConfigurationException("Warm-up read failed for counter " + path, e);
        }

        logger.debug("PerfCounter: Sampler opened - path: {}", path);
        return sampler;
    }

    /**
     * Reads a new raw sample and computes the counter value.
     *
     * @return the computed value
     * @throws CounterReadException if the counter can no longer be read
     * @throws IllegalStateException if the sampler is closed
     */
    public float value() {
        checkNotClosed();

        RawSample latest = readNext();
        if (latest.isFrequencyBased()) {
            float elapsedSeconds =
                (latest.timestamp() - samples.current().timestamp()) / (float) latest.systemFrequency();
            if (elapsedSeconds > ROTATION_THRESHOLD_SECONDS || elapsedSeconds < -ROTATION_THRESHOLD_SECONDS) {
                samples = samples.advanceSeeded(latest);
                metricsRegistry.incrementCounter(MetricNames.SAMPLES_ROTATIONS);
            } else {
                metricsRegistry.incrementCounter(MetricNames.SAMPLES_ROTATIONS_SUPPRESSED);
            }
        } else {
            samples = samples.advance(latest);
            metricsRegistry.incrementCounter(MetricNames.SAMPLES_ROTATIONS);
        }

        float result = CounterSampleCalculator.calculate(samples.previous(), latest);
        logger.trace("PerfCounter: Sampled {} - raw: {}, value: {}", handle.path(), latest.rawValue(), result);
        return result;
    }

    /**
     * Same as {@link #value()}, boxed for consumers of untyped values.
     *
     * @return the computed value as a {@link Float}
     */
    public Object rawValue() {
        return value();
    }

    private RawSample readNext() {
        long startNanos = System.nanoTime();
        try {
            RawSample sample = handle.nextRawSample();
            metricsRegistry.incrementCounter(MetricNames.SAMPLES_READ);
            return sample;
        } catch (CounterReadException e) {
            metricsRegistry.incrementCounter(MetricNames.ERRORS_READ);
            throw e;
        } catch (RuntimeException e) {
            metricsRegistry.incrementCounter(MetricNames.ERRORS_READ);
            throw new CounterReadException("Cannot read counter " + handle.path(), e);
        } finally {
            metricsRegistry.recordLatencySince(MetricNames.SAMPLES_READ_LATENCY, startNanos);
        }
    }

    /**
     * @return the retained reference sample
     */
    public RawSample previousSample() {
        return samples.previous();
    }

    /**
     * @return the retained sample marking the last rotation point
     */
    public RawSample currentSample() {
        return samples.current();
    }

    public CounterPath path() {
        return handle.path();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases the counter handle and resets the retained samples. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        samples = SamplePair.EMPTY;
        try {
            handle.close();
        } finally {
            if (tracked) {
                handleTracker.trackClosed(metricsRegistry);
            }
        }
        logger.trace("PerfCounter: Sampler closed - path: {}", handle.path());
    }

    private void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("PerfCounter: Sampler is closed");
        }
    }

    /**
     * Handle statistics for samplers created through {@code open}.
     */
    public static HandleTracker getHandleTracker() {
        return handleTracker;
    }
}
