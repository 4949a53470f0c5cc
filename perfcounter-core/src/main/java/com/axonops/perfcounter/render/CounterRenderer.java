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

package com.axonops.perfcounter.render;

import com.axonops.perfcounter.api.CounterConfigurationException;
import com.axonops.perfcounter.api.CounterProvider;
import com.axonops.perfcounter.api.RateSampler;
import com.axonops.perfcounter.config.SamplerConfig;
import com.axonops.perfcounter.metrics.MetricNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a counter value into text for a host such as a log layout.
 *
 * <p>Lifecycle mirrors the host: {@link #initialize()} once, {@link #render(StringBuilder)} or
 * {@link #renderValue()} per event, {@link #close()} on shutdown. Number formatting happens
 * here, never in the sampler.
 *
 * <p>A failed render is logged and appends nothing, so one unreadable counter cannot break the
 * host's output. A failed {@link #initialize()} propagates: the renderer must not be used.
 *
 * <p>Thread-safe: calls are serialized because hosts render from many threads.
 *
 * <pre>{@code
 * CounterRenderer renderer = new CounterRenderer(config, provider, "#,##0.0", Locale.GERMANY);
 * renderer.initialize();
 * StringBuilder line = new StringBuilder("cpu=");
 * renderer.render(line);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class CounterRenderer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CounterRenderer.class);

    /** Pattern used when no format is configured. */
    public static final String DEFAULT_PATTERN = "0.#######";

    private final SamplerConfig config;
    private final CounterProvider provider;
    private final DecimalFormat formatter;

    private RateSampler sampler;

    /**
     * Creates a renderer using {@link #DEFAULT_PATTERN} and the default format locale.
     */
    public CounterRenderer(SamplerConfig config, CounterProvider provider) {
        this(config, provider, null, null);
    }

    /**
     * @param config counter to render
     * @param provider counter subsystem
     * @param pattern {@link DecimalFormat} pattern, or null for {@link #DEFAULT_PATTERN}
     * @param locale locale for digit grouping and decimal separators, or null for the default
     *     format locale
     * @throws CounterConfigurationException if the pattern is invalid
     */
    public CounterRenderer(SamplerConfig config, CounterProvider provider, String pattern, Locale locale) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        Locale effectiveLocale = locale != null ? locale : Locale.getDefault(Locale.Category.FORMAT);
        try {
            this.formatter = new DecimalFormat(
                pattern != null ? pattern : DEFAULT_PATTERN, DecimalFormatSymbols.getInstance(effectiveLocale));
        } catch (IllegalArgumentException e) {
            throw new CounterConfigurationException("Invalid format pattern '" + pattern + "'", e);
        }
    }

    /**
     * Opens the counter and performs the warm-up read.
     *
     * @throws CounterConfigurationException if the counter cannot be opened
     */
    public synchronized void initialize() {
        if (sampler == null) {
            sampler = RateSampler.open(config, provider);
        }
    }

    /**
     * Samples the counter.
     *
     * @return the current counter value
     * @throws com.axonops.perfcounter.api.CounterReadException if the counter cannot be read
     * @throws IllegalStateException if not initialized
     */
    public synchronized float renderValue() {
        return requireSampler().value();
    }

    /**
     * @return the current counter value as a {@link Float}
     */
    public synchronized Object rawValue() {
        return requireSampler().rawValue();
    }

    /**
     * Appends the formatted counter value. Appends nothing if sampling fails.
     *
     * @param builder destination
     */
    public synchronized void render(StringBuilder builder) {
        float value;
        try {
            value = renderValue();
        } catch (RuntimeException e) {
            config.metricsRegistry().incrementCounter(MetricNames.ERRORS_RENDER);
            logger.warn("PerfCounter: Failed to render counter - category: {}, counter: {}", config.category(), config.counter(), e);
            return;
        }
        builder.append(formatter.format(value));
    }

    /**
     * Formats a value with this renderer's pattern and locale.
     */
    public synchronized String format(float value) {
        return formatter.format(value);
    }

    public synchronized boolean isInitialized() {
        return sampler != null;
    }

    @Override
    public synchronized void close() {
        if (sampler != null) {
            sampler.close();
            sampler = null;
        }
    }

    private RateSampler requireSampler() {
        if (sampler == null) {
            throw new IllegalStateException("PerfCounter: Renderer is not initialized");
        }
        return sampler;
    }
}
