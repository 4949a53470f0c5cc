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
import com.axonops.perfcounter.api.CounterReadException;
import com.axonops.perfcounter.api.CounterType;
import com.axonops.perfcounter.api.RateSampler;
import com.axonops.perfcounter.api.RawSample;
import com.axonops.perfcounter.config.SamplerConfig;
import com.axonops.perfcounter.metrics.DropwizardMetricsAdapter;
import com.axonops.perfcounter.test.ScriptedCounterProvider;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

class CounterRendererTest {

    private ScriptedCounterProvider provider;
    private SamplerConfig config;

    @BeforeEach
    void setUp() {
        provider = new ScriptedCounterProvider();
        config = SamplerConfig.builder().category("Memory").counter("Available Bytes").build();
        RateSampler.getHandleTracker().reset();
    }

    private static RawSample items(long value) {
        return RawSample.of(0, value, 0, CounterType.NUMBER_OF_ITEMS);
    }

    @Test
    void rendersWithPatternAndLocale() {
        provider.script("Memory", "Available Bytes", "", items(1), new RawSample(0, 25, 200, 0, CounterType.RAW_FRACTION));

        try (CounterRenderer renderer = new CounterRenderer(config, provider, "0.00", Locale.GERMANY)) {
            renderer.initialize();
            StringBuilder line = new StringBuilder("mem=");
            renderer.render(line);

            assertThat(line).hasToString("mem=12,50");
        }
    }

    @Test
    void defaultPatternDropsTrailingZeros() {
        provider.script("Memory", "Available Bytes", "", items(1), items(2048));

        try (CounterRenderer renderer = new CounterRenderer(config, provider, null, Locale.ROOT)) {
            renderer.initialize();
            StringBuilder line = new StringBuilder();
            renderer.render(line);

            assertThat(line).hasToString("2048");
            assertThat(renderer.format(0.25f)).isEqualTo("0.25");
        }
    }

    @Test
    void initializePerformsWarmUpOnce() {
        provider.script("Memory", "Available Bytes", "", items(1), items(2));

        try (CounterRenderer renderer = new CounterRenderer(config, provider)) {
            renderer.initialize();
            renderer.initialize();

            assertThat(provider.handles()).hasSize(1);
            assertThat(provider.lastHandle().reads()).isEqualTo(1);
            assertThat(renderer.renderValue()).isEqualTo(2f);
        }
    }

    @Test
    void rawValueIsBoxedFloat() {
        provider.script("Memory", "Available Bytes", "", items(1), items(3));

        try (CounterRenderer renderer = new CounterRenderer(config, provider)) {
            renderer.initialize();

            assertThat(renderer.rawValue()).isInstanceOf(Float.class).isEqualTo(3f);
        }
    }

    @Test
    void failedRenderAppendsNothing() {
        MetricRegistry registry = new MetricRegistry();
        SamplerConfig instrumented = SamplerConfig.builder()
            .category("Memory")
            .counter("Available Bytes")
            .metricsRegistry(new DropwizardMetricsAdapter(registry, "test"))
            .build();
        provider.script("Memory", "Available Bytes", "", items(1), new CounterReadException("gone"));

        try (CounterRenderer renderer = new CounterRenderer(instrumented, provider)) {
            renderer.initialize();
            StringBuilder line = new StringBuilder("mem=");
            renderer.render(line);

            assertThat(line).hasToString("mem=");
            assertThat(registry.counter("test.errors.render.total.count").getCount()).isEqualTo(1);
        }
    }

    @Test
    void renderValuePropagatesReadFailure() {
        provider.script("Memory", "Available Bytes", "", items(1), new CounterReadException("gone"));

        try (CounterRenderer renderer = new CounterRenderer(config, provider)) {
            renderer.initialize();

            assertThatThrownBy(renderer::renderValue).isInstanceOf(CounterReadException.class);
        }
    }

    @Test
    void useBeforeInitializeFails() {
        CounterRenderer renderer = new CounterRenderer(config, provider);

        assertThat(renderer.isInitialized()).isFalse();
        assertThatThrownBy(renderer::renderValue)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not initialized");
    }

    @Test
    void initializeFailurePropagates() {
        try (CounterRenderer renderer = new CounterRenderer(config, provider)) {
            assertThatThrownBy(renderer::initialize).isInstanceOf(CounterConfigurationException.class);
            assertThat(renderer.isInitialized()).isFalse();
        }
    }

    @Test
    void invalidPatternRejected() {
        assertThatThrownBy(() -> new CounterRenderer(config, provider, "#,##0.0.0", Locale.ROOT))
            .isInstanceOf(CounterConfigurationException.class)
            .hasMessageContaining("#,##0.0.0");
    }

    @Test
    void closeReleasesSampler() {
        provider.script("Memory", "Available Bytes", "", items(1));
        CounterRenderer renderer = new CounterRenderer(config, provider);
        renderer.initialize();

        renderer.close();
        renderer.close();

        assertThat(renderer.isInitialized()).isFalse();
        assertThat(provider.lastHandle().closeCalls()).isEqualTo(1);
        assertThat(RateSampler.getHandleTracker().getActiveHandleCount()).isZero();
    }
}
