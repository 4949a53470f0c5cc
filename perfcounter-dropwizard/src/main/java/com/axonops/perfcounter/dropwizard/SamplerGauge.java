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

package com.axonops.perfcounter.dropwizard;

import com.axonops.perfcounter.api.PerfCounterException;
import com.axonops.perfcounter.api.RateSampler;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Exposes a {@link RateSampler} as a Dropwizard {@link Gauge}.
 *
 * <p>Every read of the gauge samples the counter. Reporters and JMX may read concurrently, so
 * reads are serialized on the gauge. A failed read yields {@link Float#NaN} and a warning.
 *
 * <pre>{@code
 * RateSampler sampler = RateSampler.open(config, CounterProviders.platformDefault());
 * SamplerGauge.register(registry, "process.cpu", sampler);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SamplerGauge implements Gauge<Float> {
    private static final Logger logger = LoggerFactory.getLogger(SamplerGauge.class);

    private final RateSampler sampler;

    public SamplerGauge(RateSampler sampler) {
        this.sampler = Objects.requireNonNull(sampler, "sampler cannot be null");
    }

    /**
     * Registers a gauge for the sampler under {@code name}, replacing any existing metric.
     * Locks on {@code registry}, like {@link com.axonops.perfcounter.metrics.DropwizardMetricsAdapter}
     * does for its own replacements.
     *
     * @return the registered gauge
     */
    public static SamplerGauge register(MetricRegistry registry, String name, RateSampler sampler) {
        Objects.requireNonNull(registry, "registry cannot be null");
        SamplerGauge gauge = new SamplerGauge(sampler);
        synchronized (registry) {
            registry.remove(name);
            return registry.register(name, gauge);
        }
    }

    @Override
    public synchronized Float getValue() {
        try {
            return sampler.value();
        } catch (PerfCounterException | IllegalStateException e) {
            logger.warn("PerfCounter: Gauge read failed - path: {}", sampler.path(), e);
            return Float.NaN;
        }
    }
}
