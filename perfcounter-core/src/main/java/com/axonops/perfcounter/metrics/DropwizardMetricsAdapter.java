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

import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Reports sampler instrumentation into a Dropwizard {@link MetricRegistry}.
 *
 * <p>Counters map to {@link com.codahale.metrics.Counter}, latencies to
 * {@link com.codahale.metrics.Timer} and gauges to {@link Gauge}. Every name is placed under
 * the adapter's prefix, so {@code samples.read.total.count} with prefix {@code myapp.perf}
 * becomes {@code myapp.perf.samples.read.total.count}.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * SamplerConfig config = SamplerConfig.builder()
 *     .category("Processor")
 *     .counter("% Processor Time")
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.perf"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class DropwizardMetricsAdapter implements SamplerMetricsRegistry {

    /** Namespace used by {@link #DropwizardMetricsAdapter(MetricRegistry)}. */
    public static final String DEFAULT_PREFIX = "com.axonops.perfcounter";

    private final MetricRegistry registry;
    private final String prefix;

    public DropwizardMetricsAdapter(MetricRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * @param registry destination registry
     * @param prefix namespace for all sampler metrics
     * @throws NullPointerException if registry or prefix is null
     */
    public DropwizardMetricsAdapter(MetricRegistry registry, String prefix) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public void incrementCounter(String name) {
        registry.counter(qualify(name)).inc();
    }

    @Override
    public void recordLatency(String name, long durationNanos) {
        registry.timer(qualify(name)).update(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void registerGauge(String name, Supplier<? extends Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        String qualified = qualify(name);
        Gauge<Number> gauge = valueSupplier::get;
        // Adapters sharing a registry lock on it so remove and register stay paired
        synchronized (registry) {
            registry.remove(qualified);
            registry.register(qualified, gauge);
        }
    }

    @Override
    public void registerGaugeIfAbsent(String name, Supplier<? extends Number> valueSupplier) {
        Objects.requireNonNull(valueSupplier, "valueSupplier cannot be null");
        Gauge<Number> gauge = valueSupplier::get;
        // get-or-create: a concurrent registration of the same name wins and this one is dropped
        registry.gauge(qualify(name), () -> gauge);
    }

    @Override
    public void removeGauge(String name) {
        registry.remove(qualify(name));
    }

    /**
     * @return the namespace this adapter writes under
     */
    public String prefix() {
        return prefix;
    }

    private String qualify(String name) {
        return MetricRegistry.name(prefix, name);
    }
}
