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

import com.axonops.perfcounter.config.SamplerConfig;
import com.axonops.perfcounter.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds {@link SamplerConfig}s whose instrumentation lands in a Dropwizard {@link MetricRegistry}.
 *
 * <h2>JMX exposure</h2>
 *
 * <p>The class owns at most one {@link JmxReporter} per JVM. It is bound to the registry of the
 * first {@code withMetrics} call with JMX enabled, and every metric later added to that registry
 * (sampler instrumentation under the chosen prefix, {@link SamplerGauge}s) shows up in JMX.
 * Samplers configured with a different registry still record into their own registry, but that
 * registry is not exposed: expose it with a reporter of your own, or call {@link #shutdown()}
 * first to rebind. Several samplers sharing one registry under different prefixes are all
 * covered by the single reporter.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * SamplerConfig config = PerfCounterMetricsConfig.withMetrics(registry, "com.myapp.perf")
 *     .category("Process")
 *     .counter("% Processor Time")
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class PerfCounterMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(PerfCounterMetricsConfig.class);

    // Guarded by the class lock
    private static JmxReporter jmxReporter;
    private static MetricRegistry exposedRegistry;

    private PerfCounterMetricsConfig() {
    }

    /**
     * Same as {@link #withMetrics(MetricRegistry, String, boolean)} with JMX enabled.
     */
    public static SamplerConfig.Builder withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * @param registry registry receiving sampler instrumentation
     * @param metricPrefix namespace prepended to every sampler metric name
     * @param enableJmx expose {@code registry} over JMX if no registry is exposed yet
     * @return builder with the metrics registry set
     */
    public static SamplerConfig.Builder withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            exposeOverJmx(registry);
        }

        return SamplerConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Uses {@link DropwizardMetricsAdapter#DEFAULT_PREFIX} and enables JMX.
     */
    public static SamplerConfig.Builder withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    private static synchronized void exposeOverJmx(MetricRegistry registry) {
        if (jmxReporter != null) {
            if (exposedRegistry != registry) {
                logger.warn("PerfCounter: JMX already exposes another registry, sampler metrics of this one stay off JMX");
            }
            return;
        }
        try {
            JmxReporter reporter = JmxReporter.forRegistry(registry).build();
            reporter.start();
            jmxReporter = reporter;
            exposedRegistry = registry;
            logger.info("PerfCounter: JmxReporter started for sampler metrics");
        } catch (RuntimeException e) {
            // Sampling works without JMX; retried on the next withMetrics call
            logger.warn("PerfCounter: Failed to start JmxReporter", e);
        }
    }

    public static synchronized boolean isJmxReporterRunning() {
        return jmxReporter != null;
    }

    /**
     * Whether {@code registry} is the one currently exposed over JMX.
     */
    public static synchronized boolean isExposedOverJmx(MetricRegistry registry) {
        return jmxReporter != null && exposedRegistry == registry;
    }

    /**
     * Stops the JMX reporter, if any. The next {@code withMetrics} call with JMX enabled binds a
     * new one.
     */
    public static synchronized void shutdown() {
        if (jmxReporter != null) {
            logger.info("PerfCounter: Stopping JmxReporter");
            jmxReporter.stop();
            jmxReporter = null;
            exposedRegistry = null;
        }
    }
}
