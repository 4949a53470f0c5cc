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

package com.axonops.perfcounter.config;

import com.axonops.perfcounter.api.CounterConfigurationException;
import com.axonops.perfcounter.api.CounterProvider;
import com.axonops.perfcounter.metrics.NoOpMetricsRegistry;
import com.axonops.perfcounter.metrics.SamplerMetricsRegistry;
import java.util.Objects;

/**
 * Configuration for a {@link com.axonops.perfcounter.api.RateSampler}.
 *
 * <p>Immutable configuration using Java 17 records. Names the counter to sample and where the
 * sampler reports its own metrics.
 *
 * <h2>Instance Auto-Detection</h2>
 *
 * <p>When {@code instance} is null or empty, {@code machineName} is null and {@code category} is
 * {@code "Process"} (any case), the sampler looks up the instance that belongs to the calling
 * process instead of using the default instance. Setting {@code machineName} disables this.
 *
 * <h2>Configuration Examples</h2>
 *
 * <pre>{@code
 * // CPU usage of this process
 * SamplerConfig config = SamplerConfig.builder()
 *     .category("Process")
 *     .counter("% Processor Time")
 *     .build();
 *
 * // Available memory with Dropwizard metrics
 * SamplerConfig config = SamplerConfig.builder()
 *     .category("Memory")
 *     .counter("Available Bytes")
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.perf"))
 *     .build();
 * }</pre>
 *
 * @param category counter category (required)
 * @param counter counter name within the category (required)
 * @param instance instance name, or null to use the default or auto-detected instance
 * @param machineName remote host, or null for the local machine
 * @param readOnly open the counter for reading only
 * @param metricsRegistry metrics implementation (use {@link NoOpMetricsRegistry} for zero
 *     overhead)
 * @since 1.0.0
 * @see com.axonops.perfcounter.metrics.MetricNames
 */
public record SamplerConfig(
    String category,
    String counter,
    String instance,
    String machineName,
    boolean readOnly,
    SamplerMetricsRegistry metricsRegistry) {

  /**
   * Compact constructor with validation.
   *
   * @throws CounterConfigurationException if category or counter is missing
   */
  public SamplerConfig {
    if (category == null || category.isBlank()) {
      throw new CounterConfigurationException("category is required");
    }
    if (counter == null || counter.isBlank()) {
      throw new CounterConfigurationException("counter is required");
    }
    if (machineName != null && machineName.isBlank()) {
      throw new CounterConfigurationException("machineName must not be blank when set");
    }
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
  }

  /**
   * @return true if the sampler should look up the calling process's instance
   */
  public boolean autoDetectsInstance() {
    return (instance == null || instance.isEmpty())
        && machineName == null
        && CounterProvider.PROCESS_CATEGORY.equalsIgnoreCase(category);
  }

  /**
   * Creates a builder for custom configuration.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for sampler configuration. */
  public static class Builder {
    private String category;
    private String counter;
    private String instance;
    private String machineName;
    private boolean readOnly = true;
    private SamplerMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * @param category counter category, e.g. {@code "Process"}
     * @return this builder
     */
    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /**
     * @param counter counter name, e.g. {@code "% Processor Time"}
     * @return this builder
     */
    public Builder counter(String counter) {
      this.counter = counter;
      return this;
    }

    public Builder instance(String instance) {
      this.instance = instance;
      return this;
    }

    public Builder machineName(String machineName) {
      this.machineName = machineName;
      return this;
    }

    /**
     * <b>Default: true</b>
     *
     * @param readOnly open the counter for reading only
     * @return this builder
     */
    public Builder readOnly(boolean readOnly) {
      this.readOnly = readOnly;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * <p><b>Default: {@link NoOpMetricsRegistry}</b>
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(SamplerMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated immutable configuration
     * @throws CounterConfigurationException if category or counter is missing
     */
    public SamplerConfig build() {
      return new SamplerConfig(
          category, counter, instance, machineName, readOnly, metricsRegistry);
    }
  }
}
