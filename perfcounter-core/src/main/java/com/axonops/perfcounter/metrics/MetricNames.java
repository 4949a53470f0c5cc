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

/**
 * Metric name constants for perfcounter-java instrumentation.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * SamplerConfig config = SamplerConfig.builder()
 *     .category("Process")
 *     .counter("% Processor Time")
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.perf"))
 *     .build();
 *
 * Counter reads = registry.counter(MetricRegistry.name("myapp.perf", MetricNames.SAMPLES_READ));
 * }</pre>
 *
 * <h2>Monitoring Recommendations</h2>
 *
 * <ul>
 *   <li><b>Rotation ratio:</b> SAMPLES_ROTATIONS_SUPPRESSED / SAMPLES_READ - High values mean the
 *       caller polls much faster than once per second
 *   <li><b>Handle leaks:</b> HANDLES_OPENED - HANDLES_CLOSED should equal the number of open
 *       samplers
 * </ul>
 *
 * @since 1.0.0
 * @see com.axonops.perfcounter.api.RateSampler
 */
public final class MetricNames {
  private MetricNames() {}

  // ========================================
  // Sampling
  // ========================================

  /**
   * Raw samples read from counter handles.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SAMPLES_READ = "samples.read.total.count";

  /**
   * Latency of a single raw read.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   *
   * <p><b>Interpretation:</b> High latencies usually mean a remote machine or a slow provider
   */
  public static final String SAMPLES_READ_LATENCY = "samples.read.latency";

  /**
   * Times the retained reference samples advanced.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SAMPLES_ROTATIONS = "samples.rotations.total.count";

  /**
   * Reads of frequency-based counters that arrived within the rotation threshold and left the
   * retained samples unchanged.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String SAMPLES_ROTATIONS_SUPPRESSED =
      "samples.rotations.suppressed.total.count";

  // ========================================
  // Handles
  // ========================================

  /** Counter handles opened. <b>Type:</b> Counter */
  public static final String HANDLES_OPENED = "handles.opened.total.count";

  /** Counter handles closed. <b>Type:</b> Counter */
  public static final String HANDLES_CLOSED = "handles.closed.total.count";

  /** Handles of open samplers right now. <b>Type:</b> Gauge */
  public static final String HANDLES_ACTIVE = "handles.active.current.count";

  // ========================================
  // Instance resolution
  // ========================================

  /**
   * Process instances resolved to the calling process.
   *
   * <p><b>Type:</b> Counter
   */
  public static final String INSTANCES_RESOLVED = "instances.resolved.total.count";

  /**
   * Resolutions that found no matching instance or failed while probing.
   *
   * <p><b>Type:</b> Counter
   *
   * <p><b>Interpretation:</b> Samplers fall back to the default instance when this increments
   */
  public static final String INSTANCES_RESOLUTION_FAILED =
      "instances.resolution.failed.total.count";

  /**
   * Time spent enumerating and probing instances.
   *
   * <p><b>Type:</b> Timer (nanoseconds)
   */
  public static final String INSTANCES_RESOLUTION_LATENCY = "instances.resolution.latency";

  // ========================================
  // Errors
  // ========================================

  /** Counters that could not be opened. <b>Type:</b> Counter */
  public static final String ERRORS_OPEN = "errors.open.total.count";

  /** Raw reads that failed. <b>Type:</b> Counter */
  public static final String ERRORS_READ = "errors.read.total.count";

  /** Renders that failed and produced no output. <b>Type:</b> Counter */
  public static final String ERRORS_RENDER = "errors.render.total.count";
}
