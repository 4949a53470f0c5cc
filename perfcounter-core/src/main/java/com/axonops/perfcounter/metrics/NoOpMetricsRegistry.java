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
 * Registry that discards everything. Default of {@link com.axonops.perfcounter.config.SamplerConfig}.
 *
 * @since 1.0.0
 */
public final class NoOpMetricsRegistry implements SamplerMetricsRegistry {

  public static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

  private NoOpMetricsRegistry() {
    // Singleton - use INSTANCE
  }

  @Override
  public void incrementCounter(String name) {
    // discarded
  }

  @Override
  public void recordLatency(String name, long durationNanos) {
    // discarded
  }

  @Override
  public void recordLatencySince(String name, long startNanos) {
    // skips the clock read
  }

  @Override
  public void registerGauge(String name, Supplier<? extends Number> valueSupplier) {
    // discarded
  }

  @Override
  public void registerGaugeIfAbsent(String name, Supplier<? extends Number> valueSupplier) {
    // discarded
  }

  @Override
  public void removeGauge(String name) {
    // discarded
  }
}
