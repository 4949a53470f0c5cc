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
import com.axonops.perfcounter.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class SamplerConfigTest {

    @Test
    void builderDefaults() {
        SamplerConfig config = SamplerConfig.builder().category("Memory").counter("Available Bytes").build();

        assertThat(config.instance()).isNull();
        assertThat(config.machineName()).isNull();
        assertThat(config.readOnly()).isTrue();
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Process", "process", "PROCESS"})
    void processCategoryWithoutInstanceAutoDetects(String category) {
        SamplerConfig config = SamplerConfig.builder().category(category).counter("Working Set").build();

        assertThat(config.autoDetectsInstance()).isTrue();
    }

    @Test
    void emptyInstanceAutoDetects() {
        SamplerConfig config = SamplerConfig.builder()
            .category("Process").counter("Working Set").instance("").build();

        assertThat(config.autoDetectsInstance()).isTrue();
    }

    @Test
    void explicitInstanceDisablesAutoDetection() {
        SamplerConfig config = SamplerConfig.builder()
            .category("Process").counter("Working Set").instance("java#2").build();

        assertThat(config.autoDetectsInstance()).isFalse();
    }

    @Test
    void machineNameDisablesAutoDetection() {
        SamplerConfig config = SamplerConfig.builder()
            .category("Process").counter("Working Set").machineName("db01").build();

        assertThat(config.autoDetectsInstance()).isFalse();
    }

    @Test
    void otherCategoriesNeverAutoDetect() {
        SamplerConfig config = SamplerConfig.builder().category("Processor").counter("% Processor Time").build();

        assertThat(config.autoDetectsInstance()).isFalse();
    }

    @Test
    void categoryIsRequired() {
        assertThatThrownBy(() -> SamplerConfig.builder().counter("Working Set").build())
            .isInstanceOf(CounterConfigurationException.class)
            .hasMessageContaining("category");
    }

    @Test
    void counterIsRequired() {
        assertThatThrownBy(() -> SamplerConfig.builder().category("Process").counter("  ").build())
            .isInstanceOf(CounterConfigurationException.class)
            .hasMessageContaining("counter");
    }

    @Test
    void blankMachineNameRejected() {
        assertThatThrownBy(() -> SamplerConfig.builder()
                .category("Process").counter("Working Set").machineName("").build())
            .isInstanceOf(CounterConfigurationException.class);
    }

    @Test
    void nullMetricsRegistryRejected() {
        assertThatThrownBy(() -> SamplerConfig.builder().metricsRegistry(null))
            .isInstanceOf(NullPointerException.class);
    }
}
