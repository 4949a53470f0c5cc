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

import com.axonops.perfcounter.api.CounterHandle;
import com.axonops.perfcounter.api.CounterPath;
import com.axonops.perfcounter.api.CounterReadException;
import com.axonops.perfcounter.api.CounterType;
import com.axonops.perfcounter.api.RateSampler;
import com.axonops.perfcounter.api.RawSample;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SamplerGaugeTest {

    /** Replays gauge values; throws once they run out. */
    private static final class ReplayHandle implements CounterHandle {
        private final Deque<Long> values;

        ReplayHandle(Long... values) {
            this.values = new ArrayDeque<>(List.of(values));
        }

        @Override
        public CounterPath path() {
            return CounterPath.local("Process", "Thread Count", "java");
        }

        @Override
        public RawSample nextRawSample() {
            Long next = values.poll();
            if (next == null) {
                throw new CounterReadException("Instance no longer exists");
            }
            return RawSample.of(0, next, 0, CounterType.NUMBER_OF_ITEMS);
        }

        @Override
        public void close() {
            // nothing to release
        }
    }

    @Test
    void gaugeSamplesOnEveryRead() {
        MetricRegistry registry = new MetricRegistry();
        RateSampler sampler = new RateSampler(new ReplayHandle(12L, 14L));

        SamplerGauge.register(registry, "process.threads", sampler);

        Gauge<?> gauge = registry.getGauges().get("process.threads");
        assertThat(gauge.getValue()).isEqualTo(12f);
        assertThat(gauge.getValue()).isEqualTo(14f);
    }

    @Test
    void failedReadYieldsNaN() {
        SamplerGauge gauge = new SamplerGauge(new RateSampler(new ReplayHandle()));

        assertThat(gauge.getValue()).isNaN();
    }

    @Test
    void closedSamplerYieldsNaN() {
        RateSampler sampler = new RateSampler(new ReplayHandle(1L));
        SamplerGauge gauge = new SamplerGauge(sampler);
        sampler.close();

        assertThat(gauge.getValue()).isNaN();
    }

    @Test
    void registerReplacesExistingMetric() {
        MetricRegistry registry = new MetricRegistry();
        registry.counter("process.threads");

        SamplerGauge gauge = SamplerGauge.register(registry, "process.threads", new RateSampler(new ReplayHandle(5L)));

        assertThat(registry.getCounters()).doesNotContainKey("process.threads");
        assertThat(registry.getGauges().get("process.threads")).isSameAs(gauge);
    }

    @Test
    void rejectsNullSampler() {
        assertThatThrownBy(() -> new SamplerGauge(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("sampler");
    }
}
