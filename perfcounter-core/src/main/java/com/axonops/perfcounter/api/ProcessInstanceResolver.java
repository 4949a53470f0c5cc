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

package com.axonops.perfcounter.api;

import com.axonops.perfcounter.metrics.MetricNames;
import com.axonops.perfcounter.metrics.SamplerMetricsRegistry;
import com.axonops.perfcounter.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Finds the counter instance that belongs to the calling process.
 *
 * <p>When several processes share an executable name, the process category lists them under
 * distinct instance names ({@code java}, {@code java#1}, ...). The only reliable way to tell them
 * apart is to read each instance's {@code "ID Process"} counter and compare it to our own pid.
 *
 * <p>Resolution never fails hard: when nothing matches, or reading a candidate throws a recoverable
 * exception, an empty instance name is returned and a warning is logged. Fatal errors (see
 * {@link Failures#classify(Throwable)}) are rethrown.
 *
 * @since 1.0.0
 */
public final class ProcessInstanceResolver {
    private static final Logger logger = LoggerFactory.getLogger(ProcessInstanceResolver.class);

    private final CounterProvider provider;
    private final LongSupplier pidSupplier;
    private final SamplerMetricsRegistry metricsRegistry;

    /**
     * Creates a resolver comparing against the pid of the running JVM.
     */
    public ProcessInstanceResolver(CounterProvider provider, SamplerMetricsRegistry metricsRegistry) {
        this(provider, () -> ProcessHandle.current().pid(), metricsRegistry);
    }

    public ProcessInstanceResolver(CounterProvider provider, LongSupplier pidSupplier,
                                   SamplerMetricsRegistry metricsRegistry) {
        this.provider = Objects.requireNonNull(provider, "provider cannot be null");
        this.pidSupplier = Objects.requireNonNull(pidSupplier, "pidSupplier cannot be null");
        this.metricsRegistry = Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
    }

    /**
     * Returns the instance of {@code category} whose {@code "ID Process"} equals our pid.
     *
     * @param category the process category name
     * @return the matching instance name, or an empty string if none matched
     */
    public String instanceName(String category) {
        long startNanos = System.nanoTime();
        long pid = -1;
        try {
            pid = pidSupplier.getAsLong();
            List<String> candidates = provider.instanceNames(category, null);
            for (String candidate : candidates) {
                CounterPath candidatePath = CounterPath.local(category, CounterProvider.ID_PROCESS_COUNTER, candidate);
                try (CounterHandle handle = provider.open(candidatePath, true)) {
                    long reportedPid = handle.nextRawSample().rawValue();
                    if (reportedPid == pid) {
                        metricsRegistry.incrementCounter(MetricNames.INSTANCES_RESOLVED);
                        logger.debug("PerfCounter: Resolved process instance - instance: {}, pid: {}", candidate, pid);
                        return candidate;
                    }
                }
            }

            metricsRegistry.incrementCounter(MetricNames.INSTANCES_RESOLUTION_FAILED);
            logger.warn("PerfCounter: Failed to auto detect current process instance - pid: {}, candidates: {}",
                pid, candidates.size());
        } catch (Throwable t) {
            Failures.rethrowIfFatal(t);
            metricsRegistry.incrementCounter(MetricNames.INSTANCES_RESOLUTION_FAILED);
            logger.warn("PerfCounter: Failed to auto detect current process instance - pid: {}", pid, t);
        } finally {
            metricsRegistry.recordLatencySince(MetricNames.INSTANCES_RESOLUTION_LATENCY, startNanos);
        }
        return "";
    }
}
