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

import java.util.List;

/**
 * The operating system's counter subsystem.
 *
 * <p>Abstracts the platform API so {@link RateSampler} and {@link ProcessInstanceResolver} can be
 * driven by scripted samples in tests. Implementations must be thread-safe; the handles they
 * return need not be.
 *
 * @since 1.0.0
 */
public interface CounterProvider {

    /** Category holding one instance per running process. */
    String PROCESS_CATEGORY = "Process";

    /** Counter in {@link #PROCESS_CATEGORY} reporting the instance's process id. */
    String ID_PROCESS_COUNTER = "ID Process";

    /**
     * Opens a counter.
     *
     * @param path counter address
     * @param readOnly open for reading only
     * @return a new handle owned by the caller
     * @throws CounterConfigurationException if the category, counter or instance does not exist,
     *     or the machine cannot be served
     */
    CounterHandle open(CounterPath path, boolean readOnly);

    /**
     * Lists the instances currently registered under a category.
     *
     * @param category category name
     * @param machineName remote host, or null for the local machine
     * @return instance names, empty for single-instance categories
     * @throws CounterConfigurationException if the category does not exist, or the machine cannot
     *     be served
     * @throws CounterReadException if the instance list cannot be read
     */
    List<String> instanceNames(String category, String machineName);
}
