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

package com.axonops.perfcounter.provider;

import com.axonops.perfcounter.api.CounterProvider;
import com.axonops.perfcounter.api.CounterProviderException;
import com.axonops.perfcounter.provider.procfs.ProcfsCounterProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects the counter provider for the running platform.
 *
 * Supported platforms:
 * - Linux (procfs)
 *
 * @since 1.0.0
 */
public final class CounterProviders {
    private static final Logger logger = LoggerFactory.getLogger(CounterProviders.class);

    private CounterProviders() {
        // Utility class
    }

    /**
     * Creates the provider for the current operating system.
     *
     * @return a new provider
     * @throws CounterProviderException if the operating system is not supported
     */
    public static CounterProvider platformDefault() {
        return forOperatingSystem(System.getProperty("os.name"));
    }

    static CounterProvider forOperatingSystem(String osName) {
        String os = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
        if (os.contains("linux")) {
            logger.debug("PerfCounter: Using procfs provider for {}", osName);
            return new ProcfsCounterProvider();
        }
        throw new CounterProviderException("Unsupported OS: " + osName + " (only Linux supported)");
    }
}
