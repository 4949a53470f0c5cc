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

package com.axonops.perfcounter.jni;

import com.axonops.perfcounter.api.CounterProviderException;
import com.sun.jna.Native;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * System configuration values read through {@code sysconf(3)}.
 *
 * <p>The C library is loaded once via JNA. When it cannot be loaded, or a query returns an
 * invalid value, the conventional Linux defaults are used instead.
 *
 * Thread-safe and idempotent.
 *
 * @since 1.0.0
 */
public final class Sysconf {
    private static final Logger logger = LoggerFactory.getLogger(Sysconf.class);

    /** USER_HZ on every mainstream Linux architecture. */
    public static final long DEFAULT_CLOCK_TICKS = 100;

    public static final long DEFAULT_PAGE_SIZE = 4096;

    private static final AtomicBoolean loaded = new AtomicBoolean(false);
    private static volatile LibC library = null;
    private static volatile Throwable loadError = null;

    private Sysconf() {
        // Utility class
    }

    /**
     * Loads the C library (idempotent).
     *
     * @return LibC binding
     * @throws CounterProviderException if the library cannot be loaded
     */
    public static LibC loadLibrary() {
        if (loaded.get()) {
            return loadedOrThrow();
        }

        synchronized (Sysconf.class) {
            if (loaded.get()) {
                return loadedOrThrow();
            }

            try {
                library = Native.load("c", LibC.class);
                loaded.set(true);
                logger.debug("PerfCounter: C library loaded");
                return library;
            } catch (Exception | UnsatisfiedLinkError e) {
                loadError = e;
                loaded.set(true);
                logger.warn("PerfCounter: Failed to load C library, using default system constants", e);
                throw new CounterProviderException("Failed to load C library: " + e.getMessage(), e);
            }
        }
    }

    private static LibC loadedOrThrow() {
        if (loadError != null) {
            throw new CounterProviderException("Previous C library load failed", loadError);
        }
        return library;
    }

    /**
     * @return scheduler clock ticks per second, the unit of CPU times in {@code /proc}
     */
    public static long clockTicksPerSecond() {
        return query(LibC.SC_CLK_TCK, DEFAULT_CLOCK_TICKS);
    }

    /**
     * @return memory page size in bytes
     */
    public static long pageSize() {
        return query(LibC.SC_PAGESIZE, DEFAULT_PAGE_SIZE);
    }

    public static boolean isLoaded() {
        return loaded.get() && loadError == null;
    }

    private static long query(int name, long fallback) {
        try {
            long value = loadLibrary().sysconf(name).longValue();
            if (value > 0) {
                return value;
            }
            logger.debug("PerfCounter: sysconf({}) returned {}, using {}", name, value, fallback);
        } catch (CounterProviderException e) {
            logger.debug("PerfCounter: sysconf({}) unavailable, using {}", name, fallback);
        }
        return fallback;
    }
}
