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

package com.axonops.perfcounter.provider.procfs;

import com.axonops.perfcounter.api.CounterHandle;
import com.axonops.perfcounter.api.CounterPath;
import com.axonops.perfcounter.api.CounterReadException;
import com.axonops.perfcounter.api.RawSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * Handle reading one counter from {@code /proc} files.
 *
 * <p>Holds no open file descriptors between reads, so {@link #close()} only marks the handle
 * unusable.
 */
final class ProcfsCounterHandle implements CounterHandle {
    private static final Logger logger = LoggerFactory.getLogger(ProcfsCounterHandle.class);

    /** Produces one sample per call by re-reading the backing file. */
    @FunctionalInterface
    interface SampleSource {
        RawSample read() throws IOException;
    }

    private final CounterPath path;
    private final SampleSource source;
    private volatile boolean closed = false;

    ProcfsCounterHandle(CounterPath path, SampleSource source) {
        this.path = path;
        this.source = source;
    }

    @Override
    public CounterPath path() {
        return path;
    }

    @Override
    public RawSample nextRawSample() {
        if (closed) {
            throw new CounterReadException("Handle is closed: " + path);
        }
        try {
            return source.read();
        } catch (NoSuchFileException e) {
            throw new CounterReadException("Instance no longer exists: " + path, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new CounterReadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.trace("PerfCounter: procfs handle closed - path: {}", path);
        }
    }
}
