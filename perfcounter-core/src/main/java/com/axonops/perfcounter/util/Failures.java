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

package com.axonops.perfcounter.util;

/**
 * Decides which caught failures may be swallowed and which must propagate.
 *
 * <p>{@link VirtualMachineError} (out of memory, stack overflow, internal JVM errors) and
 * {@link LinkageError} are {@link FailureSeverity#FATAL}. Everything else is
 * {@link FailureSeverity#RECOVERABLE}.
 *
 * @since 1.0.0
 */
public final class Failures {

    private Failures() {
        // Utility class
    }

    public static FailureSeverity classify(Throwable failure) {
        if (failure instanceof VirtualMachineError || failure instanceof LinkageError) {
            return FailureSeverity.FATAL;
        }
        return FailureSeverity.RECOVERABLE;
    }

    /**
     * Rethrows the failure unchanged if it is fatal, otherwise returns normally.
     *
     * <p>Also restores the interrupt flag when the failure is an {@link InterruptedException}.
     *
     * @param failure caught failure
     */
    public static void rethrowIfFatal(Throwable failure) {
        if (failure instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        if (classify(failure) == FailureSeverity.FATAL) {
            // Only Error subclasses are classified fatal
            throw (Error) failure;
        }
    }
}
