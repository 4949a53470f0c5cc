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
 * Outcome of classifying a failure caught while probing counters.
 *
 * @since 1.0.0
 */
public enum FailureSeverity {

    /** The operation failed; the process is healthy and the caller may continue. */
    RECOVERABLE,

    /** The process itself is in an unrecoverable state; the failure must be rethrown. */
    FATAL
}
