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

import com.axonops.perfcounter.api.CounterType;

import java.util.Locale;
import java.util.Optional;

/**
 * Counters served by {@link ProcfsCounterProvider}, named after their Windows counterparts so
 * configurations port across platforms.
 *
 * @since 1.0.0
 */
public enum ProcfsCounter {

    PROCESS_ID(Category.PROCESS, "ID Process", CounterType.NUMBER_OF_ITEMS),
    PROCESS_PROCESSOR_TIME(Category.PROCESS, "% Processor Time", CounterType.PERCENT_TIMER),
    PROCESS_USER_TIME(Category.PROCESS, "% User Time", CounterType.PERCENT_TIMER),
    PROCESS_PRIVILEGED_TIME(Category.PROCESS, "% Privileged Time", CounterType.PERCENT_TIMER),
    PROCESS_WORKING_SET(Category.PROCESS, "Working Set", CounterType.NUMBER_OF_ITEMS),
    PROCESS_VIRTUAL_BYTES(Category.PROCESS, "Virtual Bytes", CounterType.NUMBER_OF_ITEMS),
    PROCESS_THREAD_COUNT(Category.PROCESS, "Thread Count", CounterType.NUMBER_OF_ITEMS),
    PROCESS_PAGE_FAULTS(Category.PROCESS, "Page Faults/sec", CounterType.RATE_OF_COUNTS_PER_SECOND),

    PROCESSOR_TIME(Category.PROCESSOR, "% Processor Time", CounterType.SAMPLE_FRACTION),
    PROCESSOR_USER_TIME(Category.PROCESSOR, "% User Time", CounterType.SAMPLE_FRACTION),
    PROCESSOR_PRIVILEGED_TIME(Category.PROCESSOR, "% Privileged Time", CounterType.SAMPLE_FRACTION),
    PROCESSOR_IDLE_TIME(Category.PROCESSOR, "% Idle Time", CounterType.SAMPLE_FRACTION),

    MEMORY_AVAILABLE_BYTES(Category.MEMORY, "Available Bytes", CounterType.NUMBER_OF_ITEMS),
    MEMORY_COMMITTED_BYTES(Category.MEMORY, "Committed Bytes", CounterType.NUMBER_OF_ITEMS);

    /** Counter categories. */
    public enum Category {
        PROCESS("Process"),
        PROCESSOR("Processor"),
        MEMORY("Memory");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }

        /** Case-insensitive lookup by display name. */
        public static Optional<Category> find(String name) {
            for (Category category : values()) {
                if (category.displayName.equalsIgnoreCase(name)) {
                    return Optional.of(category);
                }
            }
            return Optional.empty();
        }
    }

    private final Category category;
    private final String displayName;
    private final CounterType type;

    ProcfsCounter(Category category, String displayName, CounterType type) {
        this.category = category;
        this.displayName = displayName;
        this.type = type;
    }

    public Category category() {
        return category;
    }

    public String displayName() {
        return displayName;
    }

    public CounterType type() {
        return type;
    }

    /** Case-insensitive lookup by display name within a category. */
    public static Optional<ProcfsCounter> find(Category category, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (ProcfsCounter counter : values()) {
            if (counter.category == category && counter.displayName.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(counter);
            }
        }
        return Optional.empty();
    }
}
