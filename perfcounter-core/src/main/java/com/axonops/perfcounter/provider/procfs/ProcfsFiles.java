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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Parsers for the {@code /proc} file formats used by {@link ProcfsCounterProvider}.
 *
 * <p>All parsers throw {@link IllegalArgumentException} on malformed input.
 */
final class ProcfsFiles {

    /** Instance name of the aggregate line in {@code /proc/stat}. */
    static final String TOTAL_INSTANCE = "_Total";

    private ProcfsFiles() {
        // Utility class
    }

    /**
     * Fields of {@code /proc/[pid]/stat}. CPU times are in clock ticks, resident size in pages.
     */
    record ProcessStat(
        long pid,
        String name,
        long minorFaults,
        long majorFaults,
        long userTicks,
        long systemTicks,
        long threads,
        long virtualBytes,
        long residentPages) {
    }

    /**
     * Aggregate CPU times of one {@code cpu} line in {@code /proc/stat}, in clock ticks.
     */
    record CpuTimes(
        long user, long nice, long system, long idle, long iowait, long irq, long softirq, long steal) {

        long total() {
            return user + nice + system + idle + iowait + irq + softirq + steal;
        }

        long idleAll() {
            return idle + iowait;
        }

        long busy() {
            return total() - idleAll();
        }

        long userAll() {
            return user + nice;
        }

        long privileged() {
            return system + irq + softirq;
        }
    }

    static ProcessStat parseProcessStat(String content) {
        // The command name may itself contain spaces and parentheses
        int open = content.indexOf('(');
        int close = content.lastIndexOf(')');
        if (open <= 0 || close < open) {
            throw new IllegalArgumentException("Malformed process stat: " + abbreviate(content));
        }

        long pid = Long.parseLong(content.substring(0, open).trim());
        String name = content.substring(open + 1, close);
        String[] fields = content.substring(close + 1).trim().split("\\s+");
        if (fields.length < 22) {
            throw new IllegalArgumentException("Process stat has " + fields.length + " fields after name, expected >= 22");
        }

        return new ProcessStat(
            pid,
            name,
            Long.parseLong(fields[7]),
            Long.parseLong(fields[9]),
            Long.parseLong(fields[11]),
            Long.parseLong(fields[12]),
            Long.parseLong(fields[17]),
            Long.parseLong(fields[20]),
            Long.parseLong(fields[21]));
    }

    /**
     * Parses the {@code cpu} lines of {@code /proc/stat}.
     *
     * @return CPU times keyed by instance name: {@value #TOTAL_INSTANCE} for the aggregate line,
     *     the cpu number otherwise; in file order
     */
    static Map<String, CpuTimes> parseCpuTimes(List<String> lines) {
        Map<String, CpuTimes> result = new LinkedHashMap<>();
        for (String line : lines) {
            if (!line.startsWith("cpu")) {
                continue;
            }
            String[] fields = line.trim().split("\\s+");
            String label = fields[0];
            String instance = label.equals("cpu") ? TOTAL_INSTANCE : label.substring(3);
            result.put(instance, new CpuTimes(
                field(fields, 1), field(fields, 2), field(fields, 3), field(fields, 4),
                field(fields, 5), field(fields, 6), field(fields, 7), field(fields, 8)));
        }
        return result;
    }

    /**
     * Reads one entry of {@code /proc/meminfo} in bytes.
     *
     * @param key entry name without the trailing colon, e.g. {@code "MemAvailable"}
     */
    static OptionalLong parseMeminfoBytes(List<String> lines, String key) {
        String prefix = key + ":";
        for (String line : lines) {
            if (line.startsWith(prefix)) {
                String[] fields = line.substring(prefix.length()).trim().split("\\s+");
                long value = Long.parseLong(fields[0]);
                boolean kilobytes = fields.length > 1 && fields[1].equalsIgnoreCase("kB");
                return OptionalLong.of(kilobytes ? value * 1024 : value);
            }
        }
        return OptionalLong.empty();
    }

    static boolean isPid(String fileName) {
        if (fileName.isEmpty()) {
            return false;
        }
        for (int i = 0; i < fileName.length(); i++) {
            if (!Character.isDigit(fileName.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    // Older kernels report fewer columns
    private static long field(String[] fields, int index) {
        return index < fields.length ? Long.parseLong(fields[index]) : 0L;
    }

    private static String abbreviate(String content) {
        return content.length() > 64 ? content.substring(0, 64) + "..." : content;
    }
}
