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

import com.axonops.perfcounter.provider.procfs.ProcfsFiles.CpuTimes;
import com.axonops.perfcounter.provider.procfs.ProcfsFiles.ProcessStat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProcfsFilesTest {

    /** Builds a {@code /proc/[pid]/stat} line with the fields the provider reads. */
    static String statLine(long pid, String name, long minorFaults, long majorFaults, long userTicks,
                           long systemTicks, long threads, long virtualBytes, long residentPages) {
        return pid + " (" + name + ") S 1 " + pid + " " + pid + " 0 -1 4194560 "
            + minorFaults + " 0 " + majorFaults + " 0 " + userTicks + " " + systemTicks
            + " 0 0 20 0 " + threads + " 0 8872 " + virtualBytes + " " + residentPages
            + " 18446744073709551615 1 1 0 0 0 0 0 0 0 0 0 0 17 3 0 0 0 0 0\n";
    }

    @Test
    void parsesProcessStat() {
        ProcessStat stat = ProcfsFiles.parseProcessStat(statLine(4242, "java", 11, 2, 300, 45, 37, 8_000_000, 512));

        assertThat(stat).isEqualTo(new ProcessStat(4242, "java", 11, 2, 300, 45, 37, 8_000_000, 512));
    }

    @Test
    void commandNameMayContainSpacesAndParentheses() {
        ProcessStat stat = ProcfsFiles.parseProcessStat(statLine(7, "Web Content (1)", 0, 0, 1, 1, 3, 100, 1));

        assertThat(stat.name()).isEqualTo("Web Content (1)");
        assertThat(stat.threads()).isEqualTo(3);
    }

    @Test
    void truncatedStatRejected() {
        assertThatThrownBy(() -> ProcfsFiles.parseProcessStat("12 (java) S 1 12 12"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fields");
    }

    @Test
    void statWithoutNameRejected() {
        assertThatThrownBy(() -> ProcfsFiles.parseProcessStat("garbage"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void parsesCpuLinesInFileOrder() {
        Map<String, CpuTimes> times = ProcfsFiles.parseCpuTimes(List.of(
            "cpu  100 5 50 800 20 3 2 0 0 0",
            "cpu0 60 5 30 400 10 2 1 0 0 0",
            "cpu1 40 0 20 400 10 1 1 0 0 0",
            "intr 12345 0 0",
            "ctxt 999"));

        assertThat(times).containsOnlyKeys(ProcfsFiles.TOTAL_INSTANCE, "0", "1");
        assertThat(times.keySet()).containsExactly(ProcfsFiles.TOTAL_INSTANCE, "0", "1");

        CpuTimes total = times.get(ProcfsFiles.TOTAL_INSTANCE);
        assertThat(total.total()).isEqualTo(980);
        assertThat(total.idleAll()).isEqualTo(820);
        assertThat(total.busy()).isEqualTo(160);
        assertThat(total.userAll()).isEqualTo(105);
        assertThat(total.privileged()).isEqualTo(55);
    }

    @Test
    void missingCpuColumnsAreZero() {
        CpuTimes times = ProcfsFiles.parseCpuTimes(List.of("cpu 10 0 5 100")).get(ProcfsFiles.TOTAL_INSTANCE);

        assertThat(times).isEqualTo(new CpuTimes(10, 0, 5, 100, 0, 0, 0, 0));
    }

    @Test
    void meminfoKilobytesConvertedToBytes() {
        List<String> lines = List.of(
            "MemTotal:       16318480 kB",
            "MemAvailable:    2048 kB",
            "HugePages_Total:       4");

        assertThat(ProcfsFiles.parseMeminfoBytes(lines, "MemAvailable")).hasValue(2_097_152L);
        assertThat(ProcfsFiles.parseMeminfoBytes(lines, "HugePages_Total")).hasValue(4L);
        assertThat(ProcfsFiles.parseMeminfoBytes(lines, "Committed_AS")).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({"1, true", "4242, true", "self, false", "12a, false", "'', false"})
    void recognisesPidDirectories(String name, boolean expected) {
        assertThat(ProcfsFiles.isPid(name)).isEqualTo(expected);
    }
}
