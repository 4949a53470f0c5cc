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

import com.axonops.perfcounter.api.CounterConfigurationException;
import com.axonops.perfcounter.api.CounterHandle;
import com.axonops.perfcounter.api.CounterPath;
import com.axonops.perfcounter.api.CounterProvider;
import com.axonops.perfcounter.api.CounterReadException;
import com.axonops.perfcounter.api.RawSample;
import com.axonops.perfcounter.jni.Sysconf;
import com.axonops.perfcounter.provider.procfs.ProcfsCounter.Category;
import com.axonops.perfcounter.provider.procfs.ProcfsFiles.CpuTimes;
import com.axonops.perfcounter.provider.procfs.ProcfsFiles.ProcessStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.LongSupplier;

/**
 * Counter provider backed by the Linux {@code /proc} filesystem.
 *
 * <h2>Categories</h2>
 *
 * <ul>
 *   <li><b>Process</b> - one instance per running process, named after the command. Processes
 *       sharing a name are numbered in ascending pid order: {@code java}, {@code java#1},
 *       {@code java#2}. The empty instance reads the calling process.
 *   <li><b>Processor</b> - {@code _Total} plus one instance per cpu. The empty instance reads
 *       {@code _Total}.
 *   <li><b>Memory</b> - no instances.
 * </ul>
 *
 * <p>Frequency-based counters carry nanosecond timestamps with a system frequency of
 * {@value #NANOS_PER_SECOND}. Instantaneous counters report a system frequency of 0.
 *
 * <p>Process names are decoded as UTF-8 with malformed bytes replaced, so a process whose
 * command is not valid UTF-8 still shows up as an instance. The name-to-pid map built by the
 * last enumeration is reused when opening named process instances; a cached pid whose command
 * no longer matches the instance name triggers a fresh enumeration.
 *
 * <p>Only the local machine is served: a machine name other than {@code "."} or
 * {@code "localhost"} is rejected.
 *
 * <p>Thread-safe. Handles are not.
 *
 * @since 1.0.0
 * @see ProcfsCounter
 */
public final class ProcfsCounterProvider implements CounterProvider {
    private static final Logger logger = LoggerFactory.getLogger(ProcfsCounterProvider.class);

    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private static final String SELF = "self";

    /** Reads the raw bytes of a process {@code stat} file. */
    @FunctionalInterface
    interface StatReader {
        byte[] read(Path statFile) throws IOException;
    }

    private final Path procRoot;
    private final StatReader statReader;
    private final LongSupplier nanoClock;
    private final long clockTicksPerSecond;
    private final long pageSize;

    // Instance name to pid, from the most recent enumeration
    private volatile Map<String, Long> knownInstances = Map.of();

    /**
     * Creates a provider reading {@code /proc} with system clock tick and page size values.
     */
    public ProcfsCounterProvider() {
        this(Paths.get("/proc"), System::nanoTime, Sysconf.clockTicksPerSecond(), Sysconf.pageSize());
    }

    /**
     * @param procRoot mount point of procfs
     * @param nanoClock monotonic nanosecond clock used for sample timestamps
     * @param clockTicksPerSecond unit of CPU times in {@code stat} files
     * @param pageSize bytes per page, unit of resident set size
     */
    public ProcfsCounterProvider(Path procRoot, LongSupplier nanoClock, long clockTicksPerSecond, long pageSize) {
        this(procRoot, nanoClock, clockTicksPerSecond, pageSize, Files::readAllBytes);
    }

    ProcfsCounterProvider(Path procRoot, LongSupplier nanoClock, long clockTicksPerSecond, long pageSize,
                          StatReader statReader) {
        this.statReader = Objects.requireNonNull(statReader, "statReader cannot be null");
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot cannot be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock cannot be null");
        if (clockTicksPerSecond <= 0) {
            throw new IllegalArgumentException("clockTicksPerSecond must be positive");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.clockTicksPerSecond = clockTicksPerSecond;
        this.pageSize = pageSize;
    }

    @Override
    public CounterHandle open(CounterPath path, boolean readOnly) {
        checkLocal(path.machineName());
        if (!readOnly) {
            throw new CounterConfigurationException("procfs counters are read-only: " + path);
        }

        Category category = category(path.category());
        ProcfsCounter counter = ProcfsCounter.find(category, path.counter())
            .orElseThrow(() -> new CounterConfigurationException(
                "Counter '" + path.counter() + "' does not exist in category " + category.displayName()));

        CounterHandle handle;
        switch (category) {
            case PROCESS:
                handle = openProcess(path, counter);
                break;
            case PROCESSOR:
                handle = verified(openProcessor(path, counter));
                break;
            case MEMORY:
                handle = verified(openMemory(path, counter));
                break;
            default:
                throw new IllegalStateException("Unknown category: " + category);
        }
        logger.debug("PerfCounter: procfs counter opened - path: {}", path);
        return handle;
    }

    @Override
    public List<String> instanceNames(String category, String machineName) {
        checkLocal(machineName);
        try {
            switch (category(category)) {
                case PROCESS:
                    return new ArrayList<>(processInstances().keySet());
                case PROCESSOR:
                    return new ArrayList<>(ProcfsFiles.parseCpuTimes(Files.readAllLines(procRoot.resolve("stat"))).keySet());
                default:
                    return List.of();
            }
        } catch (IOException e) {
            throw new CounterReadException("Cannot enumerate instances of " + category, e);
        }
    }

    /**
     * Performs one read so an unreadable instance fails at open rather than on the first sample.
     */
    private static CounterHandle verified(CounterHandle handle) {
        try {
            handle.nextRawSample();
        } catch (RuntimeException e) {
            throw new CounterConfigurationException("Cannot read " + handle.path(), e);
        }
        return handle;
    }

    private CounterHandle openProcess(CounterPath path, ProcfsCounter counter) {
        String instance = path.instance();
        if (instance.isEmpty()) {
            return verified(processHandle(path, counter, procRoot.resolve(SELF), null));
        }

        Long cachedPid = knownInstances.get(instance);
        if (cachedPid != null) {
            CounterHandle handle = processHandle(path, counter, procRoot.resolve(Long.toString(cachedPid)), instance);
            try {
                handle.nextRawSample();
                return handle;
            } catch (CounterReadException e) {
                logger.trace("PerfCounter: Cached pid stale, re-enumerating - instance: {}, pid: {}, reason: {}",
                    instance, cachedPid, e.getMessage());
            }
        }

        Long pid;
        try {
            pid = processInstances().get(instance);
        } catch (IOException e) {
            throw new CounterConfigurationException("Cannot enumerate process instances", e);
        }
        if (pid == null) {
            throw new CounterConfigurationException("Instance '" + instance + "' does not exist in category Process");
        }
        return verified(processHandle(path, counter, procRoot.resolve(Long.toString(pid)), instance));
    }

    /**
     * @param expectedInstance instance name the process must still answer to, or null for {@code self}
     */
    private CounterHandle processHandle(CounterPath path, ProcfsCounter counter, Path processDir,
                                        String expectedInstance) {
        Path statFile = processDir.resolve("stat");
        return new ProcfsCounterHandle(path, () -> {
            ProcessStat stat = readProcessStat(statFile);
            if (expectedInstance != null && !answersTo(expectedInstance, stat.name())) {
                // pid was reused by another command
                throw new NoSuchFileException(statFile.toString(), null, "now runs " + stat.name());
            }
            long now = nanoClock.getAsLong();
            switch (counter) {
                case PROCESS_ID:
                    return instantaneous(now, stat.pid(), counter);
                case PROCESS_PROCESSOR_TIME:
                    return frequencyBased(now, ticksToNanos(stat.userTicks() + stat.systemTicks()), counter);
                case PROCESS_USER_TIME:
                    return frequencyBased(now, ticksToNanos(stat.userTicks()), counter);
                case PROCESS_PRIVILEGED_TIME:
                    return frequencyBased(now, ticksToNanos(stat.systemTicks()), counter);
                case PROCESS_WORKING_SET:
                    return instantaneous(now, stat.residentPages() * pageSize, counter);
                case PROCESS_VIRTUAL_BYTES:
                    return instantaneous(now, stat.virtualBytes(), counter);
                case PROCESS_THREAD_COUNT:
                    return instantaneous(now, stat.threads(), counter);
                case PROCESS_PAGE_FAULTS:
                    return frequencyBased(now, stat.minorFaults() + stat.majorFaults(), counter);
                default:
                    throw new IllegalStateException("Not a process counter: " + counter);
            }
        });
    }

    private CounterHandle openProcessor(CounterPath path, ProcfsCounter counter) {
        String instance = path.instance().isEmpty() ? ProcfsFiles.TOTAL_INSTANCE : path.instance();
        Path statFile = procRoot.resolve("stat");
        return new ProcfsCounterHandle(path, () -> {
            CpuTimes times = ProcfsFiles.parseCpuTimes(Files.readAllLines(statFile)).get(instance);
            if (times == null) {
                throw new NoSuchFileException(statFile.toString(), null, "no cpu line for instance " + instance);
            }
            long now = nanoClock.getAsLong();
            switch (counter) {
                case PROCESSOR_TIME:
                    return fraction(now, times.busy(), times.total(), counter);
                case PROCESSOR_USER_TIME:
                    return fraction(now, times.userAll(), times.total(), counter);
                case PROCESSOR_PRIVILEGED_TIME:
                    return fraction(now, times.privileged(), times.total(), counter);
                case PROCESSOR_IDLE_TIME:
                    return fraction(now, times.idleAll(), times.total(), counter);
                default:
                    throw new IllegalStateException("Not a processor counter: " + counter);
            }
        });
    }

    private CounterHandle openMemory(CounterPath path, ProcfsCounter counter) {
        if (!path.instance().isEmpty()) {
            throw new CounterConfigurationException("Category Memory has no instances: " + path);
        }
        String key = counter == ProcfsCounter.MEMORY_AVAILABLE_BYTES ? "MemAvailable" : "Committed_AS";
        Path meminfo = procRoot.resolve("meminfo");
        return new ProcfsCounterHandle(path, () -> {
            OptionalLong bytes = ProcfsFiles.parseMeminfoBytes(Files.readAllLines(meminfo), key);
            if (bytes.isEmpty()) {
                throw new IllegalArgumentException(key + " missing from " + meminfo);
            }
            return instantaneous(nanoClock.getAsLong(), bytes.getAsLong(), counter);
        });
    }

    /**
     * Maps process instance names to pids and remembers the result for later opens.
     *
     * <p>Processes that exit during enumeration, or whose {@code stat} cannot be read or parsed,
     * are left out.
     */
    Map<String, Long> processInstances() throws IOException {
        List<ProcessStat> stats = new ArrayList<>();
        try (DirectoryStream<Path> dirs =
                 Files.newDirectoryStream(procRoot, entry -> ProcfsFiles.isPid(entry.getFileName().toString()))) {
            for (Path dir : dirs) {
                try {
                    stats.add(readProcessStat(dir.resolve("stat")));
                } catch (NoSuchFileException e) {
                    logger.trace("PerfCounter: Process exited during enumeration - dir: {}", dir);
                } catch (IOException | IllegalArgumentException e) {
                    logger.trace("PerfCounter: Skipping unreadable process - dir: {}, reason: {}", dir, e.getMessage());
                }
            }
        }
        stats.sort(Comparator.comparingLong(ProcessStat::pid));

        Map<String, Integer> seen = new HashMap<>();
        Map<String, Long> instances = new LinkedHashMap<>();
        for (ProcessStat stat : stats) {
            int ordinal = seen.merge(stat.name(), 1, Integer::sum) - 1;
            String instance = ordinal == 0 ? stat.name() : stat.name() + "#" + ordinal;
            instances.put(instance, stat.pid());
        }
        knownInstances = Map.copyOf(instances);
        return instances;
    }

    private ProcessStat readProcessStat(Path statFile) throws IOException {
        // Malformed UTF-8 in the command name decodes to U+FFFD instead of failing
        return ProcfsFiles.parseProcessStat(new String(statReader.read(statFile), StandardCharsets.UTF_8));
    }

    /**
     * Whether a process named {@code command} can be listed as {@code instance}, i.e. the
     * instance is the command itself or the command followed by {@code #<ordinal>}.
     */
    static boolean answersTo(String instance, String command) {
        if (instance.equals(command)) {
            return true;
        }
        if (!instance.startsWith(command + "#")) {
            return false;
        }
        String ordinal = instance.substring(command.length() + 1);
        return !ordinal.isEmpty() && ordinal.chars().allMatch(Character::isDigit);
    }

    private long ticksToNanos(long ticks) {
        return ticks * (NANOS_PER_SECOND / clockTicksPerSecond);
    }

    private static RawSample instantaneous(long now, long value, ProcfsCounter counter) {
        return RawSample.of(now, value, 0, counter.type());
    }

    private static RawSample frequencyBased(long now, long value, ProcfsCounter counter) {
        return RawSample.of(now, value, NANOS_PER_SECOND, counter.type());
    }

    private static RawSample fraction(long now, long value, long base, ProcfsCounter counter) {
        return new RawSample(now, value, base, NANOS_PER_SECOND, counter.type());
    }

    private static Category category(String name) {
        return Category.find(name)
            .orElseThrow(() -> new CounterConfigurationException("Category '" + name + "' does not exist"));
    }

    private static void checkLocal(String machineName) {
        if (machineName != null && !machineName.equals(".") && !machineName.equalsIgnoreCase("localhost")) {
            throw new CounterConfigurationException(
                "Remote machine '" + machineName + "' is not supported by the procfs provider");
        }
    }
}
