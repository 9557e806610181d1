package com.whereq.taskgate.resource;

import com.sun.management.OperatingSystemMXBean;
import com.whereq.taskgate.exception.ResourceSamplingException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Samples the host through the platform OperatingSystemMXBean.
 * On Linux, available memory comes from MemAvailable in /proc/meminfo,
 * which counts reclaimable page cache unlike the bean's free memory.
 * Inside a memory-limited container the bean reports the cgroup limit while
 * /proc/meminfo still describes the host, so meminfo is only used when its
 * MemTotal matches the bean's total.
 */
@Slf4j
public class JmxSystemResourceProbe implements SystemResourceProbe {

    private static final Path PROC_MEMINFO = Path.of("/proc/meminfo");
    private static final String MEM_TOTAL = "MemTotal:";
    private static final String MEM_AVAILABLE = "MemAvailable:";
    private static final long CPU_RETRY_DELAY_MS = 100;

    // Relative difference under which MemTotal and the bean's total count as the same memory
    private static final double TOTAL_MATCH_TOLERANCE = 0.01;

    private final OperatingSystemMXBean osBean;
    private final Path meminfo;

    public JmxSystemResourceProbe() {
        this(PROC_MEMINFO);
    }

    JmxSystemResourceProbe(Path meminfo) {
        this.meminfo = meminfo;
        java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        if (!(bean instanceof OperatingSystemMXBean)) {
            throw new ResourceSamplingException(
                "Platform does not expose CPU load and physical memory: " + bean.getClass().getName());
        }
        this.osBean = (OperatingSystemMXBean) bean;
    }

    @Override
    public int getLogicalProcessorCount() {
        return Runtime.getRuntime().availableProcessors();
    }

    @Override
    public long getTotalMemoryBytes() {
        return osBean.getTotalMemorySize();
    }

    @Override
    public double getCpuLoad() {
        double load = osBean.getCpuLoad();
        if (load < 0) {
            // The first reading after startup is often unavailable
            try {
                Thread.sleep(CPU_RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ResourceSamplingException("Interrupted while sampling CPU load", e);
            }
            load = osBean.getCpuLoad();
        }
        if (load < 0) {
            throw new ResourceSamplingException("CPU load is not available on this platform");
        }
        return load;
    }

    @Override
    public long getAvailableMemoryBytes() {
        long total = getTotalMemoryBytes();
        Map<String, Long> fields = readMeminfo();
        Long memTotal = fields.get(MEM_TOTAL);
        Long memAvailable = fields.get(MEM_AVAILABLE);

        if (memTotal != null && memAvailable != null && sameMemory(memTotal, total)) {
            return Math.min(memAvailable, total);
        }
        if (memTotal != null) {
            log.debug("{} reports {} bytes but the JVM sees {}, using the JVM's free memory",
                meminfo, memTotal, total);
        }
        // Container-aware on JDK 17: limit minus usage of the cgroup
        return Math.min(osBean.getFreeMemorySize(), total);
    }

    private static boolean sameMemory(long memTotal, long total) {
        return total > 0 && Math.abs(memTotal - total) <= total * TOTAL_MATCH_TOLERANCE;
    }

    /**
     * MemTotal and MemAvailable in bytes, whichever are present
     */
    private Map<String, Long> readMeminfo() {
        Map<String, Long> fields = new HashMap<>();
        if (!Files.isReadable(meminfo)) {
            return fields;
        }
        try {
            for (String line : Files.readAllLines(meminfo)) {
                for (String key : List.of(MEM_TOTAL, MEM_AVAILABLE)) {
                    if (line.startsWith(key)) {
                        String[] parts = line.substring(key.length()).trim().split("\\s+");
                        fields.put(key, Long.parseLong(parts[0]) * 1024L);
                    }
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Could not read memory figures from {}: {}", meminfo, e.getMessage());
            fields.clear();
        }
        return fields;
    }
}
