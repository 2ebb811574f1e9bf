package com.example.techsewa.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Readings from the JDK management beans and, where present, the Linux
 * {@code /proc} and {@code /sys} pseudo files.
 */
public class OsSystemSampler implements SystemSampler {
    private static final Logger log = LoggerFactory.getLogger(OsSystemSampler.class);

    private static final Set<String> PSEUDO_FS = Set.of(
            "proc", "sysfs", "tmpfs", "devtmpfs", "devpts", "cgroup", "cgroup2", "mqueue",
            "securityfs", "pstore", "debugfs", "tracefs", "configfs", "fusectl", "bpf",
            "hugetlbfs", "autofs", "binfmt_misc", "nsfs", "squashfs", "overlay", "efivarfs");

    private final Path procRoot;
    private final Path sysPowerSupply;

    private long lastSent = -1;
    private long lastRecv = -1;
    private long lastNanos;

    public OsSystemSampler() {
        this(Path.of("/proc"), Path.of("/sys/class/power_supply"));
    }

    OsSystemSampler(Path procRoot, Path sysPowerSupply) {
        this.procRoot = procRoot;
        this.sysPowerSupply = sysPowerSupply;
    }

    @Override
    public OptionalDouble cpuPercent() {
        java.lang.management.OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            double load = mx.getCpuLoad();
            if (load >= 0) {
                return OptionalDouble.of(load * 100.0);
            }
        }
        return OptionalDouble.empty();
    }

    @Override
    public OptionalDouble memoryPercent() {
        OptionalDouble fromProc = memoryFromProc();
        if (fromProc.isPresent()) {
            return fromProc;
        }
        java.lang.management.OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            long total = mx.getTotalMemorySize();
            if (total > 0) {
                return OptionalDouble.of(100.0 * (total - mx.getFreeMemorySize()) / total);
            }
        }
        return OptionalDouble.empty();
    }

    /** MemAvailable accounts for reclaimable cache, unlike the bean's free size. */
    private OptionalDouble memoryFromProc() {
        Path meminfo = procRoot.resolve("meminfo");
        if (!Files.isReadable(meminfo)) {
            return OptionalDouble.empty();
        }
        try {
            long total = -1;
            long available = -1;
            for (String line : Files.readAllLines(meminfo, StandardCharsets.UTF_8)) {
                if (line.startsWith("MemTotal:")) {
                    total = kb(line);
                } else if (line.startsWith("MemAvailable:")) {
                    available = kb(line);
                }
            }
            if (total > 0 && available >= 0) {
                return OptionalDouble.of(100.0 * (total - available) / total);
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("[MONITOR] could not read {}: {}", meminfo, e.toString());
        }
        return OptionalDouble.empty();
    }

    private static long kb(String line) {
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }

    @Override
    public List<DiskUsage> disks() {
        List<DiskUsage> out = new ArrayList<>();
        for (FileStore store : FileSystems.getDefault().getFileStores()) {
            try {
                if (PSEUDO_FS.contains(store.type())) {
                    continue;
                }
                long total = store.getTotalSpace();
                if (total <= 0) {
                    continue;
                }
                long used = total - store.getUnallocatedSpace();
                long denom = used + store.getUsableSpace();
                double pct = denom > 0 ? 100.0 * used / denom : 0;
                out.add(new DiskUsage(store.toString(), total, pct));
            } catch (IOException e) {
                log.debug("[MONITOR] skipping store {}: {}", store, e.toString());
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<NetworkThroughput> networkThroughput() {
        long[] counters = readNetCounters();
        if (counters == null) {
            return Optional.empty();
        }
        long now = System.nanoTime();
        Optional<NetworkThroughput> result = Optional.empty();
        if (lastSent >= 0) {
            double seconds = (now - lastNanos) / 1_000_000_000.0;
            if (seconds > 0) {
                result = Optional.of(new NetworkThroughput(
                        (counters[0] - lastSent) / 1024.0 / seconds,
                        (counters[1] - lastRecv) / 1024.0 / seconds));
            }
        }
        lastSent = counters[0];
        lastRecv = counters[1];
        lastNanos = now;
        return result;
    }

    /** {sent, received} bytes over all non-loopback interfaces, or null. */
    private long[] readNetCounters() {
        Path dev = procRoot.resolve("net").resolve("dev");
        if (!Files.isReadable(dev)) {
            return null;
        }
        try {
            long sent = 0;
            long recv = 0;
            for (String line : Files.readAllLines(dev, StandardCharsets.UTF_8)) {
                int colon = line.indexOf(':');
                if (colon < 0) {
                    continue;
                }
                String iface = line.substring(0, colon).trim();
                if ("lo".equals(iface)) {
                    continue;
                }
                String[] f = line.substring(colon + 1).trim().split("\\s+");
                recv += Long.parseLong(f[0]);
                sent += Long.parseLong(f[8]);
            }
            return new long[]{sent, recv};
        } catch (IOException | RuntimeException e) {
            log.debug("[MONITOR] could not read {}: {}", dev, e.toString());
            return null;
        }
    }

    @Override
    public Optional<BatteryStatus> battery() {
        if (!Files.isDirectory(sysPowerSupply)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(sysPowerSupply, "BAT*")) {
            for (Path bat : dirs) {
                Path capacity = bat.resolve("capacity");
                if (!Files.isReadable(capacity)) {
                    continue;
                }
                double pct = Double.parseDouble(Files.readString(capacity).trim());
                Path statusFile = bat.resolve("status");
                String status = Files.isReadable(statusFile) ? Files.readString(statusFile).trim() : "";
                return Optional.of(new BatteryStatus(pct, !"Discharging".equalsIgnoreCase(status)));
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("[MONITOR] battery unreadable: {}", e.toString());
        }
        return Optional.empty();
    }
}
