package com.example.techsewa.diagnostics;

import com.example.techsewa.health.SystemSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * On-demand system report for the operator.  Every check degrades to a
 * "could not check" line instead of failing the report.
 */
public class DiagnosticsService {
    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);

    private static final double GB = 1024.0 * 1024 * 1024;

    private final SystemSampler sampler;
    private final InetSocketAddress connectivityTarget;
    private final Duration connectivityTimeout;
    private final Clock clock;

    public DiagnosticsService(SystemSampler sampler, InetSocketAddress connectivityTarget, Duration connectivityTimeout, Clock clock) {
        this.sampler = sampler;
        this.connectivityTarget = connectivityTarget;
        this.connectivityTimeout = connectivityTimeout;
        this.clock = clock;
    }

    public List<String> runAll() {
        long start = clock.millis();
        List<String> lines = new ArrayList<>();
        lines.add(checkInternet());
        lines.add(checkCpuMemory());
        lines.add(checkDisk());
        double secs = (clock.millis() - start) / 1000.0;
        lines.add(String.format(Locale.ROOT, "⏱️ Diagnostics completed in %.2f seconds", secs));
        return lines;
    }

    String checkInternet() {
        try (Socket socket = new Socket()) {
            socket.connect(connectivityTarget, (int) connectivityTimeout.toMillis());
            return "✅ Internet connection working";
        } catch (IOException e) {
            log.debug("[DIAG] connectivity check to {} failed: {}", connectivityTarget, e.toString());
            return "❌ No internet connection";
        }
    }

    String checkCpuMemory() {
        OptionalDouble cpu = sampler.cpuPercent();
        OptionalDouble mem = sampler.memoryPercent();
        if (cpu.isEmpty() && mem.isEmpty()) {
            return "⚠️ Could not check CPU/memory";
        }
        return "🧠 CPU: " + fmt(cpu) + " | RAM: " + fmt(mem) + " used";
    }

    String checkDisk() {
        List<SystemSampler.DiskUsage> disks = sampler.disks();
        if (disks.isEmpty()) {
            return "⚠️ Could not check disk usage";
        }
        SystemSampler.DiskUsage root = disks.stream()
                .filter(d -> d.mount().startsWith("/ ") || d.mount().equals("/"))
                .findFirst()
                .orElse(disks.get(0));
        return String.format(Locale.ROOT, "💽 Disk: %.1f%% used of %dGB",
                root.percentUsed(), (long) (root.totalBytes() / GB));
    }

    public SystemInfo systemInfo() {
        List<SystemInfo.Disk> disks = new ArrayList<>();
        for (SystemSampler.DiskUsage d : sampler.disks()) {
            disks.add(new SystemInfo.Disk(d.mount(), round2(d.totalBytes() / GB), round2(d.percentUsed())));
        }
        double ramGb = -1;
        java.lang.management.OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean mx) {
            ramGb = round2(mx.getTotalMemorySize() / GB);
        }
        return new SystemInfo(
                System.getProperty("os.name"),
                System.getProperty("os.arch"),
                Runtime.getRuntime().availableProcessors(),
                ramGb,
                disks);
    }

    private static String fmt(OptionalDouble v) {
        return v.isPresent() ? String.format(Locale.ROOT, "%.1f%%", v.getAsDouble()) : "n/a";
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
