package com.example.techsewa.health;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Source of the readings the monitor checks.  Any reading may be unavailable on a given host.
 */
public interface SystemSampler {

    OptionalDouble cpuPercent();

    OptionalDouble memoryPercent();

    List<DiskUsage> disks();

    /** Throughput since the previous call; empty on the first call. */
    Optional<NetworkThroughput> networkThroughput();

    Optional<BatteryStatus> battery();

    record DiskUsage(String mount, long totalBytes, double percentUsed) {
    }

    record NetworkThroughput(double uploadKbps, double downloadKbps) {
    }

    record BatteryStatus(double percent, boolean pluggedIn) {
    }
}
