package com.example.techsewa.health;

/**
 * Static breach levels.  Percent values trip when strictly exceeded; the network check
 * trips when both directions are below their minimum; the battery check trips below
 * {@code lowBatteryPercent} while unplugged.
 */
public record HealthThresholds(double cpuPercent,
                               double memoryPercent,
                               double storagePercent,
                               double minUploadKbps,
                               double minDownloadKbps,
                               double lowBatteryPercent) {

    public static HealthThresholds defaults() {
        return new HealthThresholds(90, 90, 90, 10, 10, 20);
    }
}
