package com.example.techsewa.diagnostics;

import java.util.List;

/**
 * Static description of the host.
 *
 * @param ramGb total physical memory, or -1 when the platform does not expose it
 */
public record SystemInfo(String system, String architecture, int logicalCores, double ramGb, List<Disk> disks) {

    public record Disk(String mount, double totalGb, double percentUsed) {
    }
}
