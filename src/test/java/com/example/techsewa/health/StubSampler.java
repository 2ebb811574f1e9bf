package com.example.techsewa.health;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;

/** Fixed readings; every field may be changed between passes. */
public class StubSampler implements SystemSampler {

    public volatile OptionalDouble cpu = OptionalDouble.of(10);
    public volatile OptionalDouble memory = OptionalDouble.of(10);
    public volatile List<DiskUsage> disks = new ArrayList<>();
    public volatile Optional<NetworkThroughput> network = Optional.empty();
    public volatile Optional<BatteryStatus> battery = Optional.empty();

    public final AtomicInteger cpuReads = new AtomicInteger();

    @Override
    public OptionalDouble cpuPercent() {
        cpuReads.incrementAndGet();
        return cpu;
    }

    @Override
    public OptionalDouble memoryPercent() {
        return memory;
    }

    @Override
    public List<DiskUsage> disks() {
        return disks;
    }

    @Override
    public Optional<NetworkThroughput> networkThroughput() {
        return network;
    }

    @Override
    public Optional<BatteryStatus> battery() {
        return battery;
    }
}
