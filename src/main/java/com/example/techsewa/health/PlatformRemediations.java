package com.example.techsewa.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Default remediation actions for the host operating system.
 */
public class PlatformRemediations {
    private static final Logger log = LoggerFactory.getLogger(PlatformRemediations.class);

    static final double CRITICAL_BATTERY_PERCENT = 10;
    static final double RUNAWAY_CPU_PERCENT = 50;

    private final OsFamily os;
    private final CommandRunner runner;
    private final SystemSampler sampler;
    private final Duration commandTimeout;
    private final boolean allowProcessTermination;

    public PlatformRemediations(OsFamily os,
                                CommandRunner runner,
                                SystemSampler sampler,
                                Duration commandTimeout,
                                boolean allowProcessTermination) {
        this.os = os;
        this.runner = runner;
        this.sampler = sampler;
        this.commandTimeout = commandTimeout;
        this.allowProcessTermination = allowProcessTermination;
    }

    public Map<SignalKind, RemediationAction> actions() {
        Map<SignalKind, RemediationAction> m = new EnumMap<>(SignalKind.class);
        m.put(SignalKind.NETWORK, this::healNetwork);
        m.put(SignalKind.POWER, this::healPower);
        m.put(SignalKind.CPU, this::healCpu);
        m.put(SignalKind.MEMORY, this::healMemory);
        m.put(SignalKind.STORAGE, this::healStorage);
        return m;
    }

    /** Restart the network stack and flush the DNS cache. */
    boolean healNetwork() throws IOException, InterruptedException {
        switch (os) {
            case WINDOWS:
                return runAll(List.of(
                        List.of("ipconfig", "/release"),
                        List.of("ipconfig", "/renew"),
                        List.of("ipconfig", "/flushdns"),
                        List.of("netsh", "winsock", "reset")));
            case LINUX:
                return runAll(List.of(
                        List.of("systemctl", "restart", "NetworkManager"),
                        List.of("resolvectl", "flush-caches")));
            case MAC:
                return runAll(List.of(
                        List.of("dscacheutil", "-flushcache"),
                        List.of("killall", "-HUP", "mDNSResponder")));
            default:
                return false;
        }
    }

    boolean healPower() {
        Optional<SystemSampler.BatteryStatus> battery = sampler.battery();
        if (battery.isPresent() && battery.get().percent() < CRITICAL_BATTERY_PERCENT) {
            log.warn("[HEAL] battery critical at {}%; nothing software can do", battery.get().percent());
            return false;
        }
        return true;
    }

    /** Terminate the heaviest process when it averages more than half a core. */
    boolean healCpu() {
        if (!allowProcessTermination) {
            log.info("[HEAL] process termination disabled; leaving CPU consumers alone");
            return false;
        }
        Set<Long> protectedPids = protectedPids();
        Optional<ProcessHandle> top = topCpuConsumer(ProcessHandle.allProcesses(), Instant.now(), protectedPids);
        if (top.isEmpty()) {
            return true;
        }
        ProcessHandle p = top.get();
        log.warn("[HEAL] terminating pid {} ({})", p.pid(), p.info().command().orElse("?"));
        return p.destroy();
    }

    boolean healMemory() throws IOException, InterruptedException {
        if (os == OsFamily.LINUX || os == OsFamily.MAC) {
            return runAll(List.of(List.of("sync")));
        }
        return true;
    }

    boolean healStorage() throws IOException, InterruptedException {
        if (os == OsFamily.WINDOWS) {
            return runAll(List.of(List.of("cleanmgr", "/sagerun:1")));
        }
        log.info("[HEAL] storage cleanup requested; no automatic cleaner on {}", os);
        return true;
    }

    /** Stops at the first non-zero exit. */
    private boolean runAll(List<List<String>> commands) throws IOException, InterruptedException {
        for (List<String> cmd : commands) {
            int exit = runner.run(cmd, commandTimeout);
            if (exit != 0) {
                log.warn("[HEAL] {} exited with {}", String.join(" ", cmd), exit);
                return false;
            }
        }
        return true;
    }

    private static Set<Long> protectedPids() {
        ProcessHandle self = ProcessHandle.current();
        Set<Long> pids = Stream.iterate(Optional.of(self), Optional::isPresent, o -> o.get().parent())
                .map(o -> o.get().pid())
                .collect(Collectors.toCollection(HashSet::new));
        pids.add(1L);
        return pids;
    }

    static Optional<ProcessHandle> topCpuConsumer(Stream<ProcessHandle> processes, Instant now, Set<Long> excluded) {
        return processes
                .filter(p -> !excluded.contains(p.pid()))
                .filter(p -> averageCpuPercent(p.info(), now) > RUNAWAY_CPU_PERCENT)
                .max(Comparator.comparingDouble(p -> averageCpuPercent(p.info(), now)));
    }

    /** Lifetime CPU time over wall time, as a percentage of one core; 0 when unknown. */
    static double averageCpuPercent(ProcessHandle.Info info, Instant now) {
        Optional<Duration> cpu = info.totalCpuDuration();
        Optional<Instant> started = info.startInstant();
        if (cpu.isEmpty() || started.isEmpty()) {
            return 0;
        }
        long wallMillis = Duration.between(started.get(), now).toMillis();
        if (wallMillis <= 0) {
            return 0;
        }
        return 100.0 * cpu.get().toMillis() / wallMillis;
    }
}
