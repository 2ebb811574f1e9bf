package com.example.techsewa.health;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class PlatformRemediationsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final List<List<String>> executed = new ArrayList<>();
    private final StubSampler sampler = new StubSampler();

    private CommandRunner exiting(int code) {
        return (command, timeout) -> {
            executed.add(command);
            return code;
        };
    }

    @Test
    void linuxNetworkRestartsManagerAndFlushesResolver() throws Exception {
        PlatformRemediations r = new PlatformRemediations(OsFamily.LINUX, exiting(0), sampler, TIMEOUT, false);

        assertThat(r.healNetwork()).isTrue();
        assertThat(executed).containsExactly(
                List.of("systemctl", "restart", "NetworkManager"),
                List.of("resolvectl", "flush-caches"));
    }

    @Test
    void windowsNetworkStopsAtFirstFailure() throws Exception {
        PlatformRemediations r = new PlatformRemediations(OsFamily.WINDOWS, exiting(1), sampler, TIMEOUT, false);

        assertThat(r.healNetwork()).isFalse();
        assertThat(executed).containsExactly(List.of("ipconfig", "/release"));
    }

    @Test
    void unknownOsCannotHealNetwork() throws Exception {
        PlatformRemediations r = new PlatformRemediations(OsFamily.OTHER, exiting(0), sampler, TIMEOUT, false);

        assertThat(r.healNetwork()).isFalse();
        assertThat(executed).isEmpty();
    }

    @Test
    void criticalBatteryCannotBeHealed() {
        PlatformRemediations r = new PlatformRemediations(OsFamily.LINUX, exiting(0), sampler, TIMEOUT, false);

        sampler.battery = Optional.of(new SystemSampler.BatteryStatus(5, false));
        assertThat(r.healPower()).isFalse();
        sampler.battery = Optional.of(new SystemSampler.BatteryStatus(15, false));
        assertThat(r.healPower()).isTrue();
    }

    @Test
    void cpuHealingNeedsPermission() {
        PlatformRemediations r = new PlatformRemediations(OsFamily.LINUX, exiting(0), sampler, TIMEOUT, false);

        assertThat(r.healCpu()).isFalse();
    }

    @Test
    void memoryAndStoragePerOs() throws Exception {
        assertThat(new PlatformRemediations(OsFamily.LINUX, exiting(0), sampler, TIMEOUT, false).healMemory()).isTrue();
        assertThat(new PlatformRemediations(OsFamily.WINDOWS, exiting(0), sampler, TIMEOUT, false).healStorage()).isTrue();
        assertThat(new PlatformRemediations(OsFamily.MAC, exiting(0), sampler, TIMEOUT, false).healStorage()).isTrue();

        assertThat(executed).containsExactly(List.of("sync"), List.of("cleanmgr", "/sagerun:1"));
    }

    @Test
    void actionsCoverEveryKind() {
        PlatformRemediations r = new PlatformRemediations(OsFamily.LINUX, exiting(0), sampler, TIMEOUT, false);

        assertThat(r.actions()).containsOnlyKeys(SignalKind.values());
    }

    @Test
    void topConsumerSkipsExcludedAndIdleProcesses() {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        ProcessHandle busy = process(10, now.minusSeconds(100), Duration.ofSeconds(80));
        ProcessHandle busier = process(11, now.minusSeconds(100), Duration.ofSeconds(95));
        ProcessHandle idle = process(12, now.minusSeconds(100), Duration.ofSeconds(10));

        assertThat(PlatformRemediations.topCpuConsumer(Stream.of(busy, busier, idle), now, Set.of()))
                .contains(busier);
        assertThat(PlatformRemediations.topCpuConsumer(Stream.of(busy, busier, idle), now, Set.of(11L)))
                .contains(busy);
        assertThat(PlatformRemediations.topCpuConsumer(Stream.of(idle), now, Set.of())).isEmpty();
    }

    @Test
    void averageCpuIsZeroWhenUnknown() {
        ProcessHandle.Info info = mock(ProcessHandle.Info.class);
        when(info.totalCpuDuration()).thenReturn(Optional.empty());
        when(info.startInstant()).thenReturn(Optional.empty());

        assertThat(PlatformRemediations.averageCpuPercent(info, Instant.now())).isZero();
    }

    private static ProcessHandle process(long pid, Instant started, Duration cpu) {
        ProcessHandle.Info info = mock(ProcessHandle.Info.class);
        when(info.startInstant()).thenReturn(Optional.of(started));
        when(info.totalCpuDuration()).thenReturn(Optional.of(cpu));
        ProcessHandle p = mock(ProcessHandle.class);
        when(p.pid()).thenReturn(pid);
        when(p.info()).thenReturn(info);
        return p;
    }
}
