package com.example.techsewa.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically samples the host and reports every threshold breach to the listener.
 *
 * <p>There is no de-duplication: a condition that persists is reported again on every
 * pass.  After {@link #stop()} returns the listener is never called again, even by a
 * pass that was already running.  {@code stop()} may be called from any thread,
 * including from inside the listener.  Alerts are delivered under a per-session lock,
 * so a slow listener delays {@code stop()} but never {@link #isRunning()} or a
 * no-op {@link #start}.</p>
 */
public class HealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(10);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(30);

    private final SystemSampler sampler;
    private final HealthThresholds thresholds;
    private final Duration interval;

    private final Object lock = new Object();
    private volatile Session session;

    public HealthMonitor(SystemSampler sampler) {
        this(sampler, HealthThresholds.defaults(), DEFAULT_INTERVAL);
    }

    public HealthMonitor(SystemSampler sampler, HealthThresholds thresholds, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.sampler = sampler;
        this.thresholds = thresholds;
        this.interval = interval;
    }

    /**
     * Begin sampling; the first pass runs immediately.  Calling start while running is a no-op.
     */
    public void start(HealthAlertListener listener) {
        if (session != null) {
            log.debug("[MONITOR] already running");
            return;
        }
        synchronized (lock) {
            if (session != null) {
                log.debug("[MONITOR] already running");
                return;
            }
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "health-monitor");
                t.setDaemon(true);
                return t;
            });
            Session s = new Session(listener, executor);
            session = s;
            executor.scheduleWithFixedDelay(() -> runPass(s), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
            log.info("[MONITOR] started (interval={}s)", interval.toSeconds());
        }
    }

    public void stop() {
        Session s;
        synchronized (lock) {
            s = session;
            if (s == null) {
                return;
            }
            session = null;
        }
        // waits for an alert already being delivered; reentrant when called from the listener
        synchronized (s.dispatchLock) {
            s.closed = true;
        }
        s.executor.shutdownNow();
        if (Thread.currentThread() != s.thread) {
            try {
                if (!s.executor.awaitTermination(JOIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("[MONITOR] sampling thread did not finish within {}s", JOIN_TIMEOUT.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[MONITOR] stopped");
    }

    public boolean isRunning() {
        return session != null;
    }

    public Duration getInterval() {
        return interval;
    }

    private void runPass(Session s) {
        s.thread = Thread.currentThread();
        List<HealthSignal> signals;
        try {
            signals = checkOnce();
        } catch (RuntimeException e) {
            log.warn("[MONITOR] sampling pass failed", e);
            return;
        }
        for (HealthSignal signal : signals) {
            dispatch(s, signal);
        }
    }

    private void dispatch(Session s, HealthSignal signal) {
        synchronized (s.dispatchLock) {
            if (s.closed) {
                return;
            }
            try {
                s.listener.onAlert(signal.message(), signal.severityCode());
            } catch (RuntimeException e) {
                log.warn("[MONITOR] alert listener failed for {}", signal.kind(), e);
            }
        }
    }

    /**
     * One detection pass over every reading.
     */
    public List<HealthSignal> checkOnce() {
        List<HealthSignal> out = new ArrayList<>();

        OptionalDouble cpu = sampler.cpuPercent();
        if (cpu.isPresent() && cpu.getAsDouble() > thresholds.cpuPercent()) {
            out.add(HealthSignal.of(SignalKind.CPU, "High CPU usage: " + pct(cpu.getAsDouble())));
        }

        OptionalDouble mem = sampler.memoryPercent();
        if (mem.isPresent() && mem.getAsDouble() > thresholds.memoryPercent()) {
            out.add(HealthSignal.of(SignalKind.MEMORY, "High memory usage: " + pct(mem.getAsDouble())));
        }

        for (SystemSampler.DiskUsage disk : sampler.disks()) {
            if (disk.percentUsed() > thresholds.storagePercent()) {
                out.add(HealthSignal.of(SignalKind.STORAGE,
                        "Low disk space on " + disk.mount() + ": " + pct(disk.percentUsed())));
            }
        }

        Optional<SystemSampler.NetworkThroughput> net = sampler.networkThroughput();
        if (net.isPresent()
                && net.get().uploadKbps() < thresholds.minUploadKbps()
                && net.get().downloadKbps() < thresholds.minDownloadKbps()) {
            out.add(HealthSignal.of(SignalKind.NETWORK, "Network connection unstable"));
        }

        Optional<SystemSampler.BatteryStatus> battery = sampler.battery();
        if (battery.isPresent()
                && battery.get().percent() < thresholds.lowBatteryPercent()
                && !battery.get().pluggedIn()) {
            out.add(HealthSignal.of(SignalKind.POWER,
                    "Low battery: " + pct(battery.get().percent()) + " remaining"));
        }
        return out;
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.1f%%", v);
    }

    private static final class Session {
        final HealthAlertListener listener;
        final ScheduledExecutorService executor;
        final Object dispatchLock = new Object();
        boolean closed;
        volatile Thread thread;

        Session(HealthAlertListener listener, ScheduledExecutorService executor) {
            this.listener = listener;
            this.executor = executor;
        }
    }
}
