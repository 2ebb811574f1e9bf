package com.example.techsewa.config;

import com.example.techsewa.health.HealthAlertListener;
import com.example.techsewa.health.HealthMonitor;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the monitor's background loop to the application context.
 */
public class HealthMonitorLifecycle implements SmartLifecycle {

    private final HealthMonitor monitor;
    private final HealthAlertListener listener;

    public HealthMonitorLifecycle(HealthMonitor monitor, HealthAlertListener listener) {
        this.monitor = monitor;
        this.listener = listener;
    }

    @Override
    public void start() {
        monitor.start(listener);
    }

    @Override
    public void stop() {
        monitor.stop();
    }

    @Override
    public boolean isRunning() {
        return monitor.isRunning();
    }
}
