package com.example.techsewa.config;

import com.example.techsewa.diagnostics.DiagnosticsService;
import com.example.techsewa.health.AutoHealer;
import com.example.techsewa.health.HealthAlertHandler;
import com.example.techsewa.health.HealthMonitor;
import com.example.techsewa.health.HealthThresholds;
import com.example.techsewa.health.OsFamily;
import com.example.techsewa.health.OsSystemSampler;
import com.example.techsewa.health.PlatformRemediations;
import com.example.techsewa.health.ProcessCommandRunner;
import com.example.techsewa.health.SystemSampler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.time.Clock;

@Configuration
public class HealthConfig {

    @Bean
    public SystemSampler systemSampler() {
        return new OsSystemSampler();
    }

    @Bean
    public AutoHealer autoHealer(SystemSampler sampler, TechsewaProperties props) {
        TechsewaProperties.Healer h = props.getHealer();
        PlatformRemediations remediations = new PlatformRemediations(
                OsFamily.current(),
                new ProcessCommandRunner(),
                sampler,
                h.getCommandTimeout(),
                h.isAllowProcessTermination());
        return new AutoHealer(remediations.actions());
    }

    @Bean
    public HealthMonitor healthMonitor(SystemSampler sampler, TechsewaProperties props) {
        TechsewaProperties.Monitor m = props.getMonitor();
        HealthThresholds thresholds = new HealthThresholds(
                m.getCpuPercent(),
                m.getMemoryPercent(),
                m.getStoragePercent(),
                m.getMinUploadKbps(),
                m.getMinDownloadKbps(),
                m.getLowBatteryPercent());
        return new HealthMonitor(sampler, thresholds, m.getInterval());
    }

    @Bean
    public HealthAlertHandler healthAlertHandler(AutoHealer autoHealer, TechsewaProperties props) {
        return new HealthAlertHandler(autoHealer, props.getMonitor().isAutoHeal());
    }

    @Bean
    @ConditionalOnProperty(prefix = "techsewa.monitor", name = "enabled", havingValue = "true")
    public HealthMonitorLifecycle healthMonitorLifecycle(HealthMonitor monitor, HealthAlertHandler handler) {
        return new HealthMonitorLifecycle(monitor, handler);
    }

    @Bean
    public DiagnosticsService diagnosticsService(SystemSampler sampler, TechsewaProperties props, Clock clock) {
        TechsewaProperties.Diagnostics d = props.getDiagnostics();
        return new DiagnosticsService(
                sampler,
                new InetSocketAddress(d.getConnectivityHost(), d.getConnectivityPort()),
                d.getConnectivityTimeout(),
                clock);
    }
}
