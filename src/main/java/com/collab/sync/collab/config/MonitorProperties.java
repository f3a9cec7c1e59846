package com.collab.sync.collab.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Event log monitoring ({@code collabsync.monitor.*}).
 */
@ConfigurationProperties(prefix = "collabsync.monitor")
public class MonitorProperties {

    /** Periodic dead-letter check. */
    private boolean enabled = true;

    /** Dead-letter depth at or above which an alert is logged. */
    private long deadLetterThreshold = 1;

    private Duration checkInterval = Duration.ofMinutes(1);

    /** How often per-group gauges are recomputed. */
    private Duration metricsRefresh = Duration.ofSeconds(30);

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public long getDeadLetterThreshold() { return deadLetterThreshold; }
    public void setDeadLetterThreshold(long deadLetterThreshold) { this.deadLetterThreshold = deadLetterThreshold; }

    public Duration getCheckInterval() { return checkInterval; }
    public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }

    public Duration getMetricsRefresh() { return metricsRefresh; }
    public void setMetricsRefresh(Duration metricsRefresh) { this.metricsRefresh = metricsRefresh; }
}
