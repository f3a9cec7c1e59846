package com.collab.sync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Controls stream provisioning at startup.
 *
 * <p>Prefix: {@code collabsync.bootstrap.*}</p>
 */
@ConfigurationProperties(prefix = "collabsync.bootstrap")
public class JetStreamBootstrapProperties {

    private boolean enabled = false;

    /**
     * When an existing stream differs from the declared settings: {@code true} fails startup,
     * {@code false} logs a warning and continues. Existing streams are never modified.
     */
    private boolean failOnMismatch = false;

    /** Topics to provision. Empty means every known topic. */
    private List<String> topics = new ArrayList<>();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isFailOnMismatch() { return failOnMismatch; }
    public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }

    public List<String> getTopics() { return topics; }
    public void setTopics(List<String> topics) { this.topics = topics; }
}
