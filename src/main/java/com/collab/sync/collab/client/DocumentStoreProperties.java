package com.collab.sync.collab.client;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings of the document service client.
 *
 * <p>Prefix: {@code collabsync.document-store.*}</p>
 */
@ConfigurationProperties(prefix = "collabsync.document-store")
public class DocumentStoreProperties {

    private String baseUrl = "http://localhost:8001";

    /** Per-request timeout. */
    private Duration timeout = Duration.ofSeconds(5);

    /** Retries after the first failed attempt. */
    private int maxRetries = 2;
    private Duration retryBackoff = Duration.ofMillis(200);

    /** Consecutive failures before the circuit opens. */
    private int failureThreshold = 5;
    private Duration recoveryTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }

    public int getFailureThreshold() { return failureThreshold; }
    public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

    public Duration getRecoveryTimeout() { return recoveryTimeout; }
    public void setRecoveryTimeout(Duration recoveryTimeout) { this.recoveryTimeout = recoveryTimeout; }
}
