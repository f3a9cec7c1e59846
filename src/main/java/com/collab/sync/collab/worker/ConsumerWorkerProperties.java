package com.collab.sync.collab.worker;

import com.collab.sync.core.consumer.ConsumerSettings;
import com.collab.sync.core.event.Topics;
import com.collab.sync.core.log.EventLog;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Background consumer workers ({@code collabsync.consumer.*}).
 *
 * <p>One {@code EventConsumer} is started per entry of {@link #topics}, all in the same
 * consumer group. The consumer name defaults to the node id.</p>
 */
@ConfigurationProperties(prefix = "collabsync.consumer")
public class ConsumerWorkerProperties {

    private boolean enabled = false;
    private String group = "document-persistence";
    private String consumerName;
    private List<String> topics = new ArrayList<>(List.of(Topics.DOCUMENT));
    private int batchSize = 10;
    private Duration block = Duration.ofSeconds(5);
    private int maxAttempts = ConsumerSettings.DEFAULT_MAX_ATTEMPTS;
    private Duration baseDelay = Duration.ofSeconds(2);
    private Duration maxDelay = Duration.ofSeconds(60);
    private Duration reconnectDelay = Duration.ofSeconds(2);
    private Duration stopTimeout = Duration.ofSeconds(10);
    /** {@code beginning} or {@code latest}. */
    private String start = "beginning";

    public ConsumerSettings toSettings() {
        return new ConsumerSettings(batchSize, block, maxAttempts, baseDelay, maxDelay, reconnectDelay, startPosition());
    }

    long startPosition() {
        String s = start == null ? "" : start.trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "", "beginning", "all" -> EventLog.FROM_BEGINNING;
            case "latest", "new", "$" -> EventLog.LATEST;
            default -> throw new IllegalArgumentException(
                    "collabsync.consumer.start must be 'beginning' or 'latest', got: " + start);
        };
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getGroup() { return group; }
    public void setGroup(String group) { this.group = group; }

    public String getConsumerName() { return consumerName; }
    public void setConsumerName(String consumerName) { this.consumerName = consumerName; }

    public List<String> getTopics() { return topics; }
    public void setTopics(List<String> topics) { this.topics = topics; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public Duration getBlock() { return block; }
    public void setBlock(Duration block) { this.block = block; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Duration getBaseDelay() { return baseDelay; }
    public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

    public Duration getMaxDelay() { return maxDelay; }
    public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }

    public Duration getReconnectDelay() { return reconnectDelay; }
    public void setReconnectDelay(Duration reconnectDelay) { this.reconnectDelay = reconnectDelay; }

    public Duration getStopTimeout() { return stopTimeout; }
    public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }

    public String getStart() { return start; }
    public void setStart(String start) { this.start = start; }
}
