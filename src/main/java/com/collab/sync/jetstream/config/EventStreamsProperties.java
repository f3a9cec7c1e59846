package com.collab.sync.jetstream.config;

import com.collab.sync.jetstream.naming.StreamNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * =====================================================================
 * EventStreamsProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Declarative JetStream stream settings for the event log topics.
 *
 * MAPPING
 * -------
 *   topic            → stream  {@code <TOPIC>} (upper case)
 *                    → subject {@code <subject-prefix>.<topic>}
 *
 * Every topic uses {@link #getDefaults()} unless {@link #getTopics()} holds an
 * override keyed by topic name. Retention must stay {@code Limits}: several
 * consumer groups read the same topic independently.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * collabsync.jetstream.*
 */
@ConfigurationProperties(prefix = "collabsync.jetstream")
public class EventStreamsProperties {

    private String subjectPrefix = StreamNames.DEFAULT_SUBJECT_PREFIX;

    /**
     * How long the server waits for an ack before redelivering. Must exceed the worst-case
     * retry cycle of a consumer (5 attempts with backoff capped at 60s).
     */
    private Duration ackWait = Duration.ofMinutes(5);

    private StreamSpec defaults = new StreamSpec();

    private Map<String, StreamSpec> topics = new LinkedHashMap<>();

    public String getSubjectPrefix() { return subjectPrefix; }
    public void setSubjectPrefix(String subjectPrefix) { this.subjectPrefix = subjectPrefix; }

    public Duration getAckWait() { return ackWait; }
    public void setAckWait(Duration ackWait) { this.ackWait = ackWait; }

    public StreamSpec getDefaults() { return defaults; }
    public void setDefaults(StreamSpec defaults) { this.defaults = defaults; }

    public Map<String, StreamSpec> getTopics() { return topics; }
    public void setTopics(Map<String, StreamSpec> topics) { this.topics = topics; }

    public String streamName(String topic) {
        return StreamNames.stream(topic);
    }

    public String subject(String topic) {
        return StreamNames.subject(subjectPrefix, topic);
    }

    /** Effective settings for a topic. */
    public StreamSpec specFor(String topic) {
        StreamSpec override = topics == null ? null : topics.get(topic);
        return override != null ? override : defaults;
    }

    public static class StreamSpec {

        private Duration maxAge = Duration.ofDays(30);
        private String retentionPolicy = "Limits";
        private String storageType = "File";
        private int replicas = 1;
        private List<String> placementTags = new ArrayList<>();

        public Duration getMaxAge() { return maxAge; }
        public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

        public String getRetentionPolicy() { return retentionPolicy; }
        public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

        public String getStorageType() { return storageType; }
        public void setStorageType(String storageType) { this.storageType = storageType; }

        public int getReplicas() { return replicas; }
        public void setReplicas(int replicas) { this.replicas = replicas; }

        public List<String> getPlacementTags() { return placementTags; }
        public void setPlacementTags(List<String> placementTags) { this.placementTags = placementTags; }
    }
}
