package com.collab.sync.jetstream.bootstrap;

import com.collab.sync.jetstream.config.EventStreamsProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Placement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * =====================================================================
 * StreamProvisioner
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Makes sure the JetStream stream behind an event log topic exists.
 *
 * BEHAVIOR
 * --------
 * - stream missing   → created from {@link EventStreamsProperties}
 * - stream present   → compared with the declared settings; differences are
 *                      reported, never applied
 *
 * Only "stream not found" (10059) leads to creation. Permission and
 * infrastructure errors propagate.
 */
public class StreamProvisioner {

    private static final Logger log = LoggerFactory.getLogger(StreamProvisioner.class);

    public static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final JetStreamManagement jsm;
    private final EventStreamsProperties streams;

    public StreamProvisioner(JetStreamManagement jsm, EventStreamsProperties streams) {
        this.jsm = jsm;
        this.streams = streams;
    }

    /**
     * Creates the topic's stream if missing.
     *
     * @return differences between the existing stream and the declared settings; empty when it
     *         matches or was just created
     */
    public List<String> ensure(String topic) throws IOException, JetStreamApiException {
        StreamConfiguration desired = toStreamConfig(topic);
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            List<String> diffs = diff(desired, existing.getConfiguration());
            if (diffs.isEmpty()) {
                log.info("JetStream stream exists and matches config: {} (subjects={})",
                        desired.getName(), desired.getSubjects());
            }
            return diffs;
        } catch (JetStreamApiException e) {
            if (!isStreamNotFound(e)) {
                throw e;
            }
        }

        jsm.addStream(desired);
        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas());
        return List.of();
    }

    StreamConfiguration toStreamConfig(String topic) {
        EventStreamsProperties.StreamSpec spec = streams.specFor(topic);
        Duration maxAge = Objects.requireNonNull(spec.getMaxAge(), "maxAge is required for topic " + topic);

        StreamConfiguration.Builder b = StreamConfiguration.builder()
                .name(streams.streamName(topic))
                .subjects(streams.subject(topic))
                .retentionPolicy(parseRetentionPolicy(spec.getRetentionPolicy()))
                .storageType(parseStorageType(spec.getStorageType()))
                .maxAge(maxAge)
                .replicas(spec.getReplicas());

        List<String> tags = spec.getPlacementTags();
        if (tags != null && !tags.isEmpty()) {
            b.placement(Placement.builder().tags(tags.toArray(String[]::new)).build());
        }
        return b.build();
    }

    private static List<String> diff(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> diffs = new ArrayList<>();
        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy() + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType() + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }
        return diffs;
    }

    public static boolean isStreamNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR;
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    private static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue", "work_queue", "work-queue" -> throw new IllegalArgumentException(
                    "WorkQueue retention cannot serve several consumer groups; use Limits or Interest");
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    private static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
