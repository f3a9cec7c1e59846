package com.collab.sync.jetstream.log;

import com.collab.sync.core.log.EventLog;
import com.collab.sync.core.log.GroupInfo;
import com.collab.sync.core.log.PendingEntry;
import com.collab.sync.core.log.TransportException;
import com.collab.sync.core.model.Event;
import com.collab.sync.core.model.StreamEntry;
import com.collab.sync.jetstream.bootstrap.StreamProvisioner;
import com.collab.sync.jetstream.config.EventStreamsProperties;
import com.collab.sync.jetstream.naming.StreamNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.ConsumerInfo;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.MessageInfo;
import io.nats.client.api.PublishAck;
import io.nats.client.api.ReplayPolicy;
import io.nats.client.api.StreamInfo;
import io.nats.client.api.StreamState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * =====================================================================
 * JetStreamEventLog
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Durable {@link EventLog} on NATS JetStream.
 *
 * MAPPING
 * -------
 *   topic     → stream (see {@link StreamNames})
 *   position  → stream sequence
 *   group     → durable pull consumer, explicit ack, replay instant
 *   groupRead → {@code fetch(maxCount, block)} on a bound pull subscription
 *   ack       → {@code Message.ack()} on the delivered message
 *
 * Sequences are strictly increasing per stream, so positions keep the ordering
 * contract of {@link EventLog}.
 *
 * IN-FLIGHT MESSAGES
 * ------------------
 * JetStream acks are sent on the delivered {@link Message}. Messages handed out
 * by {@link #groupRead} are kept until acked; {@link #pending} reports the ones
 * held by this process. Unacked messages are redelivered by the server after
 * {@code ack-wait}.
 *
 * FAILURE SEMANTICS
 * -----------------
 * I/O and server errors surface as {@link TransportException}; a missing durable
 * consumer surfaces as {@link IllegalStateException}.
 */
public class JetStreamEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventLog.class);

    static final int JS_CONSUMER_NOT_FOUND_ERR = 10014;
    static final int JS_NO_MESSAGE_FOUND_ERR = 10037;

    private final JetStream js;
    private final JetStreamManagement jsm;
    private final ObjectMapper mapper;
    private final EventStreamsProperties streams;
    private final StreamProvisioner provisioner;
    private final Clock clock;

    private final Set<String> provisioned = ConcurrentHashMap.newKeySet();
    private final Map<String, JetStreamSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<InFlightKey, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> ackCounts = new ConcurrentHashMap<>();

    public JetStreamEventLog(JetStream js, JetStreamManagement jsm, ObjectMapper mapper,
                             EventStreamsProperties streams, StreamProvisioner provisioner, Clock clock) {
        this.js = js;
        this.jsm = jsm;
        this.mapper = mapper;
        this.streams = streams;
        this.provisioner = provisioner;
        this.clock = clock;
    }

    @Override
    public long append(String topic, Event event) {
        ensureStream(topic);
        byte[] body = encode(event);
        try {
            PublishAck ack = js.publish(streams.subject(topic), body);
            log.debug("Appended topic={} stream={} seq={}", topic, ack.getStream(), ack.getSeqno());
            return ack.getSeqno();
        } catch (IOException | JetStreamApiException e) {
            throw new TransportException("Append to " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StreamEntry> readRange(String topic, long fromPosition, int count) {
        StreamState state = streamState(topic);
        if (state == null || count <= 0) {
            return List.of();
        }
        List<StreamEntry> out = new ArrayList<>();
        long seq = Math.max(Math.max(1, fromPosition), state.getFirstSequence());
        for (; seq <= state.getLastSequence() && out.size() < count; seq++) {
            StreamEntry entry = fetchEntry(topic, seq);
            if (entry != null) {
                out.add(entry);
            }
        }
        return out;
    }

    @Override
    public List<StreamEntry> readReverse(String topic, int count) {
        StreamState state = streamState(topic);
        if (state == null || count <= 0) {
            return List.of();
        }
        List<StreamEntry> out = new ArrayList<>();
        long first = Math.max(1, state.getFirstSequence());
        for (long seq = state.getLastSequence(); seq >= first && out.size() < count; seq--) {
            StreamEntry entry = fetchEntry(topic, seq);
            if (entry != null) {
                out.add(entry);
            }
        }
        return out;
    }

    @Override
    public long length(String topic) {
        StreamState state = streamState(topic);
        return state == null ? 0 : state.getMsgCount();
    }

    @Override
    public void groupCreate(String topic, String group, long startPosition) {
        ensureStream(topic);
        String stream = streams.streamName(topic);
        String durable = StreamNames.durable(group);
        try {
            jsm.getConsumerInfo(stream, durable);
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_CONSUMER_NOT_FOUND_ERR) {
                throw new TransportException("Group lookup " + topic + "/" + group + " failed: " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new TransportException("Group lookup " + topic + "/" + group + " failed: " + e.getMessage(), e);
        }

        ConsumerConfiguration.Builder cc = ConsumerConfiguration.builder()
                .durable(durable)
                .ackPolicy(AckPolicy.Explicit)
                .replayPolicy(ReplayPolicy.Instant)
                .ackWait(streams.getAckWait())
                .filterSubject(streams.subject(topic));
        if (startPosition == LATEST) {
            cc.deliverPolicy(DeliverPolicy.New);
        } else if (startPosition <= FROM_BEGINNING) {
            cc.deliverPolicy(DeliverPolicy.All);
        } else {
            cc.deliverPolicy(DeliverPolicy.ByStartSequence).startSequence(startPosition + 1);
        }

        try {
            jsm.addOrUpdateConsumer(stream, cc.build());
            log.info("Created durable consumer stream={} durable={} startAfter={}", stream, durable, startPosition);
        } catch (IOException | JetStreamApiException e) {
            throw new TransportException("Group create " + topic + "/" + group + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<StreamEntry> groupRead(String topic, String group, String consumer, int maxCount, Duration block) {
        JetStreamSubscription sub = subscription(topic, group);
        List<Message> messages;
        try {
            messages = sub.fetch(Math.max(1, maxCount), block == null ? Duration.ofMillis(1) : block);
        } catch (IllegalStateException e) {
            subscriptions.remove(key(topic, group));
            throw new TransportException("Fetch " + topic + "/" + group + " failed: " + e.getMessage(), e);
        }

        List<StreamEntry> out = new ArrayList<>(messages.size());
        for (Message m : messages) {
            long position = m.metaData().streamSequence();
            Event event;
            try {
                event = mapper.readValue(m.getData(), Event.class);
            } catch (IOException e) {
                log.error("Undecodable entry topic={} position={}; terminating delivery: {}", topic, position, e.toString());
                m.term();
                continue;
            }
            inFlight.put(new InFlightKey(topic, group, position),
                    new InFlight(m, consumer, clock.instant(), (int) m.metaData().deliveredCount()));
            out.add(new StreamEntry(topic, position, event));
        }
        return out;
    }

    @Override
    public boolean ack(String topic, String group, long position) {
        InFlight held = inFlight.remove(new InFlightKey(topic, group, position));
        if (held == null) {
            return false;
        }
        held.message().ack();
        ackCounts.computeIfAbsent(key(topic, group), k -> new AtomicLong()).incrementAndGet();
        return true;
    }

    @Override
    public boolean touch(String topic, String group, long position) {
        InFlight held = inFlight.get(new InFlightKey(topic, group, position));
        if (held == null) {
            return false;
        }
        held.message().inProgress();
        return true;
    }

    @Override
    public List<String> topics() {
        try {
            return jsm.getStreamNames().stream().map(StreamNames::topic).sorted().toList();
        } catch (IOException | JetStreamApiException e) {
            throw new TransportException("Listing streams failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> groups(String topic) {
        try {
            return jsm.getConsumerNames(streams.streamName(topic));
        } catch (JetStreamApiException e) {
            if (StreamProvisioner.isStreamNotFound(e)) {
                return List.of();
            }
            throw new TransportException("Listing groups of " + topic + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TransportException("Listing groups of " + topic + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public GroupInfo groupInfo(String topic, String group) {
        ConsumerInfo ci;
        try {
            ci = jsm.getConsumerInfo(streams.streamName(topic), StreamNames.durable(group));
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == JS_CONSUMER_NOT_FOUND_ERR || StreamProvisioner.isStreamNotFound(e)) {
                throw new IllegalStateException("No consumer group " + group + " on topic " + topic, e);
            }
            throw new TransportException("Group info " + topic + "/" + group + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TransportException("Group info " + topic + "/" + group + " failed: " + e.getMessage(), e);
        }
        AtomicLong acked = ackCounts.get(key(topic, group));
        return new GroupInfo(
                topic,
                group,
                ci.getDelivered().getStreamSequence(),
                ci.getAckFloor().getStreamSequence(),
                ci.getNumAckPending(),
                acked == null ? 0 : acked.get()
        );
    }

    @Override
    public List<PendingEntry> pending(String topic, String group) {
        List<PendingEntry> out = new ArrayList<>();
        inFlight.forEach((k, v) -> {
            if (k.topic().equals(topic) && k.group().equals(group)) {
                out.add(new PendingEntry(k.position(), v.consumer(), v.deliveredAt(), v.deliveryCount()));
            }
        });
        out.sort((a, b) -> Long.compare(a.position(), b.position()));
        return out;
    }

    /**
     * Drops cached subscriptions. Unacked messages are left to server redelivery.
     */
    public void close() {
        subscriptions.values().forEach(sub -> {
            try {
                sub.unsubscribe();
            } catch (RuntimeException e) {
                log.debug("Unsubscribe failed (ignored): {}", e.toString());
            }
        });
        subscriptions.clear();
        inFlight.clear();
    }

    private JetStreamSubscription subscription(String topic, String group) {
        String key = key(topic, group);
        JetStreamSubscription existing = subscriptions.get(key);
        if (existing != null && existing.isActive()) {
            return existing;
        }
        PullSubscribeOptions pso = PullSubscribeOptions.bind(streams.streamName(topic), StreamNames.durable(group));
        try {
            JetStreamSubscription sub = js.subscribe(streams.subject(topic), pso);
            subscriptions.put(key, sub);
            log.info("Bound pull subscription topic={} group={}", topic, group);
            return sub;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == JS_CONSUMER_NOT_FOUND_ERR || StreamProvisioner.isStreamNotFound(e)) {
                throw new IllegalStateException("No consumer group " + group + " on topic " + topic, e);
            }
            throw new TransportException("Subscribe " + topic + "/" + group + " failed: " + e.getMessage(), e);
        } catch (IOException | IllegalStateException e) {
            throw new TransportException("Subscribe " + topic + "/" + group + " failed: " + e.getMessage(), e);
        }
    }

    private void ensureStream(String topic) {
        if (provisioned.contains(topic)) {
            return;
        }
        try {
            List<String> diffs = provisioner.ensure(topic);
            if (!diffs.isEmpty()) {
                log.warn("JetStream stream for topic {} differs from expected :: {}", topic, String.join("; ", diffs));
            }
            provisioned.add(topic);
        } catch (IOException | JetStreamApiException e) {
            throw new TransportException("Provisioning stream for " + topic + " failed: " + e.getMessage(), e);
        }
    }

    private StreamState streamState(String topic) {
        try {
            StreamInfo info = jsm.getStreamInfo(streams.streamName(topic));
            return info.getStreamState();
        } catch (JetStreamApiException e) {
            if (StreamProvisioner.isStreamNotFound(e)) {
                return null;
            }
            throw new TransportException("Stream info for " + topic + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TransportException("Stream info for " + topic + " failed: " + e.getMessage(), e);
        }
    }

    private StreamEntry fetchEntry(String topic, long seq) {
        MessageInfo mi;
        try {
            mi = jsm.getMessage(streams.streamName(topic), seq);
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() == JS_NO_MESSAGE_FOUND_ERR) {
                return null;
            }
            throw new TransportException("Read " + topic + "#" + seq + " failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TransportException("Read " + topic + "#" + seq + " failed: " + e.getMessage(), e);
        }
        try {
            return new StreamEntry(topic, seq, mapper.readValue(mi.getData(), Event.class));
        } catch (IOException e) {
            log.warn("Skipping undecodable entry topic={} position={}: {}", topic, seq, e.toString());
            return null;
        }
    }

    private byte[] encode(Event event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String key(String topic, String group) {
        return topic + "/" + group;
    }

    private record InFlightKey(String topic, String group, long position) {
    }

    private record InFlight(Message message, String consumer, Instant deliveredAt, int deliveryCount) {
    }
}
