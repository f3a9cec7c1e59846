package com.collab.sync.jetstream.bootstrap;

import com.collab.sync.core.event.Topics;
import com.collab.sync.jetstream.config.JetStreamBootstrapProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;

/**
 * =====================================================================
 * JetStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Provisions the streams of the event log topics at startup, then publishes
 * {@link EventLogReadyEvent}.
 *
 * ACTIVATION
 * ----------
 * Registered by {@code NatsJetStreamConfig} when
 * {@code collabsync.bootstrap.enabled=true} and the JetStream back end is active.
 *
 * MISMATCH POLICY
 * ---------------
 * An existing stream whose settings differ is never changed. With
 * {@code fail-on-mismatch=true} startup fails; otherwise a warning is logged.
 */
public class JetStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBootstrapper.class);

    private final StreamProvisioner provisioner;
    private final JetStreamBootstrapProperties bootstrapProps;
    private final ApplicationEventPublisher publisher;

    public JetStreamBootstrapper(
            StreamProvisioner provisioner,
            JetStreamBootstrapProperties bootstrapProps,
            ApplicationEventPublisher publisher
    ) {
        this.provisioner = provisioner;
        this.bootstrapProps = bootstrapProps;
        this.publisher = publisher;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> topics = selectedTopics();
        log.info("JetStream bootstrap: provisioning {} topics {}", topics.size(), topics);

        for (String topic : topics) {
            List<String> diffs = provisioner.ensure(topic);
            if (diffs.isEmpty()) {
                continue;
            }
            String msg = "JetStream stream for topic " + topic + " differs from expected :: " + String.join("; ", diffs);
            if (bootstrapProps.isFailOnMismatch()) {
                throw new IllegalStateException(msg);
            }
            log.warn(msg);
        }

        publisher.publishEvent(new EventLogReadyEvent());
        log.info("JetStream bootstrap complete (published EventLogReadyEvent)");
    }

    List<String> selectedTopics() {
        List<String> configured = bootstrapProps.getTopics();
        if (configured == null || configured.isEmpty()) {
            return Topics.ALL;
        }
        return configured.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .toList();
    }
}
