package com.collab.sync.jetstream.config;

import com.collab.sync.jetstream.bootstrap.JetStreamBootstrapper;
import com.collab.sync.jetstream.bootstrap.StreamProvisioner;
import com.collab.sync.jetstream.log.JetStreamEventLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * =====================================================================
 * NatsJetStreamConfig
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Wires the JetStream back end of the event log:
 *
 *   Connection → JetStream / JetStreamManagement → StreamProvisioner
 *                                                → JetStreamEventLog (EventLog)
 *                                                → JetStreamBootstrapper (optional)
 *
 * ACTIVATION
 * ----------
 * Only when {@code collabsync.event-log.backend=jetstream}. Otherwise the
 * in-memory log from {@code CoreBeansConfig} is used and no NATS connection is
 * opened.
 *
 * AUTHENTICATION
 * --------------
 * user/password, token, or a .creds file, plus optional TLS. Secrets are masked
 * in logs.
 */
@Configuration
@ConditionalOnProperty(prefix = "collabsync.event-log", name = "backend", havingValue = "jetstream")
@EnableConfigurationProperties({
        EventStreamsProperties.class,
        JetStreamBootstrapProperties.class
})
public class NatsJetStreamConfig {

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamConfig.class);

    @Bean(destroyMethod = "close")
    public Connection natsConnection(CollabSyncProperties props) throws Exception {
        Options options = buildOptions(props);
        Connection c = Nats.connect(options);
        log.info("Connected to NATS (url={}, tls={}, user={}, creds={})",
                props.getNatsUrl(),
                props.isNatsTls(),
                mask(props.getNatsUser()),
                props.getNatsCreds() == null ? "" : props.getNatsCreds());
        return c;
    }

    static Options buildOptions(CollabSyncProperties props) throws Exception {
        Options.Builder builder = new Options.Builder()
                .server(props.getNatsUrl())
                .connectionName(props.getNodeId())
                .maxReconnects(-1);

        if (props.isNatsTls()) {
            builder.secure();
        }
        if (notBlank(props.getNatsToken())) {
            builder.token(props.getNatsToken().toCharArray());
        }
        if (notBlank(props.getNatsUser())) {
            String pass = props.getNatsPassword() == null ? "" : props.getNatsPassword();
            builder.userInfo(props.getNatsUser().toCharArray(), pass.toCharArray());
        }
        if (notBlank(props.getNatsCreds())) {
            builder.authHandler(Nats.credentials(props.getNatsCreds()));
        }
        return builder.build();
    }

    @Bean
    public JetStream jetStream(Connection connection) throws Exception {
        return connection.jetStream();
    }

    @Bean
    public JetStreamManagement jetStreamManagement(Connection connection) throws Exception {
        return connection.jetStreamManagement();
    }

    @Bean
    public StreamProvisioner streamProvisioner(JetStreamManagement jsm, EventStreamsProperties streams) {
        return new StreamProvisioner(jsm, streams);
    }

    @Bean(destroyMethod = "close")
    public JetStreamEventLog eventLog(JetStream js, JetStreamManagement jsm, ObjectMapper mapper,
                                      EventStreamsProperties streams, StreamProvisioner provisioner, Clock clock) {
        log.info("Event log back end: JetStream (subjects {}.*)", streams.getSubjectPrefix());
        return new JetStreamEventLog(js, jsm, mapper, streams, provisioner, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "collabsync.bootstrap", name = "enabled", havingValue = "true")
    public JetStreamBootstrapper jetStreamBootstrapper(StreamProvisioner provisioner,
                                                       JetStreamBootstrapProperties bootstrapProps,
                                                       ApplicationEventPublisher publisher) {
        return new JetStreamBootstrapper(provisioner, bootstrapProps, publisher);
    }

    private static boolean notBlank(String v) {
        return v != null && !v.isBlank();
    }

    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
