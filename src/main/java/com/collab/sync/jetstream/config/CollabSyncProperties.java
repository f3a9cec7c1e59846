package com.collab.sync.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * =====================================================================
 * CollabSyncProperties
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Node identity, event log back end selection and NATS connection settings.
 *
 * CONFIGURATION PREFIX
 * --------------------
 * collabsync.*
 *
 * <pre>
 * collabsync:
 *   node-id: collab-01
 *   event-log:
 *     backend: jetstream          # memory | jetstream
 *   nats-url: nats://localhost:4222
 *   nats-user: ...
 *   events:
 *     extra-types:
 *       session_expired: COLLABORATION
 * </pre>
 *
 * SECURITY
 * --------
 * Credentials are never logged in clear; see {@link NatsJetStreamConfig}.
 */
@ConfigurationProperties(prefix = "collabsync")
public class CollabSyncProperties {

    public static final String BACKEND_MEMORY = "memory";
    public static final String BACKEND_JETSTREAM = "jetstream";

    /** Identity of this process. Used as the default consumer name and NATS connection name. */
    private String nodeId = "collab-01";

    private String natsUrl = "nats://localhost:4222";
    private String natsUser;
    private String natsPassword;
    private String natsToken;

    /** Path to a NATS .creds file. */
    private String natsCreds;
    private boolean natsTls = false;

    private EventLogSettings eventLog = new EventLogSettings();
    private Events events = new Events();

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getNatsUrl() { return natsUrl; }
    public void setNatsUrl(String natsUrl) { this.natsUrl = natsUrl; }

    public String getNatsUser() { return natsUser; }
    public void setNatsUser(String natsUser) { this.natsUser = natsUser; }

    public String getNatsPassword() { return natsPassword; }
    public void setNatsPassword(String natsPassword) { this.natsPassword = natsPassword; }

    public String getNatsToken() { return natsToken; }
    public void setNatsToken(String natsToken) { this.natsToken = natsToken; }

    public String getNatsCreds() { return natsCreds; }
    public void setNatsCreds(String natsCreds) { this.natsCreds = natsCreds; }

    public boolean isNatsTls() { return natsTls; }
    public void setNatsTls(boolean natsTls) { this.natsTls = natsTls; }

    public EventLogSettings getEventLog() { return eventLog; }
    public void setEventLog(EventLogSettings eventLog) { this.eventLog = eventLog; }

    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }

    public static class EventLogSettings {

        /** {@code memory} (default) or {@code jetstream}. */
        private String backend = BACKEND_MEMORY;

        public String getBackend() { return backend; }
        public void setBackend(String backend) { this.backend = backend; }
    }

    public static class Events {

        /** Additional event types, mapped to a schema family name (USER, DOCUMENT, COLLABORATION). */
        private Map<String, String> extraTypes = new LinkedHashMap<>();

        public Map<String, String> getExtraTypes() { return extraTypes; }
        public void setExtraTypes(Map<String, String> extraTypes) { this.extraTypes = extraTypes; }
    }
}
