package com.collab.sync.jetstream.bootstrap;

import com.collab.sync.jetstream.config.EventStreamsProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class StreamProvisionerTest {

    private JetStreamManagement jsm;
    private EventStreamsProperties streams;
    private StreamProvisioner provisioner;

    @BeforeEach
    void setUp() {
        jsm = mock(JetStreamManagement.class);
        streams = new EventStreamsProperties();
        provisioner = new StreamProvisioner(jsm, streams);
    }

    private static JetStreamApiException apiError(int code) {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(code);
        return e;
    }

    @Test
    void missingStreamIsCreatedFromDefaults() throws Exception {
        JetStreamApiException notFound = apiError(StreamProvisioner.JS_STREAM_NOT_FOUND_ERR);
        when(jsm.getStreamInfo("DOCUMENT_EVENTS")).thenThrow(notFound);

        assertThat(provisioner.ensure("document_events")).isEmpty();

        ArgumentCaptor<StreamConfiguration> created = ArgumentCaptor.forClass(StreamConfiguration.class);
        verify(jsm).addStream(created.capture());
        assertThat(created.getValue().getName()).isEqualTo("DOCUMENT_EVENTS");
        assertThat(created.getValue().getSubjects()).containsExactly("collab.events.document_events");
        assertThat(created.getValue().getRetentionPolicy()).isEqualTo(RetentionPolicy.Limits);
        assertThat(created.getValue().getStorageType()).isEqualTo(StorageType.File);
        assertThat(created.getValue().getMaxAge()).isEqualTo(Duration.ofDays(30));
    }

    @Test
    void existingStreamIsComparedButNeverModified() throws Exception {
        StreamConfiguration actual = StreamConfiguration.builder()
                .name("USER_EVENTS")
                .subjects("collab.events.user_events")
                .retentionPolicy(RetentionPolicy.Limits)
                .storageType(StorageType.Memory)
                .maxAge(Duration.ofDays(30))
                .replicas(1)
                .build();
        StreamInfo info = mock(StreamInfo.class);
        when(info.getConfiguration()).thenReturn(actual);
        when(jsm.getStreamInfo("USER_EVENTS")).thenReturn(info);

        assertThat(provisioner.ensure("user_events")).singleElement().asString().startsWith("storageType");
        verify(jsm, never()).addStream(any());
    }

    @Test
    void otherApiErrorsPropagate() throws Exception {
        JetStreamApiException denied = apiError(10003);
        when(jsm.getStreamInfo("USER_EVENTS")).thenThrow(denied);

        assertThatThrownBy(() -> provisioner.ensure("user_events")).isSameAs(denied);
        verify(jsm, never()).addStream(any());
    }

    @Test
    void workQueueRetentionIsRejected() {
        EventStreamsProperties.StreamSpec spec = new EventStreamsProperties.StreamSpec();
        spec.setRetentionPolicy("WorkQueue");
        streams.getTopics().put("user_events", spec);

        assertThatThrownBy(() -> provisioner.toStreamConfig("user_events"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
