package com.collab.sync.collab.websocket;

import com.collab.sync.collab.service.CollaborationService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CollaborationWebSocketHandlerTest {

    @Test
    void documentIdIsTheLastPathSegment() {
        assertThat(CollaborationWebSocketHandler.documentId("/ws/collaborate/doc-42")).isEqualTo("doc-42");
        assertThat(CollaborationWebSocketHandler.documentId("/ws/collaborate/doc-42/")).isEqualTo("doc-42");
        assertThat(CollaborationWebSocketHandler.documentId(null)).isEmpty();
    }

    @Test
    void handshakeWithoutIdentityIsClosedWithPolicyViolation() {
        CollaborationService service = mock(CollaborationService.class);
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("s1");
        when(session.getHandshakeInfo()).thenReturn(
                new HandshakeInfo(URI.create("ws://h/ws/collaborate/doc-1"), new HttpHeaders(), Mono.empty(), null));
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        CollaborationWebSocketHandler handler = new CollaborationWebSocketHandler(service, new HeaderIdentityResolver());

        StepVerifier.create(handler.handle(session)).verifyComplete();
        verify(session).close(CloseStatus.POLICY_VIOLATION);
        verifyNoInteractions(service);
    }
}
