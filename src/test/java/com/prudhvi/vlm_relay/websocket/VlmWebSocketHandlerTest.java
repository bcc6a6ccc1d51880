package com.prudhvi.vlm_relay.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prudhvi.vlm_relay.config.RelayProperties;
import com.prudhvi.vlm_relay.subscriber.Subscriber;
import com.prudhvi.vlm_relay.subscriber.SubscriberRegistry;
import jakarta.websocket.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

@ExtendWith(MockitoExtension.class)
class VlmWebSocketHandlerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private WebSocketSession session;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, Object> attributes = new HashMap<>();
    private SubscriberRegistry registry;
    private VlmWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(session.getAttributes()).thenReturn(attributes);
        lenient().when(session.isOpen()).thenReturn(true);
        lenient().when(session.getId()).thenReturn("session-1");

        registry = new SubscriberRegistry();
        handler = new VlmWebSocketHandler(registry, objectMapper,
                Clock.fixed(NOW, ZoneOffset.UTC), new RelayProperties());
    }

    @Test
    void connect_ShouldRegisterSubscriberAndSendGreeting() throws Exception {
        handler.afterConnectionEstablished(session);

        assertThat(registry.count()).isEqualTo(1);
        Subscriber subscriber = registry.snapshot().get(0);
        assertThat(subscriber.getConnectedAt()).isEqualTo(NOW);

        JsonNode greeting = objectMapper.readTree(sentFrames().get(0));
        assertThat(greeting.get("type").asText()).isEqualTo("connection");
        assertThat(greeting.get("message").asText()).isEqualTo("Connected to VLM stream");
        assertThat(greeting.get("client_id").asText()).isEqualTo(subscriber.getId());
    }

    @Test
    void ping_ShouldBeAnsweredWithPongWithoutTouchingRegistry() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("{\"type\":\"ping\"}"));

        List<String> frames = sentFrames();
        assertThat(frames).hasSize(2);
        assertThat(objectMapper.readTree(frames.get(1)).get("type").asText()).isEqualTo("pong");
        assertThat(registry.count()).isEqualTo(1);
        assertThat(registry.snapshot().get(0).getMessagesSent()).isZero();
    }

    @Test
    void malformedOrUnknownFrames_ShouldBeIgnoredAndKeepConnectionOpen() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleMessage(session, new TextMessage("not json at all"));
        handler.handleMessage(session, new TextMessage("{\"type\":\"subscribe\"}"));
        handler.handleMessage(session, new TextMessage("[\"ping\"]"));

        assertThat(sentFrames()).hasSize(1);
        assertThat(registry.count()).isEqualTo(1);
        verify(session, times(0)).close(any(CloseStatus.class));
    }

    @Test
    void broadcastThroughRegisteredHandle_ShouldReachSession() throws Exception {
        handler.afterConnectionEstablished(session);

        registry.snapshot().get(0).getHandle().send("{\"type\":\"vlm_result\"}");

        verify(session, timeout(1000).times(2)).sendMessage(any());
        assertThat(sentFrames()).last().isEqualTo("{\"type\":\"vlm_result\"}");
    }

    @Test
    void close_ShouldRemoveSubscriberAndReleaseSessionOnce() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);
        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(registry.count()).isZero();
        verify(session, times(1)).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void transportError_ShouldRemoveSubscriber() throws Exception {
        handler.afterConnectionEstablished(session);

        handler.handleTransportError(session, new IOException("connection reset"));

        assertThat(registry.count()).isZero();
    }

    @Test
    void greetingFailure_ShouldUnregisterAndClose() throws Exception {
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        handler.afterConnectionEstablished(session);

        assertThat(registry.count()).isZero();
        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    @Test
    void connect_OnStandardSession_ShouldCapContainerBlockingSendAtSendTimeLimit() throws Exception {
        WebSocketSession standardSession = mock(WebSocketSession.class,
                withSettings().extraInterfaces(NativeWebSocketSession.class));
        Session nativeSession = mock(Session.class);
        Map<String, Object> userProperties = new HashMap<>();
        when(standardSession.getAttributes()).thenReturn(new HashMap<>());
        when(((NativeWebSocketSession) standardSession).getNativeSession()).thenReturn(nativeSession);
        when(nativeSession.getUserProperties()).thenReturn(userProperties);

        handler.afterConnectionEstablished(standardSession);

        assertThat(userProperties).containsEntry(VlmWebSocketHandler.TOMCAT_BLOCKING_SEND_TIMEOUT, 5000L);
        assertThat(registry.count()).isEqualTo(1);
    }

    private List<String> sentFrames() throws IOException {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, atLeastOnce()).sendMessage(captor.capture());
        return captor.getAllValues().stream()
                .map(TextMessage::getPayload)
                .toList();
    }
}
