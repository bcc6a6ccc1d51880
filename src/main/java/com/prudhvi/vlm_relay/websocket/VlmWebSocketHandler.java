package com.prudhvi.vlm_relay.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prudhvi.vlm_relay.config.RelayProperties;
import com.prudhvi.vlm_relay.subscriber.QueuedSubscriberHandle;
import com.prudhvi.vlm_relay.subscriber.Subscriber;
import com.prudhvi.vlm_relay.subscriber.SubscriberRegistry;
import jakarta.websocket.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * WebSocket endpoint that turns each browser connection into a subscriber.
 *
 * On connect the session is registered under a fresh UUID and greeted with
 * {"type":"connection","message":...,"client_id":...}. The only inbound frame
 * understood is {"type":"ping"}, answered with {"type":"pong"}. Anything else,
 * including non-JSON text, is ignored and the connection stays open.
 *
 * This handler never triggers broadcasts; the stream reader does that through
 * the registry.
 */
@Component
public class VlmWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(VlmWebSocketHandler.class);

    static final String CLIENT_ID_ATTR = "vlm.clientId";
    static final String OUTBOUND_ATTR  = "vlm.outbound";

    // Tomcat's per-session limit on a blocking write, in milliseconds (Long).
    static final String TOMCAT_BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final SubscriberRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String greeting;
    private final Duration sendTimeLimit;
    private final int maxPendingFrames;
    private final int bufferSizeLimit;

    public VlmWebSocketHandler(SubscriberRegistry registry, ObjectMapper objectMapper,
                               Clock clock, RelayProperties properties) {
        RelayProperties.WebSocket ws = properties.getWebsocket();
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.greeting = ws.getGreeting();
        this.sendTimeLimit = ws.getSendTimeLimit();
        this.maxPendingFrames = ws.getMaxPendingFrames();
        this.bufferSizeLimit = ws.getBufferSizeLimit();
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String clientId = UUID.randomUUID().toString();
        limitContainerSendTime(session);
        WebSocketSession outbound = new ConcurrentWebSocketSessionDecorator(
                session, (int) sendTimeLimit.toMillis(), bufferSizeLimit);
        session.getAttributes().put(CLIENT_ID_ATTR, clientId);
        session.getAttributes().put(OUTBOUND_ATTR, outbound);

        QueuedSubscriberHandle handle = new QueuedSubscriberHandle(
                clientId, new WebSocketSubscriberHandle(outbound), sendTimeLimit, maxPendingFrames);
        registry.add(new Subscriber(clientId, clock.instant(), handle));

        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("type", "connection");
        welcome.put("message", greeting);
        welcome.put("client_id", clientId);
        try {
            outbound.sendMessage(new TextMessage(objectMapper.writeValueAsString(welcome)));
        } catch (IOException e) {
            log.warn("Greeting to client {} failed: {}", clientId, e.getMessage());
            // Removal closes the handle and with it the session.
            registry.remove(clientId);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed frame from client {}", clientId(session));
            return;
        }

        if (frame != null && frame.isObject() && "ping".equals(frame.path("type").asText())) {
            outbound(session).sendMessage(new TextMessage("{\"type\":\"pong\"}"));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("WebSocket error for client {}: {}", clientId(session), exception.getMessage());
        registry.remove(clientId(session));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        registry.remove(clientId(session));
    }

    private static String clientId(WebSocketSession session) {
        return (String) session.getAttributes().get(CLIENT_ID_ATTR);
    }

    private static WebSocketSession outbound(WebSocketSession session) {
        Object outbound = session.getAttributes().get(OUTBOUND_ATTR);
        return outbound != null ? (WebSocketSession) outbound : session;
    }

    /**
     * The decorator only enforces its send-time limit against a second thread
     * waiting on the flush lock; the thread that is writing is bounded by the
     * container alone. Tomcat's default there is 20s, so align it.
     */
    private void limitContainerSendTime(WebSocketSession session) {
        if (session instanceof NativeWebSocketSession nativeSession
                && nativeSession.getNativeSession() instanceof Session standard) {
            standard.getUserProperties().put(TOMCAT_BLOCKING_SEND_TIMEOUT, sendTimeLimit.toMillis());
        }
    }
}
