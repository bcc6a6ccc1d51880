package com.prudhvi.vlm_relay.websocket;

import com.prudhvi.vlm_relay.subscriber.SubscriberHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * Adapts a WebSocket session to the fan-out's {@link SubscriberHandle}.
 *
 * The session passed in must already be a ConcurrentWebSocketSessionDecorator:
 * broadcast frames come from the stream reader thread while pongs come from
 * the session's own thread, and a raw session does not allow concurrent sends.
 */
class WebSocketSubscriberHandle implements SubscriberHandle {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSubscriberHandle.class);

    private final WebSocketSession session;

    WebSocketSubscriberHandle(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public void send(String text) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(text));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Closing session {} failed: {}", session.getId(), e.getMessage());
        }
    }
}
