package com.prudhvi.vlm_relay.event;

/**
 * Raised when a canonical event cannot be serialized to its JSON frame.
 */
public class EventEncodingException extends RuntimeException {

    public EventEncodingException(String messageId, Throwable cause) {
        super("Failed to encode event " + messageId, cause);
    }
}
