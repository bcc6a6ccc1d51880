package com.prudhvi.vlm_relay.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Serializes a canonical event into the broadcast frame exactly once, so the
 * fan-out writes the same string to every subscriber.
 */
@Component
public class EventFrameEncoder {

    private final ObjectMapper objectMapper;

    public EventFrameEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(CanonicalEvent event) {
        try {
            return objectMapper.writeValueAsString(VlmResultFrame.of(event));
        } catch (JsonProcessingException e) {
            throw new EventEncodingException(event.messageId(), e);
        }
    }
}
