package com.prudhvi.vlm_relay.event;

/**
 * Outbound broadcast frame: {"type": "vlm_result", "data": {...}}.
 */
public record VlmResultFrame(String type, CanonicalEvent data) {

    public static final String TYPE = "vlm_result";

    public static VlmResultFrame of(CanonicalEvent event) {
        return new VlmResultFrame(TYPE, event);
    }
}
