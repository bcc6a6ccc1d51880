package com.prudhvi.vlm_relay.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized VLM result, the unit every subscriber receives.
 *
 * Every component is always populated. Absent or malformed fields in the
 * upstream record are replaced by the defaults in {@link EventNormalizer},
 * so consumers never have to handle a missing value.
 *
 * The JSON names are the wire contract with browser clients and must not change.
 */
public record CanonicalEvent(
        @JsonProperty("message_id")   String messageId,
        @JsonProperty("frame_number") long   frameNumber,
        @JsonProperty("source_id")    long   sourceId,
        @JsonProperty("vlm_response") String payloadText,
        @JsonProperty("model_name")   String modelName,
        @JsonProperty("timestamp")    long   timestamp,
        @JsonProperty("type")         String kind
) {}
