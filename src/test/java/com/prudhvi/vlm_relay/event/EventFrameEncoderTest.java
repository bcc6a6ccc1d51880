package com.prudhvi.vlm_relay.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventFrameEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final EventFrameEncoder encoder = new EventFrameEncoder(objectMapper);

    @Test
    void encode_ShouldProduceBroadcastFrameWithWireFieldNames() throws Exception {
        CanonicalEvent event = new CanonicalEvent(
                "1700000000000-0", 42, 3, "a cat", "default", 1700000000000L, "vlm_result");

        JsonNode frame = objectMapper.readTree(encoder.encode(event));

        assertThat(frame.get("type").asText()).isEqualTo("vlm_result");
        JsonNode data = frame.get("data");
        assertThat(data.get("message_id").asText()).isEqualTo("1700000000000-0");
        assertThat(data.get("frame_number").asLong()).isEqualTo(42);
        assertThat(data.get("source_id").asLong()).isEqualTo(3);
        assertThat(data.get("vlm_response").asText()).isEqualTo("a cat");
        assertThat(data.get("model_name").asText()).isEqualTo("default");
        assertThat(data.get("timestamp").asLong()).isEqualTo(1700000000000L);
        assertThat(data.get("type").asText()).isEqualTo("vlm_result");
        assertThat(data.size()).isEqualTo(7);
    }
}
