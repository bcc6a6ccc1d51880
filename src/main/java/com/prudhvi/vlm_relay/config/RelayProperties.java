package com.prudhvi.vlm_relay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed view of the vlm-relay.* block in application.yaml.
 *
 * Bound once at startup. Redis host and port are not here; they come from the
 * standard spring.data.redis.* keys, which application.yaml maps to the
 * REDIS_HOST / REDIS_PORT environment variables.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "vlm-relay")
public class RelayProperties {

    private Stream stream = new Stream();
    private WebSocket websocket = new WebSocket();

    @Getter
    @Setter
    public static class Stream {

        // Redis stream key the DeepStream pipeline appends VLM results to.
        private String name = "vlm:results:stream";

        // Longest a single XREAD may block waiting for new entries.
        private Duration blockTimeout = Duration.ofSeconds(1);

        // Maximum entries returned by one XREAD.
        private int batchSize = 10;

        // Wait between reconnect attempts while Redis is unreachable.
        private Duration reconnectBackoff = Duration.ofSeconds(5);

        // Wait before retrying the same position after a non-connectivity read error.
        private Duration readErrorBackoff = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class WebSocket {

        private String path = "/ws";

        private String greeting = "Connected to VLM stream";

        // A frame write blocked longer than this fails the subscriber. Applied to
        // the subscriber's own sender thread and to the container's blocking send.
        private Duration sendTimeLimit = Duration.ofSeconds(5);

        // Frames a slow subscriber may have waiting for its sender thread before it is failed.
        private int maxPendingFrames = 100;

        // Bytes that may be buffered when a pong and a broadcast frame overlap on one session.
        private int bufferSizeLimit = 512 * 1024;
    }
}
